package io.github.goodees.seedlog;

/*-
 * #%L
 * seedlog
 * %%
 * Copyright (C) 2017 Patrik Duditš
 * %%
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 * 
 *      http://www.apache.org/licenses/LICENSE-2.0
 * 
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 * #L%
 */

import com.fasterxml.jackson.databind.JsonNode;

import java.util.Optional;

import static io.github.goodees.seedlog.PayloadRule.allOf;
import static io.github.goodees.seedlog.PayloadRule.atLeastOne;
import static io.github.goodees.seedlog.PayloadRule.instant;
import static io.github.goodees.seedlog.PayloadRule.nonBlankText;
import static io.github.goodees.seedlog.PayloadRule.nonNegativeInt;
import static io.github.goodees.seedlog.PayloadRule.oneOf;
import static io.github.goodees.seedlog.PayloadRule.optionalInstant;
import static io.github.goodees.seedlog.PayloadRule.optionalText;
import static io.github.goodees.seedlog.PayloadRule.text;

/**
 * Closed set of transaction types per {@link EntityKind}. The wire name is what gets persisted; it is unique only
 * within a kind (tags and followups both have a {@code creation} type).
 */
public enum TransactionType {
    CREATE_SEED(EntityKind.SEED, "create_seed", true, nonBlankText("content")),
    EDIT_CONTENT(EntityKind.SEED, "edit_content", false, text("content")),
    ADD_TAG(EntityKind.SEED, "add_tag", false, allOf(text("tag_id"), text("tag_name"))),
    REMOVE_TAG(EntityKind.SEED, "remove_tag", false, text("tag_id")),
    ADD_CATEGORY(EntityKind.SEED, "add_category", false,
            allOf(text("category_id"), text("category_name"), text("category_path"))),
    SET_CATEGORY(EntityKind.SEED, "set_category", false,
            allOf(text("category_id"), text("category_name"), text("category_path"))),
    REMOVE_CATEGORY(EntityKind.SEED, "remove_category", false, text("category_id")),
    ADD_FOLLOWUP(EntityKind.SEED, "add_followup", false, text("followup_id")),
    ADD_SPROUT(EntityKind.SEED, "add_sprout", false, text("sprout_id")),

    TAG_CREATION(EntityKind.TAG, "creation", true, allOf(nonBlankText("name"), optionalText("color"))),
    TAG_EDIT(EntityKind.TAG, "edit", false, nonBlankText("name")),
    SET_COLOR(EntityKind.TAG, "set_color", false, optionalText("color")),

    FOLLOWUP_CREATION(EntityKind.SPROUT_FOLLOWUP, "creation", true,
            allOf(oneOf("trigger", "manual", "automatic"), instant("initial_time"), text("initial_message"))),
    FOLLOWUP_EDIT(EntityKind.SPROUT_FOLLOWUP, "edit", false,
            allOf(atLeastOne("new_time", "new_message"), optionalInstant("new_time"), optionalText("new_message"))),
    DISMISSAL(EntityKind.SPROUT_FOLLOWUP, "dismissal", false,
            allOf(instant("dismissed_at"), oneOf("type", "followup", "snooze"))),
    SNOOZE(EntityKind.SPROUT_FOLLOWUP, "snooze", false,
            allOf(instant("snoozed_at"), nonNegativeInt("duration_minutes"), oneOf("method", "manual", "automatic")));

    private final EntityKind kind;
    private final String wireName;
    private final boolean creation;
    private final PayloadRule rule;

    TransactionType(EntityKind kind, String wireName, boolean creation, PayloadRule rule) {
        this.kind = kind;
        this.wireName = wireName;
        this.creation = creation;
        this.rule = rule;
    }

    public EntityKind kind() {
        return kind;
    }

    public String wireName() {
        return wireName;
    }

    public boolean isCreation() {
        return creation;
    }

    /**
     * Check the payload against the structural rule of this type.
     * @param payload the payload
     * @return description of the first violation, or empty if the payload is acceptable
     */
    public Optional<String> violation(JsonNode payload) {
        if (payload == null || !payload.isObject()) {
            return Optional.of("payload must be an object");
        }
        return rule.check(payload);
    }

    public void validate(JsonNode payload) throws ValidationException {
        Optional<String> violation = violation(payload);
        if (violation.isPresent()) {
            throw ValidationException.invalidPayload(this, violation.get());
        }
    }

    public static Optional<TransactionType> of(EntityKind kind, String wireName) {
        for (TransactionType type : values()) {
            if (type.kind == kind && type.wireName.equals(wireName)) {
                return Optional.of(type);
            }
        }
        return Optional.empty();
    }

    public static TransactionType resolve(EntityKind kind, String wireName) throws ValidationException {
        Optional<TransactionType> type = of(kind, wireName);
        if (!type.isPresent()) {
            throw ValidationException.unknownType(kind, wireName);
        }
        return type.get();
    }

    public static TransactionType creationOf(EntityKind kind) {
        for (TransactionType type : values()) {
            if (type.kind == kind && type.creation) {
                return type;
            }
        }
        throw new IllegalArgumentException("No creation type for " + kind);
    }
}

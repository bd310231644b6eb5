package io.github.goodees.seedlog.projection;

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

import io.github.goodees.seedlog.EntityKind;
import io.github.goodees.seedlog.TransactionRecord;
import io.github.goodees.seedlog.store.TransactionLog;
import org.slf4j.Logger;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

import static io.github.goodees.seedlog.Payloads.text;
import static io.github.goodees.seedlog.TransactionType.ADD_CATEGORY;
import static io.github.goodees.seedlog.TransactionType.ADD_FOLLOWUP;
import static io.github.goodees.seedlog.TransactionType.ADD_SPROUT;
import static io.github.goodees.seedlog.TransactionType.ADD_TAG;
import static io.github.goodees.seedlog.TransactionType.EDIT_CONTENT;
import static io.github.goodees.seedlog.TransactionType.REMOVE_CATEGORY;
import static io.github.goodees.seedlog.TransactionType.REMOVE_TAG;
import static io.github.goodees.seedlog.TransactionType.SET_CATEGORY;
import static java.util.stream.Collectors.toList;

/**
 * Projects seeds. Tag and category additions are idempotent by id, removals of absent ids are no-ops.
 */
public class SeedProjector extends EntityProjector<SeedState> {

    public SeedProjector(TransactionLog log) {
        super(EntityKind.SEED, log);
    }

    public SeedProjector(TransactionLog log, Logger logger) {
        super(EntityKind.SEED, log, logger);
    }

    @Override
    protected SeedState initialState(TransactionRecord creation) {
        return ImmutableSeedState.builder()
                .seedId(creation.getEntityId())
                .content(text(creation.getPayload(), "content"))
                .createdAt(creation.getCreatedAt())
                .updatedAt(creation.getCreatedAt())
                .build();
    }

    @Override
    protected TransactionSwitch<SeedState> defineReducers() {
        return TransactionSwitch.builder(SeedState.class)
                .on(EDIT_CONTENT, (s, tx) -> touch(s, tx).withContent(text(tx.getPayload(), "content")))
                .on(ADD_TAG, this::addTag)
                .on(REMOVE_TAG, (s, tx) -> {
                    String tagId = text(tx.getPayload(), "tag_id");
                    return touch(s, tx).withTags(s.getTags().stream().filter(t -> !t.getId().equals(tagId))
                            .collect(toList()));
                })
                .on(ADD_CATEGORY, (s, tx) -> {
                    CategoryRef category = category(tx);
                    if (s.hasCategory(category.getId())) {
                        return touch(s, tx);
                    }
                    return touch(s, tx).withCategories(append(s.getCategories(), category));
                })
                .on(SET_CATEGORY, (s, tx) -> touch(s, tx).withCategories(Collections.singletonList(category(tx))))
                .on(REMOVE_CATEGORY, (s, tx) -> {
                    String categoryId = text(tx.getPayload(), "category_id");
                    return touch(s, tx).withCategories(s.getCategories().stream()
                            .filter(c -> !c.getId().equals(categoryId)).collect(toList()));
                })
                .on(ADD_FOLLOWUP, (s, tx) -> {
                    String followupId = text(tx.getPayload(), "followup_id");
                    return s.getFollowupIds().contains(followupId) ? touch(s, tx)
                            : touch(s, tx).withFollowupIds(append(s.getFollowupIds(), followupId));
                })
                .on(ADD_SPROUT, (s, tx) -> {
                    String sproutId = text(tx.getPayload(), "sprout_id");
                    return s.getSproutIds().contains(sproutId) ? touch(s, tx)
                            : touch(s, tx).withSproutIds(append(s.getSproutIds(), sproutId));
                })
                .build();
    }

    private SeedState addTag(SeedState state, TransactionRecord tx) {
        String tagId = text(tx.getPayload(), "tag_id");
        if (state.hasTag(tagId)) {
            return touch(state, tx);
        }
        return touch(state, tx).withTags(append(state.getTags(),
            ImmutableTagRef.of(tagId, text(tx.getPayload(), "tag_name"))));
    }

    private static CategoryRef category(TransactionRecord tx) {
        return ImmutableCategoryRef.of(text(tx.getPayload(), "category_id"), text(tx.getPayload(), "category_name"),
            text(tx.getPayload(), "category_path"));
    }

    private static ImmutableSeedState touch(SeedState state, TransactionRecord tx) {
        return ImmutableSeedState.copyOf(state).withUpdatedAt(tx.getCreatedAt());
    }

    private static <T> List<T> append(List<T> list, T element) {
        List<T> result = new ArrayList<>(list);
        result.add(element);
        return result;
    }
}

package io.github.goodees.seedlog.musing;

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
import io.github.goodees.seedlog.immutables.ValueStyle;
import org.immutables.value.Value;

import java.time.Instant;
import java.util.Optional;

/**
 * Generated prompt related to a seed. Dismissal and completion are mutually exclusive terminal states.
 */
@Value.Immutable
@ValueStyle
public interface IdeaMusing {
    String getId();

    String getSeedId();

    TemplateType getTemplateType();

    JsonNode getContent();

    Instant getCreatedAt();

    @Value.Default
    default boolean isDismissed() {
        return false;
    }

    Optional<Instant> getDismissedAt();

    @Value.Default
    default boolean isCompleted() {
        return false;
    }

    Optional<Instant> getCompletedAt();

    default boolean isTerminal() {
        return isDismissed() || isCompleted();
    }

    @Value.Check
    default void check() {
        if (isDismissed() && isCompleted()) {
            throw new IllegalStateException("Musing " + getId() + " cannot be both dismissed and completed");
        }
    }
}

package io.github.goodees.seedlog.event;

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

import io.github.goodees.seedlog.immutables.ValueStyle;
import io.github.goodees.seedlog.patch.JsonPatch;
import org.immutables.value.Value;

import java.time.Instant;
import java.util.Comparator;
import java.util.Optional;

/**
 * Stored patch event. Only {@code enabled} ever changes after the event is written.
 */
@Value.Immutable
@ValueStyle
public interface EventRecord {
    Comparator<EventRecord> REPLAY_ORDER = Comparator.comparing(EventRecord::getCreatedAt)
            .thenComparingLong(EventRecord::getSequence);

    String getId();

    String getEntityId();

    String getEventType();

    JsonPatch getPatch();

    @Value.Default
    default boolean isEnabled() {
        return true;
    }

    Instant getCreatedAt();

    long getSequence();

    Optional<String> getAutomationId();
}

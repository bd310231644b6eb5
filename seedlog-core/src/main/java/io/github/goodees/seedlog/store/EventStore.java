package io.github.goodees.seedlog.store;

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

import io.github.goodees.seedlog.ValidationException;
import io.github.goodees.seedlog.event.EventRecord;
import io.github.goodees.seedlog.patch.JsonPatch;

import java.util.List;
import java.util.Optional;

/**
 * Store of patch events. Patches are never edited; toggling {@code enabled} is the only mutation.
 */
public interface EventStore {

    /**
     * Store a new enabled event.
     * @throws ValidationException if the patch is empty, malformed or touches disallowed paths
     */
    EventRecord append(String entityId, String eventType, JsonPatch patch, String automationId)
            throws ValidationException, TransactionStoreException;

    Optional<EventRecord> findById(String eventId);

    /**
     * Include or exclude an event from derived views.
     * @return updated event, or empty if no such event exists
     */
    Optional<EventRecord> setEnabled(String eventId, boolean enabled) throws TransactionStoreException;

    /**
     * Enabled events of an entity ordered by {@link EventRecord#REPLAY_ORDER}.
     */
    List<EventRecord> readEnabled(String entityId);

    /**
     * Whole timeline of an entity including disabled events, ordered by {@link EventRecord#REPLAY_ORDER}.
     */
    List<EventRecord> readAll(String entityId);

    List<EventRecord> readByAutomation(String automationId);

    int deleteEntity(String entityId) throws TransactionStoreException;
}

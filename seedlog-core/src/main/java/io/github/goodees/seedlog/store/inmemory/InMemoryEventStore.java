package io.github.goodees.seedlog.store.inmemory;

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
import io.github.goodees.seedlog.config.SeedlogConfiguration;
import io.github.goodees.seedlog.event.EventRecord;
import io.github.goodees.seedlog.event.ImmutableEventRecord;
import io.github.goodees.seedlog.patch.JsonPatch;
import io.github.goodees.seedlog.patch.PatchValidator;
import io.github.goodees.seedlog.store.EventStore;

import java.time.Clock;
import java.time.temporal.ChronoUnit;
import java.util.List;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.atomic.AtomicLong;
import java.util.function.Predicate;

import static java.util.stream.Collectors.toList;

public class InMemoryEventStore implements EventStore {
    private final ConcurrentMap<String, EventRecord> storage = new ConcurrentHashMap<>();
    private final AtomicLong sequence = new AtomicLong();
    private final PatchValidator validator;
    private final Clock clock;

    public InMemoryEventStore() {
        this(SeedlogConfiguration.DEFAULTS, Clock.systemUTC());
    }

    public InMemoryEventStore(SeedlogConfiguration configuration, Clock clock) {
        this(new PatchValidator(configuration.allowedPatchPrefixes()), clock);
    }

    public InMemoryEventStore(PatchValidator validator, Clock clock) {
        this.validator = validator;
        this.clock = clock;
    }

    @Override
    public EventRecord append(String entityId, String eventType, JsonPatch patch, String automationId)
            throws ValidationException {
        if (entityId == null || entityId.isEmpty()) {
            throw new ValidationException("Entity id is required");
        }
        if (eventType == null || eventType.trim().isEmpty()) {
            throw new ValidationException("Event type is required");
        }
        validator.validate(patch);
        EventRecord event = ImmutableEventRecord.builder()
                .id(UUID.randomUUID().toString())
                .entityId(entityId)
                .eventType(eventType)
                .patch(patch)
                .createdAt(clock.instant().truncatedTo(ChronoUnit.MILLIS))
                .sequence(sequence.incrementAndGet())
                .automationId(automationId)
                .build();
        storage.put(event.getId(), event);
        return event;
    }

    @Override
    public Optional<EventRecord> findById(String eventId) {
        return Optional.ofNullable(storage.get(eventId));
    }

    @Override
    public Optional<EventRecord> setEnabled(String eventId, boolean enabled) {
        return Optional.ofNullable(storage.computeIfPresent(eventId,
            (id, event) -> ImmutableEventRecord.copyOf(event).withEnabled(enabled)));
    }

    @Override
    public List<EventRecord> readEnabled(String entityId) {
        return select(e -> e.getEntityId().equals(entityId) && e.isEnabled());
    }

    @Override
    public List<EventRecord> readAll(String entityId) {
        return select(e -> e.getEntityId().equals(entityId));
    }

    @Override
    public List<EventRecord> readByAutomation(String automationId) {
        return select(e -> e.getAutomationId().filter(automationId::equals).isPresent());
    }

    @Override
    public int deleteEntity(String entityId) {
        List<String> ids = readAll(entityId).stream().map(EventRecord::getId).collect(toList());
        ids.forEach(storage::remove);
        return ids.size();
    }

    private List<EventRecord> select(Predicate<EventRecord> filter) {
        return storage.values().stream().filter(filter).sorted(EventRecord.REPLAY_ORDER).collect(toList());
    }
}

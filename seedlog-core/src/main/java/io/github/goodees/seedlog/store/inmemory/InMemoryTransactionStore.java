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

import com.fasterxml.jackson.databind.JsonNode;
import io.github.goodees.seedlog.EntityKind;
import io.github.goodees.seedlog.ImmutableTransactionRecord;
import io.github.goodees.seedlog.TransactionRecord;
import io.github.goodees.seedlog.TransactionType;
import io.github.goodees.seedlog.ValidationException;
import io.github.goodees.seedlog.store.TransactionLog;
import io.github.goodees.seedlog.store.TransactionStore;

import java.time.Clock;
import java.time.temporal.ChronoUnit;
import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.atomic.AtomicLong;
import java.util.function.BiFunction;
import java.util.function.Consumer;

import static java.util.stream.Collectors.toList;

/**
 * Transaction log held in memory, for tests and single-process use.
 */
public class InMemoryTransactionStore implements TransactionStore, TransactionLog {
    private final Map<EntityKind, ConcurrentMap<String, List<TransactionRecord>>> storage =
            new EnumMap<>(EntityKind.class);
    private final AtomicLong sequence = new AtomicLong();
    private final Clock clock;

    public InMemoryTransactionStore() {
        this(Clock.systemUTC());
    }

    public InMemoryTransactionStore(Clock clock) {
        this.clock = clock;
        for (EntityKind kind : EntityKind.values()) {
            storage.put(kind, new ConcurrentHashMap<>());
        }
    }

    protected List<TransactionRecord> entityLog(EntityKind kind, String entityId) {
        return storage.get(kind).computeIfAbsent(entityId, (i) -> Collections.synchronizedList(new ArrayList<>()));
    }

    @Override
    public TransactionRecord append(String entityId, TransactionType type, JsonNode payload, String automationId)
            throws ValidationException {
        if (entityId == null || entityId.isEmpty()) {
            throw new ValidationException("Entity id is required");
        }
        type.validate(payload);
        List<TransactionRecord> log = entityLog(type.kind(), entityId);
        synchronized (log) {
            boolean created = log.stream().anyMatch(t -> t.getType().isCreation());
            if (type.isCreation() && created) {
                throw ValidationException.duplicateCreation(entityId, type);
            } else if (!type.isCreation() && !created) {
                throw ValidationException.notCreated(entityId, type);
            }
            TransactionRecord record = ImmutableTransactionRecord.builder()
                    .id(UUID.randomUUID().toString())
                    .entityId(entityId)
                    .type(type)
                    .payload(payload.deepCopy())
                    .createdAt(clock.instant().truncatedTo(ChronoUnit.MILLIS))
                    .sequence(sequence.incrementAndGet())
                    .automationId(automationId)
                    .build();
            log.add(record);
            return record;
        }
    }

    @Override
    public int deleteEntity(EntityKind kind, String entityId) {
        List<TransactionRecord> removed = storage.get(kind).remove(entityId);
        return removed == null ? 0 : removed.size();
    }

    @Override
    public List<String> readEntityIds(EntityKind kind) {
        return storage.get(kind).entrySet().stream()
                .filter(e -> !e.getValue().isEmpty())
                .map(Map.Entry::getKey)
                .sorted()
                .collect(toList());
    }

    @Override
    public List<TransactionRecord> readByAutomation(String automationId) {
        List<TransactionRecord> result = new ArrayList<>();
        for (ConcurrentMap<String, List<TransactionRecord>> logs : storage.values()) {
            for (List<TransactionRecord> log : logs.values()) {
                synchronized (log) {
                    log.stream()
                            .filter(t -> t.getAutomationId().filter(automationId::equals).isPresent())
                            .forEach(result::add);
                }
            }
        }
        result.sort(TransactionRecord.REPLAY_ORDER);
        return result;
    }

    @Override
    public StoredTransactions readTransactions(EntityKind kind, String entityId) {
        return new StoredTransactions() {
            final List<TransactionRecord> transactions;
            boolean stop = false;

            {
                List<TransactionRecord> log = storage.get(kind).getOrDefault(entityId, Collections.emptyList());
                synchronized (log) {
                    transactions = log.stream().sorted(TransactionRecord.REPLAY_ORDER).collect(toList());
                }
            }

            @Override
            public void foreach(Consumer<? super TransactionRecord> consumer) {
                for (TransactionRecord transaction : transactions) {
                    if (stop) {
                        break;
                    }
                    consumer.accept(transaction);
                }
            }

            @Override
            public <R> R reduce(R initial, BiFunction<R, ? super TransactionRecord, R> reducer) {
                R result = initial;
                for (TransactionRecord transaction : transactions) {
                    if (stop) {
                        break;
                    }
                    result = reducer.apply(result, transaction);
                }
                return result;
            }

            @Override
            public void stop() {
                stop = true;
            }

            @Override
            public void close() {
            }
        };
    }
}

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
import io.github.goodees.seedlog.IntegrityException;
import io.github.goodees.seedlog.TransactionRecord;
import io.github.goodees.seedlog.store.TransactionLog;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Reconstructs current state of an entity by replaying its transaction log.
 *
 * <p>The log must start with exactly one creation transaction, otherwise replay fails with
 * {@link IntegrityException}. Every other transaction goes through {@link #reducers()}; those whose payload does
 * not conform to their type are skipped and logged. Replay has no side effects besides logging, so replaying the
 * same transactions always yields equal states.
 *
 * @param <S> type of the projected state
 */
public abstract class EntityProjector<S> {
    private final EntityKind kind;
    private final TransactionLog log;
    private final Logger logger;
    private volatile TransactionSwitch<S> reducers;

    protected EntityProjector(EntityKind kind, TransactionLog log) {
        this(kind, log, LoggerFactory.getLogger(EntityProjector.class));
    }

    protected EntityProjector(EntityKind kind, TransactionLog log, Logger logger) {
        this.kind = kind;
        this.log = log;
        this.logger = logger;
    }

    public EntityKind getKind() {
        return kind;
    }

    /**
     * Read the log of the entity and replay it.
     * @param entityId id of the entity
     * @return current state
     * @throws IntegrityException when the log is empty or violates the creation invariants
     */
    public S project(String entityId) throws IntegrityException {
        List<TransactionRecord> transactions = new ArrayList<>();
        try (TransactionLog.StoredTransactions stored = log.readTransactions(kind, entityId)) {
            stored.foreach(transactions::add);
        }
        return replay(entityId, transactions);
    }

    /**
     * Like {@link #project(String)}, but returns empty for entities that cannot be projected.
     */
    public Optional<S> tryProject(String entityId) {
        try {
            return Optional.of(project(entityId));
        } catch (IntegrityException e) {
            logger.warn("{} Excluded from {} views: {}", entityId, kind.wireName(), e.getMessage());
            return Optional.empty();
        }
    }

    /**
     * Replay explicit list of transactions. The list is sorted into replay order first.
     */
    public S replay(String entityId, List<TransactionRecord> transactions) throws IntegrityException {
        List<TransactionRecord> ordered = new ArrayList<>(transactions);
        ordered.sort(TransactionRecord.REPLAY_ORDER);
        if (ordered.isEmpty()) {
            throw IntegrityException.missingCreation(kind, entityId);
        }
        TransactionRecord first = ordered.get(0);
        for (TransactionRecord transaction : ordered.subList(1, ordered.size())) {
            if (transaction.getType().isCreation()) {
                throw first.getType().isCreation() ? IntegrityException.duplicateCreation(entityId, transaction)
                        : IntegrityException.creationNotFirst(entityId, first);
            }
        }
        if (!first.getType().isCreation()) {
            throw IntegrityException.missingCreation(kind, entityId);
        }
        Optional<String> invalid = first.getType().violation(first.getPayload());
        if (invalid.isPresent()) {
            throw IntegrityException.invalidCreation(entityId, invalid.get());
        }

        S state = initialState(first);
        TransactionSwitch<S> reducers = reducers();
        for (TransactionRecord transaction : ordered.subList(1, ordered.size())) {
            Optional<String> violation = transaction.getType().violation(transaction.getPayload());
            if (violation.isPresent()) {
                logger.warn("{} Skipping {} transaction {}: {}", entityId, transaction.getType().wireName(),
                    transaction.getId(), violation.get());
                continue;
            }
            state = reducers.apply(state, transaction);
        }
        logger.debug("{} Replayed {} transactions", entityId, ordered.size());
        return state;
    }

    private TransactionSwitch<S> reducers() {
        if (reducers == null) {
            reducers = defineReducers();
        }
        return reducers;
    }

    /**
     * Build state from a creation transaction whose payload has already been validated.
     */
    protected abstract S initialState(TransactionRecord creation);

    /**
     * Reducers for all non-creation transaction types of the entity kind.
     */
    protected abstract TransactionSwitch<S> defineReducers();
}

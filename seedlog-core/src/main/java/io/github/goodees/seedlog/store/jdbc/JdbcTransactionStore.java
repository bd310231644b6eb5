package io.github.goodees.seedlog.store.jdbc;

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
import io.github.goodees.seedlog.store.Serialization;
import io.github.goodees.seedlog.store.TransactionLog;
import io.github.goodees.seedlog.store.TransactionStore;
import io.github.goodees.seedlog.store.TransactionStoreException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.sql.DataSource;
import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.time.Clock;
import java.time.temporal.ChronoUnit;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.UUID;
import java.util.function.BiFunction;
import java.util.function.Consumer;

/**
 * Transaction log backed by schema and serialization.
 */
public class JdbcTransactionStore implements TransactionStore, TransactionLog {
    private static final Logger logger = LoggerFactory.getLogger(JdbcTransactionStore.class);

    private final DataSource ds;
    private final JdbcSchema schema;
    private final Serialization<JsonNode> serialization;
    private final boolean strict;
    private final TxHandler txHandler;
    private final Clock clock;

    public JdbcTransactionStore(DataSource ds, JdbcSchema schema, Serialization<JsonNode> serialization,
            boolean strict) {
        this(ds, schema, serialization, strict, TxHandler.CONTAINER, Clock.systemUTC());
    }

    /**
     * Create instance that will read from provided datasource, delegating queries to JdbcSchema, deserializing
     * payloads by serialization, while being or not being strict.
     *
     * <p>In strict mode a stored transaction that cannot be read, because its type is unknown or its payload is not
     * readable, causes an exception. Such rows usually come from a newer version of the system after a rollback.
     * When {@code strict} is false, the row is logged and skipped.
     */
    public JdbcTransactionStore(DataSource ds, JdbcSchema schema, Serialization<JsonNode> serialization,
            boolean strict, TxHandler txHandler, Clock clock) {
        this.ds = ds;
        this.schema = schema;
        this.serialization = serialization;
        this.strict = strict;
        this.txHandler = txHandler;
        this.clock = clock;
    }

    /**
     * Indicate whether failure to read a transaction causes exception to be thrown.
     */
    public boolean isStrict() {
        return strict;
    }

    @Override
    public TransactionRecord append(String entityId, TransactionType type, JsonNode payload, String automationId)
            throws ValidationException, TransactionStoreException {
        if (entityId == null || entityId.isEmpty()) {
            throw new ValidationException("Entity id is required");
        }
        type.validate(payload);
        TransactionRecord record = ImmutableTransactionRecord.builder()
                .id(UUID.randomUUID().toString())
                .entityId(entityId)
                .type(type)
                .payload(payload.deepCopy())
                .createdAt(clock.instant().truncatedTo(ChronoUnit.MILLIS))
                .sequence(0)
                .automationId(automationId)
                .build();
        String serialized;
        try {
            serialized = serialization.serialize(record.getPayload());
        } catch (IllegalArgumentException e) {
            throw TransactionStoreException.unserializable(entityId, e);
        }

        try (Connection connection = txHandler.enroll(ds.getConnection())) {
            try {
                checkCreation(connection, record);
                try (PreparedStatement insert = schema.insertTransaction(connection, type.kind())) {
                    schema.prepareInsert(insert, record, serialized);
                    insert.executeUpdate();
                }
                TransactionRecord stored = reread(connection, record);
                txHandler.commit(connection);
                return stored;
            } catch (SQLException | ValidationException | RuntimeException e) {
                txHandler.rollback(connection);
                throw e;
            }
        } catch (SQLException e) {
            throw TransactionStoreException.storeFailed(entityId, e);
        }
    }

    private void checkCreation(Connection connection, TransactionRecord record)
            throws SQLException, ValidationException {
        TransactionType creation = TransactionType.creationOf(record.getKind());
        try (PreparedStatement count = schema.countTransactionsOfType(connection, record.getKind(),
                record.getEntityId(), creation.wireName());
                ResultSet rs = count.executeQuery()) {
            boolean created = rs.next() && rs.getLong(1) > 0;
            if (record.getType().isCreation() && created) {
                throw ValidationException.duplicateCreation(record.getEntityId(), record.getType());
            } else if (!record.getType().isCreation() && !created) {
                throw ValidationException.notCreated(record.getEntityId(), record.getType());
            }
        }
    }

    private TransactionRecord reread(Connection connection, TransactionRecord record) throws SQLException {
        try (PreparedStatement select = schema.selectTransaction(connection, record.getKind(), record.getId());
                ResultSet rs = select.executeQuery()) {
            if (!rs.next()) {
                throw new SQLException("Inserted transaction " + record.getId() + " not found");
            }
            return ImmutableTransactionRecord.copyOf(record).withSequence(schema.readSequence(rs));
        }
    }

    @Override
    public int deleteEntity(EntityKind kind, String entityId) throws TransactionStoreException {
        try (Connection connection = txHandler.enroll(ds.getConnection());
                PreparedStatement delete = schema.deleteTransactions(connection, kind, entityId)) {
            try {
                int deleted = delete.executeUpdate();
                txHandler.commit(connection);
                return deleted;
            } catch (SQLException | RuntimeException e) {
                txHandler.rollback(connection);
                throw e;
            }
        } catch (SQLException e) {
            throw TransactionStoreException.deleteFailed(entityId, e);
        }
    }

    @Override
    public List<String> readEntityIds(EntityKind kind) {
        try (Connection connection = ds.getConnection();
                PreparedStatement select = schema.selectEntityIds(connection, kind);
                ResultSet rs = select.executeQuery()) {
            List<String> result = new ArrayList<>();
            while (rs.next()) {
                result.add(rs.getString(1));
            }
            return result;
        } catch (SQLException e) {
            throw new IllegalStateException("Cannot access storage", e);
        }
    }

    @Override
    public List<TransactionRecord> readByAutomation(String automationId) {
        List<TransactionRecord> result = new ArrayList<>();
        try (Connection connection = ds.getConnection()) {
            for (EntityKind kind : EntityKind.values()) {
                try (PreparedStatement select = schema.selectTransactionsByAutomation(connection, kind, automationId);
                        ResultSet rs = select.executeQuery()) {
                    while (rs.next()) {
                        readRecord(kind, rs).ifPresent(result::add);
                    }
                }
            }
        } catch (SQLException e) {
            throw new IllegalStateException("Cannot access storage", e);
        }
        result.sort(TransactionRecord.REPLAY_ORDER);
        return result;
    }

    @Override
    public StoredTransactions readTransactions(EntityKind kind, String entityId) {
        try {
            return new JdbcStoredTransactions(kind, entityId);
        } catch (SQLException e) {
            throw new IllegalStateException("Cannot access storage", e);
        }
    }

    /**
     * Convert current row. Unreadable rows throw in strict mode and are skipped otherwise.
     */
    protected Optional<TransactionRecord> readRecord(EntityKind kind, ResultSet rs) throws SQLException {
        String type = schema.readType(rs);
        Optional<TransactionType> transactionType = TransactionType.of(kind, type);
        JsonNode payload = serialization.deserialize(schema.readPayload(rs), type);
        if (!transactionType.isPresent() || payload == null) {
            String entityId = schema.readEntityId(rs);
            String id = schema.readId(rs);
            if (isStrict()) {
                throw new IllegalArgumentException(entityId + " Could not deserialize transaction " + id);
            } else {
                logger.error("{} Could not deserialize transaction {} of type {}", entityId, id, type);
                return Optional.empty();
            }
        }
        return Optional.of(ImmutableTransactionRecord.builder()
                .id(schema.readId(rs))
                .entityId(schema.readEntityId(rs))
                .type(transactionType.get())
                .payload(payload)
                .createdAt(schema.readCreatedAt(rs))
                .sequence(schema.readSequence(rs))
                .automationId(schema.readAutomationId(rs))
                .build());
    }

    class JdbcStoredTransactions implements StoredTransactions {
        private final EntityKind kind;
        private Connection connection;
        private PreparedStatement statement;
        private ResultSet resultSet;
        private boolean iterating;
        private boolean stop;

        JdbcStoredTransactions(EntityKind kind, String entityId) throws SQLException {
            this.kind = kind;
            try {
                connection = ds.getConnection();
                statement = schema.selectTransactions(connection, kind, entityId);
                resultSet = statement.executeQuery();
            } catch (SQLException e) {
                close();
                throw e;
            }
        }

        @Override
        public void foreach(Consumer<? super TransactionRecord> consumer) {
            reduce(null, (r, transaction) -> {
                consumer.accept(transaction);
                return r;
            });
        }

        @Override
        public <R> R reduce(R initial, BiFunction<R, ? super TransactionRecord, R> reducer) {
            if (iterating) {
                throw new IllegalStateException("Iteration has already been done");
            }
            iterating = true;
            try {
                R result = initial;
                while (!stop && resultSet.next()) {
                    Optional<TransactionRecord> record = readRecord(kind, resultSet);
                    if (record.isPresent()) {
                        result = reducer.apply(result, record.get());
                    }
                }
                return result;
            } catch (SQLException e) {
                throw new IllegalStateException("Cannot access datastore", e);
            }
        }

        @Override
        public void stop() {
            stop = true;
        }

        @Override
        public void close() {
            cleanup(resultSet);
            cleanup(statement);
            cleanup(connection);
        }

        protected void cleanup(AutoCloseable resource) {
            if (resource != null) {
                try {
                    resource.close();
                } catch (Exception e) {
                    logger.warn("Suppressing cleanup exception", e);
                }
            }
        }
    }
}

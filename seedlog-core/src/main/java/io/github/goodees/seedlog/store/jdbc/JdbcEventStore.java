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
import io.github.goodees.seedlog.ValidationException;
import io.github.goodees.seedlog.config.SeedlogConfiguration;
import io.github.goodees.seedlog.event.EventRecord;
import io.github.goodees.seedlog.event.ImmutableEventRecord;
import io.github.goodees.seedlog.patch.JsonPatch;
import io.github.goodees.seedlog.patch.PatchValidator;
import io.github.goodees.seedlog.store.EventStore;
import io.github.goodees.seedlog.store.Serialization;
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

/**
 * Event store keeping patches in their JSON form.
 */
public class JdbcEventStore implements EventStore {
    private static final Logger logger = LoggerFactory.getLogger(JdbcEventStore.class);

    private final DataSource ds;
    private final JdbcSchema schema;
    private final Serialization<JsonNode> serialization;
    private final PatchValidator validator;
    private final TxHandler txHandler;
    private final Clock clock;

    public JdbcEventStore(DataSource ds, JdbcSchema schema, Serialization<JsonNode> serialization) {
        this(ds, schema, serialization, SeedlogConfiguration.DEFAULTS, TxHandler.CONTAINER, Clock.systemUTC());
    }

    public JdbcEventStore(DataSource ds, JdbcSchema schema, Serialization<JsonNode> serialization,
            SeedlogConfiguration configuration, TxHandler txHandler, Clock clock) {
        this(ds, schema, serialization, new PatchValidator(configuration.allowedPatchPrefixes()), txHandler, clock);
    }

    public JdbcEventStore(DataSource ds, JdbcSchema schema, Serialization<JsonNode> serialization,
            PatchValidator validator, TxHandler txHandler, Clock clock) {
        this.ds = ds;
        this.schema = schema;
        this.serialization = serialization;
        this.validator = validator;
        this.txHandler = txHandler;
        this.clock = clock;
    }

    @Override
    public EventRecord append(String entityId, String eventType, JsonPatch patch, String automationId)
            throws ValidationException, TransactionStoreException {
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
                .sequence(0)
                .automationId(automationId)
                .build();
        String serialized;
        try {
            serialized = serialization.serialize(patch.toJson());
        } catch (IllegalArgumentException e) {
            throw TransactionStoreException.unserializable(entityId, e);
        }
        try (Connection connection = txHandler.enroll(ds.getConnection())) {
            try {
                try (PreparedStatement insert = schema.insertEvent(connection, event, serialized)) {
                    insert.executeUpdate();
                }
                long sequence;
                try (PreparedStatement select = schema.selectEvent(connection, event.getId());
                        ResultSet rs = select.executeQuery()) {
                    if (!rs.next()) {
                        throw new SQLException("Inserted event " + event.getId() + " not found");
                    }
                    sequence = schema.readSequence(rs);
                }
                txHandler.commit(connection);
                return ImmutableEventRecord.copyOf(event).withSequence(sequence);
            } catch (SQLException | RuntimeException e) {
                txHandler.rollback(connection);
                throw e;
            }
        } catch (SQLException e) {
            throw TransactionStoreException.storeFailed(entityId, e);
        }
    }

    @Override
    public Optional<EventRecord> findById(String eventId) {
        try (Connection connection = ds.getConnection()) {
            return find(connection, eventId);
        } catch (SQLException e) {
            throw new IllegalStateException("Cannot access storage", e);
        }
    }

    private Optional<EventRecord> find(Connection connection, String eventId) throws SQLException {
        try (PreparedStatement select = schema.selectEvent(connection, eventId);
                ResultSet rs = select.executeQuery()) {
            return rs.next() ? readEvent(rs) : Optional.empty();
        }
    }

    @Override
    public Optional<EventRecord> setEnabled(String eventId, boolean enabled) throws TransactionStoreException {
        try (Connection connection = txHandler.enroll(ds.getConnection())) {
            try {
                int updated;
                try (PreparedStatement update = schema.updateEventEnabled(connection, eventId, enabled)) {
                    updated = update.executeUpdate();
                }
                Optional<EventRecord> result = updated == 0 ? Optional.empty() : find(connection, eventId);
                txHandler.commit(connection);
                return result;
            } catch (SQLException | RuntimeException e) {
                txHandler.rollback(connection);
                throw e;
            }
        } catch (SQLException e) {
            throw TransactionStoreException.updateFailed(eventId, e);
        }
    }

    @Override
    public List<EventRecord> readEnabled(String entityId) {
        return readEvents(entityId, true);
    }

    @Override
    public List<EventRecord> readAll(String entityId) {
        return readEvents(entityId, false);
    }

    private List<EventRecord> readEvents(String entityId, boolean enabledOnly) {
        try (Connection connection = ds.getConnection();
                PreparedStatement select = schema.selectEvents(connection, entityId, enabledOnly)) {
            return collect(select);
        } catch (SQLException e) {
            throw new IllegalStateException("Cannot access storage", e);
        }
    }

    @Override
    public List<EventRecord> readByAutomation(String automationId) {
        try (Connection connection = ds.getConnection();
                PreparedStatement select = schema.selectEventsByAutomation(connection, automationId)) {
            return collect(select);
        } catch (SQLException e) {
            throw new IllegalStateException("Cannot access storage", e);
        }
    }

    @Override
    public int deleteEntity(String entityId) throws TransactionStoreException {
        try (Connection connection = txHandler.enroll(ds.getConnection());
                PreparedStatement delete = schema.deleteEvents(connection, entityId)) {
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

    private List<EventRecord> collect(PreparedStatement select) throws SQLException {
        List<EventRecord> result = new ArrayList<>();
        try (ResultSet rs = select.executeQuery()) {
            while (rs.next()) {
                readEvent(rs).ifPresent(result::add);
            }
        }
        return result;
    }

    /**
     * Convert current row. A row whose patch cannot be read is logged and left out of the timeline.
     */
    protected Optional<EventRecord> readEvent(ResultSet rs) throws SQLException {
        String id = schema.readId(rs);
        String eventType = schema.readType(rs);
        JsonNode patchJson = serialization.deserialize(schema.readPayload(rs), eventType);
        if (patchJson == null) {
            logger.error("{} Could not deserialize patch of event {}", schema.readEntityId(rs), id);
            return Optional.empty();
        }
        JsonPatch patch;
        try {
            patch = JsonPatch.fromJson(patchJson);
        } catch (ValidationException e) {
            logger.error("{} Stored patch of event {} is malformed", schema.readEntityId(rs), id, e);
            return Optional.empty();
        }
        return Optional.of(ImmutableEventRecord.builder()
                .id(id)
                .entityId(schema.readEntityId(rs))
                .eventType(eventType)
                .patch(patch)
                .createdAt(schema.readCreatedAt(rs))
                .sequence(schema.readSequence(rs))
                .automationId(schema.readAutomationId(rs))
                .enabled(schema.readEnabled(rs))
                .build());
    }
}

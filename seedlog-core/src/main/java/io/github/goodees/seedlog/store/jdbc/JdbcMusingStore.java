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
import io.github.goodees.seedlog.musing.IdeaMusing;
import io.github.goodees.seedlog.musing.ImmutableShownHistoryEntry;
import io.github.goodees.seedlog.musing.MusingStore;
import io.github.goodees.seedlog.musing.ShownHistoryEntry;
import io.github.goodees.seedlog.store.Serialization;

import javax.sql.DataSource;
import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.time.Instant;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.Collection;
import java.util.HashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;

public class JdbcMusingStore implements MusingStore {
    private final DataSource ds;
    private final JdbcSchema schema;
    private final Serialization<JsonNode> serialization;
    private final TxHandler txHandler;

    public JdbcMusingStore(DataSource ds, JdbcSchema schema, Serialization<JsonNode> serialization) {
        this(ds, schema, serialization, TxHandler.CONTAINER);
    }

    public JdbcMusingStore(DataSource ds, JdbcSchema schema, Serialization<JsonNode> serialization,
            TxHandler txHandler) {
        this.ds = ds;
        this.schema = schema;
        this.serialization = serialization;
        this.txHandler = txHandler;
    }

    @Override
    public IdeaMusing insert(IdeaMusing musing) {
        String content = serialization.serialize(musing.getContent());
        try (Connection connection = txHandler.enroll(ds.getConnection())) {
            try (PreparedStatement insert = schema.insertMusing(connection, musing, content)) {
                insert.executeUpdate();
                txHandler.commit(connection);
                return musing;
            } catch (SQLException | RuntimeException e) {
                txHandler.rollback(connection);
                throw e;
            }
        } catch (SQLException e) {
            if (e.getSQLState() != null && e.getSQLState().startsWith("23")) {
                throw new IllegalArgumentException("Musing " + musing.getId() + " already exists", e);
            }
            throw new IllegalStateException("Cannot store musing " + musing.getId(), e);
        }
    }

    @Override
    public Optional<IdeaMusing> findById(String musingId) {
        try (Connection connection = ds.getConnection()) {
            return find(connection, musingId);
        } catch (SQLException e) {
            throw new IllegalStateException("Cannot access storage", e);
        }
    }

    private Optional<IdeaMusing> find(Connection connection, String musingId) throws SQLException {
        try (PreparedStatement select = schema.selectMusing(connection, musingId);
                ResultSet rs = select.executeQuery()) {
            return rs.next() ? Optional.of(schema.readMusing(rs, serialization)) : Optional.empty();
        }
    }

    @Override
    public List<IdeaMusing> findBySeed(String seedId) {
        try (Connection connection = ds.getConnection();
                PreparedStatement select = schema.selectMusingsBySeed(connection, seedId);
                ResultSet rs = select.executeQuery()) {
            List<IdeaMusing> result = new ArrayList<>();
            while (rs.next()) {
                result.add(schema.readMusing(rs, serialization));
            }
            return result;
        } catch (SQLException e) {
            throw new IllegalStateException("Cannot access storage", e);
        }
    }

    @Override
    public List<IdeaMusing> findCreatedBetween(Collection<String> seedIds, Instant from, Instant to) {
        Set<String> seeds = new HashSet<>(seedIds);
        try (Connection connection = ds.getConnection();
                PreparedStatement select = schema.selectMusingsCreatedBetween(connection, from, to);
                ResultSet rs = select.executeQuery()) {
            List<IdeaMusing> result = new ArrayList<>();
            while (rs.next()) {
                IdeaMusing musing = schema.readMusing(rs, serialization);
                if (seeds.contains(musing.getSeedId())) {
                    result.add(musing);
                }
            }
            return result;
        } catch (SQLException e) {
            throw new IllegalStateException("Cannot access storage", e);
        }
    }

    @Override
    public Optional<IdeaMusing> markDismissed(String musingId, Instant at) {
        return transition(musingId, false, at);
    }

    @Override
    public Optional<IdeaMusing> markCompleted(String musingId, Instant at) {
        return transition(musingId, true, at);
    }

    private Optional<IdeaMusing> transition(String musingId, boolean completed, Instant at) {
        try (Connection connection = txHandler.enroll(ds.getConnection())) {
            try {
                try (PreparedStatement update = schema.updateMusingTerminal(connection, musingId, completed, at)) {
                    update.executeUpdate();
                }
                Optional<IdeaMusing> result = find(connection, musingId);
                txHandler.commit(connection);
                return result;
            } catch (SQLException | RuntimeException e) {
                txHandler.rollback(connection);
                throw e;
            }
        } catch (SQLException e) {
            throw new IllegalStateException("Cannot update musing " + musingId, e);
        }
    }

    @Override
    public ShownHistoryEntry appendShown(String seedId, LocalDate shownDate, Instant at) {
        ShownHistoryEntry entry = ImmutableShownHistoryEntry.builder()
                .id(UUID.randomUUID().toString())
                .seedId(seedId)
                .shownDate(shownDate)
                .createdAt(at)
                .build();
        try (Connection connection = txHandler.enroll(ds.getConnection())) {
            try (PreparedStatement insert = schema.insertShown(connection, entry)) {
                insert.executeUpdate();
                txHandler.commit(connection);
                return entry;
            } catch (SQLException | RuntimeException e) {
                txHandler.rollback(connection);
                throw e;
            }
        } catch (SQLException e) {
            throw new IllegalStateException("Cannot record shown musings of " + seedId, e);
        }
    }

    @Override
    public List<ShownHistoryEntry> findShown(String seedId) {
        try (Connection connection = ds.getConnection();
                PreparedStatement select = schema.selectShown(connection, seedId);
                ResultSet rs = select.executeQuery()) {
            List<ShownHistoryEntry> result = new ArrayList<>();
            while (rs.next()) {
                result.add(schema.readShown(rs));
            }
            return result;
        } catch (SQLException e) {
            throw new IllegalStateException("Cannot access storage", e);
        }
    }

    @Override
    public Set<String> seedsShownSince(LocalDate since) {
        try (Connection connection = ds.getConnection();
                PreparedStatement select = schema.selectSeedsShownSince(connection, since);
                ResultSet rs = select.executeQuery()) {
            Set<String> result = new HashSet<>();
            while (rs.next()) {
                result.add(rs.getString(1));
            }
            return result;
        } catch (SQLException e) {
            throw new IllegalStateException("Cannot access storage", e);
        }
    }

    @Override
    public int deleteBySeed(String seedId) {
        try (Connection connection = txHandler.enroll(ds.getConnection());
                PreparedStatement delete = schema.deleteMusings(connection, seedId)) {
            try {
                int deleted = delete.executeUpdate();
                txHandler.commit(connection);
                return deleted;
            } catch (SQLException | RuntimeException e) {
                txHandler.rollback(connection);
                throw e;
            }
        } catch (SQLException e) {
            throw new IllegalStateException("Cannot delete musings of " + seedId, e);
        }
    }
}

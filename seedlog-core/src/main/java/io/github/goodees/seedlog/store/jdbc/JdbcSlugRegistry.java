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

import io.github.goodees.seedlog.slug.SlugRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.sql.DataSource;
import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.util.Optional;

/**
 * Slug registry relying on unique constraints of the slug table. A concurrent registration of the same slug fails on
 * the constraint and is reported as taken.
 */
public class JdbcSlugRegistry implements SlugRegistry {
    private static final Logger logger = LoggerFactory.getLogger(JdbcSlugRegistry.class);

    private final DataSource ds;
    private final JdbcSchema schema;
    private final TxHandler txHandler;

    public JdbcSlugRegistry(DataSource ds, JdbcSchema schema) {
        this(ds, schema, TxHandler.CONTAINER);
    }

    public JdbcSlugRegistry(DataSource ds, JdbcSchema schema, TxHandler txHandler) {
        this.ds = ds;
        this.schema = schema;
        this.txHandler = txHandler;
    }

    @Override
    public boolean exists(String slug) {
        return entityFor(slug).isPresent();
    }

    @Override
    public Optional<String> slugOf(String entityId) {
        try (Connection connection = ds.getConnection();
                PreparedStatement select = schema.selectSlugByEntity(connection, entityId);
                ResultSet rs = select.executeQuery()) {
            return rs.next() ? Optional.of(schema.readSlug(rs)) : Optional.empty();
        } catch (SQLException e) {
            throw new IllegalStateException("Cannot access storage", e);
        }
    }

    @Override
    public Optional<String> entityFor(String slug) {
        try (Connection connection = ds.getConnection();
                PreparedStatement select = schema.selectSlugBySlug(connection, slug);
                ResultSet rs = select.executeQuery()) {
            return rs.next() ? Optional.of(schema.readSlugEntityId(rs)) : Optional.empty();
        } catch (SQLException e) {
            throw new IllegalStateException("Cannot access storage", e);
        }
    }

    @Override
    public boolean register(String entityId, String slug) {
        Optional<String> current = slugOf(entityId);
        if (current.isPresent()) {
            throw new IllegalStateException("Entity " + entityId + " already has slug " + current.get());
        }
        try (Connection connection = txHandler.enroll(ds.getConnection())) {
            try (PreparedStatement insert = schema.insertSlug(connection, entityId, slug)) {
                insert.executeUpdate();
                txHandler.commit(connection);
                return true;
            } catch (SQLException e) {
                txHandler.rollback(connection);
                if (isConstraintViolation(e)) {
                    logger.debug("Slug {} not registered for {}: {}", slug, entityId, e.getMessage());
                    return false;
                }
                throw e;
            }
        } catch (SQLException e) {
            throw new IllegalStateException("Cannot register slug " + slug, e);
        }
    }

    /**
     * SQLSTATE class 23 covers integrity constraint violations.
     */
    protected boolean isConstraintViolation(SQLException e) {
        return e.getSQLState() != null && e.getSQLState().startsWith("23");
    }

    @Override
    public boolean remove(String entityId) {
        try (Connection connection = txHandler.enroll(ds.getConnection());
                PreparedStatement delete = schema.deleteSlug(connection, entityId)) {
            try {
                int deleted = delete.executeUpdate();
                txHandler.commit(connection);
                return deleted > 0;
            } catch (SQLException | RuntimeException e) {
                txHandler.rollback(connection);
                throw e;
            }
        } catch (SQLException e) {
            throw new IllegalStateException("Cannot remove slug of " + entityId, e);
        }
    }
}

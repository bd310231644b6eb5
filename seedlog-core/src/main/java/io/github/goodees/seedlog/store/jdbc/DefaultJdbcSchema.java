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
import io.github.goodees.seedlog.TransactionRecord;
import io.github.goodees.seedlog.event.EventRecord;
import io.github.goodees.seedlog.musing.IdeaMusing;
import io.github.goodees.seedlog.musing.ImmutableIdeaMusing;
import io.github.goodees.seedlog.musing.ImmutableShownHistoryEntry;
import io.github.goodees.seedlog.musing.ShownHistoryEntry;
import io.github.goodees.seedlog.musing.TemplateType;
import io.github.goodees.seedlog.store.Serialization;

import java.sql.Connection;
import java.sql.Date;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Timestamp;
import java.time.Instant;
import java.time.LocalDate;

/**
 * JDBC schema with a table per entity kind. Following tables are expected to exist, all names optionally prefixed:
 * <ul>
 * <li><em>seed_transaction</em>, <em>tag_transaction</em>, <em>followup_transaction</em>(ID primary key, ENTITY_ID,
 * SEQ auto-increment, TYPE, PAYLOAD, CREATED_AT, AUTOMATION_ID) indexed on (ENTITY_ID, CREATED_AT, SEQ)</li>
 * <li><em>seed_event</em>(ID primary key, ENTITY_ID, SEQ auto-increment, EVENT_TYPE, PATCH, CREATED_AT,
 * AUTOMATION_ID, ENABLED) indexed on (ENTITY_ID, ENABLED, CREATED_AT, SEQ)</li>
 * <li><em>seed_slug</em>(ENTITY_ID primary key, SLUG unique, CREATED_AT)</li>
 * <li><em>idea_musing</em>(ID primary key, SEED_ID, TEMPLATE_TYPE, CONTENT, CREATED_AT, DISMISSED, DISMISSED_AT,
 * COMPLETED, COMPLETED_AT)</li>
 * <li><em>idea_musing_shown</em>(ID primary key, SEED_ID, SHOWN_DATE, CREATED_AT)</li>
 * </ul>
 */
public class DefaultJdbcSchema extends JdbcSchema {
    private static final String TRANSACTION_COLUMNS = "ID, ENTITY_ID, SEQ, TYPE, PAYLOAD, CREATED_AT, AUTOMATION_ID";
    private static final String EVENT_COLUMNS =
            "ID, ENTITY_ID, SEQ, EVENT_TYPE, PATCH, CREATED_AT, AUTOMATION_ID, ENABLED";
    private static final String MUSING_COLUMNS =
            "ID, SEED_ID, TEMPLATE_TYPE, CONTENT, CREATED_AT, DISMISSED, DISMISSED_AT, COMPLETED, COMPLETED_AT";

    private final String prefix;

    public DefaultJdbcSchema() {
        this("");
    }

    public DefaultJdbcSchema(String prefix) {
        this.prefix = prefix;
    }

    protected String getTransactionTable(EntityKind kind) {
        switch (kind) {
            case SEED:
                return prefix + "seed_transaction";
            case TAG:
                return prefix + "tag_transaction";
            case SPROUT_FOLLOWUP:
                return prefix + "followup_transaction";
            default:
                throw new IllegalArgumentException("No table for " + kind);
        }
    }

    protected String getEventTable() {
        return prefix + "seed_event";
    }

    protected String getSlugTable() {
        return prefix + "seed_slug";
    }

    protected String getMusingTable() {
        return prefix + "idea_musing";
    }

    protected String getShownTable() {
        return prefix + "idea_musing_shown";
    }

    @Override
    protected PreparedStatement insertTransaction(Connection connection, EntityKind kind) throws SQLException {
        return connection.prepareStatement("INSERT INTO " + getTransactionTable(kind)
                + " (ID, ENTITY_ID, TYPE, PAYLOAD, CREATED_AT, AUTOMATION_ID) VALUES (?,?,?,?,?,?)");
    }

    @Override
    protected void prepareInsert(PreparedStatement insert, TransactionRecord record, String payload)
            throws SQLException {
        insert.setString(1, record.getId());
        insert.setString(2, record.getEntityId());
        insert.setString(3, record.getType().wireName());
        insert.setString(4, payload);
        insert.setTimestamp(5, new Timestamp(record.getCreatedAt().toEpochMilli()));
        insert.setString(6, record.getAutomationId().orElse(null));
    }

    @Override
    protected PreparedStatement countTransactionsOfType(Connection connection, EntityKind kind, String entityId,
            String type) throws SQLException {
        PreparedStatement st = connection.prepareStatement("SELECT COUNT(*) FROM " + getTransactionTable(kind)
                + " WHERE ENTITY_ID=? AND TYPE=?");
        st.setString(1, entityId);
        st.setString(2, type);
        return st;
    }

    @Override
    protected PreparedStatement selectTransaction(Connection connection, EntityKind kind, String id)
            throws SQLException {
        PreparedStatement st = connection.prepareStatement("SELECT " + TRANSACTION_COLUMNS + " FROM "
                + getTransactionTable(kind) + " WHERE ID=?");
        st.setString(1, id);
        return st;
    }

    @Override
    protected PreparedStatement selectTransactions(Connection connection, EntityKind kind, String entityId)
            throws SQLException {
        PreparedStatement st = connection.prepareStatement("SELECT " + TRANSACTION_COLUMNS + " FROM "
                + getTransactionTable(kind) + " WHERE ENTITY_ID=? ORDER BY CREATED_AT, SEQ");
        st.setString(1, entityId);
        return st;
    }

    @Override
    protected PreparedStatement selectTransactionsByAutomation(Connection connection, EntityKind kind,
            String automationId) throws SQLException {
        PreparedStatement st = connection.prepareStatement("SELECT " + TRANSACTION_COLUMNS + " FROM "
                + getTransactionTable(kind) + " WHERE AUTOMATION_ID=? ORDER BY CREATED_AT, SEQ");
        st.setString(1, automationId);
        return st;
    }

    @Override
    protected PreparedStatement selectEntityIds(Connection connection, EntityKind kind) throws SQLException {
        return connection.prepareStatement("SELECT DISTINCT ENTITY_ID FROM " + getTransactionTable(kind)
                + " ORDER BY ENTITY_ID");
    }

    @Override
    protected PreparedStatement deleteTransactions(Connection connection, EntityKind kind, String entityId)
            throws SQLException {
        PreparedStatement st = connection.prepareStatement("DELETE FROM " + getTransactionTable(kind)
                + " WHERE ENTITY_ID=?");
        st.setString(1, entityId);
        return st;
    }

    @Override
    protected PreparedStatement insertEvent(Connection connection, EventRecord event, String patch)
            throws SQLException {
        PreparedStatement st = connection.prepareStatement("INSERT INTO " + getEventTable()
                + " (ID, ENTITY_ID, EVENT_TYPE, PATCH, CREATED_AT, AUTOMATION_ID, ENABLED) VALUES (?,?,?,?,?,?,?)");
        st.setString(1, event.getId());
        st.setString(2, event.getEntityId());
        st.setString(3, event.getEventType());
        st.setString(4, patch);
        st.setTimestamp(5, new Timestamp(event.getCreatedAt().toEpochMilli()));
        st.setString(6, event.getAutomationId().orElse(null));
        st.setBoolean(7, event.isEnabled());
        return st;
    }

    @Override
    protected PreparedStatement selectEvent(Connection connection, String eventId) throws SQLException {
        PreparedStatement st = connection.prepareStatement("SELECT " + EVENT_COLUMNS + " FROM " + getEventTable()
                + " WHERE ID=?");
        st.setString(1, eventId);
        return st;
    }

    @Override
    protected PreparedStatement selectEvents(Connection connection, String entityId, boolean enabledOnly)
            throws SQLException {
        PreparedStatement st = connection.prepareStatement("SELECT " + EVENT_COLUMNS + " FROM " + getEventTable()
                + " WHERE ENTITY_ID=?" + (enabledOnly ? " AND ENABLED=TRUE" : "") + " ORDER BY CREATED_AT, SEQ");
        st.setString(1, entityId);
        return st;
    }

    @Override
    protected PreparedStatement selectEventsByAutomation(Connection connection, String automationId)
            throws SQLException {
        PreparedStatement st = connection.prepareStatement("SELECT " + EVENT_COLUMNS + " FROM " + getEventTable()
                + " WHERE AUTOMATION_ID=? ORDER BY CREATED_AT, SEQ");
        st.setString(1, automationId);
        return st;
    }

    @Override
    protected PreparedStatement updateEventEnabled(Connection connection, String eventId, boolean enabled)
            throws SQLException {
        PreparedStatement st = connection.prepareStatement("UPDATE " + getEventTable() + " SET ENABLED=? WHERE ID=?");
        st.setBoolean(1, enabled);
        st.setString(2, eventId);
        return st;
    }

    @Override
    protected PreparedStatement deleteEvents(Connection connection, String entityId) throws SQLException {
        PreparedStatement st = connection.prepareStatement("DELETE FROM " + getEventTable() + " WHERE ENTITY_ID=?");
        st.setString(1, entityId);
        return st;
    }

    @Override
    protected String readId(ResultSet rs) throws SQLException {
        return rs.getString(1);
    }

    @Override
    protected String readEntityId(ResultSet rs) throws SQLException {
        return rs.getString(2);
    }

    @Override
    protected long readSequence(ResultSet rs) throws SQLException {
        return rs.getLong(3);
    }

    @Override
    protected String readType(ResultSet rs) throws SQLException {
        return rs.getString(4);
    }

    @Override
    protected String readPayload(ResultSet rs) throws SQLException {
        return rs.getString(5);
    }

    @Override
    protected Instant readCreatedAt(ResultSet rs) throws SQLException {
        return Instant.ofEpochMilli(rs.getTimestamp(6).getTime());
    }

    @Override
    protected String readAutomationId(ResultSet rs) throws SQLException {
        return rs.getString(7);
    }

    @Override
    protected boolean readEnabled(ResultSet rs) throws SQLException {
        return rs.getBoolean(8);
    }

    @Override
    protected PreparedStatement selectSlugBySlug(Connection connection, String slug) throws SQLException {
        PreparedStatement st = connection.prepareStatement("SELECT ENTITY_ID, SLUG FROM " + getSlugTable()
                + " WHERE SLUG=?");
        st.setString(1, slug);
        return st;
    }

    @Override
    protected PreparedStatement selectSlugByEntity(Connection connection, String entityId) throws SQLException {
        PreparedStatement st = connection.prepareStatement("SELECT ENTITY_ID, SLUG FROM " + getSlugTable()
                + " WHERE ENTITY_ID=?");
        st.setString(1, entityId);
        return st;
    }

    @Override
    protected PreparedStatement insertSlug(Connection connection, String entityId, String slug)
            throws SQLException {
        PreparedStatement st = connection.prepareStatement("INSERT INTO " + getSlugTable()
                + " (ENTITY_ID, SLUG, CREATED_AT) VALUES (?,?,?)");
        st.setString(1, entityId);
        st.setString(2, slug);
        st.setTimestamp(3, new Timestamp(System.currentTimeMillis()));
        return st;
    }

    @Override
    protected PreparedStatement deleteSlug(Connection connection, String entityId) throws SQLException {
        PreparedStatement st = connection.prepareStatement("DELETE FROM " + getSlugTable() + " WHERE ENTITY_ID=?");
        st.setString(1, entityId);
        return st;
    }

    @Override
    protected String readSlugEntityId(ResultSet rs) throws SQLException {
        return rs.getString(1);
    }

    @Override
    protected String readSlug(ResultSet rs) throws SQLException {
        return rs.getString(2);
    }

    @Override
    protected PreparedStatement insertMusing(Connection connection, IdeaMusing musing, String content)
            throws SQLException {
        PreparedStatement st = connection.prepareStatement("INSERT INTO " + getMusingTable() + " ("
                + MUSING_COLUMNS + ") VALUES (?,?,?,?,?,?,?,?,?)");
        st.setString(1, musing.getId());
        st.setString(2, musing.getSeedId());
        st.setString(3, musing.getTemplateType().wireName());
        st.setString(4, content);
        st.setTimestamp(5, new Timestamp(musing.getCreatedAt().toEpochMilli()));
        st.setBoolean(6, musing.isDismissed());
        st.setTimestamp(7, timestamp(musing.getDismissedAt().orElse(null)));
        st.setBoolean(8, musing.isCompleted());
        st.setTimestamp(9, timestamp(musing.getCompletedAt().orElse(null)));
        return st;
    }

    @Override
    protected PreparedStatement selectMusing(Connection connection, String musingId) throws SQLException {
        PreparedStatement st = connection.prepareStatement("SELECT " + MUSING_COLUMNS + " FROM " + getMusingTable()
                + " WHERE ID=?");
        st.setString(1, musingId);
        return st;
    }

    @Override
    protected PreparedStatement selectMusingsBySeed(Connection connection, String seedId) throws SQLException {
        PreparedStatement st = connection.prepareStatement("SELECT " + MUSING_COLUMNS + " FROM " + getMusingTable()
                + " WHERE SEED_ID=? ORDER BY CREATED_AT, ID");
        st.setString(1, seedId);
        return st;
    }

    @Override
    protected PreparedStatement selectMusingsCreatedBetween(Connection connection, Instant from, Instant to)
            throws SQLException {
        PreparedStatement st = connection.prepareStatement("SELECT " + MUSING_COLUMNS + " FROM " + getMusingTable()
                + " WHERE CREATED_AT>=? AND CREATED_AT<? ORDER BY CREATED_AT, ID");
        st.setTimestamp(1, new Timestamp(from.toEpochMilli()));
        st.setTimestamp(2, new Timestamp(to.toEpochMilli()));
        return st;
    }

    @Override
    protected PreparedStatement updateMusingTerminal(Connection connection, String musingId, boolean completed,
            Instant at) throws SQLException {
        String column = completed ? "COMPLETED" : "DISMISSED";
        PreparedStatement st = connection.prepareStatement("UPDATE " + getMusingTable() + " SET " + column
                + "=TRUE, " + column + "_AT=? WHERE ID=? AND DISMISSED=FALSE AND COMPLETED=FALSE");
        st.setTimestamp(1, timestamp(at));
        st.setString(2, musingId);
        return st;
    }

    @Override
    protected PreparedStatement deleteMusings(Connection connection, String seedId) throws SQLException {
        PreparedStatement st = connection.prepareStatement("DELETE FROM " + getMusingTable() + " WHERE SEED_ID=?");
        st.setString(1, seedId);
        return st;
    }

    @Override
    protected IdeaMusing readMusing(ResultSet rs, Serialization<JsonNode> contentSerialization)
            throws SQLException {
        String templateType = rs.getString(3);
        TemplateType type = TemplateType.of(templateType)
                .orElseThrow(() -> new SQLException("Unknown template type " + templateType));
        JsonNode content = contentSerialization.deserialize(rs.getString(4), templateType);
        if (content == null) {
            throw new SQLException("Unreadable content of musing " + rs.getString(1));
        }
        return ImmutableIdeaMusing.builder()
                .id(rs.getString(1))
                .seedId(rs.getString(2))
                .templateType(type)
                .content(content)
                .createdAt(instant(rs.getTimestamp(5)))
                .dismissed(rs.getBoolean(6))
                .dismissedAt(instant(rs.getTimestamp(7)))
                .completed(rs.getBoolean(8))
                .completedAt(instant(rs.getTimestamp(9)))
                .build();
    }

    @Override
    protected PreparedStatement insertShown(Connection connection, ShownHistoryEntry entry) throws SQLException {
        PreparedStatement st = connection.prepareStatement("INSERT INTO " + getShownTable()
                + " (ID, SEED_ID, SHOWN_DATE, CREATED_AT) VALUES (?,?,?,?)");
        st.setString(1, entry.getId());
        st.setString(2, entry.getSeedId());
        st.setDate(3, Date.valueOf(entry.getShownDate()));
        st.setTimestamp(4, timestamp(entry.getCreatedAt()));
        return st;
    }

    @Override
    protected PreparedStatement selectShown(Connection connection, String seedId) throws SQLException {
        PreparedStatement st = connection.prepareStatement("SELECT ID, SEED_ID, SHOWN_DATE, CREATED_AT FROM "
                + getShownTable() + " WHERE SEED_ID=? ORDER BY SHOWN_DATE, CREATED_AT");
        st.setString(1, seedId);
        return st;
    }

    @Override
    protected PreparedStatement selectSeedsShownSince(Connection connection, LocalDate since) throws SQLException {
        PreparedStatement st = connection.prepareStatement("SELECT DISTINCT SEED_ID FROM " + getShownTable()
                + " WHERE SHOWN_DATE >= ?");
        st.setDate(1, Date.valueOf(since));
        return st;
    }

    @Override
    protected ShownHistoryEntry readShown(ResultSet rs) throws SQLException {
        return ImmutableShownHistoryEntry.builder()
                .id(rs.getString(1))
                .seedId(rs.getString(2))
                .shownDate(rs.getDate(3).toLocalDate())
                .createdAt(instant(rs.getTimestamp(4)))
                .build();
    }

    private static Timestamp timestamp(Instant instant) {
        return instant == null ? null : new Timestamp(instant.toEpochMilli());
    }

    private static Instant instant(Timestamp timestamp) {
        return timestamp == null ? null : Instant.ofEpochMilli(timestamp.getTime());
    }
}

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
import io.github.goodees.seedlog.musing.ShownHistoryEntry;
import io.github.goodees.seedlog.store.Serialization;

import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.time.Instant;
import java.time.LocalDate;

/**
 * SQL dialect and table layout used by the JDBC stores. Statements are created by the schema and executed by the
 * stores, so that a subclass may adapt queries without touching the store logic.
 *
 * <p>Queries returning transactions and events deliver columns in the order ID, ENTITY_ID, SEQ, TYPE, PAYLOAD,
 * CREATED_AT, AUTOMATION_ID, with event queries adding ENABLED as the eighth column.
 */
public abstract class JdbcSchema {

    // transactions

    protected abstract PreparedStatement insertTransaction(Connection connection, EntityKind kind)
            throws SQLException;

    protected abstract void prepareInsert(PreparedStatement insert, TransactionRecord record, String payload)
            throws SQLException;

    protected abstract PreparedStatement countTransactionsOfType(Connection connection, EntityKind kind,
            String entityId, String type) throws SQLException;

    protected abstract PreparedStatement selectTransaction(Connection connection, EntityKind kind, String id)
            throws SQLException;

    protected abstract PreparedStatement selectTransactions(Connection connection, EntityKind kind, String entityId)
            throws SQLException;

    protected abstract PreparedStatement selectTransactionsByAutomation(Connection connection, EntityKind kind,
            String automationId) throws SQLException;

    protected abstract PreparedStatement selectEntityIds(Connection connection, EntityKind kind) throws SQLException;

    protected abstract PreparedStatement deleteTransactions(Connection connection, EntityKind kind, String entityId)
            throws SQLException;

    // events

    protected abstract PreparedStatement insertEvent(Connection connection, EventRecord event, String patch)
            throws SQLException;

    protected abstract PreparedStatement selectEvent(Connection connection, String eventId) throws SQLException;

    /**
     * Events of an entity in replay order. Enabled-only lookup is the hot path of views and should be backed by an
     * index on (ENTITY_ID, ENABLED, CREATED_AT, SEQ).
     */
    protected abstract PreparedStatement selectEvents(Connection connection, String entityId, boolean enabledOnly)
            throws SQLException;

    protected abstract PreparedStatement selectEventsByAutomation(Connection connection, String automationId)
            throws SQLException;

    protected abstract PreparedStatement updateEventEnabled(Connection connection, String eventId, boolean enabled)
            throws SQLException;

    protected abstract PreparedStatement deleteEvents(Connection connection, String entityId) throws SQLException;

    // common columns of transactions and events

    protected abstract String readId(ResultSet rs) throws SQLException;

    protected abstract String readEntityId(ResultSet rs) throws SQLException;

    protected abstract long readSequence(ResultSet rs) throws SQLException;

    protected abstract String readType(ResultSet rs) throws SQLException;

    protected abstract String readPayload(ResultSet rs) throws SQLException;

    protected abstract Instant readCreatedAt(ResultSet rs) throws SQLException;

    protected abstract String readAutomationId(ResultSet rs) throws SQLException;

    protected abstract boolean readEnabled(ResultSet rs) throws SQLException;

    // slugs

    protected abstract PreparedStatement selectSlugBySlug(Connection connection, String slug) throws SQLException;

    protected abstract PreparedStatement selectSlugByEntity(Connection connection, String entityId)
            throws SQLException;

    protected abstract PreparedStatement insertSlug(Connection connection, String entityId, String slug)
            throws SQLException;

    protected abstract PreparedStatement deleteSlug(Connection connection, String entityId) throws SQLException;

    protected abstract String readSlugEntityId(ResultSet rs) throws SQLException;

    protected abstract String readSlug(ResultSet rs) throws SQLException;

    // musings

    protected abstract PreparedStatement insertMusing(Connection connection, IdeaMusing musing, String content)
            throws SQLException;

    protected abstract PreparedStatement selectMusing(Connection connection, String musingId) throws SQLException;

    protected abstract PreparedStatement selectMusingsBySeed(Connection connection, String seedId)
            throws SQLException;

    /**
     * Musings with creation time in {@code [from, to)}, oldest first.
     */
    protected abstract PreparedStatement selectMusingsCreatedBetween(Connection connection, Instant from, Instant to)
            throws SQLException;

    /**
     * Move a musing to a terminal state, affecting no row when it already is terminal.
     */
    protected abstract PreparedStatement updateMusingTerminal(Connection connection, String musingId,
            boolean completed, Instant at) throws SQLException;

    protected abstract PreparedStatement deleteMusings(Connection connection, String seedId) throws SQLException;

    protected abstract IdeaMusing readMusing(ResultSet rs, Serialization<JsonNode> contentSerialization)
            throws SQLException;

    protected abstract PreparedStatement insertShown(Connection connection, ShownHistoryEntry entry)
            throws SQLException;

    protected abstract PreparedStatement selectShown(Connection connection, String seedId) throws SQLException;

    protected abstract PreparedStatement selectSeedsShownSince(Connection connection, LocalDate since)
            throws SQLException;

    protected abstract ShownHistoryEntry readShown(ResultSet rs) throws SQLException;
}

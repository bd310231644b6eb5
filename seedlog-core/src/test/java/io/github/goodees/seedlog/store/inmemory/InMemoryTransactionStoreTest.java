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

import com.fasterxml.jackson.databind.node.ObjectNode;
import io.github.goodees.seedlog.EntityKind;
import io.github.goodees.seedlog.TestClock;
import io.github.goodees.seedlog.TransactionRecord;
import io.github.goodees.seedlog.TransactionType;
import io.github.goodees.seedlog.ValidationException;
import io.github.goodees.seedlog.store.TransactionLog;
import org.junit.Before;
import org.junit.Rule;
import org.junit.Test;
import org.junit.rules.TestName;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

import static io.github.goodees.seedlog.Transactions.content;
import static io.github.goodees.seedlog.Transactions.payload;
import static io.github.goodees.seedlog.Transactions.tag;
import static java.util.stream.Collectors.toList;
import static org.hamcrest.Matchers.contains;
import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertThat;
import static org.junit.Assert.assertTrue;
import static org.junit.Assert.fail;

public class InMemoryTransactionStoreTest {
    @Rule
    public TestName testName = new TestName();

    private TestClock clock;
    private InMemoryTransactionStore store;

    @Before
    public void setUp() {
        clock = TestClock.at("2024-05-01T10:00:00Z");
        store = new InMemoryTransactionStore(clock);
    }

    private String name() {
        return testName.getMethodName();
    }

    private List<TransactionRecord> read(String entityId) {
        List<TransactionRecord> result = new ArrayList<>();
        try (TransactionLog.StoredTransactions stored = store.readTransactions(EntityKind.SEED, entityId)) {
            stored.foreach(result::add);
        }
        return result;
    }

    @Test
    public void append_assigns_identity_and_time() throws Exception {
        TransactionRecord record = store.append(name(), TransactionType.CREATE_SEED, content("idea"), "auto-1");
        assertEquals(name(), record.getEntityId());
        assertEquals(clock.instant(), record.getCreatedAt());
        assertEquals("auto-1", record.getAutomationId().get());
        assertTrue(record.getSequence() > 0);
    }

    @Test
    public void transaction_before_creation_is_rejected() throws Exception {
        try {
            store.append(name(), TransactionType.EDIT_CONTENT, content("edit"));
            fail("Edit of nonexistent seed should be rejected");
        } catch (ValidationException e) {
            assertEquals(Collections.emptyList(), store.readEntityIds(EntityKind.SEED));
        }
    }

    @Test
    public void second_creation_is_rejected() throws Exception {
        store.append(name(), TransactionType.CREATE_SEED, content("idea"));
        try {
            store.append(name(), TransactionType.CREATE_SEED, content("again"));
            fail("Second creation should be rejected");
        } catch (ValidationException e) {
            assertEquals(1, read(name()).size());
        }
    }

    @Test
    public void invalid_payload_is_not_stored() throws Exception {
        store.append(name(), TransactionType.CREATE_SEED, content("idea"));
        try {
            store.append(name(), TransactionType.ADD_TAG, content("no tag here"));
            fail("Malformed payload should be rejected");
        } catch (ValidationException e) {
            assertEquals(1, read(name()).size());
        }
    }

    @Test
    public void wire_name_append_resolves_type() throws Exception {
        TransactionRecord record = store.append(EntityKind.TAG, name(), "creation",
                payload("name", "work"), null);
        assertEquals(TransactionType.TAG_CREATION, record.getType());
        try {
            store.append(EntityKind.TAG, name(), "create_seed", content("x"), null);
            fail("Seed type is not a tag type");
        } catch (ValidationException e) {
            // expected
        }
    }

    @Test
    public void equal_timestamps_keep_insertion_order() throws Exception {
        store.append(name(), TransactionType.CREATE_SEED, content("idea"));
        store.append(name(), TransactionType.ADD_TAG, tag("t1", "one"));
        store.append(name(), TransactionType.ADD_TAG, tag("t2", "two"));
        List<TransactionType> types = read(name()).stream().map(TransactionRecord::getType).collect(toList());
        assertThat(types, contains(TransactionType.CREATE_SEED, TransactionType.ADD_TAG, TransactionType.ADD_TAG));
        assertEquals("t2", read(name()).get(2).getPayload().get("tag_id").asText());
    }

    @Test
    public void transactions_are_read_by_creation_time() throws Exception {
        store.append(name(), TransactionType.CREATE_SEED, content("idea"));
        clock.advance(Duration.ofMinutes(5));
        store.append(name(), TransactionType.EDIT_CONTENT, content("late"));
        clock.advance(Duration.ofMinutes(-2));
        store.append(name(), TransactionType.EDIT_CONTENT, content("early"));
        List<String> contents = read(name()).stream().map(t -> t.getPayload().get("content").asText())
                .collect(toList());
        assertThat(contents, contains("idea", "early", "late"));
    }

    @Test
    public void stored_payload_is_detached_from_caller() throws Exception {
        ObjectNode payload = content("idea");
        store.append(name(), TransactionType.CREATE_SEED, payload);
        payload.put("content", "changed");
        assertEquals("idea", read(name()).get(0).getPayload().get("content").asText());
    }

    @Test
    public void reduction_can_stop_early() throws Exception {
        store.append(name(), TransactionType.CREATE_SEED, content("idea"));
        store.append(name(), TransactionType.EDIT_CONTENT, content("a"));
        store.append(name(), TransactionType.EDIT_CONTENT, content("b"));
        try (TransactionLog.StoredTransactions stored = store.readTransactions(EntityKind.SEED, name())) {
            int count = stored.reduce(0, (c, tx) -> {
                if (tx.getType() == TransactionType.EDIT_CONTENT) {
                    stored.stop();
                }
                return c + 1;
            });
            assertEquals(2, count);
        }
    }

    @Test
    public void automation_transactions_are_listed_across_kinds() throws Exception {
        store.append(name(), TransactionType.CREATE_SEED, content("idea"), "auto");
        store.append(name(), TransactionType.EDIT_CONTENT, content("manual"));
        store.append("tag-" + name(), TransactionType.TAG_CREATION,
                payload("name", "work"), "auto");
        List<TransactionRecord> automated = store.readByAutomation("auto");
        assertEquals(2, automated.size());
        assertEquals(EntityKind.TAG, automated.get(1).getKind());
    }

    @Test
    public void deleting_entity_removes_its_log() throws Exception {
        store.append(name(), TransactionType.CREATE_SEED, content("idea"));
        store.append(name(), TransactionType.EDIT_CONTENT, content("edit"));
        assertEquals(2, store.deleteEntity(EntityKind.SEED, name()));
        assertEquals(0, read(name()).size());
        assertEquals(0, store.deleteEntity(EntityKind.SEED, name()));
    }
}

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

import io.github.goodees.seedlog.IntegrityException;
import io.github.goodees.seedlog.TestClock;
import io.github.goodees.seedlog.TransactionType;
import io.github.goodees.seedlog.store.inmemory.UncheckedTransactionStore;
import org.junit.Before;
import org.junit.Rule;
import org.junit.Test;
import org.junit.rules.TestName;

import java.time.Duration;
import java.time.Instant;

import static io.github.goodees.seedlog.Transactions.category;
import static io.github.goodees.seedlog.Transactions.content;
import static io.github.goodees.seedlog.Transactions.payload;
import static io.github.goodees.seedlog.Transactions.record;
import static io.github.goodees.seedlog.Transactions.tag;
import static org.hamcrest.Matchers.contains;
import static org.hamcrest.Matchers.empty;
import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertThat;
import static org.junit.Assert.fail;

public class SeedProjectorTest {
    @Rule
    public TestName testName = new TestName();

    private TestClock clock;
    private UncheckedTransactionStore store;
    private SeedProjector projector;

    @Before
    public void setUp() {
        clock = TestClock.at("2024-05-01T10:00:00Z");
        store = new UncheckedTransactionStore(clock);
        projector = new SeedProjector(store);
    }

    private String name() {
        return testName.getMethodName();
    }

    private void assertFault(IntegrityException.Fault expected, String seedId) {
        try {
            projector.project(seedId);
            fail("Projection should fail with " + expected);
        } catch (IntegrityException e) {
            assertEquals(expected, e.getFault());
            assertEquals(seedId, e.getEntityId());
        }
    }

    @Test
    public void created_seed_has_content_and_no_memberships() throws Exception {
        store.append(name(), TransactionType.CREATE_SEED, content("Grow tomatoes"));
        SeedState state = projector.project(name());
        assertEquals("Grow tomatoes", state.getContent());
        assertEquals(state.getCreatedAt(), state.getUpdatedAt());
        assertThat(state.getTags(), empty());
        assertThat(state.getCategories(), empty());
    }

    @Test
    public void replay_is_deterministic() throws Exception {
        store.append(name(), TransactionType.CREATE_SEED, content("idea"));
        store.append(name(), TransactionType.ADD_TAG, tag("t1", "garden"));
        store.append(name(), TransactionType.EDIT_CONTENT, content("better idea"));
        assertEquals(projector.project(name()), projector.project(name()));
    }

    @Test
    public void tag_added_then_removed_is_absent() throws Exception {
        store.append(name(), TransactionType.CREATE_SEED, content("idea"));
        store.append(name(), TransactionType.ADD_TAG, tag("t1", "garden"));
        store.append(name(), TransactionType.ADD_TAG, tag("t2", "food"));
        store.append(name(), TransactionType.REMOVE_TAG, payload("tag_id", "t1"));
        SeedState state = projector.project(name());
        assertFalse(state.hasTag("t1"));
        assertThat(state.getTags(), contains((TagRef) ImmutableTagRef.of("t2", "food")));
    }

    @Test
    public void adding_same_tag_twice_keeps_one() throws Exception {
        store.append(name(), TransactionType.CREATE_SEED, content("idea"));
        store.append(name(), TransactionType.ADD_TAG, tag("t1", "garden"));
        store.append(name(), TransactionType.ADD_TAG, tag("t1", "garden"));
        assertEquals(1, projector.project(name()).getTags().size());
    }

    @Test
    public void removing_absent_tag_changes_nothing_but_time() throws Exception {
        store.append(name(), TransactionType.CREATE_SEED, content("idea"));
        clock.advance(Duration.ofMinutes(1));
        store.append(name(), TransactionType.REMOVE_TAG, payload("tag_id", "nope"));
        SeedState state = projector.project(name());
        assertThat(state.getTags(), empty());
        assertEquals(clock.instant(), state.getUpdatedAt());
    }

    @Test
    public void categories_accumulate_and_set_replaces_them() throws Exception {
        store.append(name(), TransactionType.CREATE_SEED, content("idea"));
        store.append(name(), TransactionType.ADD_CATEGORY, category("c1", "Garden", "home/garden"));
        store.append(name(), TransactionType.ADD_CATEGORY, category("c2", "Food", "home/food"));
        assertEquals(2, projector.project(name()).getCategories().size());

        store.append(name(), TransactionType.SET_CATEGORY, category("c3", "Work", "work"));
        assertThat(projector.project(name()).getCategories(), contains(
                (CategoryRef) ImmutableCategoryRef.of("c3", "Work", "work")));

        store.append(name(), TransactionType.REMOVE_CATEGORY, payload("category_id", "c3"));
        assertThat(projector.project(name()).getCategories(), empty());
    }

    @Test
    public void followups_and_sprouts_are_collected_once() throws Exception {
        store.append(name(), TransactionType.CREATE_SEED, content("idea"));
        store.append(name(), TransactionType.ADD_FOLLOWUP, payload("followup_id", "f1"));
        store.append(name(), TransactionType.ADD_FOLLOWUP, payload("followup_id", "f1"));
        store.append(name(), TransactionType.ADD_SPROUT, payload("sprout_id", "s1"));
        SeedState state = projector.project(name());
        assertThat(state.getFollowupIds(), contains("f1"));
        assertThat(state.getSproutIds(), contains("s1"));
    }

    @Test
    public void empty_log_is_missing_creation() {
        assertFault(IntegrityException.Fault.MISSING_CREATION, name());
    }

    @Test
    public void log_without_creation_is_missing_creation() {
        store.insertUnchecked(record(name(), TransactionType.EDIT_CONTENT, content("x"), clock.instant(), 1));
        assertFault(IntegrityException.Fault.MISSING_CREATION, name());
    }

    @Test
    public void creation_after_other_transaction_is_detected() {
        Instant t = clock.instant();
        store.insertUnchecked(record(name(), TransactionType.EDIT_CONTENT, content("x"), t, 1));
        store.insertUnchecked(record(name(), TransactionType.CREATE_SEED, content("idea"), t.plusSeconds(1), 2));
        assertFault(IntegrityException.Fault.CREATION_NOT_FIRST, name());
    }

    @Test
    public void duplicate_creation_is_detected() {
        Instant t = clock.instant();
        store.insertUnchecked(record(name(), TransactionType.CREATE_SEED, content("one"), t, 1));
        store.insertUnchecked(record(name(), TransactionType.CREATE_SEED, content("two"), t, 2));
        assertFault(IntegrityException.Fault.DUPLICATE_CREATION, name());
    }

    @Test
    public void malformed_creation_is_detected() {
        store.insertUnchecked(record(name(), TransactionType.CREATE_SEED, payload("text", "idea"), clock.instant(),
                1));
        assertFault(IntegrityException.Fault.INVALID_CREATION, name());
    }

    @Test
    public void malformed_transaction_is_skipped() throws Exception {
        Instant t = clock.instant();
        store.insertUnchecked(record(name(), TransactionType.CREATE_SEED, content("idea"), t, 1));
        store.insertUnchecked(record(name(), TransactionType.ADD_TAG, payload("tag_id", "t1"), t, 2));
        store.insertUnchecked(record(name(), TransactionType.EDIT_CONTENT, content("edited"), t, 3));
        SeedState state = projector.project(name());
        assertThat(state.getTags(), empty());
        assertEquals("edited", state.getContent());
    }

    @Test
    public void invalid_seed_is_excluded_from_try_project() {
        store.insertUnchecked(record(name(), TransactionType.EDIT_CONTENT, content("x"), clock.instant(), 1));
        assertFalse(projector.tryProject(name()).isPresent());
    }
}

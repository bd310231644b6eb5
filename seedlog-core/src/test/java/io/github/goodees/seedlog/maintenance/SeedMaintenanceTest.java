package io.github.goodees.seedlog.maintenance;

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
import io.github.goodees.seedlog.Json;
import io.github.goodees.seedlog.TestClock;
import io.github.goodees.seedlog.TransactionType;
import io.github.goodees.seedlog.config.SeedlogConfiguration;
import io.github.goodees.seedlog.musing.ImmutableIdeaMusing;
import io.github.goodees.seedlog.musing.TemplateType;
import io.github.goodees.seedlog.patch.JsonPatch;
import io.github.goodees.seedlog.slug.SlugGenerator;
import io.github.goodees.seedlog.store.inmemory.InMemoryEventStore;
import io.github.goodees.seedlog.store.inmemory.InMemoryMusingStore;
import io.github.goodees.seedlog.store.inmemory.InMemorySlugRegistry;
import io.github.goodees.seedlog.store.inmemory.UncheckedTransactionStore;
import org.junit.Before;
import org.junit.Test;

import java.time.Instant;
import java.util.Map;

import static io.github.goodees.seedlog.Transactions.content;
import static io.github.goodees.seedlog.Transactions.record;
import static io.github.goodees.seedlog.Transactions.tag;
import static org.hamcrest.Matchers.empty;
import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertThat;
import static org.junit.Assert.assertTrue;

public class SeedMaintenanceTest {
    private static final Instant EARLY = Instant.parse("2024-04-01T00:00:00Z");

    private UncheckedTransactionStore transactions;
    private InMemoryEventStore events;
    private InMemoryMusingStore musings;
    private InMemorySlugRegistry slugs;
    private SeedMaintenance maintenance;

    @Before
    public void setUp() throws Exception {
        TestClock clock = TestClock.at("2024-05-01T08:00:00Z");
        transactions = new UncheckedTransactionStore(clock);
        events = new InMemoryEventStore(SeedlogConfiguration.DEFAULTS, clock);
        musings = new InMemoryMusingStore();
        slugs = new InMemorySlugRegistry();
        maintenance = new SeedMaintenance(transactions, transactions, events, musings, slugs,
                new SlugGenerator(slugs));

        transactions.append("valid01-seed", TransactionType.CREATE_SEED, content("Valid seed"));
        transactions.insertUnchecked(record("orphan1-seed", TransactionType.ADD_TAG, tag("t1", "x"), EARLY, 100));
        transactions.insertUnchecked(record("twice01-seed", TransactionType.CREATE_SEED, content("one"), EARLY, 101));
        transactions.insertUnchecked(record("twice01-seed", TransactionType.CREATE_SEED, content("two"), EARLY, 102));
    }

    @Test
    public void audit_reports_invalid_seeds_only() {
        Map<String, IntegrityException.Fault> faults = maintenance.audit();
        assertEquals(2, faults.size());
        assertEquals(IntegrityException.Fault.MISSING_CREATION, faults.get("orphan1-seed"));
        assertEquals(IntegrityException.Fault.DUPLICATE_CREATION, faults.get("twice01-seed"));
    }

    @Test
    public void purge_removes_everything_belonging_to_invalid_seeds() throws Exception {
        events.append("orphan1-seed", "note", JsonPatch.fromJson(Json.parse(
                "[{\"op\":\"add\",\"path\":\"/metadata/x\",\"value\":1}]")), null);
        musings.insert(ImmutableIdeaMusing.builder()
                .id("m1")
                .seedId("orphan1-seed")
                .templateType(TemplateType.MARKDOWN)
                .content(Json.parse("{\"markdown\":\"hi\"}"))
                .createdAt(EARLY)
                .build());
        slugs.register("orphan1-seed", "orphan1/x");

        Map<String, IntegrityException.Fault> purged = maintenance.purgeInvalid();

        assertEquals(2, purged.size());
        assertFalse(transactions.readEntityIds(EntityKind.SEED).contains("orphan1-seed"));
        assertThat(events.readAll("orphan1-seed"), empty());
        assertThat(musings.findBySeed("orphan1-seed"), empty());
        assertFalse(slugs.slugOf("orphan1-seed").isPresent());
        assertTrue(maintenance.audit().isEmpty());
    }

    @Test
    public void backfill_assigns_slugs_to_valid_seeds_without_one() throws Exception {
        transactions.append("slugged-seed", TransactionType.CREATE_SEED, content("Already named"));
        slugs.register("slugged-seed", "slugged/custom");

        Map<String, String> assigned = maintenance.backfillSlugs();

        assertEquals(1, assigned.size());
        assertEquals("valid01/valid-seed", assigned.get("valid01-seed"));
        assertEquals("slugged/custom", slugs.slugOf("slugged-seed").get());
        assertFalse(slugs.slugOf("orphan1-seed").isPresent());
        assertTrue(maintenance.backfillSlugs().isEmpty());
    }
}

package io.github.goodees.seedlog.view;

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

import io.github.goodees.seedlog.Json;
import io.github.goodees.seedlog.TestClock;
import io.github.goodees.seedlog.TransactionType;
import io.github.goodees.seedlog.config.SeedlogConfiguration;
import io.github.goodees.seedlog.event.EventEngine;
import io.github.goodees.seedlog.event.EventRecord;
import io.github.goodees.seedlog.patch.JsonPatch;
import io.github.goodees.seedlog.projection.SeedProjector;
import io.github.goodees.seedlog.store.inmemory.InMemoryEventStore;
import io.github.goodees.seedlog.store.inmemory.InMemorySlugRegistry;
import io.github.goodees.seedlog.store.inmemory.UncheckedTransactionStore;
import org.junit.Before;
import org.junit.Rule;
import org.junit.Test;
import org.junit.rules.TestName;

import java.time.Instant;
import java.util.Arrays;

import static io.github.goodees.seedlog.Transactions.content;
import static io.github.goodees.seedlog.Transactions.record;
import static io.github.goodees.seedlog.Transactions.tag;
import static java.util.stream.Collectors.toList;
import static org.hamcrest.Matchers.contains;
import static org.hamcrest.Matchers.empty;
import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertThat;
import static org.junit.Assert.assertTrue;

public class SeedViewsTest {
    @Rule
    public TestName testName = new TestName();

    private UncheckedTransactionStore transactions;
    private InMemoryEventStore events;
    private InMemorySlugRegistry slugs;
    private SeedViews views;

    @Before
    public void setUp() {
        TestClock clock = TestClock.at("2024-05-01T08:00:00Z");
        transactions = new UncheckedTransactionStore(clock);
        events = new InMemoryEventStore(SeedlogConfiguration.DEFAULTS, clock);
        slugs = new InMemorySlugRegistry();
        views = new SeedViews(new SeedProjector(transactions), events, new EventEngine(), slugs);
    }

    private String name() {
        return testName.getMethodName();
    }

    private static JsonPatch patch(String json) throws Exception {
        return JsonPatch.fromJson(Json.parse(json));
    }

    @Test
    public void view_without_events_is_the_projection_tree() throws Exception {
        transactions.append(name(), TransactionType.CREATE_SEED, content("Plant garlic"));
        transactions.append(name(), TransactionType.ADD_TAG, tag("t1", "garden"));

        SeedView view = views.find(name()).get();
        assertEquals("Plant garlic", view.getView().getState().at("/seed/content").asText());
        assertEquals("garden", view.getView().getState().at("/tags/0/name").asText());
        assertTrue(view.getView().getState().at("/metadata").isObject());
        assertTrue(view.getView().isClean());
        assertFalse(view.getSlug().isPresent());
    }

    @Test
    public void enabled_events_overlay_the_projection() throws Exception {
        transactions.append(name(), TransactionType.CREATE_SEED, content("Plant garlic"));
        EventRecord rename = events.append(name(), "rename", patch(
                "[{\"op\":\"replace\",\"path\":\"/seed/content\",\"value\":\"Plant onions\"}]"), null);
        events.append(name(), "annotate", patch(
                "[{\"op\":\"add\",\"path\":\"/metadata/mood\",\"value\":\"hopeful\"}]"), null);

        SeedView view = views.find(name()).get();
        assertEquals("Plant onions", view.getView().getState().at("/seed/content").asText());
        assertEquals("hopeful", view.getView().getState().at("/metadata/mood").asText());
        assertEquals("Plant garlic", view.getProjection().getContent());

        events.setEnabled(rename.getId(), false);
        assertEquals("Plant garlic", views.find(name()).get().getView().getState().at("/seed/content").asText());
    }

    @Test
    public void failing_event_is_reported_and_skipped() throws Exception {
        transactions.append(name(), TransactionType.CREATE_SEED, content("Plant garlic"));
        EventRecord guard = events.append(name(), "guard", patch(
                "[{\"op\":\"test\",\"path\":\"/seed/content\",\"value\":\"Something else\"},"
                        + "{\"op\":\"add\",\"path\":\"/metadata/checked\",\"value\":true}]"), null);
        EventRecord note = events.append(name(), "note", patch(
                "[{\"op\":\"add\",\"path\":\"/metadata/note\",\"value\":\"n\"}]"), null);

        SeedView view = views.find(name()).get();
        assertThat(view.getView().getSkippedEvents().stream().map(s -> s.getEventId()).collect(toList()),
                contains(guard.getId()));
        assertThat(view.getView().getAppliedEventIds(), contains(note.getId()));
        assertTrue(view.getView().getState().at("/metadata/checked").isMissingNode());
    }

    @Test
    public void seed_is_found_by_slug() throws Exception {
        transactions.append(name(), TransactionType.CREATE_SEED, content("Plant garlic"));
        slugs.register(name(), "seed_is/plant-garlic");

        SeedView view = views.findBySlug("seed_is/plant-garlic").get();
        assertEquals(name(), view.getSeedId());
        assertEquals("seed_is/plant-garlic", view.getSlug().get());
        assertFalse(views.findBySlug("seed_is/other").isPresent());
    }

    @Test
    public void invalid_seeds_are_left_out_of_lists() throws Exception {
        transactions.append("good", TransactionType.CREATE_SEED, content("fine"));
        transactions.insertUnchecked(record("broken", TransactionType.ADD_TAG, tag("t1", "x"),
                Instant.parse("2024-05-01T07:00:00Z"), 99));

        assertThat(views.list(Arrays.asList("broken", "good", "missing")).stream().map(SeedView::getSeedId)
                .collect(toList()), contains("good"));
        assertFalse(views.find("broken").isPresent());
        assertThat(views.list(Arrays.<String>asList()), empty());
    }
}

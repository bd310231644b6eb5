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

import io.github.goodees.seedlog.Json;
import io.github.goodees.seedlog.musing.IdeaMusing;
import io.github.goodees.seedlog.musing.ImmutableIdeaMusing;
import io.github.goodees.seedlog.musing.TemplateType;
import org.junit.Before;
import org.junit.Test;

import java.time.Instant;
import java.time.LocalDate;

import static java.util.stream.Collectors.toList;
import static org.hamcrest.Matchers.contains;
import static org.hamcrest.Matchers.containsInAnyOrder;
import static org.hamcrest.Matchers.empty;
import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertThat;
import static org.junit.Assert.assertTrue;

public class InMemoryMusingStoreTest {
    private static final Instant T0 = Instant.parse("2024-05-01T10:00:00Z");

    private InMemoryMusingStore store;

    @Before
    public void setUp() {
        store = new InMemoryMusingStore();
    }

    private static IdeaMusing musing(String id, String seedId, Instant createdAt) {
        return ImmutableIdeaMusing.builder()
                .id(id)
                .seedId(seedId)
                .templateType(TemplateType.MARKDOWN)
                .content(Json.parse("{\"markdown\":\"" + id + "\"}"))
                .createdAt(createdAt)
                .build();
    }

    @Test
    public void musings_of_seed_are_oldest_first() {
        store.insert(musing("b", "s1", T0.plusSeconds(5)));
        store.insert(musing("a", "s1", T0));
        store.insert(musing("c", "s2", T0));
        assertThat(store.findBySeed("s1").stream().map(IdeaMusing::getId).collect(toList()), contains("a", "b"));
    }

    @Test(expected = IllegalArgumentException.class)
    public void duplicate_id_is_rejected() {
        store.insert(musing("a", "s1", T0));
        store.insert(musing("a", "s1", T0));
    }

    @Test
    public void terminal_states_are_exclusive() {
        store.insert(musing("a", "s1", T0));
        IdeaMusing completed = store.markCompleted("a", T0.plusSeconds(1)).get();
        assertTrue(completed.isCompleted());
        assertEquals(T0.plusSeconds(1), completed.getCompletedAt().get());

        IdeaMusing after = store.markDismissed("a", T0.plusSeconds(2)).get();
        assertFalse(after.isDismissed());
        assertFalse(after.getDismissedAt().isPresent());
        assertFalse(store.markDismissed("missing", T0).isPresent());
    }

    @Test
    public void shown_history_survives_musing_deletion() {
        store.insert(musing("a", "s1", T0));
        store.appendShown("s1", LocalDate.of(2024, 5, 1), T0);
        store.appendShown("s2", LocalDate.of(2024, 4, 20), T0);

        assertEquals(1, store.deleteBySeed("s1"));
        assertThat(store.findBySeed("s1"), empty());
        assertEquals(1, store.findShown("s1").size());
        assertThat(store.seedsShownSince(LocalDate.of(2024, 4, 30)), containsInAnyOrder("s1"));
        assertThat(store.seedsShownSince(LocalDate.of(2024, 4, 20)), containsInAnyOrder("s1", "s2"));
    }
}

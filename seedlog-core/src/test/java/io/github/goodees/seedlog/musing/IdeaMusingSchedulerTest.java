package io.github.goodees.seedlog.musing;

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
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.github.goodees.seedlog.Json;
import io.github.goodees.seedlog.TestClock;
import io.github.goodees.seedlog.TransactionType;
import io.github.goodees.seedlog.config.SeedlogConfiguration;
import io.github.goodees.seedlog.projection.SeedProjector;
import io.github.goodees.seedlog.projection.SeedState;
import io.github.goodees.seedlog.store.inmemory.InMemoryMusingStore;
import io.github.goodees.seedlog.store.inmemory.InMemoryTransactionStore;
import org.junit.Before;
import org.junit.Test;

import java.time.Duration;
import java.time.LocalDate;
import java.util.Arrays;
import java.util.Collections;
import java.util.EnumSet;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicInteger;

import static io.github.goodees.seedlog.Transactions.content;
import static java.util.stream.Collectors.toList;
import static org.hamcrest.Matchers.contains;
import static org.hamcrest.Matchers.empty;
import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertThat;
import static org.junit.Assert.assertTrue;

public class IdeaMusingSchedulerTest {
    private static final LocalDate TODAY = LocalDate.of(2024, 5, 10);

    private TestClock clock;
    private InMemoryTransactionStore transactions;
    private InMemoryMusingStore store;
    private AtomicInteger generated;
    private boolean generateGarbage;
    private IdeaMusingScheduler scheduler;

    @Before
    public void setUp() throws Exception {
        clock = TestClock.at("2024-05-10T12:00:00Z");
        transactions = new InMemoryTransactionStore(clock);
        store = new InMemoryMusingStore();
        generated = new AtomicInteger();
        for (String seedId : Arrays.asList("s1", "s2", "s3")) {
            transactions.append(seedId, TransactionType.CREATE_SEED, content("Idea " + seedId));
        }
        scheduler = scheduler(2);
    }

    private IdeaMusingScheduler scheduler(int excludeDays) {
        SeedlogConfiguration configuration = new SeedlogConfiguration() {
            @Override
            public int musingExcludeDays() {
                return excludeDays;
            }

            @Override
            public int musingMaxPerDay() {
                return 2;
            }
        };
        return new IdeaMusingScheduler(store, new SeedProjector(transactions), this::generate, configuration, clock);
    }

    private Optional<JsonNode> generate(SeedState seed, TemplateType type) {
        generated.incrementAndGet();
        if (generateGarbage) {
            return Optional.of(Json.parse("{\"nonsense\":true}"));
        }
        ObjectNode content = Json.object();
        switch (type) {
            case NUMBERED_IDEAS:
                content.putArray("ideas").add("Think about " + seed.getContent());
                break;
            case WIKIPEDIA_LINKS:
                content.putArray("links").addObject().put("title", "Seed").put("url", "https://en.wikipedia.org");
                break;
            default:
                content.put("markdown", "# " + seed.getContent());
        }
        return Optional.of(content);
    }

    @Test
    public void seed_shown_today_is_excluded() {
        scheduler.recordShown("s1", TODAY);
        assertThat(scheduler.nextCandidates("s1", Collections.<TemplateType>emptySet(), 1), empty());
        assertEquals(0, generated.get());
    }

    @Test
    public void seed_shown_yesterday_is_excluded() {
        scheduler.recordShown("s1", TODAY.minusDays(1));
        assertTrue(scheduler.isExcluded("s1", TODAY));
    }

    @Test
    public void seed_shown_two_days_ago_is_eligible() {
        scheduler.recordShown("s1", TODAY.minusDays(2));
        assertFalse(scheduler.isExcluded("s1", TODAY));
        assertEquals(1, scheduler.nextCandidates("s1", EnumSet.of(TemplateType.MARKDOWN), 1).size());
    }

    @Test
    public void window_moves_with_the_clock() {
        scheduler.recordShown("s1", scheduler.today());
        assertTrue(scheduler.isExcluded("s1", scheduler.today()));
        clock.advance(Duration.ofDays(1));
        assertTrue(scheduler.isExcluded("s1", scheduler.today()));
        clock.advance(Duration.ofDays(1));
        assertFalse(scheduler.isExcluded("s1", scheduler.today()));
    }

    @Test
    public void zero_day_window_never_excludes() {
        IdeaMusingScheduler unlimited = scheduler(0);
        unlimited.recordShown("s1", TODAY);
        assertFalse(unlimited.isExcluded("s1", TODAY));
    }

    @Test
    public void generated_musings_cycle_through_requested_types() {
        List<IdeaMusing> candidates = scheduler.nextCandidates("s1",
                Arrays.asList(TemplateType.NUMBERED_IDEAS, TemplateType.MARKDOWN), 3);
        assertThat(candidates.stream().map(IdeaMusing::getTemplateType).collect(toList()),
                contains(TemplateType.NUMBERED_IDEAS, TemplateType.MARKDOWN, TemplateType.NUMBERED_IDEAS));
        assertEquals(3, store.findBySeed("s1").size());
    }

    @Test
    public void active_musings_are_reused_before_generating() {
        IdeaMusing first = scheduler.nextCandidates("s1", EnumSet.of(TemplateType.MARKDOWN), 1).get(0);
        List<IdeaMusing> again = scheduler.nextCandidates("s1", EnumSet.of(TemplateType.MARKDOWN), 1);
        assertEquals(first.getId(), again.get(0).getId());
        assertEquals(1, generated.get());
    }

    @Test
    public void terminal_musings_are_not_candidates() {
        IdeaMusing first = scheduler.nextCandidates("s1", EnumSet.of(TemplateType.MARKDOWN), 1).get(0);
        scheduler.dismiss(first.getId());
        IdeaMusing second = scheduler.nextCandidates("s1", EnumSet.of(TemplateType.MARKDOWN), 1).get(0);
        assertFalse(first.getId().equals(second.getId()));
    }

    @Test
    public void dismissed_musing_cannot_be_completed() {
        IdeaMusing musing = scheduler.nextCandidates("s1", EnumSet.of(TemplateType.MARKDOWN), 1).get(0);
        assertTrue(scheduler.dismiss(musing.getId()).get().isDismissed());
        IdeaMusing after = scheduler.complete(musing.getId()).get();
        assertTrue(after.isDismissed());
        assertFalse(after.isCompleted());
        assertFalse(after.getCompletedAt().isPresent());
    }

    @Test
    public void invalid_generated_content_is_discarded() {
        generateGarbage = true;
        assertThat(scheduler.nextCandidates("s1", EnumSet.of(TemplateType.NUMBERED_IDEAS), 2), empty());
        assertThat(store.findBySeed("s1"), empty());
    }

    @Test
    public void unknown_seed_gets_no_musings() {
        assertThat(scheduler.nextCandidates("nobody", EnumSet.allOf(TemplateType.class), 1), empty());
        assertEquals(0, generated.get());
    }

    @Test
    public void musings_are_listed_newest_first() {
        IdeaMusing older = scheduler.nextCandidates("s1", EnumSet.of(TemplateType.MARKDOWN), 1).get(0);
        scheduler.complete(older.getId());
        clock.advance(Duration.ofMinutes(1));
        IdeaMusing newer = scheduler.nextCandidates("s1", EnumSet.of(TemplateType.MARKDOWN), 1).get(0);
        assertThat(scheduler.musingsFor("s1").stream().map(IdeaMusing::getId).collect(toList()),
                contains(newer.getId(), older.getId()));
    }

    @Test
    public void huge_count_generates_until_generator_runs_dry() {
        AtomicInteger calls = new AtomicInteger();
        IdeaMusingScheduler limited = new IdeaMusingScheduler(store, new SeedProjector(transactions),
                (seed, type) -> calls.incrementAndGet() <= 3 ? generate(seed, type) : Optional.empty(),
                SeedlogConfiguration.DEFAULTS, clock);
        List<IdeaMusing> candidates = limited.nextCandidates("s1",
                Arrays.asList(TemplateType.MARKDOWN, TemplateType.NUMBERED_IDEAS), Integer.MAX_VALUE);
        assertEquals(3, candidates.size());
        assertEquals(5, calls.get());
    }

    @Test
    public void daily_musings_are_todays_active_ones_newest_first() {
        clock.advance(Duration.ofDays(-1));
        IdeaMusing yesterday = scheduler.nextCandidates("s1", EnumSet.of(TemplateType.MARKDOWN), 1).get(0);
        clock.advance(Duration.ofDays(1));
        IdeaMusing first = scheduler.nextCandidates("s1", EnumSet.of(TemplateType.NUMBERED_IDEAS), 1).get(0);
        clock.advance(Duration.ofMinutes(1));
        IdeaMusing second = scheduler.nextCandidates("s2", EnumSet.of(TemplateType.MARKDOWN), 1).get(0);
        clock.advance(Duration.ofMinutes(1));
        IdeaMusing dismissed = scheduler.nextCandidates("s3", EnumSet.of(TemplateType.MARKDOWN), 1).get(0);
        scheduler.dismiss(dismissed.getId());

        assertThat(scheduler.dailyMusings(Arrays.asList("s1", "s2", "s3")).stream().map(IdeaMusing::getId)
                .collect(toList()), contains(second.getId(), first.getId()));
        assertThat(scheduler.dailyMusings(Collections.singletonList("s1")).stream().map(IdeaMusing::getId)
                .collect(toList()), contains(first.getId()));
        assertTrue(store.findById(yesterday.getId()).isPresent());
    }

    @Test
    public void daily_run_is_capped_and_records_shown_seeds() {
        List<IdeaMusing> presented = scheduler.runDaily(Arrays.asList("s1", "s2", "s3"));
        assertThat(presented.stream().map(IdeaMusing::getSeedId).collect(toList()), contains("s1", "s2"));
        assertEquals(TODAY, store.findShown("s1").get(0).getShownDate());
        assertThat(store.findShown("s3"), empty());

        List<IdeaMusing> sameDay = scheduler.runDaily(Arrays.asList("s1", "s2", "s3"));
        assertThat(sameDay.stream().map(IdeaMusing::getSeedId).collect(toList()), contains("s3"));
    }

    @Test
    public void daily_run_skips_failing_seed() {
        IdeaMusingScheduler failing = new IdeaMusingScheduler(store, new SeedProjector(transactions),
                (seed, type) -> {
                    if (seed.getSeedId().equals("s1")) {
                        throw new IllegalStateException("generator down");
                    }
                    return generate(seed, type);
                }, SeedlogConfiguration.DEFAULTS, clock);
        List<IdeaMusing> presented = failing.runDaily(Arrays.asList("s1", "s2"));
        assertThat(presented.stream().map(IdeaMusing::getSeedId).collect(toList()), contains("s2"));
    }
}

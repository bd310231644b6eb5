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
import io.github.goodees.seedlog.ValidationException;
import io.github.goodees.seedlog.config.SeedlogConfiguration;
import io.github.goodees.seedlog.projection.SeedProjector;
import io.github.goodees.seedlog.projection.SeedState;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneId;
import java.time.temporal.ChronoUnit;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.EnumSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;

import static java.util.stream.Collectors.toList;

/**
 * Selects musings to present for seeds.
 *
 * <p>A seed that was shown within the exclusion window gets no candidates. With the default window of two days a
 * seed shown today or yesterday is skipped, one shown two or more days ago is eligible again. The window is
 * evaluated on calendar days in the configured zone.
 */
public class IdeaMusingScheduler {
    private static final Logger logger = LoggerFactory.getLogger(IdeaMusingScheduler.class);

    private final MusingStore store;
    private final SeedProjector projector;
    private final MusingGenerator generator;
    private final Clock clock;
    private final ZoneId zone;
    private final int excludeDays;
    private final int maxPerDay;

    public IdeaMusingScheduler(MusingStore store, SeedProjector projector, MusingGenerator generator) {
        this(store, projector, generator, SeedlogConfiguration.DEFAULTS, Clock.systemUTC());
    }

    public IdeaMusingScheduler(MusingStore store, SeedProjector projector, MusingGenerator generator,
            SeedlogConfiguration configuration, Clock clock) {
        if (configuration.musingExcludeDays() < 0) {
            throw new IllegalArgumentException("Exclusion window cannot be negative");
        }
        this.store = store;
        this.projector = projector;
        this.generator = generator;
        this.clock = clock;
        this.zone = configuration.musingZone();
        this.excludeDays = configuration.musingExcludeDays();
        this.maxPerDay = configuration.musingMaxPerDay();
    }

    public LocalDate today() {
        return LocalDate.now(clock.withZone(zone));
    }

    /**
     * @return true if the seed has a shown entry within the exclusion window ending at {@code day}
     */
    public boolean isExcluded(String seedId, LocalDate day) {
        if (excludeDays == 0) {
            return false;
        }
        LocalDate windowStart = windowStart(day);
        return store.findShown(seedId).stream().anyMatch(e -> !e.getShownDate().isBefore(windowStart));
    }

    private LocalDate windowStart(LocalDate day) {
        return day.minusDays(excludeDays - 1L);
    }

    /**
     * Select or generate up to {@code count} musings for a seed.
     *
     * <p>Existing musings that are neither dismissed nor completed come first, oldest first. Remaining places are
     * filled by the generator, cycling through the requested template types, until a whole round of types yields
     * nothing. Nothing is returned for seeds in the
     * exclusion window and for seeds that cannot be projected.
     *
     * @param seedId the seed
     * @param templateTypes template types to consider, all types when empty
     * @param count maximal number of musings
     * @return candidates, possibly fewer than requested
     */
    public List<IdeaMusing> nextCandidates(String seedId, Collection<TemplateType> templateTypes, int count) {
        if (count <= 0 || isExcluded(seedId, today())) {
            return new ArrayList<>();
        }
        Optional<SeedState> seed = projector.tryProject(seedId);
        if (!seed.isPresent()) {
            return new ArrayList<>();
        }
        List<TemplateType> types = new ArrayList<>(templateTypes.isEmpty() ? EnumSet.allOf(TemplateType.class)
                : EnumSet.copyOf(templateTypes));

        List<IdeaMusing> result = store.findBySeed(seedId).stream()
                .filter(m -> !m.isTerminal() && types.contains(m.getTemplateType()))
                .limit(count)
                .collect(toList());

        long attempts = (long) (count - result.size()) * types.size();
        int misses = 0;
        for (long i = 0; i < attempts && result.size() < count && misses < types.size(); i++) {
            Optional<IdeaMusing> musing = generate(seed.get(), types.get((int) (i % types.size())));
            if (musing.isPresent()) {
                result.add(musing.get());
                misses = 0;
            } else {
                // a full round without a musing ends generation
                misses++;
            }
        }
        return result;
    }

    private Optional<IdeaMusing> generate(SeedState seed, TemplateType type) {
        Optional<JsonNode> content = generator.generate(seed, type);
        if (!content.isPresent()) {
            return Optional.empty();
        }
        try {
            type.validate(content.get());
        } catch (ValidationException e) {
            logger.warn("{} Discarding generated {} musing: {}", seed.getSeedId(), type.wireName(), e.getMessage());
            return Optional.empty();
        }
        IdeaMusing musing = store.insert(ImmutableIdeaMusing.builder()
                .id(UUID.randomUUID().toString())
                .seedId(seed.getSeedId())
                .templateType(type)
                .content(content.get())
                .createdAt(now())
                .build());
        logger.info("{} Generated {} musing {}", seed.getSeedId(), type.wireName(), musing.getId());
        return Optional.of(musing);
    }

    public ShownHistoryEntry recordShown(String seedId, LocalDate date) {
        return store.appendShown(seedId, date, now());
    }

    public Optional<IdeaMusing> dismiss(String musingId) {
        return store.markDismissed(musingId, now());
    }

    public Optional<IdeaMusing> complete(String musingId) {
        return store.markCompleted(musingId, now());
    }

    /**
     * All musings of a seed, newest first.
     */
    public List<IdeaMusing> musingsFor(String seedId) {
        List<IdeaMusing> musings = new ArrayList<>(store.findBySeed(seedId));
        musings.sort(IdeaMusingScheduler::newestFirst);
        return musings;
    }

    /**
     * Musings of the seeds created today in the configured zone that are neither dismissed nor completed, newest
     * first.
     */
    public List<IdeaMusing> dailyMusings(Collection<String> seedIds) {
        LocalDate today = today();
        Instant from = today.atStartOfDay(zone).toInstant();
        Instant to = today.plusDays(1).atStartOfDay(zone).toInstant();
        List<IdeaMusing> musings = store.findCreatedBetween(seedIds, from, to).stream()
                .filter(m -> !m.isTerminal())
                .collect(toList());
        musings.sort(IdeaMusingScheduler::newestFirst);
        return musings;
    }

    private static int newestFirst(IdeaMusing a, IdeaMusing b) {
        return b.getCreatedAt().compareTo(a.getCreatedAt());
    }

    /**
     * Daily run: give one musing to each eligible seed and mark it shown today, up to the configured number of
     * seeds. A failure of one seed is logged and does not stop the run.
     *
     * @param seedIds seeds to consider, in order of preference
     * @return musings presented today
     */
    public List<IdeaMusing> runDaily(Collection<String> seedIds) {
        LocalDate today = today();
        Set<String> recentlyShown = excludeDays == 0 ? Collections.<String>emptySet()
                : store.seedsShownSince(windowStart(today));
        List<IdeaMusing> presented = new ArrayList<>();
        for (String seedId : seedIds) {
            if (presented.size() >= maxPerDay) {
                break;
            }
            if (recentlyShown.contains(seedId)) {
                continue;
            }
            try {
                List<IdeaMusing> candidates = nextCandidates(seedId, EnumSet.allOf(TemplateType.class), 1);
                if (!candidates.isEmpty()) {
                    recordShown(seedId, today);
                    presented.add(candidates.get(0));
                }
            } catch (RuntimeException e) {
                logger.error("{} Daily musing failed", seedId, e);
            }
        }
        logger.info("Daily musing run presented {} musings for {}", presented.size(), today);
        return presented;
    }

    private Instant now() {
        return clock.instant().truncatedTo(ChronoUnit.MILLIS);
    }
}

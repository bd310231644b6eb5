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

import io.github.goodees.seedlog.musing.IdeaMusing;
import io.github.goodees.seedlog.musing.ImmutableIdeaMusing;
import io.github.goodees.seedlog.musing.ImmutableShownHistoryEntry;
import io.github.goodees.seedlog.musing.MusingStore;
import io.github.goodees.seedlog.musing.ShownHistoryEntry;

import java.time.Instant;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.Comparator;
import java.util.HashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.function.UnaryOperator;

import static java.util.stream.Collectors.toList;
import static java.util.stream.Collectors.toSet;

public class InMemoryMusingStore implements MusingStore {
    private final ConcurrentMap<String, IdeaMusing> musings = new ConcurrentHashMap<>();
    private final List<ShownHistoryEntry> shown = Collections.synchronizedList(new ArrayList<>());

    @Override
    public IdeaMusing insert(IdeaMusing musing) {
        if (musings.putIfAbsent(musing.getId(), musing) != null) {
            throw new IllegalArgumentException("Musing " + musing.getId() + " already exists");
        }
        return musing;
    }

    @Override
    public Optional<IdeaMusing> findById(String musingId) {
        return Optional.ofNullable(musings.get(musingId));
    }

    @Override
    public List<IdeaMusing> findBySeed(String seedId) {
        return musings.values().stream()
                .filter(m -> m.getSeedId().equals(seedId))
                .sorted(Comparator.comparing(IdeaMusing::getCreatedAt).thenComparing(IdeaMusing::getId))
                .collect(toList());
    }

    @Override
    public List<IdeaMusing> findCreatedBetween(Collection<String> seedIds, Instant from, Instant to) {
        Set<String> seeds = new HashSet<>(seedIds);
        return musings.values().stream()
                .filter(m -> seeds.contains(m.getSeedId()))
                .filter(m -> !m.getCreatedAt().isBefore(from) && m.getCreatedAt().isBefore(to))
                .sorted(Comparator.comparing(IdeaMusing::getCreatedAt).thenComparing(IdeaMusing::getId))
                .collect(toList());
    }

    @Override
    public Optional<IdeaMusing> markDismissed(String musingId, Instant at) {
        return transition(musingId, m -> ImmutableIdeaMusing.copyOf(m).withDismissed(true).withDismissedAt(at));
    }

    @Override
    public Optional<IdeaMusing> markCompleted(String musingId, Instant at) {
        return transition(musingId, m -> ImmutableIdeaMusing.copyOf(m).withCompleted(true).withCompletedAt(at));
    }

    private Optional<IdeaMusing> transition(String musingId, UnaryOperator<IdeaMusing> change) {
        return Optional.ofNullable(musings.computeIfPresent(musingId, (id, m) -> m.isTerminal() ? m : change.apply(m)));
    }

    @Override
    public ShownHistoryEntry appendShown(String seedId, LocalDate shownDate, Instant at) {
        ShownHistoryEntry entry = ImmutableShownHistoryEntry.builder()
                .id(UUID.randomUUID().toString())
                .seedId(seedId)
                .shownDate(shownDate)
                .createdAt(at)
                .build();
        shown.add(entry);
        return entry;
    }

    @Override
    public List<ShownHistoryEntry> findShown(String seedId) {
        synchronized (shown) {
            return shown.stream().filter(e -> e.getSeedId().equals(seedId)).collect(toList());
        }
    }

    @Override
    public Set<String> seedsShownSince(LocalDate since) {
        synchronized (shown) {
            return shown.stream()
                    .filter(e -> !e.getShownDate().isBefore(since))
                    .map(ShownHistoryEntry::getSeedId)
                    .collect(toSet());
        }
    }

    @Override
    public int deleteBySeed(String seedId) {
        List<String> ids = findBySeed(seedId).stream().map(IdeaMusing::getId).collect(toList());
        ids.forEach(musings::remove);
        return ids.size();
    }
}

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

import java.time.Instant;
import java.time.LocalDate;
import java.util.Collection;
import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * Persistence of idea musings and their shown history.
 */
public interface MusingStore {

    IdeaMusing insert(IdeaMusing musing);

    Optional<IdeaMusing> findById(String musingId);

    /**
     * All musings of a seed, oldest first.
     */
    List<IdeaMusing> findBySeed(String seedId);

    /**
     * Musings of the given seeds created at or after {@code from} and before {@code to}, oldest first.
     */
    List<IdeaMusing> findCreatedBetween(Collection<String> seedIds, Instant from, Instant to);

    /**
     * Dismiss the musing unless it is already terminal.
     * @return current state of the musing, empty if it does not exist
     */
    Optional<IdeaMusing> markDismissed(String musingId, Instant at);

    /**
     * Complete the musing unless it is already terminal.
     * @return current state of the musing, empty if it does not exist
     */
    Optional<IdeaMusing> markCompleted(String musingId, Instant at);

    ShownHistoryEntry appendShown(String seedId, LocalDate shownDate, Instant at);

    List<ShownHistoryEntry> findShown(String seedId);

    /**
     * Seeds with a shown history entry on or after the date.
     */
    Set<String> seedsShownSince(LocalDate since);

    /**
     * Delete musings of a seed. Shown history is kept.
     * @return number of deleted musings
     */
    int deleteBySeed(String seedId);
}

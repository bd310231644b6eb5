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
import io.github.goodees.seedlog.musing.MusingStore;
import io.github.goodees.seedlog.projection.SeedProjector;
import io.github.goodees.seedlog.projection.SeedState;
import io.github.goodees.seedlog.slug.SlugCollisionExhaustedException;
import io.github.goodees.seedlog.slug.SlugGenerator;
import io.github.goodees.seedlog.slug.SlugRegistry;
import io.github.goodees.seedlog.store.EventStore;
import io.github.goodees.seedlog.store.TransactionLog;
import io.github.goodees.seedlog.store.TransactionStore;
import io.github.goodees.seedlog.store.TransactionStoreException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Administrative batch jobs over all seeds. Not meant for request paths.
 */
public class SeedMaintenance {
    private static final Logger logger = LoggerFactory.getLogger(SeedMaintenance.class);

    private final TransactionLog log;
    private final TransactionStore transactions;
    private final EventStore events;
    private final MusingStore musings;
    private final SlugRegistry slugs;
    private final SeedProjector projector;
    private final SlugGenerator slugGenerator;

    public SeedMaintenance(TransactionLog log, TransactionStore transactions, EventStore events, MusingStore musings,
            SlugRegistry slugs, SlugGenerator slugGenerator) {
        this.log = log;
        this.transactions = transactions;
        this.events = events;
        this.musings = musings;
        this.slugs = slugs;
        this.projector = new SeedProjector(log);
        this.slugGenerator = slugGenerator;
    }

    /**
     * Find seeds whose logs cannot be projected.
     * @return fault per invalid seed id
     */
    public Map<String, IntegrityException.Fault> audit() {
        Map<String, IntegrityException.Fault> result = new LinkedHashMap<>();
        for (String seedId : log.readEntityIds(EntityKind.SEED)) {
            try {
                projector.project(seedId);
            } catch (IntegrityException e) {
                result.put(seedId, e.getFault());
            }
        }
        return result;
    }

    /**
     * Delete every seed that fails the audit, along with its events, musings and slug.
     * @return the purged seeds with their faults
     */
    public Map<String, IntegrityException.Fault> purgeInvalid() throws TransactionStoreException {
        Map<String, IntegrityException.Fault> invalid = audit();
        for (Map.Entry<String, IntegrityException.Fault> entry : invalid.entrySet()) {
            String seedId = entry.getKey();
            int deletedTransactions = transactions.deleteEntity(EntityKind.SEED, seedId);
            int deletedEvents = events.deleteEntity(seedId);
            int deletedMusings = musings.deleteBySeed(seedId);
            slugs.remove(seedId);
            logger.info("{} Purged seed ({}): {} transactions, {} events, {} musings", seedId, entry.getValue(),
                deletedTransactions, deletedEvents, deletedMusings);
        }
        return invalid;
    }

    /**
     * Assign slugs to valid seeds that do not have one yet.
     * @return assigned slug per seed id
     */
    public Map<String, String> backfillSlugs() {
        Map<String, String> assigned = new LinkedHashMap<>();
        for (String seedId : log.readEntityIds(EntityKind.SEED)) {
            if (slugs.slugOf(seedId).isPresent()) {
                continue;
            }
            try {
                SeedState seed = projector.project(seedId);
                assigned.put(seedId, slugGenerator.assign(seedId, seed.getContent()));
            } catch (IntegrityException e) {
                logger.warn("{} Not assigning slug to invalid seed: {}", seedId, e.getMessage());
            } catch (SlugCollisionExhaustedException e) {
                logger.error("{} Could not assign slug", seedId, e);
            }
        }
        logger.info("Backfilled {} slugs", assigned.size());
        return assigned;
    }
}

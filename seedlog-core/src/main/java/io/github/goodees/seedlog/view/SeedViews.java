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

import io.github.goodees.seedlog.event.EventEngine;
import io.github.goodees.seedlog.event.ViewState;
import io.github.goodees.seedlog.projection.SeedProjector;
import io.github.goodees.seedlog.projection.SeedState;
import io.github.goodees.seedlog.slug.SlugRegistry;
import io.github.goodees.seedlog.store.EventStore;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Optional;

/**
 * Read path for seeds. Seeds whose logs violate integrity are left out instead of failing the read.
 */
public class SeedViews {
    private final SeedProjector projector;
    private final EventStore events;
    private final EventEngine engine;
    private final SlugRegistry slugs;

    public SeedViews(SeedProjector projector, EventStore events, EventEngine engine, SlugRegistry slugs) {
        this.projector = projector;
        this.events = events;
        this.engine = engine;
        this.slugs = slugs;
    }

    public Optional<SeedView> find(String seedId) {
        return projector.tryProject(seedId).map(this::view);
    }

    public Optional<SeedView> findBySlug(String slug) {
        return slugs.entityFor(slug).flatMap(this::find);
    }

    public List<SeedView> list(Collection<String> seedIds) {
        List<SeedView> result = new ArrayList<>();
        for (String seedId : seedIds) {
            find(seedId).ifPresent(result::add);
        }
        return result;
    }

    private SeedView view(SeedState state) {
        ViewState view = engine.applyEvents(SeedStateTree.toTree(state), events.readEnabled(state.getSeedId()));
        return ImmutableSeedView.builder()
                .seedId(state.getSeedId())
                .slug(slugs.slugOf(state.getSeedId()))
                .projection(state)
                .view(view)
                .build();
    }
}

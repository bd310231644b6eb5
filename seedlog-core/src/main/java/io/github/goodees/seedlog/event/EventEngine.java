package io.github.goodees.seedlog.event;

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
import io.github.goodees.seedlog.patch.PatchApplicationException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Collection;
import java.util.List;

import static java.util.stream.Collectors.toList;

/**
 * Overlays enabled events on top of a projected base state.
 *
 * <p>Disabled events are ignored entirely. Enabled events are applied in {@link EventRecord#REPLAY_ORDER}; an event
 * whose patch fails is skipped as a whole and the next event continues from the state before it.
 */
public class EventEngine {
    private final Logger logger;

    public EventEngine() {
        this(LoggerFactory.getLogger(EventEngine.class));
    }

    public EventEngine(Logger logger) {
        this.logger = logger;
    }

    public ViewState applyEvents(JsonNode baseState, Collection<EventRecord> events) {
        List<EventRecord> ordered = events.stream()
                .filter(EventRecord::isEnabled)
                .sorted(EventRecord.REPLAY_ORDER)
                .collect(toList());

        ImmutableViewState.Builder result = ImmutableViewState.builder();
        JsonNode state = baseState;
        for (EventRecord event : ordered) {
            try {
                state = event.getPatch().apply(state);
                result.addAppliedEventId(event.getId());
            } catch (PatchApplicationException e) {
                logger.warn("{} Skipping event {} ({}): {}", event.getEntityId(), event.getId(),
                    event.getEventType(), e.getMessage());
                result.addSkippedEvent(ImmutableSkippedEvent.of(event.getId(), e.getMessage()));
            }
        }
        // the base state is never handed out, callers may modify the view freely
        return result.state(state == baseState ? baseState.deepCopy() : state).build();
    }
}

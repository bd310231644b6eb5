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
import io.github.goodees.seedlog.immutables.ValueStyle;
import org.immutables.value.Value;

import java.util.List;

/**
 * Result of overlaying events on a base state.
 */
@Value.Immutable
@ValueStyle
public interface ViewState {
    JsonNode getState();

    List<String> getAppliedEventIds();

    List<SkippedEvent> getSkippedEvents();

    default boolean isClean() {
        return getSkippedEvents().isEmpty();
    }
}

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

import io.github.goodees.seedlog.immutables.ValueStyle;
import org.immutables.value.Value;

import java.time.Instant;
import java.time.LocalDate;

/**
 * Record that musings of a seed were presented on a calendar day.
 */
@Value.Immutable
@ValueStyle
public interface ShownHistoryEntry {
    String getId();

    String getSeedId();

    LocalDate getShownDate();

    Instant getCreatedAt();
}

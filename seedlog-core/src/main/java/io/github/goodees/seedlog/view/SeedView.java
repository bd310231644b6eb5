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

import io.github.goodees.seedlog.event.ViewState;
import io.github.goodees.seedlog.immutables.ValueStyle;
import io.github.goodees.seedlog.projection.SeedState;
import org.immutables.value.Value;

import java.util.Optional;

/**
 * Client visible seed: projection of its transactions overlaid with its enabled events.
 */
@Value.Immutable
@ValueStyle
public interface SeedView {
    String getSeedId();

    Optional<String> getSlug();

    SeedState getProjection();

    ViewState getView();
}

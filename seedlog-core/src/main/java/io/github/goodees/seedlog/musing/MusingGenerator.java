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
import io.github.goodees.seedlog.projection.SeedState;

import java.util.Optional;

/**
 * Produces musing content for a seed, e.g. by asking a language model.
 */
@FunctionalInterface
public interface MusingGenerator {

    /**
     * @param seed projected seed
     * @param type requested template
     * @return content shaped by the template, or empty if nothing could be generated
     */
    Optional<JsonNode> generate(SeedState seed, TemplateType type);
}

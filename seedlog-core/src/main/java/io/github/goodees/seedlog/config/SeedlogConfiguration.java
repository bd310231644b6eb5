package io.github.goodees.seedlog.config;

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

import java.time.ZoneId;
import java.time.ZoneOffset;
import java.util.Arrays;
import java.util.List;

/**
 * Tunables of seedlog components. Every method has a default, implementations override what they need.
 */
public interface SeedlogConfiguration {

    SeedlogConfiguration DEFAULTS = new SeedlogConfiguration() {
    };

    /**
     * Maximal length of the text part of a slug.
     */
    default int slugMaxLength() {
        return 50;
    }

    /**
     * How many counter suffixes are tried before slug generation gives up.
     */
    default int slugMaxAttempts() {
        return 1000;
    }

    /**
     * Number of calendar days, including today, in which a seed that was shown is not offered again.
     */
    default int musingExcludeDays() {
        return 2;
    }

    /**
     * Upper bound of seeds receiving a musing in one daily run.
     */
    default int musingMaxPerDay() {
        return 10;
    }

    /**
     * Zone that determines the calendar day for shown history.
     */
    default ZoneId musingZone() {
        return ZoneOffset.UTC;
    }

    /**
     * Pointers under which event patches may operate. Empty list allows any path.
     */
    default List<String> allowedPatchPrefixes() {
        return Arrays.asList("/seed", "/tags", "/categories", "/metadata");
    }

    default long fetchDefaultTimeoutMs() {
        return 30_000;
    }

    default long fetchMaxTimeoutMs() {
        return 300_000;
    }

    default int fetchMaxRedirects() {
        return 5;
    }
}

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

import org.junit.Test;

import java.time.ZoneId;
import java.time.ZoneOffset;
import java.util.Properties;

import static org.hamcrest.Matchers.contains;
import static org.hamcrest.Matchers.empty;
import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertThat;

public class PropertiesConfigurationTest {

    private static PropertiesConfiguration of(String... keyValues) {
        Properties properties = new Properties();
        for (int i = 0; i < keyValues.length; i += 2) {
            properties.setProperty(keyValues[i], keyValues[i + 1]);
        }
        return new PropertiesConfiguration(properties);
    }

    @Test
    public void missing_keys_fall_back_to_defaults() {
        PropertiesConfiguration configuration = of();
        assertEquals(50, configuration.slugMaxLength());
        assertEquals(2, configuration.musingExcludeDays());
        assertEquals(ZoneOffset.UTC, configuration.musingZone());
        assertEquals(300_000L, configuration.fetchMaxTimeoutMs());
        assertThat(configuration.allowedPatchPrefixes(), contains("/seed", "/tags", "/categories", "/metadata"));
    }

    @Test
    public void values_override_defaults() {
        PropertiesConfiguration configuration = of(
                "seedlog.slug.maxLength", " 20 ",
                "seedlog.musing.zone", "Europe/Prague",
                "seedlog.fetch.maxRedirects", "1",
                "seedlog.events.allowedPathPrefixes", "/seed, /metadata,");
        assertEquals(20, configuration.slugMaxLength());
        assertEquals(ZoneId.of("Europe/Prague"), configuration.musingZone());
        assertEquals(1, configuration.fetchMaxRedirects());
        assertThat(configuration.allowedPatchPrefixes(), contains("/seed", "/metadata"));
    }

    @Test
    public void empty_prefix_list_allows_any_path() {
        assertThat(of("seedlog.events.allowedPathPrefixes", "").allowedPatchPrefixes(), empty());
    }

    @Test(expected = IllegalArgumentException.class)
    public void malformed_number_fails() {
        of("seedlog.musing.maxPerDay", "ten").musingMaxPerDay();
    }

    @Test(expected = IllegalArgumentException.class)
    public void malformed_zone_fails() {
        of("seedlog.musing.zone", "Mars/Olympus").musingZone();
    }

    @Test
    public void classpath_resource_is_loaded() {
        PropertiesConfiguration configuration = PropertiesConfiguration.load();
        assertEquals(ZoneId.of("UTC"), configuration.musingZone());
        assertEquals(30_000L, configuration.fetchDefaultTimeoutMs());
        assertEquals(10, configuration.musingMaxPerDay());
    }
}

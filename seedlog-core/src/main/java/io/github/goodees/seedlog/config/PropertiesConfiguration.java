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

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.time.DateTimeException;
import java.time.ZoneId;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.Properties;

import static java.util.stream.Collectors.toList;

/**
 * Configuration read from properties with keys prefixed by {@code seedlog.}, e.g. {@code seedlog.slug.maxLength}.
 * Missing keys fall back to {@link SeedlogConfiguration} defaults, malformed values fail fast.
 */
public class PropertiesConfiguration implements SeedlogConfiguration {
    private static final Logger logger = LoggerFactory.getLogger(PropertiesConfiguration.class);

    public static final String RESOURCE = "seedlog.properties";
    static final String PREFIX = "seedlog.";

    private final Properties properties;

    public PropertiesConfiguration(Properties properties) {
        this.properties = new Properties();
        this.properties.putAll(properties);
    }

    /**
     * Read {@value #RESOURCE} from the classpath, overridden by system properties with same keys.
     */
    public static PropertiesConfiguration load() {
        Properties properties = new Properties();
        try (InputStream in = PropertiesConfiguration.class.getClassLoader().getResourceAsStream(RESOURCE)) {
            if (in != null) {
                properties.load(in);
            } else {
                logger.info("No {} on classpath, using defaults", RESOURCE);
            }
        } catch (IOException e) {
            throw new UncheckedIOException("Cannot read " + RESOURCE, e);
        }
        for (String key : System.getProperties().stringPropertyNames()) {
            if (key.startsWith(PREFIX)) {
                properties.setProperty(key, System.getProperty(key));
            }
        }
        return new PropertiesConfiguration(properties);
    }

    private String value(String key) {
        String value = properties.getProperty(PREFIX + key);
        return value == null ? null : value.trim();
    }

    private long longValue(String key, long defaultValue) {
        String value = value(key);
        if (value == null || value.isEmpty()) {
            return defaultValue;
        }
        try {
            return Long.parseLong(value);
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("Property " + PREFIX + key + " is not a number: " + value, e);
        }
    }

    private int intValue(String key, int defaultValue) {
        return Math.toIntExact(longValue(key, defaultValue));
    }

    @Override
    public int slugMaxLength() {
        return intValue("slug.maxLength", SeedlogConfiguration.super.slugMaxLength());
    }

    @Override
    public int slugMaxAttempts() {
        return intValue("slug.maxAttempts", SeedlogConfiguration.super.slugMaxAttempts());
    }

    @Override
    public int musingExcludeDays() {
        return intValue("musing.excludeDays", SeedlogConfiguration.super.musingExcludeDays());
    }

    @Override
    public int musingMaxPerDay() {
        return intValue("musing.maxPerDay", SeedlogConfiguration.super.musingMaxPerDay());
    }

    @Override
    public ZoneId musingZone() {
        String value = value("musing.zone");
        if (value == null || value.isEmpty()) {
            return SeedlogConfiguration.super.musingZone();
        }
        try {
            return ZoneId.of(value);
        } catch (DateTimeException e) {
            throw new IllegalArgumentException("Property " + PREFIX + "musing.zone is not a zone: " + value, e);
        }
    }

    @Override
    public List<String> allowedPatchPrefixes() {
        String value = value("events.allowedPathPrefixes");
        if (value == null) {
            return SeedlogConfiguration.super.allowedPatchPrefixes();
        } else if (value.isEmpty()) {
            return Collections.emptyList();
        }
        return Arrays.stream(value.split(",")).map(String::trim).filter(s -> !s.isEmpty()).collect(toList());
    }

    @Override
    public long fetchDefaultTimeoutMs() {
        return longValue("fetch.defaultTimeoutMs", SeedlogConfiguration.super.fetchDefaultTimeoutMs());
    }

    @Override
    public long fetchMaxTimeoutMs() {
        return longValue("fetch.maxTimeoutMs", SeedlogConfiguration.super.fetchMaxTimeoutMs());
    }

    @Override
    public int fetchMaxRedirects() {
        return intValue("fetch.maxRedirects", SeedlogConfiguration.super.fetchMaxRedirects());
    }
}

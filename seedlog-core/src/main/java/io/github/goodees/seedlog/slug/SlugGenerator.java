package io.github.goodees.seedlog.slug;

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

import io.github.goodees.seedlog.config.SeedlogConfiguration;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Optional;

/**
 * Derives slugs of the form {@code <id prefix>/<text>[-<counter>]}.
 *
 * <p>The first seven characters of the entity id partition the namespace. Within a partition a collision on the
 * text is resolved by suffixes {@code -2}, {@code -3}, ..., checking the registry again for every candidate, since
 * other writers may register slugs between our checks.
 */
public class SlugGenerator {
    private static final Logger logger = LoggerFactory.getLogger(SlugGenerator.class);

    public static final int PREFIX_LENGTH = 7;
    public static final String FALLBACK = "seed";

    private final SlugRegistry registry;
    private final int maxLength;
    private final int maxAttempts;

    public SlugGenerator(SlugRegistry registry) {
        this(registry, SeedlogConfiguration.DEFAULTS);
    }

    public SlugGenerator(SlugRegistry registry, SeedlogConfiguration configuration) {
        this(registry, configuration.slugMaxLength(), configuration.slugMaxAttempts());
    }

    public SlugGenerator(SlugRegistry registry, int maxLength, int maxAttempts) {
        if (maxAttempts < 1) {
            throw new IllegalArgumentException("maxAttempts must be positive");
        }
        this.registry = registry;
        this.maxLength = maxLength;
        this.maxAttempts = maxAttempts;
    }

    public static String idPrefix(String entityId) {
        return entityId.length() <= PREFIX_LENGTH ? entityId : entityId.substring(0, PREFIX_LENGTH);
    }

    /**
     * Find the first free slug for the content.
     * @param content seed content, only its first {@code maxLength} characters are considered
     * @param idPrefix namespace of the slug
     * @return slug not present in the registry at the time of the check
     * @throws SlugCollisionExhaustedException if no candidate was free
     */
    public String generateSlug(String content, String idPrefix) {
        String base = idPrefix + "/" + textPart(content);
        String candidate = base;
        for (int attempt = 1; attempt <= maxAttempts; attempt++) {
            if (!registry.exists(candidate)) {
                return candidate;
            }
            candidate = base + "-" + (attempt + 1);
        }
        throw new SlugCollisionExhaustedException(base, maxAttempts);
    }

    /**
     * Generate and register a slug for an entity.
     * @return the registered slug
     * @throws IllegalStateException if the entity already has a slug
     * @throws SlugCollisionExhaustedException if registration keeps losing races with other writers
     */
    public String assign(String entityId, String content) {
        Optional<String> existing = registry.slugOf(entityId);
        if (existing.isPresent()) {
            throw new IllegalStateException("Entity " + entityId + " already has slug " + existing.get());
        }
        String prefix = idPrefix(entityId);
        for (int attempt = 1; attempt <= maxAttempts; attempt++) {
            String candidate = generateSlug(content, prefix);
            if (registry.register(entityId, candidate)) {
                logger.debug("{} Assigned slug {}", entityId, candidate);
                return candidate;
            }
            logger.debug("{} Slug {} was taken concurrently, retrying", entityId, candidate);
        }
        throw new SlugCollisionExhaustedException(prefix + "/" + textPart(content), maxAttempts);
    }

    private String textPart(String content) {
        String trimmed = content == null ? "" : content.trim();
        if (trimmed.length() > maxLength) {
            trimmed = trimmed.substring(0, maxLength);
        }
        String slug = Slugs.slugify(trimmed, maxLength);
        return slug.isEmpty() ? FALLBACK : slug;
    }
}

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
import io.github.goodees.seedlog.ValidationException;

import java.util.Optional;

/**
 * Presentation templates of idea musings. The scheduler stores content opaquely, the template only fixes its shape.
 */
public enum TemplateType {
    /**
     * {@code {"ideas": ["...", ...]}}
     */
    NUMBERED_IDEAS("numbered_ideas") {
        @Override
        Optional<String> violation(JsonNode content) {
            JsonNode ideas = content.path("ideas");
            if (!ideas.isArray() || ideas.size() == 0) {
                return Optional.of("ideas must be a non-empty array");
            }
            for (JsonNode idea : ideas) {
                if (!idea.isTextual()) {
                    return Optional.of("ideas must contain strings");
                }
            }
            return Optional.empty();
        }
    },
    /**
     * {@code {"links": [{"title": "...", "url": "..."}, ...]}}
     */
    WIKIPEDIA_LINKS("wikipedia_links") {
        @Override
        Optional<String> violation(JsonNode content) {
            JsonNode links = content.path("links");
            if (!links.isArray() || links.size() == 0) {
                return Optional.of("links must be a non-empty array");
            }
            for (JsonNode link : links) {
                if (!link.path("title").isTextual() || !link.path("url").isTextual()) {
                    return Optional.of("every link needs a title and url");
                }
            }
            return Optional.empty();
        }
    },
    /**
     * {@code {"markdown": "..."}}
     */
    MARKDOWN("markdown") {
        @Override
        Optional<String> violation(JsonNode content) {
            return content.path("markdown").isTextual() ? Optional.empty()
                    : Optional.of("markdown must be a string");
        }
    };

    private final String wireName;

    TemplateType(String wireName) {
        this.wireName = wireName;
    }

    public String wireName() {
        return wireName;
    }

    abstract Optional<String> violation(JsonNode content);

    public void validate(JsonNode content) throws ValidationException {
        if (content == null || !content.isObject()) {
            throw new ValidationException(wireName + " content must be an object");
        }
        Optional<String> violation = violation(content);
        if (violation.isPresent()) {
            throw new ValidationException("Invalid " + wireName + " content: " + violation.get());
        }
    }

    public static Optional<TemplateType> of(String wireName) {
        for (TemplateType type : values()) {
            if (type.wireName.equals(wireName)) {
                return Optional.of(type);
            }
        }
        return Optional.empty();
    }
}

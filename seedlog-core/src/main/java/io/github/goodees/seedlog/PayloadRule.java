package io.github.goodees.seedlog;

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

import java.util.Arrays;
import java.util.Optional;

/**
 * Structural check of a transaction payload. Returns the violation, or empty when the payload conforms.
 */
@FunctionalInterface
public interface PayloadRule {

    Optional<String> check(JsonNode payload);

    static PayloadRule allOf(PayloadRule... rules) {
        return payload -> {
            for (PayloadRule rule : rules) {
                Optional<String> violation = rule.check(payload);
                if (violation.isPresent()) {
                    return violation;
                }
            }
            return Optional.empty();
        };
    }

    static PayloadRule text(String field) {
        return payload -> payload.path(field).isTextual() ? Optional.empty()
                : Optional.of(field + " must be a string");
    }

    static PayloadRule nonBlankText(String field) {
        return payload -> {
            JsonNode node = payload.path(field);
            if (!node.isTextual() || node.asText().trim().isEmpty()) {
                return Optional.of(field + " must be a non-empty string");
            }
            return Optional.empty();
        };
    }

    /**
     * Field may be absent, null or a string.
     */
    static PayloadRule optionalText(String field) {
        return payload -> {
            JsonNode node = payload.get(field);
            if (node == null || node.isNull() || node.isTextual()) {
                return Optional.empty();
            }
            return Optional.of(field + " must be a string or null");
        };
    }

    static PayloadRule instant(String field) {
        return payload -> Payloads.isInstant(payload.get(field)) ? Optional.empty()
                : Optional.of(field + " must be an ISO-8601 timestamp");
    }

    static PayloadRule optionalInstant(String field) {
        return payload -> {
            JsonNode node = payload.get(field);
            if (node == null || node.isNull() || Payloads.isInstant(node)) {
                return Optional.empty();
            }
            return Optional.of(field + " must be an ISO-8601 timestamp");
        };
    }

    static PayloadRule oneOf(String field, String... values) {
        return payload -> {
            JsonNode node = payload.path(field);
            if (node.isTextual() && Arrays.asList(values).contains(node.asText())) {
                return Optional.empty();
            }
            return Optional.of(field + " must be one of " + String.join(", ", values));
        };
    }

    static PayloadRule nonNegativeInt(String field) {
        return payload -> {
            JsonNode node = payload.path(field);
            if (node.canConvertToInt() && node.isIntegralNumber() && node.asInt() >= 0) {
                return Optional.empty();
            }
            return Optional.of(field + " must be a non-negative integer");
        };
    }

    static PayloadRule atLeastOne(String... fields) {
        return payload -> {
            for (String field : fields) {
                JsonNode node = payload.get(field);
                if (node != null && !node.isNull()) {
                    return Optional.empty();
                }
            }
            return Optional.of("at least one of " + String.join(", ", fields) + " is required");
        };
    }
}

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

import java.time.Instant;
import java.time.OffsetDateTime;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.util.Optional;

/**
 * Typed accessors over transaction payloads. Callers validate the payload with its {@link PayloadRule} first.
 */
public final class Payloads {

    private Payloads() {
    }

    public static String text(JsonNode payload, String field) {
        return payload.path(field).asText();
    }

    public static Optional<String> optionalText(JsonNode payload, String field) {
        JsonNode node = payload.get(field);
        return node == null || node.isNull() ? Optional.empty() : Optional.of(node.asText());
    }

    public static Instant instant(JsonNode payload, String field) {
        return parseInstant(payload.path(field).asText());
    }

    public static Optional<Instant> optionalInstant(JsonNode payload, String field) {
        JsonNode node = payload.get(field);
        return node == null || node.isNull() ? Optional.empty() : Optional.of(parseInstant(node.asText()));
    }

    /**
     * Parse an ISO-8601 timestamp with zone offset, e.g. {@code 2024-05-01T10:00:00.000Z}.
     */
    public static Instant parseInstant(String value) {
        return OffsetDateTime.parse(value, DateTimeFormatter.ISO_OFFSET_DATE_TIME).toInstant();
    }

    static boolean isInstant(JsonNode node) {
        if (node == null || !node.isTextual()) {
            return false;
        }
        try {
            parseInstant(node.asText());
            return true;
        } catch (DateTimeParseException e) {
            return false;
        }
    }
}

package io.github.goodees.seedlog.automation;

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

import java.util.Locale;

/**
 * JSON type a tool parameter accepts.
 */
public enum ParameterType {
    STRING {
        @Override
        public boolean accepts(JsonNode value) {
            return value.isTextual();
        }
    },
    NUMBER {
        @Override
        public boolean accepts(JsonNode value) {
            return value.isNumber() && !(value.isDouble() && Double.isNaN(value.doubleValue()));
        }
    },
    BOOLEAN {
        @Override
        public boolean accepts(JsonNode value) {
            return value.isBoolean();
        }
    },
    OBJECT {
        @Override
        public boolean accepts(JsonNode value) {
            return value.isObject();
        }
    },
    ARRAY {
        @Override
        public boolean accepts(JsonNode value) {
            return value.isArray();
        }
    };

    public abstract boolean accepts(JsonNode value);

    public String wireName() {
        return name().toLowerCase(Locale.ROOT);
    }

    /**
     * Name of the JSON type of a value, used in error messages.
     */
    public static String describe(JsonNode value) {
        switch (value.getNodeType()) {
            case NULL:
            case MISSING:
                return "null";
            case POJO:
            case BINARY:
                return "object";
            default:
                return value.getNodeType().name().toLowerCase(Locale.ROOT);
        }
    }
}

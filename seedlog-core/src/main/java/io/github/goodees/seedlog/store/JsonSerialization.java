package io.github.goodees.seedlog.store;

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

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.github.goodees.seedlog.Json;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Stores JSON trees as their textual form.
 */
public class JsonSerialization implements Serialization<JsonNode> {
    private static final Logger logger = LoggerFactory.getLogger(JsonSerialization.class);

    private final ObjectMapper mapper;

    public JsonSerialization() {
        this(Json.mapper());
    }

    public JsonSerialization(ObjectMapper mapper) {
        this.mapper = mapper;
    }

    @Override
    public String serialize(JsonNode object) {
        try {
            return mapper.writeValueAsString(object);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Cannot serialize " + object, e);
        }
    }

    @Override
    public JsonNode deserialize(String payload, String type) {
        if (payload == null) {
            return null;
        }
        try {
            return mapper.readTree(payload);
        } catch (JsonProcessingException e) {
            logger.debug("Payload of type {} is not valid JSON", type, e);
            return null;
        }
    }
}

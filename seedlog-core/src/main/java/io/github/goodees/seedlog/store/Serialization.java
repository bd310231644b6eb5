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

/**
 * Common interface for serialization and deserialization into String payload. JDBC stores use it to convert
 * structured payloads into text columns.
 */
public interface Serialization<T> {

    /**
     * Serialize the object into a String payload.
     * @param object object to serialize
     * @return String serialization of the object
     * @throws IllegalArgumentException when the object cannot be serialized
     */
    String serialize(T object);

    /**
     * Deserialize a stored payload.
     *
     * @param payload payload to deserialize
     * @param type a type discriminator if supported by underlying storage, <code>null</code> otherwise
     * @return deserialized object or null if the payload cannot be read
     */
    T deserialize(String payload, String type);
}

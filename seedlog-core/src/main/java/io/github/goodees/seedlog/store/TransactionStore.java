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

import com.fasterxml.jackson.databind.JsonNode;
import io.github.goodees.seedlog.EntityKind;
import io.github.goodees.seedlog.TransactionRecord;
import io.github.goodees.seedlog.TransactionType;
import io.github.goodees.seedlog.ValidationException;

/**
 * Append-only store of transactions. Each append is a single atomic row.
 */
public interface TransactionStore {

    /**
     * Append a transaction to the log of an entity.
     *
     * <p>Payload is validated against the rule of its type. A creation transaction may only be appended to an empty
     * log, any other transaction only to a log that already contains the creation.
     *
     * @param entityId id of the entity
     * @param type type of transaction, determines the entity kind
     * @param payload structured payload
     * @param automationId automation that produced this transaction, or null
     * @return the stored record with id, timestamp and sequence assigned
     * @throws ValidationException when type or payload is not acceptable
     * @throws TransactionStoreException when the storage fails
     */
    TransactionRecord append(String entityId, TransactionType type, JsonNode payload, String automationId)
            throws ValidationException, TransactionStoreException;

    default TransactionRecord append(String entityId, TransactionType type, JsonNode payload)
            throws ValidationException, TransactionStoreException {
        return append(entityId, type, payload, null);
    }

    /**
     * Append a transaction given by its wire name, as received from clients.
     * @throws ValidationException when the name is not among types of the entity kind
     */
    default TransactionRecord append(EntityKind kind, String entityId, String type, JsonNode payload,
            String automationId) throws ValidationException, TransactionStoreException {
        return append(entityId, TransactionType.resolve(kind, type), payload, automationId);
    }

    /**
     * Delete whole log of an entity. Reserved to maintenance.
     * @return number of deleted transactions
     */
    int deleteEntity(EntityKind kind, String entityId) throws TransactionStoreException;
}

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

/**
 * The transaction log of an entity violates invariants required for projection. Such entity is excluded from
 * normal operation and left for a maintenance procedure, it is never repaired by guessing.
 */
public class IntegrityException extends Exception {
    private final Fault fault;
    private final String entityId;

    public enum Fault {
        MISSING_CREATION, CREATION_NOT_FIRST, DUPLICATE_CREATION, INVALID_CREATION
    }

    protected IntegrityException(Fault fault, String entityId, String message) {
        super(message);
        this.fault = fault;
        this.entityId = entityId;
    }

    public Fault getFault() {
        return fault;
    }

    public String getEntityId() {
        return entityId;
    }

    public static IntegrityException missingCreation(EntityKind kind, String entityId) {
        return new IntegrityException(Fault.MISSING_CREATION, entityId, "No creation transaction found for "
                + kind.wireName() + " " + entityId);
    }

    public static IntegrityException creationNotFirst(String entityId, TransactionRecord first) {
        return new IntegrityException(Fault.CREATION_NOT_FIRST, entityId, "Entity " + entityId
                + " starts with " + first.getType().wireName() + " transaction " + first.getId());
    }

    public static IntegrityException duplicateCreation(String entityId, TransactionRecord duplicate) {
        return new IntegrityException(Fault.DUPLICATE_CREATION, entityId, "Entity " + entityId
                + " has another creation transaction " + duplicate.getId());
    }

    public static IntegrityException invalidCreation(String entityId, String reason) {
        return new IntegrityException(Fault.INVALID_CREATION, entityId, "Creation transaction of " + entityId
                + " is invalid: " + reason);
    }
}

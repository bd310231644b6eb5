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
 * Input rejected at a write or execution boundary. The input is never coerced into a valid shape.
 */
public class ValidationException extends Exception {

    public ValidationException(String message) {
        super(message);
    }

    public ValidationException(String message, Throwable cause) {
        super(message, cause);
    }

    public static ValidationException unknownType(EntityKind kind, String type) {
        return new ValidationException("Unknown " + kind.wireName() + " transaction type: " + type);
    }

    public static ValidationException invalidPayload(TransactionType type, String reason) {
        return new ValidationException("Invalid " + type.wireName() + " payload: " + reason);
    }

    public static ValidationException duplicateCreation(String entityId, TransactionType type) {
        return new ValidationException("Entity " + entityId + " already has a " + type.wireName()
                + " transaction");
    }

    public static ValidationException notCreated(String entityId, TransactionType type) {
        return new ValidationException("Entity " + entityId + " has no creation transaction, cannot append "
                + type.wireName());
    }
}

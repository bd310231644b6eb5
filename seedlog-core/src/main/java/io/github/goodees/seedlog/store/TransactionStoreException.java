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
 * Exception generated when a write to a store fails.
 */
public class TransactionStoreException extends Exception {
    private final Fault fault;

    public enum Fault {
        TX_ERROR, PROGRAMMATIC_ERROR
    }

    protected TransactionStoreException(Fault type, String message, Throwable cause) {
        super(message, cause);
        this.fault = type;
    }

    public Fault getFault() {
        return fault;
    }

    public static TransactionStoreException storeFailed(String entityId, Throwable cause) {
        return new TransactionStoreException(Fault.TX_ERROR,
            "Store of entity " + entityId + " failed. " + cause.getMessage(), cause);
    }

    public static TransactionStoreException deleteFailed(String entityId, Throwable cause) {
        return new TransactionStoreException(Fault.TX_ERROR,
            "Deletion of entity " + entityId + " failed. " + cause.getMessage(), cause);
    }

    public static TransactionStoreException updateFailed(String recordId, Throwable cause) {
        return new TransactionStoreException(Fault.TX_ERROR,
            "Update of " + recordId + " failed. " + cause.getMessage(), cause);
    }

    public static TransactionStoreException unserializable(String entityId, Throwable cause) {
        return new TransactionStoreException(Fault.PROGRAMMATIC_ERROR,
            "Payload of entity " + entityId + " cannot be serialized", cause);
    }
}

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

import io.github.goodees.seedlog.EntityKind;
import io.github.goodees.seedlog.TransactionRecord;

import java.util.List;
import java.util.function.BiFunction;
import java.util.function.Consumer;

/**
 * Reads persisted transaction logs.
 * This interface is usually implemented along with {@link TransactionStore}.
 */
public interface TransactionLog {
    /**
     * Read all transactions of an entity.
     * @param kind kind of the entity
     * @param entityId the id of an entity
     * @return accessor for the transactions in {@link TransactionRecord#REPLAY_ORDER}
     */
    StoredTransactions readTransactions(EntityKind kind, String entityId);

    /**
     * List ids of all entities of a kind that have at least one transaction.
     */
    List<String> readEntityIds(EntityKind kind);

    /**
     * Transactions of any kind written on behalf of an automation, in order of creation.
     */
    List<TransactionRecord> readByAutomation(String automationId);

    /**
     * Accessor that enables single iteration over found transactions.
     * The transactions need not be materialized at once, an implementation may for example wrap a JDBC
     * ResultSet. Only one of methods foreach and reduce may be called on single instance, and only once.
     */
    interface StoredTransactions extends AutoCloseable {
        /**
         * Iterate over all found transactions. Consumer may call {@link #stop()} to stop the iteration.
         * @param consumer consumer that will receive the transactions
         */
        void foreach(Consumer<? super TransactionRecord> consumer);

        /**
         * Perform a reduction over all found transactions. Reducer may call {@link #stop()} to stop the process.
         * @param initial Initial value for reduction
         * @param reducer the reducer function
         * @param <R> type of result
         * @return result of reduction.
         */
        <R> R reduce(R initial, BiFunction<R, ? super TransactionRecord, R> reducer);

        /**
         * Can be called from within the lambda functions to stop the iteration after current step.
         */
        void stop();

        // will not throw exception
        @Override
        void close();
    }
}

package io.github.goodees.seedlog.projection;

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

import io.github.goodees.seedlog.TransactionRecord;
import io.github.goodees.seedlog.TransactionType;

import java.util.EnumMap;
import java.util.Map;
import java.util.Objects;
import java.util.function.BiFunction;

/**
 * Boilerplate-free dispatch of transactions to reducers by their type.
 * <pre>
 *     TransactionSwitch.builder(SeedState.class)
 *         .on(TransactionType.EDIT_CONTENT, (state, tx) -> state.withContent(...))
 *         .otherwise((state, tx) -> state)
 *         .build();
 * </pre>
 */
public class TransactionSwitch<S> {
    private final Map<TransactionType, BiFunction<S, TransactionRecord, ? extends S>> branches;
    private final BiFunction<S, TransactionRecord, ? extends S> fallback;

    private TransactionSwitch(Builder<S> b) {
        this.branches = new EnumMap<>(b.branches);
        this.fallback = b.fallback;
    }

    /**
     * Apply reducer registered for the type of the transaction.
     * @param state current state
     * @param transaction transaction to apply
     * @return new state, or unchanged state when no branch matches and no fallback is defined
     */
    public S apply(S state, TransactionRecord transaction) {
        BiFunction<S, TransactionRecord, ? extends S> branch = branches.get(transaction.getType());
        if (branch != null) {
            return branch.apply(state, transaction);
        } else if (fallback != null) {
            return fallback.apply(state, transaction);
        }
        return state;
    }

    public boolean handles(TransactionType type) {
        return branches.containsKey(type);
    }

    public static <S> Builder<S> builder(Class<S> stateClass) {
        return new Builder<>();
    }

    public static class Builder<S> {
        protected Map<TransactionType, BiFunction<S, TransactionRecord, ? extends S>> branches =
                new EnumMap<>(TransactionType.class);
        protected BiFunction<S, TransactionRecord, ? extends S> fallback;

        public Builder<S> on(TransactionType type, BiFunction<S, TransactionRecord, ? extends S> reducer) {
            Objects.requireNonNull(reducer, "Reducer cannot be null");
            if (branches.putIfAbsent(Objects.requireNonNull(type, "Type cannot be null"), reducer) != null) {
                throw new IllegalArgumentException("Reducer for " + type + " already defined");
            }
            return this;
        }

        public Builder<S> otherwise(BiFunction<S, TransactionRecord, ? extends S> fallback) {
            this.fallback = fallback;
            return this;
        }

        public TransactionSwitch<S> build() {
            return new TransactionSwitch<>(this);
        }
    }
}

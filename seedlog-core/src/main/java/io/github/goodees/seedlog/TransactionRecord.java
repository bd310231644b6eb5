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
import io.github.goodees.seedlog.immutables.ValueStyle;
import org.immutables.value.Value;

import java.time.Instant;
import java.util.Comparator;
import java.util.Optional;

/**
 * Immutable entry in the transaction log of an entity.
 */
@Value.Immutable
@ValueStyle
public interface TransactionRecord {
    /**
     * Order in which transactions of one entity are replayed: creation time, ties broken by insertion sequence.
     */
    Comparator<TransactionRecord> REPLAY_ORDER = Comparator.comparing(TransactionRecord::getCreatedAt)
            .thenComparingLong(TransactionRecord::getSequence);

    String getId();

    String getEntityId();

    TransactionType getType();

    JsonNode getPayload();

    Instant getCreatedAt();

    /**
     * Insertion counter assigned by the store.
     */
    long getSequence();

    /**
     * The automation that wrote this transaction, if any.
     */
    Optional<String> getAutomationId();

    default EntityKind getKind() {
        return getType().kind();
    }
}

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
import org.junit.Test;

import java.time.Instant;

import static io.github.goodees.seedlog.Transactions.content;
import static io.github.goodees.seedlog.Transactions.record;
import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertTrue;

public class TransactionSwitchTest {
    private final TransactionRecord edit = record("s", TransactionType.EDIT_CONTENT, content("x"), Instant.EPOCH, 1);
    private final TransactionRecord tag = record("s", TransactionType.ADD_TAG, content("x"), Instant.EPOCH, 2);

    @Test
    public void matching_branch_is_applied() {
        TransactionSwitch<String> sw = TransactionSwitch.builder(String.class)
                .on(TransactionType.EDIT_CONTENT, (s, tx) -> s + "!")
                .build();
        assertEquals("a!", sw.apply("a", edit));
        assertTrue(sw.handles(TransactionType.EDIT_CONTENT));
        assertFalse(sw.handles(TransactionType.ADD_TAG));
    }

    @Test
    public void unmatched_transaction_keeps_state() {
        TransactionSwitch<String> sw = TransactionSwitch.builder(String.class)
                .on(TransactionType.EDIT_CONTENT, (s, tx) -> s + "!")
                .build();
        assertEquals("a", sw.apply("a", tag));
    }

    @Test
    public void fallback_handles_unmatched_transaction() {
        TransactionSwitch<String> sw = TransactionSwitch.builder(String.class)
                .on(TransactionType.EDIT_CONTENT, (s, tx) -> s + "!")
                .otherwise((s, tx) -> s + "?")
                .build();
        assertEquals("a?", sw.apply("a", tag));
    }

    @Test(expected = IllegalArgumentException.class)
    public void branch_cannot_be_defined_twice() {
        TransactionSwitch.builder(String.class)
                .on(TransactionType.EDIT_CONTENT, (s, tx) -> s)
                .on(TransactionType.EDIT_CONTENT, (s, tx) -> s);
    }
}

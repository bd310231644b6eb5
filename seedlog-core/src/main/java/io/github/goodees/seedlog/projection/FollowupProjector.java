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

import io.github.goodees.seedlog.EntityKind;
import io.github.goodees.seedlog.TransactionRecord;
import io.github.goodees.seedlog.TransactionType;
import io.github.goodees.seedlog.store.TransactionLog;
import org.slf4j.Logger;

import java.time.Duration;

import static io.github.goodees.seedlog.Payloads.instant;
import static io.github.goodees.seedlog.Payloads.optionalInstant;
import static io.github.goodees.seedlog.Payloads.optionalText;
import static io.github.goodees.seedlog.Payloads.text;

/**
 * Projects sprout followups. A snooze postpones the current due time, an edit replaces it.
 */
public class FollowupProjector extends EntityProjector<FollowupState> {

    public FollowupProjector(TransactionLog log) {
        super(EntityKind.SPROUT_FOLLOWUP, log);
    }

    public FollowupProjector(TransactionLog log, Logger logger) {
        super(EntityKind.SPROUT_FOLLOWUP, log, logger);
    }

    @Override
    protected FollowupState initialState(TransactionRecord creation) {
        return ImmutableFollowupState.builder()
                .followupId(creation.getEntityId())
                .trigger(text(creation.getPayload(), "trigger"))
                .dueTime(instant(creation.getPayload(), "initial_time"))
                .message(text(creation.getPayload(), "initial_message"))
                .snoozeCount(0)
                .dismissed(false)
                .createdAt(creation.getCreatedAt())
                .build();
    }

    @Override
    protected TransactionSwitch<FollowupState> defineReducers() {
        return TransactionSwitch.builder(FollowupState.class)
                .on(TransactionType.FOLLOWUP_EDIT, (s, tx) -> ImmutableFollowupState.copyOf(s)
                        .withDueTime(optionalInstant(tx.getPayload(), "new_time").orElse(s.getDueTime()))
                        .withMessage(optionalText(tx.getPayload(), "new_message").orElse(s.getMessage())))
                .on(TransactionType.SNOOZE, (s, tx) -> ImmutableFollowupState.copyOf(s)
                        .withDueTime(s.getDueTime().plus(
                            Duration.ofMinutes(tx.getPayload().path("duration_minutes").asLong())))
                        .withSnoozeCount(s.getSnoozeCount() + 1))
                .on(TransactionType.DISMISSAL, (s, tx) -> ImmutableFollowupState.copyOf(s)
                        .withDismissed(true)
                        .withDismissedAt(instant(tx.getPayload(), "dismissed_at"))
                        .withDismissalType(text(tx.getPayload(), "type")))
                .build();
    }
}

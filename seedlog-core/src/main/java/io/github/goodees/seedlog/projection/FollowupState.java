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

import io.github.goodees.seedlog.immutables.ValueStyle;
import org.immutables.value.Value;

import java.time.Instant;
import java.util.Optional;

/**
 * Current state of a sprout followup: when it is due, with what message, and whether it was dismissed.
 */
@Value.Immutable
@ValueStyle
public interface FollowupState {
    String getFollowupId();

    /**
     * {@code manual} or {@code automatic}.
     */
    String getTrigger();

    Instant getDueTime();

    String getMessage();

    int getSnoozeCount();

    boolean isDismissed();

    Optional<Instant> getDismissedAt();

    /**
     * {@code followup} when the followup itself was dismissed, {@code snooze} when a snooze prompt was.
     */
    Optional<String> getDismissalType();

    Instant getCreatedAt();
}

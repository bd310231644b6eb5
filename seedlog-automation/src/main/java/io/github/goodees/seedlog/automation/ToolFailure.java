package io.github.goodees.seedlog.automation;

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

import java.util.Optional;

/**
 * Classified reason of an unsuccessful tool call.
 */
@Value.Immutable
@ValueStyle
public interface ToolFailure {

    enum Kind {
        /**
         * The deadline of the call passed.
         */
        TIMEOUT("timeout"),
        /**
         * A remote server answered with an error status.
         */
        HTTP_ERROR("http-error"),
        /**
         * No response was received.
         */
        NETWORK_ERROR("network-error"),
        GENERIC_ERROR("generic-error"),
        /**
         * The call itself was rejected before the tool did any work.
         */
        INVALID_CALL("invalid-call");

        private final String wireName;

        Kind(String wireName) {
            this.wireName = wireName;
        }

        public String wireName() {
            return wireName;
        }
    }

    @Value.Parameter
    Kind getKind();

    @Value.Parameter
    String getMessage();

    /**
     * Status code of the response, present for {@link Kind#HTTP_ERROR}.
     */
    Optional<Integer> getStatusCode();

    static ToolFailure of(Kind kind, String message) {
        return ImmutableToolFailure.of(kind, message);
    }

    static ToolFailure httpError(int statusCode, String reason) {
        return ImmutableToolFailure.builder()
                .kind(Kind.HTTP_ERROR)
                .message("HTTP " + statusCode + " - " + reason)
                .statusCode(statusCode)
                .build();
    }
}

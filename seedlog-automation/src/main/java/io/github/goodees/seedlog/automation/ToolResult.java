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
 * Outcome of a tool call. Exactly one of output and failure is present.
 */
@Value.Immutable
@ValueStyle
public interface ToolResult {
    String getToolName();

    Optional<String> getOutput();

    Optional<ToolFailure> getFailure();

    default boolean isSuccess() {
        return getOutput().isPresent();
    }

    @Value.Check
    default void check() {
        if (getOutput().isPresent() == getFailure().isPresent()) {
            throw new IllegalStateException("Result of " + getToolName() + " needs either output or failure");
        }
    }

    static ToolResult success(String toolName, String output) {
        return ImmutableToolResult.builder().toolName(toolName).output(output).build();
    }

    static ToolResult failure(String toolName, ToolFailure failure) {
        return ImmutableToolResult.builder().toolName(toolName).failure(failure).build();
    }

    static ToolResult failure(String toolName, ToolFailure.Kind kind, String message) {
        return failure(toolName, ToolFailure.of(kind, message));
    }
}

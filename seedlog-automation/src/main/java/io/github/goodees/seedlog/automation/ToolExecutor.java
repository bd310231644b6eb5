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

import com.fasterxml.jackson.databind.JsonNode;
import io.github.goodees.seedlog.ValidationException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Runs tool calls against a registry. Every outcome, including rejected calls and failing tools, is reported as a
 * {@link ToolResult}; nothing is thrown to the caller.
 */
public class ToolExecutor {
    private static final Logger logger = LoggerFactory.getLogger(ToolExecutor.class);

    private final ToolRegistry registry;

    public ToolExecutor(ToolRegistry registry) {
        this.registry = registry;
    }

    public ToolResult execute(ToolCall call) {
        Optional<AutomationTool> found = registry.get(call.getToolName());
        if (!found.isPresent()) {
            return invalid(call, "Tool \"" + call.getToolName() + "\" not found");
        }
        AutomationTool tool = found.get();
        Optional<String> argumentError = checkArguments(tool.parameters(), call.getArguments());
        if (argumentError.isPresent()) {
            return invalid(call, argumentError.get());
        }
        try {
            ToolResult result = tool.execute(call.getArguments());
            if (!result.isSuccess()) {
                logger.info("Tool {} failed with {}: {}", tool.name(), result.getFailure().get().getKind().wireName(),
                        result.getFailure().get().getMessage());
            }
            return result;
        } catch (ValidationException e) {
            return invalid(call, e.getMessage());
        } catch (RuntimeException e) {
            logger.warn("Tool {} threw an exception", tool.name(), e);
            return ToolResult.failure(call.getToolName(), ToolFailure.Kind.GENERIC_ERROR,
                    "Tool execution failed: " + e.getMessage());
        }
    }

    /**
     * Execute calls one after another, in order.
     */
    public List<ToolResult> executeAll(List<ToolCall> calls) {
        List<ToolResult> results = new ArrayList<>(calls.size());
        for (ToolCall call : calls) {
            results.add(execute(call));
        }
        return results;
    }

    private ToolResult invalid(ToolCall call, String message) {
        logger.debug("Rejected call {}: {}", call.getToolName(), message);
        return ToolResult.failure(call.getToolName(), ToolFailure.Kind.INVALID_CALL, message);
    }

    static Optional<String> checkArguments(List<ToolParameter> parameters, List<JsonNode> args) {
        long required = parameters.stream().filter(ToolParameter::isRequired).count();
        if (args.size() < required) {
            return Optional.of("Expected at least " + required + " argument(s), got " + args.size());
        }
        if (args.size() > parameters.size()) {
            return Optional.of("Expected at most " + parameters.size() + " argument(s), got " + args.size());
        }
        for (int i = 0; i < args.size(); i++) {
            ToolParameter parameter = parameters.get(i);
            JsonNode arg = args.get(i);
            if (arg.isNull() && !parameter.isRequired()) {
                continue;
            }
            if (!parameter.getType().accepts(arg)) {
                return Optional.of("Argument " + (i + 1) + " (" + parameter.getName() + "): Expected "
                        + parameter.getType().wireName() + ", got " + ParameterType.describe(arg));
            }
        }
        return Optional.empty();
    }
}

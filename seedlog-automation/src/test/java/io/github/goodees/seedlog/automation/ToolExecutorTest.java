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
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import org.junit.Before;
import org.junit.Test;

import java.util.Arrays;
import java.util.Collections;
import java.util.List;

import static java.util.stream.Collectors.toList;
import static org.hamcrest.Matchers.contains;
import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertThat;
import static org.junit.Assert.assertTrue;

public class ToolExecutorTest {
    private static final JsonNodeFactory NODES = JsonNodeFactory.instance;

    private ToolExecutor executor;

    @Before
    public void setUp() {
        ToolRegistry registry = new ToolRegistry();
        registry.register(new EchoTool("echo"));
        executor = new ToolExecutor(registry);
    }

    private static ToolCall call(String tool, JsonNode... args) {
        return ImmutableToolCall.builder().toolName(tool).addArguments(args).build();
    }

    private static void assertInvalid(String expectedMessage, ToolResult result) {
        assertFalse(result.isSuccess());
        assertEquals(ToolFailure.Kind.INVALID_CALL, result.getFailure().get().getKind());
        assertEquals(expectedMessage, result.getFailure().get().getMessage());
    }

    @Test
    public void valid_call_runs_the_tool() {
        ToolResult result = executor.execute(call("echo", NODES.textNode("ab"), NODES.numberNode(3)));
        assertTrue(result.isSuccess());
        assertEquals("ababab", result.getOutput().get());
        assertEquals("echo", result.getToolName());
    }

    @Test
    public void unknown_tool_is_reported() {
        assertInvalid("Tool \"shout\" not found", executor.execute(call("shout", NODES.textNode("x"))));
    }

    @Test
    public void missing_required_argument_is_reported() {
        assertInvalid("Expected at least 1 argument(s), got 0", executor.execute(call("echo")));
    }

    @Test
    public void surplus_arguments_are_reported() {
        assertInvalid("Expected at most 2 argument(s), got 3", executor.execute(
            call("echo", NODES.textNode("x"), NODES.numberNode(1), NODES.booleanNode(true))));
    }

    @Test
    public void argument_types_are_checked() {
        assertInvalid("Argument 1 (text): Expected string, got number",
            executor.execute(call("echo", NODES.numberNode(1))));
        assertInvalid("Argument 2 (times): Expected number, got string",
            executor.execute(call("echo", NODES.textNode("x"), NODES.textNode("2"))));
        assertInvalid("Argument 1 (text): Expected string, got null",
            executor.execute(call("echo", NODES.nullNode())));
    }

    @Test
    public void null_is_accepted_for_optional_argument() {
        ToolResult result = executor.execute(call("echo", NODES.textNode("x"), NODES.nullNode()));
        assertEquals("x", result.getOutput().get());
    }

    @Test
    public void tool_validation_becomes_invalid_call() {
        assertInvalid("times must be positive",
            executor.execute(call("echo", NODES.textNode("x"), NODES.numberNode(0))));
    }

    @Test
    public void tool_exception_becomes_generic_error() {
        ToolResult result = executor.execute(call("echo", NODES.textNode("boom")));
        assertEquals(ToolFailure.Kind.GENERIC_ERROR, result.getFailure().get().getKind());
        assertEquals("Tool execution failed: exploded", result.getFailure().get().getMessage());
    }

    @Test
    public void calls_are_executed_in_order() {
        List<ToolResult> results = executor.executeAll(Arrays.asList(
            call("echo", NODES.textNode("a")),
            call("missing"),
            call("echo", NODES.textNode("b"))));
        assertThat(results.stream().map(ToolResult::isSuccess).collect(toList()), contains(true, false, true));
        assertEquals("b", results.get(2).getOutput().get());
        assertTrue(executor.executeAll(Collections.<ToolCall>emptyList()).isEmpty());
    }
}

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

import java.util.List;

/**
 * Function that automations may invoke by name.
 */
public interface AutomationTool {
    /**
     * Unique name the tool is called by.
     */
    String name();

    /**
     * Human readable signature, e.g. {@code wget(string uri, number timeoutMs): string}.
     */
    String signature();

    String description();

    /**
     * Positional parameters. Required parameters precede optional ones.
     */
    List<ToolParameter> parameters();

    /**
     * Run the tool. Arguments are validated before any side effect takes place.
     *
     * @param args positional arguments
     * @return successful output or classified failure
     * @throws ValidationException when the arguments are not acceptable
     */
    ToolResult execute(List<JsonNode> args) throws ValidationException;
}

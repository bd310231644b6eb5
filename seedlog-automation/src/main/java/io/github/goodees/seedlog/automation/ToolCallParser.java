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

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.json.JsonReadFeature;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.json.JsonMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Extracts tool calls from generated text. A call is a fenced block
 *
 * <pre>
 * ```tool
 * return wget("https://example.org", 5000);
 * ```
 * </pre>
 *
 * whose arguments are JSON literals. Single quoted strings and unquoted object keys are accepted.
 */
public class ToolCallParser {
    private static final Logger logger = LoggerFactory.getLogger(ToolCallParser.class);

    private static final Pattern TOOL_BLOCK =
            Pattern.compile("```tool\\s*\\n\\s*return\\s+(\\w+)\\s*\\(([^)]*)\\)\\s*;?\\s*\\n?```");

    private final JsonMapper mapper = JsonMapper.builder()
            .enable(JsonReadFeature.ALLOW_SINGLE_QUOTES)
            .enable(JsonReadFeature.ALLOW_UNQUOTED_FIELD_NAMES)
            .enable(JsonReadFeature.ALLOW_BACKSLASH_ESCAPING_ANY_CHARACTER)
            .build();

    /**
     * Parse all well-formed calls in order of appearance. Malformed calls are logged and skipped.
     */
    public List<ToolCall> parse(String text) {
        List<ToolCall> calls = new ArrayList<>();
        if (text == null) {
            return calls;
        }
        Matcher matcher = TOOL_BLOCK.matcher(text);
        while (matcher.find()) {
            String rawText = matcher.group();
            try {
                calls.add(ImmutableToolCall.builder()
                        .toolName(matcher.group(1))
                        .arguments(parseArguments(matcher.group(2).trim()))
                        .rawText(rawText)
                        .build());
            } catch (JsonProcessingException e) {
                logger.warn("Failed to parse tool call: {}", rawText, e);
            }
        }
        return calls;
    }

    List<JsonNode> parseArguments(String argsText) throws JsonProcessingException {
        List<JsonNode> args = new ArrayList<>();
        if (argsText.isEmpty()) {
            return args;
        }
        mapper.readTree("[" + argsText + "]").forEach(args::add);
        return args;
    }
}

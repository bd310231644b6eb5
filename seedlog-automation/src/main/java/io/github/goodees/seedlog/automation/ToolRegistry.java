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

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Tools available to automations, keyed by name.
 */
public class ToolRegistry {
    private static final Logger logger = LoggerFactory.getLogger(ToolRegistry.class);

    private final Map<String, AutomationTool> tools = new ConcurrentHashMap<>();

    /**
     * @throws IllegalArgumentException when a tool of the same name is registered
     */
    public void register(AutomationTool tool) {
        if (tools.putIfAbsent(tool.name(), tool) != null) {
            throw new IllegalArgumentException("Tool \"" + tool.name() + "\" is already registered");
        }
        logger.debug("Registered tool {}", tool.name());
    }

    public Optional<AutomationTool> get(String name) {
        return Optional.ofNullable(tools.get(name));
    }

    public boolean has(String name) {
        return tools.containsKey(name);
    }

    /**
     * Registered tools ordered by name.
     */
    public List<AutomationTool> getAll() {
        List<AutomationTool> result = new ArrayList<>(tools.values());
        result.sort(Comparator.comparing(AutomationTool::name));
        return result;
    }
}

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

import io.github.goodees.seedlog.automation.fetch.FetchTool;
import org.junit.Before;
import org.junit.Test;

import static java.util.stream.Collectors.toList;
import static org.hamcrest.Matchers.contains;
import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertSame;
import static org.junit.Assert.assertThat;
import static org.junit.Assert.assertTrue;
import static org.junit.Assert.fail;

public class ToolRegistryTest {
    private ToolRegistry registry;

    @Before
    public void setUp() {
        registry = new ToolRegistry();
    }

    @Test
    public void registered_tools_are_found_by_name() {
        FetchTool fetch = new FetchTool();
        registry.register(fetch);
        assertTrue(registry.has("wget"));
        assertSame(fetch, registry.get("wget").get());
        assertFalse(registry.get("curl").isPresent());
    }

    @Test
    public void duplicate_name_is_rejected() {
        registry.register(new EchoTool("echo"));
        try {
            registry.register(new EchoTool("echo"));
            fail("Second registration should fail");
        } catch (IllegalArgumentException e) {
            assertEquals("Tool \"echo\" is already registered", e.getMessage());
        }
    }

    @Test
    public void all_tools_are_listed_by_name() {
        registry.register(new EchoTool("zeta"));
        registry.register(new FetchTool());
        registry.register(new EchoTool("alpha"));
        assertThat(registry.getAll().stream().map(AutomationTool::name).collect(toList()),
            contains("alpha", "wget", "zeta"));
    }
}

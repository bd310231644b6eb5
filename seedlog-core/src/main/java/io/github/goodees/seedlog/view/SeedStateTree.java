package io.github.goodees.seedlog.view;

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

import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.github.goodees.seedlog.Json;
import io.github.goodees.seedlog.projection.CategoryRef;
import io.github.goodees.seedlog.projection.SeedState;
import io.github.goodees.seedlog.projection.TagRef;

/**
 * Converts projected seeds into the tree that events patch:
 * <pre>
 * {
 *   "seed": {"id": ..., "content": ..., "created_at": ...},
 *   "timestamp": ...,
 *   "metadata": {},
 *   "tags": [{"id": ..., "name": ...}],
 *   "categories": [{"id": ..., "name": ..., "path": ...}]
 * }
 * </pre>
 */
public final class SeedStateTree {

    private SeedStateTree() {
    }

    public static ObjectNode toTree(SeedState state) {
        ObjectNode root = Json.object();
        ObjectNode seed = root.putObject("seed");
        seed.put("id", state.getSeedId());
        seed.put("content", state.getContent());
        seed.put("created_at", state.getCreatedAt().toString());
        root.put("timestamp", state.getUpdatedAt().toString());
        root.putObject("metadata");
        ArrayNode tags = root.putArray("tags");
        for (TagRef tag : state.getTags()) {
            tags.addObject().put("id", tag.getId()).put("name", tag.getName());
        }
        ArrayNode categories = root.putArray("categories");
        for (CategoryRef category : state.getCategories()) {
            categories.addObject()
                    .put("id", category.getId())
                    .put("name", category.getName())
                    .put("path", category.getPath());
        }
        return root;
    }
}

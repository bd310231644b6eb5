package io.github.goodees.seedlog.store.inmemory;

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

import io.github.goodees.seedlog.slug.SlugRegistry;

import java.util.HashMap;
import java.util.Map;
import java.util.Optional;

public class InMemorySlugRegistry implements SlugRegistry {
    private final Map<String, String> slugsByEntity = new HashMap<>();
    private final Map<String, String> entitiesBySlug = new HashMap<>();

    @Override
    public synchronized boolean exists(String slug) {
        return entitiesBySlug.containsKey(slug);
    }

    @Override
    public synchronized Optional<String> slugOf(String entityId) {
        return Optional.ofNullable(slugsByEntity.get(entityId));
    }

    @Override
    public synchronized Optional<String> entityFor(String slug) {
        return Optional.ofNullable(entitiesBySlug.get(slug));
    }

    @Override
    public synchronized boolean register(String entityId, String slug) {
        if (slugsByEntity.containsKey(entityId)) {
            throw new IllegalStateException("Entity " + entityId + " already has slug " + slugsByEntity.get(entityId));
        }
        if (entitiesBySlug.containsKey(slug)) {
            return false;
        }
        slugsByEntity.put(entityId, slug);
        entitiesBySlug.put(slug, entityId);
        return true;
    }

    @Override
    public synchronized boolean remove(String entityId) {
        String slug = slugsByEntity.remove(entityId);
        if (slug == null) {
            return false;
        }
        entitiesBySlug.remove(slug);
        return true;
    }
}

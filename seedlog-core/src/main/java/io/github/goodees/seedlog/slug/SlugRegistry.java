package io.github.goodees.seedlog.slug;

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

import java.util.Optional;

/**
 * Unique mapping between entities and their slugs.
 */
public interface SlugRegistry {

    boolean exists(String slug);

    Optional<String> slugOf(String entityId);

    Optional<String> entityFor(String slug);

    /**
     * Assign a slug to an entity.
     * @return false when the slug is already taken by any entity
     * @throws IllegalStateException when the entity already has a slug
     */
    boolean register(String entityId, String slug);

    /**
     * Drop the slug of an entity, used by administrative rebuilds and entity deletion.
     * @return true if the entity had a slug
     */
    boolean remove(String entityId);
}

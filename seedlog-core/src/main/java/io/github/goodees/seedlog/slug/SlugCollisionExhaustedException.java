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

/**
 * Every candidate slug up to the attempt limit was already taken.
 */
public class SlugCollisionExhaustedException extends IllegalStateException {
    private final String base;
    private final int attempts;

    public SlugCollisionExhaustedException(String base, int attempts) {
        super("No free slug for " + base + " after " + attempts + " attempts");
        this.base = base;
        this.attempts = attempts;
    }

    public String getBase() {
        return base;
    }

    public int getAttempts() {
        return attempts;
    }
}

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

import org.junit.Test;

import static org.junit.Assert.assertEquals;

public class SlugsTest {

    @Test
    public void words_are_joined_by_single_hyphens() {
        assertEquals("grow-tomatoes-on-the-balcony", Slugs.slugify("  Grow tomatoes   on the_balcony "));
    }

    @Test
    public void unicode_spaces_separate_words() {
        assertEquals("hello-world", Slugs.slugify("hello\u00A0world"));
        assertEquals("em-space-ideo-space", Slugs.slugify("em\u2003space\u3000ideo\u202Fspace"));
        assertEquals("bom", Slugs.slugify("\uFEFFbom"));
    }

    @Test
    public void repeated_punctuation_and_spaces_collapse() {
        assertEquals("hello-world-test", Slugs.slugify("Hello, World!!  Test"));
    }

    @Test
    public void punctuation_is_dropped() {
        assertEquals("whats-next-a-plan", Slugs.slugify("What's next?! -- a plan."));
    }

    @Test
    public void edge_hyphens_are_trimmed() {
        assertEquals("idea", Slugs.slugify("--idea--"));
    }

    @Test
    public void truncation_leaves_no_trailing_hyphen() {
        assertEquals("abc", Slugs.slugify("abc def", 4));
    }

    @Test
    public void text_without_word_characters_gives_empty_slug() {
        assertEquals("", Slugs.slugify("!?!"));
        assertEquals("", Slugs.slugify(null));
    }
}

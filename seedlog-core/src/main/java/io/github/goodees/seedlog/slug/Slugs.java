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

import java.util.Locale;
import java.util.regex.Pattern;

/**
 * Text normalization for URL slugs.
 */
public final class Slugs {
    public static final int DEFAULT_MAX_LENGTH = 50;

    // ASCII whitespace plus the Unicode spaces, \w stays ASCII
    private static final String SPACE = "\\s\\u00A0\\u1680\\u2000-\\u200A\\u2028\\u2029\\u202F\\u205F\\u3000\\uFEFF";
    private static final Pattern DISALLOWED = Pattern.compile("[^\\w" + SPACE + "-]");
    private static final Pattern SEPARATORS = Pattern.compile("[" + SPACE + "_-]+");
    private static final Pattern EDGE_HYPHENS = Pattern.compile("^-+|-+$");
    private static final Pattern TRAILING_HYPHENS = Pattern.compile("-+$");

    private Slugs() {
    }

    public static String slugify(String text) {
        return slugify(text, DEFAULT_MAX_LENGTH);
    }

    /**
     * Lowercase the text, drop everything but word characters, whitespace and hyphens, and join the words with single
     * hyphens. The result is cut to {@code maxLength} without leaving a trailing hyphen.
     *
     * @param text any text
     * @param maxLength maximal length of the result
     * @return the slug, empty if no word characters remain
     */
    public static String slugify(String text, int maxLength) {
        if (text == null) {
            return "";
        }
        String slug = text.toLowerCase(Locale.ROOT).strip();
        slug = DISALLOWED.matcher(slug).replaceAll("");
        slug = SEPARATORS.matcher(slug).replaceAll("-");
        slug = EDGE_HYPHENS.matcher(slug).replaceAll("");
        if (slug.length() > maxLength) {
            slug = TRAILING_HYPHENS.matcher(slug.substring(0, maxLength)).replaceAll("");
        }
        return slug;
    }
}

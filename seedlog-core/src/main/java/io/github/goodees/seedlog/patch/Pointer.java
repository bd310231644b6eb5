package io.github.goodees.seedlog.patch;

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

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.regex.Pattern;

/**
 * Parsed RFC 6901 pointer.
 */
final class Pointer {
    private static final Pattern ARRAY_INDEX = Pattern.compile("0|[1-9][0-9]*");

    private final String text;
    private final List<String> tokens;

    private Pointer(String text, List<String> tokens) {
        this.text = text;
        this.tokens = tokens;
    }

    static boolean isValid(String text) {
        return text != null && (text.isEmpty() || text.charAt(0) == '/') && !text.matches(".*~[^01].*|.*~$");
    }

    /**
     * @return parsed pointer or null if the text is not a valid pointer
     */
    static Pointer parse(String text) {
        if (!isValid(text)) {
            return null;
        }
        if (text.isEmpty()) {
            return new Pointer(text, Collections.emptyList());
        }
        List<String> tokens = new ArrayList<>();
        for (String raw : text.substring(1).split("/", -1)) {
            tokens.add(raw.replace("~1", "/").replace("~0", "~"));
        }
        return new Pointer(text, Collections.unmodifiableList(tokens));
    }

    boolean isRoot() {
        return tokens.isEmpty();
    }

    List<String> parentTokens() {
        return tokens.subList(0, tokens.size() - 1);
    }

    String last() {
        return tokens.get(tokens.size() - 1);
    }

    List<String> tokens() {
        return tokens;
    }

    boolean isProperPrefixOf(Pointer other) {
        return other.tokens.size() > tokens.size() && other.tokens.subList(0, tokens.size()).equals(tokens);
    }

    static int arrayIndex(String token) {
        if (!ARRAY_INDEX.matcher(token).matches() || token.length() > 9) {
            return -1;
        }
        return Integer.parseInt(token);
    }

    @Override
    public String toString() {
        return text;
    }
}

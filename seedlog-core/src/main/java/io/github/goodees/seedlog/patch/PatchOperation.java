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

import com.fasterxml.jackson.databind.JsonNode;
import io.github.goodees.seedlog.immutables.ValueStyle;
import org.immutables.value.Value;

import java.util.Locale;
import java.util.Optional;

/**
 * Single RFC 6902 operation. {@code value} is required for add, replace and test, {@code from} for move and copy;
 * see {@link PatchValidator}.
 */
@Value.Immutable
@ValueStyle
public interface PatchOperation {

    enum Op {
        ADD, REMOVE, REPLACE, MOVE, COPY, TEST;

        public String wireName() {
            return name().toLowerCase(Locale.ROOT);
        }

        public boolean requiresValue() {
            return this == ADD || this == REPLACE || this == TEST;
        }

        public boolean requiresFrom() {
            return this == MOVE || this == COPY;
        }

        public static Optional<Op> of(String wireName) {
            for (Op op : values()) {
                if (op.wireName().equals(wireName)) {
                    return Optional.of(op);
                }
            }
            return Optional.empty();
        }
    }

    Op getOp();

    String getPath();

    Optional<JsonNode> getValue();

    Optional<String> getFrom();

    static PatchOperation add(String path, JsonNode value) {
        return ImmutablePatchOperation.builder().op(Op.ADD).path(path).value(value).build();
    }

    static PatchOperation remove(String path) {
        return ImmutablePatchOperation.builder().op(Op.REMOVE).path(path).build();
    }

    static PatchOperation replace(String path, JsonNode value) {
        return ImmutablePatchOperation.builder().op(Op.REPLACE).path(path).value(value).build();
    }

    static PatchOperation move(String from, String path) {
        return ImmutablePatchOperation.builder().op(Op.MOVE).from(from).path(path).build();
    }

    static PatchOperation copy(String from, String path) {
        return ImmutablePatchOperation.builder().op(Op.COPY).from(from).path(path).build();
    }

    static PatchOperation test(String path, JsonNode value) {
        return ImmutablePatchOperation.builder().op(Op.TEST).path(path).value(value).build();
    }
}

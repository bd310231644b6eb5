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
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.github.goodees.seedlog.Json;
import io.github.goodees.seedlog.ValidationException;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.Iterator;
import java.util.List;
import java.util.Optional;

/**
 * Ordered list of operations applied atomically to a JSON tree.
 *
 * <p>Application never modifies its input. Operations run against a deep copy, so a failure in any operation leaves
 * the caller with the untouched original.
 */
public final class JsonPatch {
    private static final Comparator<JsonNode> NUMERIC_AWARE = (a, b) -> {
        if (a.isNumber() && b.isNumber()) {
            return a.decimalValue().compareTo(b.decimalValue());
        }
        return a.equals(b) ? 0 : 1;
    };

    private final List<PatchOperation> operations;

    public JsonPatch(List<PatchOperation> operations) {
        this.operations = Collections.unmodifiableList(new ArrayList<>(operations));
    }

    public List<PatchOperation> getOperations() {
        return operations;
    }

    /**
     * Read a patch from its JSON array form. Only the shape of individual operations is checked here, see
     * {@link PatchValidator} for semantic checks.
     * @param json array of {@code {op, path, value?, from?}} objects
     * @return the parsed patch
     * @throws ValidationException if the document is not a patch
     */
    public static JsonPatch fromJson(JsonNode json) throws ValidationException {
        if (json == null || !json.isArray()) {
            throw new ValidationException("Patch must be an array of operations");
        }
        List<PatchOperation> result = new ArrayList<>();
        int index = 0;
        for (JsonNode node : json) {
            result.add(readOperation(index++, node));
        }
        return new JsonPatch(result);
    }

    private static PatchOperation readOperation(int index, JsonNode node) throws ValidationException {
        if (!node.isObject()) {
            throw new ValidationException("Operation " + index + " must be an object");
        }
        JsonNode op = node.get("op");
        Optional<PatchOperation.Op> parsedOp = op != null && op.isTextual() ? PatchOperation.Op.of(op.asText())
                : Optional.empty();
        if (!parsedOp.isPresent()) {
            throw new ValidationException("Operation " + index + " has unknown op " + op);
        }
        JsonNode path = node.get("path");
        if (path == null || !path.isTextual()) {
            throw new ValidationException("Operation " + index + " requires a path");
        }
        ImmutablePatchOperation.Builder builder = ImmutablePatchOperation.builder()
                .op(parsedOp.get())
                .path(path.asText());
        if (node.has("value")) {
            builder.value(node.get("value"));
        }
        JsonNode from = node.get("from");
        if (from != null && from.isTextual()) {
            builder.from(from.asText());
        }
        return builder.build();
    }

    public ArrayNode toJson() {
        ArrayNode result = Json.array();
        for (PatchOperation operation : operations) {
            ObjectNode node = result.addObject();
            node.put("op", operation.getOp().wireName());
            node.put("path", operation.getPath());
            operation.getValue().ifPresent(v -> node.set("value", v));
            operation.getFrom().ifPresent(f -> node.put("from", f));
        }
        return result;
    }

    /**
     * Apply all operations in order.
     * @param document the target, left unmodified
     * @return new document with all operations applied
     * @throws PatchApplicationException when any operation fails
     */
    public JsonNode apply(JsonNode document) throws PatchApplicationException {
        JsonNode result = document.deepCopy();
        for (int i = 0; i < operations.size(); i++) {
            result = applyOperation(result, i, operations.get(i));
        }
        return result;
    }

    private JsonNode applyOperation(JsonNode doc, int index, PatchOperation op) throws PatchApplicationException {
        Pointer path = pointer(index, op, op.getPath());
        switch (op.getOp()) {
            case ADD:
                return add(doc, index, op, path, requireValue(index, op).deepCopy());
            case REMOVE:
                remove(doc, index, op, path);
                return doc;
            case REPLACE: {
                JsonNode value = requireValue(index, op).deepCopy();
                if (path.isRoot()) {
                    return value;
                }
                remove(doc, index, op, path);
                return add(doc, index, op, path, value);
            }
            case MOVE: {
                Pointer from = pointer(index, op, op.getFrom().orElse(null));
                if (from.isProperPrefixOf(path)) {
                    throw PatchApplicationException.moveIntoChild(index, op);
                }
                JsonNode value = existing(doc, index, op, from);
                if (from.isRoot()) {
                    return doc;
                }
                remove(doc, index, op, from);
                return add(doc, index, op, path, value);
            }
            case COPY: {
                Pointer from = pointer(index, op, op.getFrom().orElse(null));
                return add(doc, index, op, path, existing(doc, index, op, from).deepCopy());
            }
            case TEST:
                if (!existing(doc, index, op, path).equals(NUMERIC_AWARE, requireValue(index, op))) {
                    throw PatchApplicationException.testFailed(index, op);
                }
                return doc;
            default:
                throw new IllegalArgumentException("Unsupported operation " + op.getOp());
        }
    }

    private static Pointer pointer(int index, PatchOperation op, String text) throws PatchApplicationException {
        Pointer pointer = Pointer.parse(text);
        if (pointer == null) {
            throw PatchApplicationException.invalidPointer(index, op, String.valueOf(text));
        }
        return pointer;
    }

    private static JsonNode requireValue(int index, PatchOperation op) throws PatchApplicationException {
        return op.getValue().orElseThrow(() -> PatchApplicationException.missingValue(index, op));
    }

    private static JsonNode resolve(JsonNode doc, List<String> tokens) {
        JsonNode current = doc;
        Iterator<String> it = tokens.iterator();
        while (current != null && it.hasNext()) {
            String token = it.next();
            if (current.isObject()) {
                current = current.get(token);
            } else if (current.isArray()) {
                int i = Pointer.arrayIndex(token);
                current = i >= 0 && i < current.size() ? current.get(i) : null;
            } else {
                current = null;
            }
        }
        return current;
    }

    private static JsonNode existing(JsonNode doc, int index, PatchOperation op, Pointer pointer)
            throws PatchApplicationException {
        JsonNode node = resolve(doc, pointer.tokens());
        if (node == null) {
            throw PatchApplicationException.missingTarget(index, op, pointer.toString());
        }
        return node;
    }

    private static JsonNode add(JsonNode doc, int index, PatchOperation op, Pointer path, JsonNode value)
            throws PatchApplicationException {
        if (path.isRoot()) {
            return value;
        }
        JsonNode parent = resolve(doc, path.parentTokens());
        if (parent != null && parent.isObject()) {
            ((ObjectNode) parent).set(path.last(), value);
        } else if (parent != null && parent.isArray()) {
            ArrayNode array = (ArrayNode) parent;
            if ("-".equals(path.last())) {
                array.add(value);
            } else {
                int i = Pointer.arrayIndex(path.last());
                if (i < 0 || i > array.size()) {
                    throw PatchApplicationException.invalidIndex(index, op, path.toString());
                }
                array.insert(i, value);
            }
        } else {
            throw PatchApplicationException.missingParent(index, op, path.toString());
        }
        return doc;
    }

    private static void remove(JsonNode doc, int index, PatchOperation op, Pointer path)
            throws PatchApplicationException {
        if (path.isRoot()) {
            throw PatchApplicationException.rootRemoval(index, op);
        }
        JsonNode parent = resolve(doc, path.parentTokens());
        if (parent != null && parent.isObject() && parent.has(path.last())) {
            ((ObjectNode) parent).remove(path.last());
        } else if (parent != null && parent.isArray()) {
            int i = Pointer.arrayIndex(path.last());
            if (i < 0 || i >= parent.size()) {
                throw PatchApplicationException.missingTarget(index, op, path.toString());
            }
            ((ArrayNode) parent).remove(i);
        } else {
            throw PatchApplicationException.missingTarget(index, op, path.toString());
        }
    }

    @Override
    public boolean equals(Object o) {
        return o instanceof JsonPatch && operations.equals(((JsonPatch) o).operations);
    }

    @Override
    public int hashCode() {
        return operations.hashCode();
    }

    @Override
    public String toString() {
        return toJson().toString();
    }
}

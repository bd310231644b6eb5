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

import io.github.goodees.seedlog.ValidationException;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.List;

/**
 * Checks patches before they are stored as events. Besides the RFC 6902 shape of each operation, paths may be
 * confined to a set of allowed top-level prefixes of the view tree.
 */
public class PatchValidator {
    private final List<String> allowedPrefixes;

    /**
     * Validator accepting any valid pointer.
     */
    public PatchValidator() {
        this(Collections.emptyList());
    }

    /**
     * @param allowedPrefixes pointers that every {@code path} and {@code from} must equal or be nested under. Empty
     *                        collection allows any path.
     */
    public PatchValidator(Collection<String> allowedPrefixes) {
        this.allowedPrefixes = Collections.unmodifiableList(new ArrayList<>(allowedPrefixes));
    }

    public List<String> getAllowedPrefixes() {
        return allowedPrefixes;
    }

    public void validate(JsonPatch patch) throws ValidationException {
        List<PatchOperation> operations = patch.getOperations();
        if (operations.isEmpty()) {
            throw new ValidationException("Patch must contain at least one operation");
        }
        for (int i = 0; i < operations.size(); i++) {
            PatchOperation op = operations.get(i);
            checkPath(i, "path", op.getPath());
            if (op.getOp().requiresValue() && !op.getValue().isPresent()) {
                throw new ValidationException("Operation " + i + " (" + op.getOp().wireName() + ") requires a value");
            }
            if (op.getOp().requiresFrom()) {
                if (!op.getFrom().isPresent()) {
                    throw new ValidationException("Operation " + i + " (" + op.getOp().wireName()
                            + ") requires from");
                }
                checkPath(i, "from", op.getFrom().get());
            }
        }
    }

    private void checkPath(int index, String field, String pointer) throws ValidationException {
        if (!Pointer.isValid(pointer)) {
            throw new ValidationException("Operation " + index + " has invalid " + field + ": " + pointer);
        }
        if (!allowedPrefixes.isEmpty() && allowedPrefixes.stream().noneMatch(p -> isUnder(pointer, p))) {
            throw new ValidationException("Operation " + index + " " + field + " " + pointer
                    + " is outside of allowed paths " + allowedPrefixes);
        }
    }

    private static boolean isUnder(String pointer, String prefix) {
        return pointer.equals(prefix) || pointer.startsWith(prefix + "/");
    }
}

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

/**
 * An operation of a patch could not be applied. The whole patch is then considered inert.
 */
public class PatchApplicationException extends Exception {
    private final int operationIndex;

    protected PatchApplicationException(int operationIndex, String message) {
        super(message);
        this.operationIndex = operationIndex;
    }

    /**
     * @return position of the failing operation within its patch
     */
    public int getOperationIndex() {
        return operationIndex;
    }

    static PatchApplicationException missingTarget(int index, PatchOperation op, String pointer) {
        return new PatchApplicationException(index, op.getOp().wireName() + ": no value at " + pointer);
    }

    static PatchApplicationException missingValue(int index, PatchOperation op) {
        return new PatchApplicationException(index, op.getOp().wireName() + ": operation has no value");
    }

    static PatchApplicationException missingParent(int index, PatchOperation op, String pointer) {
        return new PatchApplicationException(index, op.getOp().wireName() + ": parent of " + pointer
                + " is not an object or array");
    }

    static PatchApplicationException invalidIndex(int index, PatchOperation op, String pointer) {
        return new PatchApplicationException(index, op.getOp().wireName() + ": invalid array index in " + pointer);
    }

    static PatchApplicationException invalidPointer(int index, PatchOperation op, String pointer) {
        return new PatchApplicationException(index, op.getOp().wireName() + ": invalid JSON pointer " + pointer);
    }

    static PatchApplicationException testFailed(int index, PatchOperation op) {
        return new PatchApplicationException(index, "test: value at " + op.getPath() + " differs");
    }

    static PatchApplicationException moveIntoChild(int index, PatchOperation op) {
        return new PatchApplicationException(index, "move: cannot move " + op.getFrom().orElse("")
                + " into its own child " + op.getPath());
    }

    static PatchApplicationException rootRemoval(int index, PatchOperation op) {
        return new PatchApplicationException(index, op.getOp().wireName() + ": cannot remove the document root");
    }
}

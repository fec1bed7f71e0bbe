/*
 * Copyright (c) nosqlbench
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *   http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing,
 * software distributed under the License is distributed on an
 * "AS IS" BASIS, WITHOUT WARRANTIES OR CONDITIONS OF ANY
 * KIND, either express or implied.  See the License for the
 * specific language governing permissions and limitations
 * under the License.
 */

package io.nosqlbench.cmdsweep.api.errors;

/// Thrown during iteration of a projected value source when an underlying tuple is too short
/// to contain the projected index.
public class ProjectionIndexException extends IndexOutOfBoundsException {

    private final int index;
    private final int tupleLength;

    public ProjectionIndexException(int index, int tupleLength, Object tuple) {
        super(tupleLength < 0
            ? "Cannot project index " + index + " from a value which is not a tuple: " + tuple
            : "Cannot project index " + index + " from a tuple of length " + tupleLength + ": " + tuple);
        this.index = index;
        this.tupleLength = tupleLength;
    }

    /// @return the projected index
    public int index() {
        return index;
    }

    /// @return the length of the offending tuple, or `-1` if the element was not a tuple
    public int tupleLength() {
        return tupleLength;
    }
}

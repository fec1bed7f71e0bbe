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

/// Thrown during iteration when a parameter group's value source yields a tuple whose length
/// differs from the number of keys in the group.
///
/// This can only be detected lazily, since the value source is not read at construction time.
/// An element which is not a tuple at all is reported with an actual length of `-1`.
public class ShapeMismatchException extends RuntimeException {

    private final int expectedLength;
    private final int actualLength;

    public ShapeMismatchException(int expectedLength, int actualLength, Object value) {
        super(formatMessage(expectedLength, actualLength, value));
        this.expectedLength = expectedLength;
        this.actualLength = actualLength;
    }

    /// @return the number of keys in the group
    public int expectedLength() {
        return expectedLength;
    }

    /// @return the length of the offending tuple, or `-1` if the element was not a tuple
    public int actualLength() {
        return actualLength;
    }

    private static String formatMessage(int expectedLength, int actualLength, Object value) {
        if (actualLength < 0) {
            return String.format(
                "Number of keys (%d) cannot be matched to a value which is not a tuple: %s",
                expectedLength, value);
        }
        return String.format(
            "Number of keys (%d) does not match the length of tuple of values (%d): %s",
            expectedLength, actualLength, value);
    }
}

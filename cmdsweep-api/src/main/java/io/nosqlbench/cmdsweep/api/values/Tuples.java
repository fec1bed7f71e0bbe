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

package io.nosqlbench.cmdsweep.api.values;

import java.util.Arrays;
import java.util.List;
import java.util.Optional;

/// Tuple views over the elements of grouped value sources.
///
/// A tuple is either a [List] or an object array. Primitive arrays are not tuples.
public final class Tuples {

    private Tuples() {
    }

    /// View a value as a tuple.
    /// @param value a candidate tuple
    /// @return the tuple as a list, or empty if the value is not a tuple
    public static Optional<List<?>> asTuple(Object value) {
        if (value instanceof List<?> list) {
            return Optional.of(list);
        }
        if (value instanceof Object[] array) {
            return Optional.of(Arrays.asList(array));
        }
        return Optional.empty();
    }
}

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

package io.nosqlbench.cmdsweep.api.format;

import java.util.List;

/// The closed set of value shapes a [ValueFormatter] renders differently.
public enum ValueKind {
    /// a [Double] or [Float]
    FLOAT,
    /// a [List] or an object array
    LIST,
    /// anything else, rendered through its natural string form
    OTHER;

    /// Classify a value by its shape.
    /// @param value any value, possibly null
    /// @return the kind of the value; null is [#OTHER]
    public static ValueKind of(Object value) {
        if (value instanceof Double || value instanceof Float) {
            return FLOAT;
        }
        if (value instanceof List<?> || value instanceof Object[]) {
            return LIST;
        }
        return OTHER;
    }
}

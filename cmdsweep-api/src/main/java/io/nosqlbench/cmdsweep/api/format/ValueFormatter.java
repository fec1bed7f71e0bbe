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

import io.nosqlbench.cmdsweep.api.errors.UnsupportedValueException;

import java.util.function.Function;

/// Renders a single bound value as a string, with one method per [ValueKind].
///
/// [#formatValue(Object)] classifies the value and dispatches to the matching method.
public interface ValueFormatter extends Function<Object, String> {

    String formatFloat(double value);

    /// Render a list-shaped value.
    /// @param value a [java.util.List] or object array
    /// @return the rendered list
    /// @throws UnsupportedValueException if the value is not list-shaped
    String formatList(Object value);

    /// Render any value which is neither a float nor a list through its natural string form.
    /// @param value the value
    /// @return the rendered value
    /// @throws UnsupportedValueException if the value is null
    default String formatOther(Object value) {
        if (value == null) {
            throw new UnsupportedValueException(ValueKind.OTHER, null, "null values have no string form");
        }
        return value.toString();
    }

    default String formatValue(Object value) {
        return switch (ValueKind.of(value)) {
            case FLOAT -> formatFloat(((Number) value).doubleValue());
            case LIST -> formatList(value);
            case OTHER -> formatOther(value);
        };
    }

    @Override
    default String apply(Object value) {
        return formatValue(value);
    }
}

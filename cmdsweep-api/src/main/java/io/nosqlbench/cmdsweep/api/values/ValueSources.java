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

import io.nosqlbench.cmdsweep.api.errors.SweepValidationException;

import java.util.Arrays;
import java.util.Collection;

/// Factory methods for [ValueSource]s.
public final class ValueSources {

    private ValueSources() {
    }

    /// Create a fixed source over literal values.
    /// @param values the values, in order
    /// @param <T> the value type
    /// @return a fixed value source
    @SafeVarargs
    public static <T> FixedValueSource<T> of(T... values) {
        return new FixedValueSource<>(Arrays.asList(values));
    }

    /// Normalize the values given to a parameter or group into a [ValueSource].
    ///
    /// - a [ValueSource] is returned as is
    /// - a [Collection] or an object array is copied into a [FixedValueSource]
    /// - any other [Iterable] is wrapped, not copied, in an [IterableValueSource], so it is
    ///   read lazily on each traversal and may be unbounded
    /// - anything else, including null, is rejected
    ///
    /// @param values the values as given by the caller
    /// @return a value source over the given values
    /// @throws SweepValidationException if the values are not iterable
    public static ValueSource<?> normalize(Object values) {
        if (values instanceof ValueSource<?> source) {
            return source;
        }
        if (values instanceof Collection<?> collection) {
            return new FixedValueSource<>(collection);
        }
        if (values instanceof Iterable<?> iterable) {
            return new IterableValueSource<>(iterable);
        }
        if (values instanceof Object[] array) {
            return new FixedValueSource<>(Arrays.asList(array));
        }
        throw new SweepValidationException("values has to be iterable. Was " + values);
    }
}

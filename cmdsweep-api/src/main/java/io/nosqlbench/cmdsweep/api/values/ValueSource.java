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

import java.util.Iterator;

/// The candidate values for one logical parameter slot.
///
/// A value source is lazy and restartable: every call to [#iterator()] begins a fresh traversal
/// which yields the same sequence as any other traversal, and iterating never changes the
/// source. Sources may be unbounded: [FixedValueSource] is always finite, while an
/// [IterableValueSource] is as long as the iterable it wraps.
///
/// Sources whose elements are tuples (a [java.util.List] or an object array) feed a
/// parameter group, where each tuple supplies one value per group key.
/// @param <T> the value type
public interface ValueSource<T> extends Iterable<T> {

    /// Counts the values produced by one full traversal.
    /// @return the number of values in this source
    default long count() {
        long count = 0L;
        Iterator<T> iter = iterator();
        while (iter.hasNext()) {
            iter.next();
            count++;
        }
        return count;
    }
}

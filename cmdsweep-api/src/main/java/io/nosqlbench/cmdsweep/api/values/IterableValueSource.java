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

/// A [ValueSource] view over a caller's [Iterable].
///
/// Nothing is copied: each traversal asks the wrapped iterable for a fresh iterator, so the
/// iterable must be restartable and may be unbounded. [#count()] walks a full traversal, and
/// never returns for an unbounded iterable.
public class IterableValueSource<T> implements ValueSource<T> {

    private final Iterable<? extends T> values;

    public IterableValueSource(Iterable<? extends T> values) {
        this.values = values;
    }

    @Override
    @SuppressWarnings("unchecked")
    public Iterator<T> iterator() {
        return (Iterator<T>) values.iterator();
    }

    @Override
    public String toString() {
        return "IterableValueSource[" + values + "]";
    }
}

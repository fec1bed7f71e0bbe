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

import io.nosqlbench.cmdsweep.api.errors.ProjectionIndexException;
import io.nosqlbench.cmdsweep.api.errors.SweepValidationException;

import java.util.Iterator;
import java.util.List;
import java.util.Objects;

/// A [ValueSource] which yields one coordinate of each tuple of another source.
///
/// This is the per-key view of a parameter group: for every tuple `t` of the wrapped source,
/// it yields `t[index]`. Short tuples are only detected when they are reached, and fail with
/// a [ProjectionIndexException].
public class ProjectedValueSource implements ValueSource<Object> {

    private final ValueSource<?> tuples;
    private final int index;

    public ProjectedValueSource(ValueSource<?> tuples, int index) {
        this.tuples = Objects.requireNonNull(tuples, "tuples cannot be null");
        if (index < 0) {
            throw new SweepValidationException("projection index must be non-negative, got: " + index);
        }
        this.index = index;
    }

    /// @return the source of tuples this projection reads from
    public ValueSource<?> tuples() {
        return tuples;
    }

    /// @return the projected tuple index
    public int index() {
        return index;
    }

    @Override
    public Iterator<Object> iterator() {
        Iterator<?> inner = tuples.iterator();
        return new Iterator<>() {
            @Override
            public boolean hasNext() {
                return inner.hasNext();
            }

            @Override
            public Object next() {
                Object element = inner.next();
                List<?> tuple = Tuples.asTuple(element)
                    .orElseThrow(() -> new ProjectionIndexException(index, -1, element));
                if (tuple.size() <= index) {
                    throw new ProjectionIndexException(index, tuple.size(), element);
                }
                return tuple.get(index);
            }
        };
    }

    @Override
    public long count() {
        return tuples.count();
    }

    @Override
    public String toString() {
        return "ProjectedValueSource[" + index + "]<-" + tuples;
    }
}

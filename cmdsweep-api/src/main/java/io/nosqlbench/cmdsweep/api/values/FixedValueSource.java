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

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.Iterator;
import java.util.List;

/// A [ValueSource] over a literal, ordered list of values.
///
/// The given values are copied at construction, so later changes to the caller's collection
/// are not seen. Null elements are kept as they are.
public class FixedValueSource<T> implements ValueSource<T> {

    private final List<T> values;

    public FixedValueSource(Collection<? extends T> values) {
        this.values = Collections.unmodifiableList(new ArrayList<>(values));
    }

    /// @return the values of this source, in order
    public List<T> values() {
        return values;
    }

    @Override
    public Iterator<T> iterator() {
        return values.iterator();
    }

    @Override
    public long count() {
        return values.size();
    }

    @Override
    public String toString() {
        return "FixedValueSource" + values;
    }
}

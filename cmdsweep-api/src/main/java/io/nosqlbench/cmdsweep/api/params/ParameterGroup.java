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

package io.nosqlbench.cmdsweep.api.params;

import io.nosqlbench.cmdsweep.api.errors.ShapeMismatchException;
import io.nosqlbench.cmdsweep.api.errors.SweepValidationException;
import io.nosqlbench.cmdsweep.api.values.ProjectedValueSource;
import io.nosqlbench.cmdsweep.api.values.Tuples;
import io.nosqlbench.cmdsweep.api.values.ValueSource;
import io.nosqlbench.cmdsweep.api.values.ValueSources;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Iterator;
import java.util.List;

/// Several argument slots whose values are supplied jointly.
///
/// Each element of the group's value source is a tuple holding one value per key, so the
/// members of a group vary in lock-step and are never permuted against each other. The group
/// as a whole still takes part in the product with the other units of a sweep.
///
/// Tuples are checked as they are read: a tuple whose length differs from the number of keys
/// fails with a [ShapeMismatchException] at that point in the iteration, not before.
///
/// For each tuple, every member is bound through a freshly made [Parameter] over a
/// [ProjectedValueSource] of the group's values, so group members are addressable downstream
/// exactly like plain parameters.
///
/// # Usage
/// ```java
/// ParameterGroup schedule = new ParameterGroup(
///     List.of("lr", "epochs"),
///     List.of(List.of(0.1, 10), List.of(0.01, 100)),
///     Arrays.asList("--learning-rate", null));
/// ```
public class ParameterGroup implements ParameterUnit {

    private final List<String> keys;
    private final ValueSource<?> values;
    private final List<String> outputs;

    public ParameterGroup(List<String> keys, Object values) {
        this(keys, values, null);
    }

    /// Create a parameter group.
    /// @param keys    the member keys, in tuple order
    /// @param values  a [ValueSource] of tuples, or a collection, iterable, or array of tuples
    /// @param outputs the output names per member, or null; individual entries may be null
    /// @throws SweepValidationException if keys are missing or empty, outputs has the wrong
    ///     length, or the values are not iterable
    public ParameterGroup(List<String> keys, Object values, List<String> outputs) {
        if (keys == null || keys.isEmpty()) {
            throw new SweepValidationException("keys cannot be empty. Was " + keys);
        }
        for (String key : keys) {
            if (key == null || key.isEmpty()) {
                throw new SweepValidationException("group keys cannot contain an empty key. Was " + keys);
            }
        }
        if (outputs != null && outputs.size() != keys.size()) {
            throw new SweepValidationException(
                "outputs must have the same length as keys (" + keys.size() + "), but had "
                + outputs.size() + ": " + outputs);
        }
        this.keys = List.copyOf(keys);
        this.values = ValueSources.normalize(values);
        this.outputs = outputs == null ? null : Collections.unmodifiableList(new ArrayList<>(outputs));
    }

    @Override
    public List<String> keys() {
        return keys;
    }

    /// @return the per-member output names, or null if none were given
    public List<String> outputs() {
        return outputs;
    }

    public ValueSource<?> values() {
        return values;
    }

    /// @return the number of tuples in the group's value source
    @Override
    public long cardinality() {
        return values.count();
    }

    @Override
    public Iterator<List<ParameterBinding>> iterator() {
        Iterator<?> inner = values.iterator();
        return new Iterator<>() {
            @Override
            public boolean hasNext() {
                return inner.hasNext();
            }

            @Override
            public List<ParameterBinding> next() {
                return bind(inner.next());
            }
        };
    }

    private List<ParameterBinding> bind(Object element) {
        int width = keys.size();
        List<?> tuple = Tuples.asTuple(element)
            .orElseThrow(() -> new ShapeMismatchException(width, -1, element));
        if (tuple.size() != width) {
            throw new ShapeMismatchException(width, tuple.size(), element);
        }
        List<ParameterBinding> bindings = new ArrayList<>(width);
        for (int i = 0; i < width; i++) {
            String output = outputs == null ? null : outputs.get(i);
            Parameter member = new Parameter(keys.get(i), new ProjectedValueSource(values, i), output);
            bindings.add(new ParameterBinding(member, tuple.get(i)));
        }
        return Collections.unmodifiableList(bindings);
    }

    @Override
    public String toString() {
        return "ParameterGroup{" +
            "keys=" + keys +
            (outputs != null ? ", outputs=" + outputs : "") +
            ", values=" + values +
            '}';
    }
}

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

import io.nosqlbench.cmdsweep.api.errors.SweepValidationException;
import io.nosqlbench.cmdsweep.api.values.ValueSource;
import io.nosqlbench.cmdsweep.api.values.ValueSources;

import java.util.Iterator;
import java.util.List;

/// A single, independently varying argument slot.
///
/// A parameter is identified by its `key`. The optional `output` is the name a formatter
/// should emit in place of the default name derived from the key; resolving that name is up
/// to the formatter, so both are exposed here.
///
/// # Usage
/// ```java
/// Parameter kernel = new Parameter("kernel", List.of("gauss", "imq"));
/// Parameter width = new Parameter("width", ValueSources.of(1, 2, 4), "-w");
/// ```
public class Parameter implements ParameterUnit {

    private final String key;
    private final ValueSource<?> values;
    private final String output;

    /// Create a parameter whose name is derived from its key.
    /// @param key    the parameter key
    /// @param values a [ValueSource], or a collection, iterable, or array of literal values
    public Parameter(String key, Object values) {
        this(key, values, null);
    }

    /// Create a parameter.
    /// @param key    the parameter key
    /// @param values a [ValueSource], or a collection, iterable, or array of literal values
    /// @param output the name to emit for this parameter, or null to derive it from the key
    /// @throws SweepValidationException if the key is empty or the values are not iterable
    public Parameter(String key, Object values, String output) {
        if (key == null || key.isEmpty()) {
            throw new SweepValidationException("key cannot be empty. Was " + (key == null ? "null" : "''"));
        }
        this.key = key;
        this.values = ValueSources.normalize(values);
        this.output = output;
    }

    public String key() {
        return key;
    }

    /// @return the output name override, or null if none was given
    public String output() {
        return output;
    }

    public ValueSource<?> values() {
        return values;
    }

    @Override
    public List<String> keys() {
        return List.of(key);
    }

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
                return List.of(new ParameterBinding(Parameter.this, inner.next()));
            }
        };
    }

    @Override
    public String toString() {
        return "Parameter{" +
            "key='" + key + '\'' +
            (output != null ? ", output='" + output + '\'' : "") +
            ", values=" + values +
            '}';
    }
}

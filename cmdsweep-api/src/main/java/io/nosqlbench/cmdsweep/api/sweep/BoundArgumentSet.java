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

package io.nosqlbench.cmdsweep.api.sweep;

import io.nosqlbench.cmdsweep.api.params.ParameterBinding;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Iterator;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/// One fully bound point of a sweep: an ordered list of parameter bindings, one per leaf
/// parameter slot, in specification order.
///
/// Instances are immutable. A sweep makes a new one for every point it yields and does not
/// keep them.
public final class BoundArgumentSet implements Iterable<ParameterBinding> {

    private final List<ParameterBinding> bindings;

    public BoundArgumentSet(List<ParameterBinding> bindings) {
        Objects.requireNonNull(bindings, "bindings cannot be null");
        this.bindings = Collections.unmodifiableList(new ArrayList<>(bindings));
    }

    /// @return the bindings, in specification order
    public List<ParameterBinding> bindings() {
        return bindings;
    }

    public int size() {
        return bindings.size();
    }

    public ParameterBinding get(int index) {
        return bindings.get(index);
    }

    /// @return the key of every binding, in order, including any repeated keys
    public List<String> keys() {
        List<String> keys = new ArrayList<>(bindings.size());
        for (ParameterBinding binding : bindings) {
            keys.add(binding.key());
        }
        return keys;
    }

    /// @return the value of every binding, in order
    public List<Object> values() {
        List<Object> values = new ArrayList<>(bindings.size());
        for (ParameterBinding binding : bindings) {
            values.add(binding.value());
        }
        return values;
    }

    /// Look up the value bound to a key. Keys are not required to be unique within a sweep;
    /// when a key repeats, the first binding wins.
    /// @param key the parameter key
    /// @return the bound value, or empty if no binding has that key or its value is null
    public Optional<Object> valueOf(String key) {
        for (ParameterBinding binding : bindings) {
            if (binding.key().equals(key)) {
                return Optional.ofNullable(binding.value());
            }
        }
        return Optional.empty();
    }

    @Override
    public Iterator<ParameterBinding> iterator() {
        return bindings.iterator();
    }

    /// Two argument sets are equal when they bind the same keys, output names and values in
    /// the same order. Parameter instances themselves are not compared, since group members
    /// are made afresh for each tuple.
    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof BoundArgumentSet that)) {
            return false;
        }
        if (bindings.size() != that.bindings.size()) {
            return false;
        }
        for (int i = 0; i < bindings.size(); i++) {
            ParameterBinding mine = bindings.get(i);
            ParameterBinding theirs = that.bindings.get(i);
            if (!mine.key().equals(theirs.key())
                || !Objects.equals(mine.parameter().output(), theirs.parameter().output())
                || !Objects.equals(mine.value(), theirs.value())) {
                return false;
            }
        }
        return true;
    }

    @Override
    public int hashCode() {
        int result = 1;
        for (ParameterBinding binding : bindings) {
            result = 31 * result + Objects.hash(binding.key(), binding.parameter().output(), binding.value());
        }
        return result;
    }

    @Override
    public String toString() {
        return "BoundArgumentSet" + bindings;
    }
}

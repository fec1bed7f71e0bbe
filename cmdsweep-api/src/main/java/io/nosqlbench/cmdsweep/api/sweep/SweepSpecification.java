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

import io.nosqlbench.cmdsweep.api.errors.SweepValidationException;
import io.nosqlbench.cmdsweep.api.iteration.CartesianProductIterable;
import io.nosqlbench.cmdsweep.api.params.Parameter;
import io.nosqlbench.cmdsweep.api.params.ParameterBinding;
import io.nosqlbench.cmdsweep.api.params.ParameterGroup;
import io.nosqlbench.cmdsweep.api.params.ParameterUnit;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.Iterator;
import java.util.List;
import java.util.stream.Stream;
import java.util.stream.StreamSupport;

/// An ordered collection of [ParameterUnit]s, defining every combination to enumerate.
///
/// # Enumeration
///
/// Iterating a sweep yields one [BoundArgumentSet] per point of the cartesian product of its
/// units. The last unit varies fastest. Within a point, the bindings of each unit appear in
/// unit order, followed by the bindings within that unit in their own order. Members of a
/// [ParameterGroup] vary together, so a group contributes as many selections as it has
/// tuples.
///
/// For units `a = [1, 2]` and `b = [x, y, z]` the order is
/// `(1,x) (1,y) (1,z) (2,x) (2,y) (2,z)`.
///
/// # Laziness
///
/// Nothing is materialized ahead of time. Each call to [#iterator()] or [#stream()] is a new,
/// independent traversal, and stopping early leaves nothing behind. Errors from value sources,
/// such as a [io.nosqlbench.cmdsweep.api.errors.ShapeMismatchException], surface when the
/// offending value is reached.
///
/// # Usage
/// ```java
/// SweepSpecification sweep = SweepSpecification.builder()
///     .param("kernel", List.of("gauss", "imq"))
///     .param("kparams", List.of(1, 2, 3.2))
///     .build();
/// for (BoundArgumentSet args : sweep) {
///     System.out.println(formatter.format(args));
/// }
/// ```
public class SweepSpecification implements Iterable<BoundArgumentSet> {

    private static final Logger logger = LogManager.getLogger(SweepSpecification.class);

    private final List<ParameterUnit> units;

    /// Create a sweep over the given units. Keys are not checked for uniqueness.
    /// @param units the units, in enumeration order
    /// @throws SweepValidationException if the list or any unit is null
    public SweepSpecification(List<? extends ParameterUnit> units) {
        if (units == null) {
            throw new SweepValidationException("units cannot be null");
        }
        List<ParameterUnit> copy = new ArrayList<>(units.size());
        for (ParameterUnit unit : units) {
            if (unit == null) {
                throw new SweepValidationException("units cannot contain null. Was " + units);
            }
            copy.add(unit);
        }
        this.units = Collections.unmodifiableList(copy);
        logger.debug("Created sweep over {} units with keys {}", this.units.size(), keys());
    }

    public static SweepSpecification of(ParameterUnit... units) {
        return new SweepSpecification(Arrays.asList(units));
    }

    public static Builder builder() {
        return new Builder();
    }

    public List<ParameterUnit> units() {
        return units;
    }

    /// @return every key of every unit, in binding order
    public List<String> keys() {
        List<String> keys = new ArrayList<>();
        for (ParameterUnit unit : units) {
            keys.addAll(unit.keys());
        }
        return keys;
    }

    /// Compute the number of points in this sweep, which is the product of the cardinalities
    /// of its units. This traverses each unit's values once, but does not enumerate the
    /// product.
    /// @return the number of argument sets one traversal yields
    /// @throws ArithmeticException if the count overflows a long
    public long count() {
        long count = 1L;
        for (ParameterUnit unit : units) {
            count = Math.multiplyExact(count, unit.cardinality());
        }
        return count;
    }

    @Override
    public Iterator<BoundArgumentSet> iterator() {
        Iterator<List<List<ParameterBinding>>> product =
            new CartesianProductIterable<List<ParameterBinding>>(units).iterator();
        return new Iterator<>() {
            @Override
            public boolean hasNext() {
                return product.hasNext();
            }

            @Override
            public BoundArgumentSet next() {
                return new BoundArgumentSet(flatten(product.next()));
            }
        };
    }

    /// @return a sequential stream over a fresh traversal of this sweep
    public Stream<BoundArgumentSet> stream() {
        return StreamSupport.stream(spliterator(), false);
    }

    private static List<ParameterBinding> flatten(List<List<ParameterBinding>> selections) {
        List<ParameterBinding> flat = new ArrayList<>();
        for (List<ParameterBinding> selection : selections) {
            flat.addAll(selection);
        }
        return flat;
    }

    @Override
    public String toString() {
        return "SweepSpecification" + units;
    }

    /// Builder for a [SweepSpecification], adding units in enumeration order.
    public static final class Builder {
        private final List<ParameterUnit> units = new ArrayList<>();

        Builder() {
        }

        public Builder param(String key, Object values) {
            return unit(new Parameter(key, values));
        }

        public Builder param(String key, Object values, String output) {
            return unit(new Parameter(key, values, output));
        }

        public Builder group(List<String> keys, Object values) {
            return unit(new ParameterGroup(keys, values));
        }

        public Builder group(List<String> keys, Object values, List<String> outputs) {
            return unit(new ParameterGroup(keys, values, outputs));
        }

        public Builder unit(ParameterUnit unit) {
            units.add(unit);
            return this;
        }

        public SweepSpecification build() {
            return new SweepSpecification(units);
        }
    }
}

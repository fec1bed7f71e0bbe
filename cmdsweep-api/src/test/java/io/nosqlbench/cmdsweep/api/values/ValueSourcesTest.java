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
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Iterator;
import java.util.LinkedHashSet;
import java.util.List;

import static org.assertj.core.api.Assertions.*;

@DisplayName("Value sources")
class ValueSourcesTest {

    private static List<Object> valuesOf(ValueSource<?> source) {
        List<Object> values = new ArrayList<>();
        source.forEach(values::add);
        return values;
    }

    @Nested
    @DisplayName("FixedValueSource")
    class FixedValueSourceTest {

        @Test
        @DisplayName("should yield its values in order on every traversal")
        void shouldYieldValuesInOrder() {
            FixedValueSource<String> source = ValueSources.of("a", "b", "c");

            assertThat(source).containsExactly("a", "b", "c");
            assertThat(source).containsExactly("a", "b", "c");
            assertThat(source.count()).isEqualTo(3);
        }

        @Test
        @DisplayName("should copy the given collection")
        void shouldCopyCollection() {
            List<Integer> original = new ArrayList<>(List.of(1, 2));
            FixedValueSource<Integer> source = new FixedValueSource<>(original);
            original.add(3);

            assertThat(source.values()).containsExactly(1, 2);
        }

        @Test
        @DisplayName("should keep null values")
        void shouldKeepNulls() {
            FixedValueSource<String> source = new FixedValueSource<>(Arrays.asList("a", null));

            assertThat(source).containsExactly("a", null);
        }
    }

    @Nested
    @DisplayName("normalize")
    class NormalizeTest {

        @Test
        @DisplayName("should return value sources as they are")
        void shouldKeepValueSources() {
            FixedValueSource<Integer> source = ValueSources.of(1, 2);

            assertThat(ValueSources.normalize(source)).isSameAs(source);
        }

        @Test
        @DisplayName("should accept collections, iterables and arrays")
        void shouldAcceptIterableShapes() {
            Iterable<Integer> iterable = () -> List.of(5, 6).iterator();

            assertThat(valuesOf(ValueSources.normalize(new LinkedHashSet<>(List.of(3, 1, 2))))).containsExactly(3, 1, 2);
            assertThat(valuesOf(ValueSources.normalize(iterable))).containsExactly(5, 6);
            assertThat(valuesOf(ValueSources.normalize(new Object[]{"x", 1.5}))).containsExactly("x", 1.5);
        }

        @Test
        @DisplayName("should read plain iterables lazily on every traversal")
        void shouldWrapIterablesLazily() {
            List<Integer> backing = new ArrayList<>(List.of(1, 2));
            Iterable<Integer> iterable = backing::iterator;

            ValueSource<?> source = ValueSources.normalize(iterable);
            backing.add(3);

            assertThat(source).isInstanceOf(IterableValueSource.class);
            assertThat(valuesOf(source)).containsExactly(1, 2, 3);
            assertThat(source.count()).isEqualTo(3L);
        }

        @Test
        @DisplayName("should accept an unbounded iterable without reading it")
        void shouldAcceptUnboundedIterable() {
            Iterable<Integer> naturals = () -> new Iterator<>() {
                int next = 0;

                @Override
                public boolean hasNext() {
                    return true;
                }

                @Override
                public Integer next() {
                    return next++;
                }
            };

            ValueSource<?> source = ValueSources.normalize(naturals);
            Iterator<?> it = source.iterator();
            Object first = it.next();
            Object second = it.next();
            Object restarted = source.iterator().next();

            assertThat(first).isEqualTo(0);
            assertThat(second).isEqualTo(1);
            assertThat(restarted).isEqualTo(0);
        }

        @Test
        @DisplayName("should reject values which are not iterable")
        void shouldRejectScalars() {
            assertThatThrownBy(() -> ValueSources.normalize(42))
                .isInstanceOf(SweepValidationException.class)
                .hasMessageContaining("values has to be iterable");
            assertThatThrownBy(() -> ValueSources.normalize("abc"))
                .isInstanceOf(SweepValidationException.class);
            assertThatThrownBy(() -> ValueSources.normalize(null))
                .isInstanceOf(SweepValidationException.class);
        }
    }

    @Nested
    @DisplayName("ProjectedValueSource")
    class ProjectedValueSourceTest {

        @Test
        @DisplayName("should yield one coordinate of each tuple")
        void shouldProjectCoordinate() {
            ValueSource<?> tuples = ValueSources.of(List.of(0.1, 10), new Object[]{0.01, 100});

            assertThat(new ProjectedValueSource(tuples, 0)).containsExactly(0.1, 0.01);
            assertThat(new ProjectedValueSource(tuples, 1)).containsExactly(10, 100);
            assertThat(new ProjectedValueSource(tuples, 1).count()).isEqualTo(2);
        }

        @Test
        @DisplayName("should fail lazily on a tuple which is too short")
        void shouldFailOnShortTuple() {
            ValueSource<?> tuples = ValueSources.of(List.of(1, 2), List.of(3));
            ProjectedValueSource projected = new ProjectedValueSource(tuples, 1);
            Iterator<Object> it = projected.iterator();

            assertThat(it.next()).isEqualTo(2);
            assertThatThrownBy(it::next)
                .isInstanceOf(ProjectionIndexException.class)
                .isInstanceOf(IndexOutOfBoundsException.class)
                .satisfies(e -> {
                    ProjectionIndexException pie = (ProjectionIndexException) e;
                    assertThat(pie.index()).isEqualTo(1);
                    assertThat(pie.tupleLength()).isEqualTo(1);
                });
        }

        @Test
        @DisplayName("should fail on an element which is not a tuple")
        void shouldFailOnScalar() {
            ProjectedValueSource projected = new ProjectedValueSource(ValueSources.of("scalar"), 0);

            assertThatThrownBy(() -> projected.iterator().next())
                .isInstanceOf(ProjectionIndexException.class)
                .hasMessageContaining("not a tuple");
        }

        @Test
        @DisplayName("should reject a negative index")
        void shouldRejectNegativeIndex() {
            assertThatThrownBy(() -> new ProjectedValueSource(ValueSources.of(List.of(1)), -1))
                .isInstanceOf(SweepValidationException.class);
        }
    }
}

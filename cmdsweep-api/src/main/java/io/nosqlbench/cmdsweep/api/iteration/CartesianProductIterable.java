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

package io.nosqlbench.cmdsweep.api.iteration;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.Iterator;
import java.util.List;
import java.util.NoSuchElementException;

/// An [Iterable] over the cartesian product of several restartable [Iterable]s, called axes.
///
/// Tuples are produced in lexicographic order: the last axis varies fastest, like an odometer.
/// Nothing is buffered. Whenever an axis rolls over, a fresh iterator is taken from it, so each
/// axis must yield the same sequence on every traversal. With no axes, the product holds a
/// single empty tuple; if any axis is empty, the product is empty.
///
/// Each call to [#iterator()] is an independent traversal. If an axis fails while the next
/// tuple is being assembled, the failure propagates and that traversal is finished: later calls
/// to `hasNext()` return false.
/// @param <T> the element type of the axes
public class CartesianProductIterable<T> implements Iterable<List<T>> {

    private final List<? extends Iterable<? extends T>> axes;

    public CartesianProductIterable(List<? extends Iterable<? extends T>> axes) {
        this.axes = List.copyOf(axes);
    }

    @Override
    public Iterator<List<T>> iterator() {
        return new ProductIterator<>(axes);
    }

    private static class ProductIterator<T> implements Iterator<List<T>> {
        private final List<? extends Iterable<? extends T>> axes;
        private final List<Iterator<? extends T>> cursors;
        private final Object[] current;
        private boolean started;
        private boolean pending;
        private boolean exhausted;

        ProductIterator(List<? extends Iterable<? extends T>> axes) {
            this.axes = axes;
            this.cursors = new ArrayList<>(Collections.nCopies(axes.size(), null));
            this.current = new Object[axes.size()];
        }

        @Override
        public boolean hasNext() {
            if (!pending && !exhausted) {
                try {
                    pending = started ? advance() : start();
                } catch (RuntimeException e) {
                    exhausted = true;
                    throw e;
                }
                exhausted = !pending;
            }
            return pending;
        }

        @Override
        @SuppressWarnings("unchecked")
        public List<T> next() {
            if (!hasNext()) {
                throw new NoSuchElementException("product exhausted");
            }
            pending = false;
            return (List<T>) Collections.unmodifiableList(Arrays.asList(current.clone()));
        }

        private boolean start() {
            started = true;
            return resetFrom(0);
        }

        /// Step the right-most axis which still has values and restart every axis after it.
        private boolean advance() {
            for (int axis = axes.size() - 1; axis >= 0; axis--) {
                Iterator<? extends T> cursor = cursors.get(axis);
                if (cursor.hasNext()) {
                    current[axis] = cursor.next();
                    return resetFrom(axis + 1);
                }
            }
            return false;
        }

        private boolean resetFrom(int first) {
            for (int axis = first; axis < axes.size(); axis++) {
                Iterator<? extends T> cursor = axes.get(axis).iterator();
                if (!cursor.hasNext()) {
                    return false;
                }
                cursors.set(axis, cursor);
                current[axis] = cursor.next();
            }
            return true;
        }
    }
}

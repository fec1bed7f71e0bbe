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

package io.nosqlbench.cmdsweep.api.sinks;

import io.nosqlbench.cmdsweep.api.sweep.BoundArgumentSet;

import java.io.IOException;

/// Consumes the argument sets of a sweep, such as by printing them or writing script files.
///
/// A sink pulls from the given iterable exactly once. An I/O failure aborts the remaining
/// work of that call and propagates; the sweep itself is not affected and can be traversed
/// again.
public interface SweepSink {

    /// Consume every argument set of one traversal.
    /// @param invocations the argument sets, typically a [io.nosqlbench.cmdsweep.api.sweep.SweepSpecification]
    /// @return the number of argument sets consumed
    /// @throws IOException if writing fails
    long write(Iterable<BoundArgumentSet> invocations) throws IOException;
}

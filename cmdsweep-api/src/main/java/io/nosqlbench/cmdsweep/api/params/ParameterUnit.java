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

import java.util.List;

/// The smallest element of a sweep specification.
///
/// Iterating a unit yields one list of [ParameterBinding]s per candidate selection. A single
/// [Parameter] yields singleton lists, while a [ParameterGroup] yields one binding per key
/// for each of its tuples. Because both shapes are lists of bindings, the sweep can combine
/// units without knowing which kind it holds.
///
/// Each call to [#iterator()] starts a fresh traversal.
public interface ParameterUnit extends Iterable<List<ParameterBinding>> {

    /// @return the keys of the parameter slots this unit binds, in binding order
    List<String> keys();

    /// @return the number of selections one traversal of this unit yields
    long cardinality();
}

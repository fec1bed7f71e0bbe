/// Sweep specifications and the argument sets they enumerate.
///
/// A {@link io.nosqlbench.cmdsweep.api.sweep.SweepSpecification} holds an ordered list of
/// parameter units and iterates their cartesian product lazily, yielding one
/// {@link io.nosqlbench.cmdsweep.api.sweep.BoundArgumentSet} per point.
///
/// ## Usage Example
///
/// ```java
/// SweepSpecification sweep = SweepSpecification.builder()
///     .param("kernel", List.of("gauss", "imq"))
///     .group(List.of("lr", "epochs"), List.of(List.of(0.1, 10), List.of(0.01, 100)))
///     .build();
/// sweep.stream().map(formatter::format).forEach(System.out::println);
/// ```
package io.nosqlbench.cmdsweep.api.sweep;

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

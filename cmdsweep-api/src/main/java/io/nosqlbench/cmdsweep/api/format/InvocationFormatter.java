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

package io.nosqlbench.cmdsweep.api.format;

import io.nosqlbench.cmdsweep.api.sweep.BoundArgumentSet;

import java.util.function.Function;

/// Turns one [BoundArgumentSet] into a command line string.
///
/// A formatter either returns the whole string or throws; it never hands back a partial
/// rendering.
public interface InvocationFormatter extends Function<BoundArgumentSet, String> {

    String format(BoundArgumentSet args);

    @Override
    default String apply(BoundArgumentSet args) {
        return format(args);
    }
}

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

import java.util.Objects;

/// One parameter bound to one of its candidate values.
///
/// @param parameter the parameter slot, never null
/// @param value     the chosen value, possibly null
public record ParameterBinding(Parameter parameter, Object value) {

    public ParameterBinding {
        Objects.requireNonNull(parameter, "parameter cannot be null");
    }

    /// @return the key of the bound parameter
    public String key() {
        return parameter.key();
    }

    @Override
    public String toString() {
        return parameter.key() + "=" + value;
    }
}

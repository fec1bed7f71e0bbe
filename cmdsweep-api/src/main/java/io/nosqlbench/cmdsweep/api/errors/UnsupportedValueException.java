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

package io.nosqlbench.cmdsweep.api.errors;

import io.nosqlbench.cmdsweep.api.format.ValueKind;

/// Thrown by a value formatter when a value cannot be rendered as the kind it was asked to
/// render, or has no string form at all.
public class UnsupportedValueException extends RuntimeException {

    private final ValueKind requestedKind;
    private final transient Object value;

    public UnsupportedValueException(ValueKind requestedKind, Object value, String message) {
        super(message);
        this.requestedKind = requestedKind;
        this.value = value;
    }

    /// @return the kind the formatter was asked to render
    public ValueKind requestedKind() {
        return requestedKind;
    }

    /// @return the offending value, possibly null
    public Object value() {
        return value;
    }
}

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

/// Thrown eagerly, when a sweep element is constructed, for any contract violation which can be
/// checked without iterating a value source.
///
/// Examples are an empty parameter key, an empty group key list, a group `outputs` list whose
/// length does not match its keys, values which are not iterable, or a script directory path
/// which names a regular file.
public class SweepValidationException extends IllegalArgumentException {

    public SweepValidationException(String message) {
        super(message);
    }

    public SweepValidationException(String message, Throwable cause) {
        super(message, cause);
    }
}

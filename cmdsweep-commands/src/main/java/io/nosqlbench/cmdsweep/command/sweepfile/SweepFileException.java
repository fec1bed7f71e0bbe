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

package io.nosqlbench.cmdsweep.command.sweepfile;

import java.nio.file.Path;

/// Thrown when a sweep description file cannot be read or does not describe a valid sweep.
public class SweepFileException extends RuntimeException {

    private final Path path;

    public SweepFileException(Path path, String message) {
        super(path + ": " + message);
        this.path = path;
    }

    public SweepFileException(Path path, String message, Throwable cause) {
        super(path + ": " + message, cause);
        this.path = path;
    }

    /// @return the sweep file which failed to load
    public Path getPath() {
        return path;
    }
}

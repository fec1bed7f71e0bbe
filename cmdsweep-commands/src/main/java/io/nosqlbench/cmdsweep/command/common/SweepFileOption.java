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

package io.nosqlbench.cmdsweep.command.common;

import io.nosqlbench.cmdsweep.api.sweep.SweepSpecification;
import io.nosqlbench.cmdsweep.command.sweepfile.SweepFileLoader;
import picocli.CommandLine;

import java.nio.file.Path;

/// Shared option naming the sweep description file to load.
public class SweepFileOption {

    @CommandLine.Option(
        names = {"-s", "--sweep"},
        description = "The sweep description file (.yaml, .yml or .json)",
        required = true
    )
    private Path sweepFile;

    /// @return the path of the sweep description
    public Path getSweepFile() {
        return sweepFile;
    }

    public void setSweepFile(Path sweepFile) {
        this.sweepFile = sweepFile;
    }

    /// Load the sweep described by the file.
    /// @return the sweep
    /// @throws io.nosqlbench.cmdsweep.command.sweepfile.SweepFileException if the description is invalid
    public SweepSpecification load() {
        return SweepFileLoader.load(sweepFile);
    }
}

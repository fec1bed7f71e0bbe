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

package io.nosqlbench.cmdsweep.command;

import picocli.CommandLine;

import java.util.concurrent.Callable;

/// Generate command lines for every combination of parameter values in a sweep.
///
/// This is the top level command. Its subcommands are discovered as bundled commands:
/// - `print`: write one command line per argument set to standard output
/// - `scripts`: write one bash script per argument set into a directory
/// - `count`: report how many argument sets a sweep has
///
/// # Basic Usage
/// ```
/// cmdsweep print -s sweep.yaml --prefix "python train.py "
/// cmdsweep scripts -s sweep.yaml -d jobs --run-token --file-begin '#!/bin/bash'
/// cmdsweep count -s sweep.yaml
/// ```
@CommandLine.Command(name = "cmdsweep",
    header = "Generate command lines for parameter sweeps",
    description = "Enumerates every combination of the parameter values in a sweep description, "
        + "and renders each as a command line.",
    mixinStandardHelpOptions = true,
    versionProvider = CMD_cmdsweep.VersionProvider.class,
    exitCodeListHeading = "Exit Codes:%n",
    exitCodeList = {"0: success", "2: error"},
    subcommands = {CommandLine.HelpCommand.class},
    modelTransformer = AddBundledCommands.class)
public class CMD_cmdsweep implements Callable<Integer> {

    @CommandLine.Spec
    private CommandLine.Model.CommandSpec spec;

    /// Exit code for any failure while loading, enumerating, formatting or writing a sweep.
    public static final int EXIT_ERROR = 2;

    /// run a cmdsweep command
    /// @param args
    ///     command line args
    public static void main(String[] args) {
        System.exit(newCommandLine().execute(args));
    }

    /// @return a command line for the top level command, configured as `main` runs it
    public static CommandLine newCommandLine() {
        return new CommandLine(new CMD_cmdsweep())
            .setCaseInsensitiveEnumValuesAllowed(true)
            .setOptionsCaseInsensitive(true);
    }

    @Override
    public Integer call() {
        spec.commandLine().usage(spec.commandLine().getOut());
        spec.commandLine().getOut().flush();
        return 0;
    }

    static class VersionProvider implements CommandLine.IVersionProvider {
        @Override
        public String[] getVersion() {
            String version = CMD_cmdsweep.class.getPackage().getImplementationVersion();
            return new String[]{"cmdsweep " + (version != null ? version : "development build")};
        }
    }
}

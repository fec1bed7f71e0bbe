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

package io.nosqlbench.cmdsweep.command.scripts;

import com.google.auto.service.AutoService;
import io.nosqlbench.cmdsweep.api.services.BundledCommand;
import io.nosqlbench.cmdsweep.api.services.Selector;
import io.nosqlbench.cmdsweep.api.sweep.SweepSpecification;
import io.nosqlbench.cmdsweep.command.CMD_cmdsweep;
import io.nosqlbench.cmdsweep.command.common.FormatOptions;
import io.nosqlbench.cmdsweep.command.common.SweepFileOption;
import io.nosqlbench.cmdsweep.formatters.ArgparseFormatter;
import io.nosqlbench.cmdsweep.writers.ScriptFileSink;
import io.nosqlbench.cmdsweep.writers.ScriptNamer;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import picocli.CommandLine;

import java.nio.file.Path;
import java.util.concurrent.Callable;

/**
 # Write one script per argument set

 Each argument set of the sweep becomes an executable bash script in the output directory,
 ready to be submitted as its own job. With `--run-token`, each script touches a token file
 when its command succeeds and does nothing while that token exists, so a batch can be
 re-run after partial failure.

 # Basic Usage
 ```
 scripts -s sweep.yaml -d jobs --file-begin '#!/bin/bash' --line-begin 'python train.py '
 scripts -s sweep.yaml -d jobs --run-token --naming indexed
 ```
 */
@Selector("scripts")
@AutoService(BundledCommand.class)
@CommandLine.Command(name = "scripts",
    header = "Write one bash script per argument set",
    description = "Enumerates the sweep and writes each argument set as a script into a directory.",
    exitCodeListHeading = "Exit Codes:%n",
    exitCodeList = {"0: success", "2: error"})
public class CMD_scripts implements Callable<Integer>, BundledCommand {
    private static final Logger logger = LogManager.getLogger(CMD_scripts.class);

    /// How script files are named.
    public enum ScriptNaming {
        /// by a hash of the command, stable across runs
        hashed,
        /// by the position of the argument set in the sweep
        indexed
    }

    @CommandLine.Spec
    private CommandLine.Model.CommandSpec spec;

    @CommandLine.Mixin
    private SweepFileOption sweepFile = new SweepFileOption();

    @CommandLine.Mixin
    private FormatOptions formatOptions = new FormatOptions();

    @CommandLine.Option(names = {"-d", "--directory"}, required = true,
        description = "The directory to write scripts into, created if absent")
    private Path directory;

    @CommandLine.Option(names = {"--run-token"},
        description = "Guard each command with a token file, touched when the command succeeds")
    private boolean runToken;

    @CommandLine.Option(names = {"--file-begin"}, defaultValue = "",
        description = "Text at the start of each script, such as '#!/bin/bash'")
    private String fileBegin = "";

    @CommandLine.Option(names = {"--file-end"}, defaultValue = "",
        description = "Text at the end of each script")
    private String fileEnd = "";

    @CommandLine.Option(names = {"--line-begin"}, defaultValue = "",
        description = "Text before the command, such as the program to run")
    private String lineBegin = "";

    @CommandLine.Option(names = {"--line-end"}, defaultValue = "",
        description = "Text after the command")
    private String lineEnd = "";

    @CommandLine.Option(names = {"--naming"}, defaultValue = "hashed",
        description = "How to name scripts. Valid values: ${COMPLETION-CANDIDATES} (default: ${DEFAULT-VALUE})")
    private ScriptNaming naming = ScriptNaming.hashed;

    @CommandLine.Option(names = {"--index-prefix"}, defaultValue = "run-",
        description = "File name prefix for indexed naming (default: ${DEFAULT-VALUE})")
    private String indexPrefix = "run-";

    @Override
    public Integer call() {
        try {
            SweepSpecification sweep = sweepFile.load();
            ArgparseFormatter formatter = formatOptions.toFormatter();
            ScriptFileSink sink = ScriptFileSink.builder(directory)
                .createRunToken(runToken)
                .formatter(formatter)
                .fileBegin(fileBegin)
                .fileEnd(fileEnd)
                .lineBegin(lineBegin)
                .lineEnd(lineEnd)
                .namer(naming == ScriptNaming.indexed ? ScriptNamer.indexed(indexPrefix) : ScriptNamer.hashed(formatter))
                .build();
            long written = sink.write(sweep);
            spec.commandLine().getOut().println("Wrote " + written + " scripts to " + directory);
            spec.commandLine().getOut().flush();
            logger.info("Wrote {} scripts to {}", written, directory);
            return 0;
        } catch (Exception e) {
            spec.commandLine().getErr().println("Error: " + e.getMessage());
            logger.debug("scripts failed", e);
            return CMD_cmdsweep.EXIT_ERROR;
        }
    }
}

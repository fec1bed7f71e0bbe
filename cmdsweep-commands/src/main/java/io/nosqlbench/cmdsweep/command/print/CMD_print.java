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

package io.nosqlbench.cmdsweep.command.print;

import com.google.auto.service.AutoService;
import io.nosqlbench.cmdsweep.api.services.BundledCommand;
import io.nosqlbench.cmdsweep.api.services.Selector;
import io.nosqlbench.cmdsweep.api.sweep.SweepSpecification;
import io.nosqlbench.cmdsweep.command.CMD_cmdsweep;
import io.nosqlbench.cmdsweep.command.common.FormatOptions;
import io.nosqlbench.cmdsweep.command.common.SweepFileOption;
import io.nosqlbench.cmdsweep.writers.PrintSink;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import picocli.CommandLine;

import java.util.concurrent.Callable;

/**
 # Print the commands of a sweep

 Writes one line per argument set to standard output, in enumeration order. Each line is
 the prefix, the rendered arguments, and the suffix.

 # Basic Usage
 ```
 print -s sweep.yaml --prefix "python train.py "
 print -s sweep.json --float-format '{:.3f}' --list-open '[' --list-close ']'
 ```
 */
@Selector("print")
@AutoService(BundledCommand.class)
@CommandLine.Command(name = "print",
    header = "Print one command line per argument set",
    description = "Enumerates the sweep and prints each argument set as a command line.",
    exitCodeListHeading = "Exit Codes:%n",
    exitCodeList = {"0: success", "2: error"})
public class CMD_print implements Callable<Integer>, BundledCommand {
    private static final Logger logger = LogManager.getLogger(CMD_print.class);

    @CommandLine.Spec
    private CommandLine.Model.CommandSpec spec;

    @CommandLine.Mixin
    private SweepFileOption sweepFile = new SweepFileOption();

    @CommandLine.Mixin
    private FormatOptions formatOptions = new FormatOptions();

    @CommandLine.Option(names = {"--prefix"}, defaultValue = "",
        description = "Text written before each command, such as the program to run")
    private String prefix = "";

    @CommandLine.Option(names = {"--suffix"}, defaultValue = "\n",
        description = "Text written after each command (default: a newline)")
    private String suffix = "\n";

    @Override
    public Integer call() {
        try {
            SweepSpecification sweep = sweepFile.load();
            PrintSink sink = new PrintSink(formatOptions.toFormatter(), spec.commandLine().getOut(), prefix, suffix);
            long printed = sink.write(sweep);
            logger.info("Printed {} commands from {}", printed, sweepFile.getSweepFile());
            return 0;
        } catch (Exception e) {
            spec.commandLine().getErr().println("Error: " + e.getMessage());
            logger.debug("print failed", e);
            return CMD_cmdsweep.EXIT_ERROR;
        }
    }
}

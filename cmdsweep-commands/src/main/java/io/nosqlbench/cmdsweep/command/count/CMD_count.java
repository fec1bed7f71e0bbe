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

package io.nosqlbench.cmdsweep.command.count;

import com.google.auto.service.AutoService;
import io.nosqlbench.cmdsweep.api.services.BundledCommand;
import io.nosqlbench.cmdsweep.api.services.Selector;
import io.nosqlbench.cmdsweep.api.sweep.SweepSpecification;
import io.nosqlbench.cmdsweep.command.CMD_cmdsweep;
import io.nosqlbench.cmdsweep.command.common.SweepFileOption;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import picocli.CommandLine;

import java.util.concurrent.Callable;

/// Report the number of argument sets in a sweep, the product of its unit sizes.
@Selector("count")
@AutoService(BundledCommand.class)
@CommandLine.Command(name = "count",
    header = "Count the argument sets of a sweep",
    description = "Prints the number of argument sets the sweep enumerates, without enumerating them.",
    exitCodeListHeading = "Exit Codes:%n",
    exitCodeList = {"0: success", "2: error"})
public class CMD_count implements Callable<Integer>, BundledCommand {
    private static final Logger logger = LogManager.getLogger(CMD_count.class);

    @CommandLine.Spec
    private CommandLine.Model.CommandSpec spec;

    @CommandLine.Mixin
    private SweepFileOption sweepFile = new SweepFileOption();

    @CommandLine.Option(names = {"--verbose", "-v"},
        description = "Also print the size of each unit")
    private boolean verbose;

    @Override
    public Integer call() {
        try {
            SweepSpecification sweep = sweepFile.load();
            if (verbose) {
                sweep.units().forEach(unit ->
                    spec.commandLine().getOut().println(String.join(",", unit.keys()) + ": " + unit.cardinality()));
            }
            spec.commandLine().getOut().println(sweep.count());
            spec.commandLine().getOut().flush();
            return 0;
        } catch (Exception e) {
            spec.commandLine().getErr().println("Error: " + e.getMessage());
            logger.debug("count failed", e);
            return CMD_cmdsweep.EXIT_ERROR;
        }
    }
}

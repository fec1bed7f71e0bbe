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

import io.nosqlbench.cmdsweep.api.services.BundledCommand;
import io.nosqlbench.cmdsweep.api.services.Selector;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import picocli.CommandLine;

import java.util.ServiceLoader;

/// Adds every [BundledCommand] found on the service path as a subcommand.
///
/// A command is named by its [Selector] when present, otherwise by the name in its
/// [CommandLine.Command] annotation. Types without a command annotation are skipped.
public class AddBundledCommands implements CommandLine.IModelTransformer {

    private static final Logger logger = LogManager.getLogger(AddBundledCommands.class);

    @Override
    public CommandLine.Model.CommandSpec transform(CommandLine.Model.CommandSpec commandSpec) {
        ServiceLoader<BundledCommand> load = ServiceLoader.load(BundledCommand.class);
        load.stream().forEach(provider -> {
            Class<? extends BundledCommand> type = provider.type();
            CommandLine.Command canno = type.getAnnotation(CommandLine.Command.class);
            if (canno == null) {
                logger.debug("Skipping bundled command {} without a command annotation", type.getName());
                return;
            }
            String name = nameOf(type, canno);
            if (commandSpec.subcommands().containsKey(name)) {
                throw new RuntimeException("Command name '" + name + "' is already defined, but "
                    + "found another under the same name in services manifest.");
            }
            commandSpec.addSubcommand(name, new CommandLine(type));
            logger.debug("Added bundled command {} as '{}'", type.getName(), name);
        });
        return commandSpec;
    }

    static String nameOf(Class<?> type, CommandLine.Command canno) {
        Selector selector = type.getAnnotation(Selector.class);
        return selector != null ? selector.value() : canno.name();
    }
}

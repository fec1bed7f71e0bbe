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

import io.nosqlbench.cmdsweep.formatters.ArgparseFormatter;
import io.nosqlbench.cmdsweep.formatters.ArgparseValueFormatter;
import picocli.CommandLine;

/// Shared options controlling how each argument set is rendered as a command line.
///
/// The defaults render `--key value` pairs separated by single spaces, floats in their
/// shortest form and lists as comma separated elements.
public class FormatOptions {

    @CommandLine.Option(names = {"--pair-separator"}, defaultValue = " ",
        description = "Text between two name/value pairs (default: a single space)")
    private String pairSeparator = " ";

    @CommandLine.Option(names = {"--pair-prefix"}, defaultValue = "",
        description = "Text before each name/value pair")
    private String pairPrefix = "";

    @CommandLine.Option(names = {"--pair-suffix"}, defaultValue = "",
        description = "Text after each name/value pair")
    private String pairSuffix = "";

    @CommandLine.Option(names = {"--float-format"}, defaultValue = "{}",
        description = {
            "Template for floating point values, such as '{:.2f}' or '%.2f'.",
            "'{}' renders the shortest exact form (default: ${DEFAULT-VALUE})"
        })
    private String floatFormat = "{}";

    @CommandLine.Option(names = {"--list-open"}, defaultValue = "",
        description = "Text before the elements of a list value")
    private String listOpen = "";

    @CommandLine.Option(names = {"--list-close"}, defaultValue = "",
        description = "Text after the elements of a list value")
    private String listClose = "";

    @CommandLine.Option(names = {"--list-separator"}, defaultValue = ", ",
        description = "Text between the elements of a list value (default: '${DEFAULT-VALUE}')")
    private String listSeparator = ", ";

    /// Build the formatter these options describe.
    /// @return the formatter
    /// @throws io.nosqlbench.cmdsweep.api.errors.SweepValidationException if the float format is invalid
    public ArgparseFormatter toFormatter() {
        ArgparseValueFormatter values = ArgparseValueFormatter.builder()
            .floatFormat(floatFormat)
            .listOpen(listOpen)
            .listClose(listClose)
            .listSeparator(listSeparator)
            .build();
        return ArgparseFormatter.builder()
            .pairSeparator(pairSeparator)
            .pairPrefix(pairPrefix)
            .pairSuffix(pairSuffix)
            .valueFormatter(values)
            .build();
    }
}

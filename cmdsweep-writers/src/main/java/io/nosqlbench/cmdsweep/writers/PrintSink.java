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

package io.nosqlbench.cmdsweep.writers;

import io.nosqlbench.cmdsweep.api.format.InvocationFormatter;
import io.nosqlbench.cmdsweep.api.sinks.SweepSink;
import io.nosqlbench.cmdsweep.api.sweep.BoundArgumentSet;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.io.IOException;
import java.io.OutputStreamWriter;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.util.Objects;

/// A [SweepSink] which writes each formatted command as one line of a character stream.
///
/// Every line is `prefix + command + suffix`. Lines are fully formatted before they are
/// written, so a formatting failure never leaves half a line behind. The stream is flushed
/// when the sweep is done, but never closed.
public class PrintSink implements SweepSink {

    private static final Logger logger = LogManager.getLogger(PrintSink.class);

    private final InvocationFormatter formatter;
    private final Writer out;
    private final String prefix;
    private final String suffix;

    public PrintSink(InvocationFormatter formatter, Writer out) {
        this(formatter, out, "", "\n");
    }

    /// @param formatter renders each argument set
    /// @param out       the stream to write lines to
    /// @param prefix    written before each command
    /// @param suffix    written after each command, normally a newline
    public PrintSink(InvocationFormatter formatter, Writer out, String prefix, String suffix) {
        this.formatter = Objects.requireNonNull(formatter, "formatter cannot be null");
        this.out = Objects.requireNonNull(out, "out cannot be null");
        this.prefix = Objects.requireNonNull(prefix, "prefix cannot be null");
        this.suffix = Objects.requireNonNull(suffix, "suffix cannot be null");
    }

    /// @param formatter renders each argument set
    /// @return a sink writing newline-terminated lines to standard output
    public static PrintSink stdout(InvocationFormatter formatter) {
        return new PrintSink(formatter, new OutputStreamWriter(System.out, StandardCharsets.UTF_8));
    }

    @Override
    public long write(Iterable<BoundArgumentSet> invocations) throws IOException {
        long written = 0L;
        for (BoundArgumentSet args : invocations) {
            String line = prefix + formatter.format(args) + suffix;
            out.write(line);
            written++;
        }
        out.flush();
        logger.debug("Printed {} commands", written);
        return written;
    }
}

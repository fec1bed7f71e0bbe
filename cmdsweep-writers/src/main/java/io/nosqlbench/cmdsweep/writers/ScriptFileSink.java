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

import io.nosqlbench.cmdsweep.api.errors.SweepValidationException;
import io.nosqlbench.cmdsweep.api.format.InvocationFormatter;
import io.nosqlbench.cmdsweep.api.sinks.SweepSink;
import io.nosqlbench.cmdsweep.api.sweep.BoundArgumentSet;
import io.nosqlbench.cmdsweep.formatters.ArgparseFormatter;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.attribute.PosixFilePermission;
import java.nio.file.attribute.PosixFilePermissions;
import java.util.Objects;
import java.util.Set;

/// A [SweepSink] which writes one bash script per argument set, such as for submitting each
/// command as its own job to a compute cluster.
///
/// Each script holds `fileBegin`, a line separator, the command line wrapped in `lineBegin`
/// and `lineEnd`, another line separator, and `fileEnd`. The file name comes from a
/// [ScriptNamer], by default a content hash of the formatted command.
///
/// # Run tokens
///
/// With `createRunToken` enabled, the command line is guarded so that it runs only while the
/// token file `<directory>/<script name>.token` is absent, and the token is touched when the
/// command exits with status zero. Re-running a whole batch then skips the commands which
/// already succeeded. Deleting a token makes its command run again.
///
/// # Usage
/// ```java
/// ScriptFileSink sink = ScriptFileSink.builder(Path.of("jobs"))
///     .createRunToken(true)
///     .fileBegin("#!/bin/bash")
///     .build();
/// sink.write(sweep);
/// ```
public class ScriptFileSink implements SweepSink {

    private static final Logger logger = LogManager.getLogger(ScriptFileSink.class);

    /// Suffix appended to a script's file name to name its token file.
    public static final String TOKEN_SUFFIX = ".token";

    private static final Set<PosixFilePermission> EXECUTABLE = PosixFilePermissions.fromString("rwxr-xr-x");

    private final Path directory;
    private final boolean createRunToken;
    private final InvocationFormatter formatter;
    private final String fileBegin;
    private final String fileEnd;
    private final String lineBegin;
    private final String lineEnd;
    private final String lineSeparator;
    private final ScriptNamer namer;

    private ScriptFileSink(Builder builder) throws IOException {
        if (Files.exists(builder.directory) && !Files.isDirectory(builder.directory)) {
            throw new SweepValidationException(
                "The specified directory is a file: " + builder.directory + ". Has to be a directory");
        }
        if (!Files.exists(builder.directory)) {
            Files.createDirectories(builder.directory);
            logger.debug("Created script directory {}", builder.directory);
        }
        this.directory = builder.directory;
        this.createRunToken = builder.createRunToken;
        this.formatter = builder.formatter;
        this.fileBegin = builder.fileBegin;
        this.fileEnd = builder.fileEnd;
        this.lineBegin = builder.lineBegin;
        this.lineEnd = builder.lineEnd;
        this.lineSeparator = builder.lineSeparator;
        this.namer = builder.namer != null ? builder.namer : ScriptNamer.hashed(builder.formatter);
    }

    /// @param directory the directory to write scripts into; created if absent
    /// @return a builder for a script sink
    public static Builder builder(Path directory) {
        return new Builder(directory);
    }

    @Override
    public long write(Iterable<BoundArgumentSet> invocations) throws IOException {
        long written = 0L;
        for (BoundArgumentSet args : invocations) {
            writeScript(args, written);
            written++;
        }
        logger.debug("Wrote {} scripts to {}", written, directory);
        return written;
    }

    /// Write the script for a single argument set.
    /// @param args    the argument set
    /// @param ordinal the position of the argument set within its sweep
    /// @return the path of the written script
    /// @throws IOException if the script cannot be written
    public Path writeScript(BoundArgumentSet args, long ordinal) throws IOException {
        String fileName = namer.name(args, ordinal);
        Path script = directory.resolve(fileName);
        String content = render(args, fileName);
        Files.writeString(script, content, StandardCharsets.UTF_8);
        markExecutable(script);
        logger.debug("Wrote script {}", script);
        return script;
    }

    /// Render the whole content of the script for an argument set, without writing it.
    /// @param args     the argument set
    /// @param fileName the file name the script will have, used to name its token file
    /// @return the script content
    public String render(BoundArgumentSet args, String fileName) {
        String line = lineBegin + formatter.format(args) + lineEnd;
        if (createRunToken) {
            line = wrapInTokenGuard(line, tokenPath(fileName));
        }
        return fileBegin + lineSeparator + line + lineSeparator + fileEnd;
    }

    /// @param fileName the file name of a script
    /// @return the absolute path of that script's token file
    public Path tokenPath(String fileName) {
        return directory.resolve(fileName + TOKEN_SUFFIX).toAbsolutePath();
    }

    private String wrapInTokenGuard(String line, Path token) {
        String quoted = "\"" + token + "\"";
        String nl = lineSeparator;
        return "if [ ! -f " + quoted + " ]; then" + nl
            + nl
            + line + nl
            + nl
            + "    if [ $? -eq 0 ]; then" + nl
            + "        touch " + quoted + nl
            + "    fi" + nl
            + "fi";
    }

    private void markExecutable(Path script) throws IOException {
        if (script.getFileSystem().supportedFileAttributeViews().contains("posix")) {
            Files.setPosixFilePermissions(script, EXECUTABLE);
        }
    }

    public Path directory() {
        return directory;
    }

    public boolean createsRunToken() {
        return createRunToken;
    }

    /// Builder for [ScriptFileSink].
    ///
    /// # Defaults
    /// - createRunToken: false
    /// - formatter: [ArgparseFormatter#defaults()]
    /// - fileBegin, fileEnd, lineBegin, lineEnd: empty
    /// - lineSeparator: `\n`
    /// - namer: [ScriptNamer#hashed(InvocationFormatter)] over the formatter
    public static final class Builder {
        private final Path directory;
        private boolean createRunToken = false;
        private InvocationFormatter formatter = ArgparseFormatter.defaults();
        private String fileBegin = "";
        private String fileEnd = "";
        private String lineBegin = "";
        private String lineEnd = "";
        private String lineSeparator = "\n";
        private ScriptNamer namer;

        Builder(Path directory) {
            this.directory = Objects.requireNonNull(directory, "directory cannot be null");
        }

        public Builder createRunToken(boolean createRunToken) {
            this.createRunToken = createRunToken;
            return this;
        }

        public Builder formatter(InvocationFormatter formatter) {
            this.formatter = Objects.requireNonNull(formatter, "formatter");
            return this;
        }

        public Builder fileBegin(String fileBegin) {
            this.fileBegin = Objects.requireNonNull(fileBegin, "fileBegin");
            return this;
        }

        public Builder fileEnd(String fileEnd) {
            this.fileEnd = Objects.requireNonNull(fileEnd, "fileEnd");
            return this;
        }

        public Builder lineBegin(String lineBegin) {
            this.lineBegin = Objects.requireNonNull(lineBegin, "lineBegin");
            return this;
        }

        public Builder lineEnd(String lineEnd) {
            this.lineEnd = Objects.requireNonNull(lineEnd, "lineEnd");
            return this;
        }

        public Builder lineSeparator(String lineSeparator) {
            this.lineSeparator = Objects.requireNonNull(lineSeparator, "lineSeparator");
            return this;
        }

        /// @param namer the namer for script files, or null for the content-hash default
        /// @return this builder
        public Builder namer(ScriptNamer namer) {
            this.namer = namer;
            return this;
        }

        /// Build the sink, creating the script directory and its parents if needed.
        /// @return the sink
        /// @throws SweepValidationException if the directory path names an existing file
        /// @throws IOException if the directory cannot be created
        public ScriptFileSink build() throws IOException {
            return new ScriptFileSink(this);
        }
    }
}

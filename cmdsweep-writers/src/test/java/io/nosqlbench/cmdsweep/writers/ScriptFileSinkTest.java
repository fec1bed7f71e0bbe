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
import io.nosqlbench.cmdsweep.api.sweep.BoundArgumentSet;
import io.nosqlbench.cmdsweep.api.sweep.SweepSpecification;
import io.nosqlbench.cmdsweep.formatters.ArgparseFormatter;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.concurrent.TimeUnit;
import java.util.stream.Collectors;
import java.util.stream.Stream;

import static org.assertj.core.api.Assertions.*;
import static org.junit.jupiter.api.Assumptions.assumeTrue;

@DisplayName("ScriptFileSink")
class ScriptFileSinkTest {

    private static final SweepSpecification SWEEP = SweepSpecification.builder()
        .param("kernel", List.of("gauss", "imq"))
        .param("kparams", List.of(1, 2, 3.2))
        .build();

    private static List<String> fileNames(Path dir) throws IOException {
        try (Stream<Path> files = Files.list(dir)) {
            return files.map(p -> p.getFileName().toString()).sorted().collect(Collectors.toList());
        }
    }

    @Nested
    @DisplayName("Naming")
    class NamingTest {

        @Test
        @DisplayName("should name scripts by a hash of the command")
        void shouldHashNames(@TempDir Path dir) throws IOException {
            BoundArgumentSet args = SweepSpecification.builder()
                .param("kernel", List.of("gauss"))
                .param("kparams", List.of(2))
                .build().iterator().next();

            Path script = ScriptFileSink.builder(dir).build().writeScript(args, 0);

            assertThat(script.getFileName().toString()).isEqualTo("ab02893f3b176e.sh");
        }

        @Test
        @DisplayName("should give every distinct command its own 14 digit name")
        void shouldWriteOneScriptPerCommand(@TempDir Path dir) throws IOException {
            long written = ScriptFileSink.builder(dir).build().write(SWEEP);

            assertThat(written).isEqualTo(6);
            assertThat(fileNames(dir))
                .hasSize(6)
                .allMatch(name -> name.matches("[0-9a-f]{14}\\.sh"));
        }

        @Test
        @DisplayName("should name scripts by position when indexed")
        void shouldIndexNames(@TempDir Path dir) throws IOException {
            ScriptFileSink.builder(dir).namer(ScriptNamer.indexed("job-")).build().write(SWEEP);

            assertThat(fileNames(dir)).containsExactly(
                "job-000000.sh", "job-000001.sh", "job-000002.sh",
                "job-000003.sh", "job-000004.sh", "job-000005.sh");
            assertThat(Files.readString(dir.resolve("job-000002.sh"))).contains("--kernel gauss --kparams 3.2");
        }

        @Test
        @DisplayName("should hash the same text to the same digest")
        void shouldHashStably() {
            assertThat(ScriptNamer.sha1Hex("--kernel gauss")).startsWith("f46ca2ee13f35a").hasSize(40);
        }
    }

    @Nested
    @DisplayName("Directory")
    class DirectoryTest {

        @Test
        @DisplayName("should create the directory and its parents")
        void shouldCreateDirectory(@TempDir Path dir) throws IOException {
            Path nested = dir.resolve("a").resolve("b");

            ScriptFileSink sink = ScriptFileSink.builder(nested).build();

            assertThat(nested).isDirectory();
            assertThat(sink.directory()).isEqualTo(nested);
        }

        @Test
        @DisplayName("should reject a path which is a regular file")
        void shouldRejectFile(@TempDir Path dir) throws IOException {
            Path file = Files.writeString(dir.resolve("not-a-dir"), "x");

            assertThatThrownBy(() -> ScriptFileSink.builder(file).build())
                .isInstanceOf(SweepValidationException.class)
                .hasMessageContaining("Has to be a directory");
        }
    }

    @Nested
    @DisplayName("Content")
    class ContentTest {

        @Test
        @DisplayName("should lay out file and line decorations around the command")
        void shouldLayOutContent(@TempDir Path dir) throws IOException {
            ScriptFileSink sink = ScriptFileSink.builder(dir)
                .fileBegin("#!/bin/bash")
                .fileEnd("# done")
                .lineBegin("python train.py ")
                .lineEnd(" > out.log")
                .namer(ScriptNamer.indexed("run-"))
                .build();

            sink.write(SweepSpecification.builder().param("kernel", List.of("gauss")).build());

            assertThat(Files.readString(dir.resolve("run-000000.sh"), StandardCharsets.UTF_8))
                .isEqualTo("#!/bin/bash\npython train.py --kernel gauss > out.log\n# done");
        }

        @Test
        @DisplayName("should use the given formatter")
        void shouldUseFormatter(@TempDir Path dir) throws IOException {
            ScriptFileSink sink = ScriptFileSink.builder(dir)
                .formatter(ArgparseFormatter.builder().flagPrefix("-").build())
                .namer(ScriptNamer.indexed(""))
                .build();

            sink.write(SweepSpecification.builder().param("k", List.of(1)).build());

            assertThat(Files.readString(dir.resolve("000000.sh"))).isEqualTo("\n-k 1\n");
        }

        @Test
        @DisplayName("should guard the command with a run token")
        void shouldWrapInTokenGuard(@TempDir Path dir) throws IOException {
            ScriptFileSink sink = ScriptFileSink.builder(dir)
                .createRunToken(true)
                .namer(ScriptNamer.indexed("run-"))
                .build();
            BoundArgumentSet args = SweepSpecification.builder().param("a", List.of(1)).build().iterator().next();

            Path script = sink.writeScript(args, 0);
            String token = dir.resolve("run-000000.sh.token").toAbsolutePath().toString();

            assertThat(sink.createsRunToken()).isTrue();
            assertThat(sink.tokenPath("run-000000.sh").toString()).isEqualTo(token);
            assertThat(Files.readString(script)).isEqualTo(
                "\n"
                    + "if [ ! -f \"" + token + "\" ]; then\n"
                    + "\n"
                    + "--a 1\n"
                    + "\n"
                    + "    if [ $? -eq 0 ]; then\n"
                    + "        touch \"" + token + "\"\n"
                    + "    fi\n"
                    + "fi\n");
        }

        @Test
        @DisplayName("should mark scripts executable where supported")
        void shouldMarkExecutable(@TempDir Path dir) throws IOException {
            assumeTrue(dir.getFileSystem().supportedFileAttributeViews().contains("posix"));

            Path script = ScriptFileSink.builder(dir).build()
                .writeScript(SWEEP.iterator().next(), 0);

            assertThat(Files.isExecutable(script)).isTrue();
        }
    }

    @Nested
    @DisplayName("Execution")
    class ExecutionTest {

        private int runBash(Path script) throws IOException, InterruptedException {
            Process process = new ProcessBuilder("/bin/bash", script.toString())
                .redirectErrorStream(true)
                .start();
            process.getInputStream().readAllBytes();
            assertThat(process.waitFor(30, TimeUnit.SECONDS)).isTrue();
            return process.exitValue();
        }

        @Test
        @DisplayName("should skip a command whose token exists and rerun it once the token is gone")
        void shouldHonorRunToken(@TempDir Path dir) throws Exception {
            assumeTrue(Files.isExecutable(Path.of("/bin/bash")), "bash is required");
            Path counter = dir.resolve("counter.txt");
            ScriptFileSink sink = ScriptFileSink.builder(dir.resolve("scripts"))
                .createRunToken(true)
                .fileBegin("#!/bin/bash")
                .lineBegin("echo ")
                .lineEnd(" >> \"" + counter + "\"")
                .namer(ScriptNamer.indexed("run-"))
                .build();
            Path script = sink.writeScript(
                SweepSpecification.builder().param("a", List.of(1)).build().iterator().next(), 0);
            Path token = sink.tokenPath("run-000000.sh");

            assertThat(runBash(script)).isZero();
            assertThat(token).exists();
            assertThat(Files.readAllLines(counter)).containsExactly("--a 1");

            assertThat(runBash(script)).isZero();
            assertThat(Files.readAllLines(counter)).containsExactly("--a 1");

            Files.delete(token);
            assertThat(runBash(script)).isZero();
            assertThat(Files.readAllLines(counter)).containsExactly("--a 1", "--a 1");
            assertThat(token).exists();
        }

        @Test
        @DisplayName("should not create a token when the command fails")
        void shouldNotTokenizeFailures(@TempDir Path dir) throws Exception {
            assumeTrue(Files.isExecutable(Path.of("/bin/bash")), "bash is required");
            ScriptFileSink sink = ScriptFileSink.builder(dir)
                .createRunToken(true)
                .lineBegin("false ")
                .namer(ScriptNamer.indexed("run-"))
                .build();
            Path script = sink.writeScript(
                SweepSpecification.builder().param("a", List.of(1)).build().iterator().next(), 0);

            runBash(script);

            assertThat(sink.tokenPath("run-000000.sh")).doesNotExist();
        }
    }
}

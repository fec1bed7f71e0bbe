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

import io.nosqlbench.cmdsweep.command.CMD_cmdsweep;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import picocli.CommandLine;

import java.io.IOException;
import java.io.PrintWriter;
import java.io.StringWriter;
import java.net.URISyntaxException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.stream.Collectors;
import java.util.stream.Stream;

import static org.assertj.core.api.Assertions.*;

@DisplayName("CMD_scripts")
class CMD_scriptsTest {

    private StringWriter out;
    private StringWriter err;
    private CommandLine commandLine;

    @BeforeEach
    void setUp() {
        out = new StringWriter();
        err = new StringWriter();
        commandLine = CMD_cmdsweep.newCommandLine();
        commandLine.setOut(new PrintWriter(out, true));
        commandLine.setErr(new PrintWriter(err, true));
    }

    private static Path example() throws URISyntaxException {
        return Path.of(CMD_scriptsTest.class.getResource("/sweeps/example.yaml").toURI());
    }

    private static List<String> fileNames(Path dir) throws IOException {
        try (Stream<Path> files = Files.list(dir)) {
            return files.map(p -> p.getFileName().toString()).sorted().collect(Collectors.toList());
        }
    }

    @Test
    @DisplayName("should write one hashed script per argument set")
    void shouldWriteHashedScripts(@TempDir Path dir) throws Exception {
        Path jobs = dir.resolve("jobs");

        int exitCode = commandLine.execute("scripts", "-s", example().toString(), "-d", jobs.toString(),
            "--file-begin", "#!/bin/bash", "--line-begin", "python train.py ");

        assertThat(exitCode).isZero();
        assertThat(fileNames(jobs)).hasSize(12).allMatch(name -> name.matches("[0-9a-f]{14}\\.sh"));
        assertThat(out.toString()).contains("Wrote 12 scripts");
        try (Stream<Path> scripts = Files.list(jobs)) {
            assertThat(scripts.map(p -> {
                try {
                    return Files.readString(p);
                } catch (IOException e) {
                    throw new RuntimeException(e);
                }
            })).allMatch(content -> content.startsWith("#!/bin/bash\npython train.py --kernel "));
        }
    }

    @Test
    @DisplayName("should write indexed scripts with run tokens")
    void shouldWriteIndexedScriptsWithTokens(@TempDir Path dir) throws Exception {
        int exitCode = commandLine.execute("scripts", "-s", example().toString(), "-d", dir.toString(),
            "--naming", "indexed", "--index-prefix", "job-", "--run-token");

        assertThat(exitCode).isZero();
        assertThat(fileNames(dir)).hasSize(12).first().isEqualTo("job-000000.sh");
        String first = Files.readString(dir.resolve("job-000000.sh"));
        assertThat(first)
            .contains("if [ ! -f \"" + dir.resolve("job-000000.sh.token").toAbsolutePath() + "\" ]; then")
            .contains("--kernel gauss --kp 1 --learning-rate 0.1 --epochs 10");
    }

    @Test
    @DisplayName("should accept naming in any case")
    void shouldAcceptNamingInAnyCase(@TempDir Path dir) throws Exception {
        int exitCode = commandLine.execute("scripts", "-s", example().toString(), "-d", dir.toString(),
            "--naming", "INDEXED");

        assertThat(exitCode).isZero();
        assertThat(fileNames(dir)).contains("run-000011.sh");
    }

    @Test
    @DisplayName("should fail with exit code 2 when the directory is a file")
    void shouldFailOnFileDirectory(@TempDir Path dir) throws Exception {
        Path file = Files.writeString(dir.resolve("taken"), "x");

        int exitCode = commandLine.execute("scripts", "-s", example().toString(), "-d", file.toString());

        assertThat(exitCode).isEqualTo(CMD_cmdsweep.EXIT_ERROR);
        assertThat(err.toString()).startsWith("Error: ").contains("Has to be a directory");
    }
}

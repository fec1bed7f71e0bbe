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

import io.nosqlbench.cmdsweep.api.errors.UnsupportedValueException;
import io.nosqlbench.cmdsweep.api.sweep.SweepSpecification;
import io.nosqlbench.cmdsweep.formatters.ArgparseFormatter;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.io.StringWriter;
import java.util.Arrays;
import java.util.List;

import static org.assertj.core.api.Assertions.*;

@DisplayName("PrintSink")
class PrintSinkTest {

    private final SweepSpecification sweep = SweepSpecification.builder()
        .param("kernel", List.of("gauss", "imq"))
        .param("kparams", List.of(1, 2))
        .build();

    @Test
    @DisplayName("should write one line per argument set")
    void shouldWriteLines() throws IOException {
        StringWriter out = new StringWriter();

        long written = new PrintSink(ArgparseFormatter.defaults(), out).write(sweep);

        assertThat(written).isEqualTo(4);
        assertThat(out.toString()).isEqualTo(
            "--kernel gauss --kparams 1\n"
                + "--kernel gauss --kparams 2\n"
                + "--kernel imq --kparams 1\n"
                + "--kernel imq --kparams 2\n");
    }

    @Test
    @DisplayName("should wrap each command in the prefix and suffix")
    void shouldApplyPrefixAndSuffix() throws IOException {
        StringWriter out = new StringWriter();

        new PrintSink(ArgparseFormatter.defaults(), out, "python train.py ", ";\n").write(sweep);

        assertThat(out.toString().split("\n"))
            .hasSize(4)
            .allSatisfy(line -> assertThat(line).startsWith("python train.py --kernel ").endsWith(";"));
    }

    @Test
    @DisplayName("should write nothing for an empty sweep")
    void shouldWriteNothingForEmptySweep() throws IOException {
        StringWriter out = new StringWriter();
        SweepSpecification empty = SweepSpecification.builder().param("a", List.of()).build();

        assertThat(new PrintSink(ArgparseFormatter.defaults(), out).write(empty)).isZero();
        assertThat(out.toString()).isEmpty();
    }

    @Test
    @DisplayName("should keep complete lines written before a formatting failure")
    void shouldNotWritePartialLines() {
        StringWriter out = new StringWriter();
        SweepSpecification withNull = SweepSpecification.builder()
            .param("a", Arrays.asList(1, null))
            .build();

        assertThatThrownBy(() -> new PrintSink(ArgparseFormatter.defaults(), out).write(withNull))
            .isInstanceOf(UnsupportedValueException.class);
        assertThat(out.toString()).isEqualTo("--a 1\n");
    }
}

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

package io.nosqlbench.cmdsweep.formatters;

import io.nosqlbench.cmdsweep.api.format.InvocationFormatter;
import io.nosqlbench.cmdsweep.api.format.ValueFormatter;
import io.nosqlbench.cmdsweep.api.params.Parameter;
import io.nosqlbench.cmdsweep.api.params.ParameterBinding;
import io.nosqlbench.cmdsweep.api.sweep.BoundArgumentSet;

import java.util.Objects;

/// An [InvocationFormatter] which renders argument sets the way a flag-style argument parser
/// expects them, such as `--kernel gauss --kparams 2`.
///
/// Each binding is rendered as `<pairPrefix><name> <value><pairSuffix>`, and the rendered
/// pairs are joined by the pair separator. The name is the parameter's output name when it
/// has one, and otherwise the flag prefix followed by the parameter key.
///
/// # Defaults
/// - pair separator: `" "`
/// - pair prefix and suffix: empty
/// - flag prefix: `--`
/// - value formatter: [ArgparseValueFormatter#defaults()]
public final class ArgparseFormatter implements InvocationFormatter {

    private final String pairSeparator;
    private final String pairPrefix;
    private final String pairSuffix;
    private final String flagPrefix;
    private final ValueFormatter valueFormatter;

    private ArgparseFormatter(Builder builder) {
        this.pairSeparator = builder.pairSeparator;
        this.pairPrefix = builder.pairPrefix;
        this.pairSuffix = builder.pairSuffix;
        this.flagPrefix = builder.flagPrefix;
        this.valueFormatter = builder.valueFormatter;
    }

    public static ArgparseFormatter defaults() {
        return new Builder().build();
    }

    public static Builder builder() {
        return new Builder();
    }

    @Override
    public String format(BoundArgumentSet args) {
        StringBuilder sb = new StringBuilder();
        boolean first = true;
        for (ParameterBinding binding : args) {
            if (!first) {
                sb.append(pairSeparator);
            }
            first = false;
            sb.append(pairPrefix)
                .append(nameOf(binding.parameter()))
                .append(' ')
                .append(valueFormatter.formatValue(binding.value()))
                .append(pairSuffix);
        }
        return sb.toString();
    }

    /// Resolve the emitted name of a parameter.
    /// @param parameter the parameter
    /// @return its output name if set, otherwise the flag prefix followed by its key
    public String nameOf(Parameter parameter) {
        return parameter.output() != null ? parameter.output() : flagPrefix + parameter.key();
    }

    public ValueFormatter valueFormatter() {
        return valueFormatter;
    }

    @Override
    public String toString() {
        return "ArgparseFormatter{" +
            "pairSeparator='" + pairSeparator + '\'' +
            ", pairPrefix='" + pairPrefix + '\'' +
            ", pairSuffix='" + pairSuffix + '\'' +
            ", flagPrefix='" + flagPrefix + '\'' +
            ", valueFormatter=" + valueFormatter +
            '}';
    }

    /// Builder for [ArgparseFormatter].
    public static final class Builder {
        private String pairSeparator = " ";
        private String pairPrefix = "";
        private String pairSuffix = "";
        private String flagPrefix = "--";
        private ValueFormatter valueFormatter = ArgparseValueFormatter.defaults();

        Builder() {
        }

        public Builder pairSeparator(String pairSeparator) {
            this.pairSeparator = Objects.requireNonNull(pairSeparator, "pairSeparator");
            return this;
        }

        public Builder pairPrefix(String pairPrefix) {
            this.pairPrefix = Objects.requireNonNull(pairPrefix, "pairPrefix");
            return this;
        }

        public Builder pairSuffix(String pairSuffix) {
            this.pairSuffix = Objects.requireNonNull(pairSuffix, "pairSuffix");
            return this;
        }

        /// @param flagPrefix the prefix for names derived from keys, `--` by default
        /// @return this builder
        public Builder flagPrefix(String flagPrefix) {
            this.flagPrefix = Objects.requireNonNull(flagPrefix, "flagPrefix");
            return this;
        }

        public Builder valueFormatter(ValueFormatter valueFormatter) {
            this.valueFormatter = Objects.requireNonNull(valueFormatter, "valueFormatter");
            return this;
        }

        public ArgparseFormatter build() {
            return new ArgparseFormatter(this);
        }
    }
}

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

import io.nosqlbench.cmdsweep.api.errors.UnsupportedValueException;
import io.nosqlbench.cmdsweep.api.format.ValueFormatter;
import io.nosqlbench.cmdsweep.api.format.ValueKind;

import java.util.Arrays;
import java.util.List;
import java.util.Objects;

/// A [ValueFormatter] for values passed to a typical flag-style argument parser.
///
/// # Defaults
/// - float format: `{}`, the plain string form of the value
/// - list open and close: empty
/// - list separator: `", "`
///
/// # Usage
/// ```java
/// ArgparseValueFormatter values = ArgparseValueFormatter.builder()
///     .floatFormat("{:.2f}")
///     .listOpen("(")
///     .listClose(")")
///     .build();
/// values.formatValue(List.of(1, 2, 3)); // "(1, 2, 3)"
/// ```
public final class ArgparseValueFormatter implements ValueFormatter {

    private final FloatTemplate floatFormat;
    private final String listOpen;
    private final String listClose;
    private final String listSeparator;

    private ArgparseValueFormatter(Builder builder) {
        this.floatFormat = FloatTemplate.of(builder.floatFormat);
        this.listOpen = builder.listOpen;
        this.listClose = builder.listClose;
        this.listSeparator = builder.listSeparator;
    }

    public static ArgparseValueFormatter defaults() {
        return new Builder().build();
    }

    public static Builder builder() {
        return new Builder();
    }

    @Override
    public String formatFloat(double value) {
        return floatFormat.render(value);
    }

    @Override
    public String formatList(Object value) {
        List<?> elements;
        if (value instanceof List<?> list) {
            elements = list;
        } else if (value instanceof Object[] array) {
            elements = Arrays.asList(array);
        } else {
            throw new UnsupportedValueException(ValueKind.LIST, value, "value should be a list. Was " + value);
        }
        StringBuilder sb = new StringBuilder(listOpen);
        for (int i = 0; i < elements.size(); i++) {
            if (i > 0) {
                sb.append(listSeparator);
            }
            sb.append(formatValue(elements.get(i)));
        }
        return sb.append(listClose).toString();
    }

    public String floatFormat() {
        return floatFormat.template();
    }

    public String listOpen() {
        return listOpen;
    }

    public String listClose() {
        return listClose;
    }

    public String listSeparator() {
        return listSeparator;
    }

    @Override
    public String toString() {
        return "ArgparseValueFormatter{" +
            "floatFormat='" + floatFormat + '\'' +
            ", listOpen='" + listOpen + '\'' +
            ", listClose='" + listClose + '\'' +
            ", listSeparator='" + listSeparator + '\'' +
            '}';
    }

    /// Builder for [ArgparseValueFormatter].
    public static final class Builder {
        private String floatFormat = "{}";
        private String listOpen = "";
        private String listClose = "";
        private String listSeparator = ", ";

        Builder() {
        }

        /// @param floatFormat a template accepted by [FloatTemplate#of(String)]
        /// @return this builder
        public Builder floatFormat(String floatFormat) {
            this.floatFormat = Objects.requireNonNull(floatFormat, "floatFormat");
            return this;
        }

        public Builder listOpen(String listOpen) {
            this.listOpen = Objects.requireNonNull(listOpen, "listOpen");
            return this;
        }

        public Builder listClose(String listClose) {
            this.listClose = Objects.requireNonNull(listClose, "listClose");
            return this;
        }

        public Builder listSeparator(String listSeparator) {
            this.listSeparator = Objects.requireNonNull(listSeparator, "listSeparator");
            return this;
        }

        /// @return a new value formatter
        /// @throws io.nosqlbench.cmdsweep.api.errors.SweepValidationException if the float format is not a valid template
        public ArgparseValueFormatter build() {
            return new ArgparseValueFormatter(this);
        }
    }
}

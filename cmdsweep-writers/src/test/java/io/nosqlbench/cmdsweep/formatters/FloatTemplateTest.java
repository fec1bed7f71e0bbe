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

import io.nosqlbench.cmdsweep.api.errors.SweepValidationException;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;
import org.junit.jupiter.params.provider.ValueSource;

import static org.assertj.core.api.Assertions.*;

@DisplayName("FloatTemplate")
class FloatTemplateTest {

    @ParameterizedTest(name = "''{0}'' renders {1} as ''{2}''")
    @CsvSource(delimiter = '|', value = {
        "{}       | 1.5      | 1.5",
        "{}       | 3.2      | 3.2",
        "{:.2f}   | 1.5      | 1.50",
        "{:.2f}   | 2.345678 | 2.35",
        "{:.0f}   | 2.5      | 3",
        "{:.3e}   | 12345.678| 1.235e+04",
        "x={:.1f} | 0.25     | x=0.3",
        "%.2f     | 1.5      | 1.50",
        "%.4f     | 0.1      | 0.1000",
        "{{{}}}   | 1.5      | {1.5}"
    })
    @DisplayName("should render floats through the template")
    void shouldRender(String template, double value, String expected) {
        assertThat(FloatTemplate.of(template).render(value)).isEqualTo(expected);
    }

    @ParameterizedTest(name = "{0} renders as ''{1}''")
    @CsvSource({
        "0.0001,   0.0001",
        "0.00001,  1e-05",
        "1e16,     1e+16",
        "1.5e16,   1.5e+16",
        "123456789012345.0, 123456789012345.0",
        "100.0,    100.0",
        "-2.5e-7,  -2.5e-07",
        "1e100,    1e+100",
        "0.0,      0.0",
        "-0.0,     -0.0",
        "NaN,      nan",
        "-Infinity, -inf"
    })
    @DisplayName("should render the plain form with positional digits near one and exponents elsewhere")
    void shouldRenderPlainForm(double value, String expected) {
        assertThat(FloatTemplate.of("{}").render(value)).isEqualTo(expected);
    }

    @Test
    @DisplayName("should not depend on the default locale")
    void shouldUseRootLocale() {
        assertThat(FloatTemplate.of("{:,.1f}").render(1234567.0)).isEqualTo("1,234,567.0");
    }

    @Test
    @DisplayName("should keep the source template")
    void shouldKeepTemplate() {
        assertThat(FloatTemplate.of("{:.2f}").template()).isEqualTo("{:.2f}");
    }

    @ParameterizedTest
    @ValueSource(strings = {"{:.2d}", "{:s}", "%d", "{", "}", "{:.2f", ""})
    @DisplayName("should reject templates which cannot render a float")
    void shouldRejectInvalidTemplates(String template) {
        assertThatThrownBy(() -> FloatTemplate.of(template))
            .isInstanceOf(SweepValidationException.class);
    }
}

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

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.IllegalFormatException;
import java.util.List;
import java.util.Locale;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/// A compiled template for rendering floating point values.
///
/// Two template styles are accepted:
/// - brace style, as in `{}`, `{:.2f}` or `x={:.3e}`, where `{}` is the plain string form of
///   the value and `{:spec}` is rendered as the `java.util.Formatter` conversion `%spec`.
///   The plain form keeps the shortest digits of [Double#toString(double)] but lays them out
///   as command line tools usually expect: positional between `1e-4` and `1e16`
///   (`0.0001`, `100.0`), and otherwise a lower-case exponent with a sign and at least two
///   digits (`1e-05`, `1.5e+16`). Non-finite values render as `nan`, `inf` and `-inf`.
///   Use `{{` and `}}` for literal braces. The spec must end in one of `f`, `e`, `E`, `g`
///   or `G`.
/// - `java.util.Formatter` style, as in `%.2f`, used whenever the template has no braces.
///
/// Rendering always uses [Locale#ROOT].
public final class FloatTemplate {

    private static final Pattern FIELD = Pattern.compile("\\{(\\d*)(?::([^{}]*))?}");
    private static final Pattern SPEC = Pattern.compile("[-#+ 0,(]*\\d*(\\.\\d+)?[feEgG]");

    private final String template;
    private final List<String> literals;
    private final List<String> specs;

    private FloatTemplate(String template, List<String> literals, List<String> specs) {
        this.template = template;
        this.literals = literals;
        this.specs = specs;
    }

    /// Compile a template.
    /// @param template a brace style or `java.util.Formatter` style template
    /// @return the compiled template
    /// @throws SweepValidationException if the template cannot render a floating point value
    public static FloatTemplate of(String template) {
        if (template == null || template.isEmpty()) {
            throw new SweepValidationException("float template cannot be empty");
        }
        if (template.indexOf('{') < 0 && template.indexOf('}') < 0) {
            try {
                String.format(Locale.ROOT, template, 0.0d);
            } catch (IllegalFormatException e) {
                throw new SweepValidationException("invalid float template '" + template + "': " + e.getMessage(), e);
            }
            return new FloatTemplate(template, List.of(), List.of());
        }
        return compileBraces(template);
    }

    private static FloatTemplate compileBraces(String template) {
        List<String> literals = new ArrayList<>();
        List<String> specs = new ArrayList<>();
        StringBuilder literal = new StringBuilder();
        int pos = 0;
        while (pos < template.length()) {
            char c = template.charAt(pos);
            if (template.startsWith("{{", pos) || template.startsWith("}}", pos)) {
                literal.append(c);
                pos += 2;
            } else if (c == '{') {
                Matcher field = FIELD.matcher(template).region(pos, template.length());
                if (!field.lookingAt()) {
                    throw new SweepValidationException("unterminated field in float template '" + template + "'");
                }
                String spec = field.group(2) == null ? "" : field.group(2);
                if (!spec.isEmpty()) {
                    checkSpec(spec, template);
                }
                literals.add(literal.toString());
                literal.setLength(0);
                specs.add(spec);
                pos = field.end();
            } else if (c == '}') {
                throw new SweepValidationException("single '}' in float template '" + template + "'");
            } else {
                literal.append(c);
                pos++;
            }
        }
        literals.add(literal.toString());
        return new FloatTemplate(template, List.copyOf(literals), List.copyOf(specs));
    }

    private static void checkSpec(String spec, String template) {
        if (!SPEC.matcher(spec).matches()) {
            throw new SweepValidationException(
                "unsupported float format spec '" + spec + "' in template '" + template + "'");
        }
        try {
            String.format(Locale.ROOT, "%" + spec, 0.0d);
        } catch (IllegalFormatException e) {
            throw new SweepValidationException(
                "invalid float format spec '" + spec + "' in template '" + template + "': " + e.getMessage(), e);
        }
    }

    public String render(double value) {
        if (literals.isEmpty()) {
            return String.format(Locale.ROOT, template, value);
        }
        StringBuilder sb = new StringBuilder(literals.get(0));
        for (int i = 0; i < specs.size(); i++) {
            String spec = specs.get(i);
            sb.append(spec.isEmpty() ? plain(value) : String.format(Locale.ROOT, "%" + spec, value));
            sb.append(literals.get(i + 1));
        }
        return sb.toString();
    }

    /// Render a value in the plain form used by an empty `{}` field.
    /// @param value the value to render
    /// @return the plain form of the value
    private static String plain(double value) {
        if (Double.isNaN(value)) {
            return "nan";
        }
        if (Double.isInfinite(value)) {
            return value > 0 ? "inf" : "-inf";
        }
        if (value == 0.0d) {
            return Double.toString(value);
        }
        BigDecimal decimal = new BigDecimal(Double.toString(value)).stripTrailingZeros();
        String digits = decimal.unscaledValue().abs().toString();
        int exponent = digits.length() - 1 - decimal.scale();
        String sign = value < 0 ? "-" : "";
        if (exponent >= -4 && exponent < 16) {
            String positional = decimal.abs().toPlainString();
            return sign + (positional.indexOf('.') < 0 ? positional + ".0" : positional);
        }
        String mantissa = digits.length() == 1 ? digits : digits.charAt(0) + "." + digits.substring(1);
        return String.format(Locale.ROOT, "%s%se%s%02d", sign, mantissa, exponent < 0 ? "-" : "+", Math.abs(exponent));
    }

    public String template() {
        return template;
    }

    @Override
    public String toString() {
        return template;
    }
}

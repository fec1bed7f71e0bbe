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

package io.nosqlbench.cmdsweep.command.sweepfile;

import com.google.gson.Gson;
import com.google.gson.GsonBuilder;
import com.google.gson.JsonParseException;
import com.google.gson.ToNumberPolicy;
import io.nosqlbench.cmdsweep.api.errors.SweepValidationException;
import io.nosqlbench.cmdsweep.api.params.Parameter;
import io.nosqlbench.cmdsweep.api.params.ParameterGroup;
import io.nosqlbench.cmdsweep.api.params.ParameterUnit;
import io.nosqlbench.cmdsweep.api.sweep.SweepSpecification;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.snakeyaml.engine.v2.api.Load;
import org.snakeyaml.engine.v2.api.LoadSettings;
import org.snakeyaml.engine.v2.exceptions.YamlEngineException;

import java.io.BufferedReader;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/// Loads a [SweepSpecification] from a YAML or JSON sweep description.
///
/// The file type is chosen by extension: `.yaml` or `.yml` for YAML, `.json` for JSON.
/// A description is a map with a `params` list, where each entry is either a parameter or a
/// group, in enumeration order:
/// ```yaml
/// params:
///   - key: kernel
///     values: [gauss, imq]
///   - key: kparams
///     values: [1, 2, 3.2]
///     output: --kp
///   - keys: [lr, epochs]
///     values: [[0.1, 10], [0.01, 100]]
///     outputs: [--learning-rate, null]
/// ```
/// Integers are read as integral values and decimals as doubles, so they render the way
/// they were written.
public class SweepFileLoader {

    private static final Logger logger = LogManager.getLogger(SweepFileLoader.class);

    public static final String PARAMS = "params";

    private final static LoadSettings loadSettings = LoadSettings.builder().setLabel("sweep").build();
    private final static Gson gson = new GsonBuilder()
        .setObjectToNumberStrategy(ToNumberPolicy.LONG_OR_DOUBLE)
        .create();

    /// Load a sweep description.
    /// @param path the YAML or JSON file
    /// @return the described sweep
    /// @throws SweepFileException if the file cannot be read or does not describe a valid sweep
    public static SweepSpecification load(Path path) {
        Object data = read(path);
        SweepSpecification sweep = parse(path, data);
        logger.debug("Loaded sweep with {} units from {}", sweep.units().size(), path);
        return sweep;
    }

    private static Object read(Path path) {
        String name = path.getFileName() == null ? "" : path.getFileName().toString().toLowerCase(Locale.ROOT);
        try (BufferedReader reader = Files.newBufferedReader(path, StandardCharsets.UTF_8)) {
            if (name.endsWith(".yaml") || name.endsWith(".yml")) {
                return new Load(loadSettings).loadFromReader(reader);
            } else if (name.endsWith(".json")) {
                return gson.fromJson(reader, Object.class);
            }
        } catch (IOException e) {
            throw new SweepFileException(path, "cannot read sweep file: " + e.getMessage(), e);
        } catch (YamlEngineException | JsonParseException e) {
            throw new SweepFileException(path, "cannot parse sweep file: " + e.getMessage(), e);
        }
        throw new SweepFileException(path, "unsupported sweep file type, expected .yaml, .yml or .json");
    }

    /// Build a sweep from an already parsed description.
    /// @param path the file the description came from, for error messages
    /// @param data the parsed description
    /// @return the described sweep
    /// @throws SweepFileException if the description is not a valid sweep
    static SweepSpecification parse(Path path, Object data) {
        if (!(data instanceof Map<?, ?> root)) {
            throw new SweepFileException(path, "expected a map with a '" + PARAMS + "' list, but found " + describe(data));
        }
        if (!(root.get(PARAMS) instanceof List<?> entries)) {
            throw new SweepFileException(path, "expected a '" + PARAMS + "' list, but found " + describe(root.get(PARAMS)));
        }
        List<ParameterUnit> units = new ArrayList<>(entries.size());
        for (int i = 0; i < entries.size(); i++) {
            String where = PARAMS + "[" + i + "]";
            try {
                units.add(parseUnit(path, where, entries.get(i)));
            } catch (SweepValidationException e) {
                throw new SweepFileException(path, where + ": " + e.getMessage(), e);
            }
        }
        return new SweepSpecification(units);
    }

    private static ParameterUnit parseUnit(Path path, String where, Object entry) {
        if (!(entry instanceof Map<?, ?> unit)) {
            throw new SweepFileException(path, where + ": expected a map, but found " + describe(entry));
        }
        boolean single = unit.containsKey("key");
        boolean grouped = unit.containsKey("keys");
        if (single == grouped) {
            throw new SweepFileException(path, where + ": expected exactly one of 'key' or 'keys'");
        }
        if (!unit.containsKey("values")) {
            throw new SweepFileException(path, where + ": 'values' is required");
        }
        Object values = unit.get("values");
        if (single) {
            return new Parameter(stringOrNull(path, where + ".key", unit.get("key")), values,
                stringOrNull(path, where + ".output", unit.get("output")));
        }
        return new ParameterGroup(stringList(path, where + ".keys", unit.get("keys")), values,
            unit.get("outputs") == null ? null : stringList(path, where + ".outputs", unit.get("outputs")));
    }

    private static List<String> stringList(Path path, String where, Object value) {
        if (!(value instanceof List<?> list)) {
            throw new SweepFileException(path, where + ": expected a list, but found " + describe(value));
        }
        List<String> strings = new ArrayList<>(list.size());
        for (int i = 0; i < list.size(); i++) {
            strings.add(stringOrNull(path, where + "[" + i + "]", list.get(i)));
        }
        return strings;
    }

    private static String stringOrNull(Path path, String where, Object value) {
        if (value == null || value instanceof String) {
            return (String) value;
        }
        throw new SweepFileException(path, where + ": expected a string, but found " + describe(value));
    }

    private static String describe(Object value) {
        return value == null ? "nothing" : value.getClass().getSimpleName() + " " + value;
    }
}

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
import io.nosqlbench.cmdsweep.api.sweep.BoundArgumentSet;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.HexFormat;
import java.util.Objects;

/// Chooses the file name of the script written for one argument set.
@FunctionalInterface
public interface ScriptNamer {

    /// Number of hex digits kept from the content hash.
    int HASH_LENGTH = 14;

    String SCRIPT_EXTENSION = ".sh";

    /// @param args    the argument set
    /// @param ordinal the zero-based position of the argument set within the sweep
    /// @return a file name, relative to the script directory
    String name(BoundArgumentSet args, long ordinal);

    /// Name scripts by content: the first [#HASH_LENGTH] hex digits of the SHA-1 of the
    /// formatted command, plus `.sh`. The same command always gets the same name.
    /// @param formatter the formatter whose output is hashed
    /// @return a content-hashing namer
    static ScriptNamer hashed(InvocationFormatter formatter) {
        Objects.requireNonNull(formatter, "formatter cannot be null");
        return (args, ordinal) -> sha1Hex(formatter.format(args)).substring(0, HASH_LENGTH) + SCRIPT_EXTENSION;
    }

    /// Name scripts by position, such as `run-000000.sh`, `run-000001.sh`, and so on.
    /// @param prefix the file name prefix
    /// @return a position-numbering namer
    static ScriptNamer indexed(String prefix) {
        Objects.requireNonNull(prefix, "prefix cannot be null");
        return (args, ordinal) -> String.format("%s%06d%s", prefix, ordinal, SCRIPT_EXTENSION);
    }

    /// @param text any text
    /// @return the lowercase hex SHA-1 digest of the UTF-8 encoding of the text
    static String sha1Hex(String text) {
        try {
            MessageDigest digest = MessageDigest.getInstance("SHA-1");
            return HexFormat.of().formatHex(digest.digest(text.getBytes(StandardCharsets.UTF_8)));
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-1 is not available", e);
        }
    }
}

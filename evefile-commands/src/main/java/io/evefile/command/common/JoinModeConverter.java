package io.evefile.command.common;

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

import io.evefile.data.join.JoinMode;
import picocli.CommandLine;

import java.util.Arrays;
import java.util.Iterator;
import java.util.stream.Collectors;

/// Accepts join modes by descriptive, camel case or legacy name.
public class JoinModeConverter implements CommandLine.ITypeConverter<JoinMode> {

    @Override
    public JoinMode convert(String value) {
        JoinMode mode = JoinMode.fromString(value);
        if (mode == null) {
            throw new CommandLine.TypeConversionException(
                "There is no such join mode: '" + value + "'. Use one of " + candidates());
        }
        return mode;
    }

    static String candidates() {
        return Arrays.stream(JoinMode.values()).map(JoinMode::toValue).collect(Collectors.joining(", "));
    }

    /// Completion candidates for the help text.
    public static class Candidates implements Iterable<String> {
        @Override
        public Iterator<String> iterator() {
            return Arrays.stream(JoinMode.values()).map(JoinMode::toValue).iterator();
        }
    }
}

package io.evefile.data.file;

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

import java.time.LocalDateTime;
import java.time.format.DateTimeParseException;

/// A message an operator entered during a measurement.
/// @param timestamp when the message was entered
/// @param message the text
public record LogMessage(LocalDateTime timestamp, String message) {

    private static final String SEPARATOR = ": ";

    /// Parse a message as stored in the file: an ISO timestamp, `": "`, then the text.
    /// @param text the stored message
    /// @return the parsed message
    /// @throws IllegalArgumentException if there is no separator or the timestamp is invalid
    public static LogMessage fromString(String text) {
        int split = text == null ? -1 : text.indexOf(SEPARATOR);
        if (split < 0) {
            throw new IllegalArgumentException("Not a log message: '" + text + "'");
        }
        try {
            return new LogMessage(LocalDateTime.parse(text.substring(0, split).trim()),
                text.substring(split + SEPARATOR.length()));
        } catch (DateTimeParseException e) {
            throw new IllegalArgumentException("Invalid timestamp in log message '" + text + "'", e);
        }
    }

    @Override
    public String toString() {
        return timestamp + SEPARATOR + message;
    }
}

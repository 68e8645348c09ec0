package io.evefile.data.join;

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

/// The ways of choosing the common positions of a join.
///
/// Each mode has a descriptive name, a short camel case name and the name the fill
/// policies had in earlier releases. {@link #fromString(String)} accepts any of them.
public enum JoinMode {

    /// The positions of the channels; axes fill forward.
    CHANNEL_POSITIONS("ChannelPositions", "LastFill"),

    /// The positions of the axes; channels are masked where absent.
    AXIS_POSITIONS("AxisPositions", "NaNFill"),

    /// The positions present for both axes and channels.
    AXIS_AND_CHANNEL_POSITIONS("AxisAndChannelPositions", "NoFill"),

    /// The positions present for axes or channels.
    AXIS_OR_CHANNEL_POSITIONS("AxisOrChannelPositions", "LastNaNFill");

    public static final JoinMode DEFAULT = AXIS_OR_CHANNEL_POSITIONS;

    private final String camelName;
    private final String legacyName;

    JoinMode(String camelName, String legacyName) {
        this.camelName = camelName;
        this.legacyName = legacyName;
    }

    /// Parse a mode name, ignoring case, dashes and underscores.
    ///
    /// Accepts `axis_or_channel_positions`, `AxisOrChannelPositions`, `LastNaNFill`, ...
    /// Returns null for unrecognized values.
    ///
    /// @param value the name to parse
    /// @return the mode, or null if not recognized
    public static JoinMode fromString(String value) {
        if (value == null) {
            return null;
        }
        String key = normalize(value);
        for (JoinMode mode : values()) {
            if (key.equals(normalize(mode.name())) || key.equals(normalize(mode.camelName))
                || key.equals(normalize(mode.legacyName))) {
                return mode;
            }
        }
        return null;
    }

    /// Parse a mode name, failing for unknown names.
    /// @param value the name to parse
    /// @return the mode
    /// @throws IllegalArgumentException if the name is not recognized
    public static JoinMode parse(String value) {
        JoinMode mode = fromString(value);
        if (mode == null) {
            throw new IllegalArgumentException("There is no such join mode: " + value);
        }
        return mode;
    }

    private static String normalize(String value) {
        return value.trim().toLowerCase().replace("_", "").replace("-", "");
    }

    /// @return the lower case name used in configuration files
    public String toValue() {
        return name().toLowerCase();
    }
}

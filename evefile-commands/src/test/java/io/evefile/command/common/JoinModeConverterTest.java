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
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;
import picocli.CommandLine;

import static org.assertj.core.api.Assertions.*;

@DisplayName("JoinModeConverter")
class JoinModeConverterTest {

    private final JoinModeConverter converter = new JoinModeConverter();

    @ParameterizedTest
    @CsvSource({
        "axis_positions, AXIS_POSITIONS",
        "ChannelPositions, CHANNEL_POSITIONS",
        "NoFill, AXIS_AND_CHANNEL_POSITIONS",
        "axis-or-channel-positions, AXIS_OR_CHANNEL_POSITIONS"
    })
    @DisplayName("should convert any accepted name")
    void shouldConvert(String value, JoinMode expected) {
        assertThat(converter.convert(value)).isEqualTo(expected);
    }

    @Test
    @DisplayName("should list the modes when a name is unknown")
    void shouldRejectUnknown() {
        assertThatThrownBy(() -> converter.convert("nearest"))
            .isInstanceOf(CommandLine.TypeConversionException.class)
            .hasMessageContaining("'nearest'")
            .hasMessageContaining("axis_or_channel_positions");
    }

    @Test
    @DisplayName("should offer the configuration names as candidates")
    void shouldOfferCandidates() {
        assertThat(new JoinModeConverter.Candidates()).containsExactly(
            "channel_positions", "axis_positions", "axis_and_channel_positions", "axis_or_channel_positions");
    }
}

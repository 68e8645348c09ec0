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

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import java.time.LocalDateTime;

import static org.assertj.core.api.Assertions.*;

class LogMessageTest {

    @Test
    @DisplayName("should split timestamp and text at the first separator")
    void shouldParse() {
        LogMessage message = LogMessage.fromString("2024-06-03T12:05:00: Beam lost: refill");

        assertThat(message.timestamp()).isEqualTo(LocalDateTime.of(2024, 6, 3, 12, 5));
        assertThat(message.message()).isEqualTo("Beam lost: refill");
        assertThat(message).hasToString("2024-06-03T12:05: Beam lost: refill");
    }

    @ParameterizedTest
    @ValueSource(strings = {"", "Beam lost", "03.06.2024 12:05: Beam lost"})
    @DisplayName("should reject text without a leading ISO timestamp")
    void shouldRejectMalformed(String text) {
        assertThatThrownBy(() -> LogMessage.fromString(text)).isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    @DisplayName("should reject null")
    void shouldRejectNull() {
        assertThatThrownBy(() -> LogMessage.fromString(null)).isInstanceOf(IllegalArgumentException.class);
    }
}

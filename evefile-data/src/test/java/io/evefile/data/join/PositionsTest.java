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

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import java.util.List;

import static org.assertj.core.api.Assertions.*;

@DisplayName("Positions")
class PositionsTest {

    @Test
    @DisplayName("should unite positions sorted and without repeats")
    void shouldUnite() {
        assertThat(Positions.union(List.of(new long[]{5, 1, 3}, new long[]{3, 2}, new long[0])))
            .containsExactly(1, 2, 3, 5);
        assertThat(Positions.union(List.of())).isEmpty();
    }

    @Test
    @DisplayName("should intersect sorted positions")
    void shouldIntersect() {
        assertThat(Positions.intersection(new long[]{1, 2, 4, 6}, new long[]{2, 3, 4, 7})).containsExactly(2, 4);
        assertThat(Positions.intersection(new long[]{1, 2}, new long[]{3, 4})).isEmpty();
    }

    @ParameterizedTest
    @CsvSource({
        "0, 0, 0",
        "1, 1, 0",
        "2, 3, 1",
        "3, 3, 3",
        "5, 5, 3",
        "6, 5, 5"
    })
    @DisplayName("should find bounds in sorted positions with repeats")
    void shouldFindBounds(long key, int upper, int lower) {
        long[] sorted = {1, 2, 2, 5, 5};
        assertThat(Positions.upperBound(sorted, key)).isEqualTo(upper);
        assertThat(Positions.lowerBound(sorted, key)).isEqualTo(lower);
    }
}

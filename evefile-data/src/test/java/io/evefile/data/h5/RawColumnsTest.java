package io.evefile.data.h5;

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

import java.util.LinkedHashMap;
import java.util.Map;

import static org.assertj.core.api.Assertions.*;

class RawColumnsTest {

    private static RawColumns compound() {
        Map<String, Object> columns = new LinkedHashMap<>();
        columns.put("PosCounter", new int[]{1, 2, 3});
        columns.put("Count", new int[]{5, 6, 7});
        columns.put("Label", new String[]{"a", "b", "c"});
        return RawColumns.of(columns);
    }

    @Test
    @DisplayName("should address columns by ordinal and by name")
    void shouldAddressColumns() {
        RawColumns columns = compound();

        assertThat(columns.names()).containsExactly("PosCounter", "Count", "Label");
        assertThat(columns.columnCount()).isEqualTo(3);
        assertThat(columns.rowCount()).isEqualTo(3);
        assertThat((int[]) columns.column(1)).containsExactly(5, 6, 7);
        assertThat(columns.column("Count")).isSameAs(columns.column(1));
        assertThat(columns.has("Label")).isTrue();
    }

    @Test
    @DisplayName("should read the first value of a numeric column")
    void shouldReadFirstNumber() {
        RawColumns columns = compound();

        assertThat(columns.firstNumber("Count").intValue()).isEqualTo(5);
        assertThatThrownBy(() -> columns.firstNumber("Label"))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("not numeric");
        assertThatThrownBy(() -> RawColumns.single("Empty", new double[0]).firstNumber("Empty"))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("empty");
    }

    @Test
    @DisplayName("should report missing columns")
    void shouldReportMissingColumns() {
        RawColumns columns = compound();

        assertThatThrownBy(() -> columns.column(3)).isInstanceOf(IndexOutOfBoundsException.class);
        assertThatThrownBy(() -> columns.column("StdDev"))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("StdDev");
    }

    @Test
    @DisplayName("should accept only arrays")
    void shouldAcceptOnlyArrays() {
        assertThatThrownBy(() -> RawColumns.single("Scalar", 1.0))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("not an array");
        assertThat(RawColumns.of(Map.of()).rowCount()).isZero();
    }
}

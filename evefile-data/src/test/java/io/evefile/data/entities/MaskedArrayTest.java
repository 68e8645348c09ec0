package io.evefile.data.entities;

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
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.BitSet;

import static org.assertj.core.api.Assertions.*;

@DisplayName("MaskedArray")
class MaskedArrayTest {

    private static BitSet bits(int... rows) {
        BitSet mask = new BitSet();
        for (int row : rows) {
            mask.set(row);
        }
        return mask;
    }

    @Nested
    @DisplayName("Construction")
    class ConstructionTest {

        @Test
        @DisplayName("should copy the given array")
        void shouldCopyArray() {
            double[] values = {1.0, 2.0};
            MaskedArray array = MaskedArray.of(values);
            values[0] = 42.0;

            assertThat(array.getDouble(0)).isEqualTo(1.0);
            assertThat(array.componentType()).isEqualTo(double.class);
        }

        @Test
        @DisplayName("should reject non-arrays")
        void shouldRejectNonArray() {
            assertThatThrownBy(() -> MaskedArray.of("text"))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("Not an array");
        }

        @Test
        @DisplayName("should ignore mask bits beyond the length")
        void shouldIgnoreMaskBeyondLength() {
            MaskedArray array = MaskedArray.of(new long[]{1, 2}, bits(1, 5));

            assertThat(array.maskedCount()).isEqualTo(1);
            assertThat(array.isMasked(1)).isTrue();
        }

        @Test
        @DisplayName("should create fully masked columns")
        void shouldCreateAllMasked() {
            MaskedArray array = MaskedArray.allMasked(String.class, 3);

            assertThat(array.length()).isEqualTo(3);
            assertThat(array.maskedCount()).isEqualTo(3);
            assertThat(array.getString(2)).isEqualTo(MaskedArray.TEXT_FILL);
        }
    }

    @Nested
    @DisplayName("Missing values")
    class MissingValuesTest {

        @Test
        @DisplayName("should distinguish masked slots from zero, empty text and NaN")
        void shouldDistinguishMaskFromValues() {
            MaskedArray ints = MaskedArray.of(new int[]{0, 0}, bits(1));
            MaskedArray texts = MaskedArray.of(new String[]{"", ""}, bits(1));
            MaskedArray doubles = MaskedArray.of(new double[]{Double.NaN, Double.NaN}, bits(1));

            assertThat(ints.get(0)).isEqualTo(0);
            assertThat(ints.get(1)).isNull();
            assertThat(texts.get(0)).isEqualTo("");
            assertThat(texts.get(1)).isNull();
            assertThat(doubles.isMasked(0)).isFalse();
            assertThat(doubles.isMasked(1)).isTrue();
        }

        @Test
        @DisplayName("should render masked values as NaN and fill text")
        void shouldRenderMaskedValues() {
            MaskedArray array = MaskedArray.of(new double[]{1.5, 2.5}, bits(0));

            assertThat(array.getDouble(0)).isNaN();
            assertThat(array.getDouble(1)).isEqualTo(2.5);
            assertThat(array.getString(0)).isEqualTo("N/A");
            assertThat(array.getString(0, "")).isEmpty();
            assertThat(array.getString(1)).isEqualTo("2.5");
            assertThat(array.toString()).isEqualTo("[--, 2.5]");
        }

        @Test
        @DisplayName("should give NaN for non-numeric values")
        void shouldGiveNaNForText() {
            assertThat(MaskedArray.ofStrings("a").getDouble(0)).isNaN();
        }

        @Test
        @DisplayName("should reject rows out of range")
        void shouldRejectRowOutOfRange() {
            MaskedArray array = MaskedArray.ofDoubles(1.0);

            assertThatThrownBy(() -> array.get(1)).isInstanceOf(IndexOutOfBoundsException.class);
            assertThatThrownBy(() -> array.isMasked(-1)).isInstanceOf(IndexOutOfBoundsException.class);
        }
    }

    @Nested
    @DisplayName("Reshaping")
    class ReshapingTest {

        @Test
        @DisplayName("should gather rows and mask row -1")
        void shouldSelectRows() {
            MaskedArray array = MaskedArray.of(new double[]{1.0, 2.0, 3.0}, bits(2));

            MaskedArray selected = array.select(new int[]{1, -1, 0, 2, 1});

            assertThat(selected.length()).isEqualTo(5);
            assertThat(selected.get(0)).isEqualTo(2.0);
            assertThat(selected.isMasked(1)).isTrue();
            assertThat(selected.get(2)).isEqualTo(1.0);
            assertThat(selected.isMasked(3)).isTrue();
            assertThat(selected.get(4)).isEqualTo(2.0);
            assertThat(array.length()).isEqualTo(3);
        }

        @Test
        @DisplayName("should concatenate and keep masks")
        void shouldConcat() {
            MaskedArray first = MaskedArray.of(new long[]{1, 2}, bits(0));
            MaskedArray second = MaskedArray.of(new long[]{3}, bits(0));

            MaskedArray joined = first.concat(second);

            assertThat(joined.componentType()).isEqualTo(long.class);
            assertThat(joined.length()).isEqualTo(3);
            assertThat(joined.mask()).isEqualTo(bits(0, 2));
            assertThat(joined.get(1)).isEqualTo(2L);
        }

        @Test
        @DisplayName("should fall back to objects when concatenating different types")
        void shouldConcatMixedTypes() {
            MaskedArray joined = MaskedArray.ofDoubles(1.0).concat(MaskedArray.ofStrings("x"));

            assertThat(joined.componentType()).isEqualTo(Object.class);
            assertThat(joined.get(0)).isEqualTo(1.0);
            assertThat(joined.get(1)).isEqualTo("x");
        }

        @Test
        @DisplayName("should insert before the given rows")
        void shouldInsert() {
            MaskedArray array = MaskedArray.ofDoubles(10.0, 20.0, 30.0);

            MaskedArray spliced = array.insert(new int[]{0, 2, 3}, MaskedArray.ofDoubles(1.0, 2.0, 3.0));

            assertThat(spliced.toDoubleArray()).containsExactly(1.0, 10.0, 20.0, 2.0, 30.0, 3.0);
        }

        @Test
        @DisplayName("should keep the order of rows inserted at the same point")
        void shouldKeepInsertOrder() {
            MaskedArray spliced = MaskedArray.ofDoubles(10.0)
                .insert(new int[]{0, 0}, MaskedArray.ofDoubles(1.0, 2.0));

            assertThat(spliced.toDoubleArray()).containsExactly(1.0, 2.0, 10.0);
        }

        @Test
        @DisplayName("should reject mismatched insertion points")
        void shouldRejectMismatchedInsert() {
            assertThatThrownBy(() -> MaskedArray.ofDoubles(1.0).insert(new int[]{0}, MaskedArray.ofDoubles(1.0, 2.0)))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("one insertion point per inserted row");
            assertThatThrownBy(() -> MaskedArray.ofDoubles(1.0).insert(new int[]{2}, MaskedArray.ofDoubles(1.0)))
                .isInstanceOf(IndexOutOfBoundsException.class);
        }
    }

    @Nested
    @DisplayName("Conversion and equality")
    class ConversionTest {

        @Test
        @DisplayName("should convert numbers to longs")
        void shouldConvertToLongs() {
            assertThat(MaskedArray.of(new int[]{1, 2}).toLongArray()).containsExactly(1L, 2L);
            assertThat(MaskedArray.of(new Double[]{1.9, 2.0}).toLongArray()).containsExactly(1L, 2L);
        }

        @Test
        @DisplayName("should refuse to convert text or masked values to longs")
        void shouldRefuseLongConversion() {
            assertThatThrownBy(() -> MaskedArray.ofStrings("1").toLongArray())
                .isInstanceOf(IllegalStateException.class);
            assertThatThrownBy(() -> MaskedArray.of(new long[]{1}, bits(0)).toLongArray())
                .isInstanceOf(IllegalStateException.class)
                .hasMessageContaining("masked");
        }

        @Test
        @DisplayName("should ignore the values under the mask in equality")
        void shouldCompareIgnoringMaskedValues() {
            MaskedArray a = MaskedArray.of(new double[]{1.0, 2.0}, bits(1));
            MaskedArray b = MaskedArray.of(new double[]{1.0, 99.0}, bits(1));
            MaskedArray c = MaskedArray.ofDoubles(1.0, 2.0);

            assertThat(a).isEqualTo(b);
            assertThat(a.hashCode()).isEqualTo(b.hashCode());
            assertThat(a).isNotEqualTo(c);
        }

        @Test
        @DisplayName("should return copies of the backing array")
        void shouldCopyOut() {
            MaskedArray array = MaskedArray.ofLongs(1, 2);
            long[] copy = (long[]) array.toArray();
            copy[0] = 42;

            assertThat(array.get(0)).isEqualTo(1L);
            assertThat(array.isNumeric()).isTrue();
            assertThat(MaskedArray.ofStrings("a").isNumeric()).isFalse();
        }
    }
}

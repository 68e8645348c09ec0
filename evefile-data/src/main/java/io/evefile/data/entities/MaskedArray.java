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

import org.jetbrains.annotations.NotNull;

import java.lang.reflect.Array;
import java.util.Arrays;
import java.util.BitSet;
import java.util.Objects;

/// An immutable column of values together with a mask of missing slots.
///
/// The values are held in a plain Java array (`double[]`, `long[]`, `int[]`, `String[]`, ...),
/// and missing slots are tracked in a separate {@link BitSet}. A set bit means "no value at
/// this row". This keeps missing values distinct from any value the array can hold, including
/// `0`, the empty string or `NaN`, which matters for integer and textual device data where no
/// sentinel is available.
///
/// Instances never expose their backing array. Every operation which changes shape or content
/// returns a new instance.
public final class MaskedArray {

    /// The text used in place of a masked value when a textual rendering is asked for
    public static final String TEXT_FILL = "N/A";

    private final Object data;
    private final BitSet mask;
    private final int length;

    private MaskedArray(Object data, BitSet mask) {
        this.data = data;
        this.length = Array.getLength(data);
        this.mask = mask;
    }

    /// Wrap a copy of the given array, with no masked slots.
    /// @param array
    ///     a one-dimensional Java array of primitives or objects
    /// @return a new masked array
    /// @throws IllegalArgumentException
    ///     if the argument is not an array
    public static MaskedArray of(Object array) {
        return of(array, new BitSet());
    }

    /// Wrap a copy of the given array, masking the rows whose bits are set.
    /// @param array
    ///     a one-dimensional Java array of primitives or objects
    /// @param mask
    ///     the rows to mask, bits beyond the array length are ignored
    /// @return a new masked array
    public static MaskedArray of(Object array, BitSet mask) {
        if (array == null || !array.getClass().isArray()) {
            throw new IllegalArgumentException("Not an array: " + array);
        }
        int length = Array.getLength(array);
        Object copy = Array.newInstance(array.getClass().getComponentType(), length);
        System.arraycopy(array, 0, copy, 0, length);
        BitSet effective = (BitSet) mask.clone();
        if (effective.length() > length) {
            effective.clear(length, effective.length());
        }
        return new MaskedArray(copy, effective);
    }

    public static MaskedArray ofDoubles(double... values) {
        return of(values);
    }

    public static MaskedArray ofLongs(long... values) {
        return of(values);
    }

    public static MaskedArray ofStrings(String... values) {
        return of(values);
    }

    /// Create a column of the given type where every slot is masked.
    /// @param componentType
    ///     the element type of the backing array
    /// @param length
    ///     the number of rows
    /// @return a fully masked column
    public static MaskedArray allMasked(Class<?> componentType, int length) {
        BitSet mask = new BitSet(length);
        mask.set(0, length);
        return new MaskedArray(Array.newInstance(componentType, length), mask);
    }

    public int length() {
        return length;
    }

    public boolean isEmpty() {
        return length == 0;
    }

    /// @return the element type of the backing array
    public Class<?> componentType() {
        return data.getClass().getComponentType();
    }

    /// @return true if the elements are primitive numbers or boxed {@link Number}s
    public boolean isNumeric() {
        Class<?> type = componentType();
        if (type.isPrimitive()) {
            return type != boolean.class && type != char.class;
        }
        return Number.class.isAssignableFrom(type);
    }

    public boolean isMasked(int row) {
        checkRow(row);
        return mask.get(row);
    }

    /// @return true if at least one slot is masked
    public boolean hasMask() {
        return !mask.isEmpty();
    }

    public int maskedCount() {
        return mask.cardinality();
    }

    /// @return a copy of the mask
    public BitSet mask() {
        return (BitSet) mask.clone();
    }

    /// Get the value at a row, boxed.
    /// @param row
    ///     the row
    /// @return the value, or null if the row is masked
    public Object get(int row) {
        checkRow(row);
        if (mask.get(row)) {
            return null;
        }
        return Array.get(data, row);
    }

    /// Get a numeric value.
    /// @param row
    ///     the row
    /// @return the value as a double, or NaN for masked or non-numeric rows
    public double getDouble(int row) {
        Object value = get(row);
        if (value instanceof Number) {
            return ((Number) value).doubleValue();
        }
        return Double.NaN;
    }

    /// Get a textual value.
    /// @param row
    ///     the row
    /// @return the value rendered as text, or {@link #TEXT_FILL} if the row is masked
    public String getString(int row) {
        return getString(row, TEXT_FILL);
    }

    public String getString(int row, String fill) {
        Object value = get(row);
        return value == null ? fill : String.valueOf(value);
    }

    /// Gather rows into a new column.
    ///
    /// Row number `-1` produces a masked slot. Masked source rows stay masked.
    /// @param rows
    ///     the source row for each result row
    /// @return a new column with `rows.length` rows
    @NotNull
    public MaskedArray select(int[] rows) {
        Object selected = Array.newInstance(componentType(), rows.length);
        BitSet selectedMask = new BitSet(rows.length);
        for (int i = 0; i < rows.length; i++) {
            int source = rows[i];
            if (source < 0) {
                selectedMask.set(i);
                continue;
            }
            checkRow(source);
            Array.set(selected, i, Array.get(data, source));
            if (mask.get(source)) {
                selectedMask.set(i);
            }
        }
        return new MaskedArray(selected, selectedMask);
    }

    /// Append another column. The result keeps this column's element type when both types
    /// agree, and falls back to an `Object[]` column otherwise.
    /// @param other
    ///     the rows to append
    /// @return a new column of `length() + other.length()` rows
    public MaskedArray concat(MaskedArray other) {
        Class<?> type = componentType().equals(other.componentType()) ? componentType() : Object.class;
        int total = length + other.length;
        Object joined = Array.newInstance(type, total);
        for (int i = 0; i < length; i++) {
            Array.set(joined, i, Array.get(data, i));
        }
        for (int i = 0; i < other.length; i++) {
            Array.set(joined, length + i, Array.get(other.data, i));
        }
        BitSet joinedMask = (BitSet) mask.clone();
        for (int bit = other.mask.nextSetBit(0); bit >= 0; bit = other.mask.nextSetBit(bit + 1)) {
            joinedMask.set(length + bit);
        }
        return new MaskedArray(joined, joinedMask);
    }

    /// Insert rows of another column before the given rows of this one.
    ///
    /// `before[k]` is the row of this column in front of which `other` row `k` is placed;
    /// a value of `length()` appends. Rows inserted before the same row keep their order.
    /// @param before
    ///     insertion points, one per row of `other`
    /// @param other
    ///     the rows to insert
    /// @return a new column with the rows spliced in
    public MaskedArray insert(int[] before, MaskedArray other) {
        if (before.length != other.length) {
            throw new IllegalArgumentException(
                    "Need one insertion point per inserted row, got " + before.length + " for " + other.length);
        }
        Integer[] order = new Integer[before.length];
        for (int k = 0; k < order.length; k++) {
            if (before[k] < 0 || before[k] > length) {
                throw new IndexOutOfBoundsException("Insertion point " + before[k] + " outside 0.." + length);
            }
            order[k] = k;
        }
        Arrays.sort(order, (a, b) -> Integer.compare(before[a], before[b]));

        int[] rows = new int[length + other.length];
        int out = 0;
        int next = 0;
        for (int row = 0; row <= length; row++) {
            while (next < order.length && before[order[next]] == row) {
                rows[out++] = length + order[next++];
            }
            if (row < length) {
                rows[out++] = row;
            }
        }
        return concat(other).select(rows);
    }

    /// @return a copy of the backing array; masked slots hold the array type's default value
    public Object toArray() {
        Object copy = Array.newInstance(componentType(), length);
        System.arraycopy(data, 0, copy, 0, length);
        return copy;
    }

    /// @return the values as doubles, NaN for masked or non-numeric rows
    public double[] toDoubleArray() {
        double[] values = new double[length];
        for (int i = 0; i < length; i++) {
            values[i] = getDouble(i);
        }
        return values;
    }

    /// Convert a numeric column without masked slots to longs.
    /// @return the values as longs, truncating fractional parts
    /// @throws IllegalStateException
    ///     if the column is not numeric or has masked slots
    public long[] toLongArray() {
        if (!isNumeric()) {
            throw new IllegalStateException("Cannot convert " + componentType().getSimpleName() + " values to longs");
        }
        if (hasMask()) {
            throw new IllegalStateException("Cannot convert masked values to longs");
        }
        long[] values = new long[length];
        for (int i = 0; i < length; i++) {
            values[i] = ((Number) Array.get(data, i)).longValue();
        }
        return values;
    }

    private void checkRow(int row) {
        if (row < 0 || row >= length) {
            throw new IndexOutOfBoundsException("Row " + row + " outside 0.." + (length - 1));
        }
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof MaskedArray)) {
            return false;
        }
        MaskedArray that = (MaskedArray) o;
        if (length != that.length || !mask.equals(that.mask)) {
            return false;
        }
        for (int i = 0; i < length; i++) {
            if (!mask.get(i) && !Objects.equals(Array.get(data, i), Array.get(that.data, i))) {
                return false;
            }
        }
        return true;
    }

    @Override
    public int hashCode() {
        int result = Objects.hash(length, mask);
        for (int i = 0; i < length; i++) {
            if (!mask.get(i)) {
                result = 31 * result + Objects.hashCode(Array.get(data, i));
            }
        }
        return result;
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder("[");
        for (int i = 0; i < length; i++) {
            if (i > 0) {
                sb.append(", ");
            }
            sb.append(mask.get(i) ? "--" : String.valueOf(Array.get(data, i)));
        }
        return sb.append(']').toString();
    }
}

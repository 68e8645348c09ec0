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

import java.lang.reflect.Array;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/// The columns of a dataset as read from a file.
///
/// A compound dataset yields one column per member, in member order. A plain
/// one-dimensional dataset yields a single column. Columns are Java arrays and may be
/// addressed by ordinal or by name.
public final class RawColumns {

    private final LinkedHashMap<String, Object> columns;
    private final List<String> names;

    private RawColumns(LinkedHashMap<String, Object> columns) {
        this.columns = columns;
        this.names = Collections.unmodifiableList(new ArrayList<>(columns.keySet()));
    }

    /// @param columns member names mapped to arrays, in member order
    /// @return the columns
    /// @throws IllegalArgumentException if a value is not an array
    public static RawColumns of(Map<String, ?> columns) {
        LinkedHashMap<String, Object> copy = new LinkedHashMap<>();
        columns.forEach((name, column) -> {
            if (column == null || !column.getClass().isArray()) {
                throw new IllegalArgumentException("Column '" + name + "' is not an array");
            }
            copy.put(name, column);
        });
        return new RawColumns(copy);
    }

    /// @param name the column name
    /// @param column a one-dimensional array
    /// @return a single column
    public static RawColumns single(String name, Object column) {
        return of(Map.of(name, column));
    }

    public List<String> names() {
        return names;
    }

    public int columnCount() {
        return columns.size();
    }

    /// @return the length of the first column, or zero if there is none
    public int rowCount() {
        return columns.isEmpty() ? 0 : Array.getLength(columns.values().iterator().next());
    }

    public boolean has(String name) {
        return columns.containsKey(name);
    }

    /// @param ordinal zero-based member ordinal
    /// @return the column array
    /// @throws IndexOutOfBoundsException if there is no such column
    public Object column(int ordinal) {
        if (ordinal < 0 || ordinal >= names.size()) {
            throw new IndexOutOfBoundsException(
                "No column " + ordinal + " among " + names.size() + " columns " + names);
        }
        return columns.get(names.get(ordinal));
    }

    /// @param name member name
    /// @return the column array
    /// @throws IllegalArgumentException if there is no such column
    public Object column(String name) {
        Object column = columns.get(name);
        if (column == null) {
            throw new IllegalArgumentException("No column '" + name + "' among " + names);
        }
        return column;
    }

    /// Read the first value of a named column, as used for per-dataset settings.
    /// @param name member name
    /// @return the first value as a number
    /// @throws IllegalArgumentException if the column is missing, empty or not numeric
    public Number firstNumber(String name) {
        Object column = column(name);
        if (Array.getLength(column) == 0) {
            throw new IllegalArgumentException("Column '" + name + "' is empty");
        }
        Object value = Array.get(column, 0);
        if (!(value instanceof Number)) {
            throw new IllegalArgumentException("Column '" + name + "' is not numeric: " + value);
        }
        return (Number) value;
    }

    @Override
    public String toString() {
        return "RawColumns" + names + "x" + rowCount();
    }
}

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

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/// Rows of aligned data sequences sharing one index, with one column per sequence.
///
/// The main values of each sequence form a column labelled with the sequence name, or its
/// id when the name is empty. Auxiliary fields form further columns labelled
/// `<label>:<field>`, for example `Ring current:std`.
public final class DataTable {

    private final String indexName;
    private final long[] index;
    private final LinkedHashMap<String, MaskedArray> columns;

    private DataTable(String indexName, long[] index, LinkedHashMap<String, MaskedArray> columns) {
        this.indexName = indexName;
        this.index = index;
        this.columns = columns;
    }

    /// Tabulate one sequence with all its fields.
    /// @param sequence the sequence
    /// @return a table indexed like the sequence
    public static DataTable of(DataSequence sequence) {
        return of(List.of(sequence));
    }

    /// Tabulate sequences which share an index, such as the output of a join.
    /// @param sequences aligned sequences
    /// @return a table with a column per sequence field
    /// @throws IllegalArgumentException if there are no sequences or their indices differ
    public static DataTable of(List<DataSequence> sequences) {
        if (sequences == null || sequences.isEmpty()) {
            throw new IllegalArgumentException("Need data to tabulate");
        }
        DataSequence first = sequences.get(0);
        long[] index = first.index();
        LinkedHashMap<String, MaskedArray> columns = new LinkedHashMap<>();
        for (DataSequence sequence : sequences) {
            if (!Arrays.equals(index, sequence.index())) {
                throw new IllegalArgumentException(
                    "Cannot tabulate " + sequence + " with " + first + ": the indices differ, join them first");
            }
            String label = labelOf(sequence);
            for (DataField field : sequence.fieldNames()) {
                String column = field == DataField.DATA ? label : label + ":" + field.label();
                if (columns.containsKey(column)) {
                    throw new IllegalArgumentException("Duplicate column '" + column + "'");
                }
                columns.put(column, sequence.field(field));
            }
        }
        return new DataTable(first.kind().indexName(), index, columns);
    }

    static String labelOf(DataSequence sequence) {
        String name = sequence.metadata().getName();
        return name.isEmpty() ? sequence.metadata().getId() : name;
    }

    /// @return "position" for aligned data, "milliseconds" for monitors
    public String indexName() {
        return indexName;
    }

    public long[] index() {
        return index.clone();
    }

    public int rowCount() {
        return index.length;
    }

    public int columnCount() {
        return columns.size();
    }

    public List<String> columnNames() {
        return Collections.unmodifiableList(new ArrayList<>(columns.keySet()));
    }

    /// @param name a column label
    /// @return the column
    /// @throws IllegalArgumentException if there is no such column
    public MaskedArray column(String name) {
        MaskedArray column = columns.get(name);
        if (column == null) {
            throw new IllegalArgumentException("No column '" + name + "' in " + columns.keySet());
        }
        return column;
    }

    public Map<String, MaskedArray> columns() {
        return Collections.unmodifiableMap(columns);
    }

    /// Render one row as text, with `missing` in place of masked cells.
    /// @param row the row
    /// @param missing the fill for masked cells
    /// @return the index value followed by one cell per column
    @NotNull
    public List<String> row(int row, String missing) {
        List<String> cells = new ArrayList<>(columns.size() + 1);
        cells.add(Long.toString(index[row]));
        for (MaskedArray column : columns.values()) {
            cells.add(column.getString(row, missing));
        }
        return cells;
    }
}

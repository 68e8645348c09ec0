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

import io.evefile.data.entities.DataTable;

import java.io.IOException;
import java.io.Writer;
import java.util.ArrayList;
import java.util.List;

/// Writes a {@link DataTable} as comma separated values.
///
/// The first line holds the index name and the column names. Cells containing a comma,
/// a quote or a line break are quoted, with quotes doubled. Masked cells are written as
/// the configured missing value.
public class CsvTableWriter {

    private static final String LINE_END = "\n";

    private final String missing;

    public CsvTableWriter(String missing) {
        this.missing = missing == null ? "" : missing;
    }

    /// @param table the table to write
    /// @param writer where to write; not closed
    /// @return the number of data rows written
    /// @throws IOException if writing fails
    public int write(DataTable table, Writer writer) throws IOException {
        List<String> header = new ArrayList<>(table.columnCount() + 1);
        header.add(table.indexName());
        header.addAll(table.columnNames());
        writeLine(header, writer);
        for (int row = 0; row < table.rowCount(); row++) {
            writeLine(table.row(row, missing), writer);
        }
        writer.flush();
        return table.rowCount();
    }

    private static void writeLine(List<String> cells, Writer writer) throws IOException {
        for (int i = 0; i < cells.size(); i++) {
            if (i > 0) {
                writer.write(',');
            }
            writer.write(escape(cells.get(i)));
        }
        writer.write(LINE_END);
    }

    static String escape(String cell) {
        if (cell.indexOf(',') < 0 && cell.indexOf('"') < 0 && cell.indexOf('\n') < 0 && cell.indexOf('\r') < 0) {
            return cell;
        }
        return '"' + cell.replace("\"", "\"\"") + '"';
    }
}

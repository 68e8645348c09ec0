package io.evefile.command.subcommands;

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

import io.evefile.command.common.CsvTableWriter;
import io.evefile.command.common.OutputFileOption;
import io.evefile.data.entities.DataTable;
import picocli.CommandLine;

import java.io.IOException;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;

/// Sends a table to the output file, or to the command's standard output.
final class TableOutput {

    private TableOutput() {
    }

    static int write(DataTable table, CsvTableWriter csv, OutputFileOption output,
                     CommandLine.Model.CommandSpec spec) throws IOException {
        if (!output.hasOutputPath()) {
            return csv.write(table, spec.commandLine().getOut());
        }
        try (Writer writer = Files.newBufferedWriter(output.getOutputPath(), StandardCharsets.UTF_8)) {
            return csv.write(table, writer);
        }
    }
}

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
import io.evefile.command.common.InputFileOption;
import io.evefile.command.common.OutputFileOption;
import io.evefile.command.common.SettingsOption;
import io.evefile.data.config.EvefileSettings;
import io.evefile.data.entities.DataSequence;
import io.evefile.data.entities.DataTable;
import io.evefile.data.file.EveFile;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import picocli.CommandLine;

import java.io.IOException;
import java.util.concurrent.Callable;

/// Map a monitor of an eveH5 file onto positions and write it as CSV.
///
/// Each monitor value goes to the position that was running when it was recorded. Of
/// several values for one position the latest is kept.
@CommandLine.Command(
    name = "monitor",
    header = "Map a monitor onto positions",
    description = "Assigns the values of a monitor to the positions they were recorded at.",
    exitCodeList = {
        "0: Success",
        "2: Invalid arguments, unknown monitor or error reading the file"
    }
)
public class CMD_evefile_monitor implements Callable<Integer> {

    private static final Logger logger = LogManager.getLogger(CMD_evefile_monitor.class);

    @CommandLine.Spec
    private CommandLine.Model.CommandSpec spec;

    @CommandLine.Mixin
    private InputFileOption inputFileOption = new InputFileOption();

    @CommandLine.Mixin
    private OutputFileOption outputFileOption = new OutputFileOption();

    @CommandLine.Mixin
    private SettingsOption settingsOption = new SettingsOption();

    @CommandLine.Option(
        names = {"-d", "--monitor"},
        paramLabel = "ID",
        required = true,
        description = "Id or name of the monitor"
    )
    private String monitor;

    @Override
    public Integer call() throws IOException {
        inputFileOption.validate();
        outputFileOption.validate();

        EvefileSettings settings = settingsOption.settings();
        try (EveFile evefile = EveFile.open(inputFileOption.getInputPath(), settings)) {
            DataSequence mapped = evefile.mapMonitor(monitor);
            int rows = TableOutput.write(DataTable.of(mapped), new CsvTableWriter(settings.missingValue()),
                outputFileOption, spec);
            logger.info("Mapped monitor {} of {} onto {} position(s)", monitor, inputFileOption, rows);
        }
        return 0;
    }
}

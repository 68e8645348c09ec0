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
import io.evefile.command.common.JoinModeConverter;
import io.evefile.command.common.OutputFileOption;
import io.evefile.command.common.SettingsOption;
import io.evefile.command.common.VerbosityOption;
import io.evefile.data.config.EvefileSettings;
import io.evefile.data.entities.DataSequence;
import io.evefile.data.entities.DataTable;
import io.evefile.data.file.EveFile;
import io.evefile.data.join.JoinMode;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import picocli.CommandLine;

import java.io.IOException;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.Callable;

/// Join data of an eveH5 file onto common positions and write it as CSV.
///
/// The join mode decides which positions are kept. Axes keep their last value until they
/// move again, channels are only filled where they were read.
///
/// ## Usage
///
/// ```bash
/// evefile join -i scan.h5
/// evefile join -i scan.h5 -d SimMot:01,SimChan:01 -m channel_positions -o scan.csv
/// ```
@CommandLine.Command(
    name = "join",
    header = "Join data onto common positions",
    description = "Aligns axes and channels onto common positions and writes one CSV row per position.",
    exitCodeList = {
        "0: Success",
        "2: Invalid arguments or error reading the file"
    }
)
public class CMD_evefile_join implements Callable<Integer> {

    private static final Logger logger = LogManager.getLogger(CMD_evefile_join.class);

    @CommandLine.Spec
    private CommandLine.Model.CommandSpec spec;

    @CommandLine.Mixin
    private InputFileOption inputFileOption = new InputFileOption();

    @CommandLine.Mixin
    private OutputFileOption outputFileOption = new OutputFileOption();

    @CommandLine.Mixin
    private SettingsOption settingsOption = new SettingsOption();

    @CommandLine.Mixin
    private VerbosityOption verbosityOption = new VerbosityOption();

    @CommandLine.Option(
        names = {"-d", "--data"},
        split = ",",
        paramLabel = "ID",
        description = "Ids or names of the data to join (default: all data)"
    )
    private List<String> data = new ArrayList<>();

    @CommandLine.Option(
        names = {"-m", "--mode"},
        converter = JoinModeConverter.class,
        completionCandidates = JoinModeConverter.Candidates.class,
        description = "Join mode: ${COMPLETION-CANDIDATES} (default: from settings)"
    )
    private JoinMode mode;

    @CommandLine.Option(
        names = {"--missing"},
        description = "Text written for missing values (default: from settings)"
    )
    private String missing;

    @Override
    public Integer call() throws IOException {
        verbosityOption.validate();
        inputFileOption.validate();
        outputFileOption.validate();

        EvefileSettings settings = settingsOption.settings();
        try (EveFile evefile = EveFile.open(inputFileOption.getInputPath(), settings)) {
            List<DataSequence> joined = evefile.getJoinedData(data, mode);
            if (verbosityOption.showVerbose()) {
                joined.forEach(sequence -> spec.commandLine().getErr().print(sequence.describe()));
            }
            DataTable table = DataTable.of(joined);
            int rows = TableOutput.write(table, new CsvTableWriter(missing == null ? settings.missingValue() : missing),
                outputFileOption, spec);
            if (outputFileOption.hasOutputPath() && verbosityOption.showNormalOutput()) {
                spec.commandLine().getErr().printf("Wrote %d rows of %d columns to %s%n",
                    rows, table.columnCount(), outputFileOption.getOutputPath());
            }
            logger.info("Joined {} sequence(s) of {} onto {} position(s) by {}",
                joined.size(), inputFileOption, rows, mode == null ? settings.joinMode() : mode);
        }
        return 0;
    }
}

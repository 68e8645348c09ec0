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

import com.google.gson.Gson;
import com.google.gson.GsonBuilder;
import io.evefile.command.common.InputFileOption;
import io.evefile.command.common.SettingsOption;
import io.evefile.data.entities.DataSequence;
import io.evefile.data.file.EveFile;
import io.evefile.data.file.LogMessage;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import picocli.CommandLine;

import java.io.PrintWriter;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.Callable;

/// Show what an eveH5 file contains.
///
/// Lists the file metadata, the log messages and, for data, snapshots and monitors, the
/// id, name and kind of each sequence. Data is not read for this, only attributes.
///
/// ## Usage
///
/// ```bash
/// evefile info -i scan.h5
/// evefile info -i scan.h5 --format json
/// ```
@CommandLine.Command(
    name = "info",
    header = "Show the contents of an eveH5 file",
    description = "Lists file metadata, log messages, data, snapshots and monitors.",
    exitCodeList = {
        "0: Success",
        "2: Error reading file"
    }
)
public class CMD_evefile_info implements Callable<Integer> {

    private static final Logger logger = LogManager.getLogger(CMD_evefile_info.class);

    private static final Gson gson = new GsonBuilder().setPrettyPrinting().create();

    /// Output formats.
    public enum Format {
        TEXT,
        JSON
    }

    @CommandLine.Spec
    private CommandLine.Model.CommandSpec spec;

    @CommandLine.Mixin
    private InputFileOption inputFileOption = new InputFileOption();

    @CommandLine.Mixin
    private SettingsOption settingsOption = new SettingsOption();

    @CommandLine.Option(
        names = {"--format"},
        description = "Output format: text or json (default: text)"
    )
    private Format format = Format.TEXT;

    @Override
    public Integer call() {
        inputFileOption.validate();
        PrintWriter out = spec.commandLine().getOut();
        try (EveFile evefile = EveFile.open(inputFileOption.getInputPath(), settingsOption.settings())) {
            if (format == Format.JSON) {
                out.println(gson.toJson(toJson(evefile)));
            } else {
                out.print(evefile.showInfo());
            }
        }
        out.flush();
        logger.debug("Listed {} as {}", inputFileOption, format);
        return 0;
    }

    static Map<String, Object> toJson(EveFile evefile) {
        Map<String, Object> json = new LinkedHashMap<>();
        json.put("metadata", evefile.metadata().toMap());
        List<Map<String, String>> messages = new ArrayList<>();
        for (LogMessage message : evefile.logMessages()) {
            Map<String, String> entry = new LinkedHashMap<>();
            entry.put("timestamp", message.timestamp().toString());
            entry.put("message", message.message());
            messages.add(entry);
        }
        json.put("log_messages", messages);
        json.put("data", describe(evefile.data()));
        json.put("snapshots", describe(evefile.snapshots()));
        json.put("monitors", describe(evefile.monitors()));
        return json;
    }

    private static List<Map<String, Object>> describe(Map<String, DataSequence> sequences) {
        List<Map<String, Object>> described = new ArrayList<>(sequences.size());
        for (DataSequence sequence : sequences.values()) {
            Map<String, Object> entry = new LinkedHashMap<>();
            entry.put("kind", sequence.kind().name().toLowerCase());
            sequence.channelType().ifPresent(type -> entry.put("channel_type", type.name().toLowerCase()));
            entry.putAll(sequence.metadata().attributes(sequence.kind(), sequence.channelType().orElse(null)));
            described.add(entry);
        }
        return described;
    }
}

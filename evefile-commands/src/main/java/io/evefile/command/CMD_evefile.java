package io.evefile.command;

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

import io.evefile.command.subcommands.CMD_evefile_info;
import io.evefile.command.subcommands.CMD_evefile_join;
import io.evefile.command.subcommands.CMD_evefile_monitor;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import picocli.CommandLine;

import java.util.concurrent.Callable;

/// The evefile command reads eveH5 measurement files.
///
/// This is an umbrella command for the subcommands which list a file's contents, join its
/// data onto common positions and map its monitors onto positions.
///
/// ## Usage
///
/// ```bash
/// evefile info -i scan.h5
/// evefile join -i scan.h5 -d SimMot:01,SimChan:01 -m axis_positions -o scan.csv
/// evefile monitor -i scan.h5 -d SimMon:01
/// ```
@CommandLine.Command(name = "evefile",
    header = "Read eveH5 measurement files",
    description = "Lists, joins and maps the data recorded in eveH5 files",
    mixinStandardHelpOptions = true,
    version = "evefile 0.3.0",
    exitCodeListHeading = "Exit codes:%n",
    exitCodeList = {
        "0: Success",
        "2: Invalid arguments or error reading the file"
    },
    subcommands = {
        CMD_evefile_info.class,
        CMD_evefile_join.class,
        CMD_evefile_monitor.class,
        CommandLine.HelpCommand.class
    })
public class CMD_evefile implements Callable<Integer> {
    private static final Logger logger = LogManager.getLogger(CMD_evefile.class);

    /// Exit code for failures while executing a subcommand.
    public static final int EXIT_ERROR = 2;

    /// Run CMD_evefile
    ///
    /// @param args Command line arguments
    public static void main(String[] args) {
        System.exit(commandLine().execute(args));
    }

    /// @return the command line, with errors during execution reported as exit code 2
    public static CommandLine commandLine() {
        CommandLine commandLine = new CommandLine(new CMD_evefile());
        commandLine.setCaseInsensitiveEnumValuesAllowed(true);
        commandLine.setExecutionExceptionHandler((exception, failed, parseResult) -> {
            logger.error("{} failed", failed.getCommandName(), exception);
            failed.getErr().println("Error: " + exception.getMessage());
            return EXIT_ERROR;
        });
        return commandLine;
    }

    /// Print usage when no subcommand is given
    ///
    /// @return 0
    @Override
    public Integer call() {
        CommandLine.usage(this, System.out);
        return 0;
    }
}

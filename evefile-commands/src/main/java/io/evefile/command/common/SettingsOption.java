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

import io.evefile.data.config.EvefileSettings;
import picocli.CommandLine;

import java.nio.file.Path;

/// Chooses the settings a command reads files with.
///
/// Without `--config` the user settings file is used when present, otherwise the bundled
/// defaults.
public class SettingsOption {

    @CommandLine.Option(
        names = {"--config"},
        description = "A YAML settings file overriding the defaults (default: ~/.config/evefile/settings.yaml)"
    )
    private Path configPath;

    public Path getConfigPath() {
        return configPath;
    }

    /// @return the effective settings
    public EvefileSettings settings() {
        return configPath == null ? EvefileSettings.userDefault() : EvefileSettings.load(configPath);
    }
}

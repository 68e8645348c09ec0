package io.evefile.data.config;

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

import io.evefile.data.join.JoinMode;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.snakeyaml.engine.v2.api.Load;
import org.snakeyaml.engine.v2.api.LoadSettings;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.nio.charset.Charset;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.Map;

/// Settings for reading measurement files.
///
/// Defaults come from the classpath resource `evefile-defaults.yaml`. A settings file
/// overrides any of its keys:
///
/// ```yaml
/// join:
///   mode: axis_positions
/// attributes:
///   fallback-charset: ISO-8859-1
/// table:
///   missing: NaN
/// ```
///
/// @param joinMode the join mode used when none is given
/// @param fallbackCharset the charset for attribute strings that do not decode as UTF-8
/// @param missingValue the text written for masked values in tables
public record EvefileSettings(JoinMode joinMode, Charset fallbackCharset, String missingValue) {

    private static final Logger logger = LogManager.getLogger(EvefileSettings.class);

    public static final String DEFAULTS_RESOURCE = "evefile-defaults.yaml";
    public static final Path USER_SETTINGS = Path.of(System.getProperty("user.home"), ".config", "evefile", "settings.yaml");

    /// @return the settings from the bundled defaults
    public static EvefileSettings defaults() {
        return fromMap(defaultMap());
    }

    /// Load the user settings file if there is one, otherwise the defaults.
    /// @return the effective settings
    public static EvefileSettings userDefault() {
        if (Files.isRegularFile(USER_SETTINGS)) {
            return load(USER_SETTINGS);
        }
        return defaults();
    }

    /// Load a settings file over the defaults.
    /// @param path a YAML settings file
    /// @return the effective settings
    /// @throws UncheckedIOException if the file cannot be read
    /// @throws IllegalArgumentException if a value is invalid
    public static EvefileSettings load(Path path) {
        try {
            logger.debug("Loading settings from {}", path);
            return fromYaml(Files.readString(path, StandardCharsets.UTF_8), path.toString());
        } catch (IOException e) {
            throw new UncheckedIOException("Cannot read settings from " + path, e);
        }
    }

    /// Parse YAML settings over the defaults.
    /// @param yaml the settings text
    /// @param label where the text came from, for messages
    /// @return the effective settings
    public static EvefileSettings fromYaml(String yaml, String label) {
        Map<String, Object> merged = defaultMap();
        merge(merged, parse(yaml, label), label);
        return fromMap(merged);
    }

    private static Map<String, Object> defaultMap() {
        try (InputStream in = EvefileSettings.class.getClassLoader().getResourceAsStream(DEFAULTS_RESOURCE)) {
            if (in == null) {
                throw new IllegalStateException("Missing classpath resource " + DEFAULTS_RESOURCE);
            }
            return parse(new String(in.readAllBytes(), StandardCharsets.UTF_8), DEFAULTS_RESOURCE);
        } catch (IOException e) {
            throw new UncheckedIOException("Cannot read " + DEFAULTS_RESOURCE, e);
        }
    }

    @SuppressWarnings("unchecked")
    private static Map<String, Object> parse(String yaml, String label) {
        Load load = new Load(LoadSettings.builder().setLabel(label).build());
        Object document = load.loadFromString(yaml);
        if (document == null) {
            return new LinkedHashMap<>();
        }
        if (!(document instanceof Map)) {
            throw new IllegalArgumentException("Settings in " + label + " must be a mapping, not " + document);
        }
        return new LinkedHashMap<>((Map<String, Object>) document);
    }

    @SuppressWarnings("unchecked")
    private static void merge(Map<String, Object> target, Map<String, Object> overrides, String label) {
        overrides.forEach((key, value) -> {
            Object existing = target.get(key);
            if (existing instanceof Map && value instanceof Map) {
                Map<String, Object> nested = new LinkedHashMap<>((Map<String, Object>) existing);
                merge(nested, (Map<String, Object>) value, label);
                target.put(key, nested);
            } else if (existing == null && !target.containsKey(key)) {
                logger.warn("Ignoring unknown setting '{}' in {}", key, label);
            } else {
                target.put(key, value);
            }
        });
    }

    private static EvefileSettings fromMap(Map<String, Object> map) {
        String mode = String.valueOf(lookup(map, "join", "mode"));
        JoinMode joinMode = JoinMode.parse(mode);
        String charsetName = String.valueOf(lookup(map, "attributes", "fallback-charset"));
        Charset charset;
        try {
            charset = Charset.forName(charsetName);
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("Unknown fallback charset '" + charsetName + "'", e);
        }
        Object missing = lookup(map, "table", "missing");
        return new EvefileSettings(joinMode, charset, missing == null ? "" : String.valueOf(missing));
    }

    private static Object lookup(Map<String, Object> map, String section, String key) {
        Object nested = map.get(section);
        if (!(nested instanceof Map<?, ?> values)) {
            throw new IllegalArgumentException("Missing settings section '" + section + "'");
        }
        return values.get(key);
    }

    /// @param joinMode the new join mode
    /// @return a copy with the join mode replaced
    public EvefileSettings withJoinMode(JoinMode joinMode) {
        return new EvefileSettings(joinMode, fallbackCharset, missingValue);
    }
}

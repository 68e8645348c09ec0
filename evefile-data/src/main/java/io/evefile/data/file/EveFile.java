package io.evefile.data.file;

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
import io.evefile.data.entities.DataSequence;
import io.evefile.data.entities.DataTable;
import io.evefile.data.h5.AttributeDecoder;
import io.evefile.data.h5.H5Source;
import io.evefile.data.h5.JhdfSource;
import io.evefile.data.join.JoinFactory;
import io.evefile.data.join.JoinMode;
import io.evefile.data.mapping.TimestampMapper;
import io.evefile.data.version.VersionMapper;
import io.evefile.data.version.VersionMapperFactory;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.jetbrains.annotations.NotNull;

import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/// A measurement file and everything recorded in it.
///
/// ## Contents
///
/// - {@link #metadata()} - file level metadata
/// - {@link #logMessages()} - messages entered during the measurement
/// - {@link #data()} - axes and channels recorded at each position, by id
/// - {@link #snapshots()} - axis and channel values recorded outside the scan, by id
/// - {@link #monitors()} - devices recorded whenever they changed, by id
/// - {@link #positionTimestamps()} - when each position started
///
/// Loading maps the file layout onto these collections without reading any values; data
/// is read when first accessed.
///
/// ## Usage
///
/// ```java
/// try (EveFile evefile = EveFile.open(Path.of("scan.h5"))) {
///     DataTable table = evefile.getDataTable(List.of("SimMot:01", "SimChan:01"), JoinMode.AXIS_POSITIONS);
/// }
/// ```
public class EveFile implements AutoCloseable {

    private static final Logger logger = LogManager.getLogger(EveFile.class);

    private final FileMetadata metadata = new FileMetadata();
    private final List<LogMessage> logMessages = new ArrayList<>();
    private final Map<String, DataSequence> data = new LinkedHashMap<>();
    private final Map<String, DataSequence> snapshots = new LinkedHashMap<>();
    private final Map<String, DataSequence> monitors = new LinkedHashMap<>();
    private DataSequence positionTimestamps;

    private final EvefileSettings settings;
    private H5Source source;

    public EveFile() {
        this(EvefileSettings.defaults());
    }

    public EveFile(EvefileSettings settings) {
        this.settings = settings == null ? EvefileSettings.defaults() : settings;
    }

    /// Open and load a file with the user's settings.
    /// @param path the measurement file
    /// @return the loaded file
    public static EveFile open(Path path) {
        return open(path, EvefileSettings.userDefault());
    }

    /// Open and load a file.
    /// @param path the measurement file
    /// @param settings reading settings
    /// @return the loaded file
    /// @throws UncheckedIOException if the file does not exist or is no HDF5 file
    /// @throws io.evefile.data.version.UnsupportedVersionException if the layout version is unknown
    public static EveFile open(Path path, EvefileSettings settings) {
        EveFile evefile = new EveFile(settings);
        evefile.metadata.setFilename(path.toString());
        evefile.load();
        return evefile;
    }

    /// Load the file named in the metadata.
    /// @return this file
    /// @throws IllegalStateException if no filename was set
    public EveFile load() {
        String filename = metadata.getFilename();
        if (filename.isEmpty()) {
            throw new IllegalStateException("Missing filename to load from");
        }
        Path path = Path.of(filename);
        if (!Files.isRegularFile(path)) {
            throw new UncheckedIOException(new NoSuchFileException(filename));
        }
        return load(new JhdfSource(path, new AttributeDecoder(settings.fallbackCharset())));
    }

    /// Load from an already opened source. The source is closed with this file.
    /// @param source the file contents
    /// @return this file
    public EveFile load(H5Source source) {
        if (this.source != null) {
            throw new IllegalStateException("Already loaded from " + this.source.filename());
        }
        this.source = source;
        if (metadata.getFilename().isEmpty()) {
            metadata.setFilename(source.filename());
        }
        VersionMapper mapper = new VersionMapperFactory().getMapper(source);
        mapper.map(source, this);
        logger.info("Loaded {}: {} data, {} snapshot(s), {} monitor(s)",
            metadata.getFilename(), data.size(), snapshots.size(), monitors.size());
        return this;
    }

    public EvefileSettings settings() {
        return settings;
    }

    public FileMetadata metadata() {
        return metadata;
    }

    public List<LogMessage> logMessages() {
        return Collections.unmodifiableList(logMessages);
    }

    public Map<String, DataSequence> data() {
        return Collections.unmodifiableMap(data);
    }

    public Map<String, DataSequence> snapshots() {
        return Collections.unmodifiableMap(snapshots);
    }

    public Map<String, DataSequence> monitors() {
        return Collections.unmodifiableMap(monitors);
    }

    public Optional<DataSequence> positionTimestamps() {
        return Optional.ofNullable(positionTimestamps);
    }

    public void addLogMessage(LogMessage message) {
        logMessages.add(message);
    }

    public void putData(String id, DataSequence sequence) {
        data.put(id, sequence);
    }

    public void putSnapshot(String id, DataSequence sequence) {
        snapshots.put(id, sequence);
    }

    public void putMonitor(String id, DataSequence sequence) {
        monitors.put(id, sequence);
    }

    public void setPositionTimestamps(DataSequence positionTimestamps) {
        this.positionTimestamps = positionTimestamps;
    }

    /// Look up data by id, then by name.
    /// @param key an id or name
    /// @return the data
    /// @throws IllegalArgumentException if nothing matches
    @NotNull
    public DataSequence getData(String key) {
        return find(data, key).orElseThrow(() -> new IllegalArgumentException(
            "No data '" + key + "' in " + metadata.getFilename()));
    }

    /// @param keys ids or names
    /// @return the data, in the order of the keys
    public List<DataSequence> getData(List<String> keys) {
        List<DataSequence> found = new ArrayList<>(keys.size());
        for (String key : keys) {
            found.add(getData(key));
        }
        return found;
    }

    /// Look up a monitor by id, then by name.
    /// @param key an id or name
    /// @return the monitor
    /// @throws IllegalArgumentException if nothing matches
    public DataSequence getMonitor(String key) {
        return find(monitors, key).orElseThrow(() -> new IllegalArgumentException(
            "No monitor '" + key + "' in " + metadata.getFilename()));
    }

    /// @param id the id of an axis or channel
    /// @return its snapshot, if one was recorded
    public Optional<DataSequence> findSnapshot(String id) {
        return Optional.ofNullable(snapshots.get(id));
    }

    private static Optional<DataSequence> find(Map<String, DataSequence> sequences, String key) {
        if (key == null) {
            return Optional.empty();
        }
        DataSequence byId = sequences.get(key);
        if (byId != null) {
            return Optional.of(byId);
        }
        return sequences.values().stream()
            .filter(sequence -> key.equals(sequence.metadata().getName()))
            .findFirst();
    }

    /// @return the names of all data, in file order
    public List<String> getDataNames() {
        List<String> names = new ArrayList<>(data.size());
        data.values().forEach(sequence -> names.add(sequence.metadata().getName()));
        return names;
    }

    /// The preferred axis, channel and normalization channel recorded for the scan.
    /// @return those that are recorded and present, in that order
    public List<DataSequence> getPreferredData() {
        List<DataSequence> preferred = new ArrayList<>();
        for (String id : List.of(metadata.getPreferredAxis(), metadata.getPreferredChannel(),
            metadata.getPreferredNormalisationChannel())) {
            if (id != null && !id.isEmpty()) {
                find(data, id).ifPresentOrElse(preferred::add,
                    () -> logger.warn("Preferred data '{}' not found in {}", id, metadata.getFilename()));
            }
        }
        return preferred;
    }

    /// Join data onto common positions.
    /// @param keys ids or names; all data when null or empty
    /// @param mode the join mode; the configured default when null
    /// @return the aligned data, in the order of the keys
    public List<DataSequence> getJoinedData(List<String> keys, JoinMode mode) {
        List<String> effective = keys == null || keys.isEmpty() ? new ArrayList<>(data.keySet()) : keys;
        JoinFactory factory = new JoinFactory(this);
        factory.setDefaultMode(settings.joinMode());
        return (mode == null ? factory.getJoin() : factory.getJoin(mode)).join(effective);
    }

    /// Join data onto common positions and tabulate it.
    /// @param keys ids or names; all data when null or empty
    /// @param mode the join mode; the configured default when null
    /// @return a table with one row per common position
    public DataTable getDataTable(List<String> keys, JoinMode mode) {
        return DataTable.of(getJoinedData(keys, mode));
    }

    /// Map a monitor onto positions.
    /// @param key the monitor id or name
    /// @return the monitor values by position
    public DataSequence mapMonitor(String key) {
        return new TimestampMapper(this).map(key);
    }

    /// @return a listing of the metadata, log messages, data, snapshots and monitors
    public String showInfo() {
        StringBuilder sb = new StringBuilder();
        sb.append("METADATA\n").append(metadata).append('\n');
        if (!logMessages.isEmpty()) {
            sb.append("LOG MESSAGES\n");
            logMessages.forEach(message -> sb.append(message).append('\n'));
            sb.append('\n');
        }
        appendListing(sb, "DATA", data);
        appendListing(sb, "SNAPSHOTS", snapshots);
        appendListing(sb, "MONITORS", monitors);
        return sb.toString();
    }

    private static void appendListing(StringBuilder sb, String title, Map<String, DataSequence> sequences) {
        sb.append(title).append('\n');
        sequences.values().forEach(sequence -> sb.append(sequence).append('\n'));
        sb.append('\n');
    }

    @Override
    public void close() {
        if (source != null) {
            source.close();
            source = null;
        }
    }
}

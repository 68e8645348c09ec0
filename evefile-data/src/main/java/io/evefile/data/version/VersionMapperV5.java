package io.evefile.data.version;

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

import io.evefile.data.entities.ChannelType;
import io.evefile.data.entities.DataField;
import io.evefile.data.entities.DataKind;
import io.evefile.data.entities.DataLoader;
import io.evefile.data.entities.DataMetadata;
import io.evefile.data.entities.DataSequence;
import io.evefile.data.file.FileMetadata;
import io.evefile.data.file.LogMessage;
import io.evefile.data.h5.RawColumns;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.lang.reflect.Array;
import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/// Maps files of eveH5 version 5.
///
/// ## Layout
///
/// - `/c1/meta/PosCountTimer` - when each position started
/// - `/device/*` - monitors
/// - `/c1/main/*` - axes (`DeviceType=Axis`) and channels
/// - `/c1/main/standarddev/<id>__Count`, `<id>__TrigIntv-StdDev` - interval channel statistics
/// - `/c1/main/averagemeta/<id>__AverageCount`, `<id>__Attempts`, `<id>__Limit-MaxDev` - average channel settings
/// - `/c1/main/normalized/<id>__<normalizing id>` - normalized channel values
/// - `/c1/snapshot/*` - snapshots of axes and channels
/// - `/LiveComment` - log messages
///
/// Start date and time are stored as separate attributes in `dd.MM.yyyy` and `HH:mm:ss`
/// format. There is no end time.
public class VersionMapperV5 extends VersionMapper {

    private static final Logger logger = LogManager.getLogger(VersionMapperV5.class);

    public static final String TIMESTAMPS = "/c1/meta/PosCountTimer";
    public static final String LOG_MESSAGES = "/LiveComment";
    public static final String NORMALIZED = MAIN + "/normalized";
    public static final String AVERAGE_META = MAIN + "/averagemeta";
    public static final String STANDARD_DEVIATION = MAIN + "/standarddev";

    static final Set<String> METADATA_GROUPS = Set.of("normalized", "averagemeta", "standarddev");
    static final String SEPARATOR = "__";
    static final DateTimeFormatter START_FORMAT = DateTimeFormatter.ofPattern("dd.MM.yyyy HH:mm:ss");

    @Override
    public int version() {
        return 5;
    }

    @Override
    protected void setDatasetNames() {
        super.setDatasetNames();
        for (String name : childrenIfPresent(MAIN)) {
            if (!METADATA_GROUPS.contains(name)) {
                datasetsToMapInMain.add(name);
            }
        }
        datasetsToMapInSnapshot.addAll(childrenIfPresent(SNAPSHOT));
        datasetsToMapInMonitor.addAll(childrenIfPresent(MONITOR));
    }

    @Override
    protected void mapAll() {
        super.mapAll();
        mapLogMessages();
    }

    @Override
    protected void mapFileMetadata() {
        Map<String, String> root = source.attributes("/");
        FileMetadata metadata = destination.metadata();
        Optional.ofNullable(root.get("EVEH5Version")).ifPresent(metadata::setEveh5Version);
        Optional.ofNullable(root.get("Version")).ifPresent(metadata::setEveVersion);
        Optional.ofNullable(root.get("XMLversion")).ifPresent(metadata::setXmlVersion);
        Optional.ofNullable(root.get("Location")).ifPresent(metadata::setMeasurementStation);
        Optional.ofNullable(root.get("Comment")).ifPresent(metadata::setDescription);

        if (source.contains(C1)) {
            Map<String, String> c1 = source.attributes(C1);
            Optional.ofNullable(c1.get("preferredAxis")).ifPresent(metadata::setPreferredAxis);
            Optional.ofNullable(c1.get("preferredChannel")).ifPresent(metadata::setPreferredChannel);
            Optional.ofNullable(c1.get("preferredNormalizationChannel"))
                .ifPresent(metadata::setPreferredNormalisationChannel);
        }

        if (!root.containsKey("StartTimeISO") && root.containsKey("StartDate") && root.containsKey("StartTime")) {
            String start = root.get("StartDate") + " " + root.get("StartTime");
            try {
                metadata.setStart(LocalDateTime.parse(start, START_FORMAT));
            } catch (DateTimeParseException e) {
                logger.warn("Cannot parse start '{}' in {}: {}", start, source.filename(), e.getMessage());
            }
            metadata.setEnd(LocalDateTime.of(1970, 1, 1, 0, 0));
        }
    }

    @Override
    protected void mapTimestampDataset() {
        if (!source.contains(TIMESTAMPS)) {
            logger.warn("No position timestamps in {}", source.filename());
            return;
        }
        DataMetadata metadata = new DataMetadata(VersionMapper.datasetName(TIMESTAMPS), "");
        metadata.setUnit(source.attributes(TIMESTAMPS).getOrDefault("Unit", ""));
        destination.setPositionTimestamps(DataSequence.deferred(DataKind.TIMESTAMP, metadata,
            List.of(importer(TIMESTAMPS, INDEX_AND_DATA))));
    }

    protected void mapLogMessages() {
        if (!source.contains(LOG_MESSAGES)) {
            return;
        }
        RawColumns comments = source.read(LOG_MESSAGES);
        if (comments.columnCount() == 0) {
            return;
        }
        Object column = comments.column(0);
        for (int i = 0; i < Array.getLength(column); i++) {
            Object entry = Array.get(column, i);
            String text = entry instanceof byte[] ? new String((byte[]) entry, destination.settings().fallbackCharset())
                : String.valueOf(entry);
            try {
                destination.addLogMessage(LogMessage.fromString(text.trim()));
            } catch (IllegalArgumentException e) {
                logger.warn("Skipping log message in {}: {}", source.filename(), e.getMessage());
            }
        }
    }

    /// Map the channels left in the main section once the axes are done.
    ///
    /// A channel is an interval channel when its dataset (or its normalized dataset) has
    /// `Detectortype=Interval`, an average channel when averaging settings exist for it, and
    /// a single point channel otherwise. Any of them may be normalized by another channel.
    @Override
    protected void mapChannelDatasets() {
        Map<String, String> normalizations = new LinkedHashMap<>();
        for (String entry : childrenIfPresent(NORMALIZED)) {
            int split = entry.indexOf(SEPARATOR);
            if (split < 0) {
                logger.warn("Skipping normalized dataset {} without a normalizing channel", entry);
                continue;
            }
            normalizations.putIfAbsent(entry.substring(0, split), entry);
        }

        for (String name : new ArrayList<>(datasetsToMapInMain)) {
            mapChannel(name, normalizations.remove(name));
        }
        normalizations.forEach((id, entry) -> {
            if (destination.data().containsKey(id)) {
                logger.warn("Skipping normalized dataset {}: {} is not a channel", entry, id);
            } else {
                mapChannel(id, entry);
            }
        });
    }

    private void mapChannel(String id, String normalizedEntry) {
        String mainPath = MAIN + "/" + id;
        String normalizedPath = normalizedEntry == null ? null : NORMALIZED + "/" + normalizedEntry;
        String dataPath = source.contains(mainPath) ? mainPath : normalizedPath;
        String prefix = normalizedEntry == null ? id : normalizedEntry;

        List<DataLoader> loaders = new ArrayList<>();
        loaders.add(importer(dataPath, INDEX_AND_DATA));
        DataMetadata metadata = basicMetadata(dataPath, id);

        ChannelType type = ChannelType.SINGLE_POINT;
        if (isInterval(dataPath) || (normalizedPath != null && isInterval(normalizedPath))) {
            type = mapInterval(prefix, id, loaders, metadata);
        } else {
            Optional<String> averageCount = firstExisting(AVERAGE_META, prefix, id, "AverageCount");
            if (averageCount.isPresent()) {
                type = mapAverage(averageCount.get(), prefix, id, loaders, metadata);
            }
        }

        if (normalizedPath != null) {
            String normalizeId = normalizedEntry.substring(normalizedEntry.indexOf(SEPARATOR) + SEPARATOR.length());
            metadata.setNormalizeId(normalizeId);
            loaders.add(importer(normalizedPath, 1, DataField.NORMALIZED_DATA));
            String normalizingPath = MAIN + "/" + normalizeId;
            if (source.contains(normalizingPath)) {
                loaders.add(new NormalizingDataLoader(source, dataPath, normalizingPath));
            } else {
                logger.warn("Normalizing channel {} of {} not found", normalizeId, id);
            }
        }

        destination.putData(id, DataSequence.deferred(DataKind.CHANNEL, type, metadata, loaders));
        datasetsToMapInMain.remove(id);
        logger.debug("Mapped {} channel {}{}", type, id, normalizedPath == null ? "" : " normalized by " + metadata.getNormalizeId());
    }

    private ChannelType mapInterval(String prefix, String id, List<DataLoader> loaders, DataMetadata metadata) {
        Optional<String> counts = firstExisting(STANDARD_DEVIATION, prefix, id, "Count");
        Optional<String> deviation = firstExisting(STANDARD_DEVIATION, prefix, id, "TrigIntv-StdDev");
        if (counts.isEmpty() || deviation.isEmpty()) {
            logger.warn("Interval channel {} lacks its statistics in {}, mapping it as single point", id, STANDARD_DEVIATION);
            return ChannelType.SINGLE_POINT;
        }
        loaders.add(importer(counts.get(), 1, DataField.COUNTS));
        loaders.add(importer(deviation.get(), 2, DataField.STD));
        metadata.setTriggerInterval(source.read(deviation.get()).firstNumber("TriggerIntv").doubleValue());
        return ChannelType.INTERVAL;
    }

    private ChannelType mapAverage(String averageCountPath, String prefix, String id,
                                   List<DataLoader> loaders, DataMetadata metadata) {
        metadata.setAverageCount(source.read(averageCountPath).firstNumber("AverageCount").intValue());
        Optional<String> attempts = firstExisting(AVERAGE_META, prefix, id, "Attempts");
        if (attempts.isPresent()) {
            loaders.add(importer(attempts.get(), 1, DataField.ATTEMPTS));
            metadata.setMaxAttempts(source.read(attempts.get()).firstNumber("MaxAttempts").intValue());
        }
        Optional<String> limits = firstExisting(AVERAGE_META, prefix, id, "Limit-MaxDev");
        if (limits.isPresent()) {
            RawColumns columns = source.read(limits.get());
            metadata.setLowLimit(columns.firstNumber("Limit").doubleValue());
            metadata.setMaxDeviation(columns.firstNumber("maxDeviation").doubleValue());
        }
        return ChannelType.AVERAGE;
    }

    private boolean isInterval(String path) {
        return "Interval".equals(source.attributes(path).get("Detectortype"));
    }

    private Optional<String> firstExisting(String group, String prefix, String id, String suffix) {
        String preferred = group + "/" + prefix + SEPARATOR + suffix;
        if (source.contains(preferred)) {
            return Optional.of(preferred);
        }
        String fallback = group + "/" + id + SEPARATOR + suffix;
        return source.contains(fallback) ? Optional.of(fallback) : Optional.empty();
    }
}

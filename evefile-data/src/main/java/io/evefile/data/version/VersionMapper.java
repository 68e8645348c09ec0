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

import io.evefile.data.MissingDependencyException;
import io.evefile.data.entities.ChannelType;
import io.evefile.data.entities.DataField;
import io.evefile.data.entities.DataImporter;
import io.evefile.data.entities.DataKind;
import io.evefile.data.entities.DataMetadata;
import io.evefile.data.entities.DataSequence;
import io.evefile.data.file.EveFile;
import io.evefile.data.h5.H5Source;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/// Maps the layout of an eveH5 file onto the contents of an {@link EveFile}.
///
/// Mapping classifies every dataset and attaches deferred loaders; it reads attributes
/// and a few small settings datasets, but no data. Subclasses handle the layout of one
/// major version each, building on the previous one.
///
/// Datasets still waiting to be mapped are tracked per section, so each step only sees
/// what the previous steps left over.
public abstract class VersionMapper {

    private static final Logger logger = LogManager.getLogger(VersionMapper.class);

    public static final String C1 = "/c1";
    public static final String MAIN = "/c1/main";
    public static final String SNAPSHOT = "/c1/snapshot";
    public static final String MONITOR = "/device";

    /// Column 0 is the index, column 1 the values.
    protected static final Map<Integer, DataField> INDEX_AND_DATA = indexAndData();

    protected H5Source source;
    protected EveFile destination;

    protected final List<String> datasetsToMapInMain = new ArrayList<>();
    protected final List<String> datasetsToMapInSnapshot = new ArrayList<>();
    protected final List<String> datasetsToMapInMonitor = new ArrayList<>();

    private static Map<Integer, DataField> indexAndData() {
        Map<Integer, DataField> mapping = new LinkedHashMap<>();
        mapping.put(0, DataField.INDEX);
        mapping.put(1, DataField.DATA);
        return mapping;
    }

    public H5Source getSource() {
        return source;
    }

    public void setSource(H5Source source) {
        this.source = source;
    }

    public EveFile getDestination() {
        return destination;
    }

    public void setDestination(EveFile destination) {
        this.destination = destination;
    }

    /// @return the major eveH5 version this mapper handles
    public abstract int version();

    /// Map a file onto an {@link EveFile}.
    /// @param source the file to map from, or null to use the one already set
    /// @param destination the file contents to fill, or null to use the one already set
    /// @throws MissingDependencyException if source or destination are missing
    public void map(H5Source source, EveFile destination) {
        H5Source effectiveSource = source != null ? source : this.source;
        EveFile effectiveDestination = destination != null ? destination : this.destination;
        checkPrerequisites(effectiveSource, effectiveDestination);
        this.source = effectiveSource;
        this.destination = effectiveDestination;
        setDatasetNames();
        mapAll();
        List<String> leftOver = new ArrayList<>(datasetsToMapInMain);
        leftOver.addAll(datasetsToMapInSnapshot);
        leftOver.addAll(datasetsToMapInMonitor);
        if (!leftOver.isEmpty()) {
            logger.warn("Did not map {} in {}", leftOver, this.source.filename());
        }
    }

    public List<String> getDatasetsToMapInMain() {
        return datasetsToMapInMain;
    }

    public List<String> getDatasetsToMapInSnapshot() {
        return datasetsToMapInSnapshot;
    }

    public List<String> getDatasetsToMapInMonitor() {
        return datasetsToMapInMonitor;
    }

    protected void checkPrerequisites(H5Source source, EveFile destination) {
        if (source == null) {
            throw new MissingDependencyException("Missing source to map from");
        }
        if (destination == null) {
            throw new MissingDependencyException("Missing destination to map to");
        }
    }

    protected void setDatasetNames() {
        datasetsToMapInMain.clear();
        datasetsToMapInSnapshot.clear();
        datasetsToMapInMonitor.clear();
    }

    protected void mapAll() {
        mapFileMetadata();
        mapTimestampDataset();
        mapMonitorDatasets();
        mapAxisDatasets();
        mapChannelDatasets();
        mapSnapshotDatasets();
    }

    protected void mapFileMetadata() {
    }

    protected void mapTimestampDataset() {
    }

    protected void mapChannelDatasets() {
    }

    protected void mapMonitorDatasets() {
        for (String name : datasetsToMapInMonitor) {
            String path = MONITOR + "/" + name;
            DataMetadata metadata = basicMetadata(path, name);
            destination.putMonitor(name, DataSequence.deferred(DataKind.MONITOR, metadata,
                List.of(importer(path, INDEX_AND_DATA))));
            logger.debug("Mapped monitor {}", path);
        }
        datasetsToMapInMonitor.clear();
    }

    protected void mapAxisDatasets() {
        List<String> mapped = new ArrayList<>();
        for (String name : datasetsToMapInMain) {
            String path = MAIN + "/" + name;
            if ("Axis".equals(source.attributes(path).get("DeviceType"))) {
                destination.putData(name, plainSequence(DataKind.AXIS, path, name));
                mapped.add(name);
                logger.debug("Mapped axis {}", path);
            }
        }
        datasetsToMapInMain.removeAll(mapped);
    }

    protected void mapSnapshotDatasets() {
        List<String> mapped = new ArrayList<>();
        for (String name : datasetsToMapInSnapshot) {
            String path = SNAPSHOT + "/" + name;
            String deviceType = source.attributes(path).get("DeviceType");
            if ("Axis".equals(deviceType)) {
                destination.putSnapshot(name, plainSequence(DataKind.AXIS, path, name));
                mapped.add(name);
            } else if ("Channel".equals(deviceType)) {
                destination.putSnapshot(name, plainSequence(DataKind.CHANNEL, path, name));
                mapped.add(name);
            }
        }
        datasetsToMapInSnapshot.removeAll(mapped);
    }

    private DataSequence plainSequence(DataKind kind, String path, String id) {
        ChannelType channelType = kind == DataKind.CHANNEL ? ChannelType.SINGLE_POINT : null;
        return DataSequence.deferred(kind, channelType, basicMetadata(path, id),
            List.of(importer(path, INDEX_AND_DATA)));
    }

    /// @param path a dataset path
    /// @param mapping column ordinals mapped to the fields they fill
    /// @return a loader for those columns
    protected DataImporter importer(String path, Map<Integer, DataField> mapping) {
        return new DataImporter(source, path, mapping);
    }

    protected DataImporter importer(String path, int column, DataField field) {
        return importer(path, Map.of(column, field));
    }

    /// Read id, name, access and unit of a dataset.
    /// @param path the dataset path
    /// @param id the id to assign
    /// @return the metadata
    protected DataMetadata basicMetadata(String path, String id) {
        DataMetadata metadata = new DataMetadata();
        setBasicMetadata(source.attributes(path), id, metadata);
        return metadata;
    }

    /// @param attributes the dataset attributes
    /// @param id the id to assign
    /// @param metadata the metadata to fill
    public static void setBasicMetadata(Map<String, String> attributes, String id, DataMetadata metadata) {
        metadata.setId(id);
        metadata.setName(attributes.getOrDefault("Name", ""));
        metadata.setAccess(attributes.get("Access"));
        if (attributes.containsKey("Unit")) {
            metadata.setUnit(attributes.get("Unit"));
        }
    }

    /// @param path a slash separated path
    /// @return the last element
    public static String datasetName(String path) {
        return path.substring(path.lastIndexOf('/') + 1);
    }

    protected List<String> childrenIfPresent(String groupPath) {
        if (!source.isGroup(groupPath)) {
            return new ArrayList<>();
        }
        return source.children(groupPath);
    }
}

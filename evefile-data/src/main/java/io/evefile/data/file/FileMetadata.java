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

import java.time.LocalDateTime;
import java.util.LinkedHashMap;
import java.util.Map;

/// File-level metadata of a measurement.
public class FileMetadata {

    private String filename = "";
    private String eveh5Version = "";
    private String eveVersion = "";
    private String xmlVersion = "";
    private String measurementStation = "";
    private LocalDateTime start;
    private LocalDateTime end;
    private String description = "";
    private boolean simulation;
    private String preferredAxis = "";
    private String preferredChannel = "";
    private String preferredNormalisationChannel = "";

    public String getFilename() {
        return filename;
    }

    public void setFilename(String filename) {
        this.filename = filename == null ? "" : filename;
    }

    public String getEveh5Version() {
        return eveh5Version;
    }

    public void setEveh5Version(String eveh5Version) {
        this.eveh5Version = eveh5Version;
    }

    public String getEveVersion() {
        return eveVersion;
    }

    public void setEveVersion(String eveVersion) {
        this.eveVersion = eveVersion;
    }

    public String getXmlVersion() {
        return xmlVersion;
    }

    public void setXmlVersion(String xmlVersion) {
        this.xmlVersion = xmlVersion;
    }

    public String getMeasurementStation() {
        return measurementStation;
    }

    public void setMeasurementStation(String measurementStation) {
        this.measurementStation = measurementStation;
    }

    /// @return the start of the measurement, null if not recorded
    public LocalDateTime getStart() {
        return start;
    }

    public void setStart(LocalDateTime start) {
        this.start = start;
    }

    /// @return the end of the measurement, null if not recorded
    public LocalDateTime getEnd() {
        return end;
    }

    public void setEnd(LocalDateTime end) {
        this.end = end;
    }

    public String getDescription() {
        return description;
    }

    public void setDescription(String description) {
        this.description = description;
    }

    public boolean isSimulation() {
        return simulation;
    }

    public void setSimulation(boolean simulation) {
        this.simulation = simulation;
    }

    public String getPreferredAxis() {
        return preferredAxis;
    }

    public void setPreferredAxis(String preferredAxis) {
        this.preferredAxis = preferredAxis;
    }

    public String getPreferredChannel() {
        return preferredChannel;
    }

    public void setPreferredChannel(String preferredChannel) {
        this.preferredChannel = preferredChannel;
    }

    public String getPreferredNormalisationChannel() {
        return preferredNormalisationChannel;
    }

    public void setPreferredNormalisationChannel(String preferredNormalisationChannel) {
        this.preferredNormalisationChannel = preferredNormalisationChannel;
    }

    /// @return attribute names mapped to values, in display order
    public Map<String, Object> toMap() {
        Map<String, Object> map = new LinkedHashMap<>();
        map.put("filename", filename);
        map.put("eveh5_version", eveh5Version);
        map.put("eve_version", eveVersion);
        map.put("xml_version", xmlVersion);
        map.put("measurement_station", measurementStation);
        map.put("start", start == null ? "" : start.toString());
        map.put("end", end == null ? "" : end.toString());
        map.put("description", description);
        map.put("simulation", simulation);
        map.put("preferred_axis", preferredAxis);
        map.put("preferred_channel", preferredChannel);
        map.put("preferred_normalisation_channel", preferredNormalisationChannel);
        return map;
    }

    /// @return one right-aligned `name: value` line per attribute
    @Override
    public String toString() {
        Map<String, Object> map = toMap();
        int width = map.keySet().stream().mapToInt(String::length).max().orElse(1);
        StringBuilder sb = new StringBuilder();
        map.forEach((name, value) -> sb.append(String.format("%" + width + "s: %s%n", name, value)));
        return sb.toString();
    }
}

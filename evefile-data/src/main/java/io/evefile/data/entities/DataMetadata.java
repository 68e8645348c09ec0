package io.evefile.data.entities;

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

import java.util.LinkedHashMap;
import java.util.Map;

/// Descriptive attributes of a data sequence.
///
/// Which attributes are meaningful depends on the kind of sequence and, for channels, on the
/// channel type; {@link #attributes(DataKind, ChannelType)} lists only those. Numeric
/// attributes default to zero and strings to the empty string.
public class DataMetadata {

    private String name = "";
    private String id = "";
    private String pv = "";
    private String accessMode = "";
    private String unit = "";
    private double deadband;
    private Map<String, String> options = new LinkedHashMap<>();

    private int averageCount;
    private double lowLimit;
    private int maxAttempts;
    private double maxDeviation;
    private double triggerInterval;
    private String normalizeId = "";

    public DataMetadata() {
    }

    public DataMetadata(String id, String name) {
        this.id = id;
        this.name = name;
    }

    public String getName() {
        return name;
    }

    public void setName(String name) {
        this.name = name == null ? "" : name;
    }

    public String getId() {
        return id;
    }

    public void setId(String id) {
        this.id = id == null ? "" : id;
    }

    public String getPv() {
        return pv;
    }

    public void setPv(String pv) {
        this.pv = pv == null ? "" : pv;
    }

    public String getAccessMode() {
        return accessMode;
    }

    public void setAccessMode(String accessMode) {
        this.accessMode = accessMode == null ? "" : accessMode;
    }

    /// Set process variable and access mode from an access string such as `ca:SIM:MOT01`.
    ///
    /// The part before the first colon is the access mode and the rest is the process
    /// variable. A string without a colon is taken as the process variable alone.
    /// @param access the access string as stored in the file
    public void setAccess(String access) {
        if (access == null) {
            return;
        }
        int colon = access.indexOf(':');
        if (colon < 0) {
            setPv(access);
        } else {
            setAccessMode(access.substring(0, colon));
            setPv(access.substring(colon + 1));
        }
    }

    public String getUnit() {
        return unit;
    }

    public void setUnit(String unit) {
        this.unit = unit == null ? "" : unit;
    }

    public double getDeadband() {
        return deadband;
    }

    public void setDeadband(double deadband) {
        this.deadband = deadband;
    }

    public Map<String, String> getOptions() {
        return options;
    }

    public void setOptions(Map<String, String> options) {
        this.options = new LinkedHashMap<>(options);
    }

    public int getAverageCount() {
        return averageCount;
    }

    public void setAverageCount(int averageCount) {
        this.averageCount = averageCount;
    }

    public double getLowLimit() {
        return lowLimit;
    }

    public void setLowLimit(double lowLimit) {
        this.lowLimit = lowLimit;
    }

    public int getMaxAttempts() {
        return maxAttempts;
    }

    public void setMaxAttempts(int maxAttempts) {
        this.maxAttempts = maxAttempts;
    }

    public double getMaxDeviation() {
        return maxDeviation;
    }

    public void setMaxDeviation(double maxDeviation) {
        this.maxDeviation = maxDeviation;
    }

    public double getTriggerInterval() {
        return triggerInterval;
    }

    public void setTriggerInterval(double triggerInterval) {
        this.triggerInterval = triggerInterval;
    }

    public String getNormalizeId() {
        return normalizeId;
    }

    public void setNormalizeId(String normalizeId) {
        this.normalizeId = normalizeId == null ? "" : normalizeId;
    }

    public boolean isNormalized() {
        return !normalizeId.isEmpty();
    }

    /// @return a detached copy; the options map is copied as well
    public DataMetadata copy() {
        DataMetadata copy = new DataMetadata(id, name);
        copy.pv = pv;
        copy.accessMode = accessMode;
        copy.unit = unit;
        copy.deadband = deadband;
        copy.options = new LinkedHashMap<>(options);
        copy.averageCount = averageCount;
        copy.lowLimit = lowLimit;
        copy.maxAttempts = maxAttempts;
        copy.maxDeviation = maxDeviation;
        copy.triggerInterval = triggerInterval;
        copy.normalizeId = normalizeId;
        return copy;
    }

    /// List the attributes relevant for a sequence, in display order.
    /// @param kind the kind of sequence these attributes describe
    /// @param channelType the channel type, or null for anything but channels
    /// @return attribute names mapped to their values
    public Map<String, Object> attributes(DataKind kind, ChannelType channelType) {
        Map<String, Object> attributes = new LinkedHashMap<>();
        attributes.put("name", name);
        attributes.put("id", id);
        if (kind != DataKind.TIMESTAMP) {
            attributes.put("pv", pv);
            attributes.put("access_mode", accessMode);
        }
        attributes.put("unit", unit);
        if (kind == DataKind.AXIS || kind == DataKind.CHANNEL) {
            attributes.put("deadband", deadband);
        }
        if (kind == DataKind.CHANNEL && channelType != null) {
            switch (channelType) {
                case AVERAGE:
                    attributes.put("n_averages", averageCount);
                    attributes.put("low_limit", lowLimit);
                    attributes.put("max_attempts", maxAttempts);
                    attributes.put("max_deviation", maxDeviation);
                    break;
                case INTERVAL:
                    attributes.put("trigger_interval", triggerInterval);
                    break;
                default:
                    break;
            }
            if (isNormalized()) {
                attributes.put("normalize_id", normalizeId);
            }
        }
        if (!options.isEmpty()) {
            attributes.put("options", options);
        }
        return attributes;
    }

    @Override
    public String toString() {
        return name.isEmpty() ? id : name + " (" + id + ")";
    }
}

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

/// The kinds of data sequence found in a measurement file, and what each kind can do.
///
/// | Kind | Carries forward | Snapshots | Duplicates | Index |
/// |------|-----------------|-----------|------------|-------|
/// | {@link #AXIS} | yes | yes | last wins | position |
/// | {@link #CHANNEL} | no | no | first wins | position |
/// | {@link #DEVICE} | yes | no | all kept | position |
/// | {@link #MONITOR} | no | no | not cleaned | milliseconds |
/// | {@link #TIMESTAMP} | no | no | all kept | position |
///
/// Axes hold their value until set again, so a missing position takes the last known value.
/// Channels are read exactly once per position, so a missing position stays missing.
public enum DataKind {

    /// A motor or other actuator set during a scan.
    AXIS(true, true, DuplicateRule.KEEP_LAST, true, "position"),

    /// A detector read during a scan.
    CHANNEL(false, false, DuplicateRule.KEEP_FIRST, true, "position"),

    /// Monitor values already mapped onto positions.
    DEVICE(true, false, DuplicateRule.KEEP_ALL, true, "position"),

    /// A device observed whenever its value changed, indexed by milliseconds since scan start.
    MONITOR(false, false, DuplicateRule.KEEP_ALL, false, "milliseconds"),

    /// The table which relates positions to milliseconds since scan start.
    TIMESTAMP(false, false, DuplicateRule.KEEP_ALL, true, "position");

    private final boolean carriesForward;
    private final boolean acceptsSnapshots;
    private final DuplicateRule duplicateRule;
    private final boolean sortedOnLoad;
    private final String indexName;

    DataKind(boolean carriesForward, boolean acceptsSnapshots, DuplicateRule duplicateRule,
             boolean sortedOnLoad, String indexName) {
        this.carriesForward = carriesForward;
        this.acceptsSnapshots = acceptsSnapshots;
        this.duplicateRule = duplicateRule;
        this.sortedOnLoad = sortedOnLoad;
        this.indexName = indexName;
    }

    /// @return true if a missing position takes the last known value when aligned
    public boolean carriesForward() {
        return carriesForward;
    }

    /// @return true if snapshot values are merged in when aligned
    public boolean acceptsSnapshots() {
        return acceptsSnapshots;
    }

    public DuplicateRule duplicateRule() {
        return duplicateRule;
    }

    /// @return true if loaded rows are sorted by index and duplicates resolved
    public boolean sortedOnLoad() {
        return sortedOnLoad;
    }

    /// @return "position" or "milliseconds"
    public String indexName() {
        return indexName;
    }

    /// @return true for kinds indexed by position that take part in a join
    public boolean isAlignable() {
        return this == AXIS || this == CHANNEL || this == DEVICE;
    }
}

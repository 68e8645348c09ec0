package io.evefile.data.join;

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
import io.evefile.data.entities.DataField;
import io.evefile.data.entities.DataSequence;
import io.evefile.data.entities.MaskedArray;
import io.evefile.data.file.EveFile;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/// Aligns data sequences recorded at different positions onto one common set of positions.
///
/// A subclass decides which positions are common, from the positions of the axes and the
/// positions of the channels involved. Every sequence is then brought onto those positions:
///
/// - Kinds which carry forward (axes, mapped monitors) take, at each common position, the
///   last value recorded at or before it. Before the first recorded value the slot is
///   masked. An axis with a snapshot first has the snapshot values spliced in at the
///   snapshot positions, so they can supply earlier values.
/// - Channels take the value recorded at exactly that position, masked otherwise.
///
/// All fields of a sequence are aligned together. Inputs are never modified, and the
/// results come back in the order the inputs were given.
///
/// ## Usage
///
/// ```java
/// Join join = new JoinFactory(evefile).getJoin(JoinMode.AXIS_POSITIONS);
/// List<DataSequence> aligned = join.join(List.of("SimMot:01", "SimChan:01"));
/// ```
public abstract class Join {

    private static final Logger logger = LogManager.getLogger(Join.class);

    private EveFile evefile;

    protected Join() {
    }

    protected Join(EveFile evefile) {
        this.evefile = evefile;
    }

    public EveFile getEvefile() {
        return evefile;
    }

    public void setEvefile(EveFile evefile) {
        this.evefile = evefile;
    }

    /// @return the mode this join implements
    public abstract JoinMode mode();

    /// Choose the positions of the joined result.
    /// @param axisPositions the positions of each sequence which carries forward
    /// @param channelPositions the positions of each sequence which does not
    /// @return sorted positions without repeats
    protected abstract long[] commonPositions(List<long[]> axisPositions, List<long[]> channelPositions);

    /// Join sequences of the associated file, given by id or name.
    ///
    /// Snapshots recorded for the named sequences are taken into account.
    /// @param keys ids or names of the sequences to join
    /// @return the aligned sequences, in the order of `keys`
    /// @throws MissingDependencyException if no file is associated
    /// @throws IllegalArgumentException if no keys are given or a key does not resolve
    public List<DataSequence> join(List<String> keys) {
        if (evefile == null) {
            throw new MissingDependencyException("Need an evefile to join data");
        }
        if (keys == null || keys.isEmpty()) {
            throw new IllegalArgumentException("Need data to join");
        }
        List<DataSequence> data = new ArrayList<>(keys.size());
        Map<String, DataSequence> snapshots = new LinkedHashMap<>();
        for (String key : keys) {
            DataSequence sequence = evefile.getData(key);
            data.add(sequence);
            String id = sequence.metadata().getId();
            evefile.findSnapshot(id).ifPresent(snapshot -> snapshots.put(id, snapshot));
        }
        return join(data, snapshots);
    }

    /// Join the given sequences.
    /// @param data sequences of an alignable kind
    /// @param snapshots snapshot sequences keyed by the id of the sequence they belong to;
    ///     entries for sequences not being joined are ignored
    /// @return the aligned sequences, in the order of `data`
    /// @throws IllegalArgumentException if no data is given or a sequence is not alignable
    public List<DataSequence> join(List<DataSequence> data, Map<String, DataSequence> snapshots) {
        if (data == null || data.isEmpty()) {
            throw new IllegalArgumentException("Need data to join");
        }
        List<long[]> axisPositions = new ArrayList<>();
        List<long[]> channelPositions = new ArrayList<>();
        for (DataSequence sequence : data) {
            if (sequence == null) {
                throw new IllegalArgumentException("Cannot join a missing sequence");
            }
            if (!sequence.kind().isAlignable()) {
                throw new IllegalArgumentException("Cannot join " + sequence + ": "
                    + sequence.kind() + " data is not indexed by position");
            }
            if (sequence.kind().carriesForward()) {
                axisPositions.add(sequence.index());
            } else {
                channelPositions.add(sequence.index());
            }
        }
        long[] positions = commonPositions(axisPositions, channelPositions);
        logger.debug("{} joins {} sequence(s) onto {} position(s)", mode(), data.size(), positions.length);

        Map<String, DataSequence> snapshotsById = snapshots == null ? Map.of() : snapshots;
        List<DataSequence> joined = new ArrayList<>(data.size());
        for (DataSequence sequence : data) {
            if (sequence.kind().carriesForward()) {
                DataSequence snapshot = sequence.kind().acceptsSnapshots()
                    ? snapshotsById.get(sequence.metadata().getId()) : null;
                joined.add(carryForward(sequence, snapshot, positions));
            } else {
                joined.add(exactMatch(sequence, positions));
            }
        }
        return joined;
    }

    /// Align a sequence by taking the last value at or before each position.
    static DataSequence carryForward(DataSequence sequence, DataSequence snapshot, long[] positions) {
        long[] index = sequence.index();
        Map<DataField, MaskedArray> fields = new EnumMap<>(DataField.class);
        for (DataField field : sequence.fieldNames()) {
            fields.put(field, sequence.field(field));
        }
        if (snapshot != null && snapshot.size() > 0) {
            long[] snapshotIndex = snapshot.index();
            int[] before = new int[snapshotIndex.length];
            for (int k = 0; k < snapshotIndex.length; k++) {
                before[k] = Positions.lowerBound(index, snapshotIndex[k]);
            }
            Map<DataField, MaskedArray> spliced = new EnumMap<>(DataField.class);
            for (Map.Entry<DataField, MaskedArray> entry : fields.entrySet()) {
                MaskedArray inserted = snapshot.hasField(entry.getKey())
                    ? snapshot.field(entry.getKey())
                    : MaskedArray.allMasked(entry.getValue().componentType(), snapshotIndex.length);
                spliced.put(entry.getKey(), entry.getValue().insert(before, inserted));
            }
            fields = spliced;
            index = merge(index, snapshotIndex);
        }
        int[] rows = new int[positions.length];
        for (int i = 0; i < positions.length; i++) {
            rows[i] = Positions.upperBound(index, positions[i]) - 1;
        }
        return aligned(sequence, positions, fields, rows);
    }

    /// Align a sequence by taking the value recorded at exactly each position.
    static DataSequence exactMatch(DataSequence sequence, long[] positions) {
        long[] index = sequence.index();
        Map<DataField, MaskedArray> fields = new EnumMap<>(DataField.class);
        for (DataField field : sequence.fieldNames()) {
            fields.put(field, sequence.field(field));
        }
        int[] rows = new int[positions.length];
        for (int i = 0; i < positions.length; i++) {
            int found = Arrays.binarySearch(index, positions[i]);
            rows[i] = found >= 0 ? found : -1;
        }
        return aligned(sequence, positions, fields, rows);
    }

    private static long[] merge(long[] index, long[] inserted) {
        long[] merged = Arrays.copyOf(index, index.length + inserted.length);
        System.arraycopy(inserted, 0, merged, index.length, inserted.length);
        Arrays.sort(merged);
        return merged;
    }

    private static DataSequence aligned(DataSequence source, long[] positions,
                                        Map<DataField, MaskedArray> fields, int[] rows) {
        Map<DataField, MaskedArray> selected = new EnumMap<>(DataField.class);
        fields.forEach((field, column) -> selected.put(field, column.select(rows)));
        return DataSequence.of(source.kind(), source.channelType().orElse(null), source.metadata().copy(),
            positions, selected);
    }
}

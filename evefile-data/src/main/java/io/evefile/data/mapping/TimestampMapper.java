package io.evefile.data.mapping;

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
import io.evefile.data.entities.DataKind;
import io.evefile.data.entities.DataMetadata;
import io.evefile.data.entities.DataSequence;
import io.evefile.data.entities.DuplicateRule;
import io.evefile.data.entities.MaskedArray;
import io.evefile.data.file.EveFile;
import io.evefile.data.join.Positions;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.Arrays;
import java.util.EnumMap;
import java.util.Map;

/// Maps monitor data, recorded in milliseconds since the start of a scan, onto positions.
///
/// Monitors record a value whenever the observed device changes, independent of the
/// scan positions. The position timestamp table tells when each position started. A
/// monitor value recorded at time `t` is assigned to the last position whose start time is
/// at or before `t`. Values recorded before the first position, including those written
/// with a negative time at scan start, go to the first position.
///
/// When several monitor values end up on one position the latest wins, so the result
/// behaves like an axis: it holds its value until the next change.
public class TimestampMapper {

    private static final Logger logger = LogManager.getLogger(TimestampMapper.class);

    private EveFile evefile;

    public TimestampMapper() {
    }

    public TimestampMapper(EveFile evefile) {
        this.evefile = evefile;
    }

    public EveFile getEvefile() {
        return evefile;
    }

    public void setEvefile(EveFile evefile) {
        this.evefile = evefile;
    }

    /// Map a monitor of the associated file.
    /// @param monitorKey the id or name of the monitor
    /// @return a new {@link DataKind#DEVICE} sequence indexed by position
    /// @throws IllegalArgumentException if the key is blank or names no monitor
    /// @throws MissingDependencyException if there is no file or no position timestamps
    public DataSequence map(String monitorKey) {
        if (monitorKey == null || monitorKey.isBlank()) {
            throw new IllegalArgumentException("Need monitor to map timestamps to positions");
        }
        if (evefile == null) {
            throw new MissingDependencyException("Need an evefile to map timestamps to positions");
        }
        DataSequence monitor = evefile.getMonitor(monitorKey);
        DataSequence timestamps = evefile.positionTimestamps()
            .orElseThrow(() -> new MissingDependencyException(
                "No position timestamps in " + evefile.metadata().getFilename()));
        return map(monitor, timestamps);
    }

    /// Map a monitor onto positions.
    /// @param monitor a {@link DataKind#MONITOR} sequence
    /// @param timestamps the position timestamp table
    /// @return a new {@link DataKind#DEVICE} sequence indexed by position
    public DataSequence map(DataSequence monitor, DataSequence timestamps) {
        if (monitor == null) {
            throw new IllegalArgumentException("Need monitor to map timestamps to positions");
        }
        if (timestamps == null) {
            throw new MissingDependencyException("Need position timestamps to map " + monitor);
        }
        if (monitor.kind() != DataKind.MONITOR) {
            throw new IllegalArgumentException("Cannot map " + monitor + ": not a monitor");
        }

        long[] milliseconds = monitor.index();
        Integer[] boxed = new Integer[milliseconds.length];
        for (int i = 0; i < boxed.length; i++) {
            boxed[i] = i;
        }
        Arrays.sort(boxed, (a, b) -> Long.compare(milliseconds[a], milliseconds[b]));
        long[] sortedMillis = new long[boxed.length];
        for (int i = 0; i < boxed.length; i++) {
            sortedMillis[i] = milliseconds[boxed[i]];
        }

        int[] distinctTimes = DuplicateRule.KEEP_LAST.retain(sortedMillis);
        long[] retainedMillis = new long[distinctTimes.length];
        for (int i = 0; i < distinctTimes.length; i++) {
            retainedMillis[i] = sortedMillis[distinctTimes[i]];
        }
        long[] positions = positionsFor(timestamps, retainedMillis);

        int[] distinctPositions = DuplicateRule.KEEP_LAST.retain(positions);
        int[] rows = new int[distinctPositions.length];
        long[] index = new long[distinctPositions.length];
        for (int i = 0; i < distinctPositions.length; i++) {
            int retained = distinctPositions[i];
            rows[i] = boxed[distinctTimes[retained]];
            index[i] = positions[retained];
        }
        logger.debug("Mapped {} monitor value(s) of {} onto {} position(s)",
            milliseconds.length, monitor.metadata(), index.length);

        Map<DataField, MaskedArray> fields = new EnumMap<>(DataField.class);
        for (DataField field : monitor.fieldNames()) {
            fields.put(field, monitor.field(field).select(rows));
        }
        DataMetadata metadata = monitor.metadata().copy();
        metadata.setUnit("");
        return DataSequence.of(DataKind.DEVICE, null, metadata, index, fields);
    }

    /// Look up the position a time falls into.
    /// @param timestamps the position timestamp table
    /// @param milliseconds time since scan start
    /// @return the position
    public static long positionFor(DataSequence timestamps, long milliseconds) {
        return positionsFor(timestamps, new long[]{milliseconds})[0];
    }

    /// Look up the positions a series of times fall into.
    /// @param timestamps the position timestamp table, with times increasing by position
    /// @param milliseconds times since scan start
    /// @return one position per time
    /// @throws MissingDependencyException if the table is empty
    public static long[] positionsFor(DataSequence timestamps, long[] milliseconds) {
        long[] positions = timestamps.index();
        if (positions.length == 0) {
            throw new MissingDependencyException("No position timestamps recorded");
        }
        long[] times = timestamps.values().toLongArray();
        long[] result = new long[milliseconds.length];
        for (int i = 0; i < milliseconds.length; i++) {
            int k = milliseconds[i] < 0 ? 0 : Positions.upperBound(times, milliseconds[i]) - 1;
            result[i] = positions[Math.max(k, 0)];
        }
        return result;
    }
}

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

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.jetbrains.annotations.NotNull;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/// A named series of values indexed by position (or milliseconds, for monitors), with its
/// metadata and any auxiliary columns.
///
/// ## Loading
///
/// Sequences built from a file are created empty, with one or more {@link DataLoader}s
/// describing where their columns live. The first access to the index or to any field reads
/// all loaders, checks that every column has the same length, and then cleans the result
/// according to the {@link DataKind}: rows are stable-sorted by index and duplicate index
/// values resolved by the kind's {@link DuplicateRule}. Every field is reordered together
/// with the index.
///
/// Loading happens at most once even under concurrent access. If reading fails the
/// sequence stays unloaded and the next access tries again.
///
/// Sequences built from in-memory arrays with {@link #of} are loaded at construction and
/// are not cleaned.
public class DataSequence {

    private static final Logger logger = LogManager.getLogger(DataSequence.class);

    private final DataKind kind;
    private final ChannelType channelType;
    private final DataMetadata metadata;
    private final List<DataLoader> loaders;

    private final Object loadLock = new Object();
    private volatile boolean loaded;
    private long[] index;
    private Map<DataField, MaskedArray> fields;

    private DataSequence(DataKind kind, ChannelType channelType, DataMetadata metadata, List<DataLoader> loaders) {
        if (kind == null) {
            throw new IllegalArgumentException("Need a kind of data");
        }
        if (channelType != null && kind != DataKind.CHANNEL) {
            throw new IllegalArgumentException("Only channels have a channel type, not " + kind);
        }
        this.kind = kind;
        this.channelType = kind == DataKind.CHANNEL && channelType == null ? ChannelType.SINGLE_POINT : channelType;
        this.metadata = metadata == null ? new DataMetadata() : metadata;
        this.loaders = Collections.unmodifiableList(new ArrayList<>(loaders));
    }

    /// Create a sequence whose columns are read on first access.
    /// @param kind the kind of data
    /// @param metadata descriptive attributes
    /// @param loaders where the columns live; together they must provide {@link DataField#INDEX}
    /// @return an unloaded sequence
    public static DataSequence deferred(DataKind kind, DataMetadata metadata, List<DataLoader> loaders) {
        return deferred(kind, null, metadata, loaders);
    }

    public static DataSequence deferred(DataKind kind, ChannelType channelType, DataMetadata metadata,
                                        List<DataLoader> loaders) {
        if (loaders == null || loaders.isEmpty()) {
            throw new IllegalArgumentException("Need at least one loader for " + metadata);
        }
        return new DataSequence(kind, channelType, metadata, new ArrayList<>(loaders));
    }

    /// Create a loaded sequence from an index and its values.
    /// @param kind the kind of data
    /// @param metadata descriptive attributes
    /// @param index the index values, sorted and deduplicated as on load
    /// @param values the {@link DataField#DATA} column
    /// @return a loaded sequence
    public static DataSequence of(DataKind kind, DataMetadata metadata, long[] index, MaskedArray values) {
        Map<DataField, MaskedArray> fields = new EnumMap<>(DataField.class);
        fields.put(DataField.DATA, values);
        return of(kind, null, metadata, index, fields);
    }

    /// Create a loaded sequence from an index and any number of columns.
    /// @param kind the kind of data
    /// @param channelType the channel type, or null for anything but channels
    /// @param metadata descriptive attributes
    /// @param index the index values, sorted and deduplicated as on load
    /// @param fields the columns, each as long as the index
    /// @return a loaded sequence
    public static DataSequence of(DataKind kind, ChannelType channelType, DataMetadata metadata,
                                  long[] index, Map<DataField, MaskedArray> fields) {
        DataSequence sequence = new DataSequence(kind, channelType, metadata, List.of());
        Map<DataField, MaskedArray> copy = new EnumMap<>(DataField.class);
        copy.putAll(fields);
        copy.remove(DataField.INDEX);
        checkLengths(sequence.metadata, index.length, copy);
        sequence.clean(index.clone(), copy);
        sequence.loaded = true;
        return sequence;
    }

    /// Read and clean the columns unless that already happened.
    /// @throws IllegalStateException if the loaded columns differ in length or lack an index
    public void ensureLoaded() {
        if (loaded) {
            return;
        }
        synchronized (loadLock) {
            if (loaded) {
                return;
            }
            materialize();
            loaded = true;
        }
    }

    private void materialize() {
        logger.debug("Loading {} {} from {} loader(s)", kind, metadata, loaders.size());
        Map<DataField, Object> raw = new EnumMap<>(DataField.class);
        for (DataLoader loader : loaders) {
            raw.putAll(loader.load());
        }
        Object indexColumn = raw.remove(DataField.INDEX);
        if (indexColumn == null) {
            throw new IllegalStateException("No index column loaded for " + metadata);
        }
        long[] rawIndex = MaskedArray.of(indexColumn).toLongArray();
        Map<DataField, MaskedArray> rawFields = new EnumMap<>(DataField.class);
        raw.forEach((field, column) -> rawFields.put(field, MaskedArray.of(column)));
        checkLengths(metadata, rawIndex.length, rawFields);
        clean(rawIndex, rawFields);
    }

    private void clean(long[] rawIndex, Map<DataField, MaskedArray> rawFields) {
        if (!kind.sortedOnLoad()) {
            index = rawIndex;
            fields = rawFields;
            return;
        }

        int[] order = stableOrder(rawIndex);
        long[] sorted = new long[order.length];
        for (int i = 0; i < order.length; i++) {
            sorted[i] = rawIndex[order[i]];
        }
        int[] retained = kind.duplicateRule().retain(sorted);
        int[] rows = new int[retained.length];
        long[] cleanIndex = new long[retained.length];
        for (int i = 0; i < retained.length; i++) {
            rows[i] = order[retained[i]];
            cleanIndex[i] = sorted[retained[i]];
        }
        if (rows.length != rawIndex.length) {
            logger.debug("Dropped {} duplicate row(s) from {}", rawIndex.length - rows.length, metadata);
        }
        Map<DataField, MaskedArray> cleanFields = new EnumMap<>(DataField.class);
        rawFields.forEach((field, column) -> cleanFields.put(field, column.select(rows)));
        index = cleanIndex;
        fields = cleanFields;
    }

    private static int[] stableOrder(long[] values) {
        Integer[] boxed = new Integer[values.length];
        for (int i = 0; i < boxed.length; i++) {
            boxed[i] = i;
        }
        Arrays.sort(boxed, (a, b) -> Long.compare(values[a], values[b]));
        int[] order = new int[boxed.length];
        for (int i = 0; i < order.length; i++) {
            order[i] = boxed[i];
        }
        return order;
    }

    private static void checkLengths(DataMetadata metadata, int length, Map<DataField, MaskedArray> fields) {
        fields.forEach((field, column) -> {
            if (column.length() != length) {
                throw new IllegalStateException("Column " + field.label() + " of " + metadata + " has "
                    + column.length() + " rows, but the index has " + length);
            }
        });
    }

    public boolean isLoaded() {
        return loaded;
    }

    public DataKind kind() {
        return kind;
    }

    /// @return the channel type, empty for anything but channels
    public Optional<ChannelType> channelType() {
        return Optional.ofNullable(channelType);
    }

    public DataMetadata metadata() {
        return metadata;
    }

    public List<DataLoader> loaders() {
        return loaders;
    }

    /// @return a copy of the index, loading if necessary
    @NotNull
    public long[] index() {
        ensureLoaded();
        return index.clone();
    }

    public int size() {
        ensureLoaded();
        return index.length;
    }

    /// @return the {@link DataField#DATA} column, loading if necessary
    @NotNull
    public MaskedArray values() {
        return field(DataField.DATA);
    }

    /// @param field a field this sequence carries
    /// @return the column, loading if necessary
    /// @throws IllegalArgumentException if this sequence does not carry the field
    public MaskedArray field(DataField field) {
        ensureLoaded();
        MaskedArray column = fields.get(field);
        if (column == null) {
            throw new IllegalArgumentException(metadata + " has no field " + field.label());
        }
        return column;
    }

    public boolean hasField(DataField field) {
        ensureLoaded();
        return fields.containsKey(field);
    }

    /// @return the carried fields besides the index, in field order, loading if necessary
    public Set<DataField> fieldNames() {
        ensureLoaded();
        return Collections.unmodifiableSet(fields.keySet());
    }

    private List<String> fieldLabels() {
        List<String> labels = new ArrayList<>();
        labels.add(kind.indexName());
        fields.keySet().forEach(field -> labels.add(field.label()));
        return labels;
    }

    /// Copy this sequence. Columns are immutable and shared; metadata is copied. An unloaded
    /// sequence yields an unloaded copy with the same loaders.
    /// @return an independent sequence
    public DataSequence copy() {
        if (!loaded) {
            return new DataSequence(kind, channelType, metadata.copy(), loaders);
        }
        return of(kind, channelType, metadata.copy(), index, fields);
    }

    /// @return a multi-line listing of the kind, the metadata attributes and the fields
    public String describe() {
        StringBuilder sb = new StringBuilder();
        sb.append(kind);
        if (channelType != null) {
            sb.append(" (").append(channelType).append(')');
        }
        sb.append('\n');
        Map<String, Object> attributes = metadata.attributes(kind, channelType);
        int width = Math.max(4, attributes.keySet().stream().mapToInt(String::length).max().orElse(0));
        attributes.forEach((name, value) ->
            sb.append(String.format("%" + width + "s: %s%n", name, value)));
        if (loaded) {
            sb.append(String.format("%" + width + "s: %d%n", "rows", index.length));
            sb.append(String.format("%" + width + "s: %s%n", "fields", fieldLabels()));
        } else if (channelType != null) {
            sb.append(String.format("%" + width + "s: %s%n", "fields", channelType.fields(metadata.isNormalized())));
        }
        return sb.toString();
    }

    @Override
    public String toString() {
        return metadata + " <" + kind + ">";
    }
}

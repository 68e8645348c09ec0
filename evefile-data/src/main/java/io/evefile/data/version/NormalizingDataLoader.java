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

import io.evefile.data.entities.DataField;
import io.evefile.data.entities.DataLoader;
import io.evefile.data.entities.MaskedArray;
import io.evefile.data.h5.H5Source;
import io.evefile.data.h5.RawColumns;

import java.util.HashMap;
import java.util.Map;

/// Loads the values of a normalizing channel row by row alongside a normalized channel.
///
/// The normalizing channel lives in its own dataset and need not have a row for every
/// position of the channel it normalizes. Its values are matched by position onto the rows
/// of the channel dataset, with NaN where it has no value.
class NormalizingDataLoader implements DataLoader {

    private final H5Source source;
    private final String channelPath;
    private final String normalizingPath;

    NormalizingDataLoader(H5Source source, String channelPath, String normalizingPath) {
        this.source = source;
        this.channelPath = channelPath;
        this.normalizingPath = normalizingPath;
    }

    @Override
    public Map<DataField, Object> load() {
        long[] positions = MaskedArray.of(source.read(channelPath).column(0)).toLongArray();
        RawColumns normalizing = source.read(normalizingPath);
        long[] normalizingPositions = MaskedArray.of(normalizing.column(0)).toLongArray();
        MaskedArray normalizingValues = MaskedArray.of(normalizing.column(1));

        Map<Long, Integer> rowByPosition = new HashMap<>();
        for (int row = normalizingPositions.length - 1; row >= 0; row--) {
            rowByPosition.put(normalizingPositions[row], row);
        }
        double[] values = new double[positions.length];
        for (int i = 0; i < positions.length; i++) {
            Integer row = rowByPosition.get(positions[i]);
            values[i] = row == null ? Double.NaN : normalizingValues.getDouble(row);
        }
        return Map.of(DataField.NORMALIZING_DATA, values);
    }

    @Override
    public String toString() {
        return normalizingPath + " aligned to " + channelPath;
    }
}

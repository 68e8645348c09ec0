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

import java.util.Arrays;

/// How to resolve repeated index values once a sequence is sorted by its index.
///
/// A rule sees the sorted index and answers which rows survive. Rows are returned in
/// increasing order, so the surviving index stays sorted.
public enum DuplicateRule {

    /// Keep the first row of each run of equal index values.
    KEEP_FIRST {
        @Override
        public int[] retain(long[] sortedIndex) {
            int[] rows = new int[sortedIndex.length];
            int count = 0;
            for (int i = 0; i < sortedIndex.length; i++) {
                if (i == 0 || sortedIndex[i] != sortedIndex[i - 1]) {
                    rows[count++] = i;
                }
            }
            return Arrays.copyOf(rows, count);
        }
    },

    /// Keep the last row of each run of equal index values.
    KEEP_LAST {
        @Override
        public int[] retain(long[] sortedIndex) {
            int[] rows = new int[sortedIndex.length];
            int count = 0;
            for (int i = 0; i < sortedIndex.length; i++) {
                if (i == sortedIndex.length - 1 || sortedIndex[i] != sortedIndex[i + 1]) {
                    rows[count++] = i;
                }
            }
            return Arrays.copyOf(rows, count);
        }
    },

    /// Keep every row.
    KEEP_ALL {
        @Override
        public int[] retain(long[] sortedIndex) {
            int[] rows = new int[sortedIndex.length];
            for (int i = 0; i < rows.length; i++) {
                rows[i] = i;
            }
            return rows;
        }
    };

    /// @param sortedIndex the index values in non-decreasing order
    /// @return the rows to keep, in increasing order
    public abstract int[] retain(long[] sortedIndex);
}

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

import java.util.Arrays;
import java.util.List;
import java.util.stream.LongStream;

/// Set operations on sorted position arrays.
public final class Positions {

    private Positions() {
    }

    /// @param positions any number of position arrays
    /// @return every position occurring in any array, sorted, without repeats
    public static long[] union(List<long[]> positions) {
        return positions.stream().flatMapToLong(LongStream::of).distinct().sorted().toArray();
    }

    /// @param a sorted positions without repeats
    /// @param b sorted positions without repeats
    /// @return the positions occurring in both, sorted
    public static long[] intersection(long[] a, long[] b) {
        long[] common = new long[Math.min(a.length, b.length)];
        int count = 0;
        int i = 0;
        int j = 0;
        while (i < a.length && j < b.length) {
            if (a[i] < b[j]) {
                i++;
            } else if (a[i] > b[j]) {
                j++;
            } else {
                common[count++] = a[i];
                i++;
                j++;
            }
        }
        return Arrays.copyOf(common, count);
    }

    /// Find the first element greater than a key.
    /// @param sorted values in non-decreasing order
    /// @param key the value to look for
    /// @return the number of elements less than or equal to `key`
    public static int upperBound(long[] sorted, long key) {
        int low = 0;
        int high = sorted.length;
        while (low < high) {
            int mid = (low + high) >>> 1;
            if (sorted[mid] <= key) {
                low = mid + 1;
            } else {
                high = mid;
            }
        }
        return low;
    }

    /// Find the first element not less than a key.
    /// @param sorted values in non-decreasing order
    /// @param key the value to look for
    /// @return the number of elements less than `key`
    public static int lowerBound(long[] sorted, long key) {
        int low = 0;
        int high = sorted.length;
        while (low < high) {
            int mid = (low + high) >>> 1;
            if (sorted[mid] < key) {
                low = mid + 1;
            } else {
                high = mid;
            }
        }
        return low;
    }
}

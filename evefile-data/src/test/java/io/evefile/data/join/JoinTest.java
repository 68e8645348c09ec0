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
import io.evefile.data.entities.ChannelType;
import io.evefile.data.entities.DataField;
import io.evefile.data.entities.DataKind;
import io.evefile.data.entities.DataMetadata;
import io.evefile.data.entities.DataSequence;
import io.evefile.data.entities.MaskedArray;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.EnumSource;

import java.util.EnumMap;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.*;

@DisplayName("Join")
class JoinTest {

    private final JoinFactory factory = new JoinFactory();

    private static DataSequence axis(long[] index, double... values) {
        return DataSequence.of(DataKind.AXIS, new DataMetadata("SimMot:01", "Motor"), index, MaskedArray.ofDoubles(values));
    }

    private static DataSequence channel(long[] index, double... values) {
        return DataSequence.of(DataKind.CHANNEL, new DataMetadata("SimChan:01", "Detector"), index,
            MaskedArray.ofDoubles(values));
    }

    private static DataSequence defaultAxis() {
        return axis(new long[]{2, 3, 5, 7}, 1.0, 2.0, 3.5, 4.0);
    }

    private static DataSequence defaultChannel() {
        return channel(new long[]{2, 3, 4, 6}, 10.0, 20.0, 30.0, 40.0);
    }

    private List<DataSequence> join(JoinMode mode, DataSequence... data) {
        return factory.getJoin(mode).join(List.of(data), Map.of());
    }

    private static List<String> rendered(DataSequence sequence) {
        MaskedArray values = sequence.values();
        String[] cells = new String[values.length()];
        for (int i = 0; i < cells.length; i++) {
            cells[i] = values.getString(i, "--");
        }
        return List.of(cells);
    }

    @Nested
    @DisplayName("Common positions")
    class CommonPositionsTest {

        @Test
        @DisplayName("should use every position with axis-or-channel positions")
        void shouldUniteAll() {
            List<DataSequence> joined = join(JoinMode.AXIS_OR_CHANNEL_POSITIONS, defaultAxis(), defaultChannel());

            assertThat(joined.get(0).index()).containsExactly(2, 3, 4, 5, 6, 7);
            assertThat(rendered(joined.get(0))).containsExactly("1.0", "2.0", "2.0", "3.5", "3.5", "4.0");
            assertThat(rendered(joined.get(1))).containsExactly("10.0", "20.0", "30.0", "--", "40.0", "--");
        }

        @Test
        @DisplayName("should use axis positions and mask channels without readings")
        void shouldUseAxisPositions() {
            List<DataSequence> joined = join(JoinMode.AXIS_POSITIONS, defaultAxis(), defaultChannel());

            assertThat(joined.get(1).index()).containsExactly(2, 3, 5, 7);
            assertThat(rendered(joined.get(0))).containsExactly("1.0", "2.0", "3.5", "4.0");
            assertThat(rendered(joined.get(1))).containsExactly("10.0", "20.0", "--", "--");
        }

        @Test
        @DisplayName("should use channel positions and carry axes forward")
        void shouldUseChannelPositions() {
            List<DataSequence> joined = join(JoinMode.CHANNEL_POSITIONS, defaultAxis(), defaultChannel());

            assertThat(joined.get(0).index()).containsExactly(2, 3, 4, 6);
            assertThat(rendered(joined.get(0))).containsExactly("1.0", "2.0", "2.0", "3.5");
            assertThat(joined.get(1).values().hasMask()).isFalse();
        }

        @Test
        @DisplayName("should use positions common to axes and channels")
        void shouldIntersect() {
            List<DataSequence> joined = join(JoinMode.AXIS_AND_CHANNEL_POSITIONS, defaultAxis(), defaultChannel());

            assertThat(joined.get(0).index()).containsExactly(2, 3);
            assertThat(rendered(joined.get(0))).containsExactly("1.0", "2.0");
            assertThat(rendered(joined.get(1))).containsExactly("10.0", "20.0");
        }

        @Test
        @DisplayName("should give empty results for disjoint axes and channels")
        void shouldGiveEmptyIntersection() {
            List<DataSequence> joined = join(JoinMode.AXIS_AND_CHANNEL_POSITIONS,
                axis(new long[]{1, 2}, 1.0, 2.0), channel(new long[]{3, 4}, 3.0, 4.0));

            assertThat(joined).hasSize(2);
            assertThat(joined).allSatisfy(sequence -> {
                assertThat(sequence.size()).isZero();
                assertThat(sequence.values().length()).isZero();
            });
        }

        @Test
        @DisplayName("should give empty results for axes without channels")
        void shouldGiveEmptyIntersectionForAxesOnly() {
            List<DataSequence> joined = join(JoinMode.AXIS_AND_CHANNEL_POSITIONS, axis(new long[]{1, 2, 3}, 1.0, 2.0, 3.0));

            assertThat(joined).hasSize(1);
            assertThat(joined.get(0).index()).isEmpty();
            assertThat(joined.get(0).values().length()).isZero();
        }

        @Test
        @DisplayName("should give empty results for channels without axes")
        void shouldGiveEmptyIntersectionForChannelsOnly() {
            List<DataSequence> joined = join(JoinMode.AXIS_AND_CHANNEL_POSITIONS,
                channel(new long[]{1, 2, 3}, 1.0, 2.0, 3.0));

            assertThat(joined).hasSize(1);
            assertThat(joined.get(0).index()).isEmpty();
        }

        @Test
        @DisplayName("should keep every value of a channel built from unsorted positions")
        void shouldJoinUnsortedChannel() {
            List<DataSequence> joined = join(JoinMode.CHANNEL_POSITIONS,
                channel(new long[]{5, 1, 3, 3}, 50.0, 10.0, 30.0, 31.0));

            assertThat(joined.get(0).index()).containsExactly(1, 3, 5);
            assertThat(rendered(joined.get(0))).containsExactly("10.0", "30.0", "50.0");
        }

        @ParameterizedTest
        @EnumSource(JoinMode.class)
        @DisplayName("should never give more positions than axis-or-channel positions")
        void shouldBeBoundedByUnion(JoinMode mode) {
            int union = join(JoinMode.AXIS_OR_CHANNEL_POSITIONS, defaultAxis(), defaultChannel()).get(0).size();

            assertThat(join(mode, defaultAxis(), defaultChannel()).get(0).size()).isLessThanOrEqualTo(union);
        }

        @Test
        @DisplayName("should unite the positions of several channels")
        void shouldUniteChannels() {
            DataSequence other = DataSequence.of(DataKind.CHANNEL, new DataMetadata("SimChan:02", ""),
                new long[]{1, 8}, MaskedArray.ofDoubles(-1.0, -8.0));

            List<DataSequence> joined = join(JoinMode.CHANNEL_POSITIONS, defaultAxis(), defaultChannel(), other);

            assertThat(joined.get(0).index()).containsExactly(1, 2, 3, 4, 6, 8);
            assertThat(rendered(joined.get(0))).containsExactly("--", "1.0", "2.0", "2.0", "3.5", "4.0");
            assertThat(rendered(joined.get(2))).containsExactly("-1.0", "--", "--", "--", "--", "-8.0");
        }
    }

    @Nested
    @DisplayName("Filling")
    class FillingTest {

        @Test
        @DisplayName("should mask axis values before the first recorded position")
        void shouldMaskBeforeFirstValue() {
            List<DataSequence> joined = join(JoinMode.AXIS_OR_CHANNEL_POSITIONS,
                defaultAxis(), channel(new long[]{1, 2}, 5.0, 6.0));

            assertThat(joined.get(0).index()).containsExactly(1, 2, 3, 5, 7);
            assertThat(rendered(joined.get(0))).containsExactly("--", "1.0", "2.0", "3.5", "4.0");
        }

        @Test
        @DisplayName("should take earlier axis values from the snapshot")
        void shouldSpliceSnapshot() {
            DataSequence snapshot = axis(new long[]{1}, 0.5);

            List<DataSequence> joined = factory.getJoin(JoinMode.AXIS_OR_CHANNEL_POSITIONS)
                .join(List.of(defaultAxis(), channel(new long[]{1, 2}, 5.0, 6.0)), Map.of("SimMot:01", snapshot));

            assertThat(joined.get(0).index()).containsExactly(1, 2, 3, 5, 7);
            assertThat(rendered(joined.get(0))).containsExactly("0.5", "1.0", "2.0", "3.5", "4.0");
        }

        @Test
        @DisplayName("should prefer recorded axis values over snapshot values at the same position")
        void shouldPreferRecordedValues() {
            DataSequence snapshot = axis(new long[]{2, 6}, -2.0, -6.0);

            List<DataSequence> joined = factory.getJoin(JoinMode.AXIS_OR_CHANNEL_POSITIONS)
                .join(List.of(defaultAxis(), defaultChannel()), Map.of("SimMot:01", snapshot));

            assertThat(rendered(joined.get(0))).containsExactly("1.0", "2.0", "2.0", "3.5", "-6.0", "4.0");
        }

        @Test
        @DisplayName("should never add snapshot positions to the result")
        void shouldNotAddSnapshotPositions() {
            DataSequence snapshot = axis(new long[]{0}, 0.5);

            List<DataSequence> joined = factory.getJoin(JoinMode.AXIS_POSITIONS)
                .join(List.of(defaultAxis()), Map.of("SimMot:01", snapshot));

            assertThat(joined.get(0).index()).containsExactly(2, 3, 5, 7);
        }

        @Test
        @DisplayName("should ignore snapshots for channels")
        void shouldIgnoreChannelSnapshots() {
            DataSequence snapshot = channel(new long[]{1}, 99.0);

            List<DataSequence> joined = factory.getJoin(JoinMode.AXIS_OR_CHANNEL_POSITIONS)
                .join(List.of(axis(new long[]{1, 2}, 1.0, 2.0), defaultChannel()), Map.of("SimChan:01", snapshot));

            assertThat(rendered(joined.get(1))).startsWith("--", "10.0");
        }

        @Test
        @DisplayName("should carry mapped monitor values forward")
        void shouldCarryDevicesForward() {
            DataSequence device = DataSequence.of(DataKind.DEVICE, new DataMetadata("SimMon:01", "Ring"),
                new long[]{1, 4}, MaskedArray.ofDoubles(100.0, 99.0));

            List<DataSequence> joined = join(JoinMode.CHANNEL_POSITIONS, device, defaultChannel());

            assertThat(rendered(joined.get(0))).containsExactly("100.0", "100.0", "99.0", "99.0");
            assertThat(joined.get(0).kind()).isEqualTo(DataKind.DEVICE);
        }

        @Test
        @DisplayName("should align auxiliary fields with the values")
        void shouldAlignAllFields() {
            Map<DataField, MaskedArray> fields = new EnumMap<>(DataField.class);
            fields.put(DataField.DATA, MaskedArray.ofDoubles(1.5, 2.5));
            fields.put(DataField.COUNTS, MaskedArray.ofLongs(5, 6));
            fields.put(DataField.STD, MaskedArray.ofDoubles(0.01, 0.02));
            DataSequence interval = DataSequence.of(DataKind.CHANNEL, ChannelType.INTERVAL,
                new DataMetadata("SimInt:01", ""), new long[]{3, 4}, fields);

            DataSequence joined = join(JoinMode.AXIS_POSITIONS, defaultAxis(), interval).get(1);

            assertThat(joined.channelType()).contains(ChannelType.INTERVAL);
            assertThat(joined.fieldNames()).containsExactly(DataField.DATA, DataField.COUNTS, DataField.STD);
            assertThat(joined.field(DataField.COUNTS).get(1)).isEqualTo(5L);
            assertThat(joined.field(DataField.COUNTS).isMasked(0)).isTrue();
            assertThat(joined.field(DataField.STD).isMasked(2)).isTrue();
        }

        @Test
        @DisplayName("should mask non-numeric values without a sentinel")
        void shouldMaskText() {
            DataSequence text = DataSequence.of(DataKind.CHANNEL, new DataMetadata("SimText:01", ""),
                new long[]{3}, MaskedArray.ofStrings(""));

            DataSequence joined = join(JoinMode.AXIS_POSITIONS, defaultAxis(), text).get(1);

            assertThat(joined.values().componentType()).isEqualTo(String.class);
            assertThat(joined.values().get(0)).isNull();
            assertThat(joined.values().get(1)).isEqualTo("");
        }
    }

    @Nested
    @DisplayName("Results")
    class ResultsTest {

        @Test
        @DisplayName("should return an axis unchanged when joined with itself only")
        void shouldRoundTrip() {
            DataSequence axis = defaultAxis();

            DataSequence joined = join(JoinMode.AXIS_POSITIONS, axis).get(0);

            assertThat(joined.index()).isEqualTo(axis.index());
            assertThat(joined.values()).isEqualTo(axis.values());
        }

        @Test
        @DisplayName("should keep input order and leave inputs untouched")
        void shouldKeepOrderAndInputs() {
            DataSequence axis = defaultAxis();
            DataSequence channel = defaultChannel();

            List<DataSequence> joined = join(JoinMode.AXIS_OR_CHANNEL_POSITIONS, channel, axis);

            assertThat(joined).extracting(DataSequence::kind).containsExactly(DataKind.CHANNEL, DataKind.AXIS);
            assertThat(axis.index()).containsExactly(2, 3, 5, 7);
            assertThat(channel.values().hasMask()).isFalse();
            assertThat(joined.get(1).metadata()).isNotSameAs(axis.metadata());
            assertThat(joined.get(1).metadata().getId()).isEqualTo("SimMot:01");
        }

        @ParameterizedTest
        @EnumSource(JoinMode.class)
        @DisplayName("should give the same result when repeated")
        void shouldBeDeterministic(JoinMode mode) {
            List<DataSequence> first = join(mode, defaultAxis(), defaultChannel());
            List<DataSequence> second = join(mode, defaultAxis(), defaultChannel());

            for (int i = 0; i < first.size(); i++) {
                assertThat(first.get(i).index()).isEqualTo(second.get(i).index());
                assertThat(first.get(i).values()).isEqualTo(second.get(i).values());
            }
        }
    }

    @Nested
    @DisplayName("Preconditions")
    class PreconditionsTest {

        @Test
        @DisplayName("should need data")
        void shouldNeedData() {
            Join join = factory.getJoin();

            assertThatThrownBy(() -> join.join(List.of(), Map.of()))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("Need data to join");
            assertThatThrownBy(() -> join.join(null, Map.of()))
                .isInstanceOf(IllegalArgumentException.class);
        }

        @Test
        @DisplayName("should refuse data not indexed by position")
        void shouldRefuseMonitors() {
            DataSequence monitor = DataSequence.of(DataKind.MONITOR, new DataMetadata("SimMon:01", ""),
                new long[]{-1}, MaskedArray.ofDoubles(1.0));

            assertThatThrownBy(() -> join(JoinMode.AXIS_POSITIONS, defaultAxis(), monitor))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("not indexed by position");
        }

        @Test
        @DisplayName("should need a file to resolve names")
        void shouldNeedEvefileForNames() {
            assertThatThrownBy(() -> factory.getJoin().join(List.of("SimMot:01")))
                .isInstanceOf(MissingDependencyException.class)
                .isInstanceOf(IllegalStateException.class)
                .hasMessageContaining("Need an evefile");
        }
    }
}

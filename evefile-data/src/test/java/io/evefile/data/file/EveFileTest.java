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

import io.evefile.data.config.EvefileSettings;
import io.evefile.data.entities.DataKind;
import io.evefile.data.entities.DataMetadata;
import io.evefile.data.entities.DataSequence;
import io.evefile.data.entities.DataTable;
import io.evefile.data.entities.MaskedArray;
import io.evefile.data.h5.EveH5Fixtures;
import io.evefile.data.h5.InMemoryH5Source;
import io.evefile.data.join.JoinMode;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.util.List;

import static io.evefile.data.h5.EveH5Fixtures.*;
import static org.assertj.core.api.Assertions.*;

@DisplayName("EveFile")
class EveFileTest {

    private InMemoryH5Source source;
    private EveFile evefile;

    @BeforeEach
    void setUp() {
        source = EveH5Fixtures.version7();
        evefile = new EveFile().load(source);
    }

    @AfterEach
    void tearDown() {
        evefile.close();
    }

    @Nested
    @DisplayName("Loading")
    class LoadingTest {

        @Test
        @DisplayName("should take the filename from the source")
        void shouldTakeFilename() {
            assertThat(evefile.metadata().getFilename()).isEqualTo("v7.h5");
            assertThat(evefile.metadata().getEveh5Version()).isEqualTo("7.0");
        }

        @Test
        @DisplayName("should load a file only once")
        void shouldLoadOnce() {
            assertThatThrownBy(() -> evefile.load(EveH5Fixtures.version7()))
                .isInstanceOf(IllegalStateException.class)
                .hasMessageContaining("Already loaded");
        }

        @Test
        @DisplayName("should close its source")
        void shouldCloseSource() {
            evefile.close();

            assertThat(source.isClosed()).isTrue();
        }

        @Test
        @DisplayName("should need a filename to load from")
        void shouldNeedFilename() {
            assertThatThrownBy(() -> new EveFile().load())
                .isInstanceOf(IllegalStateException.class)
                .hasMessageContaining("Missing filename");
        }

        @Test
        @DisplayName("should report missing files")
        void shouldReportMissingFiles(@TempDir Path dir) {
            Path missing = dir.resolve("missing.h5");

            assertThatThrownBy(() -> EveFile.open(missing, EvefileSettings.defaults()))
                .isInstanceOf(UncheckedIOException.class)
                .hasCauseInstanceOf(NoSuchFileException.class);
        }

        @Test
        @DisplayName("should report files which are not HDF5")
        void shouldReportInvalidFiles(@TempDir Path dir) throws IOException {
            Path text = dir.resolve("notes.h5");
            Files.writeString(text, "not an HDF5 file");

            assertThatThrownBy(() -> EveFile.open(text, EvefileSettings.defaults()))
                .isInstanceOf(UncheckedIOException.class);
        }
    }

    @Nested
    @DisplayName("Lookups")
    class LookupTest {

        @Test
        @DisplayName("should find data by id or name")
        void shouldFindData() {
            assertThat(evefile.getData(AXIS)).isSameAs(evefile.getData("Motor 1"));
            assertThat(evefile.getData(List.of("Detector 1", AXIS)))
                .extracting(sequence -> sequence.metadata().getId())
                .containsExactly(CHANNEL, AXIS);
        }

        @Test
        @DisplayName("should report unknown data")
        void shouldReportUnknownData() {
            assertThatThrownBy(() -> evefile.getData("Motor 9"))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("No data 'Motor 9'");
            assertThatThrownBy(() -> evefile.getMonitor(AXIS))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("No monitor");
        }

        @Test
        @DisplayName("should list data names in file order")
        void shouldListNames() {
            assertThat(evefile.getDataNames())
                .containsExactly("Motor 1", "Detector 1", "Detector 2", "Interval 1", "Average 1");
        }

        @Test
        @DisplayName("should return the preferred data that is present")
        void shouldReturnPreferredData() {
            assertThat(evefile.getPreferredData())
                .extracting(sequence -> sequence.metadata().getId())
                .containsExactly(AXIS, CHANNEL, NORMALIZING_CHANNEL);

            evefile.metadata().setPreferredChannel("SimChan:99");
            assertThat(evefile.getPreferredData()).hasSize(2);
        }

        @Test
        @DisplayName("should not expose its collections for modification")
        void shouldProtectCollections() {
            assertThatThrownBy(() -> evefile.data().clear()).isInstanceOf(UnsupportedOperationException.class);
            assertThatThrownBy(() -> evefile.logMessages().clear()).isInstanceOf(UnsupportedOperationException.class);
        }
    }

    @Nested
    @DisplayName("Joining")
    class JoiningTest {

        @Test
        @DisplayName("should join by the configured default mode")
        void shouldJoinByDefaultMode() {
            List<DataSequence> joined = evefile.getJoinedData(List.of(AXIS, CHANNEL), null);

            assertThat(joined.get(0).index()).containsExactly(2, 3, 4, 5, 6, 7);
            assertThat(joined.get(1).values().isMasked(3)).isTrue();
        }

        @Test
        @DisplayName("should join with the snapshot of an axis")
        void shouldUseSnapshots() {
            DataSequence late = DataSequence.of(DataKind.CHANNEL,
                new DataMetadata("SimChan:04", "Early"),
                new long[]{1}, MaskedArray.ofDoubles(1.0));
            evefile.putData("SimChan:04", late);

            List<DataSequence> joined = evefile.getJoinedData(List.of(AXIS, "Early"), JoinMode.CHANNEL_POSITIONS);

            assertThat(joined.get(0).index()).containsExactly(1);
            assertThat(joined.get(0).values().toDoubleArray()).containsExactly(0.5);
        }

        @Test
        @DisplayName("should join all data when no keys are given")
        void shouldJoinAll() {
            List<DataSequence> joined = evefile.getJoinedData(List.of(), JoinMode.AXIS_POSITIONS);

            assertThat(joined).hasSize(5);
            assertThat(joined).allSatisfy(sequence -> assertThat(sequence.index()).containsExactly(2, 3, 5, 7));
        }

        @Test
        @DisplayName("should tabulate joined data")
        void shouldTabulate() {
            DataTable table = evefile.getDataTable(List.of(AXIS, CHANNEL), JoinMode.AXIS_AND_CHANNEL_POSITIONS);

            assertThat(table.indexName()).isEqualTo("position");
            assertThat(table.columnNames()).containsExactly("Motor 1", "Detector 1",
                "Detector 1:normalized_data", "Detector 1:normalizing_data");
            assertThat(table.row(1, "")).containsExactly("3", "2.0", "20.0", "5.0", "4.0");
        }

        @Test
        @DisplayName("should use the join mode of its settings")
        void shouldUseSettingsMode() {
            EveFile configured = new EveFile(EvefileSettings.defaults().withJoinMode(JoinMode.AXIS_POSITIONS))
                .load(EveH5Fixtures.version7());

            assertThat(configured.getJoinedData(List.of(AXIS, CHANNEL), null).get(0).index())
                .containsExactly(2, 3, 5, 7);
        }
    }

    @Test
    @DisplayName("should map monitors onto positions")
    void shouldMapMonitor() {
        DataSequence mapped = evefile.mapMonitor("Ring current");

        assertThat(mapped.kind()).isEqualTo(DataKind.DEVICE);
        assertThat(mapped.index()).containsExactly(1, 2, 7, 10);
    }

    @Test
    @DisplayName("should list its contents")
    void shouldShowInfo() {
        String info = evefile.showInfo();

        assertThat(info).contains("METADATA", "LOG MESSAGES", "DATA", "SNAPSHOTS", "MONITORS");
        assertThat(info).contains("Beam lost", "Motor 1 (SimMot:01) <AXIS>", "Ring current (SimMon:01) <MONITOR>");
        assertThat(info.indexOf("SNAPSHOTS")).isLessThan(info.indexOf("MONITORS"));
    }
}

package com.libragraph.archive.formats.container;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.io.InputStream;

import static org.assertj.core.api.Assertions.*;

/**
 * Reads {@code corr_index.h5}: a correlator-style index with a compound
 * {@code (fpga_count u8, ctime f8)} time axis, compound freq (4) and prod (6)
 * axes, a plain float {@code update_time} and a compound {@code /timestamp}
 * table whose ctimes are out of order.
 */
class Hdf5ContainerTest {

    private DataContainer container;

    @BeforeEach
    void open() throws Exception {
        try (InputStream in = Hdf5ContainerOpenerTest.fixture(Hdf5ContainerOpenerTest.CORR_INDEX)) {
            container = new Hdf5ContainerOpener().open(in, "corr_index.h5");
        }
    }

    @AfterEach
    void close() throws Exception {
        container.close();
    }

    @Test
    void shouldFindDatasetsButNotGroups() {
        assertThat(container.contains("/index_map/time")).isTrue();
        assertThat(container.contains("/timestamp")).isTrue();
        assertThat(container.contains("/index_map")).isFalse();
        assertThat(container.contains("/index_map/beam")).isFalse();
    }

    @Test
    void shouldReportFirstAxisLength() {
        assertThat(container.length("/index_map/time")).isEqualTo(3);
        assertThat(container.length("/index_map/freq")).isEqualTo(4);
        assertThat(container.length("/index_map/prod")).isEqualTo(6);
        assertThat(container.length("/index_map/update_time")).isEqualTo(2);
    }

    @Test
    void shouldReadCompoundMembers() {
        assertThat(container.readField("/index_map/time", "ctime"))
                .containsExactly(1643499353.0, 1643499363.0, 1643499373.0);
        assertThat(container.readField("/index_map/time", "fpga_count"))
                .containsExactly(0.0, 390625.0, 781250.0);
        assertThat(container.readField("/timestamp", "ctime"))
                .containsExactly(1676319310.0, 1676319300.0, 1676319320.0);
        assertThat(container.readField("/index_map/prod", "input_b"))
                .containsExactly(0.0, 1.0, 2.0, 1.0, 2.0, 2.0);
    }

    @Test
    void shouldReadPlainNumericDataset() {
        assertThat(container.readDoubles("/index_map/update_time"))
                .containsExactly(1667692800.0, 1667700000.0);
    }

    @Test
    void shouldRejectShapeMismatches() {
        assertThatThrownBy(() -> container.readDoubles("/index_map/time"))
                .isInstanceOf(ContainerFormatException.class)
                .hasMessageContaining("corr_index.h5:/index_map/time");
        assertThatThrownBy(() -> container.readField("/index_map/update_time", "ctime"))
                .isInstanceOf(ContainerFormatException.class);
        assertThatThrownBy(() -> container.readField("/index_map/time", "lost_packets"))
                .isInstanceOf(ContainerFormatException.class)
                .hasMessageContaining("lost_packets");
        assertThatThrownBy(() -> container.length("/index_map/beam"))
                .isInstanceOf(ContainerFormatException.class);
    }
}

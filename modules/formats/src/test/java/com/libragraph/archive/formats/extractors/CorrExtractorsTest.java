package com.libragraph.archive.formats.extractors;

import com.libragraph.archive.formats.container.ContainerFormatException;
import com.libragraph.archive.formats.container.InMemoryContainer;
import com.libragraph.archive.formats.extract.ExtractionException;
import org.junit.jupiter.api.Test;

import java.util.Map;

import static org.assertj.core.api.Assertions.*;

class CorrExtractorsTest {

    private static InMemoryContainer corrFile(double... ctime) {
        return new InMemoryContainer()
                .withField("/index_map/time", "fpga_count", new double[ctime.length])
                .withField("/index_map/time", "ctime", ctime)
                .withLength("/index_map/freq", 1024)
                .withLength("/index_map/prod", 120);
    }

    @Test
    void shouldComputeIntegrationAsMedianCadence() throws Exception {
        Map<String, Object> fields = new CorrAcqExtractor().parseContent(corrFile(0, 30, 60, 90));

        assertThat(fields)
                .containsEntry("integration", 30.0)
                .containsEntry("nfreq", 1024)
                .containsEntry("nprod", 120);
    }

    @Test
    void shouldIgnoreSingleDroppedFrameInCadence() throws Exception {
        Map<String, Object> fields = new CorrAcqExtractor().parseContent(corrFile(0, 10, 20, 40, 50));

        assertThat(fields).containsEntry("integration", 10.0);
    }

    @Test
    void shouldOmitIntegrationForSingleSample() throws Exception {
        Map<String, Object> fields = new CorrAcqExtractor().parseContent(corrFile(1000));

        assertThat(fields).doesNotContainKey("integration").containsEntry("nfreq", 1024);
    }

    @Test
    void shouldValidateAcquisitionName() throws Exception {
        assertThat(new CorrAcqExtractor().parseFilename("20220129T233553Z_chimetiming_corr")).isEmpty();
        assertThatThrownBy(() -> new CorrAcqExtractor().parseFilename("20220129_chimetiming_corr"))
                .isInstanceOf(ExtractionException.class);
    }

    @Test
    void shouldParseChunkAndFrequencyFromFileName() throws Exception {
        assertThat(new CorrFileExtractor().parseFilename("00000012_0345.h5"))
                .containsEntry("chunk_number", 12)
                .containsEntry("freq_number", 345);
    }

    @Test
    void shouldRejectMalformedCorrFileName() {
        var extractor = new CorrFileExtractor();

        assertThatThrownBy(() -> extractor.parseFilename("0000012_0345.h5")).isInstanceOf(ExtractionException.class);
        assertThatThrownBy(() -> extractor.parseFilename("00000012_0345.h5.lock")).isInstanceOf(ExtractionException.class);
        assertThatThrownBy(() -> extractor.parseFilename("hfb_00000012_0345.h5")).isInstanceOf(ExtractionException.class);
    }

    @Test
    void shouldTakeFileSpanFromFirstAndLastTime() throws Exception {
        Map<String, Object> fields = new CorrFileExtractor().parseContent(corrFile(100, 110, 105, 130));

        assertThat(fields).containsEntry("start_time", 100.0).containsEntry("finish_time", 130.0);
    }

    @Test
    void shouldFailOnEmptyTimeIndex() {
        assertThatThrownBy(() -> new CorrFileExtractor().parseContent(corrFile()))
                .isInstanceOf(ExtractionException.class);
    }

    @Test
    void shouldPropagateMissingDataset() {
        var container = new InMemoryContainer().withLength("/index_map/freq", 4);

        assertThatThrownBy(() -> new CorrAcqExtractor().parseContent(container))
                .isInstanceOf(ContainerFormatException.class);
    }
}

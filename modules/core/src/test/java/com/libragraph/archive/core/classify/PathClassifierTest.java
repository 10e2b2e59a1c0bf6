package com.libragraph.archive.core.classify;

import com.libragraph.archive.core.catalog.AcqType;
import com.libragraph.archive.core.catalog.FilePattern;
import com.libragraph.archive.core.catalog.FileType;
import com.libragraph.archive.core.catalog.Instrument;
import com.libragraph.archive.core.catalog.TypeCatalog;
import com.libragraph.archive.core.test.TestCatalogs;
import com.libragraph.archive.formats.extract.ExtractorRegistry;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.Test;

import java.util.Map;

import static org.assertj.core.api.Assertions.*;

class PathClassifierTest {

    private static PathClassifier classifier;

    @BeforeAll
    static void seedCatalog() {
        classifier = new PathClassifier(TestCatalogs.seeded());
    }

    @Test
    void shouldClassifyCorrChunk() {
        Classification c = classifier.classify("20220129T233553Z_chimetiming_corr/00000000_0000.h5").orElseThrow();

        assertThat(c.acqType().name()).isEqualTo("corr");
        assertThat(c.instrument().name()).isEqualTo("chimetiming");
        assertThat(c.fileType().name()).isEqualTo("corr");
        assertThat(c.fileName()).isEqualTo("00000000_0000.h5");
        assertThat(c.groups()).isEqualTo(Map.of("chunk_number", "00000000", "freq_number", "0000"));
    }

    @Test
    void shouldClassifyCalibrationFileUnderEachCalibrationType() {
        for (String acqType : new String[]{"digitalgain", "gain", "flaginput"}) {
            Classification c = classifier.classify("20221106T000000Z_chime_" + acqType + "/00012345.h5")
                    .orElseThrow();

            assertThat(c.fileType().name()).isEqualTo("calibration");
            assertThat(c.groups()).isEmpty();
        }
    }

    @Test
    void shouldCaptureWeatherDate() {
        Classification c = classifier.classify("20221106T000000Z_chime_weather/20221106.h5").orElseThrow();

        assertThat(c.groups()).containsExactly(entry("date", "20221106"));
    }

    @Test
    void shouldNotMatchFileOutsideAllowedTypes() {
        // a corr chunk name in a rawadc acquisition
        assertThat(classifier.classify("20220129T233553Z_chimetiming_rawadc/00000000_0000.h5")).isEmpty();
        assertThat(classifier.classify("20220129T233553Z_chimetiming_corr/000000.h5")).isEmpty();
    }

    @Test
    void shouldNotMatchTypesWithoutPattern() {
        assertThat(classifier.classify("20220129T233553Z_chime_hk/anything.log")).isEmpty();
    }

    @Test
    void shouldNotMatchMalformedPaths() {
        assertThat(classifier.classify("00000000_0000.h5")).isEmpty();
        assertThat(classifier.classify("20220129T233553Z_chimetiming_corr/")).isEmpty();
        assertThat(classifier.classify("/00000000_0000.h5")).isEmpty();
        assertThat(classifier.classify("20220129T233553Z_corr/00000000_0000.h5")).isEmpty();
        assertThat(classifier.classify("data/20220129T233553Z_chimetiming_corr/00000000_0000.h5")).isEmpty();
    }

    @Test
    void shouldNotMatchBadTimestampOrUnknownNames() {
        assertThat(classifier.classify("20221329T233553Z_chimetiming_corr/00000000_0000.h5")).isEmpty();
        assertThat(classifier.classify("20220129T233553Z_nosuchinst_corr/00000000_0000.h5")).isEmpty();
        assertThat(classifier.classify("20220129T233553Z_chimetiming_nosuchtype/00000000_0000.h5")).isEmpty();
    }

    @Test
    void shouldMatchFromStartOfFilenameOnly() {
        assertThat(classifier.classify("20220129T233553Z_chimetiming_corr/x00000000_0000.h5")).isEmpty();
        assertThat(classifier.classify("20220129T233553Z_chimetiming_corr/00000000_0000.h5.lock")).isEmpty();
    }

    @Test
    void shouldPreferFirstRegisteredFileType() {
        TypeCatalog catalog = new TypeCatalog(new ExtractorRegistry());
        catalog.registerOrUpdate(new AcqType(1, "corr", null, null, 0));
        catalog.registerOrUpdate(new Instrument(1, "stone", null));
        catalog.registerOrUpdate(new FileType(1, "wide", null, FilePattern.compile("[0-9]+\\.h5$"), null, 0));
        catalog.registerOrUpdate(new FileType(2, "narrow", null, FilePattern.compile("(?P<n>[0-9]{4})\\.h5$"),
                null, 9));
        catalog.allow("corr", "narrow");
        catalog.allow("corr", "wide");

        Classification c = new PathClassifier(catalog).classify("20220129T233553Z_stone_corr/0001.h5").orElseThrow();

        assertThat(c.fileType().name()).isEqualTo("wide");
    }
}

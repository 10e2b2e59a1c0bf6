package com.libragraph.archive.core.catalog;

import com.libragraph.archive.core.dao.AcqTypeDao;
import com.libragraph.archive.core.dao.AcqTypeRecord;
import com.libragraph.archive.core.dao.AllowedFileTypeDao;
import com.libragraph.archive.core.dao.FileTypeDao;
import com.libragraph.archive.core.dao.InstrumentDao;
import com.libragraph.archive.core.test.TestCatalogs;
import com.libragraph.archive.core.test.TestDatabase;
import com.libragraph.archive.types.CatalogLookupException;
import com.libragraph.archive.types.ResolverId;
import org.jdbi.v3.core.Jdbi;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.*;

class CatalogSeederTest {

    private Jdbi jdbi;
    private CatalogSeeder seeder;

    @BeforeEach
    void setUp() {
        jdbi = TestDatabase.create();
        seeder = TestCatalogs.seeder(jdbi);
    }

    @Test
    void shouldReadBundledSeed() {
        CatalogSeed seed = seeder.readSeed();

        assertThat(seed.acqTypes()).extracting(CatalogSeed.AcqTypeEntry::name)
                .containsExactly("corr", "hk", "rawadc", "weather", "hkp", "digitalgain", "gain", "flaginput", "hfb");
        assertThat(seed.fileTypes()).extracting(CatalogSeed.FileTypeEntry::name)
                .containsExactly("corr", "log", "hk", "atmel_id", "rawadc", "pdf", "weather", "hkp",
                        "calibration", "hfb");
        assertThat(seed.allowedFileTypes()).hasSize(7);
        assertThat(seed.instruments()).hasSize(269);
    }

    @Test
    void shouldSeedEveryExtractorReference() {
        CatalogSeed seed = seeder.readSeed();

        List<String> refs = new ArrayList<>();
        seed.acqTypes().forEach(t -> refs.add(t.infoClass()));
        seed.fileTypes().forEach(t -> refs.add(t.infoClass()));

        assertThat(refs).contains("CorrAcqInfo", "CorrFileInfo", "RawadcAcqInfo", "RawadcFileInfo",
                "WeatherAcqDetect", "WeatherFileInfo", "DigitalGainAcqDetect", "CalibrationGainAcqDetect",
                "FlagInputAcqDetect", "HFBAcqInfo", "HFBFileInfo", ResolverId.CALIBRATION.reference());
    }

    @Test
    void shouldBeIdempotent() {
        seeder.seed();
        seeder.seed();

        jdbi.useHandle(h -> {
            assertThat(h.attach(AcqTypeDao.class).findAll()).hasSize(9);
            assertThat(h.attach(FileTypeDao.class).findAll()).hasSize(10);
            assertThat(h.attach(AllowedFileTypeDao.class).findAll()).hasSize(7);
            assertThat(h.attach(InstrumentDao.class).findAll()).hasSize(269);
        });
    }

    @Test
    void shouldUpdateExistingTypeByName() {
        jdbi.useExtension(AcqTypeDao.class, dao ->
                dao.insert(new AcqTypeRecord(1, "corr", null, "old notes", 5)));

        seeder.seed();

        AcqTypeRecord corr = jdbi.withExtension(AcqTypeDao.class, dao -> dao.findByName("corr")).orElseThrow();
        assertThat(corr.infoClass()).isEqualTo("CorrAcqInfo");
        assertThat(corr.priority()).isZero();
        assertThat(corr.notes()).startsWith("Traditionally");
    }

    @Test
    void shouldKeepUnknownTypesButDropStalePairs() {
        seeder.seed();
        jdbi.useHandle(h -> {
            h.attach(AcqTypeDao.class).insert(new AcqTypeRecord(42, "legacy", null, null, 0));
            // corr/log is not a seeded pairing
            h.attach(AllowedFileTypeDao.class).insert(1, 2);
            // legacy/log belongs to an unseeded acquisition type
            h.attach(AllowedFileTypeDao.class).insert(42, 2);
        });

        seeder.seed();

        jdbi.useHandle(h -> {
            assertThat(h.attach(AcqTypeDao.class).findByName("legacy")).isPresent();
            assertThat(h.attach(AllowedFileTypeDao.class).count(1, 2)).isZero();
            assertThat(h.attach(AllowedFileTypeDao.class).count(1, 1)).isEqualTo(1);
            assertThat(h.attach(AllowedFileTypeDao.class).count(42, 2)).isEqualTo(1);
        });
    }

    @Test
    void shouldRejectSeedWithUnknownExtractorBeforeWriting() {
        var bad = new CatalogSeed(
                List.of(new CatalogSeed.AcqTypeEntry(1, "corr", "NoSuchInfo", null, 0)),
                List.of(), List.of(), List.of());

        assertThatThrownBy(() -> seeder.seed(bad))
                .isInstanceOf(CatalogLookupException.class);
        assertThat(jdbi.withExtension(AcqTypeDao.class, AcqTypeDao::findAll)).isEmpty();
    }

    @Test
    void shouldLoadSeededCatalog() {
        TypeCatalog catalog = TestCatalogs.seeded(jdbi);

        assertThat(catalog.acqTypes()).hasSize(9);
        assertThat(catalog.instrument("chimetiming")).hasValueSatisfying(i -> assertThat(i.id()).isEqualTo(263));
        assertThat(catalog.allowedFileTypes(catalog.requireAcqType("gain")))
                .extracting(FileType::name).containsExactly("calibration");
        assertThat(catalog.allowedFileTypes(catalog.requireAcqType("hk"))).isEmpty();
        assertThat(catalog.requireFileType("log").pattern()).isNull();
        assertThat(catalog.requireFileType("calibration").extractor())
                .hasValueSatisfying(r -> assertThat(r.reference()).isEqualTo("=cal_info_class"));
    }
}

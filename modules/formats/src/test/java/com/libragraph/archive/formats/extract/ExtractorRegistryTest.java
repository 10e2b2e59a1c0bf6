package com.libragraph.archive.formats.extract;

import com.libragraph.archive.types.CatalogLookupException;
import com.libragraph.archive.types.ExtractorId;
import com.libragraph.archive.types.ItemKind;
import org.junit.jupiter.api.Test;

import java.util.HashSet;
import java.util.Set;

import static org.assertj.core.api.Assertions.*;

class ExtractorRegistryTest {

    private final ExtractorRegistry registry = new ExtractorRegistry();

    private static OwningItem fileOf(String acqType) {
        return new OwningItem(ItemKind.FILE, 1L, "20230101.h5", acqType);
    }

    @Test
    void shouldRegisterEveryExtractor() {
        for (ExtractorId id : ExtractorId.values()) {
            assertThat(registry.get(id)).as(id.label()).isNotNull();
            assertThat(registry.get(id).id()).isEqualTo(id);
        }
    }

    @Test
    void shouldResolveCalibrationToThreeDistinctExtractors() {
        ExtractorRef ref = ExtractorRef.parse("=cal_info_class");

        Set<ExtractorId> resolved = new HashSet<>();
        resolved.add(registry.resolve(ref, fileOf("digitalgain")).id());
        resolved.add(registry.resolve(ref, fileOf("gain")).id());
        resolved.add(registry.resolve(ref, fileOf("flaginput")).id());

        assertThat(resolved).containsExactlyInAnyOrder(
                ExtractorId.DIGITALGAIN_FILE, ExtractorId.CALIBRATION_GAIN_FILE, ExtractorId.FLAGINPUT_FILE);
    }

    @Test
    void shouldRejectCalibrationForUnknownAcqType() {
        ExtractorRef ref = ExtractorRef.parse("=cal_info_class");

        assertThatThrownBy(() -> registry.resolve(ref, fileOf("corr")))
                .isInstanceOf(CatalogLookupException.class)
                .hasMessageContaining("corr");
    }

    @Test
    void shouldResolveDirectReference() {
        Extractor e = registry.resolve(ExtractorRef.parse("CorrFileInfo"), fileOf("corr"));

        assertThat(e.id()).isEqualTo(ExtractorId.CORR_FILE);
        assertThat(e.readsContent()).isTrue();
        assertThat(e.filenameParser()).isPresent();
    }

    @Test
    void shouldRejectExtractorForWrongItemKind() {
        var acq = new OwningItem(ItemKind.ACQUISITION, 1L, "20220129T233553Z_chimetiming_corr", "corr");

        assertThatThrownBy(() -> registry.resolve(ExtractorRef.parse("CorrFileInfo"), acq))
                .isInstanceOf(CatalogLookupException.class);
    }

    @Test
    void shouldGiveDetectOnlyExtractorsNoContentParser() {
        assertThat(registry.get(ExtractorId.WEATHER_ACQ).readsContent()).isFalse();
        assertThat(registry.get(ExtractorId.WEATHER_FILE).readsContent()).isFalse();
        assertThat(registry.get(ExtractorId.RAWADC_ACQ).readsContent()).isFalse();
    }

    @Test
    void shouldRejectUnknownReferences() {
        assertThatThrownBy(() -> ExtractorRef.parse("NoSuchInfo"))
                .isInstanceOf(CatalogLookupException.class);
        assertThatThrownBy(() -> ExtractorRef.parse("=nope"))
                .isInstanceOf(CatalogLookupException.class);
        assertThatThrownBy(() -> ExtractorRef.parse(""))
                .isInstanceOf(CatalogLookupException.class);
    }

    @Test
    void shouldKeepStoredReferenceForm() {
        assertThat(ExtractorRef.parse("=cal_info_class").reference()).isEqualTo("=cal_info_class");
        assertThat(ExtractorRef.parse("HFBFileInfo").reference()).isEqualTo("HFBFileInfo");
    }
}

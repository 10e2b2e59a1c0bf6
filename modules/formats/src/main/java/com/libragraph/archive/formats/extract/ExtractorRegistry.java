package com.libragraph.archive.formats.extract;

import com.libragraph.archive.formats.extractors.AcqNameParser;
import com.libragraph.archive.formats.extractors.CalibrationFileExtractor;
import com.libragraph.archive.formats.extractors.CorrAcqExtractor;
import com.libragraph.archive.formats.extractors.CorrFileExtractor;
import com.libragraph.archive.formats.extractors.HfbAcqExtractor;
import com.libragraph.archive.formats.extractors.HfbFileExtractor;
import com.libragraph.archive.formats.extractors.RawadcAcqExtractor;
import com.libragraph.archive.formats.extractors.RawadcFileExtractor;
import com.libragraph.archive.formats.extractors.WeatherFileExtractor;
import com.libragraph.archive.types.CatalogLookupException;
import com.libragraph.archive.types.ExtractorId;
import com.libragraph.archive.types.ResolverId;
import jakarta.enterprise.context.ApplicationScoped;

import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;

/**
 * Binds every {@link ExtractorId} to its implementation and resolves
 * {@link ExtractorRef}s, including indirect ones, to a concrete {@link Extractor}.
 */
@ApplicationScoped
public class ExtractorRegistry {

    private final Map<ExtractorId, Extractor> extractors;

    public ExtractorRegistry() {
        Map<ExtractorId, Extractor> m = new EnumMap<>(ExtractorId.class);
        AcqNameParser acqName = new AcqNameParser();

        m.put(ExtractorId.CORR_ACQ, Extractor.of(ExtractorId.CORR_ACQ, new CorrAcqExtractor()));
        m.put(ExtractorId.CORR_FILE, Extractor.of(ExtractorId.CORR_FILE, new CorrFileExtractor()));
        m.put(ExtractorId.RAWADC_ACQ, Extractor.of(ExtractorId.RAWADC_ACQ, new RawadcAcqExtractor()));
        m.put(ExtractorId.RAWADC_FILE, Extractor.of(ExtractorId.RAWADC_FILE, new RawadcFileExtractor()));
        m.put(ExtractorId.WEATHER_ACQ, Extractor.of(ExtractorId.WEATHER_ACQ, acqName));
        m.put(ExtractorId.WEATHER_FILE, Extractor.of(ExtractorId.WEATHER_FILE, new WeatherFileExtractor()));
        m.put(ExtractorId.DIGITALGAIN_ACQ, Extractor.of(ExtractorId.DIGITALGAIN_ACQ, acqName));
        m.put(ExtractorId.DIGITALGAIN_FILE,
                Extractor.of(ExtractorId.DIGITALGAIN_FILE, new CalibrationFileExtractor()));
        m.put(ExtractorId.CALIBRATION_GAIN_ACQ, Extractor.of(ExtractorId.CALIBRATION_GAIN_ACQ, acqName));
        m.put(ExtractorId.CALIBRATION_GAIN_FILE,
                Extractor.of(ExtractorId.CALIBRATION_GAIN_FILE, new CalibrationFileExtractor()));
        m.put(ExtractorId.FLAGINPUT_ACQ, Extractor.of(ExtractorId.FLAGINPUT_ACQ, acqName));
        m.put(ExtractorId.FLAGINPUT_FILE,
                Extractor.of(ExtractorId.FLAGINPUT_FILE, new CalibrationFileExtractor()));
        m.put(ExtractorId.HFB_ACQ, Extractor.of(ExtractorId.HFB_ACQ, new HfbAcqExtractor()));
        m.put(ExtractorId.HFB_FILE, Extractor.of(ExtractorId.HFB_FILE, new HfbFileExtractor()));

        for (ExtractorId id : ExtractorId.values()) {
            if (!m.containsKey(id)) {
                throw new IllegalStateException("No implementation registered for " + id);
            }
        }
        this.extractors = Collections.unmodifiableMap(m);
    }

    public Extractor get(ExtractorId id) {
        return extractors.get(id);
    }

    /**
     * Resolves {@code ref} for {@code owner}.
     *
     * @throws CatalogLookupException if an indirect reference has no extractor for
     *                                the owner, or the result is for the wrong kind of item
     */
    public Extractor resolve(ExtractorRef ref, OwningItem owner) {
        ExtractorId id;
        if (ref instanceof ExtractorRef.Direct direct) {
            id = direct.extractor();
        } else if (ref instanceof ExtractorRef.Indirect indirect) {
            id = resolveIndirect(indirect.resolver(), owner);
        } else {
            throw new IllegalArgumentException("Unsupported extractor reference: " + ref);
        }

        if (id.kind() != owner.kind()) {
            throw new CatalogLookupException("Extractor " + id.label() + " is for "
                    + id.kind() + " items, not " + owner.kind());
        }
        return get(id);
    }

    static ExtractorId resolveIndirect(ResolverId resolver, OwningItem owner) {
        switch (resolver) {
            case CALIBRATION:
                return calibrationFor(owner.acqTypeName());
            default:
                throw new CatalogLookupException("Unhandled resolver: " + resolver);
        }
    }

    private static ExtractorId calibrationFor(String acqTypeName) {
        if ("digitalgain".equals(acqTypeName)) return ExtractorId.DIGITALGAIN_FILE;
        if ("gain".equals(acqTypeName)) return ExtractorId.CALIBRATION_GAIN_FILE;
        if ("flaginput".equals(acqTypeName)) return ExtractorId.FLAGINPUT_FILE;
        throw new CatalogLookupException("Unknown acquisition type for calibration file: " + acqTypeName);
    }
}

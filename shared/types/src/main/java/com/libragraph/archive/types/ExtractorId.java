package com.libragraph.archive.types;

import java.util.Optional;

/**
 * Closed set of metadata extractors. The label is the name stored in the
 * {@code info_class} column of the type tables.
 * <p>
 * Detect-only acquisition extractors validate the acquisition name but have no
 * info table, so they never persist anything.
 */
public enum ExtractorId {
    CORR_ACQ("CorrAcqInfo", ItemKind.ACQUISITION, InfoTable.CORR_ACQ),
    CORR_FILE("CorrFileInfo", ItemKind.FILE, InfoTable.CORR_FILE),
    RAWADC_ACQ("RawadcAcqInfo", ItemKind.ACQUISITION, InfoTable.RAWADC_ACQ),
    RAWADC_FILE("RawadcFileInfo", ItemKind.FILE, InfoTable.RAWADC_FILE),
    WEATHER_ACQ("WeatherAcqDetect", ItemKind.ACQUISITION, null),
    WEATHER_FILE("WeatherFileInfo", ItemKind.FILE, InfoTable.WEATHER_FILE),
    DIGITALGAIN_ACQ("DigitalGainAcqDetect", ItemKind.ACQUISITION, null),
    DIGITALGAIN_FILE("DigitalGainFileInfo", ItemKind.FILE, InfoTable.DIGITALGAIN_FILE),
    CALIBRATION_GAIN_ACQ("CalibrationGainAcqDetect", ItemKind.ACQUISITION, null),
    CALIBRATION_GAIN_FILE("CalibrationGainFileInfo", ItemKind.FILE, InfoTable.CALIBRATION_GAIN_FILE),
    FLAGINPUT_ACQ("FlagInputAcqDetect", ItemKind.ACQUISITION, null),
    FLAGINPUT_FILE("FlagInputFileInfo", ItemKind.FILE, InfoTable.FLAGINPUT_FILE),
    HFB_ACQ("HFBAcqInfo", ItemKind.ACQUISITION, InfoTable.HFB_ACQ),
    HFB_FILE("HFBFileInfo", ItemKind.FILE, InfoTable.HFB_FILE);

    private final String label;
    private final ItemKind kind;
    private final InfoTable table;

    ExtractorId(String label, ItemKind kind, InfoTable table) {
        this.label = label;
        this.kind = kind;
        this.table = table;
    }

    public String label() {
        return label;
    }

    public ItemKind kind() {
        return kind;
    }

    public Optional<InfoTable> table() {
        return Optional.ofNullable(table);
    }

    public static Optional<ExtractorId> find(String label) {
        for (ExtractorId e : values()) {
            if (e.label.equals(label)) return Optional.of(e);
        }
        return Optional.empty();
    }

    public static ExtractorId fromLabel(String label) {
        return find(label).orElseThrow(
                () -> new IllegalArgumentException("Unknown extractor: " + label));
    }
}

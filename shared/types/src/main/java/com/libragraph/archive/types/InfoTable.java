package com.libragraph.archive.types;

import java.util.List;
import java.util.Optional;

import static com.libragraph.archive.types.Column.doubleCol;
import static com.libragraph.archive.types.Column.intCol;
import static com.libragraph.archive.types.Column.stringCol;

/**
 * The metadata ("info") tables, one per concrete extractor that persists a record.
 * Column names here are the field names downstream consumers query on.
 */
public enum InfoTable {
    CORR_ACQ("corr_acq_info", ItemKind.ACQUISITION,
            doubleCol("integration"), intCol("nfreq"), intCol("nprod")),
    CORR_FILE("corr_file_info", ItemKind.FILE,
            doubleCol("start_time"), doubleCol("finish_time"),
            intCol("chunk_number"), intCol("freq_number")),
    RAWADC_ACQ("rawadc_acq_info", ItemKind.ACQUISITION,
            doubleCol("start_time")),
    RAWADC_FILE("rawadc_file_info", ItemKind.FILE,
            doubleCol("start_time"), doubleCol("finish_time")),
    DIGITALGAIN_FILE("digitalgain_file_info", ItemKind.FILE,
            doubleCol("start_time"), doubleCol("finish_time")),
    CALIBRATION_GAIN_FILE("calibration_gain_file_info", ItemKind.FILE,
            doubleCol("start_time"), doubleCol("finish_time")),
    FLAGINPUT_FILE("flaginput_file_info", ItemKind.FILE,
            doubleCol("start_time"), doubleCol("finish_time")),
    WEATHER_FILE("weather_file_info", ItemKind.FILE,
            doubleCol("start_time"), doubleCol("finish_time"), stringCol("date")),
    HFB_ACQ("hfb_acq_info", ItemKind.ACQUISITION,
            doubleCol("integration"), intCol("nfreq"), intCol("nsubfreq"), intCol("nbeam")),
    HFB_FILE("hfb_file_info", ItemKind.FILE,
            doubleCol("start_time"), doubleCol("finish_time"),
            intCol("chunk_number"), intCol("freq_number"));

    private final String tableName;
    private final ItemKind owner;
    private final List<Column> columns;

    InfoTable(String tableName, ItemKind owner, Column... columns) {
        this.tableName = tableName;
        this.owner = owner;
        this.columns = List.of(columns);
    }

    public String tableName() {
        return tableName;
    }

    public ItemKind owner() {
        return owner;
    }

    public List<Column> columns() {
        return columns;
    }

    public Optional<Column> column(String name) {
        for (Column c : columns) {
            if (c.name().equals(name)) return Optional.of(c);
        }
        return Optional.empty();
    }
}

package com.libragraph.archive.formats.extractors;

import com.libragraph.archive.formats.container.DataContainer;
import com.libragraph.archive.formats.extract.ExtractionException;
import com.libragraph.archive.util.Stats;

import java.util.Map;
import java.util.OptionalDouble;

/** Reads the {@code /index_map} axes shared by the correlator and HFB products. */
final class IndexMaps {

    static final String TIME = "/index_map/time";
    static final String FREQ = "/index_map/freq";
    static final String PROD = "/index_map/prod";
    static final String SUBFREQ = "/index_map/subfreq";
    static final String BEAM = "/index_map/beam";
    static final String UPDATE_TIME = "/index_map/update_time";

    private IndexMaps() {
    }

    /** The ctime column of the compound time index. */
    static double[] ctime(DataContainer container) {
        return container.readField(TIME, "ctime");
    }

    /** Median spacing of the time index; absent with fewer than two samples. */
    static OptionalDouble integration(DataContainer container) {
        return Stats.median(Stats.deltas(ctime(container)));
    }

    /** Puts start_time/finish_time as the first and last of {@code times}. */
    static void putSpan(Map<String, Object> fields, double[] times, String what)
            throws ExtractionException {
        if (times.length == 0) {
            throw new ExtractionException("Empty " + what);
        }
        fields.put("start_time", times[0]);
        fields.put("finish_time", times[times.length - 1]);
    }
}

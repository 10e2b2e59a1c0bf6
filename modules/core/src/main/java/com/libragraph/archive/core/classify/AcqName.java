package com.libragraph.archive.core.classify;

import com.libragraph.archive.util.AcqTimestamp;

import java.time.Instant;
import java.util.Optional;

/**
 * The three parts of an acquisition name, {@code TIMESTAMP_INST_ACQTYPE},
 * e.g. {@code 20220129T233553Z_chimetiming_corr}.
 */
public record AcqName(String name, Instant time, String instrument, String acqType) {

    /** Splits and checks the timestamp; instrument and type are not looked up here. */
    public static Optional<AcqName> parse(String name) {
        String[] parts = name.split("_", -1);
        if (parts.length != 3 || parts[1].isEmpty() || parts[2].isEmpty()) {
            return Optional.empty();
        }
        return AcqTimestamp.tryParse(parts[0])
                .map(time -> new AcqName(name, time, parts[1], parts[2]));
    }
}

package com.libragraph.archive.types;

import java.util.Optional;

/**
 * Indirect extractor references: a resolver picks the concrete extractor at use
 * time from the owning record. Stored in {@code info_class} with a leading
 * {@link #SIGIL}.
 */
public enum ResolverId {
    /** Calibration files; the extractor depends on the owning acquisition's type. */
    CALIBRATION("cal_info_class");

    public static final char SIGIL = '=';

    private final String label;

    ResolverId(String label) {
        this.label = label;
    }

    public String label() {
        return label;
    }

    public String reference() {
        return SIGIL + label;
    }

    public static Optional<ResolverId> find(String label) {
        for (ResolverId r : values()) {
            if (r.label.equals(label)) return Optional.of(r);
        }
        return Optional.empty();
    }
}

package com.libragraph.archive.types;

/**
 * Single-letter state of a file copy on a node, stored in the {@code has_file}
 * and {@code wants_file} columns. {@link #CORRUPT} is only valid for {@code has_file}.
 */
public enum CopyFlag {
    YES('Y'),
    NO('N'),
    MAYBE('M'),
    CORRUPT('X');

    private final char code;

    CopyFlag(char code) {
        this.code = code;
    }

    public String code() {
        return String.valueOf(code);
    }

    public static CopyFlag fromCode(String code) {
        if (code != null && code.length() == 1) {
            for (CopyFlag flag : values()) {
                if (flag.code == code.charAt(0)) {
                    return flag;
                }
            }
        }
        throw new IllegalArgumentException("Unknown copy flag: " + code);
    }
}

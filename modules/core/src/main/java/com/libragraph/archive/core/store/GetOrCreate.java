package com.libragraph.archive.core.store;

/**
 * Result of a get-or-create: the row, and whether this call inserted it.
 */
public record GetOrCreate<T>(T record, boolean created) {

    public static <T> GetOrCreate<T> found(T record) {
        return new GetOrCreate<>(record, false);
    }

    public static <T> GetOrCreate<T> created(T record) {
        return new GetOrCreate<>(record, true);
    }
}

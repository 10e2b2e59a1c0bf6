package com.libragraph.archive.core.ingest;

import java.io.IOException;
import java.io.PrintWriter;
import java.io.StringWriter;
import java.io.UncheckedIOException;

public record ImportError(
        String message,
        String exceptionType,
        String stackTrace,
        boolean retryable
) {
    public static ImportError from(Throwable t) {
        var sw = new StringWriter();
        t.printStackTrace(new PrintWriter(sw));

        // Only I/O failures are worth another attempt; format errors will fail the same way.
        Throwable cause = t.getCause();
        boolean retryable = t instanceof IOException
                || t instanceof UncheckedIOException
                || cause instanceof IOException;

        return new ImportError(
                t.getMessage(),
                t.getClass().getName(),
                sw.toString(),
                retryable
        );
    }
}

package com.libragraph.archive.formats.container;

/**
 * The container could not be opened, or lacks a dataset of the expected shape.
 */
public class ContainerFormatException extends RuntimeException {

    public ContainerFormatException(String message) {
        super(message);
    }

    public ContainerFormatException(String message, Throwable cause) {
        super(message, cause);
    }
}

package com.libragraph.archive.core.catalog;

/** An instrument that takes data; the middle part of an acquisition name. */
public record Instrument(int id, String name, String notes) {}

package com.libragraph.archive.types;

import java.util.Objects;

public record Column(String name, ColumnType type) {
    public Column {
        Objects.requireNonNull(name, "name");
        Objects.requireNonNull(type, "type");
    }

    public static Column doubleCol(String name) {
        return new Column(name, ColumnType.DOUBLE);
    }

    public static Column intCol(String name) {
        return new Column(name, ColumnType.INTEGER);
    }

    public static Column stringCol(String name) {
        return new Column(name, ColumnType.STRING);
    }
}

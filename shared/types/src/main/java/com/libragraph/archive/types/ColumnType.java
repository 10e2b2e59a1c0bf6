package com.libragraph.archive.types;

/**
 * Scalar column types used by info tables.
 * <p>
 * {@link #coerce(Object)} converts the loosely typed values produced by filename
 * and content parsing (numbers of any width, digit strings from regex groups)
 * into the exact Java type stored in the column.
 */
public enum ColumnType {
    DOUBLE,
    INTEGER,
    STRING;

    public Object coerce(Object value) {
        if (value == null) {
            return null;
        }
        switch (this) {
            case DOUBLE:
                if (value instanceof Number n) {
                    return n.doubleValue();
                }
                return Double.parseDouble(value.toString().trim());
            case INTEGER:
                if (value instanceof Number n) {
                    double d = n.doubleValue();
                    if (d != Math.rint(d)) {
                        throw new IllegalArgumentException("Not an integer: " + value);
                    }
                    // BigInteger.longValue() wraps; the cast saturates, so toIntExact sees the overflow
                    long whole = n instanceof Long ? n.longValue() : (long) d;
                    try {
                        return Math.toIntExact(whole);
                    } catch (ArithmeticException e) {
                        throw new IllegalArgumentException("Integer out of range: " + value, e);
                    }
                }
                return Integer.parseInt(value.toString().trim());
            case STRING:
                return value.toString();
            default:
                throw new IllegalStateException("Unhandled column type: " + this);
        }
    }
}

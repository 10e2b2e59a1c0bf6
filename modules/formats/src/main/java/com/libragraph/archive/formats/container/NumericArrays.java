package com.libragraph.archive.formats.container;

import java.lang.reflect.Array;

/**
 * Converts the primitive arrays that HDF5 readers hand back (byte[] through
 * double[], boxed or not) into {@code double[]}.
 */
final class NumericArrays {

    private NumericArrays() {}

    static double[] toDoubles(Object data, String what) {
        if (data instanceof double[] d) {
            return d.clone();
        }
        if (data == null || !data.getClass().isArray()) {
            throw new ContainerFormatException(what + " is not an array");
        }
        int n = Array.getLength(data);
        double[] out = new double[n];
        for (int i = 0; i < n; i++) {
            Object v = Array.get(data, i);
            if (!(v instanceof Number num)) {
                throw new ContainerFormatException(what + " is not numeric");
            }
            out[i] = num.doubleValue();
        }
        return out;
    }
}

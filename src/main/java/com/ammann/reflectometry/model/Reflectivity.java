/* (C)2026 */
package com.ammann.reflectometry.model;

import java.util.Arrays;

/**
 * Reflectivity values and their uncertainties. Instances are never modified; every
 * operation returns new arrays.
 */
public record Reflectivity(double[] r, double[] dr) {

    public Reflectivity {
        if (r.length != dr.length) {
            throw new IllegalArgumentException(
                    "Reflectivity and uncertainty differ in length: " + r.length + " vs " + dr.length);
        }
    }

    /** Divides values and uncertainties by the same constant. */
    public Reflectivity dividedBy(double divisor) {
        return new Reflectivity(
                Arrays.stream(r).map(v -> v / divisor).toArray(),
                Arrays.stream(dr).map(v -> v / divisor).toArray());
    }

    /** Largest reflectivity value, {@code NaN} for an empty curve. */
    public double max() {
        return Arrays.stream(r).max().orElse(Double.NaN);
    }
}

/* (C)2026 */
package com.ammann.reflectometry.model;

/**
 * Sample description and geometry. Dimensions are given in {@code units}, millimetres
 * unless stated otherwise.
 */
public record SampleData(
        String name,
        String category,
        String composition,
        String description,
        double length,
        double thickness,
        double height,
        String units) {

    public SampleData {
        units = units == null ? "mm" : units;
    }

    /** Sample known only by name, without geometry. */
    public static SampleData named(String name) {
        return new SampleData(name, null, null, null, 0, 0, 0, "mm");
    }
}

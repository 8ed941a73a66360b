/* (C)2026 */
package com.ammann.reflectometry.model;

/**
 * Two-slit collimation geometry. Positions are signed distances from the sample.
 */
public record SlitData(
        double slit1Width,
        double slit2Width,
        double slit1Position,
        double slit2Position,
        String units) {

    public SlitData {
        if (slit1Position == slit2Position) {
            throw new IllegalArgumentException("Slit positions must differ, both are " + slit1Position);
        }
        units = units == null ? "mm" : units;
    }

    public SlitData(double slit1Width, double slit2Width, double slit1Position, double slit2Position) {
        this(slit1Width, slit2Width, slit1Position, slit2Position, "mm");
    }

    /** Distance between the two slits. */
    public double separation() {
        return Math.abs(slit1Position - slit2Position);
    }
}

/* (C)2026 */
package com.ammann.reflectometry.model;

public record PolarizationEfficiency(
        double polarizer, double analyser, double spinFlipper1, double spinFlipper2) {

    /** Perfect devices, the value reported when no calibration is recorded. */
    public static PolarizationEfficiency ideal() {
        return new PolarizationEfficiency(1.0, 1.0, 1.0, 1.0);
    }
}

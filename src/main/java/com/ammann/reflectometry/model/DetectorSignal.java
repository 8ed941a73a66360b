/* (C)2026 */
package com.ammann.reflectometry.model;

/**
 * One-dimensional signal and background estimate extracted from a detector, with their
 * Poisson uncertainties.
 */
public record DetectorSignal(
        double[] signal, double[] signalError, double[] background, double[] backgroundError) {

    /** Signal without a background estimate. */
    public static DetectorSignal withoutBackground(double[] signal, double[] signalError) {
        return new DetectorSignal(
                signal, signalError, new double[signal.length], new double[signal.length]);
    }
}

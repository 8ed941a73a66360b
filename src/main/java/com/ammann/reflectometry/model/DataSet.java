/* (C)2026 */
package com.ammann.reflectometry.model;

import com.ammann.reflectometry.enumeration.PolarizationState;

/**
 * Raw working state of one polarization channel. All arrays hold one value per scan point.
 *
 * @param header provenance shared with the other channels of the same file
 * @param measurement channel instrument settings and source files
 * @param theta incident angle in degrees
 * @param time exposure time
 * @param monitor monitor counts
 * @param counts detector signal
 * @param countsError uncertainty of the detector signal
 * @param background background estimate, zero when none is extracted
 * @param backgroundError uncertainty of the background estimate
 */
public record DataSet(
        DataSetMetadata header,
        MeasurementData measurement,
        double[] theta,
        double[] time,
        double[] monitor,
        double[] counts,
        double[] countsError,
        double[] background,
        double[] backgroundError) {

    public DataSet {
        int points = theta.length;
        if (time.length != points
                || monitor.length != points
                || counts.length != points
                || countsError.length != points
                || background.length != points
                || backgroundError.length != points) {
            throw new IllegalArgumentException(
                    String.format(
                            "Channel arrays differ in length: theta=%d time=%d monitor=%d counts=%d"
                                    + " countsError=%d background=%d backgroundError=%d",
                            points, time.length, monitor.length, counts.length,
                            countsError.length, background.length, backgroundError.length));
        }
    }

    public int points() {
        return theta.length;
    }

    public InstrumentSettings instrumentSettings() {
        return measurement.instrumentSettings();
    }

    public PolarizationState polarization() {
        return measurement.instrumentSettings().polarization();
    }
}

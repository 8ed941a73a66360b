/* (C)2026 */
package com.ammann.reflectometry.model;

import com.ammann.reflectometry.enumeration.PolarizationState;

/**
 * Instrument settings of one polarization channel.
 *
 * @param incidentAngleMin smallest incident angle of the scan
 * @param incidentAngleMax largest incident angle of the scan
 * @param angleUnit unit of the incident angle, normally {@code deg}
 * @param wavelength monochromator wavelength
 * @param wavelengthUnit unit of the wavelength, normally {@code A}
 * @param slitConfiguration collimation geometry
 * @param polarization channel the settings belong to
 * @param polarizationEfficiency efficiencies of the spin devices
 */
public record InstrumentSettings(
        double incidentAngleMin,
        double incidentAngleMax,
        String angleUnit,
        double wavelength,
        String wavelengthUnit,
        SlitData slitConfiguration,
        PolarizationState polarization,
        PolarizationEfficiency polarizationEfficiency) {}

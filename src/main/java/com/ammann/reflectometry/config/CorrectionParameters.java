/* (C)2026 */
package com.ammann.reflectometry.config;

/**
 * Complete, immutable configuration of one reduction run.
 *
 * @param dataSource detector and signal region
 * @param normalisation time, monitor and intensity normalisation
 * @param reduction footprint, absorption and polarisation corrections
 * @param background background subtraction
 * @param wavelengthResolution relative wavelength spread dLambda/Lambda used for dQ
 * @param programCall free-form record of how the run was invoked
 */
public record CorrectionParameters(
        DataSourceConfig dataSource,
        NormalisationConfig normalisation,
        ReductionConfig reduction,
        BackgroundCorrection background,
        double wavelengthResolution,
        String programCall) {

    public static final double DEFAULT_WAVELENGTH_RESOLUTION = 0.05;

    public CorrectionParameters {
        if (dataSource == null) {
            throw new IllegalArgumentException("Data source must be set");
        }
        normalisation =
                normalisation == null
                        ? new NormalisationConfig(true, true, new IntensityNormalisation.Disabled())
                        : normalisation;
        reduction =
                reduction == null
                        ? new ReductionConfig(false, new AbsorptionCoefficient.Disabled(), false)
                        : reduction;
        background = background == null ? new BackgroundCorrection.Disabled() : background;
        programCall = programCall == null ? "" : programCall;
    }

    public boolean backgroundEnabled() {
        return !(background instanceof BackgroundCorrection.Disabled);
    }

    public CorrectionParameters withProgramCall(String call) {
        return new CorrectionParameters(
                dataSource, normalisation, reduction, background, wavelengthResolution, call);
    }
}

/* (C)2026 */
package com.ammann.reflectometry.exception;

/**
 * Exception indicating that a correction exposed by the configuration has no
 * implementation.
 *
 * <p>Mapped to HTTP 501 (Not Implemented) by {@link GlobalExceptionHandler}.
 */
public class UnsupportedCorrectionException extends ApiException {

    private final String correction;

    public UnsupportedCorrectionException(String correction, String message) {
        super(message);
        this.correction = correction;
    }

    public static UnsupportedCorrectionException polarisationCorrection() {
        return new UnsupportedCorrectionException(
                "polarisation", "Polarisation efficiency correction is not implemented");
    }

    public static UnsupportedCorrectionException backgroundFromFile(String file) {
        return new UnsupportedCorrectionException(
                "background-file",
                String.format("Background correction from file '%s' is not implemented", file));
    }

    public static UnsupportedCorrectionException intensityFromDetectorRegion() {
        return new UnsupportedCorrectionException(
                "intensity-region", "Intensity normalisation from a detector region is not implemented");
    }

    /** Short identifier of the unsupported correction. */
    public String getCorrection() {
        return correction;
    }
}

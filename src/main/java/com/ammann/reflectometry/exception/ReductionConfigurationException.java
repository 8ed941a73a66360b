/* (C)2026 */
package com.ammann.reflectometry.exception;

/**
 * Exception indicating that the correction parameters cannot be applied to the
 * measurement at hand.
 *
 * <p>Raised before any reduction step runs. Mapped to HTTP 400 (Bad Request) by
 * {@link GlobalExceptionHandler}. Provides factory methods for each configuration error.
 */
public class ReductionConfigurationException extends ApiException {

    public ReductionConfigurationException(String message) {
        super(message, null);
    }

    public ReductionConfigurationException(String message, Throwable cause) {
        super(message, cause);
    }

    /**
     * Creates exception for a detector the measurement does not contain.
     */
    public static ReductionConfigurationException unknownDetector(String detector, Iterable<String> available) {
        return new ReductionConfigurationException(
                String.format("Unknown detector '%s', available detectors: %s",
                        detector, String.join(", ", available)));
    }

    /**
     * Creates exception for an area detector selected without a signal region.
     */
    public static ReductionConfigurationException missingRegion(String detector) {
        return new ReductionConfigurationException(
                String.format("Detector '%s' requires a signal region", detector));
    }

    /**
     * Creates exception for region background subtraction without a background region.
     */
    public static ReductionConfigurationException missingBackgroundRegion() {
        return new ReductionConfigurationException(
                "Background region must be set for detector region background correction");
    }

    /**
     * Creates exception for region background subtraction requested on the area detector
     * that also delivers the signal.
     */
    public static ReductionConfigurationException regionBackgroundOnAreaDetector(String detector) {
        return new ReductionConfigurationException(
                String.format("Detector region background correction cannot be combined with signal detector '%s'",
                        detector));
    }

    /**
     * Creates exception for an invalid configuration value.
     */
    public static ReductionConfigurationException invalidParameter(String paramName, Object value, String expected) {
        return new ReductionConfigurationException(
                String.format("Invalid parameter '%s': got '%s', expected %s",
                        paramName, value, expected));
    }
}

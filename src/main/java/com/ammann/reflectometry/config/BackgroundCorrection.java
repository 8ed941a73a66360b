/* (C)2026 */
package com.ammann.reflectometry.config;

import com.ammann.reflectometry.model.RegionOfInterest;

/**
 * Background subtraction mode.
 */
public sealed interface BackgroundCorrection
        permits BackgroundCorrection.Disabled,
                BackgroundCorrection.ConstantValue,
                BackgroundCorrection.DetectorRegion,
                BackgroundCorrection.ExternalFile {

    record Disabled() implements BackgroundCorrection {}

    /** Subtract a fixed value from R; the uncertainty is left unchanged. */
    record ConstantValue(double value) implements BackgroundCorrection {}

    /** Subtract the mean of a detector region, normalised like the signal. */
    record DetectorRegion(RegionOfInterest region) implements BackgroundCorrection {}

    /** Subtract a background measured in a separate file. Not supported. */
    record ExternalFile(String file) implements BackgroundCorrection {}
}

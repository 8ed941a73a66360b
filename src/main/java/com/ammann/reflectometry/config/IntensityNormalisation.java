/* (C)2026 */
package com.ammann.reflectometry.config;

import com.ammann.reflectometry.model.RegionOfInterest;

/**
 * How the reduced curve is scaled after background subtraction.
 */
public sealed interface IntensityNormalisation
        permits IntensityNormalisation.Disabled,
                IntensityNormalisation.ConstantValue,
                IntensityNormalisation.DatasetMaximum,
                IntensityNormalisation.GlobalMaximum,
                IntensityNormalisation.DetectorRegion {

    record Disabled() implements IntensityNormalisation {}

    /** Divide by a fixed value. */
    record ConstantValue(double value) implements IntensityNormalisation {}

    /** Divide each channel by its own maximum. */
    record DatasetMaximum() implements IntensityNormalisation {}

    /** Divide every channel by the maximum over all channels of the file. */
    record GlobalMaximum() implements IntensityNormalisation {}

    /** Derive the scale from one scan point inside a detector region. Not supported. */
    record DetectorRegion(int pointIndex, RegionOfInterest region) implements IntensityNormalisation {}
}

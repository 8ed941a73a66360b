/* (C)2026 */
package com.ammann.reflectometry.enumeration;

/**
 * Configuration value selecting the intensity normalisation.
 */
public enum IntensityNormalisationMode {
    NONE,
    CONSTANT,
    DATASET_MAXIMUM,
    GLOBAL_MAXIMUM,
    DETECTOR_REGION
}

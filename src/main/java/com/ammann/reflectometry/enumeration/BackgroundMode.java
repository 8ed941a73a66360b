/* (C)2026 */
package com.ammann.reflectometry.enumeration;

/**
 * Configuration value selecting the background subtraction.
 */
public enum BackgroundMode {
    NONE,
    CONSTANT,
    DETECTOR_REGION,
    FILE
}

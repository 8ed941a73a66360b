/* (C)2026 */
package com.ammann.reflectometry.enumeration;

/**
 * Configuration value selecting where the absorption coefficient comes from.
 */
public enum AbsorptionMode {
    NONE,
    EXPLICIT,
    MATERIAL
}

/* (C)2026 */
package com.ammann.reflectometry.config;

import com.ammann.reflectometry.enumeration.AbsorptionMaterial;

/**
 * Source of the linear absorption coefficient, or no absorption correction at all.
 */
public sealed interface AbsorptionCoefficient
        permits AbsorptionCoefficient.Disabled,
                AbsorptionCoefficient.ExplicitValue,
                AbsorptionCoefficient.Tabulated {

    /** Coefficient in 1/(mm*Angstrom). */
    double mu();

    record Disabled() implements AbsorptionCoefficient {
        @Override
        public double mu() {
            return 0.0;
        }
    }

    record ExplicitValue(double mu) implements AbsorptionCoefficient {}

    record Tabulated(AbsorptionMaterial material) implements AbsorptionCoefficient {
        @Override
        public double mu() {
            return material.getMu();
        }
    }
}

/* (C)2026 */
package com.ammann.reflectometry.enumeration;

/**
 * Linear absorption coefficients of common substrates, in 1/(mm*Angstrom).
 */
public enum AbsorptionMaterial
{
    GLASS("glass", 0.0001667),
    SI("Si", 0.0000556),
    SIO2("SiO2", 0.0000278),
    AL2O3("Al2O3", 0.0000278);

    private final String label;
    private final double mu;

    AbsorptionMaterial(String label, double mu) {
        this.label = label;
        this.mu = mu;
    }

    public String getLabel() { return label; }

    public double getMu() { return mu; }
}

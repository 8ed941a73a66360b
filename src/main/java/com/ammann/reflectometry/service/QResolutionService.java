/* (C)2026 */
package com.ammann.reflectometry.service;

import com.ammann.reflectometry.model.MomentumTransfer;
import com.ammann.reflectometry.model.SlitData;
import jakarta.enterprise.context.ApplicationScoped;

/**
 * Converts incident angle and wavelength into momentum transfer and its resolution.
 */
@ApplicationScoped
public class QResolutionService
{

    /**
     * Calculates {@code Q = 4 pi / lambda * sin(theta)}.
     *
     * @param angleDeg   incident angle in degrees
     * @param wavelength wavelength in Angstrom
     * @return momentum transfer in 1/Angstrom
     */
    public double momentumTransfer(double angleDeg, double wavelength)
    {
        return 4 * Math.PI / wavelength * Math.sin(Math.toRadians(angleDeg));
    }

    /**
     * Angular divergence {@code (S1 + S2) / (2 * L12)} in radians.
     */
    public double angularDivergence(SlitData slits)
    {
        return (slits.slit1Width() + slits.slit2Width()) / (2 * slits.separation());
    }

    /**
     * Relative Q resolution {@code sqrt((dLambda/Lambda)^2 + (dTheta / tan(theta))^2)}.
     *
     * <p>Diverges for theta approaching zero.
     */
    public double relativeResolution(double angleDeg, SlitData slits, double wavelengthResolution)
    {
        double relativeAngular = angularDivergence(slits) / Math.tan(Math.toRadians(angleDeg));
        return Math.sqrt(wavelengthResolution * wavelengthResolution + relativeAngular * relativeAngular);
    }

    /**
     * Calculates Q and dQ for every incident angle of a scan.
     *
     * @param anglesDeg            incident angles in degrees
     * @param wavelength           wavelength in Angstrom
     * @param slits                slit geometry defining the angular divergence
     * @param wavelengthResolution relative wavelength spread dLambda/Lambda
     * @return Q and dQ in 1/Angstrom
     */
    public MomentumTransfer calculate(double[] anglesDeg, double wavelength, SlitData slits,
                                      double wavelengthResolution)
    {
        double[] q = new double[anglesDeg.length];
        double[] dq = new double[anglesDeg.length];
        for (int i = 0; i < anglesDeg.length; i++) {
            q[i] = momentumTransfer(anglesDeg[i], wavelength);
            dq[i] = q[i] * relativeResolution(anglesDeg[i], slits, wavelengthResolution);
        }
        return new MomentumTransfer(q, dq);
    }
}

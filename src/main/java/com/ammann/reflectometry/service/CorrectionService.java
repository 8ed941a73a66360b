/* (C)2026 */
package com.ammann.reflectometry.service;

import com.ammann.reflectometry.model.SampleData;
import com.ammann.reflectometry.model.SlitData;
import jakarta.enterprise.context.ApplicationScoped;
import org.jboss.logging.Logger;

import java.util.Arrays;

/**
 * Geometric and absorption correction factors for angle-dispersive reflectometry.
 *
 * <p>Both corrections are evaluated point by point on the incident angle array and
 * return dimensionless factors that the reduction multiplies into the counts:
 * <ul>
 *   <li>footprint correction for a sample shorter than the beam footprint, using a
 *   trapezoidal beam profile defined by two slits</li>
 *   <li>absorption correction {@code exp(-mu * lambda * path)} for the path through
 *   the sample</li>
 * </ul>
 */
@ApplicationScoped
public class CorrectionService
{

    private static final Logger LOG = Logger.getLogger(CorrectionService.class);

    // Lower bound for sin and cos in the absorption path length
    static final double MIN_TRIG_VALUE = 1e-6;

    /**
     * Calculates the footprint correction for a two-slit collimated beam.
     *
     * <p>The beam profile is a trapezoid: a flat centre of width {@code c} and linearly
     * falling edges reaching a total width {@code b}. Below {@code theta2 = asin(c / L)}
     * the illuminated fraction grows linearly with the angle, between {@code theta2} and
     * {@code theta3 = asin(b / L)} it follows the quadratic edge of the trapezoid, and
     * above {@code theta3} the whole beam hits the sample.
     *
     * <p>Geometries for which the thresholds are not finite, not positive or not
     * increasing describe no physical beam; no correction is applied and a warning is
     * logged.
     *
     * @param anglesDeg    incident angles in degrees
     * @param slits        slit widths and distances from the sample
     * @param sampleLength sample length in the slit units
     * @return inverse of the illuminated fraction for every angle, always {@code >= 1}
     */
    public double[] footprintCorrection(double[] anglesDeg, SlitData slits, double sampleLength)
    {
        double s1 = slits.slit1Width();
        double s2 = slits.slit2Width();
        double l1 = Math.abs(slits.slit1Position());
        double l2 = Math.abs(slits.slit2Position());

        double beamCenter = s2 - (s1 - s2) * l2 / (l1 + l2);
        double beamSize = (s1 + s2) * (l1 + l2) / (l1 - l2) - s1;

        double theta2 = Math.asin(beamCenter / sampleLength);
        double theta3 = Math.asin(beamSize / sampleLength);

        if (!Double.isFinite(theta2) || !Double.isFinite(theta3) || theta2 <= 0 || theta3 <= theta2) {
            LOG.warnf("Degenerate footprint geometry (centre=%.4f, size=%.4f, sample=%.4f), skipping correction",
                    beamCenter, beamSize, sampleLength);
            double[] ones = new double[anglesDeg.length];
            Arrays.fill(ones, 1.0);
            return ones;
        }

        double fullBeam = beamCenter + (beamSize - beamCenter) / 2.0;
        double scaleOuter = (beamSize - beamCenter) / 2.0 / fullBeam;
        double edgeWidth = theta3 - theta2;

        double[] correction = new double[anglesDeg.length];
        for (int i = 0; i < anglesDeg.length; i++) {
            double theta = Math.toRadians(anglesDeg[i]);
            double illuminated;
            if (theta >= theta3) {
                illuminated = 1.0;
            } else if (theta < theta2) {
                illuminated = (1.0 - scaleOuter) * theta / theta2;
            } else {
                double edge = (theta - theta3) / edgeWidth;
                illuminated = (1.0 - scaleOuter) + (1.0 - edge * edge) * scaleOuter;
            }
            correction[i] = 1.0 / illuminated;
        }

        LOG.debugf("Footprint thresholds: theta2=%.4f deg, theta3=%.4f deg",
                Math.toDegrees(theta2), Math.toDegrees(theta3));

        return correction;
    }

    /**
     * Calculates the attenuation of the beam along its path through the sample.
     *
     * <p>Below the critical angle {@code atan(2 * thickness / length)} the beam crosses
     * the full sample length, {@code length / cos(theta)}; above it the beam enters and
     * leaves through the surface, {@code 2 * thickness / sin(theta)}. Sine and cosine are
     * clamped to at least {@value #MIN_TRIG_VALUE}.
     *
     * @param anglesDeg  incident angles in degrees
     * @param wavelength wavelength in Angstrom
     * @param mu         linear absorption coefficient in 1/(mm*Angstrom)
     * @param sample     sample with length and thickness in millimetres
     * @return attenuation factor in (0, 1] for every angle
     */
    public double[] absorptionCorrection(double[] anglesDeg, double wavelength, double mu, SampleData sample)
    {
        double criticalAngle = Math.atan(sample.thickness() / sample.length() * 2);

        double[] correction = new double[anglesDeg.length];
        for (int i = 0; i < anglesDeg.length; i++) {
            double theta = Math.toRadians(anglesDeg[i]);
            double sin = Math.max(Math.sin(theta), MIN_TRIG_VALUE);
            double cos = Math.max(Math.cos(theta), MIN_TRIG_VALUE);
            double pathLength = theta < criticalAngle
                    ? sample.length() / cos
                    : 2 * sample.thickness() / sin;
            correction[i] = Math.exp(-mu * wavelength * pathLength);
        }

        LOG.debugf("Absorption correction with mu=%.3e, lambda=%.3f, critical angle=%.4f deg",
                mu, wavelength, Math.toDegrees(criticalAngle));

        return correction;
    }
}

/* (C)2026 */
package com.ammann.reflectometry.service;

import com.ammann.reflectometry.config.BackgroundCorrection;
import com.ammann.reflectometry.config.CorrectionParameters;
import com.ammann.reflectometry.exception.ReductionConfigurationException;
import com.ammann.reflectometry.model.DetectorCounts;
import com.ammann.reflectometry.model.DetectorSignal;
import com.ammann.reflectometry.model.RegionOfInterest;
import jakarta.enterprise.context.ApplicationScoped;
import org.jboss.logging.Logger;

/**
 * Reduces detector counts to a one-dimensional signal with Poisson uncertainty.
 *
 * <p>A point detector is used as is, with uncertainty {@code sqrt(counts)}. An area
 * detector is averaged over the signal region, {@code sum / pixels} with uncertainty
 * {@code sqrt(sum) / pixels}. A background region on the area detector is averaged the
 * same way, leaving out every pixel that also belongs to the signal region.
 */
@ApplicationScoped
public class DetectorSignalExtractor {

    private static final Logger LOG = Logger.getLogger(DetectorSignalExtractor.class);

    /**
     * Extracts signal and background for one channel.
     *
     * @param counts     raw detector counts of the channel
     * @param parameters correction parameters naming the regions
     * @return extracted signal
     */
    public DetectorSignal extract(DetectorCounts counts, CorrectionParameters parameters) {
        if (counts instanceof DetectorCounts.PointCounts point) {
            double[] error = new double[point.counts().length];
            for (int i = 0; i < error.length; i++) {
                error[i] = Math.sqrt(point.counts()[i]);
            }
            return DetectorSignal.withoutBackground(point.counts(), error);
        }

        DetectorCounts.AreaCounts area = (DetectorCounts.AreaCounts) counts;
        RegionOfInterest signalRegion = parameters.dataSource().region();
        if (signalRegion == null) {
            throw ReductionConfigurationException.missingRegion(parameters.dataSource().detector());
        }
        RegionAverage signal = regionAverage(area.frames(), signalRegion, null);

        if (parameters.background() instanceof BackgroundCorrection.DetectorRegion background
                && background.region() != null) {
            RegionOfInterest excluded = signalRegion.overlaps(background.region()) ? signalRegion : null;
            if (excluded != null) {
                LOG.debugf("Background region %s overlaps signal region %s, excluding shared pixels",
                        background.region(), signalRegion);
            }
            RegionAverage estimate = regionAverage(area.frames(), background.region(), excluded);
            return new DetectorSignal(signal.mean(), signal.error(), estimate.mean(), estimate.error());
        }
        return DetectorSignal.withoutBackground(signal.mean(), signal.error());
    }

    /**
     * Averages every frame over a region.
     *
     * @param frames   detector frames indexed {@code [point][y][x]}
     * @param region   region to average
     * @param excluded region whose pixels are left out, or {@code null}
     * @return per-point mean and its Poisson uncertainty
     * @throws ReductionConfigurationException if no pixel remains or the region exceeds a frame
     */
    public RegionAverage regionAverage(double[][][] frames, RegionOfInterest region, RegionOfInterest excluded) {
        double[] mean = new double[frames.length];
        double[] error = new double[frames.length];
        for (int point = 0; point < frames.length; point++) {
            double[][] frame = frames[point];
            if (region.yMax() >= frame.length || region.xMax() >= frame[region.yMax()].length) {
                throw new ReductionConfigurationException(
                        String.format("Region %s exceeds detector frame of %d x %d pixels",
                                region, frame.length, frame.length == 0 ? 0 : frame[0].length));
            }
            double sum = 0;
            int pixels = 0;
            for (int y = region.yMin(); y <= region.yMax(); y++) {
                for (int x = region.xMin(); x <= region.xMax(); x++) {
                    if (excluded != null && excluded.contains(y, x)) {
                        continue;
                    }
                    sum += frame[y][x];
                    pixels++;
                }
            }
            if (pixels == 0) {
                throw new ReductionConfigurationException(
                        String.format("Region %s lies entirely inside excluded region %s", region, excluded));
            }
            mean[point] = sum / pixels;
            error[point] = Math.sqrt(sum) / pixels;
        }
        return new RegionAverage(mean, error);
    }

    /**
     * Region mean per scan point and its uncertainty.
     */
    public record RegionAverage(double[] mean, double[] error) {}
}

/* (C)2026 */
package com.ammann.reflectometry.service;

import com.ammann.reflectometry.config.BackgroundCorrection;
import com.ammann.reflectometry.exception.ReductionConfigurationException;
import com.ammann.reflectometry.model.DetectorCounts;
import com.ammann.reflectometry.model.DetectorSignal;
import com.ammann.reflectometry.model.RegionOfInterest;
import com.ammann.reflectometry.support.TestDataFactory;
import org.junit.jupiter.api.Test;

import java.util.Arrays;

import static org.assertj.core.api.Assertions.*;

class DetectorSignalExtractorTest
{

    private final DetectorSignalExtractor extractor = new DetectorSignalExtractor();

    @Test
    void pointDetectorUsesPoissonUncertainty()
    {
        DetectorSignal signal = extractor.extract(
                new DetectorCounts.PointCounts(new double[] {100, 25, 0}), TestDataFactory.monitorOnly());

        assertThat(signal.signal()).containsExactly(100, 25, 0);
        assertThat(signal.signalError()).containsExactly(10, 5, 0);
        assertThat(signal.background()).containsExactly(0, 0, 0);
        assertThat(signal.backgroundError()).containsExactly(0, 0, 0);
    }

    @Test
    void areaDetectorAveragesSignalRegion()
    {
        double[][][] frames = frames(2, 8, 8, 4.0);
        RegionOfInterest region = new RegionOfInterest(2, 3, 2, 3);

        DetectorSignal signal = extractor.extract(
                new DetectorCounts.AreaCounts(frames),
                TestDataFactory.areaDetector(region, new BackgroundCorrection.Disabled()));

        // sum 16 over 4 pixels
        assertThat(signal.signal()).containsExactly(4.0, 4.0);
        assertThat(signal.signalError()).containsExactly(1.0, 1.0);
    }

    @Test
    void areaDetectorWithoutRegionIsRejected()
    {
        assertThatThrownBy(() -> extractor.extract(
                new DetectorCounts.AreaCounts(frames(1, 4, 4, 1.0)),
                TestDataFactory.areaDetector(null, new BackgroundCorrection.Disabled())))
                .isInstanceOf(ReductionConfigurationException.class);
    }

    @Test
    void disjointBackgroundRegionIsAveragedAsIs()
    {
        double[][][] frames = frames(1, 10, 10, 1.0);
        frames[0][8][0] = 9.0;
        RegionOfInterest signalRegion = new RegionOfInterest(0, 1, 0, 1);
        RegionOfInterest backgroundRegion = new RegionOfInterest(8, 9, 0, 1);

        DetectorSignal signal = extractor.extract(
                new DetectorCounts.AreaCounts(frames),
                TestDataFactory.areaDetector(signalRegion, new BackgroundCorrection.DetectorRegion(backgroundRegion)));

        assertThat(signal.background()[0]).isCloseTo(12.0 / 4, within(1e-12));
        assertThat(signal.backgroundError()[0]).isCloseTo(Math.sqrt(12.0) / 4, within(1e-12));
    }

    @Test
    void overlappingBackgroundExcludesSignalPixels()
    {
        // signal pixels hold 100, everything else 1
        double[][][] frames = frames(1, 10, 10, 1.0);
        RegionOfInterest signalRegion = new RegionOfInterest(4, 5, 4, 5);
        for (int y = 4; y <= 5; y++) {
            for (int x = 4; x <= 5; x++) {
                frames[0][y][x] = 100.0;
            }
        }
        RegionOfInterest backgroundRegion = new RegionOfInterest(3, 6, 3, 6);

        DetectorSignal signal = extractor.extract(
                new DetectorCounts.AreaCounts(frames),
                TestDataFactory.areaDetector(signalRegion, new BackgroundCorrection.DetectorRegion(backgroundRegion)));

        // 16 pixels in the background region minus the 4 shared ones
        assertThat(signal.background()[0]).isEqualTo(1.0);
        assertThat(signal.backgroundError()[0]).isCloseTo(Math.sqrt(12.0) / 12, within(1e-12));
        assertThat(signal.signal()[0]).isEqualTo(100.0);
    }

    @Test
    void backgroundRegionInsideSignalRegionIsRejected()
    {
        RegionOfInterest signalRegion = new RegionOfInterest(0, 5, 0, 5);
        RegionOfInterest backgroundRegion = new RegionOfInterest(1, 2, 1, 2);

        assertThatThrownBy(() -> extractor.regionAverage(frames(1, 8, 8, 1.0), backgroundRegion, signalRegion))
                .isInstanceOf(ReductionConfigurationException.class)
                .hasMessageContaining("entirely inside");
    }

    @Test
    void regionBeyondFrameIsRejected()
    {
        assertThatThrownBy(() -> extractor.regionAverage(
                frames(1, 4, 4, 1.0), new RegionOfInterest(0, 7, 0, 1), null))
                .isInstanceOf(ReductionConfigurationException.class)
                .hasMessageContaining("exceeds");
    }

    private static double[][][] frames(int points, int height, int width, double value)
    {
        double[][][] frames = new double[points][height][width];
        for (double[][] frame : frames) {
            for (double[] row : frame) {
                Arrays.fill(row, value);
            }
        }
        return frames;
    }
}

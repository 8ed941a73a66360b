/* (C)2026 */
package com.ammann.reflectometry.model;

/**
 * Raw counts of one detector for one polarization channel.
 */
public sealed interface DetectorCounts permits DetectorCounts.PointCounts, DetectorCounts.AreaCounts {

    /** Number of scan points. */
    int points();

    /**
     * Counts of a single-channel detector, one value per scan point.
     */
    record PointCounts(double[] counts) implements DetectorCounts {
        @Override
        public int points() {
            return counts.length;
        }
    }

    /**
     * Frames of a position-sensitive detector indexed {@code [point][y][x]}.
     */
    record AreaCounts(double[][][] frames) implements DetectorCounts {
        @Override
        public int points() {
            return frames.length;
        }
    }
}

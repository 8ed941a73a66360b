/* (C)2026 */
package com.ammann.reflectometry.model;

/**
 * Pipeline state of one polarization channel.
 *
 * <p>Stages follow each other in the order {@link Extracted}, {@link Corrected},
 * {@link Normalized}, {@link BackgroundAdjusted}, {@link IntensityNormalized},
 * {@link Finalized}. Every transition takes the preceding stage as input, so the
 * ordering of the reduction steps is fixed by the types.
 */
public sealed interface ChannelStage
        permits ChannelStage.Extracted,
                ChannelStage.Corrected,
                ChannelStage.Normalized,
                ChannelStage.BackgroundAdjusted,
                ChannelStage.IntensityNormalized,
                ChannelStage.Finalized {

    DataSet dataSet();

    /** Raw arrays pulled from the metadata provider. */
    record Extracted(DataSet dataSet) implements ChannelStage {}

    /** Q computed, per-point correction coefficient built. */
    record Corrected(DataSet dataSet, MomentumTransfer momentumTransfer, double[] correction)
            implements ChannelStage {}

    /** Counts corrected and normalized to R. */
    record Normalized(
            DataSet dataSet,
            MomentumTransfer momentumTransfer,
            double[] normalization,
            Reflectivity reflectivity)
            implements ChannelStage {}

    record BackgroundAdjusted(
            DataSet dataSet, MomentumTransfer momentumTransfer, Reflectivity reflectivity)
            implements ChannelStage {}

    record IntensityNormalized(
            DataSet dataSet, MomentumTransfer momentumTransfer, Reflectivity reflectivity)
            implements ChannelStage {}

    /** Result after the cross-channel pass, ready for assembly. */
    record Finalized(DataSet dataSet, DataSetOutput output) implements ChannelStage {}
}

/* (C)2026 */
package com.ammann.reflectometry.model;

/**
 * Final reduced columns of one channel in output order.
 */
public record DataSetOutput(double[] q, double[] dq, double[] r, double[] dr) {

    public static DataSetOutput of(MomentumTransfer momentumTransfer, Reflectivity reflectivity) {
        return new DataSetOutput(
                momentumTransfer.q(), momentumTransfer.dq(), reflectivity.r(), reflectivity.dr());
    }

    public int points() {
        return q.length;
    }

    /** Row {@code i} as {@code [Q, dQ, R, dR]}. */
    public double[] row(int i) {
        return new double[] {q[i], dq[i], r[i], dr[i]};
    }
}

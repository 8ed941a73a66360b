/* (C)2026 */
package com.ammann.reflectometry.model;

/**
 * Momentum transfer Q and its resolution dQ, both in 1/Angstrom.
 */
public record MomentumTransfer(double[] q, double[] dq) {}

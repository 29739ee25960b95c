/*
 * SSMDE — Align & Stamp Engine
 * Copyright © 2025 Aleksandr Listopad
 * SPDX-License-Identifier: Prosperity-3.0
 *
 * Patent notice: The authors intend to seek patent protection for this software.
 * Commercial use >30 days → license@evacortex.ai
 */
package ai.evacortex.ssmde.core.math;

import ai.evacortex.ssmde.core.exceptions.InvalidSeriesException;

import java.util.Objects;

/**
 * Fuses a series of raw signed observations into a single align score.
 *
 * <pre>
 *   a_c   := clamp(a_raw, -1+eps_a, +1-eps_a)
 *   u     := atanh(a_c)
 *   U    += w * u ; W += w
 *   align := tanh( U / max(W, eps_w) )
 * </pre>
 *
 * The result lies strictly inside (-1, 1) for any finite, non-empty series with non-negative
 * weights. The clamp margin never shrinks below one ulp of 1.0, so an {@code eps_a} too small
 * to be represented next to 1.0 still keeps every observation off the poles.
 */
public final class AlignFusion {

    public static final double DEFAULT_EPS_A = 1e-6;
    public static final double DEFAULT_EPS_W = 1e-12;

    private static final double MIN_OPEN = Math.nextUp(-1.0);
    private static final double MAX_OPEN = Math.nextDown(1.0);

    private AlignFusion() {}

    public static double fuse(double[] series) {
        return fuse(series, null, DEFAULT_EPS_A, DEFAULT_EPS_W);
    }

    public static double fuse(double[] series, double[] weights, double epsA, double epsW) {
        Objects.requireNonNull(series, "series must not be null");

        if (series.length == 0) {
            throw new InvalidSeriesException("empty series");
        }
        boolean hasWeights = weights != null;
        if (hasWeights && weights.length != series.length) {
            throw new InvalidSeriesException("weights length " + weights.length
                    + " must match series length " + series.length);
        }
        if (!(epsA > 0.0 && epsA < 1.0)) {
            throw new IllegalArgumentException("eps_a must be in (0, 1): " + epsA);
        }
        if (!(epsW > 0.0)) {
            throw new IllegalArgumentException("eps_w must be > 0: " + epsW);
        }

        double lo = Math.max(-1.0 + epsA, MIN_OPEN);
        double hi = Math.min(1.0 - epsA, MAX_OPEN);
        double u = 0.0;
        double w = 0.0;

        for (int i = 0; i < series.length; i++) {
            double a = series[i];
            if (!Double.isFinite(a)) {
                throw new InvalidSeriesException("non-finite value at index " + i + ": " + a);
            }
            double weight = hasWeights ? weights[i] : 1.0;
            if (!Double.isFinite(weight)) {
                throw new InvalidSeriesException("non-finite weight at index " + i + ": " + weight);
            }
            if (weight < 0.0) {
                throw new InvalidSeriesException("negative weight at index " + i + ": " + weight);
            }
            u += weight * atanh(clamp(a, lo, hi));
            w += weight;
            if (!Double.isFinite(u) || !Double.isFinite(w)) {
                throw new InvalidSeriesException("weighted sum overflows at index " + i);
            }
        }

        // tanh saturates to +-1.0 for large arguments
        return clamp(Math.tanh(u / Math.max(w, epsW)), MIN_OPEN, MAX_OPEN);
    }

    public static double clamp(double x, double lo, double hi) {
        return x < lo ? lo : Math.min(x, hi);
    }

    static double atanh(double x) {
        return 0.5 * (Math.log1p(x) - Math.log1p(-x));
    }
}

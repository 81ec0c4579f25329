package com.lungrisk.common.model;

import java.io.Serial;
import java.io.Serializable;
import java.util.Arrays;
import java.util.Comparator;
import java.util.stream.IntStream;

/**
 * Monotone, non-parametric map from raw classifier scores to probabilities.
 *
 * <p>Fitted with pool-adjacent-violators on (score, outcome) pairs. Scores between
 * knots are linearly interpolated; scores outside the fitted range are clipped to the
 * first or last knot.
 */
public final class IsotonicCalibrator implements Serializable {

    @Serial
    private static final long serialVersionUID = 1L;

    private final double[] xs;
    private final double[] ys;

    IsotonicCalibrator(double[] xs, double[] ys) {
        if (xs.length == 0 || xs.length != ys.length) {
            throw new IllegalArgumentException("Calibrator needs at least one knot and matching arrays");
        }
        this.xs = xs;
        this.ys = ys;
    }

    public static IsotonicCalibrator fit(double[] scores, int[] outcomes) {
        if (scores.length == 0 || scores.length != outcomes.length) {
            throw new IllegalArgumentException("Scores and outcomes must be non-empty and of equal length");
        }
        Integer[] order = IntStream.range(0, scores.length).boxed().toArray(Integer[]::new);
        Arrays.sort(order, Comparator.comparingDouble(i -> scores[i]));

        // collapse tied scores into one weighted point
        double[] x = new double[scores.length];
        double[] y = new double[scores.length];
        double[] w = new double[scores.length];
        int m = -1;
        for (int idx : order) {
            if (m >= 0 && scores[idx] == x[m]) {
                y[m] += outcomes[idx];
                w[m] += 1.0;
            } else {
                m++;
                x[m] = scores[idx];
                y[m] = outcomes[idx];
                w[m] = 1.0;
            }
        }
        m++;
        for (int i = 0; i < m; i++) {
            y[i] /= w[i];
        }

        double[] blockValue = new double[m];
        double[] blockWeight = new double[m];
        int[] blockEnd = new int[m];
        int top = -1;
        for (int i = 0; i < m; i++) {
            top++;
            blockValue[top] = y[i];
            blockWeight[top] = w[i];
            blockEnd[top] = i;
            while (top > 0 && blockValue[top - 1] > blockValue[top]) {
                double merged = blockWeight[top - 1] + blockWeight[top];
                blockValue[top - 1] = (blockValue[top - 1] * blockWeight[top - 1]
                    + blockValue[top] * blockWeight[top]) / merged;
                blockWeight[top - 1] = merged;
                blockEnd[top - 1] = blockEnd[top];
                top--;
            }
        }

        double[] fitted = new double[m];
        int start = 0;
        for (int b = 0; b <= top; b++) {
            Arrays.fill(fitted, start, blockEnd[b] + 1, blockValue[b]);
            start = blockEnd[b] + 1;
        }
        return new IsotonicCalibrator(Arrays.copyOf(x, m), fitted);
    }

    public double calibrate(double raw) {
        int i = Arrays.binarySearch(xs, raw);
        if (i >= 0) {
            return ys[i];
        }
        int p = -i - 1;
        if (p <= 0) {
            return ys[0];
        }
        if (p >= xs.length) {
            return ys[ys.length - 1];
        }
        double x0 = xs[p - 1], x1 = xs[p], y0 = ys[p - 1], y1 = ys[p];
        double t = (raw - x0) / (x1 - x0);
        return y0 + t * (y1 - y0);
    }

    public int knotCount() {
        return xs.length;
    }
}

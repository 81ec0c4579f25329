package com.lungrisk.common.scaling;

import java.io.Serial;
import java.io.Serializable;
import java.util.List;

/**
 * Persisted per-column mean and scale for standardising numeric features.
 * Fitted once on the training split and never recomputed from requests.
 */
public final class ScalingStatistics implements Serializable {

    @Serial
    private static final long serialVersionUID = 1L;

    private final List<String> columns;
    private final double[] means;
    private final double[] scales;

    public ScalingStatistics(List<String> columns, double[] means, double[] scales) {
        if (columns.size() != means.length || columns.size() != scales.length) {
            throw new IllegalArgumentException("Columns, means and scales must have the same length");
        }
        for (double scale : scales) {
            if (!(scale > 0.0) || !Double.isFinite(scale)) {
                throw new IllegalArgumentException("Scales must be finite and positive");
            }
        }
        this.columns = List.copyOf(columns);
        this.means = means.clone();
        this.scales = scales.clone();
    }

    public List<String> getColumns() {
        return columns;
    }

    public double meanOf(String column) {
        return means[indexOf(column)];
    }

    public double scaleOf(String column) {
        return scales[indexOf(column)];
    }

    public double standardize(String column, double value) {
        int index = indexOf(column);
        return (value - means[index]) / scales[index];
    }

    /**
     * Returns a copy of {@code values} with every scaled column standardised.
     * Columns without statistics (the binary indicators) pass through unchanged.
     */
    public double[] transform(List<String> featureOrder, double[] values) {
        if (featureOrder.size() != values.length) {
            throw new IllegalArgumentException(
                "Vector has " + values.length + " values but feature order has " + featureOrder.size());
        }
        double[] scaled = values.clone();
        for (int c = 0; c < columns.size(); c++) {
            int position = featureOrder.indexOf(columns.get(c));
            if (position < 0) {
                throw new IllegalArgumentException("Scaled column '" + columns.get(c) + "' not in feature order");
            }
            scaled[position] = (values[position] - means[c]) / scales[c];
        }
        return scaled;
    }

    private int indexOf(String column) {
        int index = columns.indexOf(column);
        if (index < 0) {
            throw new IllegalArgumentException("No scaling statistics for column: " + column);
        }
        return index;
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder("ScalingStatistics{");
        for (int c = 0; c < columns.size(); c++) {
            if (c > 0) {
                sb.append(", ");
            }
            sb.append(columns.get(c)).append("=(").append(means[c]).append(", ").append(scales[c]).append(')');
        }
        return sb.append('}').toString();
    }
}

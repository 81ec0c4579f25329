package com.lungrisk.common.scaling;

import lombok.extern.slf4j.Slf4j;
import org.apache.commons.math3.stat.descriptive.moment.Mean;
import org.apache.commons.math3.stat.descriptive.moment.StandardDeviation;

import java.util.List;

/**
 * Fits {@link ScalingStatistics} using the population standard deviation.
 * A constant column gets a scale of 1 so it is centred but not divided by zero.
 */
@Slf4j
public final class StandardScaler {

    private StandardScaler() {
    }

    /**
     * @param featureOrder column names of {@code rows}
     * @param rows         training rows, one vector per sample
     * @param columns      the columns to standardise
     */
    public static ScalingStatistics fit(List<String> featureOrder, double[][] rows, List<String> columns) {
        if (rows.length == 0) {
            throw new IllegalArgumentException("Cannot fit scaling statistics on an empty dataset");
        }
        double[] means = new double[columns.size()];
        double[] scales = new double[columns.size()];

        for (int c = 0; c < columns.size(); c++) {
            int position = featureOrder.indexOf(columns.get(c));
            if (position < 0) {
                throw new IllegalArgumentException("Column '" + columns.get(c) + "' not in feature order");
            }
            double[] column = new double[rows.length];
            for (int r = 0; r < rows.length; r++) {
                column[r] = rows[r][position];
            }
            means[c] = new Mean().evaluate(column);
            double std = new StandardDeviation(false).evaluate(column);
            scales[c] = std > 0.0 ? std : 1.0;
            log.debug("Scaler column {}: mean={}, std={}", columns.get(c), means[c], std);
        }
        return new ScalingStatistics(columns, means, scales);
    }
}

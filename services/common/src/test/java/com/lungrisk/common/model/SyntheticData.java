package com.lungrisk.common.model;

import com.lungrisk.common.feature.FeatureSchema;

import java.util.Random;

/**
 * Small seeded dataset in lung cancer schema order where age and COPD drive the label.
 */
public final class SyntheticData {

    public final double[][] features;
    public final int[] labels;

    private SyntheticData(double[][] features, int[] labels) {
        this.features = features;
        this.labels = labels;
    }

    public static SyntheticData generate(int rows, long seed) {
        int width = FeatureSchema.lungCancer().getFeatureOrder().size();
        Random random = new Random(seed);
        double[][] features = new double[rows][width];
        int[] labels = new int[rows];
        for (int r = 0; r < rows; r++) {
            double age = 35 + random.nextDouble() * 50;
            double copd = random.nextDouble() < 0.3 ? 1 : 0;
            features[r][0] = (age - 60) / 14.0;
            features[r][1] = random.nextGaussian();
            for (int c = 2; c < width; c++) {
                features[r][c] = random.nextDouble() < 0.4 ? 1 : 0;
            }
            features[r][6] = copd;
            double risk = (age - 35) / 50.0 * 0.6 + copd * 0.35;
            labels[r] = random.nextDouble() < risk ? 1 : 0;
        }
        return new SyntheticData(features, labels);
    }
}

package com.lungrisk.common.model;

import java.io.Serial;
import java.io.Serializable;
import java.util.List;

/**
 * Tree ensemble with out-of-fold isotonic calibration. The probability is the mean
 * of the fold members' calibrated probabilities, clipped away from 0 and 1.
 *
 * <p>Immutable after training and safe to share across request threads.
 */
public final class CalibratedClassifier implements ProbabilityModel, Serializable {

    @Serial
    private static final long serialVersionUID = 1L;

    public static final String CALIBRATION_METHOD = "isotonic";

    private final List<String> featureNames;
    private final List<CalibratedFold> folds;
    private final String modelFamily;

    CalibratedClassifier(List<String> featureNames, List<CalibratedFold> folds, String modelFamily) {
        if (folds.isEmpty()) {
            throw new IllegalArgumentException("Calibrated classifier needs at least one fold");
        }
        this.featureNames = List.copyOf(featureNames);
        this.folds = List.copyOf(folds);
        this.modelFamily = modelFamily;
    }

    @Override
    public double score(double[] features) {
        if (features.length != featureNames.size()) {
            throw new IllegalArgumentException(
                "Expected " + featureNames.size() + " features but got " + features.length);
        }
        double sum = 0.0;
        for (CalibratedFold fold : folds) {
            sum += fold.calibratedScore(features);
        }
        return Probabilities.clip(sum / folds.size());
    }

    @Override
    public List<String> getFeatureNames() {
        return featureNames;
    }

    @Override
    public String getModelFamily() {
        return modelFamily;
    }

    @Override
    public String getCalibrationMethod() {
        return CALIBRATION_METHOD;
    }

    public int getFoldCount() {
        return folds.size();
    }
}

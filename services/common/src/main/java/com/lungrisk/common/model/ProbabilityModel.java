package com.lungrisk.common.model;

import java.util.List;

/**
 * A classifier that maps a standardised feature vector, in {@link #getFeatureNames()}
 * order, to a probability of the positive class.
 *
 * <p>Implementations must be safe for concurrent use once constructed.
 */
public interface ProbabilityModel {

    double score(double[] features);

    List<String> getFeatureNames();

    String getModelFamily();

    String getCalibrationMethod();
}

package com.lungrisk.common.model;

import com.lungrisk.common.exception.RiskModelException;
import weka.classifiers.Classifier;
import weka.core.Instances;

import java.io.Serial;
import java.io.Serializable;

/**
 * One cross-validation member: a base ensemble fitted on the other folds and the
 * isotonic map fitted on this fold's held-out scores.
 */
final class CalibratedFold implements Serializable {

    @Serial
    private static final long serialVersionUID = 1L;

    private final Classifier classifier;
    private final IsotonicCalibrator calibrator;
    private final Instances header;

    CalibratedFold(Classifier classifier, IsotonicCalibrator calibrator, Instances header) {
        this.classifier = classifier;
        this.calibrator = calibrator;
        this.header = new Instances(header, 0);
    }

    double calibratedScore(double[] features) {
        return calibrator.calibrate(rawScore(classifier, header, features));
    }

    static double rawScore(Classifier classifier, Instances header, double[] features) {
        try {
            double[] distribution = classifier.distributionForInstance(WekaDatasets.unlabeled(header, features));
            return distribution[WekaDatasets.POSITIVE_CLASS_INDEX];
        } catch (Exception e) {
            throw new RiskModelException("Tree ensemble failed to score feature vector", e);
        }
    }
}

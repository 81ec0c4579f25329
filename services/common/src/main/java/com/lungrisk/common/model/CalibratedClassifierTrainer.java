package com.lungrisk.common.model;

import com.lungrisk.common.exception.RiskModelException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import weka.classifiers.trees.RandomForest;
import weka.core.Instances;

import java.util.ArrayList;
import java.util.List;

/**
 * Fits a {@link CalibratedClassifier} with stratified out-of-fold isotonic calibration.
 *
 * <p>For each of the k folds a fresh forest is trained on the remaining folds, with
 * positive rows weighted by {@code negatives / max(positives, 1)}, and an isotonic map
 * is fitted on the forest's scores for the held-out fold.
 */
@Slf4j
@RequiredArgsConstructor
public class CalibratedClassifierTrainer {

    private final TreeEnsembleSettings settings;

    public CalibratedClassifier fit(List<String> featureNames, double[][] features, int[] labels, String target) {
        if (features.length != labels.length || features.length == 0) {
            throw new IllegalArgumentException("Features and labels must be non-empty and aligned");
        }
        int positives = 0;
        for (int label : labels) {
            positives += label;
        }
        int negatives = labels.length - positives;
        int k = settings.getCalibrationFolds();
        if (Math.min(positives, negatives) < k) {
            throw new RiskModelException("Both classes need at least " + k
                + " samples for " + k + "-fold calibration (positives=" + positives
                + ", negatives=" + negatives + ")");
        }
        double positiveWeight = positiveClassWeight(positives, negatives);
        log.info("Fitting {} with {} trees on {} rows ({} positive), positive weight {}, {}-fold isotonic calibration",
            TreeEnsembleSettings.MODEL_FAMILY, settings.getNumTrees(), labels.length, positives,
            String.format("%.4f", positiveWeight), k);

        List<int[]> heldOutFolds = StratifiedSampler.folds(labels, k, settings.getSeed());
        List<CalibratedFold> members = new ArrayList<>(k);
        for (int f = 0; f < k; f++) {
            int[] heldOut = heldOutFolds.get(f);
            int[] trainRows = StratifiedSampler.complement(labels.length, heldOut);

            Instances train = WekaDatasets.trainingSet(featureNames, target, features, labels, trainRows, positiveWeight);
            RandomForest forest = settings.newForest(f);
            try {
                forest.buildClassifier(train);
            } catch (Exception e) {
                throw new RiskModelException("Failed to fit tree ensemble for calibration fold " + (f + 1), e);
            }

            Instances header = new Instances(train, 0);
            double[] scores = new double[heldOut.length];
            int[] outcomes = new int[heldOut.length];
            for (int i = 0; i < heldOut.length; i++) {
                scores[i] = CalibratedFold.rawScore(forest, header, features[heldOut[i]]);
                outcomes[i] = labels[heldOut[i]];
            }
            IsotonicCalibrator calibrator = IsotonicCalibrator.fit(scores, outcomes);
            members.add(new CalibratedFold(forest, calibrator, header));
            log.debug("Calibration fold {}/{}: trained on {} rows, calibrated on {} rows ({} knots)",
                f + 1, k, trainRows.length, heldOut.length, calibrator.knotCount());
        }
        return new CalibratedClassifier(featureNames, members, TreeEnsembleSettings.MODEL_FAMILY);
    }

    public static double positiveClassWeight(int positives, int negatives) {
        return negatives / (double) Math.max(positives, 1);
    }
}

package com.lungrisk.training.evaluation;

import lombok.Builder;
import lombok.Getter;
import lombok.ToString;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Hold-out metrics of a training run. Reported only; nothing gates on them.
 */
@Getter
@Builder
@ToString
public class EvaluationReport {

    private final int samples;
    private final int positives;
    private final double rocAuc;
    private final double prAuc;
    private final double brierScore;
    private final double bestThreshold;
    private final double bestF1;
    private final double precisionAtBest;
    private final double recallAtBest;
    private final long truePositives;
    private final long falsePositives;
    private final long trueNegatives;
    private final long falseNegatives;

    public Map<String, Double> toMetrics() {
        Map<String, Double> metrics = new LinkedHashMap<>();
        metrics.put("roc_auc", rocAuc);
        metrics.put("pr_auc", prAuc);
        metrics.put("brier", brierScore);
        metrics.put("best_f1", bestF1);
        metrics.put("precision_at_best", precisionAtBest);
        metrics.put("recall_at_best", recallAtBest);
        metrics.put("test_samples", (double) samples);
        metrics.put("test_positives", (double) positives);
        metrics.put("tp", (double) truePositives);
        metrics.put("fp", (double) falsePositives);
        metrics.put("tn", (double) trueNegatives);
        metrics.put("fn", (double) falseNegatives);
        return metrics;
    }
}

package com.lungrisk.training.evaluation;

import lombok.extern.slf4j.Slf4j;
import org.apache.commons.math3.stat.ranking.NaNStrategy;
import org.apache.commons.math3.stat.ranking.NaturalRanking;
import org.apache.commons.math3.stat.ranking.TiesStrategy;
import org.springframework.stereotype.Component;

import java.util.Arrays;
import java.util.Comparator;

/**
 * Discrimination and calibration metrics for predicted probabilities against 0/1 outcomes.
 */
@Slf4j
@Component
public class ModelEvaluator {

    public EvaluationReport evaluate(double[] probabilities, int[] outcomes) {
        if (probabilities.length != outcomes.length || probabilities.length == 0) {
            throw new IllegalArgumentException("Probabilities and outcomes must be non-empty and aligned");
        }
        int positives = Arrays.stream(outcomes).sum();

        EvaluationReport.EvaluationReportBuilder report = EvaluationReport.builder()
            .samples(outcomes.length)
            .positives(positives)
            .rocAuc(rocAuc(probabilities, outcomes))
            .prAuc(averagePrecision(probabilities, outcomes))
            .brierScore(brierScore(probabilities, outcomes));
        applyBestThreshold(report, probabilities, outcomes);

        EvaluationReport result = report.build();
        log.info("Hold-out evaluation on {} rows: ROC-AUC={}, PR-AUC={}, Brier={}, best threshold={} (F1={})",
            result.getSamples(), format(result.getRocAuc()), format(result.getPrAuc()),
            format(result.getBrierScore()), format(result.getBestThreshold()), format(result.getBestF1()));
        log.info("Confusion matrix at threshold {}: TP={}, FP={}, TN={}, FN={}", format(result.getBestThreshold()),
            result.getTruePositives(), result.getFalsePositives(), result.getTrueNegatives(), result.getFalseNegatives());
        return result;
    }

    /**
     * Mann-Whitney form of the ROC area: average ranks with ties shared. NaN when one class is absent.
     */
    public static double rocAuc(double[] probabilities, int[] outcomes) {
        long positives = Arrays.stream(outcomes).filter(y -> y == 1).count();
        long negatives = outcomes.length - positives;
        if (positives == 0 || negatives == 0) {
            return Double.NaN;
        }
        double[] ranks = new NaturalRanking(NaNStrategy.FIXED, TiesStrategy.AVERAGE).rank(probabilities);
        double positiveRankSum = 0.0;
        for (int i = 0; i < outcomes.length; i++) {
            if (outcomes[i] == 1) {
                positiveRankSum += ranks[i];
            }
        }
        double u = positiveRankSum - positives * (positives + 1) / 2.0;
        return u / (positives * (double) negatives);
    }

    /**
     * Step-wise area under the precision-recall curve, one step per distinct threshold.
     */
    public static double averagePrecision(double[] probabilities, int[] outcomes) {
        int totalPositives = Arrays.stream(outcomes).sum();
        if (totalPositives == 0) {
            return Double.NaN;
        }
        Integer[] order = descendingOrder(probabilities);
        double area = 0.0;
        double previousRecall = 0.0;
        int truePositives = 0;
        int predicted = 0;
        for (int i = 0; i < order.length; i++) {
            int row = order[i];
            predicted++;
            truePositives += outcomes[row];
            if (i + 1 < order.length && probabilities[order[i + 1]] == probabilities[row]) {
                continue;
            }
            double recall = truePositives / (double) totalPositives;
            double precision = truePositives / (double) predicted;
            area += (recall - previousRecall) * precision;
            previousRecall = recall;
        }
        return area;
    }

    public static double brierScore(double[] probabilities, int[] outcomes) {
        double sum = 0.0;
        for (int i = 0; i < outcomes.length; i++) {
            double diff = probabilities[i] - outcomes[i];
            sum += diff * diff;
        }
        return sum / outcomes.length;
    }

    private static void applyBestThreshold(EvaluationReport.EvaluationReportBuilder report,
                                           double[] probabilities, int[] outcomes) {
        int totalPositives = Arrays.stream(outcomes).sum();
        Integer[] order = descendingOrder(probabilities);

        double bestF1 = 0.0;
        double bestThreshold = 0.5;
        int truePositives = 0;
        int predicted = 0;
        for (int i = 0; i < order.length; i++) {
            int row = order[i];
            predicted++;
            truePositives += outcomes[row];
            if (i + 1 < order.length && probabilities[order[i + 1]] == probabilities[row]) {
                continue;
            }
            double precision = truePositives / (double) predicted;
            double recall = totalPositives == 0 ? 0.0 : truePositives / (double) totalPositives;
            double f1 = precision + recall == 0.0 ? 0.0 : 2.0 * precision * recall / (precision + recall);
            if (f1 > bestF1) {
                bestF1 = f1;
                bestThreshold = probabilities[row];
            }
        }

        long tp = 0;
        long fp = 0;
        long tn = 0;
        long fn = 0;
        for (int i = 0; i < outcomes.length; i++) {
            boolean flagged = probabilities[i] >= bestThreshold;
            if (flagged && outcomes[i] == 1) {
                tp++;
            } else if (flagged) {
                fp++;
            } else if (outcomes[i] == 1) {
                fn++;
            } else {
                tn++;
            }
        }
        report.bestThreshold(bestThreshold)
            .bestF1(bestF1)
            .precisionAtBest(tp + fp == 0 ? 0.0 : tp / (double) (tp + fp))
            .recallAtBest(tp + fn == 0 ? 0.0 : tp / (double) (tp + fn))
            .truePositives(tp)
            .falsePositives(fp)
            .trueNegatives(tn)
            .falseNegatives(fn);
    }

    private static Integer[] descendingOrder(double[] probabilities) {
        Integer[] order = new Integer[probabilities.length];
        for (int i = 0; i < order.length; i++) {
            order[i] = i;
        }
        Arrays.sort(order, Comparator.comparingDouble((Integer i) -> probabilities[i]).reversed());
        return order;
    }

    private static String format(double value) {
        return String.format("%.4f", value);
    }
}

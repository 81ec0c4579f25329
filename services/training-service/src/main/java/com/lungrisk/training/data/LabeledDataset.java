package com.lungrisk.training.data;

import lombok.Getter;

import java.util.List;

/**
 * Encoded (unscaled) feature matrix in schema order with 0/1 labels.
 */
@Getter
public class LabeledDataset {

    private final List<String> featureOrder;
    private final double[][] features;
    private final int[] labels;

    /** Label cells that were blank or unrecognised and therefore read as 0. */
    private final int unrecognizedLabelCount;

    public LabeledDataset(List<String> featureOrder, double[][] features, int[] labels) {
        this(featureOrder, features, labels, 0);
    }

    public LabeledDataset(List<String> featureOrder, double[][] features, int[] labels, int unrecognizedLabelCount) {
        if (features.length != labels.length) {
            throw new IllegalArgumentException("Features and labels must have the same number of rows");
        }
        this.featureOrder = List.copyOf(featureOrder);
        this.features = features;
        this.labels = labels;
        this.unrecognizedLabelCount = unrecognizedLabelCount;
    }

    public int size() {
        return labels.length;
    }

    public int positiveCount() {
        int positives = 0;
        for (int label : labels) {
            positives += label;
        }
        return positives;
    }

    /**
     * Empirical positive rate; the training prior recorded with the model.
     */
    public double positiveRate() {
        return labels.length == 0 ? Double.NaN : positiveCount() / (double) labels.length;
    }

    public double[][] rows(int[] indices) {
        double[][] selected = new double[indices.length][];
        for (int i = 0; i < indices.length; i++) {
            selected[i] = features[indices[i]];
        }
        return selected;
    }

    public int[] labels(int[] indices) {
        int[] selected = new int[indices.length];
        for (int i = 0; i < indices.length; i++) {
            selected[i] = labels[indices[i]];
        }
        return selected;
    }
}

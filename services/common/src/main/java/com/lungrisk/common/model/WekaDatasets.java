package com.lungrisk.common.model;

import weka.core.Attribute;
import weka.core.DenseInstance;
import weka.core.Instance;
import weka.core.Instances;
import weka.core.Utils;

import java.util.ArrayList;
import java.util.List;

/**
 * Bridges plain feature matrices and Weka {@link Instances}.
 * Every feature is a numeric attribute; the label is a nominal {"0", "1"} class
 * appended last, so class index 1 is the positive class.
 */
final class WekaDatasets {

    static final int POSITIVE_CLASS_INDEX = 1;

    private static final String RELATION = "lung_cancer_risk";

    private WekaDatasets() {
    }

    static Instances header(List<String> featureNames, String target, int capacity) {
        ArrayList<Attribute> attributes = new ArrayList<>(featureNames.size() + 1);
        for (String feature : featureNames) {
            attributes.add(new Attribute(feature));
        }
        attributes.add(new Attribute(target, new ArrayList<>(List.of("0", "1"))));
        Instances instances = new Instances(RELATION, attributes, capacity);
        instances.setClassIndex(attributes.size() - 1);
        return instances;
    }

    /**
     * Builds a weighted training set from the selected rows. Positive rows carry
     * {@code positiveWeight}; negative rows weigh 1.
     */
    static Instances trainingSet(List<String> featureNames, String target, double[][] features,
                                 int[] labels, int[] rows, double positiveWeight) {
        Instances instances = header(featureNames, target, rows.length);
        for (int row : rows) {
            double[] values = new double[featureNames.size() + 1];
            System.arraycopy(features[row], 0, values, 0, featureNames.size());
            values[featureNames.size()] = labels[row];
            double weight = labels[row] == 1 ? positiveWeight : 1.0;
            instances.add(new DenseInstance(weight, values));
        }
        return instances;
    }

    static Instance unlabeled(Instances header, double[] features) {
        double[] values = new double[features.length + 1];
        System.arraycopy(features, 0, values, 0, features.length);
        values[features.length] = Utils.missingValue();
        Instance instance = new DenseInstance(1.0, values);
        instance.setDataset(header);
        return instance;
    }
}

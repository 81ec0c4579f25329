package com.lungrisk.common.model;

import lombok.Builder;
import lombok.Getter;
import lombok.ToString;
import weka.classifiers.trees.RandomForest;

/**
 * Hyper-parameters of the base ensemble and its calibration.
 */
@Getter
@Builder
@ToString
public class TreeEnsembleSettings {

    public static final String MODEL_FAMILY = "weka.RandomForest";

    @Builder.Default
    private final int numTrees = 200;

    /** 0 means unlimited depth. */
    @Builder.Default
    private final int maxDepth = 0;

    @Builder.Default
    private final int executionSlots = 1;

    @Builder.Default
    private final int calibrationFolds = 5;

    @Builder.Default
    private final long seed = 42L;

    RandomForest newForest(int fold) {
        RandomForest forest = new RandomForest();
        forest.setNumIterations(numTrees);
        forest.setMaxDepth(maxDepth);
        forest.setNumExecutionSlots(executionSlots);
        forest.setSeed((int) (seed + fold));
        return forest;
    }
}

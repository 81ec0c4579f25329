package com.lungrisk.training.pipeline;

/**
 * Stages of a training run, executed strictly in declaration order.
 */
public enum TrainingStage {
    LOAD_DATA,
    VALIDATE_COLUMNS,
    ENCODE_LABELS_AND_FEATURES,
    SPLIT_TRAIN_TEST,
    FIT_SCALER,
    FIT_CALIBRATED_CLASSIFIER,
    EVALUATE,
    PERSIST_ARTIFACTS
}

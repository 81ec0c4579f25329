package com.lungrisk.training.exception;

import com.lungrisk.common.exception.RiskModelException;
import com.lungrisk.training.pipeline.TrainingStage;

/**
 * Fatal training failure. The job stops at the stage that raised it; there are no retries.
 */
public class TrainingException extends RiskModelException {

    private final TrainingStage stage;

    public TrainingException(TrainingStage stage, String message) {
        super("[" + stage + "] " + message);
        this.stage = stage;
    }

    public TrainingException(TrainingStage stage, String message, Throwable cause) {
        super("[" + stage + "] " + message, cause);
        this.stage = stage;
    }

    public TrainingStage getStage() {
        return stage;
    }
}

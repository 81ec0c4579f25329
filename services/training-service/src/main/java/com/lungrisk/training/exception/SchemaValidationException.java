package com.lungrisk.training.exception;

import com.lungrisk.training.pipeline.TrainingStage;

import java.util.List;

/**
 * The training source lacks columns the feature schema requires.
 */
public class SchemaValidationException extends TrainingException {

    private final List<String> missingColumns;

    public SchemaValidationException(String source, List<String> missingColumns) {
        super(TrainingStage.VALIDATE_COLUMNS,
            "Training data " + source + " is missing required column(s): " + String.join(", ", missingColumns));
        this.missingColumns = List.copyOf(missingColumns);
    }

    public List<String> getMissingColumns() {
        return missingColumns;
    }
}

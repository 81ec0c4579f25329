package com.lungrisk.common.exception;

/**
 * Thrown when the scaler, classifier and metadata of a bundle disagree with each
 * other, e.g. a classifier trained on a different feature order.
 */
public class ArtifactIntegrityException extends RiskModelException {

    public ArtifactIntegrityException(String message) {
        super(message);
    }
}

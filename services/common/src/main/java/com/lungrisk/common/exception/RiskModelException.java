package com.lungrisk.common.exception;

/**
 * Base exception for failures of the risk model itself: artifacts that cannot be
 * loaded, inconsistent artifacts, or a classifier that cannot be fitted.
 * Never raised for malformed request values, which fall back to defaults.
 */
public class RiskModelException extends RuntimeException {

    public RiskModelException(String message) {
        super(message);
    }

    public RiskModelException(String message, Throwable cause) {
        super(message, cause);
    }
}

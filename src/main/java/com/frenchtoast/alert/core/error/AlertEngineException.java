package com.frenchtoast.alert.core.error;

/**
 * Base type for every failure raised by the alert engine.
 */
public abstract class AlertEngineException extends RuntimeException {

    protected AlertEngineException(String message) {
        super(message);
    }

    protected AlertEngineException(String message, Throwable cause) {
        super(message, cause);
    }
}

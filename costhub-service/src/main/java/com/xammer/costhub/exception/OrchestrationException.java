package com.xammer.costhub.exception;

/**
 * Unexpected failure while post-processing collected recommendations.
 */
public class OrchestrationException extends RuntimeException {

    public OrchestrationException(String message, Throwable cause) {
        super(message, cause);
    }
}

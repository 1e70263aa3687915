package com.xammer.costhub.exception;

import com.xammer.costhub.domain.RecommendationSource;

/**
 * Failure talking to an upstream provider. Subclasses decide whether the call may be retried.
 */
public abstract class SourceException extends RuntimeException {

    private final RecommendationSource source;
    private final String errorCode;

    protected SourceException(RecommendationSource source, String errorCode, String message, Throwable cause) {
        super(message, cause);
        this.source = source;
        this.errorCode = errorCode;
    }

    public RecommendationSource getSource() {
        return source;
    }

    public String getErrorCode() {
        return errorCode;
    }

    public abstract boolean isRetryable();
}

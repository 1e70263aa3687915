package com.xammer.costhub.exception;

import com.xammer.costhub.domain.RecommendationSource;

/**
 * Access denied, invalid request or feature not enabled. Never retried.
 */
public class TerminalSourceException extends SourceException {

    public TerminalSourceException(RecommendationSource source, String errorCode, String message) {
        this(source, errorCode, message, null);
    }

    public TerminalSourceException(RecommendationSource source, String errorCode, String message, Throwable cause) {
        super(source, errorCode, message, cause);
    }

    @Override
    public boolean isRetryable() {
        return false;
    }
}

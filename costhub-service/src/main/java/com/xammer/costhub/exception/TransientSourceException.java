package com.xammer.costhub.exception;

import com.xammer.costhub.domain.RecommendationSource;

/**
 * Throttling, 5xx or client-side I/O trouble. Retried with backoff.
 */
public class TransientSourceException extends SourceException {

    public TransientSourceException(RecommendationSource source, String errorCode, String message) {
        this(source, errorCode, message, null);
    }

    public TransientSourceException(RecommendationSource source, String errorCode, String message, Throwable cause) {
        super(source, errorCode, message, cause);
    }

    @Override
    public boolean isRetryable() {
        return true;
    }
}

package com.xammer.costhub.service.source;

import com.xammer.costhub.domain.RecommendationSource;
import com.xammer.costhub.exception.SourceException;
import com.xammer.costhub.exception.TerminalSourceException;
import com.xammer.costhub.exception.TransientSourceException;
import software.amazon.awssdk.awscore.exception.AwsServiceException;
import software.amazon.awssdk.core.exception.SdkClientException;

import java.util.Locale;
import java.util.Set;

/**
 * Maps SDK exceptions onto the terminal/transient split used by the retry policy.
 */
public final class AwsErrorClassifier {

    static final Set<String> TERMINAL_CODES = Set.of(
            "AccessDeniedException",
            "AccessDenied",
            "UnauthorizedOperation",
            "UnauthorizedException",
            "OptInRequiredException",
            "ValidationException",
            "DataUnavailableException",
            "InvalidNextTokenException"
    );

    static final Set<String> TRANSIENT_CODES = Set.of(
            "Throttling",
            "ThrottlingException",
            "RequestLimitExceeded",
            "TooManyRequestsException",
            "LimitExceededException",
            "ServiceUnavailable",
            "ServiceUnavailableException",
            "InternalError",
            "InternalServerException",
            "RequestTimeout"
    );

    private AwsErrorClassifier() {
    }

    public static SourceException classify(RecommendationSource source, Throwable error) {
        if (error instanceof SourceException) {
            return (SourceException) error;
        }
        if (error instanceof AwsServiceException) {
            return classifyServiceException(source, (AwsServiceException) error);
        }
        if (error instanceof SdkClientException) {
            return new TransientSourceException(source, "ClientError",
                    source.getDisplayName() + " client error: " + error.getMessage(), error);
        }
        return new TerminalSourceException(source, "UnexpectedError",
                source.getDisplayName() + " failed unexpectedly: " + error.getMessage(), error);
    }

    private static SourceException classifyServiceException(RecommendationSource source, AwsServiceException e) {
        String code = e.awsErrorDetails() != null ? e.awsErrorDetails().errorCode() : null;
        String detail = e.awsErrorDetails() != null && e.awsErrorDetails().errorMessage() != null
                ? e.awsErrorDetails().errorMessage() : e.getMessage();
        String message = source.getDisplayName() + " error" + (code != null ? " [" + code + "]" : "") + ": " + detail;

        if (isFeatureNotEnabled(detail)) {
            return new TerminalSourceException(source, "FeatureNotEnabled",
                    source.getDisplayName() + " is not enabled for this account: " + detail, e);
        }
        if (code != null && TERMINAL_CODES.contains(code)) {
            return new TerminalSourceException(source, code, message, e);
        }
        if ((code != null && TRANSIENT_CODES.contains(code)) || e.isThrottlingException()
                || e.statusCode() >= 500 || e.statusCode() == 429) {
            return new TransientSourceException(source, code, message, e);
        }
        return new TerminalSourceException(source, code, message, e);
    }

    private static boolean isFeatureNotEnabled(String detail) {
        if (detail == null) {
            return false;
        }
        String lower = detail.toLowerCase(Locale.ROOT);
        return lower.contains("opt-in only feature") || lower.contains("not enrolled") || lower.contains("opted in");
    }

    /** Retry predicate for {@link com.xammer.costhub.service.resilience.RetryPolicy}. */
    public static boolean isRetryable(Throwable error) {
        return error instanceof SourceException && ((SourceException) error).isRetryable();
    }
}

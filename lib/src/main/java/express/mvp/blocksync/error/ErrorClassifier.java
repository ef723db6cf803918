package express.mvp.blocksync.error;

import express.mvp.blocksync.store.RemoteStoreException;
import java.net.ConnectException;
import java.net.NoRouteToHostException;
import java.net.SocketTimeoutException;
import java.net.UnknownHostException;
import java.util.Locale;
import java.util.OptionalInt;
import java.util.concurrent.TimeoutException;
import java.util.regex.Pattern;

/**
 * Classifies remote store failures into {@link ErrorCategory categories}.
 *
 * <p>Transient categories form an allow-list: a failure is only retried when it is positively
 * recognized as a timeout, connection failure, rate limit or server fault. Everything else,
 * including failures nothing here recognizes, is permanent.
 *
 * <h2>Classification Strategy</h2>
 *
 * <ol>
 *   <li>Status code of a {@link RemoteStoreException}, then its remote error code
 *   <li>Exception type (socket timeouts, refused connections, unknown hosts)
 *   <li>Exception message patterns
 *   <li>The cause chain, when the exception itself is unrecognized
 *   <li>{@link ErrorCategory#UNKNOWN}
 * </ol>
 *
 * <h2>Usage Example</h2>
 *
 * <pre>{@code
 * ErrorCategory category = ErrorClassifier.classify(failure);
 * RetryDecision decision = policy.decide(attempt, maxRetries, category.classification());
 * }</pre>
 *
 * @see ErrorCategory
 */
public final class ErrorClassifier {

    // transient statuses need an "http"/"status" prefix: a bare 5xx number may be a size or a count
    private static final String STATUS_PREFIX =
            "\\b(?:http(?:/\\d(?:\\.\\d)?)?|status(?:\\s+code)?)[\\s:=]*";
    private static final Pattern SERVER_STATUS = Pattern.compile(STATUS_PREFIX + "5\\d{2}\\b");
    private static final Pattern RATE_LIMIT_STATUS = Pattern.compile(STATUS_PREFIX + "429\\b");
    private static final Pattern AUTH_STATUS = Pattern.compile("\\b40[13]\\b");
    private static final Pattern NOT_FOUND_STATUS = Pattern.compile("\\b404\\b");
    private static final Pattern VALIDATION_STATUS = Pattern.compile("\\b(400|409|422)\\b");

    /** Guards against cyclic cause chains. */
    private static final int MAX_CAUSE_DEPTH = 16;

    private ErrorClassifier() {
        // Utility class
    }

    /**
     * Classifies a failure into an error category.
     *
     * @param throwable the failure (may be null)
     * @return the category, {@link ErrorCategory#UNKNOWN} if unrecognized
     */
    public static ErrorCategory classify(Throwable throwable) {
        Throwable current = throwable;
        for (int depth = 0; current != null && depth < MAX_CAUSE_DEPTH; depth++) {
            ErrorCategory category = classifySingle(current);
            if (category != ErrorCategory.UNKNOWN) {
                return category;
            }
            Throwable cause = current.getCause();
            if (cause == current) {
                break;
            }
            current = cause;
        }
        return ErrorCategory.UNKNOWN;
    }

    /**
     * Classifies a failure directly into transient or permanent.
     *
     * @param throwable the failure (may be null)
     * @return the classification
     */
    public static ErrorClassification classification(Throwable throwable) {
        return classify(throwable).classification();
    }

    /**
     * Maps an HTTP-equivalent status code to a category.
     *
     * @param status the status code
     * @return the category, {@link ErrorCategory#UNKNOWN} for unmapped codes
     */
    public static ErrorCategory classifyStatus(int status) {
        if (status >= 500 && status < 600) {
            return ErrorCategory.SERVER_FAULT;
        }
        return switch (status) {
            case 401, 403 -> ErrorCategory.UNAUTHORIZED;
            case 404 -> ErrorCategory.NOT_FOUND;
            case 400, 409, 422 -> ErrorCategory.VALIDATION_FAILURE;
            case 408 -> ErrorCategory.NETWORK_TIMEOUT;
            case 429 -> ErrorCategory.RATE_LIMITED;
            default -> ErrorCategory.UNKNOWN;
        };
    }

    private static ErrorCategory classifySingle(Throwable t) {
        if (t instanceof RemoteStoreException) {
            ErrorCategory category = classifyRemote((RemoteStoreException) t);
            if (category != ErrorCategory.UNKNOWN) {
                return category;
            }
        }

        if (t instanceof SocketTimeoutException || t instanceof TimeoutException) {
            return ErrorCategory.NETWORK_TIMEOUT;
        }
        if (t instanceof ConnectException
                || t instanceof UnknownHostException
                || t instanceof NoRouteToHostException) {
            return ErrorCategory.CONNECTION_FAILURE;
        }

        return classifyByMessage(t.getMessage());
    }

    private static ErrorCategory classifyRemote(RemoteStoreException e) {
        OptionalInt status = e.status();
        if (status.isPresent()) {
            ErrorCategory byStatus = classifyStatus(status.getAsInt());
            if (byStatus != ErrorCategory.UNKNOWN) {
                return byStatus;
            }
        }
        String code = e.remoteCode();
        if (code == null) {
            return ErrorCategory.UNKNOWN;
        }
        return switch (code.toLowerCase(Locale.ROOT)) {
            case "rate_limited" -> ErrorCategory.RATE_LIMITED;
            case "internal_server_error", "service_unavailable", "database_connection_unavailable",
                    "gateway_timeout" -> ErrorCategory.SERVER_FAULT;
            case "unauthorized", "restricted_resource" -> ErrorCategory.UNAUTHORIZED;
            case "object_not_found" -> ErrorCategory.NOT_FOUND;
            case "validation_error", "invalid_json", "invalid_request", "invalid_request_url",
                    "conflict_error", "missing_version" -> ErrorCategory.VALIDATION_FAILURE;
            default -> ErrorCategory.UNKNOWN;
        };
    }

    /**
     * Classifies by message text. Transient patterns are checked first.
     */
    private static ErrorCategory classifyByMessage(String message) {
        if (message == null || message.isEmpty()) {
            return ErrorCategory.UNKNOWN;
        }
        String lower = message.toLowerCase(Locale.ROOT);

        if (lower.contains("timeout")
                || lower.contains("timed out")
                || lower.contains("deadline exceeded")) {
            return ErrorCategory.NETWORK_TIMEOUT;
        }
        if (lower.contains("connection refused")
                || lower.contains("no such host")
                || lower.contains("temporary failure")
                || lower.contains("name resolution")
                || lower.contains("network is unreachable")) {
            return ErrorCategory.CONNECTION_FAILURE;
        }
        if (RATE_LIMIT_STATUS.matcher(lower).find()
                || lower.contains("rate limit")
                || lower.contains("too many requests")) {
            return ErrorCategory.RATE_LIMITED;
        }
        if (SERVER_STATUS.matcher(lower).find()
                || lower.contains("internal server error")
                || lower.contains("service unavailable")
                || lower.contains("bad gateway")) {
            return ErrorCategory.SERVER_FAULT;
        }

        if (AUTH_STATUS.matcher(lower).find()
                || lower.contains("unauthorized")
                || lower.contains("forbidden")) {
            return ErrorCategory.UNAUTHORIZED;
        }
        if (NOT_FOUND_STATUS.matcher(lower).find() || lower.contains("not found")) {
            return ErrorCategory.NOT_FOUND;
        }
        if (VALIDATION_STATUS.matcher(lower).find()
                || lower.contains("validation")
                || lower.contains("malformed")) {
            return ErrorCategory.VALIDATION_FAILURE;
        }
        return ErrorCategory.UNKNOWN;
    }

    /**
     * Returns a detailed description of the classification result.
     *
     * @param throwable the failure to describe
     * @return formatted description including category and details
     */
    public static String describeError(Throwable throwable) {
        if (throwable == null) {
            return "null exception";
        }

        ErrorCategory category = classify(throwable);
        StringBuilder sb = new StringBuilder();
        sb.append("Category: ").append(category.name());
        sb.append("\nRetryable: ").append(category.isRetryable());
        sb.append("\nType: ").append(throwable.getClass().getName());
        sb.append("\nMessage: ").append(throwable.getMessage());

        Throwable cause = throwable.getCause();
        if (cause != null) {
            sb.append("\nCause: ").append(cause.getClass().getSimpleName());
            sb.append(" - ").append(cause.getMessage());
        }

        return sb.toString();
    }
}

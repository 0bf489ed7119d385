package net.shelfwatch.application.ai;

import com.openai.errors.OpenAIException;
import com.openai.errors.OpenAIIoException;
import com.openai.errors.OpenAIServiceException;
import java.util.Objects;

/**
 * Thrown when the AI backend cannot produce a usable analysis.
 */
public class AiAnalysisException extends RuntimeException {

    /**
     * Failure categories for AI analysis.
     */
    public enum ErrorCode {
        UNAVAILABLE,
        REQUEST_FAILED,
        INVALID_RESPONSE
    }

    private final ErrorCode errorCode;

    public AiAnalysisException(ErrorCode errorCode, String message) {
        this(errorCode, message, null);
    }

    public AiAnalysisException(ErrorCode errorCode, String message, Throwable cause) {
        super(message, cause);
        this.errorCode = Objects.requireNonNull(errorCode, "errorCode must not be null");
    }

    public ErrorCode errorCode() {
        return errorCode;
    }

    /**
     * Short description of an SDK failure: HTTP status and meaning, or the network cause.
     */
    public static String describeApiError(OpenAIException ex) {
        if (ex instanceof OpenAIServiceException serviceException) {
            int status = serviceException.statusCode();
            String explanation;
            if (status == 401) {
                explanation = "unauthorized, check API key";
            } else if (status == 404) {
                explanation = "not found, check base URL and model name";
            } else if (status == 429) {
                explanation = "rate limited";
            } else if (status >= 500) {
                explanation = "server error";
            } else {
                explanation = "request rejected";
            }
            return "HTTP %d %s".formatted(status, explanation);
        }
        if (ex instanceof OpenAIIoException) {
            return "network error: " + ex.getMessage();
        }
        return ex.getMessage() != null ? ex.getMessage() : ex.getClass().getSimpleName();
    }
}

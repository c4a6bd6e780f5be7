package ai.jira.adapter.jira;

import java.util.OptionalInt;

/**
 * Raised when the issue tracker rejects a request or cannot be reached.
 */
public class JiraServiceException extends RuntimeException {

    private final int statusCode;

    public JiraServiceException(String message) {
        this(message, -1, null);
    }

    public JiraServiceException(String message, Throwable cause) {
        this(message, -1, cause);
    }

    public JiraServiceException(String message, int statusCode) {
        this(message, statusCode, null);
    }

    private JiraServiceException(String message, int statusCode, Throwable cause) {
        super(message, cause);
        this.statusCode = statusCode;
    }

    /**
     * HTTP status of the failed response, empty for network failures and client-side rejections.
     */
    public OptionalInt statusCode() {
        return statusCode < 0 ? OptionalInt.empty() : OptionalInt.of(statusCode);
    }
}

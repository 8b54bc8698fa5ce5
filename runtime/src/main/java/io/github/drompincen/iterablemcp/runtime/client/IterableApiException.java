package io.github.drompincen.iterablemcp.runtime.client;

/**
 * Single failure type for upstream calls. A status of {@code 0} marks a transport
 * failure (DNS, refused connection, timeout) rather than an HTTP response.
 */
public class IterableApiException extends RuntimeException {

    public static final String NETWORK_ERROR = "Network Error";

    private final int status;
    private final String statusText;
    private final transient Object body;

    public IterableApiException(int status, String statusText, Object body) {
        super("Iterable API error: " + status + " " + statusText);
        this.status = status;
        this.statusText = statusText;
        this.body = body;
    }

    public static IterableApiException network(Throwable cause) {
        String message = cause.getMessage() != null ? cause.getMessage() : cause.getClass().getName();
        IterableApiException e = new IterableApiException(0, NETWORK_ERROR, message);
        e.initCause(cause);
        return e;
    }

    public int getStatus() {
        return status;
    }

    public String getStatusText() {
        return statusText;
    }

    public Object getBody() {
        return body;
    }

    public boolean isNetworkError() {
        return status == 0;
    }
}

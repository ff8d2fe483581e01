package io.github.devsha256.odataclient.exception;

/**
 * A request the service answered with an error status, or that never got an answer.
 * {@code statusCode} is 0 when no HTTP status was received.
 */
public class ODataRequestException extends ODataClientException {

    private final int statusCode;

    public ODataRequestException(String message, int statusCode) {
        super(message);
        this.statusCode = statusCode;
    }

    public ODataRequestException(String message, Throwable cause) {
        super(message, cause);
        this.statusCode = 0;
    }

    public int getStatusCode() {
        return statusCode;
    }
}

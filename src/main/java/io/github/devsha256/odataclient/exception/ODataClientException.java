package io.github.devsha256.odataclient.exception;

/**
 * Raised when a response from the service cannot be understood by the client.
 */
public class ODataClientException extends RuntimeException {

    public ODataClientException(String message) {
        super(message);
    }

    public ODataClientException(String message, Throwable cause) {
        super(message, cause);
    }
}

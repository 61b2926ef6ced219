package org.carball.aql.exception;

/**
 * Raised for failures on the client side of the wire: the server could not be reached,
 * or a payload could not be serialized or parsed.
 */
public class AqlClientException extends RuntimeException {

    public AqlClientException(String message) {
        super(message);
    }

    public AqlClientException(String message, Throwable cause) {
        super(message, cause);
    }
}

package dev.contentfarm.transport;

/**
 * Raised when a body is not exactly one well-formed JSON-RPC envelope.
 */
public class MalformedMessageException extends TransportException {

    public MalformedMessageException(String message) {
        super(message);
    }

    public MalformedMessageException(String message, Throwable cause) {
        super(message, cause);
    }
}

package dev.contentfarm.transport;

/**
 * Base type for every failure raised by the correlated transport. These are surfaced to the one
 * caller they concern and never affect other outstanding calls.
 */
public class TransportException extends RuntimeException {

    public TransportException(String message) {
        super(message);
    }

    public TransportException(String message, Throwable cause) {
        super(message, cause);
    }
}

package dev.contentfarm.transport;

/**
 * An inbound request or notification arrived before the upper layer registered its handler.
 */
public class HandlerNotSetException extends TransportException {

    public HandlerNotSetException() {
        super("Message handler not set");
    }
}

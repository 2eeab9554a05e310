package dev.contentfarm.transport;

/**
 * The transport was used before {@code start()} or after {@code close()}.
 */
public class NotStartedException extends TransportException {

    public NotStartedException(String state) {
        super("Transport is not started (state " + state + ")");
    }
}

package dev.contentfarm.transport;

/**
 * {@code start()} was called on a transport that has already been started or closed.
 */
public class AlreadyStartedException extends TransportException {

    public AlreadyStartedException(String state) {
        super("Transport cannot be started again (state " + state + ")");
    }
}

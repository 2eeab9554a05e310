package dev.contentfarm.transport;

/**
 * The transport was closed while the call was still outstanding.
 */
public class TransportClosedException extends TransportException {

    private final RequestId id;
    private final String reason;

    public TransportClosedException(RequestId id, String reason) {
        super("Request " + id + " was cancelled: " + reason);
        this.id = id;
        this.reason = reason;
    }

    public RequestId id() {
        return id;
    }

    public String reason() {
        return reason;
    }
}

package dev.contentfarm.transport;

/**
 * A correlation id was reused while the call that first used it is still outstanding.
 */
public class DuplicateIdException extends TransportException {

    private final RequestId id;

    public DuplicateIdException(RequestId id) {
        super("A call with id " + id + " is already outstanding");
        this.id = id;
    }

    public RequestId id() {
        return id;
    }
}

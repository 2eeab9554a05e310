package dev.contentfarm.transport;

import java.time.Duration;

/**
 * No matching response arrived within the call's timeout.
 */
public class RequestTimeoutException extends TransportException {

    private final RequestId id;
    private final Duration timeout;

    public RequestTimeoutException(RequestId id, Duration timeout) {
        super("Request " + id + " timed out after " + timeout.toMillis() + "ms");
        this.id = id;
        this.timeout = timeout;
    }

    public RequestId id() {
        return id;
    }

    public Duration timeout() {
        return timeout;
    }
}

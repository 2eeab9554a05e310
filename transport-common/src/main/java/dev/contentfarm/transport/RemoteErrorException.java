package dev.contentfarm.transport;

import dev.contentfarm.transport.JsonRpcResponse.JsonRpcError;

/**
 * The peer answered a correlated request with an error envelope.
 */
public class RemoteErrorException extends TransportException {

    private final RequestId id;
    private final JsonRpcError error;

    public RemoteErrorException(RequestId id, JsonRpcError error) {
        super(error.message().isBlank() ? "Unknown error" : error.message());
        this.id = id;
        this.error = error;
    }

    public RequestId id() {
        return id;
    }

    public JsonRpcError error() {
        return error;
    }
}

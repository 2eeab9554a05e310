package dev.contentfarm.transport;

/**
 * One JSON-RPC 2.0 envelope: a request, a response or a notification. Payload members
 * ({@code params}, {@code result}, {@code error.data}) are kept as opaque JSON trees; the transport
 * only ever looks at the envelope shape and the correlation id.
 */
public sealed interface JsonRpcMessage permits JsonRpcRequest, JsonRpcResponse, JsonRpcNotification {

    String JSONRPC_VERSION = "2.0";

    String jsonrpc();

    /**
     * Short lowercase name of the envelope shape, used in logs.
     */
    String kind();
}

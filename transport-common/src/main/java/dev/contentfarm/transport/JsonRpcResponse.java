package dev.contentfarm.transport;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.NullNode;
import java.util.Objects;

/**
 * The answer to a request. Exactly one of {@code result} and {@code error} is present; a JSON
 * {@code null} result is carried as {@link NullNode}, so a Java {@code null} always means "absent".
 *
 * @param jsonrpc protocol version, always {@code "2.0"}
 * @param id id of the request being answered; {@code null} only for protocol-level errors whose
 * origin could not be identified
 * @param result successful result, or {@code null} when this is an error response
 * @param error error details, or {@code null} when this is a successful response
 */
public record JsonRpcResponse(String jsonrpc, RequestId id, JsonNode result, JsonRpcError error)
    implements JsonRpcMessage {

    public JsonRpcResponse {
        Objects.requireNonNull(jsonrpc, "jsonrpc");
        if ((result == null) == (error == null)) {
            throw new IllegalArgumentException("A response carries exactly one of result or error");
        }
    }

    public static JsonRpcResponse success(RequestId id, JsonNode result) {
        return new JsonRpcResponse(JSONRPC_VERSION, id, result == null ? NullNode.getInstance() : result, null);
    }

    public static JsonRpcResponse failure(RequestId id, JsonRpcError error) {
        return new JsonRpcResponse(JSONRPC_VERSION, id, null, Objects.requireNonNull(error, "error"));
    }

    public boolean isError() {
        return error != null;
    }

    @Override
    public String kind() {
        return "response";
    }

    /**
     * Error member of a failed response.
     *
     * @param code JSON-RPC error code
     * @param message short description of the error
     * @param data optional detail defined by the sender
     */
    public record JsonRpcError(int code, String message, JsonNode data) {

        public static final int PARSE_ERROR = -32700;
        public static final int INVALID_REQUEST = -32600;
        public static final int METHOD_NOT_FOUND = -32601;
        public static final int INVALID_PARAMS = -32602;
        public static final int INTERNAL_ERROR = -32603;

        public JsonRpcError {
            Objects.requireNonNull(message, "message");
        }

        public static JsonRpcError of(int code, String message) {
            return new JsonRpcError(code, message, null);
        }
    }
}

package dev.contentfarm.transport;

import com.fasterxml.jackson.databind.JsonNode;
import java.util.Objects;

/**
 * A call that expects a correlated response.
 *
 * @param jsonrpc protocol version, always {@code "2.0"}
 * @param method method to invoke on the peer
 * @param params optional parameters, {@code null} when absent
 * @param id correlation id, never {@code null}
 */
public record JsonRpcRequest(String jsonrpc, String method, JsonNode params, RequestId id) implements JsonRpcMessage {

    public JsonRpcRequest {
        Objects.requireNonNull(jsonrpc, "jsonrpc");
        Objects.requireNonNull(method, "method");
        Objects.requireNonNull(id, "requests must carry an id");
    }

    public static JsonRpcRequest of(RequestId id, String method, JsonNode params) {
        return new JsonRpcRequest(JSONRPC_VERSION, method, params, id);
    }

    @Override
    public String kind() {
        return "request";
    }
}

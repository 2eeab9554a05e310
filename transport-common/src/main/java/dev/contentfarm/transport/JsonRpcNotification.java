package dev.contentfarm.transport;

import com.fasterxml.jackson.databind.JsonNode;
import java.util.Objects;

/**
 * A one-way message. Never answered.
 */
public record JsonRpcNotification(String jsonrpc, String method, JsonNode params) implements JsonRpcMessage {

    public JsonRpcNotification {
        Objects.requireNonNull(jsonrpc, "jsonrpc");
        Objects.requireNonNull(method, "method");
    }

    public static JsonRpcNotification of(String method, JsonNode params) {
        return new JsonRpcNotification(JSONRPC_VERSION, method, params);
    }

    @Override
    public String kind() {
        return "notification";
    }
}

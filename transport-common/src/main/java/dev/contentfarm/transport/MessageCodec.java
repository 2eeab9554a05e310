package dev.contentfarm.transport;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import dev.contentfarm.transport.JsonRpcResponse.JsonRpcError;
import java.util.Objects;

/**
 * Reads and writes single JSON-RPC envelopes. Batches are not supported: a body must hold exactly
 * one JSON object. Classification follows the envelope shape only: {@code method} plus {@code id}
 * is a request, {@code method} alone is a notification, {@code result} or {@code error} is a
 * response.
 */
public final class MessageCodec {

    private final ObjectMapper mapper;

    public MessageCodec() {
        this(new ObjectMapper());
    }

    public MessageCodec(ObjectMapper mapper) {
        this.mapper = Objects.requireNonNull(mapper, "mapper");
    }

    public ObjectMapper mapper() {
        return mapper;
    }

    public JsonRpcMessage read(String json) {
        if (json == null || json.isBlank()) {
            throw new MalformedMessageException("Empty message body");
        }
        JsonNode node;
        try {
            node = mapper.readTree(json);
        } catch (JsonProcessingException e) {
            throw new MalformedMessageException("Body is not valid JSON: " + e.getOriginalMessage(), e);
        }
        return read(node);
    }

    public JsonRpcMessage read(JsonNode node) {
        if (node == null || node.isMissingNode()) {
            throw new MalformedMessageException("Empty message body");
        }
        if (node.isArray()) {
            throw new MalformedMessageException("Batch messages are not supported");
        }
        if (!node.isObject()) {
            throw new MalformedMessageException("Message must be a JSON object");
        }
        String version = node.path("jsonrpc").asText(null);
        if (!JsonRpcMessage.JSONRPC_VERSION.equals(version)) {
            throw new MalformedMessageException("Unsupported jsonrpc version: " + version);
        }

        if (node.has("method")) {
            JsonNode method = node.get("method");
            if (!method.isTextual() || method.asText().isEmpty()) {
                throw new MalformedMessageException("method must be a non-empty string");
            }
            JsonNode params = params(node);
            if (!node.has("id")) {
                return new JsonRpcNotification(version, method.asText(), params);
            }
            RequestId id = RequestId.fromJson(node.get("id"));
            if (id == null) {
                throw new MalformedMessageException("Request id must not be null");
            }
            return new JsonRpcRequest(version, method.asText(), params, id);
        }

        boolean hasResult = node.has("result");
        boolean hasError = node.has("error");
        if (hasResult && hasError) {
            throw new MalformedMessageException("Response carries both result and error");
        }
        if (!hasResult && !hasError) {
            throw new MalformedMessageException("Message is neither a request, a notification nor a response");
        }
        RequestId id = RequestId.fromJson(node.get("id"));
        if (hasResult) {
            return new JsonRpcResponse(version, id, node.get("result"), null);
        }
        return new JsonRpcResponse(version, id, null, error(node.get("error")));
    }

    public String write(JsonRpcMessage message) {
        try {
            return mapper.writeValueAsString(toTree(message));
        } catch (JsonProcessingException e) {
            throw new TransportException("Failed to serialise " + message.kind(), e);
        }
    }

    public ObjectNode toTree(JsonRpcMessage message) {
        ObjectNode node = mapper.createObjectNode();
        node.put("jsonrpc", message.jsonrpc());
        if (message instanceof JsonRpcRequest request) {
            node.set("id", request.id().toJson());
            node.put("method", request.method());
            if (request.params() != null) {
                node.set("params", request.params());
            }
        } else if (message instanceof JsonRpcNotification notification) {
            node.put("method", notification.method());
            if (notification.params() != null) {
                node.set("params", notification.params());
            }
        } else if (message instanceof JsonRpcResponse response) {
            if (response.id() != null) {
                node.set("id", response.id().toJson());
            } else {
                node.putNull("id");
            }
            if (response.isError()) {
                node.set("error", errorTree(response.error()));
            } else {
                node.set("result", response.result());
            }
        }
        return node;
    }

    public ObjectNode errorTree(JsonRpcError error) {
        ObjectNode node = mapper.createObjectNode();
        node.put("code", error.code());
        node.put("message", error.message());
        if (error.data() != null) {
            node.set("data", error.data());
        }
        return node;
    }

    private static JsonNode params(JsonNode node) {
        JsonNode params = node.get("params");
        if (params == null || params.isNull()) {
            return null;
        }
        if (!params.isObject() && !params.isArray()) {
            throw new MalformedMessageException("params must be an object or an array");
        }
        return params;
    }

    private static JsonRpcError error(JsonNode node) {
        if (node == null || !node.isObject()) {
            throw new MalformedMessageException("error must be an object");
        }
        JsonNode code = node.get("code");
        if (code == null || !code.canConvertToInt() || !code.isIntegralNumber()) {
            throw new MalformedMessageException("error.code must be an integer");
        }
        JsonNode data = node.get("data");
        return new JsonRpcError(code.asInt(), node.path("message").asText(""), data);
    }
}

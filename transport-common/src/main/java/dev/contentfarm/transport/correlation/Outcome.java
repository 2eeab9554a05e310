package dev.contentfarm.transport.correlation;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.NullNode;
import dev.contentfarm.transport.JsonRpcResponse;
import dev.contentfarm.transport.JsonRpcResponse.JsonRpcError;
import java.util.Objects;

/**
 * How a pending call ends when its response arrives.
 */
public sealed interface Outcome permits Outcome.Success, Outcome.Failure {

    static Outcome success(JsonNode result) {
        return new Success(result == null ? NullNode.getInstance() : result);
    }

    static Outcome failure(JsonRpcError error) {
        return new Failure(Objects.requireNonNull(error, "error"));
    }

    static Outcome of(JsonRpcResponse response) {
        return response.isError() ? failure(response.error()) : success(response.result());
    }

    record Success(JsonNode result) implements Outcome {
    }

    record Failure(JsonRpcError error) implements Outcome {
    }
}

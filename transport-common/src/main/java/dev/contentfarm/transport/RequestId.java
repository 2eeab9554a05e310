package dev.contentfarm.transport;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.LongNode;
import com.fasterxml.jackson.databind.node.TextNode;
import java.util.Objects;

/**
 * Correlation identifier pairing a request with its response. Either a string or an integer;
 * the two kinds never compare equal, so {@code "7"} and {@code 7} are different ids.
 */
public record RequestId(Object value) {

    public RequestId {
        Objects.requireNonNull(value, "value");
        if (value instanceof Integer || value instanceof Short || value instanceof Byte) {
            value = ((Number) value).longValue();
        }
        if (!(value instanceof String) && !(value instanceof Long)) {
            throw new IllegalArgumentException("Request id must be a string or an integer, got " + value.getClass().getName());
        }
    }

    public static RequestId of(String value) {
        return new RequestId(value);
    }

    public static RequestId of(long value) {
        return new RequestId(value);
    }

    /**
     * Read an id member from a JSON tree.
     *
     * @return the id, or {@code null} when the member is missing or JSON {@code null}
     * @throws MalformedMessageException when the member is neither a string nor an integer
     */
    public static RequestId fromJson(JsonNode node) {
        if (node == null || node.isMissingNode() || node.isNull()) {
            return null;
        }
        if (node.isTextual()) {
            return new RequestId(node.asText());
        }
        if (node.isIntegralNumber() && node.canConvertToLong()) {
            return new RequestId(node.asLong());
        }
        throw new MalformedMessageException("Request id must be a string or an integer: " + node);
    }

    public JsonNode toJson() {
        return value instanceof Long number ? LongNode.valueOf(number) : TextNode.valueOf((String) value);
    }

    public boolean isNumeric() {
        return value instanceof Long;
    }

    @Override
    public String toString() {
        return String.valueOf(value);
    }
}

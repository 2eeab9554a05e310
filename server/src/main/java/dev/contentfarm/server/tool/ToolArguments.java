package dev.contentfarm.server.tool;

import java.util.Map;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;

import io.modelcontextprotocol.spec.McpSchema;

/**
 * Typed access to tool call arguments. Missing and JSON {@code null} members yield the fallback;
 * members of the wrong type are rejected.
 */
final class ToolArguments {

	private ToolArguments() {
	}

	static JsonNode of(ObjectMapper mapper, McpSchema.CallToolRequest request) {
		Map<String, Object> arguments = request.arguments();
		return arguments == null ? mapper.createObjectNode() : mapper.valueToTree(arguments);
	}

	static String string(JsonNode arguments, String name, String fallback) {
		JsonNode value = member(arguments, name);
		if (value == null) {
			return fallback;
		}
		if (!value.isTextual()) {
			throw new IllegalArgumentException(name + " must be a string");
		}
		return value.asText();
	}

	static boolean bool(JsonNode arguments, String name, boolean fallback) {
		JsonNode value = member(arguments, name);
		if (value == null) {
			return fallback;
		}
		if (!value.isBoolean()) {
			throw new IllegalArgumentException(name + " must be a boolean");
		}
		return value.asBoolean();
	}

	static int integer(JsonNode arguments, String name, int fallback) {
		JsonNode value = member(arguments, name);
		if (value == null) {
			return fallback;
		}
		if (!value.isIntegralNumber() || !value.canConvertToInt()) {
			throw new IllegalArgumentException(name + " must be an integer");
		}
		return value.asInt();
	}

	private static JsonNode member(JsonNode arguments, String name) {
		JsonNode value = arguments.get(name);
		return value == null || value.isNull() ? null : value;
	}

}

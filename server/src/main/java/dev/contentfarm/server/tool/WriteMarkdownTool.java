package dev.contentfarm.server.tool;

import java.io.IOException;
import java.nio.file.AccessDeniedException;
import java.nio.file.FileAlreadyExistsException;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;
import org.springframework.util.StringUtils;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;

import lombok.RequiredArgsConstructor;

import dev.contentfarm.server.model.WriteResult;
import dev.contentfarm.server.service.MarkdownService;
import dev.contentfarm.server.service.UnsupportedExtensionException;
import io.modelcontextprotocol.server.McpServerFeatures;
import io.modelcontextprotocol.server.McpSyncServerExchange;
import io.modelcontextprotocol.spec.McpSchema;

/**
 * The {@code write_markdown} tool. Writes a markdown document under the content directory,
 * asking the client for confirmation before replacing an existing document.
 */
@Component
@RequiredArgsConstructor
public class WriteMarkdownTool implements McpTool {

	private static final Logger logger = LoggerFactory.getLogger(WriteMarkdownTool.class);

	static final String NAME = "write_markdown";

	private final MarkdownService markdownService;

	private final ObjectMapper objectMapper;

	@Override
	public McpServerFeatures.SyncToolSpecification specification() {
		return McpServerFeatures.SyncToolSpecification.builder()
			.tool(McpSchema.Tool.builder()
				.name(NAME)
				.title("Write markdown document")
				.description("Write a markdown document relative to the content directory. "
						+ "The client is asked before an existing document is replaced unless allowOverwrite is true.")
				.inputSchema(inputSchema())
				.build())
			.callHandler((exchange, callToolRequest) -> call(ToolArguments.of(this.objectMapper, callToolRequest),
					exchange))
			.build();
	}

	/**
	 * Handle a {@code write_markdown} call, prompting for overwrite confirmation when the target
	 * exists.
	 * @param arguments call arguments
	 * @param exchange server exchange used for the confirmation prompt
	 * @return tool result summarizing the write, or an error result
	 */
	McpSchema.CallToolResult call(JsonNode arguments, McpSyncServerExchange exchange) {
		String path;
		String content;
		boolean allowOverwrite;
		try {
			path = ToolArguments.string(arguments, "path", null);
			content = ToolArguments.string(arguments, "content", null);
			allowOverwrite = ToolArguments.bool(arguments, "allowOverwrite", false);
		}
		catch (IllegalArgumentException e) {
			return errorResult(e.getMessage(), Map.of("reason", "invalid_arguments"));
		}
		if (!StringUtils.hasText(path)) {
			return errorResult("path argument is required", Map.of("missing", "path"));
		}
		if (content == null) {
			return errorResult("content argument is required", Map.of("missing", "content"));
		}
		logger.debug("Handling write_markdown request for path {} (overwrite allowed: {})", path, allowOverwrite);

		try {
			boolean overwrite = allowOverwrite;
			if (!allowOverwrite && this.markdownService.exists(path)) {
				overwrite = confirmOverwrite(exchange, path);
				if (!overwrite) {
					return successResult("Skipped writing to " + path, Map.of("path", path, "status", "skipped"));
				}
			}
			WriteResult result = this.markdownService.write(path, content, overwrite);
			return successResult(result.summaryLine(), result.toStructured());
		}
		catch (AccessDeniedException e) {
			return errorResult(e.getReason(), Map.of("path", path));
		}
		catch (UnsupportedExtensionException e) {
			return errorResult(e.getMessage(), Map.of("path", path, "extension", e.getExtension()));
		}
		catch (FileAlreadyExistsException e) {
			logger.debug("Write aborted because {} already exists without overwrite permission", path, e);
			return errorResult("File exists and overwrite is not permitted: " + path,
					Map.of("path", path, "status", "exists"));
		}
		catch (IOException e) {
			logger.warn("Failed to write markdown document {}", path, e);
			return errorResult("Failed to write markdown file: " + path + ". " + e.getMessage(), Map.of("path", path));
		}
	}

	/**
	 * Ask the client whether an existing document should be replaced. Clients that did not
	 * declare the elicitation capability, and prompts that fail or time out, count as declined.
	 * @param exchange server exchange used to send the prompt
	 * @param path document path under consideration
	 * @return {@code true} if the client confirmed the overwrite
	 * @throws IOException if path resolution fails
	 */
	private boolean confirmOverwrite(McpSyncServerExchange exchange, String path) throws IOException {
		String normalized = this.markdownService.relativeString(this.markdownService.resolve(path));
		McpSchema.ClientCapabilities capabilities = exchange.getClientCapabilities();
		if (capabilities == null || capabilities.elicitation() == null) {
			logger.info("Client cannot confirm overwrite of {}; declining", normalized);
			return false;
		}

		Map<String, Object> properties = new LinkedHashMap<>();
		properties.put("confirm",
				Map.of("type", "boolean", "description", "Set to true to overwrite the existing document."));
		Map<String, Object> schema = new LinkedHashMap<>();
		schema.put("type", "object");
		schema.put("properties", properties);
		schema.put("required", List.of("confirm"));

		logger.info("Prompting for overwrite confirmation of {}", normalized);
		McpSchema.ElicitResult result;
		try {
			result = exchange.createElicitation(McpSchema.ElicitRequest.builder()
				.message("Document exists. Overwrite " + normalized + "?")
				.requestedSchema(schema)
				.build());
		}
		catch (RuntimeException e) {
			logger.warn("Overwrite confirmation for {} failed: {}", normalized, e.getMessage());
			return false;
		}

		if (result == null || result.action() != McpSchema.ElicitResult.Action.ACCEPT) {
			logger.info("Overwrite declined for {}", normalized);
			return false;
		}
		Object confirm = result.content() != null ? result.content().get("confirm") : null;
		boolean accepted = Boolean.TRUE.equals(confirm);
		logger.info("Overwrite {} for {}", accepted ? "confirmed" : "declined", normalized);
		return accepted;
	}

	private McpSchema.JsonSchema inputSchema() {
		Map<String, Object> properties = new LinkedHashMap<>();
		properties.put("path", Map.of("type", "string",
				"description", "Path of the markdown document relative to the content directory."));
		properties.put("content", Map.of("type", "string", "description", "Markdown text to write."));
		properties.put("allowOverwrite", Map.of("type", "boolean",
				"description", "Set to true to replace an existing document without asking."));
		return new McpSchema.JsonSchema("object", properties, List.of("path", "content"), false, null, null);
	}

	private McpSchema.CallToolResult successResult(String message, Map<String, Object> structuredContent) {
		logger.info("Success response: {}", message);
		return McpSchema.CallToolResult.builder()
			.addTextContent(message)
			.structuredContent(structuredContent)
			.build();
	}

	private McpSchema.CallToolResult errorResult(String message, Map<String, Object> structuredContent) {
		logger.warn("Error response: {}", message);
		return McpSchema.CallToolResult.builder()
			.addTextContent(message)
			.isError(true)
			.structuredContent(structuredContent)
			.build();
	}

}

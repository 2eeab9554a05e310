package dev.contentfarm.server.resource;

import java.io.IOException;
import java.nio.file.AccessDeniedException;
import java.nio.file.NoSuchFileException;
import java.util.List;
import java.util.Map;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import lombok.RequiredArgsConstructor;

import dev.contentfarm.server.model.MarkdownDocument;
import dev.contentfarm.server.service.MarkdownService;
import dev.contentfarm.server.service.UnsupportedExtensionException;
import io.modelcontextprotocol.server.McpServerFeatures;
import io.modelcontextprotocol.server.McpSyncServerExchange;
import io.modelcontextprotocol.spec.McpError;
import io.modelcontextprotocol.spec.McpSchema;

/**
 * Serves markdown documents from the content directory as {@code markdown://{filePath}} resources.
 */
@Component
@RequiredArgsConstructor
public class MarkdownFileResource {

	private static final Logger logger = LoggerFactory.getLogger(MarkdownFileResource.class);

	static final String SCHEME_PREFIX = "markdown://";

	static final String URI_TEMPLATE = SCHEME_PREFIX + "{filePath}";

	static final String MIME_TYPE = "text/markdown";

	static final int RESOURCE_NOT_FOUND = -32002;

	private final MarkdownService markdownService;

	/**
	 * Provide the resource specification for {@code markdown://{filePath}}. The SDK matches read
	 * requests against the template, so one specification serves every document.
	 * @return resource specification reading markdown documents
	 */
	public McpServerFeatures.SyncResourceSpecification specification() {
		McpSchema.Resource resource = McpSchema.Resource.builder()
			.uri(URI_TEMPLATE)
			.name("markdown")
			.title("Markdown document")
			.description("Markdown documents stored under " + this.markdownService.contentRoot())
			.mimeType(MIME_TYPE)
			.build();
		return new McpServerFeatures.SyncResourceSpecification(resource, this::handleRead);
	}

	private McpSchema.ReadResourceResult handleRead(McpSyncServerExchange exchange,
			McpSchema.ReadResourceRequest request) {
		return read(request.uri());
	}

	/**
	 * Read the document a {@code markdown://} URI points at.
	 * @param uri resource URI; everything after {@code markdown://} is the path relative to the
	 * content directory
	 * @return read result holding the document as {@code text/markdown}
	 * @throws McpError when the URI is invalid, the path is rejected, the document does
	 * not exist or cannot be read
	 */
	public McpSchema.ReadResourceResult read(String uri) {
		if (!uri.startsWith(SCHEME_PREFIX) || uri.length() == SCHEME_PREFIX.length()) {
			throw error(McpSchema.ErrorCodes.INVALID_PARAMS, "Unsupported resource uri: " + uri);
		}
		String filePath = uri.substring(SCHEME_PREFIX.length());
		logger.debug("Serving markdown resource {}", uri);
		try {
			MarkdownDocument document = this.markdownService.read(filePath);
			Map<String, Object> meta = document.lastModified() != null
					? Map.of("lastModified", document.lastModified().toString())
					: null;
			McpSchema.TextResourceContents contents = meta != null
					? new McpSchema.TextResourceContents(uri, MIME_TYPE, document.content(), meta)
					: new McpSchema.TextResourceContents(uri, MIME_TYPE, document.content());
			return new McpSchema.ReadResourceResult(List.of(contents));
		}
		catch (AccessDeniedException e) {
			logger.warn("Rejected markdown resource outside the content directory: {}", uri);
			throw error(McpSchema.ErrorCodes.INVALID_PARAMS, e.getReason());
		}
		catch (UnsupportedExtensionException e) {
			throw error(McpSchema.ErrorCodes.INVALID_PARAMS, e.getMessage());
		}
		catch (NoSuchFileException e) {
			throw error(RESOURCE_NOT_FOUND, "Resource not found: " + uri);
		}
		catch (IOException e) {
			logger.warn("Failed to read markdown resource {}", uri, e);
			throw error(McpSchema.ErrorCodes.INTERNAL_ERROR,
					"Failed to read markdown file: " + filePath + ". " + e.getMessage());
		}
	}

	private static McpError error(int code, String message) {
		return new McpError(new McpSchema.JSONRPCResponse.JSONRPCError(code, message, null));
	}

}

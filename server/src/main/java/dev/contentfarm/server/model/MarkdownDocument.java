package dev.contentfarm.server.model;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * A markdown document read from the content directory.
 * @param path path relative to the content root, using forward slashes
 * @param content document text
 * @param lastModified timestamp of the last modification, when available
 */
public record MarkdownDocument(String path, String content, Instant lastModified) {

	/**
	 * Convert the document to a structured map suitable for MCP responses.
	 * @return structured representation of the document
	 */
	public Map<String, Object> toStructured() {
		Map<String, Object> structured = new LinkedHashMap<>();
		structured.put("path", path);
		structured.put("content", content);
		if (lastModified != null) {
			structured.put("lastModified", lastModified.toString());
		}
		return structured;
	}

}

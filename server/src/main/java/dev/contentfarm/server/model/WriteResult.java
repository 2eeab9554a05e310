package dev.contentfarm.server.model;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Outcome of writing a markdown document.
 * @param path path relative to the content root
 * @param status whether the document was created or replaced
 * @param lastModified timestamp of the write, when available
 */
public record WriteResult(String path, Status status, Instant lastModified) {

	public enum Status {
		CREATED, UPDATED
	}

	public Map<String, Object> toStructured() {
		Map<String, Object> structured = new LinkedHashMap<>();
		structured.put("path", path);
		structured.put("status", status.name().toLowerCase());
		if (lastModified != null) {
			structured.put("lastModified", lastModified.toString());
		}
		return structured;
	}

	public String summaryLine() {
		return switch (status) {
			case CREATED -> "Created markdown document %s".formatted(path);
			case UPDATED -> "Updated markdown document %s".formatted(path);
		};
	}

}

package dev.contentfarm.server.config;

import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.List;
import java.util.Locale;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.util.StringUtils;

/**
 * Configuration options for the markdown content store. Allows overriding the content directory
 * via Spring configuration while honouring the {@code MARKDOWN_CONTENT_PATH} environment variable.
 */
@ConfigurationProperties(prefix = "mcp.markdown")
public class MarkdownProperties {

	static final String DEFAULT_CONTENT_PATH = "./content";

	/**
	 * An optional explicit content directory configured via application properties.
	 */
	private String contentPath;

	/**
	 * File extensions that may be read or written, including the leading dot.
	 */
	private List<String> allowedExtensions = List.of(".md", ".markdown");

	/**
	 * Retrieve the configured content directory, if any.
	 * @return configured content directory, or {@code null} when not explicitly set
	 */
	public String getContentPath() {
		return contentPath;
	}

	/**
	 * Set the directory markdown documents are served from.
	 * @param contentPath human-readable directory path
	 */
	public void setContentPath(String contentPath) {
		this.contentPath = contentPath;
	}

	/**
	 * Retrieve the allowed extensions.
	 * @return lower-case extensions, each starting with a dot
	 */
	public List<String> getAllowedExtensions() {
		return allowedExtensions;
	}

	/**
	 * Replace the allowed extensions. Entries are lower-cased and prefixed with a dot when missing.
	 * @param allowedExtensions extensions to accept
	 */
	public void setAllowedExtensions(List<String> allowedExtensions) {
		this.allowedExtensions = allowedExtensions == null ? List.of()
				: allowedExtensions.stream()
					.filter(StringUtils::hasText)
					.map(ext -> ext.trim().toLowerCase(Locale.ROOT))
					.map(ext -> ext.startsWith(".") ? ext : "." + ext)
					.toList();
	}

	/**
	 * Resolve the directory markdown documents live in, preferring the configured property, then
	 * the {@code MARKDOWN_CONTENT_PATH} environment variable, and finally {@code ./content}
	 * relative to the working directory.
	 * @return the normalized absolute content root
	 */
	public Path determineContentRoot() {
		if (StringUtils.hasText(this.contentPath)) {
			return normalize(Paths.get(this.contentPath));
		}
		String environmentOverride = System.getenv("MARKDOWN_CONTENT_PATH");
		if (StringUtils.hasText(environmentOverride)) {
			return normalize(Paths.get(environmentOverride));
		}
		return normalize(Paths.get(DEFAULT_CONTENT_PATH));
	}

	private static Path normalize(Path candidate) {
		return candidate.toAbsolutePath().normalize();
	}

}

package dev.contentfarm.server.service;

import java.io.IOException;
import java.nio.file.AccessDeniedException;
import java.nio.file.FileAlreadyExistsException;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.time.Instant;
import java.util.List;
import java.util.Locale;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import dev.contentfarm.server.config.MarkdownProperties;
import dev.contentfarm.server.model.MarkdownDocument;
import dev.contentfarm.server.model.WriteResult;

/**
 * Service layer that reads and writes markdown documents relative to the configured content
 * directory. Every path is checked twice before it is touched: it must stay inside the content
 * root, and its extension must be on the allow-list.
 */
@Service
public class MarkdownService {

	private static final Logger logger = LoggerFactory.getLogger(MarkdownService.class);

	private final Path contentRoot;

	private final List<String> allowedExtensions;

	/**
	 * Create a new service rooted at the directory defined by {@link MarkdownProperties}.
	 * @param properties configuration supplying the content directory and allowed extensions
	 */
	@Autowired
	public MarkdownService(MarkdownProperties properties) {
		this(properties.determineContentRoot(), properties.getAllowedExtensions());
	}

	/**
	 * Create a new service rooted at an explicit directory.
	 * @param contentRoot directory documents are served from
	 * @param allowedExtensions lower-case extensions including the leading dot
	 */
	public MarkdownService(Path contentRoot, List<String> allowedExtensions) {
		this.contentRoot = contentRoot.toAbsolutePath().normalize();
		this.allowedExtensions = List.copyOf(allowedExtensions);
		logger.info("Serving markdown content from {} (extensions {})", this.contentRoot, this.allowedExtensions);
	}

	/**
	 * Retrieve the normalized content root all operations are scoped to.
	 * @return absolute content directory
	 */
	public Path contentRoot() {
		return this.contentRoot;
	}

	/**
	 * Read a markdown document as UTF-8 text.
	 * @param relativePath document path relative to the content root
	 * @return the document with its content and metadata
	 * @throws AccessDeniedException when the path escapes the content root
	 * @throws IOException when the extension is not allowed or the file cannot be read
	 */
	public MarkdownDocument read(String relativePath) throws IOException {
		Path file = resolve(relativePath);
		if (!Files.exists(file)) {
			throw new NoSuchFileException(relativePath);
		}
		if (!Files.isRegularFile(file)) {
			throw new IOException("Target exists but is not a regular file: " + relativePath);
		}
		String content = Files.readString(file);
		Instant lastModified = Files.getLastModifiedTime(file).toInstant();
		return new MarkdownDocument(relativeString(file), content, lastModified);
	}

	/**
	 * Determine whether a markdown document exists.
	 * @param relativePath candidate path relative to the content root
	 * @return {@code true} if the document exists
	 * @throws IOException when the path is rejected
	 */
	public boolean exists(String relativePath) throws IOException {
		return Files.exists(resolve(relativePath));
	}

	/**
	 * Write a markdown document, creating parent directories as needed.
	 * @param relativePath document path relative to the content root
	 * @param content UTF-8 content to write
	 * @param overwrite {@code true} to permit replacing an existing document
	 * @return result describing the write outcome
	 * @throws FileAlreadyExistsException when the document exists and {@code overwrite} is false
	 * @throws IOException when the path is rejected or the write fails
	 */
	public WriteResult write(String relativePath, String content, boolean overwrite) throws IOException {
		Path target = resolve(relativePath);
		Path parent = target.getParent();
		if (parent != null) {
			Files.createDirectories(parent);
		}
		boolean existed = Files.exists(target);
		if (existed && !Files.isRegularFile(target)) {
			throw new IOException("Target exists and is not a regular file: " + relativePath);
		}
		if (existed && !overwrite) {
			throw new FileAlreadyExistsException(relativePath);
		}
		Files.writeString(target, content);
		Instant lastModified = Files.getLastModifiedTime(target).toInstant();
		logger.info("{} markdown document {}", existed ? "Updated" : "Created", target);
		return new WriteResult(relativeString(target), existed ? WriteResult.Status.UPDATED : WriteResult.Status.CREATED,
				lastModified);
	}

	/**
	 * Resolve a relative path against the content root, rejecting traversal outside the root and
	 * extensions that are not on the allow-list.
	 * @param relativePath candidate relative path; a leading slash is ignored
	 * @return resolved absolute path within the content root
	 * @throws AccessDeniedException when the path would escape the content root
	 * @throws UnsupportedExtensionException when the extension is not allowed
	 */
	public Path resolve(String relativePath) throws IOException {
		String trimmed = relativePath == null ? "" : relativePath.replaceFirst("^/+", "");
		Path candidate = this.contentRoot.resolve(trimmed).normalize();
		if (!candidate.startsWith(this.contentRoot)) {
			throw new AccessDeniedException(relativePath, null, "Access to the requested path is not allowed");
		}
		String extension = extensionOf(candidate);
		if (!this.allowedExtensions.contains(extension)) {
			throw new UnsupportedExtensionException(extension);
		}
		return candidate;
	}

	/**
	 * Produce a forward-slash formatted path relative to the content root.
	 * @param path absolute path within the content root
	 * @return relative path string
	 */
	public String relativeString(Path path) {
		String relative = this.contentRoot.relativize(path).toString().replace('\\', '/');
		return relative.isEmpty() ? "." : relative;
	}

	private static String extensionOf(Path path) {
		Path fileName = path.getFileName();
		if (fileName == null) {
			return "";
		}
		String name = fileName.toString();
		int dot = name.lastIndexOf('.');
		return dot <= 0 ? "" : name.substring(dot).toLowerCase(Locale.ROOT);
	}

}

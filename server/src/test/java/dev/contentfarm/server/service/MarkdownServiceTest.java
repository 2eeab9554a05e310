package dev.contentfarm.server.service;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.nio.file.AccessDeniedException;
import java.nio.file.FileAlreadyExistsException;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.util.List;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import dev.contentfarm.server.model.MarkdownDocument;
import dev.contentfarm.server.model.WriteResult;

class MarkdownServiceTest {

	@TempDir
	Path workspace;

	private Path contentRoot;

	private MarkdownService service;

	@BeforeEach
	void setUp() throws Exception {
		this.contentRoot = Files.createDirectories(this.workspace.resolve("content"));
		this.service = new MarkdownService(this.contentRoot, List.of(".md", ".markdown"));
	}

	@Test
	void readsDocumentInsideContentRoot() throws Exception {
		Files.createDirectories(this.contentRoot.resolve("posts"));
		Files.writeString(this.contentRoot.resolve("posts/hello.md"), "# Hello");

		MarkdownDocument document = this.service.read("posts/hello.md");

		assertEquals("posts/hello.md", document.path());
		assertEquals("# Hello", document.content());
		assertTrue(document.lastModified() != null);
	}

	@Test
	void leadingSlashIsRelativeToContentRoot() throws Exception {
		Files.writeString(this.contentRoot.resolve("intro.markdown"), "intro");

		assertEquals("intro", this.service.read("/intro.markdown").content());
	}

	@Test
	void rejectsTraversalOutsideContentRoot() throws Exception {
		Files.writeString(this.workspace.resolve("secret.md"), "secret");

		AccessDeniedException error = assertThrows(AccessDeniedException.class,
				() -> this.service.read("../secret.md"));
		assertEquals("Access to the requested path is not allowed", error.getReason());
	}

	@Test
	void rejectsExtensionsOutsideAllowList() {
		UnsupportedExtensionException error = assertThrows(UnsupportedExtensionException.class,
				() -> this.service.read("notes.txt"));
		assertEquals(".txt", error.getExtension());
		assertEquals("Unsupported file extension: .txt", error.getMessage());
	}

	@Test
	void extensionCheckIgnoresCase() throws Exception {
		Files.writeString(this.contentRoot.resolve("LOUD.MD"), "loud");

		assertEquals("loud", this.service.read("LOUD.MD").content());
	}

	@Test
	void missingDocumentIsReported() {
		assertThrows(NoSuchFileException.class, () -> this.service.read("missing.md"));
	}

	@Test
	void writeCreatesParentDirectories() throws Exception {
		WriteResult result = this.service.write("drafts/2024/post.md", "draft", false);

		assertEquals(WriteResult.Status.CREATED, result.status());
		assertEquals("drafts/2024/post.md", result.path());
		assertEquals("draft", Files.readString(this.contentRoot.resolve("drafts/2024/post.md")));
	}

	@Test
	void writeRefusesToReplaceWithoutOverwrite() throws Exception {
		this.service.write("post.md", "first", false);

		assertThrows(FileAlreadyExistsException.class, () -> this.service.write("post.md", "second", false));

		WriteResult replaced = this.service.write("post.md", "second", true);
		assertEquals(WriteResult.Status.UPDATED, replaced.status());
		assertEquals("second", Files.readString(this.contentRoot.resolve("post.md")));
	}

	@Test
	void writeRejectsTraversal() {
		assertThrows(AccessDeniedException.class, () -> this.service.write("../../escape.md", "x", true));
		assertTrue(Files.notExists(this.workspace.resolve("escape.md")));
	}

}

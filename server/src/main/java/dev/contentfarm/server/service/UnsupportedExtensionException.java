package dev.contentfarm.server.service;

import java.io.IOException;

/**
 * A document path names a file whose extension is not on the configured allow-list.
 */
public class UnsupportedExtensionException extends IOException {

	private final String extension;

	public UnsupportedExtensionException(String extension) {
		super("Unsupported file extension: " + extension);
		this.extension = extension;
	}

	public String getExtension() {
		return extension;
	}

}

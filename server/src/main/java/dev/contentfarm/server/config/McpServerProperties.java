package dev.contentfarm.server.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Identity the server reports during {@code initialize} and on the health route.
 */
@ConfigurationProperties("mcp.server")
public record McpServerProperties(String name, String version, String instructions) {

	public McpServerProperties {
		name = name == null || name.isBlank() ? "content-farm-mcp" : name;
		version = version == null || version.isBlank() ? "1.0.0" : version;
		instructions = instructions == null || instructions.isBlank()
				? "Research topics and read or write markdown content for the content farm." : instructions;
	}

}

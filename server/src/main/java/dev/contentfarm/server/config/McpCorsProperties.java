package dev.contentfarm.server.config;

import java.util.List;

import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Origins allowed to call the MCP route from a browser. An empty list registers no CORS mapping.
 */
@ConfigurationProperties("mcp.cors")
public record McpCorsProperties(List<String> allowedOrigins) {

	public McpCorsProperties {
		allowedOrigins = allowedOrigins == null ? List.of() : List.copyOf(allowedOrigins);
	}

}

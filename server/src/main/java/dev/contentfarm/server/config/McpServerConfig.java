package dev.contentfarm.server.config;

import java.time.Clock;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.servlet.function.RouterFunction;
import org.springframework.web.servlet.function.RouterFunctions;
import org.springframework.web.servlet.function.ServerResponse;

import dev.contentfarm.server.resource.MarkdownFileResource;
import dev.contentfarm.server.tool.McpTool;
import dev.contentfarm.server.transport.CorrelatedMcpTransportProvider;
import io.modelcontextprotocol.server.McpServer;
import io.modelcontextprotocol.server.McpSyncServer;
import io.modelcontextprotocol.spec.McpSchema;

/**
 * Spring configuration class that assembles the Model Context Protocol (MCP) server, connecting
 * the research and markdown tooling to the correlated transport.
 */
@Configuration
@EnableConfigurationProperties({ McpServerProperties.class, MarkdownProperties.class, PeerProperties.class })
public class McpServerConfig {

	private static final Logger logger = LoggerFactory.getLogger(McpServerConfig.class);

	@Bean
	public Clock clock() {
		return Clock.systemUTC();
	}

	/**
	 * Build the synchronous MCP server on the correlated transport and start the transport. Requests
	 * the server sends to the client share the transport's request timeout.
	 * @param transportProvider provider wrapping the correlated transport
	 * @param transportProperties route and timeout settings
	 * @param serverProperties server identity
	 * @param tools every tool bean
	 * @param markdownResource markdown resource provider
	 * @return a fully configured {@link McpSyncServer} instance
	 */
	@Bean(destroyMethod = "close")
	public McpSyncServer mcpServer(CorrelatedMcpTransportProvider transportProvider,
			McpTransportProperties transportProperties, McpServerProperties serverProperties, List<McpTool> tools,
			MarkdownFileResource markdownResource) {
		McpSyncServer server = McpServer.sync(transportProvider)
			.serverInfo(serverProperties.name(), serverProperties.version())
			.instructions(serverProperties.instructions())
			.capabilities(McpSchema.ServerCapabilities.builder().tools(false).resources(false, false).build())
			.requestTimeout(transportProperties.getRequestTimeout())
			.tools(tools.stream().map(McpTool::specification).toList())
			.resources(markdownResource.specification())
			.build();
		transportProvider.connect();
		logger.info("MCP server {} {} listening on {} with {} tool(s)", serverProperties.name(),
				serverProperties.version(), transportProperties.getBasePath(), tools.size());
		return server;
	}

	@Bean
	public RouterFunction<ServerResponse> healthRouter(McpServerProperties serverProperties) {
		return RouterFunctions.route().GET("/health", request -> {
			Map<String, Object> body = new LinkedHashMap<>();
			body.put("status", "ok");
			body.put("name", serverProperties.name());
			body.put("version", serverProperties.version());
			return ServerResponse.ok().body(body);
		}).build();
	}

}

package dev.contentfarm.server.config;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.servlet.config.annotation.CorsRegistry;
import org.springframework.web.servlet.config.annotation.WebMvcConfigurer;
import org.springframework.web.servlet.function.RouterFunction;
import org.springframework.web.servlet.function.ServerResponse;

import com.fasterxml.jackson.databind.ObjectMapper;

import dev.contentfarm.server.peer.PeerChannel;
import dev.contentfarm.server.transport.CorrelatedMcpTransportProvider;
import dev.contentfarm.server.transport.HttpEndpointAdapter;
import dev.contentfarm.transport.MessageCodec;
import dev.contentfarm.transport.correlation.CorrelatedTransport;

/**
 * Wires the correlated transport to a Spring MVC POST route and exposes it to the MCP server.
 */
@Configuration
@EnableConfigurationProperties({ McpTransportProperties.class, McpCorsProperties.class })
public class WebMvcTransportConfig {

	private static final Logger logger = LoggerFactory.getLogger(WebMvcTransportConfig.class);

	@Bean
	public MessageCodec messageCodec(ObjectMapper objectMapper) {
		return new MessageCodec(objectMapper);
	}

	@Bean
	public HttpEndpointAdapter httpEndpointAdapter(McpTransportProperties transportProperties, MessageCodec codec) {
		return new HttpEndpointAdapter(transportProperties.getBasePath(), codec);
	}

	@Bean(destroyMethod = "close")
	public CorrelatedTransport correlatedTransport(HttpEndpointAdapter endpointAdapter,
			McpTransportProperties transportProperties) {
		return CorrelatedTransport.builder(endpointAdapter)
			.basePath(transportProperties.getBasePath())
			.requestTimeout(transportProperties.getRequestTimeout())
			.build();
	}

	/**
	 * Expose the correlated transport to the MCP server as its transport provider.
	 * @param transport transport bound to the MCP route
	 * @param peerChannel channel carrying replies and server-initiated requests
	 * @param codec envelope codec
	 * @return the transport provider
	 */
	@Bean
	public CorrelatedMcpTransportProvider mcpTransportProvider(CorrelatedTransport transport, PeerChannel peerChannel,
			MessageCodec codec) {
		return new CorrelatedMcpTransportProvider(transport, peerChannel, codec);
	}

	@Bean
	public RouterFunction<ServerResponse> mcpRouter(HttpEndpointAdapter endpointAdapter) {
		return endpointAdapter.routerFunction();
	}

	/**
	 * Register CORS for the MCP route when origins are configured.
	 * @param corsProperties allowed origins
	 * @param transportProperties supplies the route path
	 * @return MVC configurer adding the mapping
	 */
	@Bean
	public WebMvcConfigurer mcpCorsConfigurer(McpCorsProperties corsProperties,
			McpTransportProperties transportProperties) {
		return new WebMvcConfigurer() {
			@Override
			public void addCorsMappings(CorsRegistry registry) {
				if (corsProperties.allowedOrigins().isEmpty()) {
					return;
				}
				registry.addMapping(transportProperties.getBasePath())
					.allowedOriginPatterns(corsProperties.allowedOrigins().toArray(String[]::new))
					.allowedMethods("GET", "POST", "OPTIONS")
					.allowedHeaders("Content-Type", "Authorization")
					.allowCredentials(true)
					.maxAge(86400);
				logger.info("CORS enabled on {} for {}", transportProperties.getBasePath(),
						corsProperties.allowedOrigins());
			}
		};
	}

}

package dev.contentfarm.server.config;

import java.time.Duration;
import java.util.Objects;

import org.springframework.boot.context.properties.ConfigurationProperties;

import dev.contentfarm.transport.correlation.CorrelatedTransport;

/**
 * Configuration properties customizing the correlated HTTP transport: the route it listens on and
 * how long an outbound request waits for its reply.
 */
@ConfigurationProperties(prefix = "mcp.transport")
public class McpTransportProperties {

	/**
	 * HTTP path of the POST route envelopes arrive on. Defaults to {@code /mcp}.
	 */
	private String basePath = CorrelatedTransport.DEFAULT_BASE_PATH;

	/**
	 * Time an outbound request waits for its correlated reply before failing. Defaults to 30 seconds.
	 */
	private Duration requestTimeout = CorrelatedTransport.DEFAULT_REQUEST_TIMEOUT;

	/**
	 * Retrieve the configured route path.
	 * @return the HTTP path that receives envelopes
	 */
	public String getBasePath() {
		return basePath;
	}

	/**
	 * Update the route path used by the transport.
	 * @param basePath the new HTTP path; blank values fall back to {@code /mcp}
	 */
	public void setBasePath(String basePath) {
		this.basePath = basePath == null || basePath.isBlank() ? CorrelatedTransport.DEFAULT_BASE_PATH : basePath;
	}

	/**
	 * Retrieve the default reply timeout.
	 * @return how long a correlated request may stay outstanding
	 */
	public Duration getRequestTimeout() {
		return requestTimeout;
	}

	/**
	 * Configure the default reply timeout.
	 * @param requestTimeout timeout to apply, or {@code null} to restore the default
	 */
	public void setRequestTimeout(Duration requestTimeout) {
		this.requestTimeout = Objects.requireNonNullElse(requestTimeout, CorrelatedTransport.DEFAULT_REQUEST_TIMEOUT);
	}

}

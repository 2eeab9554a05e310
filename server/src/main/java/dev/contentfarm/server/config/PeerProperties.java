package dev.contentfarm.server.config;

import java.time.Duration;

import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Where envelopes produced by this server are delivered. When {@code url} is unset, outbound
 * envelopes are logged and dropped.
 */
@ConfigurationProperties("mcp.peer")
public record PeerProperties(String url, Duration connectTimeout, Duration readTimeout) {

	public PeerProperties {
		connectTimeout = connectTimeout == null ? Duration.ofSeconds(5) : connectTimeout;
		readTimeout = readTimeout == null ? Duration.ofSeconds(30) : readTimeout;
	}

}

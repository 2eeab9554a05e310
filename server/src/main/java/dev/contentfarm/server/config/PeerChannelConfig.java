package dev.contentfarm.server.config;

import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import dev.contentfarm.server.peer.HttpPeerChannel;
import dev.contentfarm.server.peer.LoggingPeerChannel;
import dev.contentfarm.server.peer.PeerChannel;
import dev.contentfarm.transport.MessageCodec;

/**
 * Selects how outbound envelopes leave the server: POSTed to {@code mcp.peer.url} when it is set,
 * otherwise logged and dropped.
 */
@Configuration
public class PeerChannelConfig {

	@Bean
	@ConditionalOnProperty(prefix = "mcp.peer", name = "url")
	public PeerChannel httpPeerChannel(PeerProperties peerProperties, MessageCodec codec) {
		return new HttpPeerChannel(peerProperties, codec);
	}

	@Bean
	@ConditionalOnMissingBean(PeerChannel.class)
	public PeerChannel loggingPeerChannel(MessageCodec codec) {
		return new LoggingPeerChannel(codec);
	}

}

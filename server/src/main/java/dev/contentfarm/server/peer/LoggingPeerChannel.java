package dev.contentfarm.server.peer;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import dev.contentfarm.transport.JsonRpcMessage;
import dev.contentfarm.transport.MessageCodec;
import dev.contentfarm.transport.Wire;

/**
 * Fallback channel used when no peer URL is configured: outbound envelopes are written to the wire
 * log and dropped.
 */
public class LoggingPeerChannel implements PeerChannel {

	private static final Logger logger = LoggerFactory.getLogger(LoggingPeerChannel.class);

	private static final String ENDPOINT = "log";

	private final MessageCodec codec;

	public LoggingPeerChannel(MessageCodec codec) {
		this.codec = codec;
		logger.info("No MCP peer configured; outbound envelopes will only be logged");
	}

	@Override
	public void deliver(JsonRpcMessage message) {
		Wire.tx(ENDPOINT, message, this.codec.write(message));
		logger.debug("Dropped outbound {} (no peer configured)", message.kind());
	}

	@Override
	public boolean isAvailable() {
		return false;
	}

}

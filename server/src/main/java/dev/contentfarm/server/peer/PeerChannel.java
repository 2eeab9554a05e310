package dev.contentfarm.server.peer;

import java.io.IOException;

import dev.contentfarm.transport.JsonRpcMessage;

/**
 * Outbound half of the exchange: hands envelopes produced by this server to the peer. Replies to
 * correlated requests do not come back through this channel; they arrive later as separate POSTs
 * on the MCP route.
 */
public interface PeerChannel {

	/**
	 * Deliver one envelope to the peer.
	 * @param message envelope to deliver
	 * @throws IOException when the peer cannot be reached or refuses the envelope
	 */
	void deliver(JsonRpcMessage message) throws IOException;

	/**
	 * Whether a peer is actually listening, so that requests sent through this channel can expect
	 * a reply.
	 * @return {@code true} when delivered requests may be answered
	 */
	boolean isAvailable();

}

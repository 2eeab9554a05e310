package dev.contentfarm.server.transport;

import java.io.IOException;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.fasterxml.jackson.databind.JsonNode;

import dev.contentfarm.server.peer.PeerChannel;
import dev.contentfarm.transport.JsonRpcMessage;
import dev.contentfarm.transport.JsonRpcRequest;
import dev.contentfarm.transport.JsonRpcResponse;
import dev.contentfarm.transport.JsonRpcResponse.JsonRpcError;
import dev.contentfarm.transport.MessageCodec;
import dev.contentfarm.transport.RemoteErrorException;
import dev.contentfarm.transport.TransportException;
import dev.contentfarm.transport.correlation.CorrelatedTransport;
import dev.contentfarm.transport.correlation.MessageHandler;
import dev.contentfarm.transport.correlation.SendOptions;
import io.modelcontextprotocol.json.McpJsonMapper;
import io.modelcontextprotocol.json.TypeRef;
import io.modelcontextprotocol.spec.McpSchema;
import io.modelcontextprotocol.spec.McpServerSession;
import io.modelcontextprotocol.spec.McpServerTransport;
import io.modelcontextprotocol.spec.McpServerTransportProvider;
import io.modelcontextprotocol.spec.ProtocolVersions;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;

/**
 * {@link McpServerTransportProvider} that runs the MCP server over a {@link CorrelatedTransport}.
 * The HTTP route only carries messages in; everything the server sends leaves through the
 * {@link PeerChannel}. There is a single peer, so the provider hosts exactly one
 * {@link McpServerSession}.
 * <p>
 * Requests the server sends to the client are parked in the transport's pending-call registry
 * and their replies are handed back to the session once the registry settles them. Replies to
 * client requests go straight to the peer and never touch the registry, so a client id can
 * never complete one of the server's own waits.
 */
public class CorrelatedMcpTransportProvider implements McpServerTransportProvider, MessageHandler {

	private static final Logger logger = LoggerFactory.getLogger(CorrelatedMcpTransportProvider.class);

	private static final List<String> PROTOCOL_VERSIONS = List.of(ProtocolVersions.MCP_2024_11_05,
			ProtocolVersions.MCP_2025_03_26, McpSchema.LATEST_PROTOCOL_VERSION);

	private final CorrelatedTransport transport;

	private final PeerChannel peerChannel;

	private final MessageCodec codec;

	private final McpJsonMapper jsonMapper = McpJsonMapper.getDefault();

	private volatile McpServerSession session;

	/**
	 * Create a provider on top of an unstarted transport.
	 * @param transport correlated transport bound to the MCP route
	 * @param peerChannel channel carrying every outbound envelope
	 * @param codec envelope codec shared with the HTTP route
	 */
	public CorrelatedMcpTransportProvider(CorrelatedTransport transport, PeerChannel peerChannel,
			MessageCodec codec) {
		this.transport = Objects.requireNonNull(transport, "transport");
		this.peerChannel = Objects.requireNonNull(peerChannel, "peerChannel");
		this.codec = Objects.requireNonNull(codec, "codec");
	}

	@Override
	public void setSessionFactory(McpServerSession.Factory sessionFactory) {
		this.session = sessionFactory.create(new PeerSessionTransport());
		logger.debug("Created MCP session {} for the peer", this.session.getId());
	}

	/**
	 * Install this provider as the transport's message handler and start the transport. Must be
	 * called after the MCP server has been built on this provider.
	 */
	public void connect() {
		if (this.session == null) {
			throw new IllegalStateException("No MCP server has been built on this transport provider");
		}
		this.transport.setMessageHandler(this);
		this.transport.setCloseHandler(() -> logger.warn("MCP transport on {} closed", this.transport.basePath()));
		this.transport.start();
	}

	/**
	 * Hand one inbound request or notification to the session. Processing continues after this
	 * returns; the answer, if any, is delivered to the peer later.
	 * @param message inbound envelope
	 * @throws IOException if the envelope cannot be converted to an MCP message
	 */
	@Override
	public void handle(JsonRpcMessage message) throws IOException {
		McpServerSession current = this.session;
		if (current == null) {
			throw new IllegalStateException("MCP server is not ready");
		}
		McpSchema.JSONRPCMessage mcpMessage = McpSchema.deserializeJsonRpcMessage(this.jsonMapper,
				this.codec.write(message));
		current.handle(mcpMessage).onErrorResume(ex -> {
			logger.error("Failed processing {} on session {}", message.kind(), current.getId(), ex);
			return Mono.empty();
		}).subscribe();
	}

	@Override
	public Mono<Void> notifyClients(String method, Object params) {
		McpServerSession current = this.session;
		if (current == null) {
			logger.debug("No session to notify with {}", method);
			return Mono.empty();
		}
		return current.sendNotification(method, params).onErrorResume(ex -> {
			logger.error("Failed to notify session {} with {}", current.getId(), method, ex);
			return Mono.empty();
		});
	}

	@Override
	public Mono<Void> closeGracefully() {
		return Mono.defer(() -> {
			McpServerSession current = this.session;
			logger.info("Closing MCP transport provider");
			return current != null ? current.closeGracefully() : Mono.fromRunnable(this.transport::close);
		});
	}

	@Override
	public List<String> protocolVersions() {
		return PROTOCOL_VERSIONS;
	}

	/**
	 * Outbound half of the session: turns MCP messages into envelopes and routes them.
	 */
	private final class PeerSessionTransport implements McpServerTransport {

		@Override
		public Mono<Void> sendMessage(McpSchema.JSONRPCMessage message) {
			return Mono.fromCallable(() -> {
				route(message);
				return message;
			}).subscribeOn(Schedulers.boundedElastic()).then();
		}

		@Override
		public <T> T unmarshalFrom(Object data, TypeRef<T> typeRef) {
			return jsonMapper.convertValue(data, typeRef);
		}

		@Override
		public Mono<Void> closeGracefully() {
			return Mono.fromRunnable(transport::close);
		}

		private void route(McpSchema.JSONRPCMessage message) throws IOException {
			JsonRpcMessage envelope = codec.read(jsonMapper.writeValueAsString(message));
			if (envelope instanceof JsonRpcRequest request) {
				sendRequest(request, ((McpSchema.JSONRPCRequest) message).id());
			}
			else if (envelope instanceof JsonRpcResponse response) {
				if (!transport.isStarted()) {
					logger.warn("Dropping reply {}: transport is not running", response.id());
					return;
				}
				peerChannel.deliver(response);
			}
			else {
				transport.send(envelope, SendOptions.none());
				peerChannel.deliver(envelope);
			}
		}

		/**
		 * The wait is registered before the request leaves, so a fast reply cannot arrive ahead
		 * of its pending call. A request the peer never received fails its wait at once.
		 */
		private void sendRequest(JsonRpcRequest request, Object mcpId) {
			if (!peerChannel.isAvailable()) {
				throw new TransportException("No peer configured to answer " + request.method());
			}
			CompletableFuture<JsonNode> reply = transport.send(request, SendOptions.expectReply());
			reply.whenComplete((result, error) -> forwardReply(mcpId, result, error));
			try {
				peerChannel.deliver(request);
			}
			catch (IOException e) {
				logger.warn("Could not deliver {} request {}", request.method(), request.id(), e);
				transport.send(JsonRpcResponse.failure(request.id(),
						JsonRpcError.of(JsonRpcError.INTERNAL_ERROR, "Failed to deliver request: " + e.getMessage())),
						SendOptions.none());
			}
		}

		private void forwardReply(Object mcpId, JsonNode result, Throwable error) {
			McpSchema.JSONRPCResponse response = error == null
					? new McpSchema.JSONRPCResponse(JsonRpcMessage.JSONRPC_VERSION, mcpId,
							codec.mapper().convertValue(result, Object.class), null)
					: new McpSchema.JSONRPCResponse(JsonRpcMessage.JSONRPC_VERSION, mcpId, null, toMcpError(error));
			McpServerSession current = session;
			current.handle(response).onErrorResume(ex -> {
				logger.error("Failed to hand reply {} to session {}", mcpId, current.getId(), ex);
				return Mono.empty();
			}).subscribe();
		}

		private McpSchema.JSONRPCResponse.JSONRPCError toMcpError(Throwable error) {
			if (error instanceof RemoteErrorException remote) {
				JsonRpcError detail = remote.error();
				Object data = detail.data() == null ? null : codec.mapper().convertValue(detail.data(), Object.class);
				return new McpSchema.JSONRPCResponse.JSONRPCError(detail.code(), detail.message(), data);
			}
			return new McpSchema.JSONRPCResponse.JSONRPCError(JsonRpcError.INTERNAL_ERROR, error.getMessage(), null);
		}

	}

}

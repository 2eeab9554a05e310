package dev.contentfarm.server.transport;

import java.io.IOException;

import jakarta.servlet.ServletException;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.web.servlet.function.RouterFunction;
import org.springframework.web.servlet.function.RouterFunctions;
import org.springframework.web.servlet.function.ServerRequest;
import org.springframework.web.servlet.function.ServerResponse;

import com.fasterxml.jackson.databind.node.ObjectNode;

import dev.contentfarm.transport.JsonRpcMessage;
import dev.contentfarm.transport.JsonRpcResponse.JsonRpcError;
import dev.contentfarm.transport.MalformedMessageException;
import dev.contentfarm.transport.MessageCodec;
import dev.contentfarm.transport.Wire;
import dev.contentfarm.transport.correlation.InboundEndpoint;
import dev.contentfarm.transport.correlation.MessageHandler;

/**
 * Exposes a single POST route that feeds each request body, one envelope at a time, to the hook a
 * transport bound with {@link #bind(String, MessageHandler)}. The HTTP response only acknowledges
 * receipt; replies to requests are delivered separately.
 */
public class HttpEndpointAdapter implements InboundEndpoint {

	private static final Logger logger = LoggerFactory.getLogger(HttpEndpointAdapter.class);

	static final String INTERNAL_ERROR_MESSAGE = "Internal server error";

	static final String HANDLER_NOT_SET = "Message handler not set";

	private final String path;

	private final MessageCodec codec;

	private final String acknowledgement;

	private volatile MessageHandler inbound;

	/**
	 * Create an adapter serving the given route.
	 * @param path HTTP path of the POST route
	 * @param codec codec used to parse request bodies and write error envelopes
	 */
	public HttpEndpointAdapter(String path, MessageCodec codec) {
		this.path = path;
		this.codec = codec;
		this.acknowledgement = codec.mapper()
			.createObjectNode()
			.put("jsonrpc", JsonRpcMessage.JSONRPC_VERSION)
			.putNull("result")
			.toString();
	}

	/**
	 * Build the functional route for the POST endpoint.
	 * @return router function to register with Spring MVC
	 */
	public RouterFunction<ServerResponse> routerFunction() {
		return RouterFunctions.route().POST(this.path, this::handlePost).build();
	}

	/**
	 * Route bodies arriving on the POST endpoint to {@code inbound}.
	 * @param path route path; must be the path this adapter serves
	 * @param inbound hook receiving each parsed envelope
	 */
	@Override
	public void bind(String path, MessageHandler inbound) {
		if (!this.path.equals(path)) {
			throw new IllegalArgumentException("Adapter serves " + this.path + ", cannot bind " + path);
		}
		this.inbound = inbound;
		logger.info("MCP endpoint bound on POST {}", path);
	}

	@Override
	public void unbind(String path) {
		if (this.path.equals(path)) {
			this.inbound = null;
			logger.info("MCP endpoint on POST {} unbound", path);
		}
	}

	public String getPath() {
		return this.path;
	}

	/**
	 * Parse one envelope and hand it to the bound hook.
	 * @param request the incoming POST
	 * @return 200 acknowledgement, or 500 with an internal-error envelope when anything fails
	 */
	ServerResponse handlePost(ServerRequest request) {
		MessageHandler handler = this.inbound;
		if (handler == null) {
			logger.warn("POST {} received before a message handler was bound", this.path);
			return internalError(HANDLER_NOT_SET);
		}

		String body;
		JsonRpcMessage message;
		try {
			body = request.body(String.class);
			message = this.codec.read(body);
		}
		catch (MalformedMessageException e) {
			logger.warn("Rejected malformed envelope on {}: {}", this.path, e.getMessage());
			return internalError(e.getMessage());
		}
		catch (IOException | ServletException | RuntimeException e) {
			logger.error("Failed to read request body on {}", this.path, e);
			return internalError(e.getMessage());
		}
		Wire.rx(this.path, message, body);

		try {
			handler.handle(message);
		}
		catch (Exception e) {
			logger.error("Error handling {} on {}", message.kind(), this.path, e);
			return internalError(e.getMessage());
		}
		return ServerResponse.ok().contentType(MediaType.APPLICATION_JSON).body(this.acknowledgement);
	}

	private ServerResponse internalError(String detail) {
		ObjectNode envelope = this.codec.mapper().createObjectNode();
		envelope.put("jsonrpc", JsonRpcMessage.JSONRPC_VERSION);
		ObjectNode error = envelope.putObject("error");
		error.put("code", JsonRpcError.INTERNAL_ERROR);
		error.put("message", INTERNAL_ERROR_MESSAGE);
		error.put("data", detail);
		envelope.putNull("id");
		return ServerResponse.status(HttpStatus.INTERNAL_SERVER_ERROR)
			.contentType(MediaType.APPLICATION_JSON)
			.body(envelope.toString());
	}

}

package dev.contentfarm.server.peer;

import java.io.IOException;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.MediaType;
import org.springframework.http.client.SimpleClientHttpRequestFactory;
import org.springframework.web.client.RestClient;
import org.springframework.web.client.RestClientException;

import dev.contentfarm.server.config.PeerProperties;
import dev.contentfarm.transport.JsonRpcMessage;
import dev.contentfarm.transport.MessageCodec;
import dev.contentfarm.transport.Wire;

/**
 * Delivers envelopes by POSTing them, one per request, to the peer's MCP endpoint. The body of the
 * peer's answer is only an acknowledgement and is ignored.
 */
public class HttpPeerChannel implements PeerChannel {

	private static final Logger logger = LoggerFactory.getLogger(HttpPeerChannel.class);

	private final String url;

	private final MessageCodec codec;

	private final RestClient restClient;

	/**
	 * Create a channel targeting the configured peer URL.
	 * @param properties peer endpoint and timeouts
	 * @param codec codec used to serialize envelopes
	 */
	public HttpPeerChannel(PeerProperties properties, MessageCodec codec) {
		this(properties.url(), codec, RestClient.builder().requestFactory(requestFactory(properties)));
	}

	/**
	 * Create a channel using a caller-supplied client builder.
	 * @param url peer endpoint envelopes are POSTed to
	 * @param codec codec used to serialize envelopes
	 * @param builder client builder, for instance one bound to a mock server
	 */
	public HttpPeerChannel(String url, MessageCodec codec, RestClient.Builder builder) {
		this.url = url;
		this.codec = codec;
		this.restClient = builder.build();
		logger.info("Delivering outbound envelopes to peer {}", url);
	}

	@Override
	public void deliver(JsonRpcMessage message) throws IOException {
		String json = this.codec.write(message);
		Wire.tx(this.url, message, json);
		try {
			this.restClient.post()
				.uri(this.url)
				.contentType(MediaType.APPLICATION_JSON)
				.body(json)
				.retrieve()
				.toBodilessEntity();
		}
		catch (RestClientException e) {
			throw new IOException("Failed to deliver " + message.kind() + " to " + this.url + ": " + e.getMessage(), e);
		}
	}

	@Override
	public boolean isAvailable() {
		return true;
	}

	private static SimpleClientHttpRequestFactory requestFactory(PeerProperties properties) {
		SimpleClientHttpRequestFactory factory = new SimpleClientHttpRequestFactory();
		factory.setConnectTimeout(properties.connectTimeout());
		factory.setReadTimeout(properties.readTimeout());
		return factory;
	}

}

package dev.contentfarm.server.peer;

import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.content;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.method;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.requestTo;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withServerError;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withSuccess;

import java.io.IOException;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpMethod;
import org.springframework.http.MediaType;
import org.springframework.test.web.client.MockRestServiceServer;
import org.springframework.web.client.RestClient;

import com.fasterxml.jackson.databind.ObjectMapper;

import dev.contentfarm.transport.JsonRpcRequest;
import dev.contentfarm.transport.MessageCodec;
import dev.contentfarm.transport.RequestId;

class HttpPeerChannelTest {

	private static final String PEER_URL = "http://editor.local/mcp";

	private MockRestServiceServer server;

	private HttpPeerChannel channel;

	@BeforeEach
	void setUp() {
		RestClient.Builder builder = RestClient.builder();
		this.server = MockRestServiceServer.bindTo(builder).build();
		this.channel = new HttpPeerChannel(PEER_URL, new MessageCodec(new ObjectMapper()), builder);
	}

	@Test
	void postsEnvelopeAsJson() throws Exception {
		this.server.expect(requestTo(PEER_URL))
			.andExpect(method(HttpMethod.POST))
			.andExpect(content().contentType(MediaType.APPLICATION_JSON))
			.andExpect(content().json("{\"jsonrpc\":\"2.0\",\"id\":\"srv-1\",\"method\":\"roots/list\"}"))
			.andRespond(withSuccess("{\"jsonrpc\":\"2.0\",\"result\":null}", MediaType.APPLICATION_JSON));

		this.channel.deliver(JsonRpcRequest.of(RequestId.of("srv-1"), "roots/list", null));

		this.server.verify();
		assertTrue(this.channel.isAvailable());
	}

	@Test
	void peerFailureSurfacesAsIOException() {
		this.server.expect(requestTo(PEER_URL)).andRespond(withServerError());

		IOException error = assertThrows(IOException.class,
				() -> this.channel.deliver(JsonRpcRequest.of(RequestId.of(1), "ping", null)));
		assertTrue(error.getMessage().contains(PEER_URL));
	}

}

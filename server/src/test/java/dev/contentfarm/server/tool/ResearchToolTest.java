package dev.contentfarm.server.tool;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.Map;

import org.junit.jupiter.api.Test;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;

import dev.contentfarm.server.model.ResearchResponse;
import dev.contentfarm.server.model.ResearchResult;
import io.modelcontextprotocol.spec.McpSchema;

class ResearchToolTest {

	private static final Instant NOW = Instant.parse("2024-05-01T12:00:00Z");

	private final ObjectMapper objectMapper = new ObjectMapper();

	private final ResearchTool tool = new ResearchTool(this.objectMapper, Clock.fixed(NOW, ZoneOffset.UTC));

	@Test
	void producesThreeMockResultsByDefault() {
		ResearchResponse response = this.tool.research(arguments().put("query", "Solar  Panels"));

		assertTrue(response.success());
		assertEquals("Solar  Panels", response.query());
		assertEquals(NOW.toString(), response.timestamp());
		assertEquals(3, response.results().size());

		ResearchResult first = response.results().get(0);
		assertEquals("Solar  Panels - Result 1", first.title());
		assertEquals("https://example.com/solar-panels-1", first.url());
		assertEquals("This is a mock result for \"Solar  Panels\" (webSearch). "
				+ "Lorem ipsum dolor sit amet, consectetur adipiscing elit. "
				+ "Lorem ipsum dolor sit amet, consectetur adipiscing elit. ", first.snippet());
		assertEquals("example.com", first.source());
		assertEquals(1.0, first.relevance(), 1e-9);
		assertEquals(0.8, response.results().get(1).relevance(), 1e-9);
		assertEquals("Found 3 results for \"Solar  Panels\" with focus on webSearch.", response.summary());
	}

	@Test
	void honoursMaxResultsFocusAndSummaryFlag() {
		ResearchResponse response = this.tool.research(arguments().put("query", "ai")
			.put("maxResults", 5)
			.put("focus", "academic")
			.put("includeSummary", false));

		assertEquals(5, response.results().size());
		assertTrue(response.results().get(4).snippet().contains("(academic)"));
		assertNull(response.summary());
	}

	@Test
	void rejectsOutOfRangeMaxResults() {
		ResearchResponse response = this.tool.research(arguments().put("query", "ai").put("maxResults", 11));

		assertFalse(response.success());
		assertEquals("ai", response.query());
		assertTrue(response.results().isEmpty());
		assertEquals("maxResults must be between 1 and 10", response.error());
	}

	@Test
	void rejectsUnknownFocus() {
		ResearchResponse response = this.tool.research(arguments().put("query", "ai").put("focus", "images"));

		assertFalse(response.success());
		assertTrue(response.error().startsWith("focus must be one of"));
	}

	@Test
	void missingQueryIsReportedAsUnknown() {
		ResearchResponse response = this.tool.research(arguments());

		assertFalse(response.success());
		assertEquals("unknown", response.query());
		assertEquals("query is required", response.error());
	}

	@Test
	@SuppressWarnings("unchecked")
	void callWrapsResponseInToolResult() {
		McpSchema.CallToolResult result = this.tool.call(arguments().put("query", "ai").put("maxResults", 1));

		assertFalse(Boolean.TRUE.equals(result.isError()));
		Map<String, Object> structured = (Map<String, Object>) result.structuredContent();
		assertEquals(Boolean.TRUE, structured.get("success"));
		assertFalse(structured.containsKey("error"));
		assertEquals(1, result.content().size());
	}

	@Test
	void failedCallIsFlaggedAsError() {
		McpSchema.CallToolResult result = this.tool.call(arguments().put("query", 42).put("maxResults", 0));

		assertTrue(result.isError());
	}

	@Test
	void specificationAdvertisesName() {
		assertEquals("perplexica_research", this.tool.specification().tool().name());
	}

	private ObjectNode arguments() {
		return this.objectMapper.createObjectNode();
	}

}

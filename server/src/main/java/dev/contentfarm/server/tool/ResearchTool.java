package dev.contentfarm.server.tool;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;

import lombok.RequiredArgsConstructor;

import dev.contentfarm.server.model.ResearchResponse;
import dev.contentfarm.server.model.ResearchResult;
import io.modelcontextprotocol.server.McpServerFeatures;
import io.modelcontextprotocol.server.McpSyncServerExchange;
import io.modelcontextprotocol.spec.McpSchema;

/**
 * The {@code perplexica_research} tool. Produces deterministic mock search results until a real
 * Perplexica backend is wired in.
 */
@Component
@RequiredArgsConstructor
public class ResearchTool implements McpTool {

	private static final Logger logger = LoggerFactory.getLogger(ResearchTool.class);

	static final String NAME = "perplexica_research";

	static final Set<String> FOCUS_AREAS = Set.of("webSearch", "academic", "news", "all");

	private static final String FILLER = "Lorem ipsum dolor sit amet, consectetur adipiscing elit. ";

	private static final TypeReference<Map<String, Object>> STRUCTURED = new TypeReference<>() {
	};

	private final ObjectMapper objectMapper;

	private final Clock clock;

	@Override
	public McpServerFeatures.SyncToolSpecification specification() {
		return McpServerFeatures.SyncToolSpecification.builder()
			.tool(McpSchema.Tool.builder()
				.name(NAME)
				.title("Perplexica research")
				.description("Perform web research using Perplexica to enhance content with relevant information")
				.inputSchema(inputSchema())
				.build())
			.callHandler(this::handleResearch)
			.build();
	}

	private McpSchema.CallToolResult handleResearch(McpSyncServerExchange exchange,
			McpSchema.CallToolRequest callToolRequest) {
		return call(ToolArguments.of(this.objectMapper, callToolRequest));
	}

	/**
	 * Run a research call and render the response as text plus structured content.
	 * @param arguments tool arguments
	 * @return tool result, flagged as an error when the arguments were rejected
	 */
	McpSchema.CallToolResult call(JsonNode arguments) {
		ResearchResponse response = research(arguments);
		String text;
		try {
			text = this.objectMapper.writeValueAsString(response);
		}
		catch (JsonProcessingException e) {
			throw new IllegalStateException("Failed to serialize research response", e);
		}
		return McpSchema.CallToolResult.builder()
			.addTextContent(text)
			.isError(!response.success())
			.structuredContent(this.objectMapper.convertValue(response, STRUCTURED))
			.build();
	}

	/**
	 * Validate the arguments and build the mock results. Invalid arguments produce an unsuccessful
	 * response instead of an exception.
	 * @param arguments tool arguments
	 * @return research response
	 */
	ResearchResponse research(JsonNode arguments) {
		String timestamp = Instant.now(this.clock).toString();
		try {
			String query = ToolArguments.string(arguments, "query", null);
			if (query == null) {
				throw new IllegalArgumentException("query is required");
			}
			int maxResults = ToolArguments.integer(arguments, "maxResults", 3);
			if (maxResults < 1 || maxResults > 10) {
				throw new IllegalArgumentException("maxResults must be between 1 and 10");
			}
			String focus = ToolArguments.string(arguments, "focus", "webSearch");
			if (!FOCUS_AREAS.contains(focus)) {
				throw new IllegalArgumentException("focus must be one of webSearch, academic, news, all");
			}
			boolean includeSummary = ToolArguments.bool(arguments, "includeSummary", true);
			int timeout = ToolArguments.integer(arguments, "timeout", 10000);
			if (timeout <= 0) {
				throw new IllegalArgumentException("timeout must be positive");
			}

			logger.info("Searching for: {} (focus: {}, maxResults: {})", query, focus, maxResults);
			List<ResearchResult> results = new ArrayList<>(maxResults);
			String slug = query.toLowerCase(Locale.ROOT).replaceAll("\\s+", "-");
			for (int i = 0; i < maxResults; i++) {
				results.add(new ResearchResult(query + " - Result " + (i + 1),
						"https://example.com/" + slug + "-" + (i + 1),
						"This is a mock result for \"" + query + "\" (" + focus + "). " + FILLER.repeat(2),
						"example.com", 1 - (i * 0.2)));
			}
			String summary = includeSummary
					? "Found %d results for \"%s\" with focus on %s.".formatted(results.size(), query, focus) : null;
			return new ResearchResponse(true, query, results, timestamp, summary, null);
		}
		catch (IllegalArgumentException e) {
			logger.warn("Research request rejected: {}", e.getMessage());
			JsonNode query = arguments.get("query");
			return ResearchResponse.failure(query == null ? "unknown" : query.asText(), timestamp, e.getMessage());
		}
	}

	private McpSchema.JsonSchema inputSchema() {
		Map<String, Object> properties = new LinkedHashMap<>();
		properties.put("query", Map.of("type", "string", "description", "The research query to perform"));
		properties.put("maxResults", Map.of("type", "integer", "minimum", 1, "maximum", 10, "default", 3,
				"description", "Maximum number of results to return"));
		properties.put("focus", Map.of("type", "string", "enum", List.of("webSearch", "academic", "news", "all"),
				"default", "webSearch", "description", "Search focus area"));
		properties.put("includeSummary", Map.of("type", "boolean", "default", true,
				"description", "Whether to include a summary of results"));
		properties.put("timeout", Map.of("type", "integer", "exclusiveMinimum", 0, "default", 10000,
				"description", "Timeout in milliseconds for the research request"));
		return new McpSchema.JsonSchema("object", properties, List.of("query"), false, null, null);
	}

}

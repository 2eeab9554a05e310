package dev.contentfarm.server.model;

import java.util.List;

import com.fasterxml.jackson.annotation.JsonInclude;

/**
 * Payload of a research tool call. {@code summary} is only present when requested and
 * {@code error} only when the call failed.
 * @param success whether the research ran
 * @param query the query as received
 * @param results hits, empty on failure
 * @param timestamp ISO-8601 instant the response was produced
 * @param summary one-line summary of the hits
 * @param error failure description
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record ResearchResponse(boolean success, String query, List<ResearchResult> results, String timestamp,
		String summary, String error) {

	public static ResearchResponse failure(String query, String timestamp, String error) {
		return new ResearchResponse(false, query, List.of(), timestamp, null, error);
	}

}

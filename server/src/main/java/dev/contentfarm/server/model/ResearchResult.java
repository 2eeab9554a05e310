package dev.contentfarm.server.model;

/**
 * One hit returned by the research tool.
 * @param title result title
 * @param url link to the source page
 * @param snippet short excerpt
 * @param source host the result came from
 * @param relevance relevance score, highest first
 */
public record ResearchResult(String title, String url, String snippet, String source, double relevance) {
}

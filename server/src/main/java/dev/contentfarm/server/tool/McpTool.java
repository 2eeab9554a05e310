package dev.contentfarm.server.tool;

import io.modelcontextprotocol.server.McpServerFeatures;

/**
 * A tool registered with the MCP server.
 */
public interface McpTool {

	/**
	 * Provide the tool definition together with its call handler.
	 * @return synchronous tool specification
	 */
	McpServerFeatures.SyncToolSpecification specification();

}

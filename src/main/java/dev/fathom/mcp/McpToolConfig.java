package dev.fathom.mcp;

import org.springframework.ai.tool.ToolCallbackProvider;
import org.springframework.ai.tool.method.MethodToolCallbackProvider;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Exposes the {@code @Tool} methods of {@link McpToolService} to the Spring AI MCP server.
 *
 * <p>The server auto-configuration picks up every {@link ToolCallbackProvider} bean and serves its
 * tools over the active transport: stdio under the {@code stdio} profile, SSE over HTTP under
 * {@code web}.
 */
@Configuration
public class McpToolConfig {

  @Bean
  public ToolCallbackProvider codeSearchTools(McpToolService toolService) {
    return MethodToolCallbackProvider.builder().toolObjects(toolService).build();
  }
}

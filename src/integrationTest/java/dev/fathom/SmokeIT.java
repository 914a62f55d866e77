package dev.fathom;

import static org.assertj.core.api.Assertions.assertThat;

import dev.langchain4j.model.embedding.EmbeddingModel;
import org.junit.jupiter.api.Test;
import org.springframework.ai.tool.ToolCallback;
import org.springframework.ai.tool.ToolCallbackProvider;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.jdbc.core.JdbcTemplate;

class SmokeIT extends BaseIntegrationTest {

  @Autowired EmbeddingModel embeddingModel;

  @Autowired ToolCallbackProvider codeSearchTools;

  @Autowired JdbcTemplate jdbcTemplate;

  @Test
  void contextLoadsWithMigratedSchemaAndBundledModel() {
    assertThat(embeddingModel.dimension()).isEqualTo(384);
    assertThat(
            jdbcTemplate.queryForObject(
                "SELECT count(*) FROM pg_extension WHERE extname = 'vector'", Integer.class))
        .isEqualTo(1);
    assertThat(
            jdbcTemplate.queryForObject("SELECT to_regclass('projects') IS NOT NULL", Boolean.class))
        .isTrue();
  }

  @Test
  void everyMcpToolIsRegistered() {
    assertThat(codeSearchTools.getToolCallbacks())
        .extracting(ToolCallback::getToolDefinition)
        .extracting(definition -> definition.name())
        .containsExactlyInAnyOrder(
            "search_code",
            "list_projects",
            "add_project",
            "remove_project",
            "index_project",
            "index_structural",
            "index_status",
            "import_dependencies");
  }
}

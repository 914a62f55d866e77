package dev.fathom.indexing;

import static org.assertj.core.api.Assertions.assertThat;

import dev.fathom.BaseIntegrationTest;
import dev.fathom.project.ProjectRegistry;
import dev.fathom.search.SearchHit;
import dev.fathom.search.SearchQuery;
import dev.fathom.search.SearchResponse;
import dev.fathom.search.SearchRouter;
import dev.fathom.search.SearchType;
import dev.fathom.vector.CollectionNames;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.jdbc.core.JdbcTemplate;

/** Indexes a small project into pgvector with the bundled model and queries it back. */
class SemanticIndexingIT extends BaseIntegrationTest {

  private static final String GREETER =
      """
      package com.example;

      public class Greeter {

          public String greet(String name) {
              return "Hello, " + name + "!";
          }

          public int add(int a, int b) {
              return a + b;
          }

          public void deleteFile(java.nio.file.Path path) throws java.io.IOException {
              java.nio.file.Files.deleteIfExists(path);
          }
      }
      """;

  @Autowired ProjectRegistry projectRegistry;

  @Autowired IndexingService indexingService;

  @Autowired SearchRouter searchRouter;

  @Autowired CollectionNames collectionNames;

  @Autowired JdbcTemplate jdbcTemplate;

  @TempDir Path projectRoot;

  private void writeGreeter() throws Exception {
    Path file = projectRoot.resolve("src/main/java/com/example/Greeter.java");
    Files.createDirectories(file.getParent());
    Files.writeString(file, GREETER);
  }

  @Test
  void searchBeforeIndexingExplainsHowToIndex() {
    projectRegistry.register("unindexed", projectRoot);

    SearchResponse response =
        searchRouter.route(new SearchQuery("unindexed", "greeting", SearchType.SEMANTIC));

    assertThat(response.results()).isEmpty();
    assertThat(response.message()).contains("Run 'index unindexed' first");
  }

  @Test
  void indexedSnippetsAreFoundByMeaning() throws Exception {
    writeGreeter();
    projectRegistry.register("greeter", projectRoot);

    IndexRunResult result = indexingService.runIndex("greeter", true);

    assertThat(result.status()).isEqualTo(IndexRunStatus.INDEXED);
    assertThat(result.snippetsIndexed()).isEqualTo(3);
    assertThat(projectRegistry.get("greeter").getLastIndexedAt()).isNotNull();

    SearchResponse response =
        searchRouter.route(
            new SearchQuery("greeter", "say hello to a person", SearchType.SEMANTIC, 3));

    List<SearchHit> hits = response.results();
    assertThat(hits).hasSize(3);
    SearchHit.SemanticHit best = (SearchHit.SemanticHit) hits.get(0);
    assertThat(best.metadata()).containsEntry("method_name", "greet");
    assertThat(best.metadata()).containsEntry("class_name", "Greeter");
    assertThat(hits)
        .extracting(hit -> ((SearchHit.SemanticHit) hit).distance())
        .isSorted();
  }

  @Test
  void reindexingDoesNotDuplicateSnippets() throws Exception {
    writeGreeter();
    projectRegistry.register("reindexed", projectRoot);

    indexingService.runIndex("reindexed", false);
    indexingService.runIndex("reindexed", false);

    Integer rows =
        jdbcTemplate.queryForObject(
            "SELECT count(*) FROM " + collectionNames.forProject("reindexed"), Integer.class);
    assertThat(rows).isEqualTo(3);
  }

  @Test
  void rebuildRemovesVectorsOfDeletedMethods() throws Exception {
    writeGreeter();
    projectRegistry.register("rebuilt", projectRoot);
    indexingService.runIndex("rebuilt", false);
    Files.writeString(
        projectRoot.resolve("src/main/java/com/example/Greeter.java"),
        "package com.example; class Greeter { int one() { return 1; } }");

    indexingService.runIndex("rebuilt", true);

    Integer rows =
        jdbcTemplate.queryForObject(
            "SELECT count(*) FROM " + collectionNames.forProject("rebuilt"), Integer.class);
    assertThat(rows).isEqualTo(1);
  }

  @Test
  void removingTheProjectDropsItsTable() throws Exception {
    writeGreeter();
    projectRegistry.register("removed", projectRoot);
    indexingService.runIndex("removed", false);
    String table = collectionNames.forProject("removed");

    projectRegistry.remove("removed");

    assertThat(
            jdbcTemplate.queryForObject(
                "SELECT to_regclass(?) IS NOT NULL", Boolean.class, table))
        .isFalse();
  }
}

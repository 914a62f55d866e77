package dev.fathom.vector;

import dev.langchain4j.data.segment.TextSegment;
import dev.langchain4j.model.embedding.EmbeddingModel;
import dev.langchain4j.store.embedding.EmbeddingStore;
import dev.langchain4j.store.embedding.pgvector.PgVectorEmbeddingStore;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import javax.sql.DataSource;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.stereotype.Component;

/**
 * Backs each snippet collection with its own pgvector table.
 *
 * <p>Stores share the application's HikariCP {@link DataSource}. Table names come from {@link
 * CollectionNames} and are therefore safe to interpolate into DDL.
 */
@Component
public class PgVectorCollectionStore implements SnippetCollectionStore {

  private static final Logger log = LoggerFactory.getLogger(PgVectorCollectionStore.class);

  private final DataSource dataSource;
  private final JdbcTemplate jdbcTemplate;
  private final EmbeddingModel embeddingModel;
  private final Map<String, EmbeddingStore<TextSegment>> stores = new ConcurrentHashMap<>();

  public PgVectorCollectionStore(
      DataSource dataSource, JdbcTemplate jdbcTemplate, EmbeddingModel embeddingModel) {
    this.dataSource = dataSource;
    this.jdbcTemplate = jdbcTemplate;
    this.embeddingModel = embeddingModel;
  }

  @Override
  public Optional<EmbeddingStore<TextSegment>> find(String collection) {
    EmbeddingStore<TextSegment> cached = stores.get(collection);
    if (cached != null) {
      return Optional.of(cached);
    }
    if (!tableExists(collection)) {
      return Optional.empty();
    }
    return Optional.of(stores.computeIfAbsent(collection, name -> build(name, false)));
  }

  @Override
  public EmbeddingStore<TextSegment> getOrCreate(String collection) {
    return stores.computeIfAbsent(collection, name -> build(name, true));
  }

  @Override
  public boolean drop(String collection) {
    stores.remove(collection);
    boolean existed = tableExists(collection);
    if (existed) {
      jdbcTemplate.execute("DROP TABLE IF EXISTS " + collection);
      log.info("Dropped snippet collection {}", collection);
    }
    return existed;
  }

  private boolean tableExists(String collection) {
    Boolean exists =
        jdbcTemplate.queryForObject(
            "SELECT to_regclass(?) IS NOT NULL", Boolean.class, collection);
    return Boolean.TRUE.equals(exists);
  }

  private EmbeddingStore<TextSegment> build(String collection, boolean createTable) {
    if (createTable) {
      log.debug("Opening snippet collection {} (created when missing)", collection);
    }
    return PgVectorEmbeddingStore.datasourceBuilder()
        .datasource(dataSource)
        .table(collection)
        .dimension(embeddingModel.dimension())
        .createTable(createTable)
        .useIndex(false)
        .build();
  }
}

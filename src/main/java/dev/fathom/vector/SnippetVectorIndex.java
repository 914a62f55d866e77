package dev.fathom.vector;

import dev.langchain4j.data.embedding.Embedding;
import dev.langchain4j.data.segment.TextSegment;
import dev.langchain4j.model.embedding.EmbeddingModel;
import dev.langchain4j.store.embedding.EmbeddingMatch;
import dev.langchain4j.store.embedding.EmbeddingSearchRequest;
import dev.langchain4j.store.embedding.EmbeddingStore;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * Per-project vector collections of method snippets.
 *
 * <p>Entries are keyed by snippet fingerprint. The backing stores require UUID ids, so the store id
 * is the name-based UUID of the fingerprint and the fingerprint itself travels in the {@code
 * fingerprint} metadata key.
 */
@Service
public class SnippetVectorIndex {

  private static final Logger log = LoggerFactory.getLogger(SnippetVectorIndex.class);

  static final String FINGERPRINT_KEY = "fingerprint";

  private final SnippetCollectionStore collectionStore;
  private final CollectionNames collectionNames;
  private final EmbeddingModel embeddingModel;

  public SnippetVectorIndex(
      SnippetCollectionStore collectionStore,
      CollectionNames collectionNames,
      EmbeddingModel embeddingModel) {
    this.collectionStore = collectionStore;
    this.collectionNames = collectionNames;
    this.embeddingModel = embeddingModel;
  }

  public CollectionHandle getOrCreateCollection(String projectName) {
    String collection = collectionNames.forProject(projectName);
    return new CollectionHandle(projectName, collection, collectionStore.getOrCreate(collection));
  }

  /**
   * Inserts or replaces entries by id. Each id appears at most once in the collection afterwards.
   */
  public void upsert(CollectionHandle handle, List<SnippetRecord> records) {
    if (records.isEmpty()) {
      return;
    }
    // last record wins when a batch repeats an id
    Map<String, SnippetRecord> byId = new LinkedHashMap<>();
    records.forEach(record -> byId.put(storeId(record.id()), record));

    List<String> ids = new ArrayList<>(byId.keySet());
    List<Embedding> embeddings = byId.values().stream().map(SnippetRecord::embedding).toList();
    List<TextSegment> segments = byId.values().stream().map(SnippetRecord::toTextSegment).toList();

    EmbeddingStore<TextSegment> store = handle.store();
    store.removeAll(ids);
    store.addAll(ids, embeddings, segments);
    log.debug("Upserted {} snippets into {}", ids.size(), handle.collection());
  }

  /**
   * Finds the {@code topK} snippets closest to {@code queryText}.
   *
   * @return matches sorted by ascending distance, or {@link SemanticQueryResult.CollectionNotFound}
   */
  public SemanticQueryResult query(String projectName, String queryText, int topK) {
    String collection = collectionNames.forProject(projectName);
    Optional<EmbeddingStore<TextSegment>> store = collectionStore.find(collection);
    if (store.isEmpty()) {
      return new SemanticQueryResult.CollectionNotFound(collection);
    }

    Embedding queryEmbedding = embeddingModel.embed(queryText).content();
    EmbeddingSearchRequest request =
        EmbeddingSearchRequest.builder().queryEmbedding(queryEmbedding).maxResults(topK).build();
    List<SemanticMatch> matches =
        store.get().search(request).matches().stream()
            .map(SnippetVectorIndex::toSemanticMatch)
            .sorted(Comparator.comparingDouble(SemanticMatch::distance))
            .toList();
    return new SemanticQueryResult.Found(matches);
  }

  /** Drops the project's collection. Returns true if one existed. */
  public boolean dropCollection(String projectName) {
    return collectionStore.drop(collectionNames.forProject(projectName));
  }

  static String storeId(String fingerprint) {
    return UUID.nameUUIDFromBytes(fingerprint.getBytes(StandardCharsets.UTF_8)).toString();
  }

  private static SemanticMatch toSemanticMatch(EmbeddingMatch<TextSegment> match) {
    TextSegment segment = match.embedded();
    Map<String, Object> metadata = segment != null ? segment.metadata().toMap() : Map.of();
    Object fingerprint = metadata.get(FINGERPRINT_KEY);
    String id = fingerprint != null ? fingerprint.toString() : match.embeddingId();
    String document = segment != null ? segment.text() : "";
    return new SemanticMatch(id, document, metadata, cosineDistance(match.score()));
  }

  /**
   * LangChain4j scores are {@code (1 + cos) / 2}; the cosine distance {@code 1 - cos} is
   * {@code 2 * (1 - score)}, from 0 (same direction) to 2 (opposite).
   */
  static double cosineDistance(double relevanceScore) {
    return 2.0 * (1.0 - relevanceScore);
  }
}

package dev.fathom.vector;

import dev.langchain4j.data.segment.TextSegment;
import dev.langchain4j.store.embedding.EmbeddingStore;
import java.util.Optional;

/**
 * Resolves named snippet collections to LangChain4j embedding stores.
 *
 * <p>A collection holds the vectors of exactly one project.
 */
public interface SnippetCollectionStore {

  /** Returns the collection's store, or empty when the collection was never created. */
  Optional<EmbeddingStore<TextSegment>> find(String collection);

  /** Returns the collection's store, creating the collection when needed. */
  EmbeddingStore<TextSegment> getOrCreate(String collection);

  /**
   * Deletes the collection and every vector in it.
   *
   * @return true if a collection existed
   */
  boolean drop(String collection);
}

package dev.fathom.vector;

import dev.langchain4j.data.segment.TextSegment;
import dev.langchain4j.store.embedding.EmbeddingStore;

/**
 * An opened snippet collection, ready for upserts.
 *
 * @param projectName the owning project
 * @param collection the collection name derived from the project name
 * @param store the backing embedding store
 */
public record CollectionHandle(
    String projectName, String collection, EmbeddingStore<TextSegment> store) {}

package dev.fathom.vector;

import dev.langchain4j.data.document.Metadata;
import dev.langchain4j.data.embedding.Embedding;
import dev.langchain4j.data.segment.TextSegment;

/**
 * One vector entry to upsert.
 *
 * @param id snippet fingerprint; entries with the same id are replaced
 * @param embedding vector of the document text
 * @param documentText the text that was embedded
 * @param metadata non-body snippet fields
 */
public record SnippetRecord(
    String id, Embedding embedding, String documentText, Metadata metadata) {

  public TextSegment toTextSegment() {
    return TextSegment.from(documentText, metadata);
  }
}

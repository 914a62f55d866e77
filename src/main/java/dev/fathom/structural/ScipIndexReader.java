package dev.fathom.structural;

import com.google.protobuf.ByteString;
import com.google.protobuf.CodedInputStream;
import com.google.protobuf.InvalidProtocolBufferException;
import com.google.protobuf.WireFormat;
import dev.fathom.structural.scip.Scip;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Decodes a SCIP index with the bindings generated from {@code scip.proto}.
 *
 * <p>The whole index is parsed with {@link Scip.Index#parseFrom(byte[])}. When that fails, the
 * documents are decoded one by one so a corrupt entry is logged and left out instead of hiding
 * the rest of the index.
 */
@Component
public class ScipIndexReader {

  private static final Logger log = LoggerFactory.getLogger(ScipIndexReader.class);

  /**
   * Reads and decodes the index at {@code indexPath}.
   *
   * @throws ScipIndexException if the file cannot be read or its top-level framing is corrupt
   */
  public ScipIndex read(Path indexPath) {
    try {
      return decode(Files.readAllBytes(indexPath));
    } catch (IOException e) {
      throw new ScipIndexException(indexPath, e.getMessage(), e);
    }
  }

  ScipIndex decode(byte[] bytes) throws IOException {
    try {
      Scip.Index index = Scip.Index.parseFrom(bytes);
      return new ScipIndex(index.getDocumentsList().stream().map(ScipIndexReader::toDocument).toList());
    } catch (InvalidProtocolBufferException e) {
      log.warn("SCIP index does not decode as a whole ({}), recovering per document", e.getMessage());
      return decodePerDocument(CodedInputStream.newInstance(bytes));
    }
  }

  private ScipIndex decodePerDocument(CodedInputStream input) throws IOException {
    List<ScipDocument> documents = new ArrayList<>();
    int skipped = 0;
    int tag;
    while ((tag = input.readTag()) != 0) {
      if (WireFormat.getTagFieldNumber(tag) == Scip.Index.DOCUMENTS_FIELD_NUMBER
          && WireFormat.getTagWireType(tag) == WireFormat.WIRETYPE_LENGTH_DELIMITED) {
        ByteString bytes = input.readBytes();
        try {
          documents.add(toDocument(Scip.Document.parseFrom(bytes)));
        } catch (InvalidProtocolBufferException e) {
          skipped++;
          log.warn("Skipping malformed SCIP document: {}", e.getMessage());
        }
      } else {
        input.skipField(tag);
      }
    }
    log.debug("Decoded {} SCIP documents, {} skipped", documents.size(), skipped);
    return new ScipIndex(documents);
  }

  private static ScipDocument toDocument(Scip.Document document) {
    return new ScipDocument(
        document.getRelativePath(),
        document.getOccurrencesList().stream()
            .map(o -> new ScipOccurrence(o.getSymbol(), o.getSymbolRoles(), o.getRangeList()))
            .toList());
  }
}

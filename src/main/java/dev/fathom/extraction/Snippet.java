package dev.fathom.extraction;

import dev.langchain4j.data.document.Metadata;
import java.util.Objects;
import org.jspecify.annotations.Nullable;

/**
 * A method extracted from a source file: the unit of semantic search.
 *
 * <p>Snippets are derived data and are only persisted through the vector store. Their identity is
 * {@link #fingerprint()}, computed from location fields and never from {@code codeBody}.
 *
 * @param filePath absolute path of the source file
 * @param className simple name of the nearest enclosing type; null when there is none
 * @param methodName declared method name
 * @param parameters raw parameter list text including parentheses, e.g. {@code (String name)}
 * @param returnType declared return type text, e.g. {@code String} or {@code void}
 * @param startLine 1-based first line of the method body
 * @param endLine 1-based last line of the method body
 * @param codeBody the method body source text as written
 */
public record Snippet(
    String filePath,
    @Nullable String className,
    String methodName,
    @Nullable String parameters,
    @Nullable String returnType,
    int startLine,
    int endLine,
    String codeBody) {

  /** Placeholder shown for snippets without an enclosing type. */
  public static final String UNKNOWN_CONTAINER = "N/A";

  public Snippet {
    Objects.requireNonNull(filePath, "filePath must not be null");
    Objects.requireNonNull(methodName, "methodName must not be null");
    Objects.requireNonNull(codeBody, "codeBody must not be null");
  }

  /** Stable identity token used as the upsert key in the vector store. */
  public String fingerprint() {
    return SnippetFingerprint.of(filePath, className, methodName, startLine);
  }

  /**
   * Converts every field except the body to a langchain4j {@link Metadata} instance with the
   * snake_case keys used by the snippet collections.
   */
  public Metadata toMetadata() {
    Metadata metadata =
        Metadata.from("file_path", filePath)
            .put("class_name", className != null ? className : UNKNOWN_CONTAINER)
            .put("method_name", methodName)
            .put("start_line", startLine)
            .put("end_line", endLine)
            .put("fingerprint", fingerprint());
    if (parameters != null) {
      metadata.put("parameters", parameters);
    }
    if (returnType != null) {
      metadata.put("return_type", returnType);
    }
    return metadata;
  }
}

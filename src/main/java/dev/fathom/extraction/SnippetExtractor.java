package dev.fathom.extraction;

import com.github.javaparser.JavaParser;
import com.github.javaparser.ParseResult;
import com.github.javaparser.ParserConfiguration;
import com.github.javaparser.Problem;
import com.github.javaparser.TokenRange;
import com.github.javaparser.ast.CompilationUnit;
import com.github.javaparser.ast.Node;
import com.github.javaparser.ast.body.MethodDeclaration;
import com.github.javaparser.ast.body.TypeDeclaration;
import com.github.javaparser.ast.stmt.BlockStmt;
import java.io.IOException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.stream.Collectors;
import java.util.stream.Stream;
import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Extracts method snippets from Java source files.
 *
 * <p>Only method declarations with a body are emitted: abstract and interface methods without a
 * default body are skipped. Lines are taken from the body block, and the code text is the body as
 * written in the file.
 */
@Component
public class SnippetExtractor {

  private static final Logger log = LoggerFactory.getLogger(SnippetExtractor.class);

  private final SourceFileScanner scanner;

  public SnippetExtractor(SourceFileScanner scanner) {
    this.scanner = scanner;
  }

  /**
   * Lazily extracts snippets from every source file under {@code root}. Files that fail to parse
   * are logged and contribute nothing.
   */
  public Stream<Snippet> extract(Path root) {
    return scanner.findSourceFiles(root).stream().flatMap(file -> extractOrSkip(file).stream());
  }

  /**
   * Extracts the snippets of one file in declaration order.
   *
   * @throws SourceParseException if the file cannot be read or does not parse
   */
  public List<Snippet> extractFile(Path file) {
    CompilationUnit unit = parse(file);
    String filePath = file.toAbsolutePath().toString();
    List<Snippet> snippets = new ArrayList<>();
    for (MethodDeclaration method : unit.findAll(MethodDeclaration.class)) {
      toSnippet(filePath, method).ifPresent(snippets::add);
    }
    return snippets;
  }

  private List<Snippet> extractOrSkip(Path file) {
    try {
      return extractFile(file);
    } catch (SourceParseException e) {
      log.warn("Skipping {}: {}", file, e.getMessage());
      return List.of();
    }
  }

  private CompilationUnit parse(Path file) {
    // JavaParser instances are not thread-safe
    JavaParser parser =
        new JavaParser(
            new ParserConfiguration()
                .setLanguageLevel(ParserConfiguration.LanguageLevel.JAVA_17));
    ParseResult<CompilationUnit> result;
    try {
      result = parser.parse(file);
    } catch (IOException e) {
      throw new SourceParseException(file, e);
    }
    if (!result.isSuccessful() || result.getResult().isEmpty()) {
      String problems =
          result.getProblems().stream()
              .map(Problem::getVerboseMessage)
              .collect(Collectors.joining("; "));
      throw new SourceParseException(file, problems);
    }
    return result.getResult().get();
  }

  private Optional<Snippet> toSnippet(String filePath, MethodDeclaration method) {
    Optional<BlockStmt> body = method.getBody();
    if (body.isEmpty()) {
      return Optional.empty();
    }
    BlockStmt block = body.get();
    if (block.getBegin().isEmpty() || block.getEnd().isEmpty()) {
      return Optional.empty();
    }
    return Optional.of(
        new Snippet(
            filePath,
            enclosingTypeName(method),
            method.getNameAsString(),
            parameterText(method),
            method.getType().asString(),
            block.getBegin().get().line,
            block.getEnd().get().line,
            sourceText(block)));
  }

  /** Nearest enclosing class, interface, enum or record; null when there is none. */
  static @Nullable String enclosingTypeName(Node node) {
    Optional<Node> parent = node.getParentNode();
    while (parent.isPresent()) {
      Node current = parent.get();
      if (current instanceof TypeDeclaration<?> type) {
        return type.getNameAsString();
      }
      parent = current.getParentNode();
    }
    return null;
  }

  private static String parameterText(MethodDeclaration method) {
    return method.getParameters().stream()
        .map(SnippetExtractor::sourceText)
        .collect(Collectors.joining(", ", "(", ")"));
  }

  private static String sourceText(Node node) {
    return node.getTokenRange().map(TokenRange::toString).orElseGet(node::toString);
  }
}

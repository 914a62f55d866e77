package dev.fathom.literal;

import static org.assertj.core.api.Assertions.assertThat;

import com.fasterxml.jackson.databind.ObjectMapper;
import java.util.List;
import org.junit.jupiter.api.Test;

class RipgrepOutputParserTest {

  private static final String BEGIN =
      """
      {"type":"begin","data":{"path":{"text":"/work/demo/src/Main.java"}}}""";

  private static final String MATCH =
      """
      {"type":"match","data":{"path":{"text":"/work/demo/src/Main.java"},\
      "lines":{"text":"        System.out.println(\\"hi\\");\\n"},"line_number":6,\
      "absolute_offset":87,"submatches":[{"match":{"text":"System.out.println"},\
      "start":8,"end":26}]}}""";

  private static final String CONTEXT =
      """
      {"type":"context","data":{"path":{"text":"/work/demo/src/Main.java"},\
      "lines":{"text":"    public static void main(String[] args) {\\n"},"line_number":5,\
      "absolute_offset":40,"submatches":[]}}""";

  private static final String SUMMARY =
      """
      {"type":"summary","data":{"elapsed_total":{"secs":0,"nanos":1000,"human":"0.000001s"}}}""";

  private final RipgrepOutputParser parser = new RipgrepOutputParser(new ObjectMapper());

  @Test
  void keepsOnlyMatchRecords() {
    String output = String.join("\n", BEGIN, CONTEXT, MATCH, SUMMARY) + "\n";

    List<LiteralMatch> matches = parser.parse(output);

    assertThat(matches)
        .containsExactly(
            new LiteralMatch(
                "/work/demo/src/Main.java",
                6,
                "System.out.println(\"hi\");",
                87,
                List.of(new Submatch(8, 26, "System.out.println"))));
  }

  @Test
  void emptyOutputYieldsNoMatches() {
    assertThat(parser.parse("")).isEmpty();
  }

  @Test
  void nonJsonLinesAreDiscarded() {
    String output = "rg: warning: something odd\n" + MATCH + "\n{broken";

    assertThat(parser.parse(output)).hasSize(1);
  }

  @Test
  void matchWithoutTextualPathIsDiscarded() {
    String rawBytesPath =
        """
        {"type":"match","data":{"path":{"bytes":"L3dvcmsvZGVtbw=="},"lines":{"text":"x\\n"},\
        "line_number":1,"absolute_offset":0,"submatches":[]}}""";

    assertThat(parser.parseLine(rawBytesPath)).isEmpty();
  }

  @Test
  void matchOnNonUtf8LineIsKeptWithEmptyText() {
    String binaryLine =
        """
        {"type":"match","data":{"path":{"text":"/work/demo/Legacy.java"},\
        "lines":{"bytes":"/3ZhciBuZWVkbGU7Cg=="},"line_number":12,"absolute_offset":340,\
        "submatches":[{"match":{"text":"needle"},"start":5,"end":11}]}}""";

    assertThat(parser.parseLine(binaryLine))
        .hasValueSatisfying(
            match -> {
              assertThat(match.filePath()).isEqualTo("/work/demo/Legacy.java");
              assertThat(match.lineNumber()).isEqualTo(12);
              assertThat(match.matchText()).isEmpty();
              assertThat(match.submatches()).containsExactly(new Submatch(5, 11, "needle"));
            });
  }

  @Test
  void matchWithoutLineNumberIsDiscarded() {
    String noLineNumber =
        """
        {"type":"match","data":{"path":{"text":"a.txt"},"lines":{"text":"x\\n"},\
        "line_number":null,"absolute_offset":0,"submatches":[]}}""";

    assertThat(parser.parseLine(noLineNumber)).isEmpty();
  }

  @Test
  void matchWithoutOffsetIsDiscarded() {
    String noOffset =
        """
        {"type":"match","data":{"path":{"text":"a.txt"},"lines":{"text":"x\\n"},\
        "line_number":3,"submatches":[]}}""";

    assertThat(parser.parseLine(noOffset)).isEmpty();
  }

  @Test
  void multipleSubmatchesOnOneLineAreKept() {
    String twice =
        """
        {"type":"match","data":{"path":{"text":"a.txt"},"lines":{"text":"foo foo\\n"},\
        "line_number":1,"absolute_offset":0,"submatches":[\
        {"match":{"text":"foo"},"start":0,"end":3},{"match":{"text":"foo"},"start":4,"end":7}]}}""";

    LiteralMatch match = parser.parseLine(twice).orElseThrow();

    assertThat(match.matchText()).isEqualTo("foo foo");
    assertThat(match.submatches())
        .containsExactly(new Submatch(0, 3, "foo"), new Submatch(4, 7, "foo"));
  }
}

package dev.fathom.literal;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assumptions.assumeTrue;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.ArgumentMatchers.isNull;
import static org.mockito.BDDMockito.given;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;

import com.fasterxml.jackson.databind.ObjectMapper;
import dev.fathom.fixture.SampleProject;
import dev.fathom.process.ProcessOutcome;
import dev.fathom.process.ProcessRunner;
import java.nio.file.Path;
import java.time.Duration;
import java.util.List;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class RipgrepSearchServiceTest {

  private static final Path ROOT = Path.of("/work/demo");

  private static final String MATCH_LINE =
      """
      {"type":"match","data":{"path":{"text":"/work/demo/a.txt"},"lines":{"text":"needle\\n"},\
      "line_number":2,"absolute_offset":10,"submatches":[]}}""";

  private ProcessRunner processRunner;
  private LiteralSearchProperties properties;
  private RipgrepSearchService service;

  @BeforeEach
  void setUp() {
    processRunner = mock(ProcessRunner.class);
    properties = new LiteralSearchProperties();
    service =
        new RipgrepSearchService(
            processRunner, new RipgrepOutputParser(new ObjectMapper()), properties);
  }

  @Test
  void commandTreatsPatternAsFixedStringAfterDoubleDash() {
    assertThat(service.command(ROOT, "--not-an-option"))
        .containsExactly(
            "rg",
            "--json",
            "--line-number",
            "--context",
            "1",
            "--fixed-strings",
            "--case-sensitive",
            "--",
            "--not-an-option",
            "/work/demo");
  }

  @Test
  void exitZeroYieldsParsedMatches() {
    given(processRunner.run(anyList(), isNull(), eq(properties.getTimeout())))
        .willReturn(new ProcessOutcome.Completed(0, MATCH_LINE + "\n", ""));

    LiteralSearchOutcome outcome = service.search(ROOT, "needle");

    assertThat(outcome).isInstanceOf(LiteralSearchOutcome.Success.class);
    assertThat(((LiteralSearchOutcome.Success) outcome).matches())
        .singleElement()
        .satisfies(
            match -> {
              assertThat(match.filePath()).isEqualTo("/work/demo/a.txt");
              assertThat(match.lineNumber()).isEqualTo(2);
              assertThat(match.matchText()).isEqualTo("needle");
            });
    verify(processRunner).run(service.command(ROOT, "needle"), null, properties.getTimeout());
  }

  @Test
  void exitOneMeansNoMatches() {
    given(processRunner.run(anyList(), any(), any()))
        .willReturn(new ProcessOutcome.Completed(1, "", ""));

    assertThat(service.search(ROOT, "absent")).isInstanceOf(LiteralSearchOutcome.NoMatches.class);
  }

  @Test
  void higherExitCodeIsToolError() {
    given(processRunner.run(anyList(), any(), any()))
        .willReturn(new ProcessOutcome.Completed(2, "", "rg: /work/demo: No such file"));

    assertThat(service.search(ROOT, "x"))
        .isEqualTo(new LiteralSearchOutcome.ToolError(2, "rg: /work/demo: No such file"));
  }

  @Test
  void missingExecutableIsToolMissing() {
    given(processRunner.run(anyList(), any(), any()))
        .willReturn(new ProcessOutcome.ExecutableNotFound("rg"));

    assertThat(service.search(ROOT, "x")).isEqualTo(new LiteralSearchOutcome.ToolMissing("rg"));
  }

  @Test
  void launchFailureIsStartFailed() {
    given(processRunner.run(anyList(), any(), any()))
        .willReturn(new ProcessOutcome.StartFailed("rg", "error=13, Permission denied"));

    assertThat(service.search(ROOT, "x"))
        .isEqualTo(new LiteralSearchOutcome.StartFailed("rg", "error=13, Permission denied"));
  }

  @Test
  void timeoutIsReported() {
    given(processRunner.run(anyList(), any(), any()))
        .willReturn(new ProcessOutcome.TimedOut(Duration.ofSeconds(30)));

    assertThat(service.search(ROOT, "x"))
        .isEqualTo(new LiteralSearchOutcome.TimedOut(Duration.ofSeconds(30)));
  }

  @Test
  void findsLiteralInSampleProjectWithRealRipgrep(@TempDir Path root) throws Exception {
    ProcessRunner realRunner = new ProcessRunner();
    assumeTrue(
        realRunner.run(List.of("rg", "--version"), null, Duration.ofSeconds(10))
            instanceof ProcessOutcome.Completed,
        "ripgrep not installed");
    SampleProject.create(root);
    RipgrepSearchService realService =
        new RipgrepSearchService(
            realRunner, new RipgrepOutputParser(new ObjectMapper()), properties);

    LiteralSearchOutcome outcome = realService.search(root, "System.out.println");

    assertThat(outcome).isInstanceOf(LiteralSearchOutcome.Success.class);
    List<LiteralMatch> matches = ((LiteralSearchOutcome.Success) outcome).matches();
    assertThat(matches).hasSize(1);
    assertThat(matches.get(0).lineNumber()).isEqualTo(6);
    assertThat(matches.get(0).filePath()).endsWith("Main.java");
    assertThat(realService.search(root, "System.out.printf"))
        .isInstanceOf(LiteralSearchOutcome.NoMatches.class);
  }
}

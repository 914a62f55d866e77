package dev.fathom.structural;

import static dev.fathom.structural.ScipFixtures.GREET;
import static dev.fathom.structural.ScipFixtures.MAIN;
import static dev.fathom.structural.ScipFixtures.concat;
import static dev.fathom.structural.ScipFixtures.document;
import static dev.fathom.structural.ScipFixtures.documentEntry;
import static dev.fathom.structural.ScipFixtures.index;
import static dev.fathom.structural.ScipFixtures.occurrence;
import static dev.fathom.structural.ScipFixtures.truncatedDocument;
import static dev.fathom.structural.ScipFixtures.unpackedDocument;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.nio.file.Path;
import java.util.List;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class ScipIndexReaderTest {

  private final ScipIndexReader reader = new ScipIndexReader();

  @TempDir Path tempDir;

  @Test
  void decodesDocumentsAndOccurrences() {
    Path file =
        ScipFixtures.write(
            tempDir.resolve("demo.scip"),
            index(
                document(
                    "src/main/java/com/example/Main.java",
                    occurrence(MAIN, 1, 4, 23, 27),
                    occurrence(GREET, 0, 5, 8, 13))));

    ScipIndex scipIndex = reader.read(file);

    assertThat(scipIndex.documents()).hasSize(1);
    ScipDocument doc = scipIndex.documents().get(0);
    assertThat(doc.relativePath()).isEqualTo("src/main/java/com/example/Main.java");
    assertThat(doc.occurrences())
        .containsExactly(
            new ScipOccurrence(MAIN, 1, List.of(4, 23, 27)),
            new ScipOccurrence(GREET, 0, List.of(5, 8, 13)));
    assertThat(doc.occurrences().get(0).isDefinition()).isTrue();
    assertThat(doc.occurrences().get(1).isDefinition()).isFalse();
  }

  @Test
  void unpackedRangeDecodesLikePackedRange() {
    Path file =
        ScipFixtures.write(
            tempDir.resolve("unpacked.scip"),
            documentEntry(unpackedDocument("A.java", GREET, 1, 9, 4, 14, 5)));

    ScipOccurrence occurrence = reader.read(file).documents().get(0).occurrences().get(0);

    assertThat(occurrence.range()).containsExactly(9, 4, 14, 5);
  }

  @Test
  void malformedDocumentIsSkippedAndOthersKept() {
    Path file =
        ScipFixtures.write(
            tempDir.resolve("partial.scip"),
            concat(
                index(document("Good.java", occurrence(GREET, 1, 1, 2, 3))),
                documentEntry(truncatedDocument())));

    ScipIndex scipIndex = reader.read(file);

    assertThat(scipIndex.documents()).extracting(ScipDocument::relativePath)
        .containsExactly("Good.java");
  }

  @Test
  void emptyFileIsAnEmptyIndex() {
    Path file = ScipFixtures.write(tempDir.resolve("empty.scip"), new byte[0]);

    assertThat(reader.read(file).documents()).isEmpty();
  }

  @Test
  void missingFileRaisesScipIndexException() {
    Path missing = tempDir.resolve("missing.scip");

    assertThatThrownBy(() -> reader.read(missing))
        .isInstanceOf(ScipIndexException.class)
        .hasMessageContaining("missing.scip");
  }

  @Test
  void truncatedTopLevelFramingRaisesScipIndexException() {
    // documents entry announcing 100 bytes but carrying 2
    Path file = ScipFixtures.write(tempDir.resolve("cut.scip"), new byte[] {0x12, 0x64, 0x0a, 0x00});

    assertThatThrownBy(() -> reader.read(file)).isInstanceOf(ScipIndexException.class);
  }
}

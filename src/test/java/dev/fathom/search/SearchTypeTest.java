package dev.fathom.search;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

class SearchTypeTest {

  @ParameterizedTest
  @CsvSource({"semantic,SEMANTIC", "LITERAL,LITERAL", " Structural ,STRUCTURAL"})
  void parsesIgnoringCaseAndWhitespace(String value, SearchType expected) {
    assertThat(SearchType.fromString(value)).isEqualTo(expected);
  }

  @Test
  void unknownTypeListsValidOnes() {
    assertThatThrownBy(() -> SearchType.fromString("fuzzy"))
        .isInstanceOf(IllegalArgumentException.class)
        .hasMessage("Unknown search type 'fuzzy', expected one of [semantic, literal, structural]");
  }

  @Test
  void nullIsRejected() {
    assertThatThrownBy(() -> SearchType.fromString(null))
        .isInstanceOf(IllegalArgumentException.class);
  }

  @Test
  void serialisesInLowerCase() throws Exception {
    ObjectMapper mapper = new ObjectMapper();

    assertThat(mapper.writeValueAsString(SearchType.STRUCTURAL)).isEqualTo("\"structural\"");
    assertThat(mapper.readValue("\"Literal\"", SearchType.class)).isEqualTo(SearchType.LITERAL);
  }
}

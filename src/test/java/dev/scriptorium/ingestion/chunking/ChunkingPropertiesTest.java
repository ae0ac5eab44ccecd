package dev.scriptorium.ingestion.chunking;

import static org.assertj.core.api.Assertions.assertThatCode;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import dev.scriptorium.error.ConfigurationException;
import org.junit.jupiter.api.Test;

class ChunkingPropertiesTest {

  @Test
  void defaultsAreValid() {
    assertThatCode(() -> new ChunkingProperties().validate()).doesNotThrowAnyException();
  }

  @Test
  void chunkSizeBelowMinimumIsRejected() {
    assertThatThrownBy(() -> ChunkingProperties.validate(99, 0))
        .isInstanceOf(ConfigurationException.class)
        .hasMessageContaining("at least 100");
  }

  @Test
  void overlapMustStayBelowChunkSize() {
    assertThatCode(() -> ChunkingProperties.validate(100, 99)).doesNotThrowAnyException();
    assertThatThrownBy(() -> ChunkingProperties.validate(100, 100))
        .isInstanceOf(ConfigurationException.class);
    assertThatThrownBy(() -> ChunkingProperties.validate(100, -1))
        .isInstanceOf(ConfigurationException.class);
  }

  @Test
  void overlapCharsPerWordMustBePositive() {
    ChunkingProperties properties = new ChunkingProperties();
    properties.setOverlapCharsPerWord(0);

    assertThatThrownBy(properties::validate)
        .isInstanceOf(ConfigurationException.class)
        .hasMessageContaining("overlap-chars-per-word");
  }
}

package dev.scriptorium.ingestion.chunking;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import dev.langchain4j.data.document.Metadata;
import dev.langchain4j.data.segment.TextSegment;
import dev.scriptorium.fixture.DocumentChunkBuilder;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Test;

class DocumentChunkDataTest {

  @Test
  void ofDerivesWordAndCharacterCounts() {
    DocumentChunkData chunk = new DocumentChunkBuilder().text("three little words").build();

    assertThat(chunk.wordCount()).isEqualTo(3);
    assertThat(chunk.charCount()).isEqualTo(18);
  }

  @Test
  void bodyStripsOverlapPrefix() {
    DocumentChunkData chunk =
        new DocumentChunkBuilder().text("previous tail new body").overlapPrefixLength(14).build();

    assertThat(chunk.body()).isEqualTo("new body");
  }

  @Test
  void rejectsOverlapPrefixLongerThanText() {
    assertThatThrownBy(() -> new DocumentChunkBuilder().text("short").overlapPrefixLength(6).build())
        .isInstanceOf(IllegalArgumentException.class);
  }

  @Test
  void rejectsNegativeIndex() {
    assertThatThrownBy(() -> new DocumentChunkBuilder().chunkIndex(-1).build())
        .isInstanceOf(IllegalArgumentException.class);
  }

  @Test
  void metadataIsAnImmutableCopy() {
    Map<String, Object> source = new HashMap<>();
    source.put("file_type", "txt");
    DocumentChunkData chunk = DocumentChunkData.of("text", "a_0000", 0, "a.txt", 0, source);

    source.put("file_type", "md");

    assertThat(chunk.metadata()).containsEntry("file_type", "txt");
    assertThatThrownBy(() -> chunk.metadata().put("x", "y"))
        .isInstanceOf(UnsupportedOperationException.class);
  }

  @Test
  void withMetadataReturnsCorrectedCopy() {
    DocumentChunkData original = new DocumentChunkBuilder().metadata("file_type", "txt").build();

    DocumentChunkData corrected = original.withMetadata(Map.of("file_type", "md", "title", "Guide"));

    assertThat(corrected.metadata()).containsEntry("file_type", "md").containsEntry("title", "Guide");
    assertThat(original.metadata()).containsEntry("file_type", "txt").doesNotContainKey("title");
    assertThat(corrected.text()).isEqualTo(original.text());
  }

  @Test
  void toMetadataCarriesSegmentIdentityAndCounts() {
    DocumentChunkData chunk =
        new DocumentChunkBuilder()
            .text("one two three")
            .chunkId("guide_0003")
            .chunkIndex(3)
            .sourceFile("/docs/guide.txt")
            .build();

    Metadata metadata = chunk.toMetadata();

    assertThat(metadata.getString("chunk_id")).isEqualTo("guide_0003");
    assertThat(metadata.getInteger("chunk_index")).isEqualTo(3);
    assertThat(metadata.getString("source_file")).isEqualTo("/docs/guide.txt");
    assertThat(metadata.getInteger("word_count")).isEqualTo(3);
    assertThat(metadata.getInteger("char_count")).isEqualTo(13);
  }

  @Test
  void toMetadataKeepsNumbersAndStringifiesOtherValues() {
    DocumentChunkData chunk =
        new DocumentChunkBuilder()
            .metadata("file_size", 2048L)
            .metadata("line_count", 12)
            .metadata("ratio", 0.5)
            .metadata("flags", List.of("a", "b"))
            .build();

    Metadata metadata = chunk.toMetadata();

    assertThat(metadata.getLong("file_size")).isEqualTo(2048L);
    assertThat(metadata.getInteger("line_count")).isEqualTo(12);
    assertThat(metadata.getDouble("ratio")).isEqualTo(0.5);
    assertThat(metadata.getString("flags")).isEqualTo("[a, b]");
  }

  @Test
  void toTextSegmentCarriesTextAndMetadata() {
    DocumentChunkData chunk = new DocumentChunkBuilder().text("segment text").build();

    TextSegment segment = chunk.toTextSegment();

    assertThat(segment.text()).isEqualTo("segment text");
    assertThat(segment.metadata().getString("chunk_id")).isEqualTo("guide_0000");
  }
}

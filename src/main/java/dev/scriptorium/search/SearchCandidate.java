package dev.scriptorium.search;

import dev.langchain4j.data.segment.TextSegment;
import dev.langchain4j.store.embedding.EmbeddingMatch;
import java.util.Map;
import java.util.Objects;

/**
 * A raw vector-index match before ranking.
 *
 * @param chunkId segment id ({@code chunk_id} metadata, or the store id for foreign entries)
 * @param text segment text
 * @param score similarity score clamped to [0, 1]
 * @param sourceFile originating document, empty if unknown
 * @param metadata copy of the segment metadata
 * @param position rank in the vector-index answer, used to break score ties
 */
public record SearchCandidate(
    String chunkId,
    String text,
    double score,
    String sourceFile,
    Map<String, Object> metadata,
    int position) {

  public SearchCandidate {
    score = ResultRanker.clamp(score);
    metadata = Map.copyOf(metadata);
  }

  static SearchCandidate from(EmbeddingMatch<TextSegment> match, int position) {
    TextSegment segment = match.embedded();
    Map<String, Object> metadata = segment.metadata().toMap();
    String chunkId =
        Objects.requireNonNullElse(segment.metadata().getString("chunk_id"), match.embeddingId());
    return new SearchCandidate(
        chunkId,
        segment.text(),
        match.score() == null ? 0.0 : match.score(),
        Objects.requireNonNullElse(segment.metadata().getString("source_file"), ""),
        metadata,
        position);
  }
}

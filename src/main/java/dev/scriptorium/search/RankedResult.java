package dev.scriptorium.search;

import java.util.List;
import java.util.Map;

/**
 * A search result after ranking.
 *
 * @param chunkId segment id
 * @param text segment text
 * @param score final score in [0, 1]
 * @param sourceFile originating document
 * @param metadata segment metadata
 * @param matchedKeywords query words found in the text, sorted
 * @param explanation how the score was derived: {@code original_score}, {@code keyword_boost},
 *     {@code length_factor}, {@code text_length_words} and {@code diversity_penalty}
 */
public record RankedResult(
    String chunkId,
    String text,
    double score,
    String sourceFile,
    Map<String, Object> metadata,
    List<String> matchedKeywords,
    Map<String, Object> explanation) {

  public RankedResult {
    metadata = Map.copyOf(metadata);
    matchedKeywords = List.copyOf(matchedKeywords);
    explanation = Map.copyOf(explanation);
  }

  public boolean diversityPenalized() {
    return Boolean.TRUE.equals(explanation.get(ResultRanker.DIVERSITY_PENALTY));
  }
}

package dev.scriptorium.search;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Comparator;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import org.springframework.stereotype.Component;

/**
 * Re-scores vector-index candidates on top of their similarity score.
 *
 * <ol>
 *   <li>Keyword boost: {@code min(0.1, matched / queryWords * 0.1)} added for query words that
 *       appear verbatim (case-insensitive) in the text.
 *   <li>Length normalisation: texts under 10 words are multiplied by 0.9, texts over 500 words by
 *       0.95.
 *   <li>Source diversity: in score order, each source keeps at most {@code max(1, N / 3)}
 *       unpenalised results; the rest are multiplied by 0.8 and flagged.
 * </ol>
 *
 * <p>Scores are clamped to [0, 1] after every step. Both sorts break ties by vector-index order,
 * including ties created by the diversity penalty, so the output is deterministic.
 */
@Component
public class ResultRanker {

  static final double MAX_KEYWORD_BOOST = 0.1;
  static final int SHORT_TEXT_WORDS = 10;
  static final int LONG_TEXT_WORDS = 500;
  static final double SHORT_TEXT_FACTOR = 0.9;
  static final double LONG_TEXT_FACTOR = 0.95;
  static final double DIVERSITY_FACTOR = 0.8;

  static final String ORIGINAL_SCORE = "original_score";
  static final String KEYWORD_BOOST = "keyword_boost";
  static final String LENGTH_FACTOR = "length_factor";
  static final String TEXT_LENGTH_WORDS = "text_length_words";
  static final String DIVERSITY_PENALTY = "diversity_penalty";

  /**
   * Ranks candidates for the given query.
   *
   * @param query the normalised query
   * @param candidates vector-index matches in index order
   * @return ranked results, best first; same size as {@code candidates}
   */
  public List<RankedResult> rank(String query, List<SearchCandidate> candidates) {
    if (candidates.isEmpty()) {
      return List.of();
    }
    Set<String> queryWords = words(query);

    List<Scored> scored = new ArrayList<>(candidates.size());
    for (int i = 0; i < candidates.size(); i++) {
      scored.add(score(queryWords, candidates.get(i), i));
    }

    applyDiversityQuota(scored);
    return scored.stream().map(Scored::toResult).toList();
  }

  private Scored score(Set<String> queryWords, SearchCandidate candidate, int order) {
    double score = clamp(candidate.score());

    Set<String> textWords = words(candidate.text());
    List<String> matched = queryWords.stream().filter(textWords::contains).sorted().toList();
    double boost = 0.0;
    if (!matched.isEmpty()) {
      boost = Math.min(MAX_KEYWORD_BOOST, (double) matched.size() / queryWords.size() * 0.1);
      score = clamp(score + boost);
    }

    int wordCount = wordCount(candidate.text());
    double lengthFactor = 1.0;
    if (wordCount < SHORT_TEXT_WORDS) {
      lengthFactor = SHORT_TEXT_FACTOR;
    } else if (wordCount > LONG_TEXT_WORDS) {
      lengthFactor = LONG_TEXT_FACTOR;
    }
    score = clamp(score * lengthFactor);

    Map<String, Object> explanation = new LinkedHashMap<>();
    explanation.put(ORIGINAL_SCORE, candidate.score());
    explanation.put(KEYWORD_BOOST, boost);
    explanation.put(LENGTH_FACTOR, lengthFactor);
    explanation.put(TEXT_LENGTH_WORDS, wordCount);
    explanation.put(DIVERSITY_PENALTY, false);
    return new Scored(candidate, order, score, matched, explanation);
  }

  private static void applyDiversityQuota(List<Scored> scored) {
    Comparator<Scored> byScoreThenIndexOrder =
        Comparator.comparingDouble((Scored s) -> s.score).reversed().thenComparingInt(s -> s.order);
    scored.sort(byScoreThenIndexOrder);

    int quota = Math.max(1, scored.size() / 3);
    Map<String, Integer> perSource = new HashMap<>();
    for (Scored s : scored) {
      int kept = perSource.getOrDefault(s.candidate.sourceFile(), 0);
      if (kept < quota) {
        perSource.put(s.candidate.sourceFile(), kept + 1);
      } else {
        s.score = clamp(s.score * DIVERSITY_FACTOR);
        s.explanation.put(DIVERSITY_PENALTY, true);
      }
    }

    // Penalised scores may now tie with lower-ranked ones; vector-index order decides
    scored.sort(byScoreThenIndexOrder);
  }

  static double clamp(double score) {
    if (Double.isNaN(score)) {
      return 0.0;
    }
    return Math.max(0.0, Math.min(1.0, score));
  }

  private static Set<String> words(String text) {
    String trimmed = text.trim().toLowerCase(Locale.ROOT);
    if (trimmed.isEmpty()) {
      return Set.of();
    }
    return new LinkedHashSet<>(Arrays.asList(trimmed.split("\\s+")));
  }

  private static int wordCount(String text) {
    String trimmed = text.trim();
    return trimmed.isEmpty() ? 0 : trimmed.split("\\s+").length;
  }

  /** Mutable scoring state of one candidate. */
  private static final class Scored {

    private final SearchCandidate candidate;
    private final int order;
    private double score;
    private final List<String> matched;
    private final Map<String, Object> explanation;

    Scored(
        SearchCandidate candidate,
        int order,
        double score,
        List<String> matched,
        Map<String, Object> explanation) {
      this.candidate = candidate;
      this.order = order;
      this.score = score;
      this.matched = matched;
      this.explanation = explanation;
    }

    RankedResult toResult() {
      return new RankedResult(
          candidate.chunkId(),
          candidate.text(),
          score,
          candidate.sourceFile(),
          candidate.metadata(),
          matched,
          explanation);
    }
  }
}

package dev.scriptorium.search;

import java.util.List;

/**
 * Outcome of a search.
 *
 * @param query the normalised (trimmed) query
 * @param results ranked results, best first
 * @param cached whether the results came from the query-result cache
 * @param stats timings and counts
 */
public record SearchResponse(
    String query, List<RankedResult> results, boolean cached, SearchStats stats) {

  public SearchResponse {
    results = List.copyOf(results);
  }
}

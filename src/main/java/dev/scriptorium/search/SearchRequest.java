package dev.scriptorium.search;

import dev.scriptorium.error.QueryException;
import java.util.List;
import org.jspecify.annotations.Nullable;

/**
 * Search request with optional result count, similarity threshold and metadata filters.
 *
 * <p>Null {@code limit} and {@code threshold} fall back to the configured defaults. A request with
 * filters never reads or populates the query-result cache.
 *
 * @param query the search query text (must not be null or blank)
 * @param limit maximum number of results (must be >= 1; clamped to the configured maximum)
 * @param threshold minimum similarity score in [0, 1]
 * @param filters metadata restrictions combined with AND
 */
public record SearchRequest(
    String query,
    @Nullable Integer limit,
    @Nullable Double threshold,
    List<MetadataFilter> filters) {

  /** Compact constructor validating input. */
  public SearchRequest {
    if (query == null || query.isBlank()) {
      throw new QueryException("query must not be blank");
    }
    if (limit != null && limit < 1) {
      throw new QueryException("limit must be at least 1, got: " + limit);
    }
    if (threshold != null && (threshold.isNaN() || threshold < 0.0 || threshold > 1.0)) {
      throw new QueryException("threshold must be in [0.0, 1.0], got: " + threshold);
    }
    filters = filters == null ? List.of() : List.copyOf(filters);
  }

  /** Convenience constructor using the configured limit and threshold, no filters. */
  public SearchRequest(String query) {
    this(query, null, null, List.of());
  }

  /** Convenience constructor with limit and threshold, no filters. */
  public SearchRequest(String query, @Nullable Integer limit, @Nullable Double threshold) {
    this(query, limit, threshold, List.of());
  }
}

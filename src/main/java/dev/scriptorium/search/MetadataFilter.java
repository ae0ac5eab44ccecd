package dev.scriptorium.search;

import dev.scriptorium.error.QueryException;
import java.util.Objects;
import org.jspecify.annotations.Nullable;

/**
 * A single metadata restriction on search results: either an exact match or an inclusive numeric
 * range with at least one bound. Several filters on one request are combined with AND.
 *
 * @param key metadata key, e.g. {@code source_file} or {@code file_size}
 * @param value exact value to match (String, Integer, Long, Float or Double), or null for a range
 * @param min inclusive lower bound, or null
 * @param max inclusive upper bound, or null
 */
public record MetadataFilter(
    String key, @Nullable Object value, @Nullable Number min, @Nullable Number max) {

  public MetadataFilter {
    Objects.requireNonNull(key, "key");
    if (key.isBlank()) {
      throw new QueryException("filter key must not be blank");
    }
    if (value != null && (min != null || max != null)) {
      throw new QueryException("filter on '" + key + "' mixes an exact value with a range");
    }
    if (value == null && min == null && max == null) {
      throw new QueryException("filter on '" + key + "' has neither a value nor a range");
    }
  }

  public static MetadataFilter equalTo(String key, Object value) {
    return new MetadataFilter(key, Objects.requireNonNull(value, "value"), null, null);
  }

  public static MetadataFilter range(String key, @Nullable Number min, @Nullable Number max) {
    return new MetadataFilter(key, null, min, max);
  }

  public boolean isRange() {
    return value == null;
  }
}

package dev.scriptorium.search;

import static dev.langchain4j.store.embedding.filter.MetadataFilterBuilder.metadataKey;

import dev.langchain4j.store.embedding.filter.Filter;
import dev.langchain4j.store.embedding.filter.MetadataFilterBuilder;
import dev.scriptorium.error.QueryException;
import java.util.ArrayList;
import java.util.List;
import java.util.UUID;
import org.jspecify.annotations.Nullable;

/** Translates {@link MetadataFilter}s into a LangChain4j {@link Filter}. */
final class MetadataFilters {

  private MetadataFilters() {
    // utility class
  }

  /**
   * Builds a composable filter, combining all restrictions with AND logic.
   *
   * @return combined filter, or null if the list is empty
   */
  static @Nullable Filter toFilter(List<MetadataFilter> filters) {
    List<Filter> translated = new ArrayList<>();
    for (MetadataFilter filter : filters) {
      if (filter.isRange()) {
        addRange(translated, filter);
      } else {
        translated.add(exact(filter.key(), filter.value()));
      }
    }
    return translated.stream().reduce((a, b) -> a.and(b)).orElse(null);
  }

  private static Filter exact(String key, @Nullable Object value) {
    MetadataFilterBuilder builder = metadataKey(key);
    if (value instanceof String s) {
      return builder.isEqualTo(s);
    }
    if (value instanceof Integer i) {
      return builder.isEqualTo(i.intValue());
    }
    if (value instanceof Long l) {
      return builder.isEqualTo(l.longValue());
    }
    if (value instanceof Float f) {
      return builder.isEqualTo(f.floatValue());
    }
    if (value instanceof Double d) {
      return builder.isEqualTo(d.doubleValue());
    }
    if (value instanceof UUID u) {
      return builder.isEqualTo(u);
    }
    throw new QueryException(
        "unsupported filter value type for '"
            + key
            + "': "
            + (value == null ? "null" : value.getClass().getSimpleName()));
  }

  private static void addRange(List<Filter> translated, MetadataFilter filter) {
    Number min = filter.min();
    Number max = filter.max();
    if (min != null) {
      translated.add(lowerBound(metadataKey(filter.key()), min));
    }
    if (max != null) {
      translated.add(upperBound(metadataKey(filter.key()), max));
    }
  }

  private static Filter lowerBound(MetadataFilterBuilder builder, Number bound) {
    if (bound instanceof Integer i) {
      return builder.isGreaterThanOrEqualTo(i.intValue());
    }
    if (bound instanceof Long l) {
      return builder.isGreaterThanOrEqualTo(l.longValue());
    }
    if (bound instanceof Float f) {
      return builder.isGreaterThanOrEqualTo(f.floatValue());
    }
    return builder.isGreaterThanOrEqualTo(bound.doubleValue());
  }

  private static Filter upperBound(MetadataFilterBuilder builder, Number bound) {
    if (bound instanceof Integer i) {
      return builder.isLessThanOrEqualTo(i.intValue());
    }
    if (bound instanceof Long l) {
      return builder.isLessThanOrEqualTo(l.longValue());
    }
    if (bound instanceof Float f) {
      return builder.isLessThanOrEqualTo(f.floatValue());
    }
    return builder.isLessThanOrEqualTo(bound.doubleValue());
  }
}

package dev.scriptorium.search;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

/**
 * Time-bounded cache of ranked results for unfiltered searches.
 *
 * <p>Entries expire {@code cache-ttl} after insertion and are dropped lazily. When the cache is
 * full, expired entries are purged first and then the single oldest entry is evicted. Empty result
 * lists are never stored.
 *
 * <p>Thread-safe. Concurrent misses for the same signature are not coalesced.
 */
@Component
public class QueryResultCache {

  private static final Logger log = LoggerFactory.getLogger(QueryResultCache.class);

  private final ConcurrentMap<QuerySignature, Entry> entries = new ConcurrentHashMap<>();
  private final Object admissionLock = new Object();
  private final Duration ttl;
  private final int maxEntries;
  private final Clock clock;

  @Autowired
  public QueryResultCache(SearchProperties properties, Clock clock) {
    this(properties.getCacheTtl(), properties.getCacheMaxEntries(), clock);
  }

  public QueryResultCache(Duration ttl, int maxEntries, Clock clock) {
    this.ttl = ttl;
    this.maxEntries = maxEntries;
    this.clock = clock;
  }

  /**
   * Returns the live results stored for a signature.
   *
   * @return the cached results, or empty if absent or expired
   */
  public Optional<List<RankedResult>> get(QuerySignature signature) {
    Entry entry = entries.get(signature);
    if (entry == null) {
      return Optional.empty();
    }
    if (isExpired(entry, clock.instant())) {
      entries.remove(signature, entry);
      return Optional.empty();
    }
    log.debug("Query cache hit for '{}'", abbreviate(signature.query()));
    return Optional.of(entry.results());
  }

  /**
   * Stores results for a signature, replacing any previous entry. Empty lists are ignored.
   */
  public void put(QuerySignature signature, List<RankedResult> results) {
    if (results.isEmpty()) {
      return;
    }
    Instant now = clock.instant();
    Entry entry = new Entry(List.copyOf(results), now);
    synchronized (admissionLock) {
      if (!entries.containsKey(signature) && entries.size() >= maxEntries) {
        purgeExpired(now);
        if (entries.size() >= maxEntries) {
          evictOldest();
        }
      }
      entries.put(signature, entry);
    }
  }

  /**
   * Removes every entry.
   *
   * @return number of entries removed
   */
  public int clear() {
    synchronized (admissionLock) {
      int removed = entries.size();
      entries.clear();
      return removed;
    }
  }

  /** Number of stored entries, including expired ones not yet dropped. */
  public int size() {
    return entries.size();
  }

  private boolean isExpired(Entry entry, Instant now) {
    return !now.isBefore(entry.createdAt().plus(ttl));
  }

  private void purgeExpired(Instant now) {
    entries.entrySet().removeIf(e -> isExpired(e.getValue(), now));
  }

  private void evictOldest() {
    entries.entrySet().stream()
        .min(Comparator.comparing((Map.Entry<QuerySignature, Entry> e) -> e.getValue().createdAt()))
        .ifPresent(
            oldest -> {
              entries.remove(oldest.getKey(), oldest.getValue());
              log.debug("Evicted oldest query cache entry '{}'", abbreviate(oldest.getKey().query()));
            });
  }

  private static String abbreviate(String query) {
    return query.length() <= 50 ? query : query.substring(0, 50) + "...";
  }

  private record Entry(List<RankedResult> results, Instant createdAt) {}
}

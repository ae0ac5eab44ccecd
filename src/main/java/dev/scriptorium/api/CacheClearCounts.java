package dev.scriptorium.api;

/**
 * Entries removed by {@link RetrievalApi#clearCaches()}.
 *
 * @param queryCache query-result cache entries removed
 * @param embeddingMemoryCache in-memory embedding entries removed (the persistent tier is kept)
 */
public record CacheClearCounts(int queryCache, int embeddingMemoryCache) {}

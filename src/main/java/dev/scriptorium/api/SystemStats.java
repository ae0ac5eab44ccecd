package dev.scriptorium.api;

import java.util.Collections;
import java.util.Map;
import java.util.TreeMap;

/**
 * Snapshot of the corpus and the caches.
 *
 * @param documentsFound supported documents under the documents path
 * @param fileTypes document count per lowercase extension, sorted by extension
 * @param totalBytes combined size of those documents
 * @param queryCacheSize entries in the query-result cache
 * @param embeddingMemoryEntries entries in the in-memory embedding tier
 * @param embeddingPersistentEntries records in the persistent embedding tier
 * @param indexHealthy whether the vector index answered a probe search
 */
public record SystemStats(
    int documentsFound,
    Map<String, Integer> fileTypes,
    long totalBytes,
    int queryCacheSize,
    int embeddingMemoryEntries,
    long embeddingPersistentEntries,
    boolean indexHealthy) {

  public SystemStats {
    fileTypes = Collections.unmodifiableMap(new TreeMap<>(fileTypes));
  }
}

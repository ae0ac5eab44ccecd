package dev.scriptorium.api;

import dev.scriptorium.embedding.EmbeddingCache;
import dev.scriptorium.ingestion.IndexingProperties;
import dev.scriptorium.ingestion.IndexingService;
import dev.scriptorium.ingestion.IndexingStats;
import dev.scriptorium.ingestion.extraction.DocumentScanner;
import dev.scriptorium.search.MetadataFilter;
import dev.scriptorium.search.QueryResultCache;
import dev.scriptorium.search.SearchRequest;
import dev.scriptorium.search.SearchResponse;
import dev.scriptorium.search.SearchService;
import dev.scriptorium.search.VectorIndexHealth;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;
import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * Entry point of the retrieval system: search, indexing, cache maintenance and statistics.
 *
 * <p>Thin facade: each operation delegates to the owning service. Exceptions from the {@code
 * dev.scriptorium.error} hierarchy propagate unchanged.
 */
@Service
public class RetrievalApi {

  private static final Logger log = LoggerFactory.getLogger(RetrievalApi.class);

  private final SearchService searchService;
  private final IndexingService indexingService;
  private final QueryResultCache queryCache;
  private final EmbeddingCache embeddingCache;
  private final DocumentScanner scanner;
  private final VectorIndexHealth indexHealth;
  private final IndexingProperties indexingProperties;

  public RetrievalApi(
      SearchService searchService,
      IndexingService indexingService,
      QueryResultCache queryCache,
      EmbeddingCache embeddingCache,
      DocumentScanner scanner,
      VectorIndexHealth indexHealth,
      IndexingProperties indexingProperties) {
    this.searchService = searchService;
    this.indexingService = indexingService;
    this.queryCache = queryCache;
    this.embeddingCache = embeddingCache;
    this.scanner = scanner;
    this.indexHealth = indexHealth;
    this.indexingProperties = indexingProperties;
  }

  /**
   * Semantic search.
   *
   * @param query the query text
   * @param limit maximum results, or null for the configured default
   * @param threshold minimum similarity, or null for the configured default
   * @param filters metadata restrictions, or null for none
   */
  public SearchResponse search(
      String query,
      @Nullable Integer limit,
      @Nullable Double threshold,
      @Nullable List<MetadataFilter> filters) {
    return searchService.search(
        new SearchRequest(query, limit, threshold, filters == null ? List.of() : filters));
  }

  public SearchResponse search(String query) {
    return search(query, null, null, null);
  }

  /**
   * Indexes the given documents, or every document under the configured path when {@code paths}
   * is null.
   */
  public IndexingStats index(@Nullable List<Path> paths) {
    return paths == null ? indexingService.index() : indexingService.index(paths);
  }

  public IndexingStats reindex(Path path) {
    return indexingService.reindexDocument(path);
  }

  public void delete(String sourceFile) {
    indexingService.deleteDocument(sourceFile);
  }

  /** Empties the query-result cache and the in-memory embedding tier. */
  public CacheClearCounts clearCaches() {
    int queries = queryCache.clear();
    int embeddings = embeddingCache.clearMemory();
    log.info("Caches cleared: query_cache={}, embedding_cache={}", queries, embeddings);
    return new CacheClearCounts(queries, embeddings);
  }

  public SystemStats stats() {
    List<Path> documents = scanner.discover(Paths.get(indexingProperties.getDocumentsPath()));
    Map<String, Integer> fileTypes = new TreeMap<>();
    long totalBytes = 0;
    for (Path document : documents) {
      fileTypes.merge(DocumentScanner.extensionOf(document), 1, Integer::sum);
      try {
        totalBytes += Files.size(document);
      } catch (IOException e) {
        log.warn("Failed to read size of {}: {}", document, e.getMessage());
      }
    }
    return new SystemStats(
        documents.size(),
        fileTypes,
        totalBytes,
        queryCache.size(),
        embeddingCache.memorySize(),
        embeddingCache.persistentSize(),
        indexHealth.isHealthy());
  }

  public boolean healthy() {
    return indexHealth.isHealthy();
  }
}

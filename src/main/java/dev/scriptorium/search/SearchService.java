package dev.scriptorium.search;

import dev.langchain4j.data.embedding.Embedding;
import dev.langchain4j.data.segment.TextSegment;
import dev.langchain4j.store.embedding.EmbeddingMatch;
import dev.langchain4j.store.embedding.EmbeddingSearchRequest;
import dev.langchain4j.store.embedding.EmbeddingSearchResult;
import dev.langchain4j.store.embedding.EmbeddingStore;
import dev.langchain4j.store.embedding.filter.Filter;
import dev.scriptorium.concurrent.TimeBoundedCall;
import dev.scriptorium.embedding.EmbeddingGateway;
import dev.scriptorium.error.IndexUnavailableException;
import dev.scriptorium.error.QueryException;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.Executor;
import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

/**
 * Search orchestration: validate, consult the query-result cache, embed the query, query the
 * vector index, rank, and cache the ranked results.
 *
 * <p>Pipeline: trim and validate query -> resolve limit/threshold defaults -> cache lookup
 * (unfiltered requests only) -> embed via {@link EmbeddingGateway} -> {@link EmbeddingStore}
 * search with translated metadata filters -> {@link ResultRanker} -> cache store (unfiltered,
 * non-empty results only).
 *
 * <p>Collaborator failures propagate as {@link dev.scriptorium.error.EmbeddingUnavailableException}
 * or {@link IndexUnavailableException}; nothing is retried.
 */
@Service
public class SearchService {

  private static final Logger log = LoggerFactory.getLogger(SearchService.class);

  private final EmbeddingGateway embeddingGateway;
  private final EmbeddingStore<TextSegment> embeddingStore;
  private final ResultRanker ranker;
  private final QueryResultCache queryCache;
  private final SearchProperties properties;
  private final Executor executor;

  public SearchService(
      EmbeddingGateway embeddingGateway,
      EmbeddingStore<TextSegment> embeddingStore,
      ResultRanker ranker,
      QueryResultCache queryCache,
      SearchProperties properties,
      @Qualifier("retrievalExecutor") Executor executor) {
    this.embeddingGateway = embeddingGateway;
    this.embeddingStore = embeddingStore;
    this.ranker = ranker;
    this.queryCache = queryCache;
    this.properties = properties;
    this.executor = executor;
  }

  /**
   * Runs a search.
   *
   * @param request query, optional limit and threshold, and metadata filters
   * @return ranked results with timings
   * @throws QueryException if the query is too long
   */
  public SearchResponse search(SearchRequest request) {
    long start = System.nanoTime();
    String query = request.query().trim();
    if (query.length() > properties.getMaxQueryLength()) {
      throw new QueryException(
          "query exceeds " + properties.getMaxQueryLength() + " characters: " + query.length());
    }
    int limit =
        Math.min(
            request.limit() != null ? request.limit() : properties.getDefaultLimit(),
            properties.getMaxLimit());
    double threshold =
        request.threshold() != null ? request.threshold() : properties.getDefaultThreshold();

    boolean cacheable = request.filters().isEmpty();
    QuerySignature signature = new QuerySignature(query, limit, threshold);
    if (cacheable) {
      Optional<List<RankedResult>> cached = queryCache.get(signature);
      if (cached.isPresent()) {
        Duration total = Duration.ofNanos(System.nanoTime() - start);
        List<RankedResult> results = cached.get();
        logCompleted(query, results.size(), true, total);
        return new SearchResponse(
            query,
            results,
            true,
            new SearchStats(
                Duration.ZERO, Duration.ZERO, Duration.ZERO, total, results.size(), query.length()));
      }
    }

    long stageStart = System.nanoTime();
    float[] vector = embeddingGateway.embedQuery(query);
    Duration embeddingTime = Duration.ofNanos(System.nanoTime() - stageStart);

    stageStart = System.nanoTime();
    List<SearchCandidate> candidates =
        queryIndex(vector, limit, threshold, MetadataFilters.toFilter(request.filters()));
    Duration vectorQueryTime = Duration.ofNanos(System.nanoTime() - stageStart);

    stageStart = System.nanoTime();
    List<RankedResult> results = ranker.rank(query, candidates);
    Duration rankingTime = Duration.ofNanos(System.nanoTime() - stageStart);

    if (cacheable) {
      queryCache.put(signature, results);
    }

    Duration total = Duration.ofNanos(System.nanoTime() - start);
    logCompleted(query, results.size(), false, total);
    return new SearchResponse(
        query,
        results,
        false,
        new SearchStats(
            embeddingTime, vectorQueryTime, rankingTime, total, results.size(), query.length()));
  }

  private List<SearchCandidate> queryIndex(
      float[] vector, int limit, double threshold, @Nullable Filter filter) {
    EmbeddingSearchRequest.EmbeddingSearchRequestBuilder builder =
        EmbeddingSearchRequest.builder()
            .queryEmbedding(Embedding.from(vector))
            .maxResults(limit)
            .minScore(threshold);
    if (filter != null) {
      builder.filter(filter);
    }
    EmbeddingSearchRequest searchRequest = builder.build();

    EmbeddingSearchResult<TextSegment> result =
        TimeBoundedCall.call(
            executor,
            properties.getVectorQueryTimeout(),
            "vector query",
            () -> embeddingStore.search(searchRequest),
            (message, cause) -> new IndexUnavailableException("vector-query", message, cause));
    if (result == null || result.matches() == null) {
      return List.of();
    }

    List<EmbeddingMatch<TextSegment>> matches = result.matches();
    List<SearchCandidate> candidates = new ArrayList<>(matches.size());
    for (int i = 0; i < matches.size(); i++) {
      candidates.add(SearchCandidate.from(matches.get(i), i));
    }
    return candidates;
  }

  private static void logCompleted(String query, int resultCount, boolean cached, Duration total) {
    log.info(
        "Search completed: queryLength={}, results={}, cached={}, time={}ms",
        query.length(),
        resultCount,
        cached,
        total.toMillis());
  }
}

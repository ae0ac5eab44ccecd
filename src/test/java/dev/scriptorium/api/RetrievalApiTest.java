package dev.scriptorium.api;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import dev.scriptorium.embedding.EmbeddingCache;
import dev.scriptorium.error.IndexUnavailableException;
import dev.scriptorium.error.QueryException;
import dev.scriptorium.ingestion.IndexingProperties;
import dev.scriptorium.ingestion.IndexingService;
import dev.scriptorium.ingestion.extraction.DocumentScanner;
import dev.scriptorium.ingestion.extraction.MarkdownTextExtractor;
import dev.scriptorium.ingestion.extraction.PlainTextExtractor;
import dev.scriptorium.search.MetadataFilter;
import dev.scriptorium.search.QueryResultCache;
import dev.scriptorium.search.QuerySignature;
import dev.scriptorium.search.RankedResult;
import dev.scriptorium.search.SearchRequest;
import dev.scriptorium.search.SearchService;
import dev.scriptorium.search.VectorIndexHealth;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Duration;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.junit.jupiter.api.io.TempDir;
import org.mockito.ArgumentCaptor;
import org.mockito.Captor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

@SuppressWarnings("NullAway.Init")
@ExtendWith(MockitoExtension.class)
class RetrievalApiTest {

  @Mock SearchService searchService;

  @Mock IndexingService indexingService;

  @Mock VectorIndexHealth indexHealth;

  @Captor ArgumentCaptor<SearchRequest> requestCaptor;

  @TempDir Path workspace;

  QueryResultCache queryCache;
  EmbeddingCache embeddingCache;
  Path documents;
  RetrievalApi api;

  @BeforeEach
  void setUp() throws IOException {
    documents = Files.createDirectories(workspace.resolve("documents"));
    queryCache = new QueryResultCache(Duration.ofMinutes(5), 10, Clock.systemUTC());
    embeddingCache = new EmbeddingCache(workspace.resolve("cache"), 10, 3);
    IndexingProperties indexingProperties = new IndexingProperties();
    indexingProperties.setDocumentsPath(documents.toString());
    DocumentScanner scanner =
        new DocumentScanner(List.of(new PlainTextExtractor(), new MarkdownTextExtractor()));
    api =
        new RetrievalApi(
            searchService,
            indexingService,
            queryCache,
            embeddingCache,
            scanner,
            indexHealth,
            indexingProperties);
  }

  private static RankedResult result(String chunkId) {
    return new RankedResult(
        chunkId, "text", 0.7, "/docs/a.txt", Map.of(), List.of(), Map.of("diversity_penalty", false));
  }

  // --- Delegation ---

  @Test
  void searchBuildsRequestWithOptionalParameters() {
    api.search("vector cache", 5, null, null);

    verify(searchService).search(requestCaptor.capture());
    SearchRequest request = requestCaptor.getValue();
    assertThat(request.query()).isEqualTo("vector cache");
    assertThat(request.limit()).isEqualTo(5);
    assertThat(request.threshold()).isNull();
    assertThat(request.filters()).isEmpty();
  }

  @Test
  void searchPassesFiltersThrough() {
    MetadataFilter filter = MetadataFilter.equalTo("file_type", "md");

    api.search("vector cache", null, 0.3, List.of(filter));

    verify(searchService).search(requestCaptor.capture());
    assertThat(requestCaptor.getValue().filters()).containsExactly(filter);
  }

  @Test
  void blankQueryIsRejectedBeforeSearchService() {
    assertThatThrownBy(() -> api.search("   ")).isInstanceOf(QueryException.class);
    verify(searchService, never()).search(any());
  }

  @Test
  void indexWithoutPathsScansConfiguredDirectory() {
    api.index(null);

    verify(indexingService).index();
  }

  @Test
  void indexWithPathsIndexesOnlyThose() {
    List<Path> paths = List.of(Path.of("/docs/a.txt"));

    api.index(paths);

    verify(indexingService).index(paths);
    verify(indexingService, never()).index();
  }

  @Test
  void reindexAndDeleteDelegate() {
    api.reindex(Path.of("/docs/a.txt"));
    api.delete("/docs/b.txt");

    verify(indexingService).reindexDocument(Path.of("/docs/a.txt"));
    verify(indexingService).deleteDocument("/docs/b.txt");
  }

  @Test
  void deleteFailurePropagates() {
    doThrow(new IndexUnavailableException("delete", "delete timed out after 60000 ms", null))
        .when(indexingService)
        .deleteDocument("/docs/b.txt");

    assertThatThrownBy(() -> api.delete("/docs/b.txt"))
        .isInstanceOf(IndexUnavailableException.class);
  }

  // --- Caches ---

  @Test
  void clearCachesReportsClearedCounts() {
    queryCache.put(new QuerySignature("a", 10, 0.5), List.of(result("a_0000")));
    queryCache.put(new QuerySignature("b", 10, 0.5), List.of(result("b_0000")));
    embeddingCache.put("first text", new float[] {1f, 0f, 0f});

    CacheClearCounts counts = api.clearCaches();

    assertThat(counts.queryCache()).isEqualTo(2);
    assertThat(counts.embeddingMemoryCache()).isEqualTo(1);
    assertThat(queryCache.size()).isZero();
    assertThat(embeddingCache.memorySize()).isZero();
    assertThat(embeddingCache.persistentSize()).isEqualTo(1);
  }

  @Test
  void clearingEmptyCachesReportsZero() {
    CacheClearCounts counts = api.clearCaches();

    assertThat(counts.queryCache()).isZero();
    assertThat(counts.embeddingMemoryCache()).isZero();
  }

  // --- Health ---

  @Test
  void healthyReflectsIndexProbe() {
    when(indexHealth.isHealthy()).thenReturn(true, false);

    assertThat(api.healthy()).isTrue();
    assertThat(api.healthy()).isFalse();
  }

  // --- Stats ---

  @Test
  void statsSummariseCorpusAndCaches() throws IOException {
    Files.writeString(documents.resolve("a.txt"), "12345");
    Files.writeString(documents.resolve("b.txt"), "123");
    Files.writeString(documents.resolve("c.md"), "# 1");
    Files.writeString(documents.resolve("d.png"), "ignored");
    embeddingCache.put("cached text", new float[] {0f, 1f, 0f});
    when(indexHealth.isHealthy()).thenReturn(true);

    SystemStats stats = api.stats();

    assertThat(stats.documentsFound()).isEqualTo(3);
    assertThat(stats.fileTypes()).containsExactly(Map.entry(".md", 1), Map.entry(".txt", 2));
    assertThat(stats.totalBytes()).isEqualTo(11);
    assertThat(stats.queryCacheSize()).isZero();
    assertThat(stats.embeddingMemoryEntries()).isEqualTo(1);
    assertThat(stats.embeddingPersistentEntries()).isEqualTo(1);
    assertThat(stats.indexHealthy()).isTrue();
  }

  @Test
  void statsOnMissingDocumentsDirectoryAreEmpty() throws IOException {
    Files.delete(documents);
    when(indexHealth.isHealthy()).thenReturn(false);

    SystemStats stats = api.stats();

    assertThat(stats.documentsFound()).isZero();
    assertThat(stats.fileTypes()).isEmpty();
    assertThat(stats.totalBytes()).isZero();
    assertThat(stats.indexHealthy()).isFalse();
  }
}

package dev.scriptorium.ingestion;

import static dev.langchain4j.store.embedding.filter.MetadataFilterBuilder.metadataKey;

import dev.langchain4j.data.embedding.Embedding;
import dev.langchain4j.data.segment.TextSegment;
import dev.langchain4j.store.embedding.EmbeddingStore;
import dev.scriptorium.concurrent.TimeBoundedCall;
import dev.scriptorium.embedding.EmbeddingGateway;
import dev.scriptorium.error.EmbeddingUnavailableException;
import dev.scriptorium.error.IndexUnavailableException;
import dev.scriptorium.ingestion.chunking.DocumentChunkData;
import dev.scriptorium.ingestion.chunking.SentenceChunker;
import dev.scriptorium.ingestion.extraction.DocumentScanner;
import dev.scriptorium.ingestion.extraction.ExtractedDocument;
import dev.scriptorium.ingestion.extraction.TextExtractor;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.time.Clock;
import java.time.Duration;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import java.util.concurrent.Executor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

/**
 * Orchestrates the indexing pipeline: document -> extract -> clean and chunk -> embed -> store.
 *
 * <p><strong>Failure semantics:</strong> best-effort. A document whose extraction, chunking or
 * embedding fails is recorded in {@link IndexingStats#failures()} and skipped. A vector-index
 * insertion batch that fails is logged and skipped; batches written before it are <em>not</em>
 * rolled back. Segment ids are derived deterministically from the source file and segment id, so
 * indexing a document again overwrites its previous segments.
 */
@Service
public class IndexingService {

    private static final Logger log = LoggerFactory.getLogger(IndexingService.class);

    private final DocumentScanner scanner;
    private final SentenceChunker chunker;
    private final EmbeddingGateway embeddingGateway;
    private final EmbeddingStore<TextSegment> embeddingStore;
    private final IndexingProperties properties;
    private final Clock clock;
    private final Executor executor;

    public IndexingService(DocumentScanner scanner,
                           SentenceChunker chunker,
                           EmbeddingGateway embeddingGateway,
                           EmbeddingStore<TextSegment> embeddingStore,
                           IndexingProperties properties,
                           Clock clock,
                           @Qualifier("retrievalExecutor") Executor executor) {
        this.scanner = scanner;
        this.chunker = chunker;
        this.embeddingGateway = embeddingGateway;
        this.embeddingStore = embeddingStore;
        this.properties = properties;
        this.clock = clock;
        this.executor = executor;
    }

    /**
     * Indexes every supported document under the configured documents path.
     *
     * @return statistics of the run
     */
    public IndexingStats index() {
        Path root = Paths.get(properties.getDocumentsPath());
        log.info("Starting document indexing from: {}", root);
        return index(scanner.discover(root));
    }

    /**
     * Indexes the given documents.
     *
     * @param documentPaths documents to index
     * @return statistics of the run
     */
    public IndexingStats index(List<Path> documentPaths) {
        long start = System.nanoTime();
        Run run = new Run(documentPaths.size());

        List<DocumentChunkData> embeddedChunks = new ArrayList<>();
        List<float[]> vectors = new ArrayList<>();
        for (Path path : documentPaths) {
            long stageStart = System.nanoTime();
            List<DocumentChunkData> chunks;
            try {
                chunks = extractAndChunk(path);
            } catch (IOException | RuntimeException e) {
                run.fail(path, e);
                continue;
            } finally {
                run.extractionNanos += System.nanoTime() - stageStart;
            }
            run.segmentsProduced += chunks.size();

            stageStart = System.nanoTime();
            try {
                vectors.addAll(embed(chunks));
                embeddedChunks.addAll(chunks);
            } catch (EmbeddingUnavailableException e) {
                run.fail(path, e);
            } finally {
                run.embeddingNanos += System.nanoTime() - stageStart;
            }
        }
        run.segmentsEmbedded = embeddedChunks.size();

        long insertStart = System.nanoTime();
        run.segmentsIndexed = insert(embeddedChunks, vectors);
        run.insertionNanos = System.nanoTime() - insertStart;

        IndexingStats stats = run.toStats(Duration.ofNanos(System.nanoTime() - start));
        log.info("Indexing completed: {}/{} segments indexed from {} documents ({} failed) in {}ms",
                stats.segmentsIndexed(), stats.segmentsProduced(), stats.documentsDiscovered(),
                stats.documentsFailed(), stats.totalTime().toMillis());
        return stats;
    }

    /**
     * Replaces the indexed segments of one document: deletes everything stored for it, then
     * indexes it again.
     *
     * @param documentPath the document to re-index
     * @return statistics of the indexing run
     */
    public IndexingStats reindexDocument(Path documentPath) {
        deleteDocument(documentPath.toString());
        return index(List.of(documentPath));
    }

    /**
     * Deletes every segment whose {@code source_file} metadata equals {@code sourceFile}.
     *
     * @param sourceFile the source file as stamped on its segments
     * @throws IndexUnavailableException if the vector index fails or times out
     */
    public void deleteDocument(String sourceFile) {
        TimeBoundedCall.call(executor, properties.getInsertTimeout(), "delete " + sourceFile,
                () -> {
                    embeddingStore.removeAll(metadataKey(DocumentChunkData.SOURCE_FILE).isEqualTo(sourceFile));
                    return null;
                },
                (message, cause) -> new IndexUnavailableException("delete", message, cause));
        log.info("Deleted indexed segments of {}", sourceFile);
    }

    private List<DocumentChunkData> extractAndChunk(Path path) throws IOException {
        TextExtractor extractor = scanner.extractorFor(path)
                .orElseThrow(() -> new IOException(
                        "Unsupported file format: " + DocumentScanner.extensionOf(path)));
        ExtractedDocument document = extractor.extract(path);
        if (document.text().isBlank()) {
            log.warn("No text extracted from: {}", path);
            return List.of();
        }

        Map<String, Object> metadata = new LinkedHashMap<>(document.metadata());
        metadata.put("file_name", String.valueOf(path.getFileName()));
        metadata.put("file_path", path.toString());
        metadata.put("file_size", Files.size(path));
        metadata.put("file_modified", LocalDateTime.ofInstant(
                Files.getLastModifiedTime(path).toInstant(), clock.getZone()).toString());
        metadata.put("indexed_at", clock.instant().toString());

        List<DocumentChunkData> chunks = chunker.chunk(
                document.text(), path.toString(), DocumentScanner.stemOf(path), metadata);
        log.debug("Created {} segments from {}", chunks.size(), path);
        return chunks;
    }

    private List<float[]> embed(List<DocumentChunkData> chunks) {
        List<float[]> vectors = new ArrayList<>(chunks.size());
        int batchSize = properties.getEmbedBatchSize();
        for (int i = 0; i < chunks.size(); i += batchSize) {
            List<String> texts = chunks.subList(i, Math.min(i + batchSize, chunks.size())).stream()
                    .map(DocumentChunkData::text)
                    .toList();
            vectors.addAll(embeddingGateway.embedAll(texts));
        }
        return vectors;
    }

    private int insert(List<DocumentChunkData> chunks, List<float[]> vectors) {
        int indexed = 0;
        int batchSize = properties.getInsertBatchSize();
        for (int i = 0; i < chunks.size(); i += batchSize) {
            int end = Math.min(i + batchSize, chunks.size());
            List<DocumentChunkData> batch = chunks.subList(i, end);
            List<String> ids = batch.stream().map(IndexingService::storeId).toList();
            List<Embedding> embeddings = vectors.subList(i, end).stream().map(Embedding::from).toList();
            List<TextSegment> segments = batch.stream().map(DocumentChunkData::toTextSegment).toList();
            int batchNumber = i / batchSize + 1;
            try {
                TimeBoundedCall.call(executor, properties.getInsertTimeout(),
                        "insert batch " + batchNumber,
                        () -> {
                            embeddingStore.addAll(ids, embeddings, segments);
                            return null;
                        },
                        (message, cause) -> new IndexUnavailableException("insert", message, cause));
                indexed += batch.size();
                log.debug("Batch {}: indexed {} segments ({}/{} total)",
                        batchNumber, batch.size(), indexed, chunks.size());
            } catch (IndexUnavailableException e) {
                log.error("Failed to index batch {} ({} segments): {}",
                        batchNumber, batch.size(), e.getMessage());
            }
        }
        return indexed;
    }

    static String storeId(DocumentChunkData chunk) {
        String key = chunk.sourceFile() + "#" + chunk.chunkId();
        return UUID.nameUUIDFromBytes(key.getBytes(StandardCharsets.UTF_8)).toString();
    }

    /** Counters of one run. */
    private static final class Run {

        private final int documentsDiscovered;
        private final List<IndexingStats.FailedDocument> failures = new ArrayList<>();
        private int segmentsProduced;
        private int segmentsEmbedded;
        private int segmentsIndexed;
        private long extractionNanos;
        private long embeddingNanos;
        private long insertionNanos;

        Run(int documentsDiscovered) {
            this.documentsDiscovered = documentsDiscovered;
        }

        void fail(Path path, Exception e) {
            log.error("Failed to process {}: {}", path, e.getMessage());
            failures.add(new IndexingStats.FailedDocument(path.toString(), String.valueOf(e.getMessage())));
        }

        IndexingStats toStats(Duration total) {
            return new IndexingStats(
                    documentsDiscovered,
                    failures.size(),
                    segmentsProduced,
                    segmentsEmbedded,
                    segmentsIndexed,
                    IndexingStats.successRate(segmentsIndexed, segmentsProduced),
                    Duration.ofNanos(extractionNanos),
                    Duration.ofNanos(embeddingNanos),
                    Duration.ofNanos(insertionNanos),
                    total,
                    failures);
        }
    }
}

package dev.scriptorium.embedding;

import dev.scriptorium.error.CacheCorruptionException;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.nio.file.StandardCopyOption;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.stream.Stream;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

/**
 * Two-tier content-addressed embedding cache.
 *
 * <p>Entries are keyed by the {@link Fingerprint} of the trimmed text. Lookups consult the memory
 * tier first, then the persistent tier ({@code {dir}/{fp[0..2]}/{fp}.emb}); a persistent hit is
 * promoted to memory while the memory tier holds fewer than its configured capacity. The memory
 * tier never evicts: once full, new entries only reach the persistent tier.
 *
 * <p>A persistent record that cannot be decoded is deleted and reported as a miss. Failures to
 * write the persistent tier are logged and otherwise ignored.
 *
 * <p>Thread-safe. Vectors are copied on the way in and on the way out.
 */
@Component
public class EmbeddingCache {

  private static final Logger log = LoggerFactory.getLogger(EmbeddingCache.class);

  static final String RECORD_SUFFIX = ".emb";

  private final ConcurrentMap<String, float[]> memory = new ConcurrentHashMap<>();
  private final Path directory;
  private final int maxMemoryEntries;
  private final int dimension;

  @Autowired
  public EmbeddingCache(EmbeddingProperties properties) {
    this(
        Paths.get(properties.getCache().getDirectory()),
        properties.getCache().getMaxMemoryEntries(),
        properties.getDimension());
  }

  public EmbeddingCache(Path directory, int maxMemoryEntries, int dimension) {
    this.directory = directory;
    this.maxMemoryEntries = maxMemoryEntries;
    this.dimension = dimension;
  }

  /**
   * Looks up the vector stored for the given text.
   *
   * @param text the embedded text; surrounding whitespace is ignored
   * @return a copy of the cached vector, or empty on a miss
   */
  public Optional<float[]> get(String text) {
    String fingerprint = Fingerprint.of(text);
    float[] cached = memory.get(fingerprint);
    if (cached != null) {
      log.debug("Embedding cache memory hit for {}", fingerprint);
      return Optional.of(cached.clone());
    }

    Optional<float[]> persisted = readPersistent(fingerprint);
    persisted.ifPresent(
        vector -> {
          log.debug("Embedding cache persistent hit for {}", fingerprint);
          promote(fingerprint, vector);
        });
    return persisted.map(float[]::clone);
  }

  /**
   * Stores a vector for the given text in both tiers, replacing any vector stored before.
   *
   * @param text the embedded text; surrounding whitespace is ignored
   * @param vector the embedding; copied before being stored
   */
  public void put(String text, float[] vector) {
    String fingerprint = Fingerprint.of(text);
    float[] copy = vector.clone();
    // A resident entry is replaced so both tiers hold the latest vector
    if (memory.containsKey(fingerprint) || memory.size() < maxMemoryEntries) {
      memory.put(fingerprint, copy);
    }
    writePersistent(fingerprint, copy);
  }

  /**
   * Empties the memory tier. The persistent tier is left untouched.
   *
   * @return number of entries removed
   */
  public int clearMemory() {
    int removed = memory.size();
    memory.clear();
    log.info("Cleared {} in-memory embeddings", removed);
    return removed;
  }

  public int memorySize() {
    return memory.size();
  }

  /** Number of records in the persistent tier; 0 if the directory does not exist yet. */
  public long persistentSize() {
    if (!Files.isDirectory(directory)) {
      return 0;
    }
    try (Stream<Path> files = Files.walk(directory)) {
      return files
          .filter(Files::isRegularFile)
          .filter(p -> p.getFileName().toString().endsWith(RECORD_SUFFIX))
          .count();
    } catch (IOException | UncheckedIOException e) {
      log.warn("Failed to count persistent embeddings in {}: {}", directory, e.getMessage());
      return 0;
    }
  }

  Path recordPath(String fingerprint) {
    return directory.resolve(fingerprint.substring(0, 2)).resolve(fingerprint + RECORD_SUFFIX);
  }

  private void promote(String fingerprint, float[] vector) {
    // Racing promotions may overshoot the capacity by a few entries
    if (memory.size() < maxMemoryEntries) {
      memory.putIfAbsent(fingerprint, vector);
    }
  }

  private Optional<float[]> readPersistent(String fingerprint) {
    Path path = recordPath(fingerprint);
    byte[] data;
    try {
      data = Files.readAllBytes(path);
    } catch (NoSuchFileException e) {
      return Optional.empty();
    } catch (IOException e) {
      log.warn("Failed to read embedding record {}: {}", path, e.getMessage());
      return Optional.empty();
    }

    try {
      return Optional.of(EmbeddingRecordCodec.decode(data, fingerprint, dimension));
    } catch (CacheCorruptionException e) {
      log.warn("Discarding corrupted embedding record {}: {}", path, e.getMessage());
      deleteQuietly(path);
      return Optional.empty();
    }
  }

  private void writePersistent(String fingerprint, float[] vector) {
    Path target = recordPath(fingerprint);
    Path temp = null;
    try {
      Files.createDirectories(target.getParent());
      temp = Files.createTempFile(target.getParent(), fingerprint, ".tmp");
      Files.write(temp, EmbeddingRecordCodec.encode(fingerprint, vector));
      moveIntoPlace(temp, target);
    } catch (IOException | UncheckedIOException e) {
      log.warn("Failed to persist embedding {}: {}", fingerprint, e.getMessage());
      if (temp != null) {
        deleteQuietly(temp);
      }
    }
  }

  private static void moveIntoPlace(Path temp, Path target) throws IOException {
    try {
      Files.move(
          temp, target, StandardCopyOption.ATOMIC_MOVE, StandardCopyOption.REPLACE_EXISTING);
    } catch (AtomicMoveNotSupportedException e) {
      Files.move(temp, target, StandardCopyOption.REPLACE_EXISTING);
    }
  }

  private static void deleteQuietly(Path path) {
    try {
      Files.deleteIfExists(path);
    } catch (IOException e) {
      log.warn("Failed to delete {}: {}", path, e.getMessage());
    }
  }
}

package dev.scriptorium.ingestion.extraction;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.stream.Stream;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Discovers indexable documents below a root directory and routes each file to the {@link
 * TextExtractor} registered for its extension.
 */
@Component
public class DocumentScanner {

  private static final Logger log = LoggerFactory.getLogger(DocumentScanner.class);

  private final List<TextExtractor> extractors;

  public DocumentScanner(List<TextExtractor> extractors) {
    this.extractors = List.copyOf(extractors);
  }

  /**
   * Recursively lists the regular files under {@code root} that some extractor supports.
   *
   * @param root directory to scan
   * @return supported files sorted by path; empty if the root cannot be read
   */
  public List<Path> discover(Path root) {
    if (!Files.isDirectory(root)) {
      log.error("Documents path is not a readable directory: {}", root);
      return List.of();
    }
    try (Stream<Path> paths = Files.walk(root)) {
      List<Path> documents =
          paths.filter(Files::isRegularFile).filter(this::isSupported).sorted().toList();
      log.info("Discovered {} documents under {}", documents.size(), root);
      return documents;
    } catch (IOException | UncheckedIOException e) {
      log.error("Error discovering documents under {}: {}", root, e.getMessage());
      return List.of();
    }
  }

  /** Whether a registered extractor handles the extension of {@code path}. */
  public boolean isSupported(Path path) {
    return extractorFor(path).isPresent();
  }

  /** The extractor registered for the extension of {@code path}, if any. */
  public Optional<TextExtractor> extractorFor(Path path) {
    String extension = extensionOf(path);
    return extractors.stream().filter(e -> e.supports(extension)).findFirst();
  }

  /**
   * Lowercase extension including the dot, or the empty string when the file name has none.
   */
  public static String extensionOf(Path path) {
    Path fileName = path.getFileName();
    if (fileName == null) {
      return "";
    }
    String name = fileName.toString();
    int dot = name.lastIndexOf('.');
    return dot <= 0 ? "" : name.substring(dot).toLowerCase(Locale.ROOT);
  }

  /** File name without its extension, used as the segment id prefix. */
  public static String stemOf(Path path) {
    Path fileName = path.getFileName();
    String name = fileName == null ? path.toString() : fileName.toString();
    int dot = name.lastIndexOf('.');
    return dot <= 0 ? name : name.substring(0, dot);
  }
}

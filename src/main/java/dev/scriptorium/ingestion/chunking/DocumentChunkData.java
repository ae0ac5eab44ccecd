package dev.scriptorium.ingestion.chunking;

import dev.langchain4j.data.document.Metadata;
import dev.langchain4j.data.segment.TextSegment;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Holds the text and metadata for a single segment produced by the {@link SentenceChunker}.
 *
 * <p>The first {@code overlapPrefixLength} characters of {@code text} repeat the trailing words of
 * the previous segment (including the separating space); {@link #body()} returns the rest.
 *
 * @param text the segment text, overlap prefix included
 * @param chunkId stable identifier derived from the source file stem and the position
 * @param chunkIndex zero-based position within the source document
 * @param sourceFile path of the document the segment came from; empty for ad-hoc text
 * @param overlapPrefixLength number of leading characters copied from the previous segment
 * @param wordCount whitespace-delimited word count of {@code text}
 * @param charCount character count of {@code text}
 * @param metadata document metadata merged into every segment of that document
 */
public record DocumentChunkData(
    String text,
    String chunkId,
    int chunkIndex,
    String sourceFile,
    int overlapPrefixLength,
    int wordCount,
    int charCount,
    Map<String, Object> metadata) {

  /** Metadata key holding the source document of a segment. */
  public static final String SOURCE_FILE = "source_file";

  public DocumentChunkData {
    Objects.requireNonNull(text, "text must not be null");
    Objects.requireNonNull(chunkId, "chunkId must not be null");
    Objects.requireNonNull(sourceFile, "sourceFile must not be null");
    Objects.requireNonNull(metadata, "metadata must not be null");
    if (chunkIndex < 0) {
      throw new IllegalArgumentException("chunkIndex must not be negative");
    }
    if (overlapPrefixLength < 0 || overlapPrefixLength > text.length()) {
      throw new IllegalArgumentException("overlapPrefixLength must lie within text");
    }
    metadata = Collections.unmodifiableMap(new LinkedHashMap<>(metadata));
  }

  /** Creates a segment, deriving the word and character counts from {@code text}. */
  public static DocumentChunkData of(
      String text,
      String chunkId,
      int chunkIndex,
      String sourceFile,
      int overlapPrefixLength,
      Map<String, Object> metadata) {
    return new DocumentChunkData(
        text,
        chunkId,
        chunkIndex,
        sourceFile,
        overlapPrefixLength,
        countWords(text),
        text.length(),
        metadata);
  }

  /** The segment text without the overlap copied from its predecessor. */
  public String body() {
    return text.substring(overlapPrefixLength);
  }

  /** Returns a copy of this segment with {@code extra} merged over its metadata. */
  public DocumentChunkData withMetadata(Map<String, Object> extra) {
    Map<String, Object> merged = new LinkedHashMap<>(metadata);
    merged.putAll(extra);
    return new DocumentChunkData(
        text, chunkId, chunkIndex, sourceFile, overlapPrefixLength, wordCount, charCount, merged);
  }

  /**
   * Converts segment metadata to a langchain4j {@link Metadata} instance with the snake_case keys
   * used by the vector index. Values of types the index cannot store are written as strings.
   */
  public Metadata toMetadata() {
    Metadata result = new Metadata();
    metadata.forEach((key, value) -> putValue(result, key, value));
    result
        .put("chunk_id", chunkId)
        .put("chunk_index", chunkIndex)
        .put(SOURCE_FILE, sourceFile)
        .put("word_count", wordCount)
        .put("char_count", charCount);
    return result;
  }

  /** Converts this segment to a langchain4j {@link TextSegment} ready for embedding. */
  public TextSegment toTextSegment() {
    return TextSegment.from(text, toMetadata());
  }

  static int countWords(String text) {
    String trimmed = text.trim();
    return trimmed.isEmpty() ? 0 : trimmed.split("\\s+").length;
  }

  private static void putValue(Metadata target, String key, Object value) {
    if (value instanceof Integer i) {
      target.put(key, i);
    } else if (value instanceof Long l) {
      target.put(key, l);
    } else if (value instanceof Double d) {
      target.put(key, d);
    } else if (value instanceof Float f) {
      target.put(key, f);
    } else {
      target.put(key, String.valueOf(value));
    }
  }
}

package dev.scriptorium.ingestion.chunking;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Map;
import java.util.regex.Pattern;
import org.jspecify.annotations.Nullable;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

/**
 * Sentence-aware chunker that packs cleaned text into bounded, overlapping segments.
 *
 * <p>Algorithm:
 *
 * <ol>
 *   <li>Clean the input with {@link TextCleaner}. Empty result: no segments. Shorter than the
 *       maximum size: exactly one segment holding the cleaned text.
 *   <li>Split into sentences at whitespace that follows {@code .}, {@code !} or {@code ?}; the
 *       punctuation stays with its sentence.
 *   <li>Greedily pack sentences, joined by single spaces, into a segment body while it fits. A
 *       sentence that fits no body on its own is split on word boundaries with the same rule.
 *   <li>Prefix every segment but the first with the trailing {@code overlap / overlapCharsPerWord}
 *       words of the previous body. The prefix is reserved while packing, so a segment never
 *       exceeds the maximum size unless its body is a single word that is longer on its own.
 * </ol>
 *
 * <p>Joining all bodies with single spaces reproduces the cleaned text exactly.
 *
 * <p>Stateless and thread-safe.
 */
@Component
public class SentenceChunker {

  private static final Pattern SENTENCE_BOUNDARY = Pattern.compile("(?<=[.!?])\\s+");

  static final String ADHOC_ID_PREFIX = "segment";

  private final TextCleaner cleaner;
  private final int maxChunkSize;
  private final int chunkOverlap;
  private final int overlapCharsPerWord;

  /** Chunker with the default configuration (1000 characters, 200 overlap, 10 chars per word). */
  public SentenceChunker() {
    this(new TextCleaner(), new ChunkingProperties());
  }

  @Autowired
  public SentenceChunker(TextCleaner cleaner, ChunkingProperties properties) {
    ChunkingProperties.validate(properties.getMaxChunkSize(), properties.getChunkOverlap());
    this.cleaner = cleaner;
    this.maxChunkSize = properties.getMaxChunkSize();
    this.chunkOverlap = properties.getChunkOverlap();
    this.overlapCharsPerWord = Math.max(1, properties.getOverlapCharsPerWord());
  }

  /**
   * Chunks ad-hoc text that has no source document.
   *
   * @param text raw text, may be null
   * @param maxSize maximum segment length in characters (at least 100)
   * @param overlap overlap budget in characters, below {@code maxSize}
   * @return ordered segments with ids {@code segment_0000}, {@code segment_0001}, ...
   * @throws dev.scriptorium.error.ConfigurationException if the parameters are invalid
   */
  public List<DocumentChunkData> chunk(@Nullable String text, int maxSize, int overlap) {
    return chunk(text, maxSize, overlap, "", ADHOC_ID_PREFIX, Map.of());
  }

  /**
   * Chunks the text of a source document with the configured sizes.
   *
   * @param text raw extracted text, may be null
   * @param sourceFile path of the source document, stamped on every segment
   * @param idPrefix prefix of the segment ids, usually the file stem
   * @param documentMetadata metadata merged into every segment
   * @return ordered segments with ids {@code {idPrefix}_{index:04d}}
   */
  public List<DocumentChunkData> chunk(
      @Nullable String text,
      String sourceFile,
      String idPrefix,
      Map<String, Object> documentMetadata) {
    return chunk(text, maxChunkSize, chunkOverlap, sourceFile, idPrefix, documentMetadata);
  }

  private List<DocumentChunkData> chunk(
      @Nullable String text,
      int maxSize,
      int overlap,
      String sourceFile,
      String idPrefix,
      Map<String, Object> documentMetadata) {
    ChunkingProperties.validate(maxSize, overlap);
    String cleaned = cleaner.clean(text);
    List<Piece> pieces = split(cleaned, maxSize, overlap / overlapCharsPerWord);

    List<DocumentChunkData> chunks = new ArrayList<>(pieces.size());
    for (int i = 0; i < pieces.size(); i++) {
      Piece piece = pieces.get(i);
      String chunkText = piece.prefix().isEmpty() ? piece.body() : piece.prefix() + " " + piece.body();
      int prefixLength = chunkText.length() - piece.body().length();
      chunks.add(
          DocumentChunkData.of(
              chunkText,
              String.format("%s_%04d", idPrefix, i),
              i,
              sourceFile,
              prefixLength,
              documentMetadata));
    }
    return chunks;
  }

  /**
   * Splits cleaned text into bodies and their overlap prefixes.
   *
   * @param text cleaned text (single spaces, trimmed)
   * @param maxSize maximum segment length
   * @param overlapWords number of trailing words of the previous body to repeat
   */
  static List<Piece> split(String text, int maxSize, int overlapWords) {
    if (text.isEmpty()) {
      return List.of();
    }
    if (text.length() < maxSize) {
      return List.of(new Piece("", text));
    }

    PieceBuilder builder = new PieceBuilder(maxSize, overlapWords);
    for (String sentence : SENTENCE_BOUNDARY.split(text)) {
      if (sentence.isEmpty()) {
        continue;
      }
      if (builder.fits(sentence)) {
        builder.append(sentence);
        continue;
      }
      builder.flush();
      if (builder.fits(sentence)) {
        builder.append(sentence);
        continue;
      }
      // Sentence longer than any body: fall back to word boundaries
      for (String word : sentence.split(" ")) {
        if (!builder.fits(word)) {
          builder.flush();
        }
        builder.append(word);
      }
    }
    builder.flush();
    return builder.pieces;
  }

  /** A segment body and the overlap prefix that precedes it (empty for the first segment). */
  record Piece(String prefix, String body) {}

  /** Accumulates the body under construction and reserves room for its overlap prefix. */
  private static final class PieceBuilder {

    private final int maxSize;
    private final int overlapWords;
    private final List<Piece> pieces = new ArrayList<>();
    private final StringBuilder current = new StringBuilder();
    private String prefix = "";
    private int budget;

    PieceBuilder(int maxSize, int overlapWords) {
      this.maxSize = maxSize;
      this.overlapWords = overlapWords;
      this.budget = maxSize;
    }

    boolean fits(String unit) {
      int projected = current.length() == 0 ? unit.length() : current.length() + 1 + unit.length();
      return projected <= budget;
    }

    void append(String unit) {
      if (current.length() > 0) {
        current.append(' ');
      }
      current.append(unit);
    }

    void flush() {
      if (current.length() == 0) {
        return;
      }
      String body = current.toString();
      // An oversized single word goes out alone, without overlap
      String piecePrefix = prefix.length() + 1 + body.length() > maxSize ? "" : prefix;
      pieces.add(new Piece(piecePrefix, body));
      current.setLength(0);

      prefix = tailWords(body, overlapWords, maxSize / 2);
      budget = prefix.isEmpty() ? maxSize : maxSize - prefix.length() - 1;
    }

    /** Last {@code count} words of {@code body}, dropping leading words beyond {@code maxChars}. */
    private static String tailWords(String body, int count, int maxChars) {
      if (count <= 0) {
        return "";
      }
      String[] words = body.split(" ");
      int from = Math.max(0, words.length - count);
      String tail = String.join(" ", Arrays.copyOfRange(words, from, words.length));
      while (tail.length() > maxChars && from < words.length - 1) {
        from++;
        tail = String.join(" ", Arrays.copyOfRange(words, from, words.length));
      }
      return tail.length() > maxChars ? "" : tail;
    }
  }
}

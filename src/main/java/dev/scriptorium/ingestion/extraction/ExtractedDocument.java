package dev.scriptorium.ingestion.extraction;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Raw text pulled out of a document plus the format-specific metadata found along the way.
 *
 * @param text extracted text, empty when nothing could be read
 * @param metadata format metadata such as {@code file_type}, {@code line_count} or {@code title}
 */
public record ExtractedDocument(String text, Map<String, Object> metadata) {

  public ExtractedDocument {
    Objects.requireNonNull(text, "text must not be null");
    metadata = Collections.unmodifiableMap(new LinkedHashMap<>(metadata));
  }
}

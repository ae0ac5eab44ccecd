package dev.scriptorium.ingestion.chunking;

import java.util.regex.Pattern;
import org.jspecify.annotations.Nullable;
import org.springframework.stereotype.Component;

/**
 * Normalises extracted text so that sentence-boundary detection is reliable.
 *
 * <p>Steps, in order: collapse whitespace runs to a single space, replace every character outside
 * the allowlist (Unicode letters, digits, underscore and {@code . , ! ? ; : - ( ) [ ] " '}) with a
 * space, collapse repeated terminal punctuation, collapse whitespace again and trim.
 */
@Component
public class TextCleaner {

  private static final Pattern WHITESPACE =
      Pattern.compile("\\s+", Pattern.UNICODE_CHARACTER_CLASS);

  private static final Pattern DISALLOWED =
      Pattern.compile("[^\\w\\s.,!?;:\\-()\\[\\]\"']+", Pattern.UNICODE_CHARACTER_CLASS);

  private static final Pattern REPEATED_DOTS = Pattern.compile("\\.{2,}");

  private static final Pattern REPEATED_EXCLAMATION = Pattern.compile("[!?]{2,}");

  /**
   * Cleans raw text.
   *
   * @param input raw extracted text, may be null
   * @return cleaned text; empty for null or whitespace-only input
   */
  public String clean(@Nullable String input) {
    if (input == null || input.isBlank()) {
      return "";
    }
    String text = WHITESPACE.matcher(input).replaceAll(" ");
    text = DISALLOWED.matcher(text).replaceAll(" ");
    text = REPEATED_DOTS.matcher(text).replaceAll(".");
    text = REPEATED_EXCLAMATION.matcher(text).replaceAll("!");
    text = WHITESPACE.matcher(text).replaceAll(" ");
    return text.trim();
  }
}

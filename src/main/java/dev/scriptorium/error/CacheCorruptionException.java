package dev.scriptorium.error;

import org.jspecify.annotations.Nullable;

/**
 * A persisted embedding-cache record could not be decoded. Internal to the embedding cache,
 * which treats it as a miss and removes the record.
 */
public class CacheCorruptionException extends RetrievalException {

  public CacheCorruptionException(String message) {
    this(message, null);
  }

  public CacheCorruptionException(String message, @Nullable Throwable cause) {
    super("cache-read", message, cause);
  }
}

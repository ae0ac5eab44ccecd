package dev.scriptorium.error;

import org.jspecify.annotations.Nullable;

/** The embedding provider failed, timed out, or returned an unusable vector. */
public class EmbeddingUnavailableException extends RetrievalException {

  public EmbeddingUnavailableException(String operation, String message, @Nullable Throwable cause) {
    super(operation, message, cause);
  }
}

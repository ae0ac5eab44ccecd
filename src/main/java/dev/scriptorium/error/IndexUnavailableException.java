package dev.scriptorium.error;

import org.jspecify.annotations.Nullable;

/** The vector index failed or timed out. */
public class IndexUnavailableException extends RetrievalException {

  public IndexUnavailableException(String operation, String message, @Nullable Throwable cause) {
    super(operation, message, cause);
  }
}

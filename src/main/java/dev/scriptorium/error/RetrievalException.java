package dev.scriptorium.error;

import org.jspecify.annotations.Nullable;

/**
 * Root of the retrieval pipeline's unchecked exception hierarchy.
 *
 * <p>Every subclass carries the name of the operation that failed so callers can decide on
 * retry or backoff without parsing messages. The pipeline itself never retries.
 */
public class RetrievalException extends RuntimeException {

  private final String operation;

  public RetrievalException(String operation, String message) {
    this(operation, message, null);
  }

  public RetrievalException(String operation, String message, @Nullable Throwable cause) {
    super(message, cause);
    this.operation = operation;
  }

  /** Name of the failed operation, e.g. {@code "embed"} or {@code "vector-query"}. */
  public String getOperation() {
    return operation;
  }
}

package dev.scriptorium.error;

/** A malformed user query. Recoverable: reported to the caller as-is. */
public class QueryException extends RetrievalException {

  private final String reason;

  public QueryException(String reason) {
    super("validate", "Invalid query: " + reason);
    this.reason = reason;
  }

  public String getReason() {
    return reason;
  }
}

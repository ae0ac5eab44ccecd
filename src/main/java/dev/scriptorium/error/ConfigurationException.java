package dev.scriptorium.error;

/**
 * Invalid chunking or search configuration, or an embedding dimension that disagrees with the
 * configured one. Fatal at startup; never retried.
 */
public class ConfigurationException extends RetrievalException {

  public ConfigurationException(String message) {
    super("configuration", message);
  }
}

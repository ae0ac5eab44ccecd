package dev.scriptorium.search;

import dev.scriptorium.error.ConfigurationException;
import jakarta.annotation.PostConstruct;
import java.time.Duration;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

/**
 * Externalised configuration for the search pipeline, bound from {@code scriptorium.search.*}.
 *
 * <ul>
 *   <li>{@code default-limit} - results returned when the request names no limit (default 10)
 *   <li>{@code default-threshold} - minimum similarity when the request names none (default 0.5)
 *   <li>{@code max-limit} - upper clamp for the requested limit (default 100)
 *   <li>{@code max-query-length} - longest accepted query in characters (default 1000)
 *   <li>{@code cache-ttl} - lifetime of a cached result list (default 300s)
 *   <li>{@code cache-max-entries} - capacity of the query-result cache (default 100)
 *   <li>{@code vector-query-timeout} - upper bound for one vector-index query (default 10s)
 * </ul>
 *
 * <p>Validated at startup via {@link #validate()}; the application fails to start if values are out
 * of range.
 */
@Configuration
@ConfigurationProperties(prefix = "scriptorium.search")
public class SearchProperties {

  private int defaultLimit = 10;
  private double defaultThreshold = 0.5;
  private int maxLimit = 100;
  private int maxQueryLength = 1000;
  private Duration cacheTtl = Duration.ofSeconds(300);
  private int cacheMaxEntries = 100;
  private Duration vectorQueryTimeout = Duration.ofSeconds(10);

  /** Validates configuration at startup. Throws if values are out of allowed range. */
  @PostConstruct
  void validate() {
    if (maxLimit < 1) {
      throw new ConfigurationException(
          "scriptorium.search.max-limit must be at least 1, got: " + maxLimit);
    }
    if (defaultLimit < 1 || defaultLimit > maxLimit) {
      throw new ConfigurationException(
          "scriptorium.search.default-limit must be in [1, " + maxLimit + "], got: " + defaultLimit);
    }
    if (defaultThreshold < 0.0 || defaultThreshold > 1.0) {
      throw new ConfigurationException(
          "scriptorium.search.default-threshold must be in [0.0, 1.0], got: " + defaultThreshold);
    }
    if (maxQueryLength < 1) {
      throw new ConfigurationException(
          "scriptorium.search.max-query-length must be at least 1, got: " + maxQueryLength);
    }
    if (cacheTtl.isNegative() || cacheTtl.isZero()) {
      throw new ConfigurationException(
          "scriptorium.search.cache-ttl must be positive, got: " + cacheTtl);
    }
    if (cacheMaxEntries < 1) {
      throw new ConfigurationException(
          "scriptorium.search.cache-max-entries must be at least 1, got: " + cacheMaxEntries);
    }
    if (vectorQueryTimeout.isNegative() || vectorQueryTimeout.isZero()) {
      throw new ConfigurationException(
          "scriptorium.search.vector-query-timeout must be positive, got: " + vectorQueryTimeout);
    }
  }

  public int getDefaultLimit() {
    return defaultLimit;
  }

  public void setDefaultLimit(int defaultLimit) {
    this.defaultLimit = defaultLimit;
  }

  public double getDefaultThreshold() {
    return defaultThreshold;
  }

  public void setDefaultThreshold(double defaultThreshold) {
    this.defaultThreshold = defaultThreshold;
  }

  public int getMaxLimit() {
    return maxLimit;
  }

  public void setMaxLimit(int maxLimit) {
    this.maxLimit = maxLimit;
  }

  public int getMaxQueryLength() {
    return maxQueryLength;
  }

  public void setMaxQueryLength(int maxQueryLength) {
    this.maxQueryLength = maxQueryLength;
  }

  public Duration getCacheTtl() {
    return cacheTtl;
  }

  public void setCacheTtl(Duration cacheTtl) {
    this.cacheTtl = cacheTtl;
  }

  public int getCacheMaxEntries() {
    return cacheMaxEntries;
  }

  public void setCacheMaxEntries(int cacheMaxEntries) {
    this.cacheMaxEntries = cacheMaxEntries;
  }

  public Duration getVectorQueryTimeout() {
    return vectorQueryTimeout;
  }

  public void setVectorQueryTimeout(Duration vectorQueryTimeout) {
    this.vectorQueryTimeout = vectorQueryTimeout;
  }
}

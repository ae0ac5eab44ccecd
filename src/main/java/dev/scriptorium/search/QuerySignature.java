package dev.scriptorium.search;

/**
 * Cache key of an unfiltered search: the trimmed query with its effective limit and threshold.
 */
public record QuerySignature(String query, int limit, double threshold) {}

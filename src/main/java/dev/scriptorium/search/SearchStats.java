package dev.scriptorium.search;

import java.time.Duration;

/** Timings and counts of one search. Stage durations are zero for a cache hit. */
public record SearchStats(
    Duration embeddingTime,
    Duration vectorQueryTime,
    Duration rankingTime,
    Duration totalTime,
    int resultCount,
    int queryLength) {}

package com.reclink.mapred;

/**
 * Centralized metrics (counters) for the indexing jobs.
 */
public final class IndexingMetrics {

  private IndexingMetrics() {} // Utility class

  /** Counter group for unseen values, one counter per attribute name */
  public static final String UNSEEN_VALUES_GROUP = "Unseen values";

  /** Counters for the statistics job */
  public static enum StatsMetrics {
    RECORDS_PROCESSED,
    RECORDS_MALFORMED,
    RECORDS_SCHEMA_MISMATCH,
    COUNTS_EMITTED,
    // Performance metrics
    MAPPER_TIME_MS,
    COMBINER_INPUT_COUNTS,
    COMBINER_OUTPUT_COUNTS,
    REDUCER_OUTPUT_COUNTS,
  }

  /** Counters for the transform job */
  public static enum TransformMetrics {
    RECORDS_TRANSFORMED,
    RECORDS_MALFORMED,
    RECORDS_SCHEMA_MISMATCH,
    RECORDS_WITH_UNSEEN_VALUES,
    MAPPER_TIME_MS,
  }
}

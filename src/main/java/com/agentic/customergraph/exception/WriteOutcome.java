package com.agentic.customergraph.exception;

/**
 * What a failed operation left behind, so callers know whether a retry can
 * produce duplicates.
 */
public enum WriteOutcome {
    /** Nothing was persisted. */
    NOTHING_WRITTEN,
    /** Some data was persisted; all writes are upserts, so retrying is safe. */
    PARTIAL_WRITE_RETRY_SAFE
}

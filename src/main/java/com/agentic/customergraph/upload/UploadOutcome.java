package com.agentic.customergraph.upload;

public enum UploadOutcome {
    SUCCEEDED,
    FAILED,
    TIMED_OUT,
    /** Dry run: the snapshot would upload. */
    VALIDATED,
    /** Dry run: the snapshot would be rejected. */
    INVALID
}

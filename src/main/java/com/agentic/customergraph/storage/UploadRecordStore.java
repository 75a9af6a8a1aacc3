package com.agentic.customergraph.storage;

import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

import java.time.Instant;
import java.util.List;
import java.util.concurrent.CompletableFuture;

/**
 * Append-only audit trail of upload state per customer and extraction.
 *
 * <p>Every state change is appended as a new record; nothing is updated in
 * place or deleted. The latest record of an extraction is its current state.</p>
 *
 * Implementations: InMemoryUploadRecordStore, SQLiteUploadRecordStore
 */
public interface UploadRecordStore extends AutoCloseable {

    CompletableFuture<Void> initialize();

    CompletableFuture<Void> append(@NotNull UploadRecord record);

    /**
     * All records of one extraction in append order.
     */
    CompletableFuture<List<UploadRecord>> history(@NotNull String customerId, @NotNull String extractionId);

    /**
     * The latest record of each extraction of a customer, ordered by extraction id.
     */
    CompletableFuture<List<UploadRecord>> latestByCustomer(@NotNull String customerId);

    @Override
    void close() throws Exception;

    /**
     * Upload state of one extraction.
     *
     * <pre>
     * PENDING -> IN_PROGRESS -> SUCCEEDED
     * PENDING -> IN_PROGRESS -> FAILED -> PENDING (retry)
     * </pre>
     */
    enum UploadStatus {
        PENDING,
        IN_PROGRESS,
        SUCCEEDED,
        FAILED;

        public boolean canTransitionTo(@NotNull UploadStatus next) {
            return switch (this) {
                case PENDING -> next == IN_PROGRESS;
                case IN_PROGRESS -> next == SUCCEEDED || next == FAILED;
                case FAILED -> next == PENDING;
                case SUCCEEDED -> false;
            };
        }
    }

    /**
     * One state of an extraction's upload.
     */
    record UploadRecord(
            @NotNull String customerId,
            @NotNull String extractionId,
            @NotNull UploadStatus status,
            int attemptCount,
            @Nullable String lastError,
            int nodesWritten,
            int edgesWritten,
            @NotNull Instant recordedAt) {

        /**
         * Creates the initial PENDING record of a newly discovered extraction.
         */
        public static UploadRecord pending(@NotNull String customerId, @NotNull String extractionId) {
            return new UploadRecord(customerId, extractionId, UploadStatus.PENDING, 0, null, 0, 0, Instant.now());
        }

        /**
         * Starts a new attempt.
         */
        public UploadRecord asInProgress() {
            return transition(UploadStatus.IN_PROGRESS, attemptCount + 1, null, 0, 0);
        }

        public UploadRecord asSucceeded(int nodes, int edges) {
            return transition(UploadStatus.SUCCEEDED, attemptCount, null, nodes, edges);
        }

        /**
         * Marks the attempt failed, keeping the progress it made.
         */
        public UploadRecord asFailed(@NotNull String error, int nodes, int edges) {
            return transition(UploadStatus.FAILED, attemptCount, error, nodes, edges);
        }

        /**
         * Re-queues a failed extraction for another attempt.
         */
        public UploadRecord asRetryPending() {
            return transition(UploadStatus.PENDING, attemptCount, lastError, nodesWritten, edgesWritten);
        }

        private UploadRecord transition(UploadStatus next, int attempts, String error, int nodes, int edges) {
            if (!status.canTransitionTo(next)) {
                throw new IllegalStateException(
                    "Illegal upload transition " + status + " -> " + next + " for " + extractionId);
            }
            return new UploadRecord(customerId, extractionId, next, attempts, error, nodes, edges, Instant.now());
        }
    }
}

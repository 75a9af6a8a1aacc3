package com.agentic.customergraph.storage;

import com.agentic.customergraph.storage.UploadRecordStore.UploadRecord;
import com.agentic.customergraph.storage.UploadRecordStore.UploadStatus;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class UploadRecordTest {

    @Test
    @DisplayName("Allowed transitions follow the upload state machine")
    void allowedTransitions() {
        assertTrue(UploadStatus.PENDING.canTransitionTo(UploadStatus.IN_PROGRESS));
        assertTrue(UploadStatus.IN_PROGRESS.canTransitionTo(UploadStatus.SUCCEEDED));
        assertTrue(UploadStatus.IN_PROGRESS.canTransitionTo(UploadStatus.FAILED));
        assertTrue(UploadStatus.FAILED.canTransitionTo(UploadStatus.PENDING));

        assertFalse(UploadStatus.PENDING.canTransitionTo(UploadStatus.SUCCEEDED));
        assertFalse(UploadStatus.FAILED.canTransitionTo(UploadStatus.IN_PROGRESS));
        for (UploadStatus next : UploadStatus.values()) {
            assertFalse(UploadStatus.SUCCEEDED.canTransitionTo(next), "SUCCEEDED is terminal");
        }
    }

    @Test
    @DisplayName("Attempts count up across retries")
    void attemptsAccumulate() {
        UploadRecord second = UploadRecord.pending("acme", "extraction_1")
            .asInProgress()
            .asFailed("timeout", 0, 0)
            .asRetryPending()
            .asInProgress();

        assertEquals(2, second.attemptCount());
        assertNull(second.lastError(), "a new attempt clears the previous error");
        assertEquals(UploadStatus.IN_PROGRESS, second.status());
    }

    @Test
    @DisplayName("Illegal transitions are rejected")
    void illegalTransition() {
        UploadRecord succeeded = UploadRecord.pending("acme", "extraction_1").asInProgress().asSucceeded(2, 1);

        assertThrows(IllegalStateException.class, succeeded::asInProgress);
        assertThrows(IllegalStateException.class,
            () -> UploadRecord.pending("acme", "extraction_1").asSucceeded(1, 1));
    }
}

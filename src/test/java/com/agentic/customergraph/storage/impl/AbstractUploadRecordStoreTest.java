package com.agentic.customergraph.storage.impl;

import com.agentic.customergraph.storage.UploadRecordStore;
import com.agentic.customergraph.storage.UploadRecordStore.UploadRecord;
import com.agentic.customergraph.storage.UploadRecordStore.UploadStatus;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

/**
 * Behaviour every {@link UploadRecordStore} backend shares.
 */
abstract class AbstractUploadRecordStoreTest {

    protected abstract UploadRecordStore store();

    private UploadRecord append(UploadRecord record) {
        store().append(record).join();
        return record;
    }

    @Test
    @DisplayName("History keeps every state in append order")
    void historyIsAppendOnly() {
        UploadRecord pending = append(UploadRecord.pending("acme", "extraction_1"));
        UploadRecord running = append(pending.asInProgress());
        UploadRecord failed = append(running.asFailed("connection reset", 3, 1));
        append(failed.asRetryPending());

        List<UploadRecord> history = store().history("acme", "extraction_1").join();

        assertEquals(List.of(UploadStatus.PENDING, UploadStatus.IN_PROGRESS, UploadStatus.FAILED, UploadStatus.PENDING),
            history.stream().map(UploadRecord::status).toList());
        assertEquals("connection reset", history.get(2).lastError());
        assertEquals(3, history.get(2).nodesWritten());
        assertEquals(1, history.get(3).attemptCount());
    }

    @Test
    @DisplayName("Latest record per extraction, ordered by extraction id")
    void latestByCustomer() {
        UploadRecord second = append(UploadRecord.pending("acme", "extraction_2"));
        UploadRecord first = append(UploadRecord.pending("acme", "extraction_1"));
        append(first.asInProgress().asSucceeded(4, 3));
        append(second.asInProgress());

        List<UploadRecord> latest = store().latestByCustomer("acme").join();

        assertEquals(2, latest.size());
        assertEquals("extraction_1", latest.get(0).extractionId());
        assertEquals(UploadStatus.SUCCEEDED, latest.get(0).status());
        assertEquals(4, latest.get(0).nodesWritten());
        assertEquals(UploadStatus.IN_PROGRESS, latest.get(1).status());
    }

    @Test
    @DisplayName("Records of other customers are never returned")
    void customersAreIsolated() {
        append(UploadRecord.pending("acme", "extraction_1"));
        append(UploadRecord.pending("beta", "extraction_1"));

        assertEquals(1, store().latestByCustomer("acme").join().size());
        assertTrue(store().latestByCustomer("acme").join().stream().allMatch(r -> r.customerId().equals("acme")));
        assertTrue(store().history("gamma", "extraction_1").join().isEmpty());
    }
}

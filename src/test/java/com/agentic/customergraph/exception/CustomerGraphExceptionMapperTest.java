package com.agentic.customergraph.exception;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;

class CustomerGraphExceptionMapperTest {

    @Test
    @DisplayName("Maps each failure kind to an HTTP status")
    void statuses() {
        assertEquals(422, CustomerGraphExceptionMapper.statusOf(new MissingPrimarySubjectException("acme", "e1")));
        assertEquals(422, CustomerGraphExceptionMapper.statusOf(new EmptyGraphException("acme", "e1")));
        assertEquals(422, CustomerGraphExceptionMapper.statusOf(
            new InvalidSnapshotException("acme", "e1", List.of("edge x has no evidence"))));
        assertEquals(409, CustomerGraphExceptionMapper.statusOf(
            new CrossCustomerViolationException("acme", "e1", "beta")));
        assertEquals(404, CustomerGraphExceptionMapper.statusOf(new SnapshotNotFoundException("acme", "e1")));
        assertEquals(409, CustomerGraphExceptionMapper.statusOf(
            new ExtractionStoreException("Snapshot already exists", "acme", "e1", false)));
        assertEquals(503, CustomerGraphExceptionMapper.statusOf(
            new ExtractionStoreException("disk busy", "acme", "e1", true)));
        assertEquals(503, CustomerGraphExceptionMapper.statusOf(new UploadTimeoutException("acme", "e1",
            "upsertVertex", Duration.ofSeconds(1), WriteOutcome.NOTHING_WRITTEN, null)));
        assertEquals(500, CustomerGraphExceptionMapper.statusOf(
            new GraphDatabaseException("corrupt page", "acme", false)));
    }

    @Test
    @DisplayName("Titles include the 422 reason phrase")
    void titles() {
        assertEquals("Unprocessable Entity", CustomerGraphExceptionMapper.titleOf(422));
        assertEquals("Not Found", CustomerGraphExceptionMapper.titleOf(404));
        assertEquals("Service Unavailable", CustomerGraphExceptionMapper.titleOf(503));
    }
}

package com.agentic.customergraph.upload;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Duration;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

class InMemoryUploadMetricsSinkTest {

    private final InMemoryUploadMetricsSink sink = new InMemoryUploadMetricsSink();

    @Test
    @DisplayName("Keeps events and totals until reset")
    void recordsAndResets() {
        sink.record(new UploadMetricEvent("acme", "e1", UploadOutcome.SUCCEEDED, Duration.ofMillis(5), 3, 2, 1));
        sink.record(new UploadMetricEvent("acme", "e2", UploadOutcome.FAILED, Duration.ofMillis(5), 1, 0, 2));
        sink.record(null);

        assertEquals(2, sink.getEvents().size());
        assertEquals(4, sink.getTotalNodes());
        assertEquals(2, sink.getTotalEdges());
        assertEquals(1L, sink.countByOutcome().get(UploadOutcome.FAILED));

        sink.reset();

        assertTrue(sink.getEvents().isEmpty());
        assertEquals(0, sink.getTotalNodes());
    }
}

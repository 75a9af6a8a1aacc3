package com.agentic.customergraph.upload;

import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Duration;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;

class MicrometerUploadMetricsSinkTest {

    private SimpleMeterRegistry registry;
    private MicrometerUploadMetricsSink sink;

    @BeforeEach
    void setUp() {
        registry = new SimpleMeterRegistry();
        sink = new MicrometerUploadMetricsSink(registry);
    }

    private double count(String name, String customerId) {
        return registry.get("customer_graph.upload." + name).tag("customer_id", customerId).counter().count();
    }

    @Test
    @DisplayName("Counts successes with the elements written, per customer")
    void success() {
        sink.record(new UploadMetricEvent("acme", "e1", UploadOutcome.SUCCEEDED, Duration.ofMillis(20), 3, 2, 1));
        sink.record(new UploadMetricEvent("acme", "e2", UploadOutcome.SUCCEEDED, Duration.ofMillis(30), 4, 1, 1));
        sink.record(new UploadMetricEvent("beta", "e1", UploadOutcome.SUCCEEDED, Duration.ofMillis(30), 1, 0, 1));

        assertEquals(2.0, count("success", "acme"));
        assertEquals(7.0, count("nodes", "acme"));
        assertEquals(3.0, count("edges", "acme"));
        assertEquals(1.0, count("success", "beta"));
        assertEquals(2L, registry.get("customer_graph.upload.duration").tag("customer_id", "acme").timer().count());
    }

    @Test
    @DisplayName("A timeout counts as a timeout and as a failure")
    void timeout() {
        sink.record(new UploadMetricEvent("acme", "e1", UploadOutcome.TIMED_OUT, Duration.ofMillis(50), 0, 0, 3));
        sink.record(new UploadMetricEvent("acme", "e2", UploadOutcome.FAILED, Duration.ofMillis(5), 1, 0, 1));

        assertEquals(1.0, count("timeout", "acme"));
        assertEquals(2.0, count("failure", "acme"));
        assertNull(registry.find("customer_graph.upload.success").counter());
    }

    @Test
    @DisplayName("Dry-run outcomes are tagged and never count as successes")
    void dryRun() {
        sink.record(new UploadMetricEvent("acme", "e1", UploadOutcome.VALIDATED, Duration.ZERO, 0, 0, 0));
        sink.record(new UploadMetricEvent("acme", "e2", UploadOutcome.INVALID, Duration.ZERO, 0, 0, 0));

        assertEquals(1.0, registry.get("customer_graph.upload.dry_run")
            .tags("customer_id", "acme", "outcome", "validated").counter().count());
        assertEquals(1.0, registry.get("customer_graph.upload.dry_run")
            .tags("customer_id", "acme", "outcome", "invalid").counter().count());
        assertNull(registry.find("customer_graph.upload.success").counter());
    }
}

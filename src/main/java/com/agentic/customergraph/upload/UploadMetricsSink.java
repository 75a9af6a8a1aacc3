package com.agentic.customergraph.upload;

/**
 * External metrics sink fed by the Bulk Upload Coordinator.
 *
 * Implementations: MicrometerUploadMetricsSink, InMemoryUploadMetricsSink
 */
public interface UploadMetricsSink {

    void record(UploadMetricEvent event);
}

package com.agentic.customergraph.upload;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;

/**
 * Publishes upload metrics to a Micrometer registry:
 * <ul>
 *   <li>{@code customer_graph.upload.success}, {@code .failure}, {@code .timeout}: counters</li>
 *   <li>{@code customer_graph.upload.dry_run}: counter tagged with {@code outcome}</li>
 *   <li>{@code customer_graph.upload.duration}: timer</li>
 *   <li>{@code customer_graph.upload.nodes}, {@code .edges}: counters of elements written</li>
 * </ul>
 * Every meter is tagged with {@code customer_id}.
 */
public class MicrometerUploadMetricsSink implements UploadMetricsSink {

    static final String PREFIX = "customer_graph.upload.";
    static final String CUSTOMER_TAG = "customer_id";

    private final MeterRegistry registry;

    public MicrometerUploadMetricsSink(MeterRegistry registry) {
        this.registry = registry;
    }

    @Override
    public void record(UploadMetricEvent event) {
        String customer = event.customerId();
        switch (event.outcome()) {
            case SUCCEEDED -> counter("success", customer).increment();
            case FAILED -> counter("failure", customer).increment();
            case TIMED_OUT -> {
                counter("timeout", customer).increment();
                counter("failure", customer).increment();
            }
            case VALIDATED, INVALID -> Counter.builder(PREFIX + "dry_run")
                .tag(CUSTOMER_TAG, customer)
                .tag("outcome", event.outcome().name().toLowerCase())
                .register(registry)
                .increment();
        }
        Timer.builder(PREFIX + "duration")
            .tag(CUSTOMER_TAG, customer)
            .register(registry)
            .record(event.elapsed());
        counter("nodes", customer).increment(event.nodesWritten());
        counter("edges", customer).increment(event.edgesWritten());
    }

    private Counter counter(String name, String customerId) {
        return Counter.builder(PREFIX + name).tag(CUSTOMER_TAG, customerId).register(registry);
    }
}

package com.agentic.customergraph.upload;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Map;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicInteger;

import static java.util.stream.Collectors.counting;
import static java.util.stream.Collectors.groupingBy;

/**
 * Keeps metric events in memory, for tests and for deployments without a
 * meter registry.
 */
public class InMemoryUploadMetricsSink implements UploadMetricsSink {

    private static final Logger logger = LoggerFactory.getLogger(InMemoryUploadMetricsSink.class);

    private final CopyOnWriteArrayList<UploadMetricEvent> events = new CopyOnWriteArrayList<>();
    private final AtomicInteger totalNodes = new AtomicInteger(0);
    private final AtomicInteger totalEdges = new AtomicInteger(0);

    @Override
    public void record(UploadMetricEvent event) {
        if (event == null) {
            logger.warn("Attempted to record null UploadMetricEvent");
            return;
        }
        events.add(event);
        totalNodes.addAndGet(event.nodesWritten());
        totalEdges.addAndGet(event.edgesWritten());
        logger.debug("Recorded upload metric: customer={} extraction={} outcome={} nodes={} edges={}",
            event.customerId(), event.extractionId(), event.outcome(), event.nodesWritten(), event.edgesWritten());
    }

    public List<UploadMetricEvent> getEvents() {
        return List.copyOf(events);
    }

    public Map<UploadOutcome, Long> countByOutcome() {
        return events.stream().collect(groupingBy(UploadMetricEvent::outcome, counting()));
    }

    public int getTotalNodes() {
        return totalNodes.get();
    }

    public int getTotalEdges() {
        return totalEdges.get();
    }

    public void reset() {
        events.clear();
        totalNodes.set(0);
        totalEdges.set(0);
    }
}

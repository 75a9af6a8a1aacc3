package com.agentic.customergraph.upload;

import java.util.List;

import org.jboss.logging.Logger;

import com.agentic.customergraph.config.CustomerGraphConfig;
import com.agentic.customergraph.storage.ExtractionStore;

import io.quarkus.scheduler.Scheduled;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;

/**
 * Periodically uploads the pending extractions of every customer in the
 * Extraction Store. Disabled unless {@code customer-graph.upload.schedule.enabled=true}.
 */
@ApplicationScoped
public class BulkUploadJob {

    private static final Logger LOG = Logger.getLogger(BulkUploadJob.class);

    @Inject
    CustomerGraphConfig config;

    @Inject
    ExtractionStore extractionStore;

    @Inject
    BulkUploadCoordinator coordinator;

    @Scheduled(every = "${customer-graph.upload.schedule.every:1h}",
        concurrentExecution = Scheduled.ConcurrentExecution.SKIP)
    void uploadPending() {
        if (!config.upload().schedule().enabled()) {
            return;
        }
        List<String> customers = extractionStore.listCustomers().join();
        LOG.infof("Scheduled bulk upload for %d customers", customers.size());

        List<BulkUploadResult> results = coordinator.uploadAll(customers, false, CancellationToken.create());
        int succeeded = results.stream().mapToInt(BulkUploadResult::succeeded).sum();
        int failed = results.stream().mapToInt(BulkUploadResult::failed).sum();
        LOG.infof("Scheduled bulk upload finished: %d succeeded, %d failed", succeeded, failed);
    }
}

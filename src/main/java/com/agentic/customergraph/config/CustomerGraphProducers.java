package com.agentic.customergraph.config;

import java.time.Clock;

import org.jboss.logging.Logger;

import com.agentic.customergraph.core.EntityExtractor;
import com.agentic.customergraph.core.ExtractionSettings;
import com.agentic.customergraph.core.GraphAssembler;
import com.agentic.customergraph.core.GraphExtractionService;
import com.agentic.customergraph.core.RelationshipExtractor;
import com.agentic.customergraph.similarity.SimilarityScorerFactory;
import com.agentic.customergraph.storage.ExtractionStore;
import com.agentic.customergraph.storage.GraphDatabase;
import com.agentic.customergraph.storage.UploadRecordStore;
import com.agentic.customergraph.upload.BulkUploadCoordinator;
import com.agentic.customergraph.upload.MicrometerUploadMetricsSink;
import com.agentic.customergraph.upload.UploadMetricsSink;
import com.agentic.customergraph.upload.UploadSettings;

import io.micrometer.core.instrument.MeterRegistry;
import io.quarkus.runtime.StartupEvent;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.enterprise.event.Observes;
import jakarta.enterprise.inject.Produces;
import jakarta.inject.Inject;
import jakarta.inject.Singleton;

/**
 * Wires the framework-free core into CDI. Configuration is validated on
 * startup and handed to the core only as immutable settings records.
 * Records and final core classes are produced as {@code @Singleton}, which
 * needs no client proxy.
 */
@ApplicationScoped
public class CustomerGraphProducers {

    private static final Logger LOG = Logger.getLogger(CustomerGraphProducers.class);

    @Inject
    CustomerGraphConfig config;

    void onStart(@Observes StartupEvent event) {
        config.validate();
        LOG.infof("Customer graph configuration valid: backend=%s, similarity=%s, max-attempts=%d",
            config.storage().backend(), config.extraction().similarityProvider(), config.upload().maxAttempts());
    }

    @Produces
    @ApplicationScoped
    public Clock clock() {
        return Clock.systemUTC();
    }

    @Produces
    @Singleton
    public ExtractionSettings extractionSettings() {
        return config.extraction().toSettings();
    }

    @Produces
    @Singleton
    public UploadSettings uploadSettings() {
        return config.upload().toSettings();
    }

    @Produces
    @Singleton
    public GraphExtractionService graphExtractionService(ExtractionSettings settings, ExtractionStore store,
            SimilarityScorerFactory scorerFactory, Clock clock) {
        return new GraphExtractionService(
            new EntityExtractor(settings, clock),
            new RelationshipExtractor(settings, scorerFactory.getScorer()),
            new GraphAssembler(settings, store, clock),
            scorerFactory.providerName(),
            clock);
    }

    @Produces
    @ApplicationScoped
    public UploadMetricsSink uploadMetricsSink(MeterRegistry registry) {
        return new MicrometerUploadMetricsSink(registry);
    }

    @Produces
    @Singleton
    public BulkUploadCoordinator bulkUploadCoordinator(ExtractionStore extractionStore, GraphDatabase graphDatabase,
            UploadRecordStore uploadRecords, UploadSettings settings, UploadMetricsSink metricsSink) {
        return new BulkUploadCoordinator(extractionStore, graphDatabase, uploadRecords, settings, metricsSink);
    }
}

package com.agentic.customergraph.storage.impl;

import org.jboss.logging.Logger;

import com.agentic.customergraph.storage.GraphDatabase;
import com.agentic.customergraph.storage.UploadRecordStore;

import io.quarkus.arc.properties.IfBuildProperty;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.enterprise.inject.Produces;

/**
 * CDI producer of the in-memory Graph Database and Upload Record Store.
 * Active when {@code customer-graph.storage.backend=memory} or when no
 * backend is configured.
 */
@ApplicationScoped
@IfBuildProperty(name = "customer-graph.storage.backend", stringValue = "memory", enableIfMissing = true)
public class InMemoryStorageProvider {

    private static final Logger LOG = Logger.getLogger(InMemoryStorageProvider.class);

    @Produces
    @ApplicationScoped
    @IfBuildProperty(name = "customer-graph.storage.backend", stringValue = "memory", enableIfMissing = true)
    public GraphDatabase produceGraphDatabase() {
        InMemoryGraphDatabase graphDatabase = new InMemoryGraphDatabase();
        graphDatabase.initialize().join();
        LOG.info("Created InMemoryGraphDatabase instance");
        return graphDatabase;
    }

    @Produces
    @ApplicationScoped
    @IfBuildProperty(name = "customer-graph.storage.backend", stringValue = "memory", enableIfMissing = true)
    public UploadRecordStore produceUploadRecordStore() {
        InMemoryUploadRecordStore store = new InMemoryUploadRecordStore();
        store.initialize().join();
        LOG.info("Created InMemoryUploadRecordStore instance");
        return store;
    }
}

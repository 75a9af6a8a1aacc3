package com.agentic.customergraph.storage.impl;

import java.nio.file.Path;

import org.jboss.logging.Logger;

import com.agentic.customergraph.config.CustomerGraphConfig;
import com.agentic.customergraph.storage.ExtractionStore;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.enterprise.inject.Produces;
import jakarta.inject.Inject;

/**
 * CDI producer of the Extraction Store: file-system backed when
 * {@code customer-graph.storage.root-dir} is set, in memory otherwise.
 */
@ApplicationScoped
public class ExtractionStoreProvider {

    private static final Logger LOG = Logger.getLogger(ExtractionStoreProvider.class);

    @Inject
    CustomerGraphConfig config;

    @Produces
    @ApplicationScoped
    public ExtractionStore produceExtractionStore() {
        return config.storage().rootDir()
            .filter(dir -> !dir.isBlank())
            .<ExtractionStore>map(dir -> {
                LOG.infof("Using file-system extraction store at %s", dir);
                return new FileSystemExtractionStore(Path.of(dir));
            })
            .orElseGet(() -> {
                LOG.info("No storage root configured; using in-memory extraction store");
                return new InMemoryExtractionStore();
            });
    }
}

package com.agentic.customergraph.storage.impl;

import com.agentic.customergraph.storage.UploadRecordStore;
import org.junit.jupiter.api.BeforeEach;

class InMemoryUploadRecordStoreTest extends AbstractUploadRecordStoreTest {

    private InMemoryUploadRecordStore store;

    @BeforeEach
    void setUp() {
        store = new InMemoryUploadRecordStore();
        store.initialize().join();
    }

    @Override
    protected UploadRecordStore store() {
        return store;
    }
}

package com.agentic.customergraph.utils;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertNotSame;
import static org.junit.jupiter.api.Assertions.assertSame;

class LockUtilTest {

    @AfterEach
    void tearDown() {
        LockUtil.clearLockPool();
    }

    @Test
    @DisplayName("One lock per customer and scope")
    void lockPerCustomer() {
        assertSame(LockUtil.customerLock("bulk-upload", "acme"), LockUtil.customerLock("bulk-upload", "acme"));
        assertNotSame(LockUtil.customerLock("bulk-upload", "acme"), LockUtil.customerLock("bulk-upload", "beta"));
        assertNotSame(LockUtil.customerLock("bulk-upload", "acme"), LockUtil.customerLock("extraction", "acme"));
    }
}

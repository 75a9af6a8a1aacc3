package com.agentic.customergraph.upload;

import java.time.Duration;

/**
 * Waits between upload attempts. Tests substitute a recording no-op.
 */
@FunctionalInterface
public interface Sleeper {

    Sleeper SYSTEM = duration -> Thread.sleep(duration.toMillis());

    void sleep(Duration duration) throws InterruptedException;
}

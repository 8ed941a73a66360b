/* (C)2026 */
package com.ammann.reflectometry.config;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.enterprise.inject.Produces;
import jakarta.inject.Named;
import org.eclipse.microprofile.context.ManagedExecutor;
import org.eclipse.microprofile.context.ThreadContext;

/**
 * CDI producer for the executor that reduces polarization channels in parallel.
 *
 * <p>Provides the "reduction-executor" bean used by ReductionService. A measurement
 * holds at most four channels, so the pool stays small.
 */
@ApplicationScoped
public class ExecutorProducer {

    /**
     * Produces a named ManagedExecutor for per-channel reduction work.
     *
     * @return Configured ManagedExecutor instance
     */
    @Produces
    @Named("reduction-executor")
    @ApplicationScoped
    public ManagedExecutor createReductionExecutor() {
        return ManagedExecutor.builder()
                .maxAsync(4) // one worker per polarization channel
                .maxQueued(16)
                .propagated(ThreadContext.ALL_REMAINING)
                .build();
    }
}

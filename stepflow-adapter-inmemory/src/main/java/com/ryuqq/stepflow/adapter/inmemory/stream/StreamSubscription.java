package com.ryuqq.stepflow.adapter.inmemory.stream;

/**
 * Handle returned by {@link InMemoryStreamTransport#subscribe}.
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
@FunctionalInterface
public interface StreamSubscription {

    void cancel();
}

/**
 * Stream event publishing.
 *
 * <p>{@link com.ryuqq.stepflow.application.event.StreamEventPublisher} turns orchestration facts and
 * task executor notifications into {@link com.ryuqq.stepflow.core.model.StreamEvent}s and hands
 * them to the configured {@link com.ryuqq.stepflow.core.spi.StreamTransport}.</p>
 *
 * @since 1.0.0
 * @author Orchestrator Team
 */
package com.ryuqq.stepflow.application.event;

package com.ryuqq.stepflow.core.spi;

import com.ryuqq.stepflow.core.model.StreamEvent;

/**
 * Stream transport SPI.
 *
 * <p>Carries {@link StreamEvent}s from the orchestrator to stream consumers.</p>
 *
 * <p><strong>Implementation Requirements:</strong></p>
 * <ul>
 *   <li>Thread-safe: All methods must be safely callable from multiple threads</li>
 *   <li>Per-stream ordering: events published to one stream are delivered in publish order</li>
 *   <li>{@link #publishEvent(String, StreamEvent)} throws when the event cannot be delivered
 *       (for example, unknown stream)</li>
 * </ul>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public interface StreamTransport {

    void createStream(String streamId, String sessionId);

    void destroyStream(String streamId);

    /**
     * Publishes an event to the stream.
     *
     * @param streamId target stream
     * @param event event to deliver
     * @throws RuntimeException if delivery fails
     */
    void publishEvent(String streamId, StreamEvent event);
}

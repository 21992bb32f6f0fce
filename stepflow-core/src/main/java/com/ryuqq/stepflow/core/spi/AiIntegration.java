package com.ryuqq.stepflow.core.spi;

/**
 * AI backend integration SPI.
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public interface AiIntegration {

    /**
     * Validates that the AI connection can be used.
     *
     * @param connectionId AI connection id
     * @return true if the connection is usable
     */
    boolean validateConnection(String connectionId);
}

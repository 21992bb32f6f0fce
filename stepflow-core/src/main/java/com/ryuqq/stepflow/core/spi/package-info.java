/**
 * Service Provider Interfaces for the external collaborators of the orchestrator.
 *
 * <h2>Components</h2>
 * <ul>
 *   <li>{@link com.ryuqq.stepflow.core.spi.SessionCoordinator} - unified workflow sessions</li>
 *   <li>{@link com.ryuqq.stepflow.core.spi.ContextManager} - AI working context</li>
 *   <li>{@link com.ryuqq.stepflow.core.spi.ExecutorSessionManager} - browser executor sessions</li>
 *   <li>{@link com.ryuqq.stepflow.core.spi.StreamTransport} - event stream transport</li>
 *   <li>{@link com.ryuqq.stepflow.core.spi.AiIntegration} - AI connection validation</li>
 *   <li>{@link com.ryuqq.stepflow.core.spi.TaskExecutor} - single-step execution (task loop)</li>
 * </ul>
 *
 * <h2>Session Setup Order</h2>
 * <pre>
 * coordinator.createWorkflowSession(steps, config)
 *   → contextManager.createSession / linkExecutorSession / setSteps
 *   → executorSessions.createSession
 *   → streamTransport.createStream   (only when a stream id was assigned)
 *   → aiIntegration.validateConnection
 * </pre>
 *
 * <p>Teardown runs in reverse order: stream, executor session, context.</p>
 *
 * @since 1.0.0
 * @author Orchestrator Team
 */
package com.ryuqq.stepflow.core.spi;

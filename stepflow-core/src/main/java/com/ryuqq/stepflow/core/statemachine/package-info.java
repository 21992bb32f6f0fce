/**
 * Session status state machine.
 *
 * <h2>Components</h2>
 * <ul>
 *   <li>{@link com.ryuqq.stepflow.core.statemachine.SessionStatus} - session lifecycle states</li>
 *   <li>{@link com.ryuqq.stepflow.core.statemachine.SessionStatusTransition} - transition validation</li>
 * </ul>
 *
 * <h2>Usage Example</h2>
 * <pre>
 * SessionStatus status = SessionStatus.INITIALIZING;
 * status = SessionStatusTransition.transition(status, SessionStatus.ACTIVE);
 * status = SessionStatusTransition.transition(status, SessionStatus.PAUSED);
 * status = SessionStatusTransition.transition(status, SessionStatus.ACTIVE);
 *
 * // This will throw IllegalStateException
 * SessionStatusTransition.validate(SessionStatus.COMPLETED, SessionStatus.ACTIVE);
 * </pre>
 *
 * @since 1.0.0
 * @author Orchestrator Team
 */
package com.ryuqq.stepflow.core.statemachine;

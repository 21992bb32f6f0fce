/**
 * Error taxonomy and handling.
 *
 * <p>Every failure is normalized to a {@link com.ryuqq.stepflow.core.error.StandardError}
 * where it is first detected, logged through
 * {@link com.ryuqq.stepflow.core.error.ErrorHandler#handleError} and rethrown as a
 * {@link com.ryuqq.stepflow.core.error.WorkflowException}.</p>
 *
 * <h2>Categories</h2>
 * <ul>
 *   <li>VALIDATION - bad input; never recoverable or retryable</li>
 *   <li>EXECUTION - step or session lifecycle failures</li>
 *   <li>SYSTEM - capacity and dependency failures</li>
 *   <li>INTEGRATION - streaming and event transport failures</li>
 * </ul>
 *
 * @since 1.0.0
 * @author Orchestrator Team
 */
package com.ryuqq.stepflow.core.error;

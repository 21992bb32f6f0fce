/**
 * Core domain model for workflow sessions, step progress and stream events.
 *
 * <h2>Sessions</h2>
 * <ul>
 *   <li>{@link com.ryuqq.stepflow.core.model.WorkflowSession} - unified session owned by the session coordinator</li>
 *   <li>{@link com.ryuqq.stepflow.core.model.StepProcessorSession} - orchestration-local session state</li>
 *   <li>{@link com.ryuqq.stepflow.core.model.ExecutionProgress} - progress snapshot</li>
 *   <li>{@link com.ryuqq.stepflow.core.model.StepExecutionSummary} - one entry of the step history</li>
 *   <li>{@link com.ryuqq.stepflow.core.model.ProcessingConfig} - per-workflow processing options</li>
 * </ul>
 *
 * <h2>Stream Events</h2>
 * <ul>
 *   <li>{@link com.ryuqq.stepflow.core.model.StreamEvent} - immutable event published to a stream</li>
 *   <li>{@link com.ryuqq.stepflow.core.model.StreamEventData} - message, step, progress, error payload</li>
 *   <li>{@link com.ryuqq.stepflow.core.model.StructuredPayload} - reasoning, action or screenshot sub-payload</li>
 * </ul>
 *
 * <h2>Design Principles</h2>
 * <ul>
 *   <li><strong>Immutability:</strong> records only; updates return new instances</li>
 *   <li><strong>Validation:</strong> compact constructors reject invalid state</li>
 * </ul>
 *
 * @since 1.0.0
 * @author Orchestrator Team
 */
package com.ryuqq.stepflow.core.model;

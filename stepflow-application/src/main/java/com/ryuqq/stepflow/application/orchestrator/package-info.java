/**
 * Workflow orchestration.
 *
 * <h2>Components</h2>
 * <ul>
 *   <li>{@link com.ryuqq.stepflow.application.orchestrator.WorkflowOrchestrator} - public API</li>
 *   <li>{@link com.ryuqq.stepflow.application.orchestrator.DefaultWorkflowOrchestrator} - session lifecycle and step loop</li>
 *   <li>{@link com.ryuqq.stepflow.application.orchestrator.SessionRegistry} - lock-owning session registry</li>
 *   <li>{@link com.ryuqq.stepflow.application.orchestrator.OrchestratorDependencies} - typed collaborator bundle</li>
 *   <li>{@link com.ryuqq.stepflow.application.orchestrator.OrchestratorConfig} - limits and defaults</li>
 *   <li>{@link com.ryuqq.stepflow.application.orchestrator.StepRequests} - request helpers for line-based step input</li>
 * </ul>
 *
 * <h2>Composition</h2>
 * <pre>
 * OrchestratorDependencies dependencies = new OrchestratorDependencies(
 *     coordinator, contextManager, taskExecutor, executorSessions, streamTransport, aiIntegration);
 * WorkflowOrchestrator orchestrator =
 *     new DefaultWorkflowOrchestrator(dependencies, new OrchestratorConfig());
 * </pre>
 *
 * @since 1.0.0
 * @author Orchestrator Team
 */
package com.ryuqq.stepflow.application.orchestrator;

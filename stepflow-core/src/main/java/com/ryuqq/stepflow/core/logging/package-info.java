/**
 * Structured workflow logging on top of SLF4J with MDC context.
 *
 * @since 1.0.0
 * @author Orchestrator Team
 */
package com.ryuqq.stepflow.core.logging;

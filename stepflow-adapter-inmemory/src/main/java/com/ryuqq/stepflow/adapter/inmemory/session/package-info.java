/**
 * In-memory workflow session coordinator.
 *
 * @since 1.0.0
 * @author Orchestrator Team
 */
package com.ryuqq.stepflow.adapter.inmemory.session;

/**
 * In-memory stream transport and wire encoding.
 *
 * <h2>Wire Format</h2>
 * <pre>
 * {"type":"event","sessionId":"...","data":"Starting step 1: ...","timestamp":"..."}
 * {"type":"structured_event","sessionId":"...","data":"{\"type\":\"action\",...}","timestamp":"..."}
 * {"type":"error","sessionId":"...","data":"...","timestamp":"..."}
 * </pre>
 *
 * @since 1.0.0
 * @author Orchestrator Team
 */
package com.ryuqq.stepflow.adapter.inmemory.stream;

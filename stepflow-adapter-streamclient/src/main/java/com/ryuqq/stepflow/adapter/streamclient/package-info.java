/**
 * Reconnecting consumer of the workflow event stream.
 *
 * <p>{@link com.ryuqq.stepflow.adapter.streamclient.ReconnectingStreamClient} drives an explicit
 * connection state machine over a pluggable {@link com.ryuqq.stepflow.adapter.streamclient.StreamConnector}
 * and turns wire frames into display events.</p>
 */
package com.ryuqq.stepflow.adapter.streamclient;

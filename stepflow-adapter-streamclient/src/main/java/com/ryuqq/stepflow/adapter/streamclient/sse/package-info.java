/**
 * Server-Sent Events transport built on {@link java.net.http.HttpClient}.
 */
package com.ryuqq.stepflow.adapter.streamclient.sse;

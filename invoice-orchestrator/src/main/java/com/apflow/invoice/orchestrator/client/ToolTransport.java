package com.apflow.invoice.orchestrator.client;

/**
 * Carries one tool call: a JSON argument document out, the tool's JSON
 * result back.
 *
 * Implementations throw {@link com.apflow.invoice.tools.ToolUnavailableException},
 * {@link com.apflow.invoice.tools.ToolTimeoutException} or
 * {@link com.apflow.invoice.tools.ToolProtocolException}.
 */
@FunctionalInterface
public interface ToolTransport {

    String invoke(String toolName, String requestJson);
}

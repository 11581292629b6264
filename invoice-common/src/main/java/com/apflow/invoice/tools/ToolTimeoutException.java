package com.apflow.invoice.tools;

import com.apflow.invoice.canonical.enums.ToolErrorType;

/**
 * The tool did not answer in time. Retryable.
 */
public class ToolTimeoutException extends ToolException {

    public ToolTimeoutException(String toolName, String message) {
        super(toolName, message, null);
    }

    public ToolTimeoutException(String toolName, String message, Throwable cause) {
        super(toolName, message, cause);
    }

    @Override
    public ToolErrorType getErrorType() {
        return ToolErrorType.TIMEOUT;
    }
}

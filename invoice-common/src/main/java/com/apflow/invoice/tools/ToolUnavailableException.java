package com.apflow.invoice.tools;

import com.apflow.invoice.canonical.enums.ToolErrorType;

/**
 * The tool could not be reached or answered with a server error. Retryable.
 */
public class ToolUnavailableException extends ToolException {

    public ToolUnavailableException(String toolName, String message) {
        super(toolName, message, null);
    }

    public ToolUnavailableException(String toolName, String message, Throwable cause) {
        super(toolName, message, cause);
    }

    @Override
    public ToolErrorType getErrorType() {
        return ToolErrorType.UNAVAILABLE;
    }
}

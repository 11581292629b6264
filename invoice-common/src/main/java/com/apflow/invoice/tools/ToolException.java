package com.apflow.invoice.tools;

import com.apflow.invoice.canonical.enums.ToolErrorType;

/**
 * Failure to obtain an answer from a reference tool.
 */
public abstract class ToolException extends RuntimeException {

    private final String toolName;

    protected ToolException(String toolName, String message, Throwable cause) {
        super(message, cause);
        this.toolName = toolName;
    }

    public String getToolName() {
        return toolName;
    }

    public abstract ToolErrorType getErrorType();
}

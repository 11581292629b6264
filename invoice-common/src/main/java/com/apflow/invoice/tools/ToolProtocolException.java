package com.apflow.invoice.tools;

import com.apflow.invoice.canonical.enums.ToolErrorType;

/**
 * The tool answered with something that does not follow the contract:
 * malformed JSON, unknown fields, an unknown status or a missing required field.
 * Never retried.
 */
public class ToolProtocolException extends ToolException {

    public ToolProtocolException(String toolName, String message) {
        super(toolName, message, null);
    }

    public ToolProtocolException(String toolName, String message, Throwable cause) {
        super(toolName, message, cause);
    }

    @Override
    public ToolErrorType getErrorType() {
        return ToolErrorType.PROTOCOL;
    }
}

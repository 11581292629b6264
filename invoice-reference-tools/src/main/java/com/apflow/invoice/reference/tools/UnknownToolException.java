package com.apflow.invoice.reference.tools;

public class UnknownToolException extends RuntimeException {

    public UnknownToolException(String toolName) {
        super("Unknown tool: " + toolName);
    }
}

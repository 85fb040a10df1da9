package com.acme.reconcile.exception;

/**
 * Thrown by the guardrail when a capability is invoked with the wrong
 * argument count or argument types. Always raised before dispatch.
 */
public class ToolArgumentException extends ReconciliationException {

    private final String toolName;

    public ToolArgumentException(String toolName, String message) {
        super(message);
        this.toolName = toolName;
    }

    public String getToolName() {
        return toolName;
    }
}

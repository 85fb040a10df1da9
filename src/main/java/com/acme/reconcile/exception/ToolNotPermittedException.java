package com.acme.reconcile.exception;

/**
 * Thrown by the guardrail when a capability name is not on the allow-list.
 */
public class ToolNotPermittedException extends ReconciliationException {

    private final String toolName;

    public ToolNotPermittedException(String toolName, String allowed) {
        super("Tool '" + toolName + "' not permitted. Allowed: " + allowed);
        this.toolName = toolName;
    }

    public String getToolName() {
        return toolName;
    }
}

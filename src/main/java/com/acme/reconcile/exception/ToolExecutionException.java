package com.acme.reconcile.exception;

/**
 * Wraps any failure raised inside a dispatched capability.
 * Keeps the capability name and the original message.
 */
public class ToolExecutionException extends ReconciliationException {

    private final String toolName;

    public ToolExecutionException(String toolName, Throwable cause) {
        super("Tool '" + toolName + "' execution failed: " + cause.getMessage(), cause);
        this.toolName = toolName;
    }

    public String getToolName() {
        return toolName;
    }

    @Override
    public String toString() {
        return "ToolExecutionException{" +
               "toolName='" + toolName + '\'' +
               ", message='" + getMessage() + '\'' +
               '}';
    }
}

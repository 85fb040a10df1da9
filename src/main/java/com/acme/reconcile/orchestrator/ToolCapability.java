package com.acme.reconcile.orchestrator;

import java.util.Arrays;
import java.util.Optional;
import java.util.stream.Collectors;

/**
 * The closed set of capabilities the orchestrator may invoke.
 */
public enum ToolCapability {

    MATCHER("matcher", 4),
    EMAIL_DRAFTER("email_drafter", 5);

    private final String toolName;
    private final int arity;

    ToolCapability(String toolName, int arity) {
        this.toolName = toolName;
        this.arity = arity;
    }

    public String toolName() {
        return toolName;
    }

    public int arity() {
        return arity;
    }

    public static Optional<ToolCapability> fromToolName(String name) {
        return Arrays.stream(values())
                .filter(c -> c.toolName.equals(name))
                .findFirst();
    }

    public static String allowedNames() {
        return Arrays.stream(values())
                .map(ToolCapability::toolName)
                .collect(Collectors.joining(", "));
    }
}

package com.acme.reconcile.orchestrator;

import com.acme.reconcile.exception.ToolExecutionException;
import com.acme.reconcile.exception.ToolNotPermittedException;
import com.acme.reconcile.service.DisputeEmailDrafter;
import com.acme.reconcile.service.InvoiceMatcher;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/**
 * Gate between the workflow and its two capabilities.
 * <p>
 * Only {@link ToolCapability} members can be reached. Any failure raised inside a capability
 * comes back as a {@link ToolExecutionException} naming that capability.
 */
@Component
@Slf4j
public class ToolGuardrail {

    private final InvoiceMatcher matcher;
    private final DisputeEmailDrafter emailDrafter;

    public ToolGuardrail(InvoiceMatcher matcher, DisputeEmailDrafter emailDrafter) {
        this.matcher = matcher;
        this.emailDrafter = emailDrafter;
    }

    /**
     * Invokes a capability by name with positional arguments.
     *
     * @throws ToolNotPermittedException if the name is not on the allow-list
     * @throws com.acme.reconcile.exception.ToolArgumentException if the arguments do not fit, before dispatch
     * @throws ToolExecutionException if the capability itself fails
     */
    public Object invoke(String toolName, Object... args) {
        ToolCapability capability = ToolCapability.fromToolName(toolName)
                .orElseThrow(() -> new ToolNotPermittedException(toolName, ToolCapability.allowedNames()));
        return execute(ToolCall.bind(capability, args));
    }

    public <R> R execute(ToolCall<R> call) {
        String toolName = call.capability().toolName();
        log.debug("Dispatching {} with {}", toolName, call);
        try {
            return call.invokeOn(matcher, emailDrafter);
        } catch (RuntimeException e) {
            throw new ToolExecutionException(toolName, e);
        }
    }
}

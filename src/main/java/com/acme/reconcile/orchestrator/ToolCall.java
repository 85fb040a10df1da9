package com.acme.reconcile.orchestrator;

import com.acme.reconcile.domain.MatchFacts;
import com.acme.reconcile.domain.MatchResult;
import com.acme.reconcile.domain.MatchStatus;
import com.acme.reconcile.exception.ToolArgumentException;
import com.acme.reconcile.service.DisputeEmailDrafter;
import com.acme.reconcile.service.InvoiceMatcher;

/**
 * A typed invocation of one capability. {@code R} is what the capability returns.
 * <p>
 * Orchestration code builds calls directly, so argument shapes are checked by the compiler.
 * {@link #bind} is the entry for untyped callers and validates count and types up front.
 */
public sealed interface ToolCall<R> permits ToolCall.MatcherCall, ToolCall.EmailDraftCall {

    ToolCapability capability();

    /**
     * Runs this call against the capability it names.
     */
    R invokeOn(InvoiceMatcher matcher, DisputeEmailDrafter emailDrafter);

    record MatcherCall(String invoiceId, String poNumber, String dataDir, String modelPath)
            implements ToolCall<MatchResult> {

        @Override
        public ToolCapability capability() {
            return ToolCapability.MATCHER;
        }

        @Override
        public MatchResult invokeOn(InvoiceMatcher matcher, DisputeEmailDrafter emailDrafter) {
            return matcher.match(invoiceId, poNumber, dataDir, modelPath);
        }
    }

    record EmailDraftCall(String vendorName, String invoiceId, String poNumber, MatchFacts facts, MatchStatus status)
            implements ToolCall<String> {

        @Override
        public ToolCapability capability() {
            return ToolCapability.EMAIL_DRAFTER;
        }

        @Override
        public String invokeOn(InvoiceMatcher matcher, DisputeEmailDrafter emailDrafter) {
            return emailDrafter.draft(vendorName, invoiceId, poNumber, facts, status);
        }
    }

    /**
     * Builds a typed call from positional arguments.
     *
     * @throws ToolArgumentException on a wrong argument count or type
     */
    static ToolCall<?> bind(ToolCapability capability, Object... args) {
        Object[] actual = args != null ? args : new Object[0];
        if (actual.length != capability.arity()) {
            throw new ToolArgumentException(capability.toolName(),
                    capability.toolName() + " requires " + capability.arity()
                            + " arguments but got " + actual.length);
        }

        if (capability == ToolCapability.MATCHER) {
            return new MatcherCall(
                    arg(capability, actual, 0, "invoiceId", String.class),
                    arg(capability, actual, 1, "poNumber", String.class),
                    arg(capability, actual, 2, "dataDir", String.class),
                    arg(capability, actual, 3, "modelPath", String.class));
        }
        return new EmailDraftCall(
                arg(capability, actual, 0, "vendorName", String.class),
                arg(capability, actual, 1, "invoiceId", String.class),
                arg(capability, actual, 2, "poNumber", String.class),
                arg(capability, actual, 3, "facts", MatchFacts.class),
                status(capability, actual[4]));
    }

    private static <T> T arg(ToolCapability capability, Object[] args, int index, String name, Class<T> type) {
        Object value = args[index];
        if (!type.isInstance(value)) {
            throw new ToolArgumentException(capability.toolName(),
                    "Argument '" + name + "' must be a " + type.getSimpleName() + " but was "
                            + (value == null ? "null" : value.getClass().getSimpleName()));
        }
        return type.cast(value);
    }

    private static MatchStatus status(ToolCapability capability, Object value) {
        if (value instanceof MatchStatus status) {
            return status;
        }
        if (value instanceof String text) {
            try {
                return MatchStatus.fromValue(text);
            } catch (IllegalArgumentException e) {
                throw new ToolArgumentException(capability.toolName(), e.getMessage());
            }
        }
        throw new ToolArgumentException(capability.toolName(),
                "Argument 'status' must be one of match, partial, mismatch");
    }
}

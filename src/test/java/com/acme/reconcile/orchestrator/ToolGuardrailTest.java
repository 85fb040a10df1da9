package com.acme.reconcile.orchestrator;

import com.acme.reconcile.domain.MatchFacts;
import com.acme.reconcile.domain.MatchResult;
import com.acme.reconcile.domain.MatchStatus;
import com.acme.reconcile.exception.ConfigurationException;
import com.acme.reconcile.exception.ToolArgumentException;
import com.acme.reconcile.exception.ToolExecutionException;
import com.acme.reconcile.exception.ToolNotPermittedException;
import com.acme.reconcile.service.DisputeEmailDrafter;
import com.acme.reconcile.service.InvoiceMatcher;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
@DisplayName("ToolGuardrail Unit Tests")
class ToolGuardrailTest {

    @Mock
    private InvoiceMatcher matcher;

    @Mock
    private DisputeEmailDrafter emailDrafter;

    private ToolGuardrail guardrail;

    @BeforeEach
    void setUp() {
        guardrail = new ToolGuardrail(matcher, emailDrafter);
    }

    @Test
    @DisplayName("Should dispatch the matcher by name")
    void shouldInvokeMatcherByName() {
        // Given
        MatchResult expected = new MatchResult(MatchStatus.MATCH, 0.8, MatchFacts.defaults(), "ok");
        when(matcher.match("INV0012", "PO0012", "data", "model.json")).thenReturn(expected);

        // When
        Object result = guardrail.invoke("matcher", "INV0012", "PO0012", "data", "model.json");

        // Then
        assertThat(result).isSameAs(expected);
    }

    @Test
    @DisplayName("Should dispatch the email drafter with a status given as text")
    void shouldInvokeEmailDrafterByName() {
        // Given
        MatchFacts facts = MatchFacts.defaults();
        when(emailDrafter.draft("Acme", "INV0012", "PO0012", facts, MatchStatus.PARTIAL)).thenReturn("draft");

        // When
        Object result = guardrail.invoke("email_drafter", "Acme", "INV0012", "PO0012", facts, "partial");

        // Then
        assertThat(result).isEqualTo("draft");
    }

    @Test
    @DisplayName("Should reject the matcher with two arguments before any matching runs")
    void shouldRejectWrongArity() {
        assertThatThrownBy(() -> guardrail.invoke("matcher", "INV0012", "PO0012"))
                .isInstanceOf(ToolArgumentException.class)
                .hasMessageContaining("requires 4 arguments but got 2");

        verifyNoInteractions(matcher);
    }

    @Test
    @DisplayName("Should return each capability's own result type from typed calls")
    void shouldExecuteTypedCalls() {
        // Given
        MatchFacts facts = new MatchFacts(50.0, true, false, true, 9.0);
        MatchResult expected = new MatchResult(MatchStatus.MISMATCH, 0.9, facts, "mismatch");
        when(matcher.match("INV0199", "PO0199", "data", "model.json")).thenReturn(expected);
        when(emailDrafter.draft("Global Parts Co", "INV0199", "PO0199", facts, MatchStatus.MISMATCH))
                .thenReturn("Subject: URGENT");

        // When
        MatchResult result = guardrail.execute(new ToolCall.MatcherCall("INV0199", "PO0199", "data", "model.json"));
        String draft = guardrail.execute(new ToolCall.EmailDraftCall("Global Parts Co", "INV0199", "PO0199",
                facts, MatchStatus.MISMATCH));

        // Then
        assertThat(result).isSameAs(expected);
        assertThat(draft).isEqualTo("Subject: URGENT");
        verify(matcher).match("INV0199", "PO0199", "data", "model.json");
        verify(emailDrafter).draft("Global Parts Co", "INV0199", "PO0199", facts, MatchStatus.MISMATCH);
    }

    @Test
    @DisplayName("Should reject arguments of the wrong type")
    void shouldRejectWrongTypes() {
        assertThatThrownBy(() -> guardrail.invoke("email_drafter", "Acme", "INV0012", "PO0012", "not facts", "match"))
                .isInstanceOf(ToolArgumentException.class)
                .hasMessageContaining("facts");
        assertThatThrownBy(() -> guardrail.invoke("email_drafter", "Acme", "INV0012", "PO0012",
                MatchFacts.defaults(), "approved"))
                .isInstanceOf(ToolArgumentException.class)
                .hasMessageContaining("Invalid status");

        verifyNoInteractions(emailDrafter);
    }

    @Test
    @DisplayName("Should refuse capabilities that are not on the allow-list")
    void shouldRejectUnknownTool() {
        assertThatThrownBy(() -> guardrail.invoke("payment_sender", "INV0012"))
                .isInstanceOf(ToolNotPermittedException.class)
                .hasMessage("Tool 'payment_sender' not permitted. Allowed: matcher, email_drafter");
    }

    @Test
    @DisplayName("Should wrap capability failures with the capability name")
    void shouldWrapExecutionFailures() {
        // Given
        when(matcher.match(anyString(), anyString(), anyString(), anyString()))
                .thenThrow(new ConfigurationException("Model not found at model.json"));

        // When / Then
        assertThatThrownBy(() -> guardrail.execute(
                new ToolCall.MatcherCall("INV0012", "PO0012", "data", "model.json")))
                .isInstanceOf(ToolExecutionException.class)
                .hasMessage("Tool 'matcher' execution failed: Model not found at model.json")
                .hasCauseInstanceOf(ConfigurationException.class)
                .satisfies(e -> assertThat(((ToolExecutionException) e).getToolName()).isEqualTo("matcher"));
    }

    @Test
    @DisplayName("Should expose exactly two capabilities")
    void shouldAllowOnlyTwoCapabilities() {
        assertThat(ToolCapability.values()).extracting(ToolCapability::toolName)
                .containsExactly("matcher", "email_drafter");
        assertThat(ToolCapability.fromToolName("email_drafter")).contains(ToolCapability.EMAIL_DRAFTER);
        assertThat(ToolCapability.fromToolName("shell")).isEmpty();
    }

    @Test
    @DisplayName("Should treat null arguments as a type error")
    void shouldRejectNullArgument() {
        assertThatThrownBy(() -> guardrail.invoke("matcher", "INV0012", null, "data", "model.json"))
                .isInstanceOf(ToolArgumentException.class)
                .hasMessageContaining("poNumber");

        verifyNoInteractions(matcher);
    }
}

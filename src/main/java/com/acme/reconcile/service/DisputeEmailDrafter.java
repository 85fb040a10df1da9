package com.acme.reconcile.service;

import com.acme.reconcile.config.ReconcileProperties;
import com.acme.reconcile.domain.MatchFacts;
import com.acme.reconcile.domain.MatchIssue;
import com.acme.reconcile.domain.MatchStatus;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Locale;
import java.util.stream.Collectors;

/**
 * The email drafter capability: renders a vendor email for a reconciled invoice.
 * <p>
 * Tone follows the verdict. Mismatches get an urgent draft with a five business day
 * window and a payment hold, partial matches a review request with seven business days,
 * anything else an informational note that does not hold payment. Drafts are never sent
 * from here.
 */
@Component
public class DisputeEmailDrafter {

    static final String NO_ISSUE_BULLET = "General compliance review as part of our standard process";

    private final ReconcileProperties.Email email;

    public DisputeEmailDrafter(ReconcileProperties properties) {
        this.email = properties.getEmail();
    }

    public String draft(String vendorName, String invoiceId, String poNumber, MatchFacts facts, MatchStatus status) {
        MatchFacts effective = MatchFacts.orDefaults(facts);
        Tone tone = Tone.of(status);

        List<MatchIssue> issues = MatchIssue.detect(effective);
        String bullets = issues.isEmpty()
                ? "• " + NO_ISSUE_BULLET
                : issues.stream().map(issue -> "• " + issue.emailBullet(effective)).collect(Collectors.joining("\n"));

        return """
                Subject: %s - Invoice %s / PO %s

                Dear %s,

                %s

                %s

                Invoice Details:
                - Invoice ID: %s
                - PO Number: %s
                - Amount Delta: $%s
                - Vendor Match: %s
                - GRN Available: %s
                - PO Status: %s

                %s

                If you have any questions, please contact our Accounts Payable team at %s or call %s.

                Best regards,
                Accounts Payable Department
                %s
                """.formatted(
                tone.subjectPrefix, invoiceId, poNumber,
                vendorName,
                tone.opening,
                bullets,
                invoiceId,
                poNumber,
                String.format(Locale.ROOT, "%.2f", effective.amountDelta()),
                effective.vendorMatch() ? "Yes" : "No",
                effective.hasGrn() ? "Yes" : "No",
                effective.poMissing() ? "Missing" : "Found",
                tone.action,
                email.getApEmail(), email.getApPhone(),
                email.getCompanyName());
    }

    private enum Tone {
        URGENT("URGENT: Invoice Discrepancy",
                "We have identified significant discrepancies that require immediate attention:",
                "Please provide corrected documentation or explanation within 5 business days. "
                        + "Payment is currently on hold."),
        REVIEW("Review Required",
                "We are reviewing your invoice and need clarification on the following items:",
                "Please review and provide supporting documentation or confirmation within 7 business days."),
        INFORMATIONAL("Clarification Requested",
                "We are processing your invoice and would appreciate clarification on minor items:",
                "Please provide any additional documentation at your convenience. "
                        + "This will not delay payment processing.");

        private final String subjectPrefix;
        private final String opening;
        private final String action;

        Tone(String subjectPrefix, String opening, String action) {
            this.subjectPrefix = subjectPrefix;
            this.opening = opening;
            this.action = action;
        }

        static Tone of(MatchStatus status) {
            if (status == MatchStatus.MISMATCH) {
                return URGENT;
            }
            if (status == MatchStatus.PARTIAL) {
                return REVIEW;
            }
            return INFORMATIONAL;
        }
    }
}

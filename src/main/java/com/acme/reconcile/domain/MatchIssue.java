package com.acme.reconcile.domain;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * Issues that can be reported for a pair, in reporting order.
 * Each issue has a short phrasing for explanations and a bullet phrasing for vendor emails.
 */
public enum MatchIssue {

    PO_MISSING {
        @Override
        boolean appliesTo(MatchFacts facts) {
            return facts.poMissing();
        }

        @Override
        public String describe(MatchFacts facts) {
            return "PO reference was not found";
        }

        @Override
        public String emailBullet(MatchFacts facts) {
            return "PO reference could not be located in our system";
        }
    },

    VENDOR_MISMATCH {
        @Override
        boolean appliesTo(MatchFacts facts) {
            return !facts.vendorMatch();
        }

        @Override
        public String describe(MatchFacts facts) {
            return "Vendor on invoice does not match vendor on PO";
        }

        @Override
        public String emailBullet(MatchFacts facts) {
            return "Vendor information does not match our PO records";
        }
    },

    AMOUNT_DISCREPANCY {
        @Override
        boolean appliesTo(MatchFacts facts) {
            return Math.abs(facts.amountDelta()) > AMOUNT_TOLERANCE;
        }

        @Override
        public String describe(MatchFacts facts) {
            return String.format(Locale.ROOT, "Amount discrepancy of %.2f", facts.amountDelta());
        }

        @Override
        public String emailBullet(MatchFacts facts) {
            return String.format(Locale.ROOT, "Amount discrepancy of $%.2f detected", facts.amountDelta());
        }
    },

    GRN_MISSING {
        @Override
        boolean appliesTo(MatchFacts facts) {
            return !facts.hasGrn();
        }

        @Override
        public String describe(MatchFacts facts) {
            return "No GRN found for this PO";
        }

        @Override
        public String emailBullet(MatchFacts facts) {
            return "No goods receipt (GRN) found for the referenced PO";
        }
    },

    TIMING_CONCERN {
        @Override
        boolean appliesTo(MatchFacts facts) {
            return Math.abs(facts.daysDelta()) > TIMING_THRESHOLD_DAYS;
        }

        @Override
        public String describe(MatchFacts facts) {
            return String.format(Locale.ROOT, "Invoice timing concern: %.0f days from PO date",
                    Math.abs(facts.daysDelta()));
        }

        @Override
        public String emailBullet(MatchFacts facts) {
            return String.format(Locale.ROOT, "Timing discrepancy: Invoice issued %.0f days from the PO date",
                    Math.abs(facts.daysDelta()));
        }
    };

    /** Amount differences at or below this are rounding noise. */
    public static final double AMOUNT_TOLERANCE = 0.01;

    public static final double TIMING_THRESHOLD_DAYS = 30;

    abstract boolean appliesTo(MatchFacts facts);

    public abstract String describe(MatchFacts facts);

    public abstract String emailBullet(MatchFacts facts);

    /**
     * Lists the issues present in the given facts; null facts are read as defaults.
     */
    public static List<MatchIssue> detect(MatchFacts facts) {
        MatchFacts effective = MatchFacts.orDefaults(facts);
        List<MatchIssue> issues = new ArrayList<>();
        for (MatchIssue issue : values()) {
            if (issue.appliesTo(effective)) {
                issues.add(issue);
            }
        }
        return issues;
    }
}

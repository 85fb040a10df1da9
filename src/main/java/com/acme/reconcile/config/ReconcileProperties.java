package com.acme.reconcile.config;

import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Settings bound from the {@code reconcile.*} namespace.
 */
@Getter
@Setter
@ConfigurationProperties(prefix = "reconcile")
public class ReconcileProperties {

    private String dataDir = "./data";
    private String modelPath = "./reports/matcher_model.json";
    private String outputDir = "./reports";

    /** Matches below this confidence still get a follow-up email. */
    private double minConfidence = 0.75;

    private Files files = new Files();
    private Training training = new Training();
    private Synthetic synthetic = new Synthetic();
    private Email email = new Email();

    @Getter
    @Setter
    public static class Files {
        private String invoices = "invoices.csv";
        private String purchaseOrders = "po_grn.csv";
        private String mismatches = "labelled_mismatches.csv";
    }

    @Getter
    @Setter
    public static class Training {
        private long seed = 42L;
        private double testSize = 0.2;
        /** L2 penalty of the logistic regression. */
        private double lambda = 0.1;
        private double tolerance = 1E-5;
        private int maxIterations = 2000;
        /** Each positive row is replicated this many times in the training split. */
        private int positiveClassWeight = 2;
    }

    /**
     * Offline evaluation only. The seed is independent of the training split seed.
     */
    @Getter
    @Setter
    public static class Synthetic {
        private boolean enabled = false;
        private long seed = 7L;
    }

    @Getter
    @Setter
    public static class Email {
        private String companyName = "Acme Manufacturing";
        private String apEmail = "ap@acme-manufacturing.com";
        private String apPhone = "(555) 123-4567";
    }
}

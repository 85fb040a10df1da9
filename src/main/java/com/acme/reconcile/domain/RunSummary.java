package com.acme.reconcile.domain;

import io.swagger.v3.oas.annotations.media.Schema;

/**
 * Counts over all tasks of a run, produced at the approval checkpoint.
 */
@Schema(description = "Summary of a reconciliation run")
public record RunSummary(
    int total,
    int cleanMatches,
    int partialMatches,
    int mismatches,
    int emailsToSend,
    int failed,
    boolean approvalRequired
) {}

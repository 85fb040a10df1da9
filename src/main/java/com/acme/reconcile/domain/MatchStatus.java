package com.acme.reconcile.domain;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

/**
 * Business verdict for an invoice / purchase order pair.
 */
public enum MatchStatus {
    MATCH("match"),
    PARTIAL("partial"),
    MISMATCH("mismatch");

    private final String value;

    MatchStatus(String value) {
        this.value = value;
    }

    @JsonValue
    public String value() {
        return value;
    }

    @JsonCreator
    public static MatchStatus fromValue(String value) {
        if (value != null) {
            String lower = value.toLowerCase(Locale.ROOT);
            for (MatchStatus status : values()) {
                if (status.value.equals(lower)) {
                    return status;
                }
            }
        }
        throw new IllegalArgumentException("Invalid status: " + value);
    }
}

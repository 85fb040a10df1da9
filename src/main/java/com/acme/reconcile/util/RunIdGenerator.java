package com.acme.reconcile.util;

import org.springframework.stereotype.Component;

import java.util.UUID;
import java.util.concurrent.ThreadLocalRandom;

/**
 * Generates identifiers for reconciliation runs.
 * <p>
 * Kept as a component so tests can pin run ids with a mock.
 * Stateless; uses ThreadLocalRandom for UUID v4 generation.
 */
@Component
public class RunIdGenerator {

    /**
     * Generates a new run id in canonical UUID format (lowercase, hyphenated).
     */
    public String generate() {
        ThreadLocalRandom random = ThreadLocalRandom.current();
        long msb = random.nextLong();
        long lsb = random.nextLong();
        // version 4
        msb = (msb & 0xffffffffffff0fffL) | 0x0000000000004000L;
        // IETF variant
        lsb = (lsb & 0x3fffffffffffffffL) | 0x8000000000000000L;
        return new UUID(msb, lsb).toString();
    }
}

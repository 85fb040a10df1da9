package com.acme.reconcile.util;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.HashSet;
import java.util.Set;
import java.util.UUID;

import static org.assertj.core.api.Assertions.assertThat;

@DisplayName("RunIdGenerator Unit Tests")
class RunIdGeneratorTest {

    private RunIdGenerator runIdGenerator;

    @BeforeEach
    void setUp() {
        runIdGenerator = new RunIdGenerator();
    }

    @Test
    @DisplayName("Should generate canonical version 4 UUIDs")
    void shouldGenerateVersion4Uuid() {
        // When
        String runId = runIdGenerator.generate();

        // Then
        assertThat(runId).matches("[0-9a-f]{8}-[0-9a-f]{4}-4[0-9a-f]{3}-[89ab][0-9a-f]{3}-[0-9a-f]{12}");
        assertThat(UUID.fromString(runId).version()).isEqualTo(4);
    }

    @Test
    @DisplayName("Should generate unique run ids")
    void shouldGenerateUniqueRunIds() {
        // Given
        Set<String> ids = new HashSet<>();

        // When
        for (int i = 0; i < 5000; i++) {
            ids.add(runIdGenerator.generate());
        }

        // Then
        assertThat(ids).hasSize(5000);
    }
}

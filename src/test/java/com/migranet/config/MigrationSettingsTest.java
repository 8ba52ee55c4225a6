package com.migranet.config;

import org.junit.jupiter.api.Test;

import java.time.Duration;

import static org.junit.jupiter.api.Assertions.*;

class MigrationSettingsTest {

    @Test
    void defaults() {
        MigrationSettings s = MigrationSettings.builder().build();

        assertEquals(3, s.getMaxAttempts());
        assertEquals(3, s.getMemorySolutionLimit());
        assertEquals(5, s.getWarningThreshold());
        assertEquals(5, s.getPatternLimit());
        assertEquals("dbo", s.getTargetSchema());
        assertEquals(Duration.ofSeconds(60), s.getDeploymentTimeout());
        assertEquals(1, s.getFlushEvery());
        assertTrue(s.isReviewEnabled());
    }

    @Test
    void attemptBudgetMustBeWithinRange() {
        assertThrows(IllegalArgumentException.class, () -> MigrationSettings.builder().maxAttempts(0).build());
        assertThrows(IllegalArgumentException.class, () -> MigrationSettings.builder().maxAttempts(11).build());
        assertEquals(10, MigrationSettings.builder().maxAttempts(10).build().getMaxAttempts());
    }

    @Test
    void negativeLimitsAreRejected() {
        assertThrows(IllegalArgumentException.class, () -> MigrationSettings.builder().warningThreshold(-1).build());
        assertThrows(IllegalArgumentException.class, () -> MigrationSettings.builder().patternLimit(-1).build());
    }

    @Test
    void timeoutsMustBePositive() {
        assertThrows(IllegalArgumentException.class,
                () -> MigrationSettings.builder().deploymentTimeout(Duration.ZERO).build());
        assertThrows(IllegalArgumentException.class,
                () -> MigrationSettings.builder().searchTimeout(null).build());
    }

    @Test
    void flushEveryMustBePositive() {
        assertThrows(IllegalArgumentException.class, () -> MigrationSettings.builder().flushEvery(0).build());
    }

    @Test
    void blankTargetSchemaFallsBackToDbo() {
        assertEquals("dbo", MigrationSettings.builder().targetSchema(" ").build().getTargetSchema());
    }

    @Test
    void modeNamesIgnoreCaseAndRejectUnknownValues() {
        assertTrue(new ConversionModeResolver("primary-first").isPrimaryFirst());
        assertTrue(new ConversionModeResolver(" FALLBACK_ONLY ").isFallbackOnly());
        IllegalArgumentException e = assertThrows(IllegalArgumentException.class,
                () -> new ConversionModeResolver("sometimes"));
        assertTrue(e.getMessage().contains("migranet.conversion.mode"));
        assertTrue(e.getMessage().contains("FALLBACK_ONLY"));
    }
}

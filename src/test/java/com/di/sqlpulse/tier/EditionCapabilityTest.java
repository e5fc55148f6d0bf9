package com.di.sqlpulse.tier;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("EditionCapability Tests")
class EditionCapabilityTest {

    @ParameterizedTest(name = "\"{0}\" -> {1}")
    @DisplayName("Should map declared editions to capabilities")
    @CsvSource({
            "Enterprise Edition,            FULL_FEATURED",
            "Oracle Database 19c Enterprise, FULL_FEATURED",
            "Standard Edition 2,            LIMITED",
            "Express Edition,               LIMITED",
            "Personal Edition,              LIMITED",
            "Autonomous,                    UNKNOWN",
            "'',                            UNKNOWN"
    })
    void testFromEdition(String edition, EditionCapability expected) {
        assertEquals(expected, EditionCapability.fromEdition(edition));
    }

    @Test
    @DisplayName("Should treat a missing edition as unknown")
    void testFromEdition_Null() {
        assertEquals(EditionCapability.UNKNOWN, EditionCapability.fromEdition(null));
    }

    @Test
    @DisplayName("Should only rule out the snapshot repository for limited editions")
    void testAllowsHistoricalRepository() {
        assertTrue(EditionCapability.FULL_FEATURED.allowsHistoricalRepository());
        assertTrue(EditionCapability.UNKNOWN.allowsHistoricalRepository());
        assertFalse(EditionCapability.LIMITED.allowsHistoricalRepository());
    }
}

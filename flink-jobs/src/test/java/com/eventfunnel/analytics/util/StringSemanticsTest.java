package com.eventfunnel.analytics.util;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertTrue;

class StringSemanticsTest {

    @Test
    void isBlankCoversNullWhitespaceAndNonBlank() {
        assertTrue(StringSemantics.isBlank(null));
        assertTrue(StringSemantics.isBlank(""));
        assertTrue(StringSemantics.isBlank(" \t"));
        assertFalse(StringSemantics.isBlank("US"));
    }

    @Test
    void trimToNullTrimsValuesAndNullsBlanks() {
        assertNull(StringSemantics.trimToNull("   "));
        assertEquals("CA", StringSemantics.trimToNull(" CA "));
    }

    @Test
    void orDefaultFallsBackOnlyForBlankValues() {
        assertEquals("UNKNOWN", StringSemantics.orDefault(" ", "UNKNOWN"));
        assertEquals("DE", StringSemantics.orDefault("DE", "UNKNOWN"));
    }
}

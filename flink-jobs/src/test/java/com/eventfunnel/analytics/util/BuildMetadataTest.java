package com.eventfunnel.analytics.util;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNotNull;

class BuildMetadataTest {

    @Test
    void unfilteredPlaceholdersFallBackToDefaults() {
        BuildMetadata metadata = new BuildMetadata("${project.version}", " ");

        assertEquals("dev", metadata.version());
        assertEquals("unknown", metadata.gitCommit());
        assertEquals("dev+unknown", metadata.identity());
    }

    @Test
    void filteredValuesAreTrimmed() {
        BuildMetadata metadata = new BuildMetadata(" 0.1.0 ", "abc123");

        assertEquals("0.1.0+abc123", metadata.identity());
    }

    @Test
    void currentIsAlwaysAvailable() {
        assertNotNull(BuildMetadata.current().identity());
    }
}

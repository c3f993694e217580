package com.eventfunnel.analytics.util;

import java.io.IOException;
import java.io.InputStream;
import java.util.Properties;

/**
 * Build identity of the running artifact, read from the Maven-filtered {@code build-info.properties}.
 */
public final class BuildMetadata {
    private static final org.slf4j.Logger LOG = org.slf4j.LoggerFactory.getLogger(BuildMetadata.class);

    private static final String BUILD_INFO_RESOURCE = "build-info.properties";
    private static final BuildMetadata INSTANCE = load();

    private final String version;
    private final String gitCommit;

    BuildMetadata(String version, String gitCommit) {
        this.version = normalize(version, "dev");
        this.gitCommit = normalize(gitCommit, "unknown");
    }

    public static BuildMetadata current() {
        return INSTANCE;
    }

    public String version() {
        return version;
    }

    public String gitCommit() {
        return gitCommit;
    }

    public String identity() {
        return version + "+" + gitCommit;
    }

    private static BuildMetadata load() {
        Properties props = new Properties();
        try (InputStream in = BuildMetadata.class.getClassLoader().getResourceAsStream(BUILD_INFO_RESOURCE)) {
            if (in != null) {
                props.load(in);
            }
        } catch (IOException ex) {
            // Reports still run without build identity.
            LOG.debug("Build metadata unavailable: {}", ex.getMessage());
        }
        return new BuildMetadata(props.getProperty("build.version"), props.getProperty("build.git.commit"));
    }

    // Unfiltered placeholders (e.g. running from the IDE) count as missing.
    private static String normalize(String value, String fallback) {
        String trimmed = StringSemantics.trimToNull(value);
        if (trimmed == null || (trimmed.startsWith("${") && trimmed.endsWith("}"))) {
            return fallback;
        }
        return trimmed;
    }
}

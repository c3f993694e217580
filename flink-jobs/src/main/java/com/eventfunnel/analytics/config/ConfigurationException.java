package com.eventfunnel.analytics.config;

/**
 * Raised for an invalid funnel definition or run configuration. Always thrown before any input is read.
 */
public class ConfigurationException extends IllegalArgumentException {
    private static final long serialVersionUID = 1L;

    public ConfigurationException(String message) {
        super(message);
    }

    public ConfigurationException(String message, Throwable cause) {
        super(message, cause);
    }
}

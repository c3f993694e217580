package com.eventfunnel.analytics.config;

import com.fasterxml.jackson.databind.JsonNode;

import com.eventfunnel.analytics.util.JsonSupport;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

/**
 * Loads the funnel definition from classpath or filesystem.
 *
 * Lookup order:
 * 1) JVM property `funnel.definition.path`
 * 2) classpath resource `reference/funnel_definition.v1.json`
 */
public final class FunnelDefinitionLoader {
    public static final String DEFINITION_PROPERTY = "funnel.definition.path";
    public static final String DEFAULT_CLASSPATH_RESOURCE = "reference/funnel_definition.v1.json";

    private static final org.slf4j.Logger LOG = org.slf4j.LoggerFactory.getLogger(FunnelDefinitionLoader.class);

    private FunnelDefinitionLoader() {}

    public static FunnelDefinition loadDefault() {
        String overridePath = System.getProperty(DEFINITION_PROPERTY);
        if (overridePath != null && !overridePath.isBlank()) {
            return loadFromFile(Path.of(overridePath));
        }

        FunnelDefinition fromClasspath = loadFromClasspath(DEFAULT_CLASSPATH_RESOURCE);
        if (fromClasspath == null) {
            throw new ConfigurationException("Funnel definition resource not found: " + DEFAULT_CLASSPATH_RESOURCE);
        }
        return fromClasspath;
    }

    static FunnelDefinition loadFromClasspath(String resourcePath) {
        try (InputStream in = FunnelDefinitionLoader.class.getClassLoader().getResourceAsStream(resourcePath)) {
            if (in == null) {
                return null;
            }
            JsonNode root = JsonSupport.MAPPER.readTree(in);
            FunnelDefinition definition = parseDefinition(root);
            LOG.info("Loaded funnel definition {} from classpath {}", definition, resourcePath);
            return definition;
        } catch (IOException ex) {
            throw new IllegalStateException("Failed to load funnel definition from classpath: " + resourcePath, ex);
        }
    }

    static FunnelDefinition loadFromFile(Path path) {
        if (!Files.exists(path)) {
            throw new ConfigurationException("Funnel definition file not found: " + path);
        }
        try {
            JsonNode root = JsonSupport.MAPPER.readTree(path.toFile());
            FunnelDefinition definition = parseDefinition(root);
            LOG.info("Loaded funnel definition {} from {}", definition, path);
            return definition;
        } catch (IOException ex) {
            throw new IllegalStateException("Failed to load funnel definition from file: " + path, ex);
        }
    }

    static FunnelDefinition parseDefinition(JsonNode root) {
        if (root == null || !root.isObject()) {
            throw new ConfigurationException("Funnel definition is not a JSON object");
        }
        JsonNode stepsNode = root.path("steps");
        if (!stepsNode.isArray()) {
            throw new ConfigurationException("Funnel definition missing steps array");
        }
        List<String> steps = new ArrayList<>();
        for (JsonNode step : stepsNode) {
            if (!step.isTextual()) {
                throw new ConfigurationException("Funnel step must be a string: " + step);
            }
            steps.add(step.asText());
        }
        return FunnelDefinition.of(root.path("name").asText("funnel"), steps);
    }
}

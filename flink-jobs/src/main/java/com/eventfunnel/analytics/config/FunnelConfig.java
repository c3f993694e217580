package com.eventfunnel.analytics.config;

import java.util.Arrays;
import java.util.List;
import java.util.function.Function;

/**
 * Centralized configuration for a funnel run, sourced from environment variables or built programmatically.
 * Every instance is validated on construction, so an invalid configuration never reaches the input.
 */
public class FunnelConfig implements java.io.Serializable {
    private static final long serialVersionUID = 1L;

    public static final int DEFAULT_TOP_N_GROUPS = 3;
    public static final String DEFAULT_UNKNOWN_GROUP_LABEL = "UNKNOWN";
    public static final int DEFAULT_REJECTED_SAMPLE_SIZE = 20;
    public static final int UNLIMITED = -1;

    public final FunnelDefinition funnelDefinition;
    public final int topNGroups;
    public final String unknownGroupLabel;
    public final RankingMetric rankingMetric;
    public final TimestampUnit timestampUnit;
    public final int maxDroppedRecords;
    public final int rejectedSampleSize;

    public final String inputPath;
    public final String outputDir;
    public final int parallelism;

    private FunnelConfig(Builder builder) {
        if (builder.funnelDefinition == null) {
            throw new ConfigurationException("Funnel definition is required");
        }
        if (builder.topNGroups <= 0) {
            throw new ConfigurationException("top_n_groups must be positive, got " + builder.topNGroups);
        }
        if (builder.unknownGroupLabel == null || builder.unknownGroupLabel.isBlank()) {
            throw new ConfigurationException("unknown_group_label must not be blank");
        }
        if (builder.maxDroppedRecords < UNLIMITED) {
            throw new ConfigurationException("max_dropped_records must be -1 (unlimited) or >= 0, got "
                    + builder.maxDroppedRecords);
        }
        if (builder.rejectedSampleSize < 0) {
            throw new ConfigurationException("rejected_sample_size must be >= 0, got " + builder.rejectedSampleSize);
        }
        if (builder.parallelism <= 0) {
            throw new ConfigurationException("parallelism must be positive, got " + builder.parallelism);
        }
        this.funnelDefinition = builder.funnelDefinition;
        this.topNGroups = builder.topNGroups;
        this.unknownGroupLabel = builder.unknownGroupLabel;
        this.rankingMetric = builder.rankingMetric == null ? RankingMetric.EVENT_COUNT : builder.rankingMetric;
        this.timestampUnit = builder.timestampUnit == null ? TimestampUnit.MILLIS : builder.timestampUnit;
        this.maxDroppedRecords = builder.maxDroppedRecords;
        this.rejectedSampleSize = builder.rejectedSampleSize;
        this.inputPath = builder.inputPath;
        this.outputDir = builder.outputDir;
        this.parallelism = builder.parallelism;
    }

    public static Builder builder(FunnelDefinition funnelDefinition) {
        return new Builder(funnelDefinition);
    }

    public static FunnelConfig of(FunnelDefinition funnelDefinition, int topNGroups) {
        return builder(funnelDefinition).topNGroups(topNGroups).build();
    }

    public static FunnelConfig fromEnv() {
        return fromLookup(System::getenv);
    }

    static FunnelConfig fromLookup(Function<String, String> env) {
        String rawSteps = env.apply("FUNNEL_STEPS");
        FunnelDefinition definition = rawSteps == null || rawSteps.isBlank()
                ? FunnelDefinitionLoader.loadDefault()
                : FunnelDefinition.of(value(env, "FUNNEL_NAME", "funnel"), splitList(rawSteps));

        return builder(definition)
                .topNGroups(intValue(env, "FUNNEL_TOP_N_GROUPS", DEFAULT_TOP_N_GROUPS))
                .unknownGroupLabel(value(env, "FUNNEL_UNKNOWN_GROUP_LABEL", DEFAULT_UNKNOWN_GROUP_LABEL))
                .rankingMetric(RankingMetric.parse(value(env, "FUNNEL_RANKING_METRIC", RankingMetric.EVENT_COUNT.name())))
                .timestampUnit(TimestampUnit.parse(value(env, "FUNNEL_TIMESTAMP_UNIT", TimestampUnit.MILLIS.name())))
                .maxDroppedRecords(intValue(env, "FUNNEL_MAX_DROPPED_RECORDS", UNLIMITED))
                .rejectedSampleSize(intValue(env, "FUNNEL_REJECTED_SAMPLE_SIZE", DEFAULT_REJECTED_SAMPLE_SIZE))
                .inputPath(value(env, "FUNNEL_INPUT_PATH", "events.jsonl"))
                .outputDir(value(env, "FUNNEL_OUTPUT_DIR", "funnel-report"))
                .parallelism(intValue(env, "FUNNEL_PARALLELISM", 1))
                .build();
    }

    private static String value(Function<String, String> env, String key, String defaultValue) {
        String value = env.apply(key);
        return value == null || value.isEmpty() ? defaultValue : value;
    }

    private static int intValue(Function<String, String> env, String key, int defaultValue) {
        String value = env.apply(key);
        if (value == null || value.isEmpty()) {
            return defaultValue;
        }
        try {
            return Integer.parseInt(value.trim());
        } catch (NumberFormatException ex) {
            throw new ConfigurationException(key + " is not an integer: " + value, ex);
        }
    }

    private static List<String> splitList(String raw) {
        return Arrays.asList(raw.trim().split("\\s*,\\s*"));
    }

    @Override
    public String toString() {
        return "FunnelConfig{funnel=" + funnelDefinition
                + ", topNGroups=" + topNGroups
                + ", unknownGroupLabel=" + unknownGroupLabel
                + ", rankingMetric=" + rankingMetric
                + ", timestampUnit=" + timestampUnit
                + ", maxDroppedRecords=" + maxDroppedRecords + "}";
    }

    public static final class Builder {
        private final FunnelDefinition funnelDefinition;
        private int topNGroups = DEFAULT_TOP_N_GROUPS;
        private String unknownGroupLabel = DEFAULT_UNKNOWN_GROUP_LABEL;
        private RankingMetric rankingMetric = RankingMetric.EVENT_COUNT;
        private TimestampUnit timestampUnit = TimestampUnit.MILLIS;
        private int maxDroppedRecords = UNLIMITED;
        private int rejectedSampleSize = DEFAULT_REJECTED_SAMPLE_SIZE;
        private String inputPath;
        private String outputDir;
        private int parallelism = 1;

        private Builder(FunnelDefinition funnelDefinition) {
            this.funnelDefinition = funnelDefinition;
        }

        public Builder topNGroups(int topNGroups) {
            this.topNGroups = topNGroups;
            return this;
        }

        public Builder unknownGroupLabel(String unknownGroupLabel) {
            this.unknownGroupLabel = unknownGroupLabel;
            return this;
        }

        public Builder rankingMetric(RankingMetric rankingMetric) {
            this.rankingMetric = rankingMetric;
            return this;
        }

        public Builder timestampUnit(TimestampUnit timestampUnit) {
            this.timestampUnit = timestampUnit;
            return this;
        }

        public Builder maxDroppedRecords(int maxDroppedRecords) {
            this.maxDroppedRecords = maxDroppedRecords;
            return this;
        }

        public Builder rejectedSampleSize(int rejectedSampleSize) {
            this.rejectedSampleSize = rejectedSampleSize;
            return this;
        }

        public Builder inputPath(String inputPath) {
            this.inputPath = inputPath;
            return this;
        }

        public Builder outputDir(String outputDir) {
            this.outputDir = outputDir;
            return this;
        }

        public Builder parallelism(int parallelism) {
            this.parallelism = parallelism;
            return this;
        }

        public FunnelConfig build() {
            return new FunnelConfig(this);
        }
    }
}

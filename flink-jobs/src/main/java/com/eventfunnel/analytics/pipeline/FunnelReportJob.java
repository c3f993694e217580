package com.eventfunnel.analytics.pipeline;

import org.apache.flink.api.common.RuntimeExecutionMode;
import org.apache.flink.api.common.typeinfo.TypeInformation;
import org.apache.flink.api.common.typeinfo.Types;
import org.apache.flink.streaming.api.datastream.DataStream;
import org.apache.flink.streaming.api.environment.StreamExecutionEnvironment;
import org.apache.flink.util.CloseableIterator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.eventfunnel.analytics.config.FunnelConfig;
import com.eventfunnel.analytics.dedup.DedupKey;
import com.eventfunnel.analytics.dedup.EarliestEventProcessFunction;
import com.eventfunnel.analytics.funnel.FunnelEngine;
import com.eventfunnel.analytics.funnel.FunnelReport;
import com.eventfunnel.analytics.model.EventRecord;
import com.eventfunnel.analytics.quality.EventRecordNormalizer;
import com.eventfunnel.analytics.util.BuildMetadata;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.stream.Stream;

/**
 * Batch funnel report job:
 * - Read the NDJSON event log and normalize rows (malformed rows dropped and sampled)
 * - Deduplicate on Flink, partitioned by (user, event type)
 * - Rank groups, aggregate the funnel and derive conversion rates on the collected result
 * - Write the report tables as JSON-each-row files
 */
public class FunnelReportJob {
    private static final Logger LOG = LoggerFactory.getLogger(FunnelReportJob.class);

    public static void main(String[] args) throws Exception {
        FunnelConfig config = FunnelConfig.fromEnv();
        LOG.info("Starting funnel report job (build={}, inputPath={}, outputDir={}, config={})",
                BuildMetadata.current().identity(), config.inputPath, config.outputDir, config);

        FunnelEngine engine = new FunnelEngine(config);
        EventRecordNormalizer normalizer = new EventRecordNormalizer(config);
        List<EventRecord> records = new ArrayList<>();
        try (Stream<String> lines = EventLogReader.lines(Path.of(config.inputPath))) {
            normalizer.normalizeLines(lines.iterator()).forEachRemaining(records::add);
        }
        normalizer.diagnostics().enforceBudget(config.maxDroppedRecords);

        StreamExecutionEnvironment env = StreamExecutionEnvironment.getExecutionEnvironment();
        env.setRuntimeMode(RuntimeExecutionMode.BATCH);
        env.setParallelism(config.parallelism);

        List<EventRecord> deduped = deduplicate(env, records);
        FunnelReport report = engine.summarize(deduped, normalizer.diagnostics());
        FunnelReportWriter.write(report, Path.of(config.outputDir));
    }

    /**
     * Runs the keyed deduplication stage and collects its output, ordered by input position.
     */
    static List<EventRecord> deduplicate(StreamExecutionEnvironment env, List<EventRecord> records) throws Exception {
        List<EventRecord> result = new ArrayList<>();
        if (records.isEmpty()) {
            // fromCollection rejects an empty collection.
            return result;
        }

        DataStream<EventRecord> deduped = env
                .fromCollection(records, TypeInformation.of(EventRecord.class))
                .name("Normalized Events")
                .keyBy(DedupKey::keyOf, Types.STRING)
                .process(new EarliestEventProcessFunction())
                .returns(EventRecord.class)
                .name("Dedup: Earliest Event");

        try (CloseableIterator<EventRecord> iterator = deduped.executeAndCollect("Funnel Dedup")) {
            iterator.forEachRemaining(result::add);
        }
        result.sort(Comparator.comparingLong(EventRecord::sequence));
        LOG.info("Deduplicated {} records into {} (user, event type) pairs", records.size(), result.size());
        return result;
    }
}

package com.eventfunnel.analytics.pipeline;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import com.eventfunnel.analytics.config.FunnelConfig;
import com.eventfunnel.analytics.config.FunnelDefinition;
import com.eventfunnel.analytics.funnel.FunnelEngine;
import com.eventfunnel.analytics.funnel.FunnelReport;

import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class FunnelReportWriterTest {
    @TempDir
    Path tempDir;

    @Test
    void writesAllReportTables() throws Exception {
        FunnelEngine engine = new FunnelEngine(FunnelConfig.of(FunnelDefinition.of("page_view", "purchase"), 2));
        FunnelReport report = engine.runLines(List.of(
                "{\"user_id\":\"u1\",\"event_type\":\"page_view\",\"timestamp\":1,\"group\":\"US\"}",
                "{\"user_id\":\"u1\",\"event_type\":\"purchase\",\"timestamp\":2,\"group\":\"US\"}",
                "{\"user_id\":\"u2\",\"event_type\":\"page_view\",\"timestamp\":3,\"group\":\"CA\"}",
                "{broken").iterator());

        Path outputDir = tempDir.resolve("report");
        FunnelReportWriter.write(report, outputDir);

        List<String> counts = Files.readAllLines(outputDir.resolve(FunnelReportWriter.FUNNEL_COUNTS_FILE), StandardCharsets.UTF_8);
        assertEquals(4, counts.size());
        assertEquals("{\"group\":\"US\",\"step_index\":1,\"event_type\":\"page_view\",\"user_count\":1}", counts.get(0));

        List<String> rates = Files.readAllLines(outputDir.resolve(FunnelReportWriter.CONVERSION_RATES_FILE), StandardCharsets.UTF_8);
        assertEquals(4, rates.size());

        List<String> totals = Files.readAllLines(outputDir.resolve(FunnelReportWriter.GROUP_TOTALS_FILE), StandardCharsets.UTF_8);
        assertEquals("{\"group\":\"US\",\"metric\":\"EVENT_COUNT\",\"total\":2}", totals.get(0));
        assertEquals("{\"group\":\"CA\",\"metric\":\"EVENT_COUNT\",\"total\":1}", totals.get(1));

        List<String> rejected = Files.readAllLines(outputDir.resolve(FunnelReportWriter.REJECTED_RECORDS_FILE), StandardCharsets.UTF_8);
        assertEquals(1, rejected.size());
        assertTrue(rejected.get(0).contains("json_parse_error"));
    }

    @Test
    void reportFilesDependOnlyOnInput() throws Exception {
        FunnelEngine engine = new FunnelEngine(FunnelConfig.of(FunnelDefinition.of("page_view", "purchase"), 2));
        List<String> lines = List.of(
                "{\"user_id\":\"u1\",\"event_type\":\"page_view\",\"timestamp\":1,\"group\":\"US\"}",
                "{\"user_id\":\"u2\",\"event_type\":\"page_view\"}",
                "{broken");

        Path first = tempDir.resolve("first");
        Path second = tempDir.resolve("second");
        FunnelReportWriter.write(engine.runLines(lines.iterator()), first);
        Thread.sleep(5L);
        FunnelReportWriter.write(engine.runLines(lines.iterator()), second);

        for (String file : List.of(FunnelReportWriter.FUNNEL_COUNTS_FILE, FunnelReportWriter.CONVERSION_RATES_FILE,
                FunnelReportWriter.GROUP_TOTALS_FILE, FunnelReportWriter.REJECTED_RECORDS_FILE)) {
            assertEquals(Files.readAllLines(first.resolve(file)), Files.readAllLines(second.resolve(file)), file);
        }
        assertEquals(2, Files.readAllLines(first.resolve(FunnelReportWriter.REJECTED_RECORDS_FILE)).size());
    }

    @Test
    void emptyReportWritesEmptyFiles() throws Exception {
        FunnelEngine engine = new FunnelEngine(FunnelConfig.of(FunnelDefinition.of("page_view", "purchase"), 2));
        FunnelReport report = engine.runLines(List.<String>of().iterator());

        FunnelReportWriter.write(report, tempDir);

        assertTrue(Files.readAllLines(tempDir.resolve(FunnelReportWriter.FUNNEL_COUNTS_FILE)).isEmpty());
        assertTrue(Files.readAllLines(tempDir.resolve(FunnelReportWriter.CONVERSION_RATES_FILE)).isEmpty());
    }
}

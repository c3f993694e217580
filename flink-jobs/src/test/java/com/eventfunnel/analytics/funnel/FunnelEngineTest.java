package com.eventfunnel.analytics.funnel;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.junit.jupiter.api.Test;

import com.eventfunnel.analytics.config.FunnelConfig;
import com.eventfunnel.analytics.config.FunnelDefinition;
import com.eventfunnel.analytics.model.ConversionRow;
import com.eventfunnel.analytics.model.FunnelCount;
import com.eventfunnel.analytics.quality.MalformedRecordException;
import com.eventfunnel.analytics.util.JsonSupport;

import java.io.BufferedReader;
import java.io.InputStreamReader;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class FunnelEngineTest {
    private static final FunnelDefinition VIEW_THEN_BUY = FunnelDefinition.of("page_view", "purchase");

    @Test
    void keepsEarliestViewAndScopesToTopGroups() {
        FunnelEngine engine = new FunnelEngine(FunnelConfig.of(VIEW_THEN_BUY, 2));

        FunnelReport report = engine.run(List.of(
                row("u1", "page_view", 1_000L, "US"),
                row("u1", "page_view", 500L, "US"),
                row("u1", "purchase", 2_000L, "US"),
                row("u2", "page_view", 1_000L, "CA")));

        assertEquals(3, report.dedupedEventCount());
        assertEquals(List.of("US", "CA"), report.topGroups());
        assertEquals(List.of(
                new FunnelCount("US", 1, "page_view", 1),
                new FunnelCount("US", 2, "purchase", 1),
                new FunnelCount("CA", 1, "page_view", 1),
                new FunnelCount("CA", 2, "purchase", 0)), report.funnelCounts());

        ConversionRow usPurchase = report.conversionRows().get(1);
        assertEquals(1.0, usPurchase.stepConversionRate());
        assertEquals(1.0, usPurchase.cumulativeConversionRate());
        assertEquals(0.0, usPurchase.dropOffRate());

        ConversionRow caPurchase = report.conversionRows().get(3);
        assertEquals(0.0, caPurchase.stepConversionRate());
        assertEquals(0.0, caPurchase.cumulativeConversionRate());
        assertEquals(1.0, caPurchase.dropOffRate());
    }

    @Test
    void unattributedEventsFormSingleUnknownGroup() {
        FunnelEngine engine = new FunnelEngine(FunnelConfig.of(VIEW_THEN_BUY, 3));

        FunnelReport report = engine.run(List.of(
                row("u1", "page_view", 1L, null),
                row("u2", "page_view", 2L, null),
                row("u2", "purchase", 3L, null)));

        assertEquals(List.of("UNKNOWN"), report.topGroups());
        assertEquals(2, report.funnelCounts().get(0).userCount());
        assertEquals(1, report.funnelCounts().get(1).userCount());
        assertEquals(0.5, report.conversionRows().get(1).stepConversionRate());
    }

    @Test
    void emptyInputYieldsEmptyReport() {
        FunnelEngine engine = new FunnelEngine(FunnelConfig.of(VIEW_THEN_BUY, 3));

        FunnelReport report = engine.run(new ArrayList<JsonNode>());

        assertTrue(report.topGroups().isEmpty());
        assertTrue(report.funnelCounts().isEmpty());
        assertTrue(report.conversionRows().isEmpty());
        assertEquals(0, report.diagnostics().totalCount());
    }

    @Test
    void runLinesDropsMalformedRowsAndKeepsTheRest() {
        FunnelEngine engine = new FunnelEngine(FunnelConfig.of(VIEW_THEN_BUY, 3));

        FunnelReport report = engine.runLines(List.of(
                "{\"user_id\":\"u1\",\"event_type\":\"page_view\",\"timestamp\":10,\"group\":\"US\"}",
                "not json",
                "",
                "{\"user_id\":\"u2\",\"event_type\":\"page_view\"}",
                "{\"user_id\":\"u1\",\"event_type\":\"purchase\",\"timestamp\":20,\"group\":\"US\"}").iterator());

        assertEquals(2, report.diagnostics().acceptedCount());
        assertEquals(2, report.diagnostics().droppedCount());
        assertEquals(1L, report.diagnostics().droppedByReason().get("json_parse_error"));
        assertEquals(1L, report.diagnostics().droppedByReason().get("missing_timestamp"));
        assertEquals(List.of(
                new FunnelCount("US", 1, "page_view", 1),
                new FunnelCount("US", 2, "purchase", 1)), report.funnelCounts());
    }

    @Test
    void exceedingDropBudgetFailsTheRun() {
        FunnelConfig config = FunnelConfig.builder(VIEW_THEN_BUY).maxDroppedRecords(0).build();
        FunnelEngine engine = new FunnelEngine(config);

        MalformedRecordException ex = assertThrows(MalformedRecordException.class, () -> engine.runLines(List.of(
                "{\"user_id\":\"u1\",\"event_type\":\"page_view\",\"timestamp\":10}",
                "{\"event_type\":\"page_view\",\"timestamp\":10}").iterator()));

        assertEquals(1, ex.droppedCount());
        assertEquals(1, ex.sample().size());
    }

    @Test
    void repeatedRunsAreIndependent() {
        FunnelEngine engine = new FunnelEngine(FunnelConfig.of(VIEW_THEN_BUY, 1));
        List<JsonNode> rows = List.of(row("u1", "page_view", 1L, "US"), row("u2", "page_view", 1L, "US"));

        FunnelReport first = engine.run(rows);
        FunnelReport second = engine.run(rows);

        assertEquals(first.funnelCounts(), second.funnelCounts());
        assertEquals(first.conversionRows(), second.conversionRows());
    }

    @Test
    void sampleLogProducesExpectedFunnel() throws Exception {
        FunnelEngine engine = new FunnelEngine(FunnelConfig.of(
                FunnelDefinition.of("page_view", "add_to_cart", "purchase"), 3));

        FunnelReport report;
        try (BufferedReader reader = new BufferedReader(new InputStreamReader(
                getClass().getClassLoader().getResourceAsStream("events_sample.jsonl"), StandardCharsets.UTF_8))) {
            report = engine.runLines(reader.lines().iterator());
        }

        assertEquals(11, report.dedupedEventCount());
        assertEquals(1L, report.diagnostics().droppedByReason().get("invalid_timestamp"));
        assertEquals(List.of("US", "CA", "BR"), report.topGroups());
        assertEquals(6, report.groupTotals().countOf("US"));

        List<FunnelCount> counts = report.funnelCounts();
        assertEquals(9, counts.size());
        assertEquals(new FunnelCount("US", 1, "page_view", 3), counts.get(0));
        assertEquals(new FunnelCount("US", 2, "add_to_cart", 2), counts.get(1));
        assertEquals(new FunnelCount("US", 3, "purchase", 1), counts.get(2));
        assertEquals(new FunnelCount("CA", 3, "purchase", 0), counts.get(5));
        assertEquals(new FunnelCount("BR", 1, "page_view", 1), counts.get(6));

        ConversionRow usPurchase = report.conversionRows().get(2);
        assertEquals(0.5, usPurchase.stepConversionRate());
        assertEquals(1.0 / 3, usPurchase.cumulativeConversionRate(), 1e-12);
    }

    private static JsonNode row(String userId, String eventType, long timestamp, String group) {
        ObjectNode node = JsonSupport.MAPPER.createObjectNode();
        node.put("user_id", userId);
        node.put("event_type", eventType);
        node.put("timestamp", timestamp);
        if (group == null) {
            node.putNull("group");
        } else {
            node.put("group", group);
        }
        return node;
    }
}

package com.eventfunnel.analytics.pipeline;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.eventfunnel.analytics.funnel.FunnelReport;
import com.eventfunnel.analytics.model.RejectedRecord;
import com.eventfunnel.analytics.ranking.GroupTotal;

import java.io.BufferedWriter;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Collections;
import java.util.List;

/**
 * Writes a funnel report as JSON-each-row files into an output directory.
 */
public final class FunnelReportWriter {
    private static final Logger LOG = LoggerFactory.getLogger(FunnelReportWriter.class);

    public static final String FUNNEL_COUNTS_FILE = "funnel_counts.jsonl";
    public static final String CONVERSION_RATES_FILE = "conversion_rates.jsonl";
    public static final String GROUP_TOTALS_FILE = "group_totals.jsonl";
    public static final String REJECTED_RECORDS_FILE = "rejected_records.jsonl";

    private FunnelReportWriter() {}

    public static void write(FunnelReport report, Path outputDir) {
        try {
            Files.createDirectories(outputDir);
        } catch (IOException ex) {
            throw new IllegalStateException("Failed to create report directory: " + outputDir, ex);
        }
        writeRows(outputDir.resolve(FUNNEL_COUNTS_FILE), report.funnelCounts(), ReportRowMappers::funnelCountRow);
        writeRows(outputDir.resolve(CONVERSION_RATES_FILE), report.conversionRows(), ReportRowMappers::conversionRow);
        String metric = report.groupTotals().metric().name();
        writeRows(outputDir.resolve(GROUP_TOTALS_FILE), report.groupTotals().ranked(),
                total -> groupTotalRow(total, metric));
        writeRows(outputDir.resolve(REJECTED_RECORDS_FILE),
                report.diagnostics() == null ? Collections.<RejectedRecord>emptyList() : report.diagnostics().sample(),
                ReportRowMappers::rejectedRow);
        LOG.info("Wrote funnel report to {} ({} funnel rows, {} conversion rows)",
                outputDir, report.funnelCounts().size(), report.conversionRows().size());
    }

    static <T> void writeRows(Path file, List<T> rows, RowMapper<T> mapper) {
        try (BufferedWriter writer = Files.newBufferedWriter(file, StandardCharsets.UTF_8)) {
            for (T row : rows) {
                writer.write(mapper.map(row));
                writer.newLine();
            }
        } catch (IOException ex) {
            throw new IllegalStateException("Failed to write report file: " + file, ex);
        }
    }

    private static String groupTotalRow(GroupTotal total, String metric) {
        return JsonRow.create()
                .addString("group", total.group())
                .addString("metric", metric)
                .addLong("total", total.count())
                .build();
    }
}

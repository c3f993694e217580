package com.eventfunnel.analytics.quality;

import com.fasterxml.jackson.databind.JsonNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.eventfunnel.analytics.config.FunnelConfig;
import com.eventfunnel.analytics.config.TimestampUnit;
import com.eventfunnel.analytics.model.EventRecord;
import com.eventfunnel.analytics.model.RejectedRecord;
import com.eventfunnel.analytics.util.JsonSupport;

import java.util.Iterator;
import java.util.NoSuchElementException;

/**
 * Quality gate for the raw event log: validates each row and yields an {@link EventRecord}, or drops the row
 * and records a {@link RejectedRecord} in the diagnostics. The returned iterators are lazy and single-pass.
 *
 * <p>One normalizer serves one run; row indexes and diagnostics accumulate across calls.</p>
 */
public class EventRecordNormalizer {
    private static final Logger LOG = LoggerFactory.getLogger(EventRecordNormalizer.class);

    private final RecordValidator validator;
    private final NormalizationDiagnostics diagnostics;
    private long nextRowIndex;

    public EventRecordNormalizer(FunnelConfig config) {
        this(config.timestampUnit, new NormalizationDiagnostics(config.rejectedSampleSize));
    }

    public EventRecordNormalizer(TimestampUnit timestampUnit, NormalizationDiagnostics diagnostics) {
        this.validator = new RecordValidator(timestampUnit);
        this.diagnostics = diagnostics;
        LOG.debug("Normalizer initialized (timestampUnit={})", timestampUnit);
    }

    public NormalizationDiagnostics diagnostics() {
        return diagnostics;
    }

    public Iterator<EventRecord> normalize(Iterator<? extends JsonNode> rows) {
        return new NormalizingIterator<JsonNode>(rows) {
            @Override
            EventRecord normalizeRow(long rowIndex, JsonNode row) {
                return normalizeTree(rowIndex, row);
            }
        };
    }

    /** Normalizes JSON-encoded rows, one object per line. Blank lines are skipped without consuming a row index. */
    public Iterator<EventRecord> normalizeLines(Iterator<String> lines) {
        return new NormalizingIterator<String>(lines) {
            @Override
            boolean skip(String line) {
                return line == null || line.isBlank();
            }

            @Override
            EventRecord normalizeRow(long rowIndex, String line) {
                JsonNode root;
                try {
                    root = JsonSupport.LINE_READER.readTree(line);
                } catch (Exception ex) {
                    LOG.debug("JSON parse failed (row={}): {}", rowIndex, ex.getMessage());
                    reject(RejectedRecordFactory.forParseFailure(rowIndex, line, ex));
                    return null;
                }
                return normalizeTree(rowIndex, root);
            }
        };
    }

    private EventRecord normalizeTree(long rowIndex, JsonNode root) {
        RecordValidator.ValidationResult validation = validator.validate(root);
        if (!validation.valid) {
            LOG.debug("Dropping row {} (reason={}, details={})", rowIndex, validation.reason, validation.details);
            reject(RejectedRecordFactory.forValidationFailure(rowIndex, root, validation));
            return null;
        }
        diagnostics.recordAccepted();
        return new EventRecord(
                validation.userId,
                validation.eventType,
                validation.timestamp,
                validation.group,
                rowIndex);
    }

    private void reject(RejectedRecord rejected) {
        diagnostics.recordDropped(rejected);
    }

    private abstract class NormalizingIterator<T> implements Iterator<EventRecord> {
        private final Iterator<? extends T> source;
        private EventRecord next;
        private boolean finished;

        NormalizingIterator(Iterator<? extends T> source) {
            this.source = source;
        }

        boolean skip(T row) {
            return false;
        }

        abstract EventRecord normalizeRow(long rowIndex, T row);

        @Override
        public boolean hasNext() {
            while (next == null && !finished) {
                if (!source.hasNext()) {
                    finished = true;
                    if (diagnostics.droppedCount() > 0) {
                        LOG.warn("Normalization dropped {} of {} rows (reasons={})",
                                diagnostics.droppedCount(), diagnostics.totalCount(), diagnostics.droppedByReason());
                    } else {
                        LOG.info("Normalization accepted all {} rows", diagnostics.acceptedCount());
                    }
                    break;
                }
                T row = source.next();
                if (skip(row)) {
                    continue;
                }
                next = normalizeRow(nextRowIndex++, row);
            }
            return next != null;
        }

        @Override
        public EventRecord next() {
            if (!hasNext()) {
                throw new NoSuchElementException();
            }
            EventRecord current = next;
            next = null;
            return current;
        }
    }
}

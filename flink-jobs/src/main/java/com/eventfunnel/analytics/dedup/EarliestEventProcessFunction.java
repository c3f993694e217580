package com.eventfunnel.analytics.dedup;

import org.apache.flink.api.common.state.ValueState;
import org.apache.flink.api.common.state.ValueStateDescriptor;
import org.apache.flink.configuration.Configuration;
import org.apache.flink.metrics.Counter;
import org.apache.flink.streaming.api.functions.KeyedProcessFunction;
import org.apache.flink.util.Collector;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.eventfunnel.analytics.model.EventRecord;

/**
 * Keyed variant of {@link EarliestEventDeduplicator}: partitioned by {@link DedupKey#keyOf(EventRecord)}, it keeps
 * the earliest record of each key in state and emits it once the input of the key is complete, i.e. when the
 * end-of-input watermark fires the key's timer. Intended for BATCH runtime mode.
 */
public class EarliestEventProcessFunction extends KeyedProcessFunction<String, EventRecord, EventRecord> {
    private static final long serialVersionUID = 1L;
    private static final Logger LOG = LoggerFactory.getLogger(EarliestEventProcessFunction.class);

    static final long END_OF_INPUT = Long.MAX_VALUE;

    private transient ValueState<EventRecord> earliestState;
    private transient Counter acceptedCounter;
    private transient Counter supersededCounter;
    private transient Counter emittedCounter;

    @Override
    public void open(Configuration parameters) {
        earliestState = getRuntimeContext().getState(new ValueStateDescriptor<>("dedup-earliest", EventRecord.class));

        org.apache.flink.metrics.MetricGroup metrics = getRuntimeContext().getMetricGroup().addGroup("funnel").addGroup("dedup");
        acceptedCounter = metrics.counter("accepted");
        supersededCounter = metrics.counter("superseded");
        emittedCounter = metrics.counter("emitted");
        LOG.info("Earliest-event deduplication initialized");
    }

    @Override
    public void processElement(EventRecord record, Context ctx, Collector<EventRecord> out) throws Exception {
        if (record == null) {
            return;
        }
        acceptedCounter.inc();

        EventRecord current = earliestState.value();
        if (current == null) {
            earliestState.update(record);
            ctx.timerService().registerEventTimeTimer(END_OF_INPUT);
            return;
        }

        if (record.isEarlierThan(current)) {
            supersededCounter.inc();
            LOG.trace("Replacing candidate (key={}, sequence {} -> {})", ctx.getCurrentKey(), current.sequence(), record.sequence());
            earliestState.update(record);
        }
    }

    @Override
    public void onTimer(long timestamp, OnTimerContext ctx, Collector<EventRecord> out) throws Exception {
        EventRecord earliest = earliestState.value();
        if (earliest != null) {
            emittedCounter.inc();
            out.collect(earliest);
        }
        earliestState.clear();
    }
}

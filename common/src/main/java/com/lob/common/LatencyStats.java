package com.lob.common;

import org.HdrHistogram.Histogram;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.concurrent.atomic.LongAdder;

/**
 * Latency tracking using HdrHistogram.
 * Record nanos; report percentiles periodically.
 * Recording is single-writer (the engine worker thread).
 */
public final class LatencyStats {

    private static final Logger log = LoggerFactory.getLogger(LatencyStats.class);

    private final Histogram histogram;
    private final LongAdder count = new LongAdder();
    private final String name;

    public LatencyStats(String name) {
        this.name = name;
        // max 10 seconds, 3 sig figs
        this.histogram = new Histogram(10_000_000_000L, 3);
    }

    public void record(long latencyNanos) {
        histogram.recordValue(Math.min(latencyNanos, histogram.getHighestTrackableValue()));
        count.increment();
    }

    public long count() { return count.sum(); }

    public long valueAtPercentile(double percentile) {
        return histogram.getValueAtPercentile(percentile);
    }

    /** Logs the percentiles recorded since the last call and resets. Returns the sample count. */
    public long logAndReset() {
        long total = count.sumThenReset();
        if (total == 0) return 0;
        if (log.isInfoEnabled()) {
            log.info("[metrics] {} count={} p50={}us p99={}us p999={}us max={}us",
                    name, total,
                    micros(histogram.getValueAtPercentile(50)),
                    micros(histogram.getValueAtPercentile(99)),
                    micros(histogram.getValueAtPercentile(99.9)),
                    micros(histogram.getMaxValue()));
        }
        histogram.reset();
        return total;
    }

    // nanos -> micros, one decimal
    private static double micros(long nanos) {
        return Math.round(nanos / 100.0) / 10.0;
    }
}

package com.aegis.allocation.infra.metrics;

import com.aegis.allocation.api.model.AllocationDecision;
import com.aegis.allocation.api.model.LoeLevel;

import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.concurrent.atomic.LongAdder;

/**
 * Allocation counters shared by every request thread.
 *
 * <p>Tracks total allocations and processing time, Fast-Track versus rule-chain
 * decisions, allocations per LOE level, rejected selections, and approximate
 * p50/p95/p99 latency. All recording goes through {@link LongAdder}s.
 */
public final class AllocationMetrics {

    private final LongAdder totalAllocations = new LongAdder();
    private final LongAdder totalProcessingTimeNanos = new LongAdder();
    private final LongAdder fastTrackAllocations = new LongAdder();
    private final LongAdder rejectedSelections = new LongAdder();
    private final Map<LoeLevel, LongAdder> allocationsByLevel = new EnumMap<>(LoeLevel.class);

    private final LatencyHistogram latency = new LatencyHistogram();

    public AllocationMetrics() {
        for (LoeLevel level : LoeLevel.values()) {
            allocationsByLevel.put(level, new LongAdder());
        }
    }

    /**
     * Records a completed allocation, whichever path produced it.
     */
    public void recordDecision(AllocationDecision decision) {
        totalAllocations.increment();
        totalProcessingTimeNanos.add(decision.processingTimeNanos());
        allocationsByLevel.get(decision.result().loeLevel()).increment();
        if (decision.fastTracked()) {
            fastTrackAllocations.increment();
        }
        latency.record(decision.processingTimeNanos());
    }

    /**
     * Record a selection rejected at the intake boundary.
     */
    public void recordRejectedSelection() {
        rejectedSelections.increment();
    }

    public long getTotalAllocations() {
        return totalAllocations.sum();
    }

    public long getFastTrackAllocations() {
        return fastTrackAllocations.sum();
    }

    public long getRejectedSelections() {
        return rejectedSelections.sum();
    }

    public long getAllocations(LoeLevel level) {
        return allocationsByLevel.get(level).sum();
    }

    /**
     * Point-in-time copy of all counters, keyed for JSON output.
     */
    public Map<String, Object> getSnapshot() {
        Map<String, Object> snapshot = new LinkedHashMap<>();

        long allocations = totalAllocations.sum();
        long totalTime = totalProcessingTimeNanos.sum();
        long fastTracked = fastTrackAllocations.sum();

        snapshot.put("totalAllocations", allocations);
        snapshot.put("fastTrackAllocations", fastTracked);
        snapshot.put("ruleChainAllocations", allocations - fastTracked);
        snapshot.put("rejectedSelections", rejectedSelections.sum());
        snapshot.put("avgProcessingTimeNanos", allocations > 0 ? totalTime / allocations : 0);

        Map<String, Long> byLevel = new LinkedHashMap<>();
        allocationsByLevel.forEach((level, count) -> byLevel.put(level.name(), count.sum()));
        snapshot.put("allocationsByLevel", byLevel);

        snapshot.put("p50LatencyNanos", latency.getPercentile(0.50));
        snapshot.put("p95LatencyNanos", latency.getPercentile(0.95));
        snapshot.put("p99LatencyNanos", latency.getPercentile(0.99));

        return snapshot;
    }

    /**
     * Latency histogram with power-of-two buckets: bucket {@code i} holds
     * samples in {@code [2^i, 2^(i+1))} nanoseconds. Percentiles report the
     * bucket's upper bound, so they are accurate to within a factor of two.
     */
    static final class LatencyHistogram {
        private static final int BUCKETS = Long.SIZE;
        private final LongAdder[] counts = new LongAdder[BUCKETS];

        LatencyHistogram() {
            for (int i = 0; i < BUCKETS; i++) {
                counts[i] = new LongAdder();
            }
        }

        void record(long latencyNanos) {
            counts[bucketOf(latencyNanos)].increment();
        }

        static int bucketOf(long latencyNanos) {
            return latencyNanos <= 1 ? 0 : Long.SIZE - 1 - Long.numberOfLeadingZeros(latencyNanos);
        }

        long getPercentile(double percentile) {
            long[] snapshot = new long[BUCKETS];
            long samples = 0;
            for (int i = 0; i < BUCKETS; i++) {
                snapshot[i] = counts[i].sum();
                samples += snapshot[i];
            }
            if (samples == 0) {
                return 0;
            }

            long rank = Math.max(1, (long) Math.ceil(samples * percentile));
            long seen = 0;
            for (int i = 0; i < BUCKETS; i++) {
                seen += snapshot[i];
                if (seen >= rank) {
                    return i >= BUCKETS - 2 ? Long.MAX_VALUE : (1L << (i + 1)) - 1;
                }
            }
            return Long.MAX_VALUE;
        }
    }
}

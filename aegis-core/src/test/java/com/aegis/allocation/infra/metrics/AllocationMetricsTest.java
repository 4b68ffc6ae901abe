package com.aegis.allocation.infra.metrics;

import com.aegis.allocation.api.model.AllocationDecision;
import com.aegis.allocation.api.model.AllocationPath;
import com.aegis.allocation.api.model.ControlAllocationResult;
import com.aegis.allocation.api.model.LoeLevel;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.Map;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;

class AllocationMetricsTest {

    private static AllocationDecision decision(LoeLevel level, AllocationPath path, long nanos) {
        return new AllocationDecision("r", ControlAllocationResult.of(level, "test"), path, 0L, nanos);
    }

    @Test
    @DisplayName("Should count allocations by path and level")
    void shouldCountAllocations() {
        AllocationMetrics metrics = new AllocationMetrics();
        metrics.recordDecision(decision(LoeLevel.A, AllocationPath.FAST_TRACK, 1_000));
        metrics.recordDecision(decision(LoeLevel.D, AllocationPath.RULE_CHAIN, 3_000));
        metrics.recordDecision(decision(LoeLevel.D, AllocationPath.RULE_CHAIN, 5_000));
        metrics.recordRejectedSelection();

        assertThat(metrics.getTotalAllocations()).isEqualTo(3);
        assertThat(metrics.getFastTrackAllocations()).isEqualTo(1);
        assertThat(metrics.getRejectedSelections()).isEqualTo(1);
        assertThat(metrics.getAllocations(LoeLevel.D)).isEqualTo(2);
        assertThat(metrics.getAllocations(LoeLevel.DFARS)).isZero();

        Map<String, Object> snapshot = metrics.getSnapshot();
        assertThat(snapshot)
                .containsEntry("totalAllocations", 3L)
                .containsEntry("ruleChainAllocations", 2L)
                .containsEntry("avgProcessingTimeNanos", 3_000L);
        @SuppressWarnings("unchecked")
        Map<String, Long> byLevel = (Map<String, Long>) snapshot.get("allocationsByLevel");
        assertThat(byLevel).containsEntry("A", 1L).containsEntry("D", 2L).containsEntry("DFARS", 0L);
    }

    @Test
    @DisplayName("Empty metrics report zeros")
    void shouldReportZerosWhenEmpty() {
        Map<String, Object> snapshot = new AllocationMetrics().getSnapshot();
        assertThat(snapshot)
                .containsEntry("totalAllocations", 0L)
                .containsEntry("avgProcessingTimeNanos", 0L)
                .containsEntry("p99LatencyNanos", 0L);
    }

    @Test
    @DisplayName("Percentiles report the upper bound of the power-of-two bucket")
    void shouldApproximatePercentiles() {
        AllocationMetrics.LatencyHistogram histogram = new AllocationMetrics.LatencyHistogram();
        for (int i = 0; i < 99; i++) {
            histogram.record(1_000);
        }
        histogram.record(1_000_000);

        assertThat(AllocationMetrics.LatencyHistogram.bucketOf(1_000)).isEqualTo(9);
        assertThat(histogram.getPercentile(0.50)).isEqualTo(1_023);
        assertThat(histogram.getPercentile(0.99)).isEqualTo(1_023);
        assertThat(histogram.getPercentile(1.0)).isEqualTo(1_048_575);
    }

    @Test
    @DisplayName("Recording is safe from many threads")
    void shouldCountConcurrently() throws InterruptedException {
        AllocationMetrics metrics = new AllocationMetrics();
        ExecutorService pool = Executors.newFixedThreadPool(8);
        for (int i = 0; i < 8_000; i++) {
            pool.submit(() -> metrics.recordDecision(decision(LoeLevel.B, AllocationPath.RULE_CHAIN, 500)));
        }
        pool.shutdown();
        assertThat(pool.awaitTermination(30, TimeUnit.SECONDS)).isTrue();

        assertThat(metrics.getTotalAllocations()).isEqualTo(8_000);
        assertThat(metrics.getAllocations(LoeLevel.B)).isEqualTo(8_000);
    }
}

package com.aegis.allocation.infra.management;

import com.aegis.allocation.api.exceptions.InvalidSelectionException;
import com.aegis.allocation.api.model.AllocationDecision;
import com.aegis.allocation.api.model.AllocationPath;
import com.aegis.allocation.api.model.AllocationRequest;
import com.aegis.allocation.api.model.AllocationTrace;
import com.aegis.allocation.api.model.BatchAllocationResult;
import com.aegis.allocation.api.model.FeatureFlagState;
import com.aegis.allocation.api.model.LoeLevel;
import com.aegis.allocation.api.model.TemplateBaseline;
import com.aegis.allocation.runtime.model.AllocationRuleChain;
import io.opentelemetry.api.OpenTelemetry;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class AllocationEngineTest {

    private static AllocationEngine engine(FeatureFlagState flags) {
        return new AllocationEngine(AllocationRuleChain.standard(), flags, TemplateBaseline.standard(),
                OpenTelemetry.noop().getTracer("test"));
    }

    private static Map<String, String> completeTemplate() {
        Map<String, String> fields = new HashMap<>();
        TemplateBaseline.STANDARD_FIELDS.forEach(field -> fields.put(field, "filled"));
        return fields;
    }

    @Test
    @DisplayName("Should allocate through the rule chain and record metrics")
    void shouldAllocate() {
        AllocationEngine engine = engine(FeatureFlagState.disabled());

        AllocationDecision decision = engine.allocate(new AllocationRequest("req-42",
                Map.of("pii", true, "system_scope", "EXTERNAL"), null));

        assertThat(decision.requestId()).isEqualTo("req-42");
        assertThat(decision.result().controlCount()).isEqualTo(70);
        assertThat(decision.path()).isEqualTo(AllocationPath.RULE_CHAIN);
        assertThat(engine.getMetrics().getTotalAllocations()).isEqualTo(1);
    }

    @Test
    @DisplayName("Should generate a request id when none is given")
    void shouldGenerateRequestId() {
        AllocationDecision decision = engine(FeatureFlagState.disabled())
                .allocate(new AllocationRequest(null, Map.of(), null));
        assertThat(decision.requestId()).isNotBlank();
        assertThat(decision.result().loeLevel()).isEqualTo(LoeLevel.A);
    }

    @Test
    @DisplayName("Should take the Fast-Track path when enabled and the template is complete")
    void shouldFastTrack() {
        AllocationEngine engine = engine(FeatureFlagState.withFastTrack());

        AllocationDecision decision = engine.allocate(new AllocationRequest("ft",
                Map.of("proprietary", true, "system_scope", "INTERNAL"), completeTemplate()));

        assertThat(decision.path()).isEqualTo(AllocationPath.FAST_TRACK);
        assertThat(decision.result()).isEqualTo(TemplateBaseline.BASELINE_RESULT);
        assertThat(engine.getMetrics().getFastTrackAllocations()).isEqualTo(1);
    }

    @Test
    @DisplayName("A null template value falls through to the rule chain")
    void shouldTreatNullTemplateValueAsMissing() {
        AllocationEngine engine = engine(FeatureFlagState.withFastTrack());
        Map<String, String> template = completeTemplate();
        template.put("system_name", null);

        AllocationDecision decision = engine.allocate(new AllocationRequest("nulls",
                Map.of("public_data", true), template));
        BatchAllocationResult batch = engine.allocateBatch(List.of(
                new AllocationRequest("nulls-batch", Map.of("public_data", true), template)));

        assertThat(decision.path()).isEqualTo(AllocationPath.RULE_CHAIN);
        assertThat(decision.result().controlCount()).isEqualTo(38);
        assertThat(batch.decisions().get(0).path()).isEqualTo(AllocationPath.RULE_CHAIN);
        assertThat(engine.getMetrics().getFastTrackAllocations()).isZero();
        assertThat(engine.getMetrics().getRejectedSelections()).isZero();
    }

    @Test
    @DisplayName("Should count and rethrow invalid selections")
    void shouldRejectInvalidSelection() {
        AllocationEngine engine = engine(FeatureFlagState.disabled());

        assertThatThrownBy(() -> engine.allocate(new AllocationRequest("bad", Map.of("cui", "maybe"), null)))
                .isInstanceOf(InvalidSelectionException.class);
        assertThat(engine.getMetrics().getRejectedSelections()).isEqualTo(1);
        assertThat(engine.getMetrics().getTotalAllocations()).isZero();
    }

    @Test
    @DisplayName("Batch keeps input order and aggregates statistics")
    void shouldAllocateBatch() {
        AllocationEngine engine = engine(FeatureFlagState.withFastTrack());

        BatchAllocationResult result = engine.allocateBatch(List.of(
                new AllocationRequest("1", Map.of("cui", true), completeTemplate()),
                new AllocationRequest("2", Map.of("public_data", true), completeTemplate()),
                new AllocationRequest("3", Map.of("public_data", true), null)));

        assertThat(result.decisions()).extracting(AllocationDecision::requestId).containsExactly("1", "2", "3");
        assertThat(result.decisions()).extracting(d -> d.result().controlCount()).containsExactly(110, 20, 38);
        assertThat(result.stats().totalRequests()).isEqualTo(3);
        assertThat(result.stats().fastTracked()).isEqualTo(1);
        assertThat(result.stats().totalControlCount()).isEqualTo(168);
        assertThat(result.stats().countByLevel())
                .containsEntry(LoeLevel.DFARS, 1)
                .containsEntry(LoeLevel.A, 1)
                .containsEntry(LoeLevel.B, 1);
    }

    @Test
    @DisplayName("One invalid entry rejects the whole batch with its index")
    void shouldRejectBatchWithInvalidEntry() {
        AllocationEngine engine = engine(FeatureFlagState.disabled());
        List<AllocationRequest> requests = new ArrayList<>();
        requests.add(new AllocationRequest("ok", Map.of("pii", true), null));
        requests.add(new AllocationRequest("bad", Map.of("system_scope", "SOMEWHERE"), null));

        assertThatThrownBy(() -> engine.allocateBatch(requests))
                .isInstanceOf(InvalidSelectionException.class)
                .hasMessageStartingWith("requests[1]:");
        assertThat(engine.getMetrics().getTotalAllocations()).isZero();
    }

    @Test
    @DisplayName("Empty batch yields empty statistics")
    void shouldHandleEmptyBatch() {
        BatchAllocationResult result = engine(FeatureFlagState.disabled()).allocateBatch(List.of());
        assertThat(result.decisions()).isEmpty();
        assertThat(result.stats().totalRequests()).isZero();
    }

    @Test
    @DisplayName("Explain ignores the Fast-Track gate")
    void explainShouldUseRuleChain() {
        AllocationTrace trace = engine(FeatureFlagState.withFastTrack())
                .explain(Map.of("competition_sensitive", true, "system_scope", "internal"));

        assertThat(trace.matchedRuleCode()).isEqualTo(AllocationRuleChain.INTERNAL_SENSITIVE);
        assertThat(trace.result().controlCount()).isEqualTo(56);
    }

    @Test
    @DisplayName("Rule catalog lists rules and the Fast-Track template")
    void shouldDescribeCatalog() {
        Map<String, Object> catalog = engine(FeatureFlagState.withFastTrack()).ruleCatalog();

        assertThat(catalog).containsKeys("rules", "fast_track");
        assertThat((List<?>) catalog.get("rules")).hasSize(7);
        @SuppressWarnings("unchecked")
        Map<String, Object> fastTrack = (Map<String, Object>) catalog.get("fast_track");
        assertThat(fastTrack).containsEntry("enabled", true).containsEntry("baseline", TemplateBaseline.standard());
    }
}

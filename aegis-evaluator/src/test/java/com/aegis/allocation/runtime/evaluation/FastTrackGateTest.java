package com.aegis.allocation.runtime.evaluation;

import com.aegis.allocation.api.IControlAllocator;
import com.aegis.allocation.api.model.AllocationDecision;
import com.aegis.allocation.api.model.AllocationPath;
import com.aegis.allocation.api.model.ClassificationSelection;
import com.aegis.allocation.api.model.ControlAllocationResult;
import com.aegis.allocation.api.model.FeatureFlagState;
import com.aegis.allocation.api.model.IntakeSubmission;
import com.aegis.allocation.api.model.LoeLevel;
import com.aegis.allocation.api.model.SystemScope;
import com.aegis.allocation.api.model.TemplateBaseline;
import io.opentelemetry.api.OpenTelemetry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.HashMap;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class FastTrackGateTest {

    private static final ControlAllocationResult EVALUATED = ControlAllocationResult.of(LoeLevel.D, "evaluated");

    @Mock
    private IControlAllocator allocator;

    private FastTrackGate gate;

    @BeforeEach
    void setUp() {
        gate = new FastTrackGate(allocator, TemplateBaseline.standard(), OpenTelemetry.noop().getTracer("test"));
    }

    private static Map<String, String> completeTemplate() {
        Map<String, String> fields = new HashMap<>();
        TemplateBaseline.STANDARD_FIELDS.forEach(field -> fields.put(field, "filled"));
        return fields;
    }

    private static ClassificationSelection eligibleSelection() {
        return ClassificationSelection.builder()
                .pii(true)
                .systemScope(SystemScope.EXTERNAL)
                .build();
    }

    @Test
    @DisplayName("Eligible submission with a complete template never reaches the evaluator")
    void shouldBypassEvaluator() {
        IntakeSubmission submission = new IntakeSubmission(eligibleSelection(), completeTemplate());

        ControlAllocationResult result = gate.route(submission, FeatureFlagState.withFastTrack());

        assertThat(result).isEqualTo(TemplateBaseline.BASELINE_RESULT);
        assertThat(result.controlCount()).isEqualTo(20);
        verifyNoInteractions(allocator);
    }

    @Test
    @DisplayName("Flag off forwards the selection unchanged")
    void shouldForwardWhenDisabled() {
        ClassificationSelection selection = eligibleSelection();
        when(allocator.evaluate(selection)).thenReturn(EVALUATED);

        ControlAllocationResult result = gate.route(
                new IntakeSubmission(selection, completeTemplate()), FeatureFlagState.disabled());

        assertThat(result).isEqualTo(EVALUATED);
        verify(allocator).evaluate(selection);
    }

    @Test
    @DisplayName("Any DFARS-tier or CUI flag makes the selection ineligible")
    void shouldForwardHighRiskSelections() {
        ClassificationSelection base = ClassificationSelection.empty();
        ClassificationSelection[] highRisk = {
                base.toBuilder().cui(true).build(),
                base.toBuilder().cdiDfars(true).build(),
                base.toBuilder().itar(true).build(),
                base.toBuilder().ear(true).build(),
                base.toBuilder().ear99Plus(true).build()
        };

        for (ClassificationSelection selection : highRisk) {
            assertThat(FastTrackGate.isEligible(selection)).isFalse();
            assertThat(gate.pathFor(new IntakeSubmission(selection, completeTemplate()), FeatureFlagState.withFastTrack()))
                    .isEqualTo(AllocationPath.RULE_CHAIN);
        }
    }

    @Test
    @DisplayName("Eligibility ignores public, pilot, scope and sensitive-data flags")
    void eligibilityShouldIgnoreLowRiskFlags() {
        ClassificationSelection selection = ClassificationSelection.builder()
                .publicData(true)
                .pilotShortDuration(true)
                .competitionSensitive(true)
                .proprietary(true)
                .pii(true)
                .systemScope(SystemScope.INTERNAL)
                .build();
        assertThat(FastTrackGate.isEligible(selection)).isTrue();
    }

    @Test
    @DisplayName("Incomplete template falls through to the evaluator")
    void shouldForwardIncompleteTemplate() {
        ClassificationSelection selection = eligibleSelection();
        Map<String, String> fields = completeTemplate();
        fields.put("data_description", "");
        when(allocator.evaluate(selection)).thenReturn(EVALUATED);

        ControlAllocationResult result = gate.route(new IntakeSubmission(selection, fields), FeatureFlagState.withFastTrack());

        assertThat(result).isEqualTo(EVALUATED);
    }

    @Test
    @DisplayName("Selection without template fields always reaches the evaluator")
    void shouldForwardBareSelection() {
        ClassificationSelection selection = eligibleSelection();
        when(allocator.evaluate(selection)).thenReturn(EVALUATED);

        assertThat(gate.route(selection, FeatureFlagState.withFastTrack())).isEqualTo(EVALUATED);
    }

    @Test
    @DisplayName("Decision records the path and request id")
    void decisionShouldRecordPath() {
        AllocationDecision fastTracked = gate.decide("req-1",
                new IntakeSubmission(eligibleSelection(), completeTemplate()), FeatureFlagState.withFastTrack());

        assertThat(fastTracked.requestId()).isEqualTo("req-1");
        assertThat(fastTracked.path()).isEqualTo(AllocationPath.FAST_TRACK);
        assertThat(fastTracked.fastTracked()).isTrue();
        assertThat(fastTracked.processingTimeNanos()).isGreaterThanOrEqualTo(0);
        verifyNoInteractions(allocator);
    }

    @Test
    @DisplayName("Gate in front of the real evaluator keeps rule-chain results when disabled")
    void shouldMatchEvaluatorWhenDisabled() {
        ControlAllocationEvaluator evaluator = ControlAllocationEvaluator.standard();
        FastTrackGate realGate = new FastTrackGate(evaluator, TemplateBaseline.standard(),
                OpenTelemetry.noop().getTracer("test"));
        ClassificationSelection selection = eligibleSelection();

        AllocationDecision decision = realGate.decide("req-2",
                new IntakeSubmission(selection, completeTemplate()), FeatureFlagState.disabled());

        assertThat(decision.path()).isEqualTo(AllocationPath.RULE_CHAIN);
        assertThat(decision.result()).isEqualTo(evaluator.evaluate(selection));
        assertThat(decision.result().controlCount()).isEqualTo(70);
    }
}

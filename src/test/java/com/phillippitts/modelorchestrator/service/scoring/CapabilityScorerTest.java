package com.phillippitts.modelorchestrator.service.scoring;

import com.phillippitts.modelorchestrator.config.properties.ScoringProperties;
import com.phillippitts.modelorchestrator.domain.ModelCapability;
import com.phillippitts.modelorchestrator.testutil.MutableClock;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

class CapabilityScorerTest {

    // 0.5 * 1.0 + 0.3 * (1 - 0.2^1.5) + 0.2 * (1 - 0.2^2)
    private static final double HEALTHY_SCORE = 0.5 + 0.3 * (1 - Math.pow(0.2, 1.5)) + 0.2 * 0.96;

    private MutableClock clock;
    private CapabilityScorer scorer;

    @BeforeEach
    void setUp() {
        clock = MutableClock.atEpoch();
        scorer = new CapabilityScorer(new ScoringProperties(), clock);
    }

    @Test
    void scoresZeroBelowMinimumSamples() {
        recordSuccesses("m1", ModelCapability.CODE, 4, 100, 0.2);

        assertThat(scorer.getCapabilityScore("m1", ModelCapability.CODE)).isZero();
    }

    @Test
    void scoresFromWeightedMetricsAtMinimumSamples() {
        recordSuccesses("m1", ModelCapability.CODE, 5, 100, 0.2);

        assertThat(scorer.getCapabilityScore("m1", ModelCapability.CODE)).isCloseTo(HEALTHY_SCORE, within(1e-9));
    }

    @Test
    void unknownModelOrCapabilityScoresZero() {
        recordSuccesses("m1", ModelCapability.CODE, 5, 100, 0.2);

        assertThat(scorer.getCapabilityScore("unknown", ModelCapability.CODE)).isZero();
        assertThat(scorer.getCapabilityScore("m1", ModelCapability.VISION)).isZero();
        assertThat(scorer.getCapabilityScore(null, ModelCapability.CODE)).isZero();
    }

    @Test
    void onlyNewestSamplesCount() {
        recordFailures("m1", ModelCapability.CODE, 5, 100, 0.2);
        recordSuccesses("m1", ModelCapability.CODE, 5, 100, 0.2);

        assertThat(scorer.getCapabilityScore("m1", ModelCapability.CODE)).isCloseTo(HEALTHY_SCORE, within(1e-9));
    }

    @Test
    void failuresLowerTheScore() {
        recordSuccesses("m1", ModelCapability.CODE, 3, 100, 0.2);
        recordFailures("m1", ModelCapability.CODE, 2, 100, 0.2);

        // success rate 0.6 instead of 1.0
        assertThat(scorer.getCapabilityScore("m1", ModelCapability.CODE))
                .isCloseTo(HEALTHY_SCORE - 0.5 * 0.4, within(1e-9));
    }

    @Test
    void severeLatencyHalvesTheScore() {
        recordSuccesses("m1", ModelCapability.REASONING, 5, 900, 0.2);

        // latency term is floored at 0, then the whole score is halved
        double expected = (0.5 + 0.0 + 0.2 * 0.96) * 0.5;
        assertThat(scorer.getCapabilityScore("m1", ModelCapability.REASONING)).isCloseTo(expected, within(1e-9));
    }

    @Test
    void severeResourceUsageHalvesTheScore() {
        recordSuccesses("m1", ModelCapability.REASONING, 5, 100, 0.9);

        double expected = (0.5 + 0.3 * (1 - Math.pow(0.2, 1.5)) + 0.2 * (1 - 0.81)) * 0.5;
        assertThat(scorer.getCapabilityScore("m1", ModelCapability.REASONING)).isCloseTo(expected, within(1e-9));
    }

    @Test
    void scoreDecaysWithAgeOfNewestRecord() {
        recordSuccesses("m1", ModelCapability.CODE, 5, 100, 0.2);
        double fresh = scorer.getCapabilityScore("m1", ModelCapability.CODE);

        clock.advance(Duration.ofDays(1));
        double oneDay = scorer.getCapabilityScore("m1", ModelCapability.CODE);
        clock.advance(Duration.ofDays(1));
        double twoDays = scorer.getCapabilityScore("m1", ModelCapability.CODE);

        assertThat(oneDay).isCloseTo(fresh * 0.95, within(1e-9));
        assertThat(twoDays).isCloseTo(fresh * 0.95 * 0.95, within(1e-9));
    }

    @Test
    void repeatedReadsDoNotCompoundDecay() {
        recordSuccesses("m1", ModelCapability.CODE, 5, 100, 0.2);
        clock.advance(Duration.ofDays(1));

        double first = scorer.getCapabilityScore("m1", ModelCapability.CODE);
        double second = scorer.getCapabilityScore("m1", ModelCapability.CODE);

        assertThat(second).isEqualTo(first);
    }

    @Test
    void recordsOutsideWindowArePruned() {
        recordSuccesses("m1", ModelCapability.CODE, 5, 100, 0.2);

        clock.advance(Duration.ofDays(8));

        assertThat(scorer.getCapabilityScore("m1", ModelCapability.CODE)).isZero();
        assertThat(scorer.getModelScores("m1").capabilities()).isEmpty();
    }

    @Test
    void modelScoresIncludeOnlyCapabilitiesWithEnoughSamples() {
        recordSuccesses("m1", ModelCapability.CODE, 5, 100, 0.2);
        recordSuccesses("m1", ModelCapability.ANALYSIS, 2, 100, 0.2);

        CapabilityScore scores = scorer.getModelScores("m1");

        assertThat(scores.modelId()).isEqualTo("m1");
        assertThat(scores.capabilities()).containsOnlyKeys(ModelCapability.CODE);
        assertThat(scores.performanceMetrics().successRate()).isEqualTo(1.0);
        assertThat(scores.performanceMetrics().latencyMs()).isCloseTo(100.0, within(1e-9));
        assertThat(scores.performanceMetrics().resourceUsage()).isCloseTo(0.2, within(1e-9));
    }

    @Test
    void modelScoresForUnknownModelAreEmpty() {
        CapabilityScore scores = scorer.getModelScores("nobody");

        assertThat(scores.capabilities()).isEmpty();
        assertThat(scores.performanceMetrics()).isEqualTo(PerformanceMetrics.EMPTY);
    }

    @Test
    void ranksModelsByScoreKeepingInputOrderOnTies() {
        recordSuccesses("good", ModelCapability.CODE, 5, 100, 0.2);
        recordSuccesses("slow", ModelCapability.CODE, 5, 900, 0.2);

        List<String> ranked = scorer.rankModels(ModelCapability.CODE, List.of("new-a", "slow", "good", "new-b"));

        assertThat(ranked).containsExactly("good", "slow", "new-a", "new-b");
    }

    @Test
    void honorsConfiguredMinimumSamples() {
        ScoringProperties props = new ScoringProperties();
        props.setMinSamples(2);
        CapabilityScorer custom = new CapabilityScorer(props, clock);

        custom.recordSuccess("m1", ModelCapability.CODE, 100, 0.2);
        custom.recordSuccess("m1", ModelCapability.CODE, 100, 0.2);

        assertThat(custom.getCapabilityScore("m1", ModelCapability.CODE)).isCloseTo(HEALTHY_SCORE, within(1e-9));
    }

    private void recordSuccesses(String model, ModelCapability capability, int n, double latencyMs, double usage) {
        for (int i = 0; i < n; i++) {
            scorer.recordSuccess(model, capability, latencyMs, usage);
        }
    }

    private void recordFailures(String model, ModelCapability capability, int n, double latencyMs, double usage) {
        for (int i = 0; i < n; i++) {
            scorer.recordFailure(model, capability, latencyMs, usage);
        }
    }
}

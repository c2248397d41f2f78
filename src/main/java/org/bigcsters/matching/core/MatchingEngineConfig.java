package org.bigcsters.matching.core;

import lombok.Builder;
import lombok.Value;
import org.bigcsters.matching.score.ScoringWeights;
import org.bigcsters.matching.strategy.HybridConfig;

import java.time.Duration;

/**
 * Immutable engine configuration.
 */
@Value
@Builder(toBuilder = true)
public class MatchingEngineConfig {
    /** Base weights; per-run overrides are applied on top. */
    @Builder.Default
    ScoringWeights weights = ScoringWeights.defaults();

    @Builder.Default
    HybridConfig hybrid = HybridConfig.defaults();

    /** Bound on each ILP backend call. */
    @Builder.Default
    Duration solverTimeout = Duration.ofSeconds(30);

    /** Extra ILP attempts after a timeout. */
    @Builder.Default
    int solverTimeoutRetries = 0;

    /** Run compared strategies concurrently. */
    @Builder.Default
    boolean parallelComparison = true;

    @Builder.Default
    int comparisonThreads = MatchingAlgorithm.values().length;

    public static MatchingEngineConfig defaults() {
        return MatchingEngineConfig.builder().build();
    }

    /**
     * @return this instance.
     * @throws MatchingException with {@link MatchingException#REASON_INVALID_CONFIGURATION}.
     */
    public MatchingEngineConfig validate() {
        if (weights == null) {
            throw invalid("weights are required");
        }
        weights.validate();
        if (hybrid == null) {
            throw invalid("hybrid config is required");
        }
        hybrid.validate();
        if (solverTimeout == null || solverTimeout.isZero() || solverTimeout.isNegative()) {
            throw invalid("solverTimeout must be positive, got " + solverTimeout);
        }
        if (solverTimeoutRetries < 0) {
            throw invalid("solverTimeoutRetries must be >= 0, got " + solverTimeoutRetries);
        }
        if (comparisonThreads < 1) {
            throw invalid("comparisonThreads must be >= 1, got " + comparisonThreads);
        }
        return this;
    }

    private static MatchingException invalid(String message) {
        return new MatchingException(MatchingException.REASON_INVALID_CONFIGURATION, message);
    }
}

package org.bigcsters.matching.evaluation;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;
import org.bigcsters.matching.core.AlgorithmResult;
import org.bigcsters.matching.core.MatchingAlgorithm;

import java.util.List;
import java.util.Optional;

/**
 * Ranked comparison of strategy results.
 *
 * <p>Ranking order: total score descending, blocking pairs ascending, unmatched count
 * ascending, then {@link MatchingAlgorithm} declaration order. Failed results are kept
 * apart with their reason codes.</p>
 */
@Value
@Builder
public class EvaluationReport {
    @Singular("ranked")
    List<StrategyMetrics> ranking;
    @Singular
    List<AlgorithmResult> failures;

    /**
     * @return top-ranked strategy, empty when every strategy failed.
     */
    public Optional<StrategyMetrics> best() {
        return ranking.isEmpty() ? Optional.empty() : Optional.of(ranking.get(0));
    }

    /**
     * @return metrics of a succeeded strategy.
     */
    public Optional<StrategyMetrics> metrics(MatchingAlgorithm algorithm) {
        for (StrategyMetrics metrics : ranking) {
            if (metrics.getAlgorithm() == algorithm) {
                return Optional.of(metrics);
            }
        }
        return Optional.empty();
    }

    /**
     * @return 1-based rank of a succeeded strategy, or {@code -1}.
     */
    public int rankOf(MatchingAlgorithm algorithm) {
        for (int i = 0; i < ranking.size(); i++) {
            if (ranking.get(i).getAlgorithm() == algorithm) {
                return i + 1;
            }
        }
        return -1;
    }
}

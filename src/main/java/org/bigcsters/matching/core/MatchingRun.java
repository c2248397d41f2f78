package org.bigcsters.matching.core;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;
import org.bigcsters.matching.evaluation.EvaluationReport;
import org.bigcsters.matching.score.ScoreMatrix;

import java.util.List;
import java.util.Optional;

/**
 * Structured output of one engine run, handed to downstream consumers.
 *
 * <p>Recoverable conditions never escape as exceptions: mentees without any eligible
 * mentor are listed in {@code noEligibleMenteeIds}, and failed strategies appear as
 * {@link AlgorithmResult.Status#FAILED} results.</p>
 */
@Value
@Builder
public class MatchingRun {
    /** Score matrix shared by every strategy of this run. */
    ScoreMatrix scoreMatrix;
    /** Problem (matrix, capacities, priorities) every strategy consumed. */
    MatchingProblem problem;
    /** Results in {@link MatchingAlgorithm} declaration order. */
    @Singular
    List<AlgorithmResult> results;
    /** Mentees reported as {@code NO_ELIGIBLE_PAIRS}; unassigned in every result. */
    @Singular
    List<String> noEligibleMenteeIds;
    /** Comparison report, null unless the selection asked for comparison. */
    EvaluationReport evaluation;

    /**
     * @return result of the given strategy when it was part of the run.
     */
    public Optional<AlgorithmResult> result(MatchingAlgorithm algorithm) {
        for (AlgorithmResult result : results) {
            if (result.getAlgorithm() == algorithm) {
                return Optional.of(result);
            }
        }
        return Optional.empty();
    }
}

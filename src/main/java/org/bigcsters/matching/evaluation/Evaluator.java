package org.bigcsters.matching.evaluation;

import it.unimi.dsi.fastutil.ints.IntArrayList;
import it.unimi.dsi.fastutil.ints.IntLists;
import lombok.extern.slf4j.Slf4j;
import org.bigcsters.matching.core.AlgorithmResult;
import org.bigcsters.matching.core.Assignment;
import org.bigcsters.matching.core.MatchingProblem;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Objects;

/**
 * Computes comparison metrics for strategy results. Never mutates an {@link Assignment}.
 */
@Slf4j
public final class Evaluator {

    static final Comparator<StrategyMetrics> RANKING = Comparator
            .comparingDouble(StrategyMetrics::getTotalScore).reversed()
            .thenComparingInt(StrategyMetrics::getBlockingPairs)
            .thenComparingInt(StrategyMetrics::getUnmatchedCount)
            .thenComparing(StrategyMetrics::getAlgorithm);

    /**
     * Ranks succeeded results and lists failed ones.
     *
     * @param results strategy results of one run.
     * @param problem problem every result was computed for.
     * @return ranked report.
     */
    public EvaluationReport evaluate(List<AlgorithmResult> results, MatchingProblem problem) {
        Objects.requireNonNull(results, "results");
        Objects.requireNonNull(problem, "problem");
        List<StrategyMetrics> succeeded = new ArrayList<>();
        EvaluationReport.EvaluationReportBuilder report = EvaluationReport.builder();
        for (AlgorithmResult result : results) {
            if (result.isSucceeded()) {
                succeeded.add(measure(result, problem));
            } else {
                report.failure(result);
            }
        }
        succeeded.sort(RANKING);
        for (StrategyMetrics metrics : succeeded) {
            log.info("{}: total={} unmatched={} blockingPairs={} load=[{}, {}]",
                    metrics.getAlgorithm(), metrics.getTotalScore(), metrics.getUnmatchedCount(),
                    metrics.getBlockingPairs(), metrics.getMinLoad(), metrics.getMaxLoad());
        }
        return report.ranking(succeeded).build();
    }

    /**
     * Computes metrics for one succeeded result.
     */
    public StrategyMetrics measure(AlgorithmResult result, MatchingProblem problem) {
        if (!result.isSucceeded()) {
            throw new IllegalArgumentException("cannot measure failed result of " + result.getAlgorithm());
        }
        Assignment assignment = result.getAssignment();
        int mentorCount = assignment.mentorCount();
        IntArrayList loads = new IntArrayList(mentorCount);
        int minLoad = mentorCount == 0 ? 0 : Integer.MAX_VALUE;
        int maxLoad = 0;
        for (int r = 0; r < mentorCount; r++) {
            int load = assignment.load(r);
            loads.add(load);
            minLoad = Math.min(minLoad, load);
            maxLoad = Math.max(maxLoad, load);
        }

        double min = Double.POSITIVE_INFINITY;
        double max = Double.NEGATIVE_INFINITY;
        for (int e = 0; e < assignment.menteeCount(); e++) {
            if (assignment.isAssigned(e)) {
                double score = problem.score(assignment.mentorOf(e), e);
                min = Math.min(min, score);
                max = Math.max(max, score);
            }
        }
        int assigned = assignment.assignedCount();
        return StrategyMetrics.builder()
                .algorithm(result.getAlgorithm())
                .totalScore(assignment.totalScore())
                .assignedCount(assigned)
                .unmatchedCount(assignment.unassignedCount())
                .blockingPairs(StabilityAnalyzer.countBlockingPairs(assignment, problem))
                .minLoad(minLoad)
                .maxLoad(maxLoad)
                .mentorLoads(IntLists.unmodifiable(loads))
                .averageMatchScore(assigned == 0 ? 0.0d : assignment.totalScore() / assigned)
                .minMatchScore(assigned == 0 ? 0.0d : min)
                .maxMatchScore(assigned == 0 ? 0.0d : max)
                .elapsedMillis(result.getElapsedMillis())
                .build();
    }
}

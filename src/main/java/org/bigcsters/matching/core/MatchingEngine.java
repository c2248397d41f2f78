package org.bigcsters.matching.core;

import it.unimi.dsi.fastutil.ints.IntList;
import lombok.Builder;
import lombok.extern.slf4j.Slf4j;
import org.bigcsters.matching.evaluation.Evaluator;
import org.bigcsters.matching.profile.ProfileStore;
import org.bigcsters.matching.score.CompatibilityScorer;
import org.bigcsters.matching.score.ScoreMatrix;
import org.bigcsters.matching.score.ScoringWeights;
import org.bigcsters.matching.solver.OrToolsSolverBackend;
import org.bigcsters.matching.solver.SolverBackend;
import org.bigcsters.matching.solver.SolverException;
import org.bigcsters.matching.strategy.GreedyMatchingStrategy;
import org.bigcsters.matching.strategy.HybridPriorityStableStrategy;
import org.bigcsters.matching.strategy.IlpOptimalStrategy;
import org.bigcsters.matching.strategy.MatchingStrategy;
import org.bigcsters.matching.strategy.StableMatchingStrategy;
import org.bigcsters.matching.strategy.WeightedOptimalMatchingStrategy;

import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Entry point of the matching core: scores profiles once, runs the selected strategies and
 * optionally compares them.
 *
 * <p>Configuration errors and malformed profiles are fatal and thrown as
 * {@link MatchingException} before any strategy runs. Strategy failures are isolated: they
 * become {@link AlgorithmResult.Status#FAILED} results while other strategies complete.</p>
 */
@Slf4j
public final class MatchingEngine {
    private final MatchingEngineConfig config;
    private final CompatibilityScorer scorer = new CompatibilityScorer();
    private final Evaluator evaluator = new Evaluator();
    private final Map<MatchingAlgorithm, MatchingStrategy> strategies;

    /**
     * Creates an engine.
     *
     * @param config engine configuration, defaults when null.
     * @param solverBackend ILP backend, OR-Tools when null.
     * @param strategies optional strategy replacements keyed by algorithm.
     */
    @Builder
    public MatchingEngine(
            MatchingEngineConfig config,
            SolverBackend solverBackend,
            Map<MatchingAlgorithm, MatchingStrategy> strategies
    ) {
        this.config = (config == null ? MatchingEngineConfig.defaults() : config).validate();
        SolverBackend backend = solverBackend == null ? new OrToolsSolverBackend() : solverBackend;

        EnumMap<MatchingAlgorithm, MatchingStrategy> resolved = new EnumMap<>(MatchingAlgorithm.class);
        for (MatchingAlgorithm algorithm : MatchingAlgorithm.values()) {
            MatchingStrategy custom = strategies == null ? null : strategies.get(algorithm);
            resolved.put(algorithm, custom == null ? createStrategy(algorithm, backend) : custom);
        }
        this.strategies = resolved;
    }

    public MatchingEngineConfig config() {
        return config;
    }

    /**
     * Runs the selection with the configured weights.
     */
    public MatchingRun run(ProfileStore profiles, AlgorithmSelection selection) {
        return run(profiles, selection, Map.of());
    }

    /**
     * Scores the profiles and runs the selected strategies.
     *
     * @param profiles validated profiles.
     * @param selection strategies to run.
     * @param weightOverrides named weight overrides; null or empty for none.
     * @return run output.
     * @throws MatchingException with {@link MatchingException#REASON_INVALID_CONFIGURATION} for
     * bad overrides.
     */
    public MatchingRun run(
            ProfileStore profiles,
            AlgorithmSelection selection,
            Map<String, ? extends Number> weightOverrides
    ) {
        Objects.requireNonNull(profiles, "profiles");
        Objects.requireNonNull(selection, "selection");
        ScoringWeights weights = config.getWeights().withOverrides(weightOverrides);

        ScoreMatrix matrix = scorer.buildMatrix(profiles, weights);
        double[] priorities = new double[profiles.menteeCount()];
        for (int e = 0; e < priorities.length; e++) {
            priorities[e] = config.getHybrid().priorityOf(profiles.mentee(e));
        }
        MatchingProblem problem = MatchingProblem.of(matrix, profiles.capacities(), priorities);
        log.info("scored {} mentor(s) x {} mentee(s), total capacity {}",
                matrix.mentorCount(), matrix.menteeCount(), problem.totalCapacity());
        return solve(problem, selection);
    }

    /**
     * Runs the selected strategies on a prepared problem.
     *
     * @param problem problem shared by every strategy.
     * @param selection strategies to run.
     * @return run output with results in {@link MatchingAlgorithm} order.
     */
    public MatchingRun solve(MatchingProblem problem, AlgorithmSelection selection) {
        Objects.requireNonNull(problem, "problem");
        Objects.requireNonNull(selection, "selection");
        ScoreMatrix matrix = problem.scoreMatrix();

        MatchingRun.MatchingRunBuilder run = MatchingRun.builder()
                .scoreMatrix(matrix)
                .problem(problem);
        IntList withoutEligible = matrix.menteesWithoutEligibleMentor();
        for (int i = 0; i < withoutEligible.size(); i++) {
            String menteeId = matrix.menteeId(withoutEligible.getInt(i));
            log.warn("[{}] mentee {} has no eligible mentor", MatchingException.REASON_NO_ELIGIBLE_PAIRS, menteeId);
            run.noEligibleMenteeId(menteeId);
        }

        List<AlgorithmResult> results = selection.isCompare() && config.isParallelComparison()
                && selection.getAlgorithms().size() > 1
                ? runConcurrently(problem, selection.getAlgorithms())
                : runSequentially(problem, selection.getAlgorithms());
        run.results(results);
        if (selection.isCompare()) {
            run.evaluation(evaluator.evaluate(results, problem));
        }
        return run.build();
    }

    private List<AlgorithmResult> runSequentially(MatchingProblem problem, List<MatchingAlgorithm> algorithms) {
        List<AlgorithmResult> results = new ArrayList<>(algorithms.size());
        for (MatchingAlgorithm algorithm : algorithms) {
            results.add(runStrategy(problem, algorithm));
        }
        return results;
    }

    private List<AlgorithmResult> runConcurrently(MatchingProblem problem, List<MatchingAlgorithm> algorithms) {
        int threads = Math.min(config.getComparisonThreads(), algorithms.size());
        AtomicInteger threadIds = new AtomicInteger();
        ExecutorService pool = Executors.newFixedThreadPool(threads, task -> {
            Thread thread = new Thread(task, "matching-strategy-" + threadIds.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        });
        try {
            List<Future<AlgorithmResult>> futures = new ArrayList<>(algorithms.size());
            for (MatchingAlgorithm algorithm : algorithms) {
                futures.add(pool.submit(() -> runStrategy(problem, algorithm)));
            }
            List<AlgorithmResult> results = new ArrayList<>(algorithms.size());
            for (int i = 0; i < futures.size(); i++) {
                try {
                    results.add(futures.get(i).get());
                } catch (ExecutionException ex) {
                    MatchingAlgorithm algorithm = algorithms.get(i);
                    log.error("{} aborted", algorithm, ex.getCause());
                    results.add(AlgorithmResult.failed(
                            algorithm,
                            MatchingException.REASON_STRATEGY_FAILED,
                            String.valueOf(ex.getCause()),
                            0L
                    ));
                } catch (InterruptedException ex) {
                    Thread.currentThread().interrupt();
                    throw new MatchingException(
                            MatchingException.REASON_STRATEGY_FAILED,
                            "interrupted while waiting for " + algorithms.get(i),
                            ex
                    );
                }
            }
            return results;
        } finally {
            pool.shutdownNow();
        }
    }

    private AlgorithmResult runStrategy(MatchingProblem problem, MatchingAlgorithm algorithm) {
        MatchingStrategy strategy = strategies.get(algorithm);
        long startNanos = System.nanoTime();
        try {
            Assignment assignment = strategy.solve(problem);
            long elapsed = elapsedMillis(startNanos);
            log.info("{} assigned {}/{} mentee(s), total score {} in {} ms",
                    algorithm, assignment.assignedCount(), assignment.menteeCount(),
                    assignment.totalScore(), elapsed);
            return AlgorithmResult.succeeded(algorithm, assignment, elapsed);
        } catch (SolverException ex) {
            log.warn("{} failed: {}", algorithm, ex.getMessage());
            return AlgorithmResult.failed(algorithm, ex.getReasonCode(), ex.getMessage(), elapsedMillis(startNanos));
        } catch (MatchingException ex) {
            log.warn("{} failed: {}", algorithm, ex.getMessage());
            return AlgorithmResult.failed(algorithm, ex.getReasonCode(), ex.getMessage(), elapsedMillis(startNanos));
        } catch (RuntimeException ex) {
            log.error("{} failed unexpectedly", algorithm, ex);
            return AlgorithmResult.failed(
                    algorithm,
                    MatchingException.REASON_STRATEGY_FAILED,
                    "[" + MatchingException.REASON_STRATEGY_FAILED + "] " + ex,
                    elapsedMillis(startNanos)
            );
        }
    }

    private MatchingStrategy createStrategy(MatchingAlgorithm algorithm, SolverBackend backend) {
        return switch (algorithm) {
            case GREEDY -> new GreedyMatchingStrategy();
            case WEIGHTED_OPTIMAL -> new WeightedOptimalMatchingStrategy();
            case STABLE -> new StableMatchingStrategy();
            case HYBRID_PRIORITY_STABLE -> new HybridPriorityStableStrategy(config.getHybrid());
            case ILP_OPTIMAL -> new IlpOptimalStrategy(
                    backend,
                    config.getSolverTimeout(),
                    config.getSolverTimeoutRetries()
            );
        };
    }

    private static long elapsedMillis(long startNanos) {
        return (System.nanoTime() - startNanos) / 1_000_000L;
    }
}

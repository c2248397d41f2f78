package org.bigcsters.matching.strategy;

import it.unimi.dsi.fastutil.ints.IntArrayList;
import lombok.extern.slf4j.Slf4j;
import org.bigcsters.matching.core.Assignment;
import org.bigcsters.matching.core.MatchingAlgorithm;
import org.bigcsters.matching.core.MatchingProblem;
import org.bigcsters.matching.solver.LinearProgram;
import org.bigcsters.matching.solver.SolverBackend;
import org.bigcsters.matching.solver.SolverException;
import org.bigcsters.matching.solver.SolverSolution;

import java.time.Duration;
import java.util.Objects;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Exact maximum-total-score assignment as a 0/1 integer program.
 *
 * <pre>
 *   maximise   sum(score[r][e] * x[r][e])   over eligible pairs
 *   subject to sum_r x[r][e] &lt;= 1            for every mentee
 *              sum_e x[r][e] &lt;= capacity[r]  for every mentor
 * </pre>
 *
 * <p>The backend call runs on a dedicated thread and is bounded by the configured timeout.
 * Failures surface as {@link SolverException}.</p>
 */
@Slf4j
public final class IlpOptimalStrategy implements MatchingStrategy {
    private final SolverBackend backend;
    private final Duration timeout;
    private final int timeoutRetries;

    /**
     * @param backend solver backend.
     * @param timeout bound on each backend call, also forwarded as the backend time limit.
     * @param timeoutRetries extra attempts after a timeout.
     */
    public IlpOptimalStrategy(SolverBackend backend, Duration timeout, int timeoutRetries) {
        this.backend = Objects.requireNonNull(backend, "backend");
        this.timeout = Objects.requireNonNull(timeout, "timeout");
        if (timeout.isNegative() || timeout.isZero()) {
            throw new IllegalArgumentException("timeout must be positive");
        }
        if (timeoutRetries < 0) {
            throw new IllegalArgumentException("timeoutRetries must be >= 0");
        }
        this.timeoutRetries = timeoutRetries;
    }

    @Override
    public MatchingAlgorithm algorithm() {
        return MatchingAlgorithm.ILP_OPTIMAL;
    }

    @Override
    public Assignment solve(MatchingProblem problem) {
        Objects.requireNonNull(problem, "problem");
        int mentorCount = problem.mentorCount();
        int menteeCount = problem.menteeCount();
        if (menteeCount > 0 && problem.totalCapacity() == 0L) {
            throw new SolverException(
                    SolverException.REASON_SOLVER_INFEASIBLE,
                    "total mentor capacity is 0 for " + menteeCount + " mentee(s)"
            );
        }

        LinearProgram.Builder program = LinearProgram.builder();
        IntArrayList pairMentor = new IntArrayList();
        IntArrayList pairMentee = new IntArrayList();
        IntArrayList[] menteeVariables = new IntArrayList[menteeCount];
        IntArrayList[] mentorVariables = new IntArrayList[mentorCount];
        for (int r = 0; r < mentorCount; r++) {
            mentorVariables[r] = new IntArrayList();
            if (problem.capacity(r) == 0) {
                continue;
            }
            for (int e = 0; e < menteeCount; e++) {
                if (!problem.isEligible(r, e)) {
                    continue;
                }
                int variable = program.addBinaryVariable("x_" + r + "_" + e, problem.score(r, e));
                pairMentor.add(r);
                pairMentee.add(e);
                mentorVariables[r].add(variable);
                if (menteeVariables[e] == null) {
                    menteeVariables[e] = new IntArrayList();
                }
                menteeVariables[e].add(variable);
            }
        }
        if (pairMentor.isEmpty()) {
            return Assignment.builder(problem).build();
        }
        for (int e = 0; e < menteeCount; e++) {
            if (menteeVariables[e] != null) {
                program.addAtMost("mentee_" + e, menteeVariables[e].toIntArray(), 1.0d);
            }
        }
        for (int r = 0; r < mentorCount; r++) {
            if (!mentorVariables[r].isEmpty()) {
                program.addAtMost("mentor_" + r, mentorVariables[r].toIntArray(), problem.capacity(r));
            }
        }
        LinearProgram built = program.build();

        SolverSolution solution = solveBounded(built);
        double[] values = solution.values();
        if (values.length != built.variableCount()) {
            throw new SolverException(
                    SolverException.REASON_SOLVER_ABNORMAL,
                    backend.id() + " returned " + values.length + " values for " + built.variableCount() + " variables"
            );
        }
        for (LinearProgram.Constraint constraint : built.constraints()) {
            if (!constraint.isSatisfiedBy(values)) {
                throw new SolverException(
                        SolverException.REASON_SOLVER_ABNORMAL,
                        backend.id() + " returned a solution violating " + constraint.name()
                );
            }
        }

        Assignment.Builder builder = Assignment.builder(problem);
        for (int i = 0; i < built.variableCount(); i++) {
            if (solution.isSet(i)) {
                builder.assign(pairMentee.getInt(i), pairMentor.getInt(i));
            }
        }
        if (solution.status() != SolverSolution.Status.OPTIMAL) {
            log.warn("{} returned a {} solution for {} variables, objective {}; assignment may not be optimal",
                    backend.id(), solution.status(), built.variableCount(), solution.objectiveValue());
        } else {
            log.debug("{} solved {} variables with status {}, objective {}",
                    backend.id(), built.variableCount(), solution.status(), solution.objectiveValue());
        }
        return builder.build();
    }

    private SolverSolution solveBounded(LinearProgram program) {
        for (int attempt = 0; attempt <= timeoutRetries; attempt++) {
            // A native solve may ignore interruption, so every attempt gets its own thread.
            ExecutorService executor = newSolverExecutor(attempt + 1);
            Future<SolverSolution> future = executor.submit(() -> backend.solve(program, timeout));
            try {
                return future.get(timeout.toMillis(), TimeUnit.MILLISECONDS);
            } catch (TimeoutException ex) {
                future.cancel(true);
                log.warn("{} exceeded {} ms (attempt {} of {})",
                        backend.id(), timeout.toMillis(), attempt + 1, timeoutRetries + 1);
            } catch (ExecutionException ex) {
                Throwable cause = ex.getCause();
                if (cause instanceof SolverException solverException) {
                    throw solverException;
                }
                throw new SolverException(
                        SolverException.REASON_SOLVER_UNAVAILABLE,
                        backend.id() + " failed: " + cause,
                        cause
                );
            } catch (InterruptedException ex) {
                Thread.currentThread().interrupt();
                future.cancel(true);
                throw new SolverException(
                        SolverException.REASON_SOLVER_TIMEOUT,
                        "interrupted while waiting for " + backend.id(),
                        ex
                );
            } finally {
                executor.shutdownNow();
            }
        }
        throw new SolverException(
                SolverException.REASON_SOLVER_TIMEOUT,
                backend.id() + " did not finish within " + timeout.toMillis() + " ms after "
                        + (timeoutRetries + 1) + " attempt(s)"
        );
    }

    private static ExecutorService newSolverExecutor(int attempt) {
        return Executors.newSingleThreadExecutor(task -> {
            Thread thread = new Thread(task, "ilp-solver-" + attempt);
            thread.setDaemon(true);
            return thread;
        });
    }
}

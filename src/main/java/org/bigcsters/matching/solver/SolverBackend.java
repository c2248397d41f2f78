package org.bigcsters.matching.solver;

import java.time.Duration;

/**
 * Narrow seam to an integer-programming backend.
 *
 * <p>Implementations must treat the program as read-only and be callable from any thread.</p>
 */
public interface SolverBackend {

    /**
     * Stable backend identifier used in logs.
     */
    String id();

    /**
     * Solves a maximisation program over binary variables.
     *
     * @param program program to solve.
     * @param timeLimit advisory time limit forwarded to the backend.
     * @return optimal or feasible solution.
     * @throws SolverException with {@link SolverException#REASON_SOLVER_INFEASIBLE},
     * {@link SolverException#REASON_SOLVER_UNAVAILABLE}, {@link SolverException#REASON_SOLVER_TIMEOUT}
     * or {@link SolverException#REASON_SOLVER_ABNORMAL}.
     */
    SolverSolution solve(LinearProgram program, Duration timeLimit);
}

package org.bigcsters.matching.solver;

import java.util.Objects;

/**
 * Solution returned by a {@link SolverBackend}.
 *
 * @param status solve status, always OPTIMAL or FEASIBLE.
 * @param objectiveValue achieved objective.
 * @param values value per variable, variable index order.
 */
public record SolverSolution(Status status, double objectiveValue, double[] values) {

    /**
     * Statuses a backend may return alongside a solution.
     */
    public enum Status {
        OPTIMAL,
        FEASIBLE
    }

    public SolverSolution {
        Objects.requireNonNull(status, "status");
        values = Objects.requireNonNull(values, "values").clone();
    }

    /**
     * @return true when the binary variable is set in this solution.
     */
    public boolean isSet(int variableIndex) {
        return values[variableIndex] > 0.5d;
    }

    @Override
    public double[] values() {
        return values.clone();
    }
}

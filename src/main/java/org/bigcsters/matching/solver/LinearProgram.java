package org.bigcsters.matching.solver;

import it.unimi.dsi.fastutil.doubles.DoubleArrayList;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Objects;

/**
 * Backend-neutral maximisation program over binary variables with {@code <=} constraints.
 *
 * <pre>
 *   maximise   sum(objective[i] * x[i])
 *   subject to sum(coefficients[k] * x[variables[k]]) &lt;= upperBound   for every constraint
 *              x[i] in {0, 1}
 * </pre>
 */
public final class LinearProgram {
    private final List<String> variableNames;
    private final double[] objective;
    private final List<Constraint> constraints;

    private LinearProgram(List<String> variableNames, double[] objective, List<Constraint> constraints) {
        this.variableNames = variableNames;
        this.objective = objective;
        this.constraints = constraints;
    }

    public static Builder builder() {
        return new Builder();
    }

    public int variableCount() {
        return objective.length;
    }

    public String variableName(int variableIndex) {
        return variableNames.get(variableIndex);
    }

    public double objectiveCoefficient(int variableIndex) {
        return objective[variableIndex];
    }

    public List<Constraint> constraints() {
        return constraints;
    }

    /**
     * Evaluates the objective for a candidate solution.
     */
    public double objectiveValue(double[] values) {
        double total = 0.0d;
        for (int i = 0; i < objective.length; i++) {
            total += objective[i] * values[i];
        }
        return total;
    }

    /**
     * One {@code <=} row.
     *
     * @param name constraint label.
     * @param variables variable indices.
     * @param coefficients coefficient per listed variable.
     * @param upperBound right-hand side.
     */
    public record Constraint(String name, int[] variables, double[] coefficients, double upperBound) {
        public Constraint {
            Objects.requireNonNull(name, "name");
            variables = Objects.requireNonNull(variables, "variables").clone();
            coefficients = Objects.requireNonNull(coefficients, "coefficients").clone();
            if (variables.length != coefficients.length) {
                throw new IllegalArgumentException("constraint " + name + " has mismatched variable/coefficient counts");
            }
        }

        /**
         * @return true when the candidate solution respects this row.
         */
        public boolean isSatisfiedBy(double[] values) {
            double lhs = 0.0d;
            for (int k = 0; k < variables.length; k++) {
                lhs += coefficients[k] * values[variables[k]];
            }
            return lhs <= upperBound + 1e-9;
        }
    }

    /**
     * Incremental program builder. Not thread-safe.
     */
    public static final class Builder {
        private final List<String> variableNames = new ArrayList<>();
        private final DoubleArrayList objective = new DoubleArrayList();
        private final List<Constraint> constraints = new ArrayList<>();

        private Builder() {
        }

        /**
         * Adds a binary variable.
         *
         * @return index of the new variable.
         */
        public int addBinaryVariable(String name, double objectiveCoefficient) {
            if (!Double.isFinite(objectiveCoefficient)) {
                throw new IllegalArgumentException("objective coefficient of " + name + " must be finite");
            }
            variableNames.add(Objects.requireNonNull(name, "name"));
            objective.add(objectiveCoefficient);
            return objective.size() - 1;
        }

        /**
         * Adds {@code sum(x[variables]) <= upperBound} with unit coefficients.
         */
        public Builder addAtMost(String name, int[] variables, double upperBound) {
            double[] ones = new double[variables.length];
            Arrays.fill(ones, 1.0d);
            return addConstraint(new Constraint(name, variables, ones, upperBound));
        }

        public Builder addConstraint(Constraint constraint) {
            for (int variable : constraint.variables()) {
                if (variable < 0 || variable >= objective.size()) {
                    throw new IllegalArgumentException(
                            "constraint " + constraint.name() + " references unknown variable " + variable);
                }
            }
            constraints.add(constraint);
            return this;
        }

        public LinearProgram build() {
            return new LinearProgram(List.copyOf(variableNames), objective.toDoubleArray(), List.copyOf(constraints));
        }
    }
}

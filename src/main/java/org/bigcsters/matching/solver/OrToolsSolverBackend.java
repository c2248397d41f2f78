package org.bigcsters.matching.solver;

import com.google.ortools.Loader;
import com.google.ortools.linearsolver.MPConstraint;
import com.google.ortools.linearsolver.MPObjective;
import com.google.ortools.linearsolver.MPSolver;
import com.google.ortools.linearsolver.MPVariable;
import lombok.extern.slf4j.Slf4j;

import java.time.Duration;
import java.util.List;
import java.util.Objects;

/**
 * {@link SolverBackend} on Google OR-Tools' {@link MPSolver}.
 *
 * <p>Tries the configured mixed-integer solver ids in order (SCIP, then CBC by default).
 * Native libraries are loaded once per JVM; a load failure surfaces as
 * {@link SolverException#REASON_SOLVER_UNAVAILABLE}.</p>
 */
@Slf4j
public final class OrToolsSolverBackend implements SolverBackend {
    public static final List<String> DEFAULT_SOLVER_IDS = List.of("SCIP", "CBC");

    private static final Object NATIVE_LOCK = new Object();
    private static volatile boolean nativeLoaded;

    private final List<String> solverIds;

    public OrToolsSolverBackend() {
        this(DEFAULT_SOLVER_IDS);
    }

    /**
     * @param solverIds OR-Tools solver ids tried in order.
     */
    public OrToolsSolverBackend(List<String> solverIds) {
        this.solverIds = List.copyOf(Objects.requireNonNull(solverIds, "solverIds"));
        if (this.solverIds.isEmpty()) {
            throw new IllegalArgumentException("solverIds must be non-empty");
        }
    }

    @Override
    public String id() {
        return "ortools-mp:" + String.join("|", solverIds);
    }

    /**
     * @return true when the OR-Tools native libraries can be loaded in this JVM.
     */
    public static boolean isAvailable() {
        try {
            ensureNativeLibraries();
            return true;
        } catch (SolverException ex) {
            log.debug("OR-Tools unavailable: {}", ex.getMessage());
            return false;
        }
    }

    @Override
    public SolverSolution solve(LinearProgram program, Duration timeLimit) {
        Objects.requireNonNull(program, "program");
        Objects.requireNonNull(timeLimit, "timeLimit");
        ensureNativeLibraries();

        MPSolver solver = createSolver();
        try {
            solver.setTimeLimit(Math.max(1L, timeLimit.toMillis()));

            MPVariable[] x = new MPVariable[program.variableCount()];
            for (int i = 0; i < x.length; i++) {
                x[i] = solver.makeBoolVar(program.variableName(i));
            }
            for (LinearProgram.Constraint row : program.constraints()) {
                MPConstraint constraint = solver.makeConstraint(-MPSolver.infinity(), row.upperBound(), row.name());
                int[] variables = row.variables();
                double[] coefficients = row.coefficients();
                for (int k = 0; k < variables.length; k++) {
                    constraint.setCoefficient(x[variables[k]], coefficients[k]);
                }
            }
            MPObjective objective = solver.objective();
            for (int i = 0; i < x.length; i++) {
                objective.setCoefficient(x[i], program.objectiveCoefficient(i));
            }
            objective.setMaximization();

            MPSolver.ResultStatus status = solver.solve();
            log.debug("{} finished with status {} for {} variables", id(), status, x.length);
            if (status == MPSolver.ResultStatus.OPTIMAL || status == MPSolver.ResultStatus.FEASIBLE) {
                double[] values = new double[x.length];
                for (int i = 0; i < x.length; i++) {
                    values[i] = x[i].solutionValue();
                }
                SolverSolution.Status solutionStatus = status == MPSolver.ResultStatus.OPTIMAL
                        ? SolverSolution.Status.OPTIMAL
                        : SolverSolution.Status.FEASIBLE;
                return new SolverSolution(solutionStatus, objective.value(), values);
            }
            if (status == MPSolver.ResultStatus.INFEASIBLE) {
                throw new SolverException(
                        SolverException.REASON_SOLVER_INFEASIBLE,
                        "OR-Tools reported the program infeasible"
                );
            }
            if (status == MPSolver.ResultStatus.NOT_SOLVED) {
                throw new SolverException(
                        SolverException.REASON_SOLVER_TIMEOUT,
                        "OR-Tools found no solution within " + timeLimit.toMillis() + " ms"
                );
            }
            throw new SolverException(SolverException.REASON_SOLVER_ABNORMAL, "OR-Tools returned status " + status);
        } finally {
            solver.delete();
        }
    }

    private MPSolver createSolver() {
        for (String solverId : solverIds) {
            MPSolver solver = MPSolver.createSolver(solverId);
            if (solver != null) {
                return solver;
            }
            log.debug("OR-Tools solver {} is not available in this build", solverId);
        }
        throw new SolverException(
                SolverException.REASON_SOLVER_UNAVAILABLE,
                "none of the OR-Tools solvers " + solverIds + " could be created"
        );
    }

    private static void ensureNativeLibraries() {
        if (nativeLoaded) {
            return;
        }
        synchronized (NATIVE_LOCK) {
            if (nativeLoaded) {
                return;
            }
            try {
                Loader.loadNativeLibraries();
                nativeLoaded = true;
            } catch (UnsatisfiedLinkError | RuntimeException ex) {
                throw new SolverException(
                        SolverException.REASON_SOLVER_UNAVAILABLE,
                        "OR-Tools native libraries could not be loaded: " + ex.getMessage(),
                        ex
                );
            }
        }
    }
}

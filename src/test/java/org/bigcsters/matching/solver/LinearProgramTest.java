package org.bigcsters.matching.solver;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class LinearProgramTest {

    @Test
    @DisplayName("Builder assigns dense variable indices and keeps constraint order")
    void testBuilder() {
        LinearProgram.Builder builder = LinearProgram.builder();
        int a = builder.addBinaryVariable("a", 3.0);
        int b = builder.addBinaryVariable("b", 2.0);
        builder.addAtMost("pick-one", new int[]{a, b}, 1.0);
        LinearProgram program = builder.build();

        assertEquals(0, a);
        assertEquals(1, b);
        assertEquals(2, program.variableCount());
        assertEquals("b", program.variableName(1));
        assertEquals(1, program.constraints().size());
        assertEquals(3.0, program.objectiveValue(new double[]{1.0, 0.0}));
        assertTrue(program.constraints().get(0).isSatisfiedBy(new double[]{1.0, 0.0}));
        assertFalse(program.constraints().get(0).isSatisfiedBy(new double[]{1.0, 1.0}));
    }

    @Test
    @DisplayName("Unknown variables and non-finite coefficients are rejected")
    void testGuards() {
        LinearProgram.Builder builder = LinearProgram.builder();
        builder.addBinaryVariable("a", 1.0);

        assertThrows(IllegalArgumentException.class, () -> builder.addAtMost("bad", new int[]{0, 5}, 1.0));
        assertThrows(IllegalArgumentException.class, () -> builder.addBinaryVariable("inf", Double.POSITIVE_INFINITY));
        assertThrows(IllegalArgumentException.class,
                () -> new LinearProgram.Constraint("mismatch", new int[]{0}, new double[]{1.0, 2.0}, 1.0));
    }

    @Test
    @DisplayName("Solver exception carries the reason code in its message")
    void testSolverExceptionFormat() {
        SolverException ex = new SolverException(SolverException.REASON_SOLVER_TIMEOUT, "slow");

        assertEquals(SolverException.REASON_SOLVER_TIMEOUT, ex.getReasonCode());
        assertEquals("[SOLVER_TIMEOUT] slow", ex.getMessage());
        assertThrows(IllegalArgumentException.class, () -> new SolverException(" ", "blank"));
    }
}

package org.bigcsters.matching.strategy;

import org.bigcsters.matching.core.Assignment;
import org.bigcsters.matching.core.MatchingAlgorithm;
import org.bigcsters.matching.core.MatchingProblem;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.Random;

import static org.bigcsters.matching.testutil.MatchingFixtureFactory.X;
import static org.bigcsters.matching.testutil.MatchingFixtureFactory.assertValidAssignment;
import static org.bigcsters.matching.testutil.MatchingFixtureFactory.problem;
import static org.bigcsters.matching.testutil.MatchingFixtureFactory.randomProblem;
import static org.bigcsters.matching.testutil.MatchingFixtureFactory.threeMentorsFourMentees;
import static org.junit.jupiter.api.Assertions.*;

class GreedyMatchingStrategyTest {

    private final GreedyMatchingStrategy greedy = new GreedyMatchingStrategy();

    @Test
    @DisplayName("Greedy takes the highest remaining score first")
    void testHighestScoreFirst() {
        MatchingProblem problem = threeMentorsFourMentees();
        Assignment assignment = greedy.solve(problem);

        assertValidAssignment(assignment, problem);
        assertEquals(0, assignment.mentorOf(0));
        assertEquals(1, assignment.mentorOf(1));
        assertEquals(2, assignment.mentorOf(2));
        assertEquals(2, assignment.mentorOf(3));
        assertEquals(35.0, assignment.totalScore(), 1e-9);
        assertEquals(MatchingAlgorithm.GREEDY, greedy.algorithm());
    }

    @Test
    @DisplayName("Second mentee falls through to its next eligible mentor when the top mentor is full")
    void testFallThrough() {
        MatchingProblem problem = problem(new double[][]{
                {10.0, 9.0},
                {3.0, 4.0}
        }, 1, 1);
        Assignment assignment = greedy.solve(problem);

        assertEquals(0, assignment.mentorOf(0));
        assertEquals(1, assignment.mentorOf(1));
        assertEquals(1, assignment.load(0));
    }

    @Test
    @DisplayName("Equal scores are resolved by mentee index, then mentor index")
    void testTieBreaks() {
        MatchingProblem problem = problem(new double[][]{
                {5.0, 5.0},
                {5.0, 5.0}
        }, 1, 1);
        Assignment assignment = greedy.solve(problem);

        assertEquals(0, assignment.mentorOf(0));
        assertEquals(1, assignment.mentorOf(1));
    }

    @Test
    @DisplayName("Mentee without eligible mentor stays unassigned")
    void testNoEligibleMentor() {
        MatchingProblem problem = problem(new double[][]{
                {4.0, X},
                {2.0, X}
        }, 2, 2);
        Assignment assignment = greedy.solve(problem);

        assertEquals(0, assignment.mentorOf(0));
        assertFalse(assignment.isAssigned(1));
        assertEquals(1, assignment.unassignedCount());
    }

    @Test
    @DisplayName("Zero capacity leaves every mentee unassigned without error")
    void testZeroCapacity() {
        MatchingProblem problem = problem(new double[][]{{3.0, 4.0, 5.0}}, 0);
        Assignment assignment = greedy.solve(problem);

        assertEquals(3, assignment.unassignedCount());
        assertEquals(0.0, assignment.totalScore());
    }

    @Test
    @DisplayName("Empty problem yields an empty assignment")
    void testEmptyProblem() {
        MatchingProblem problem = problem(new double[0][0]);
        Assignment assignment = greedy.solve(problem);

        assertEquals(0, assignment.menteeCount());
        assertEquals(0, assignment.mentorCount());
    }

    @Test
    @DisplayName("Randomised: invariants hold and runs are deterministic")
    void testRandomInvariants() {
        Random random = new Random(11L);
        for (int round = 0; round < 50; round++) {
            MatchingProblem problem = randomProblem(random, 1 + random.nextInt(5), random.nextInt(8), 3, 0.2);
            Assignment first = greedy.solve(problem);
            assertValidAssignment(first, problem);
            assertEquals(first, greedy.solve(problem));
        }
    }
}

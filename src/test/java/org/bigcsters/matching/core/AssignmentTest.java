package org.bigcsters.matching.core;

import org.bigcsters.matching.score.ScoreMatrix;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;
import java.util.Optional;

import static org.bigcsters.matching.testutil.MatchingFixtureFactory.X;
import static org.junit.jupiter.api.Assertions.*;

class AssignmentTest {

    private static MatchingProblem sample() {
        ScoreMatrix matrix = ScoreMatrix.of(
                List.of("ada@uwaterloo.ca", "grace@uwaterloo.ca"),
                List.of("e1@uwaterloo.ca", "e2@uwaterloo.ca", "e3@uwaterloo.ca"),
                new double[][]{
                        {5.0, 3.0, X},
                        {1.0, 2.0, 4.0}
                }
        );
        return MatchingProblem.of(matrix, new int[]{2, 1});
    }

    @Test
    @DisplayName("Builder enforces uniqueness, capacity and eligibility")
    void testBuilderGuards() {
        Assignment.Builder builder = Assignment.builder(sample());
        builder.assign(0, 0);

        assertThrows(IllegalStateException.class, () -> builder.assign(0, 1), "already assigned");
        assertThrows(IllegalStateException.class, () -> builder.assign(2, 0), "ineligible");
        builder.assign(2, 1);
        assertThrows(IllegalStateException.class, () -> builder.assign(1, 1), "mentor full");
        assertFalse(builder.hasCapacity(1));
        assertTrue(builder.hasCapacity(0));
    }

    @Test
    @DisplayName("Mentor buckets are frozen in mentee input order")
    void testBucketOrdering() {
        Assignment assignment = Assignment.builder(sample())
                .assign(1, 0)
                .assign(0, 0)
                .build();

        assertEquals(List.of(0, 1), assignment.menteesOf(0));
        assertEquals(List.of("e1@uwaterloo.ca", "e2@uwaterloo.ca"), assignment.menteesOf("ada@uwaterloo.ca"));
        assertEquals(List.of(), assignment.menteesOf("grace@uwaterloo.ca"));
        assertEquals(8.0, assignment.totalScore(), 1e-9);
        assertEquals(2, assignment.assignedCount());
        assertEquals(1, assignment.unassignedCount());
    }

    @Test
    @DisplayName("Id-level views report assigned pairs and unassigned mentees")
    void testIdViews() {
        Assignment assignment = Assignment.builder(sample())
                .assign(0, 0)
                .assign(2, 1)
                .build();

        assertEquals(Map.of("e1@uwaterloo.ca", "ada@uwaterloo.ca", "e3@uwaterloo.ca", "grace@uwaterloo.ca"),
                assignment.menteeToMentor());
        assertEquals(Optional.of("grace@uwaterloo.ca"), assignment.mentorIdOf("e3@uwaterloo.ca"));
        assertEquals(Optional.empty(), assignment.mentorIdOf("e2@uwaterloo.ca"));
        assertEquals(List.of("e2@uwaterloo.ca"), assignment.unassignedMenteeIds());
        assertThrows(IllegalArgumentException.class, () -> assignment.mentorIdOf("nobody@uwaterloo.ca"));
    }

    @Test
    @DisplayName("Unassign frees the slot and copyOf reproduces an assignment")
    void testUnassignAndCopy() {
        MatchingProblem problem = sample();
        Assignment.Builder builder = Assignment.builder(problem).assign(2, 1);
        builder.unassign(2);
        builder.assign(1, 1);
        Assignment assignment = builder.build();

        assertEquals(Assignment.UNASSIGNED, assignment.mentorOf(2));
        assertEquals(1, assignment.mentorOf(1));
        assertEquals(assignment, Assignment.builder(problem).copyOf(assignment).build());
        assertEquals(assignment.hashCode(), Assignment.builder(problem).copyOf(assignment).build().hashCode());
    }

    @Test
    @DisplayName("Built assignment is unaffected by later builder changes")
    void testImmutability() {
        Assignment.Builder builder = Assignment.builder(sample()).assign(0, 0);
        Assignment frozen = builder.build();
        builder.unassign(0);

        assertEquals(0, frozen.mentorOf(0));
        int[] copy = frozen.toMentorArray();
        copy[0] = 1;
        assertEquals(0, frozen.mentorOf(0));
    }
}

package org.bigcsters.matching.score;

import org.bigcsters.core.id.IDMapper;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.bigcsters.matching.testutil.MatchingFixtureFactory.X;
import static org.junit.jupiter.api.Assertions.*;

class ScoreMatrixTest {

    @Test
    @DisplayName("Eligibility, max score and mentees without any eligible mentor")
    void testQueries() {
        ScoreMatrix matrix = ScoreMatrix.of(new double[][]{
                {3.0, X, 0.0},
                {9.5, X, X}
        });

        assertEquals(2, matrix.mentorCount());
        assertEquals(3, matrix.menteeCount());
        assertEquals("M1", matrix.mentorId(1));
        assertEquals("E2", matrix.menteeId(2));
        assertEquals(9.5, matrix.maxScore());
        assertEquals(2, matrix.eligibleMentorCount(0));
        assertEquals(List.of(1), matrix.menteesWithoutEligibleMentor());
        assertTrue(matrix.isEligible(0, 2));
    }

    @Test
    @DisplayName("Input array is copied")
    void testDefensiveCopy() {
        double[][] scores = {{1.0}};
        ScoreMatrix matrix = ScoreMatrix.of(scores);
        scores[0][0] = 50.0;

        assertEquals(1.0, matrix.score(0, 0));
    }

    @Test
    @DisplayName("Negative, NaN and positive infinite scores and ragged shapes are rejected")
    void testValidation() {
        assertThrows(IllegalArgumentException.class, () -> ScoreMatrix.of(new double[][]{{-1.0}}));
        assertThrows(IllegalArgumentException.class, () -> ScoreMatrix.of(new double[][]{{Double.NaN}}));
        assertThrows(IllegalArgumentException.class,
                () -> ScoreMatrix.of(new double[][]{{Double.POSITIVE_INFINITY}}));
        assertThrows(IllegalArgumentException.class, () -> ScoreMatrix.of(new double[][]{{1.0, 2.0}, {1.0}}));
        assertThrows(IllegalArgumentException.class,
                () -> ScoreMatrix.of(List.of("a"), List.of("b"), new double[][]{{1.0}, {2.0}}));
    }

    @Test
    @DisplayName("All-ineligible matrix has max score zero")
    void testAllIneligible() {
        assertEquals(0.0, ScoreMatrix.of(new double[][]{{X, X}}).maxScore());
    }

    @Test
    @DisplayName("Id lookups resolve through the id mappers")
    void testIdLookups() {
        IDMapper mentors = IDMapper.createImmutable(List.of("ada@uwaterloo.ca", "grace@uwaterloo.ca"));
        IDMapper mentees = IDMapper.createImmutable(List.of("e1@uwaterloo.ca"));
        ScoreMatrix matrix = ScoreMatrix.of(mentors, mentees, new double[][]{{1.0}, {2.0}});

        assertEquals(1, matrix.mentorIndexOf("grace@uwaterloo.ca"));
        assertEquals(0, matrix.menteeIndexOf("e1@uwaterloo.ca"));
        assertEquals("grace@uwaterloo.ca", matrix.mentorId(1));
        assertEquals(List.of("ada@uwaterloo.ca", "grace@uwaterloo.ca"), matrix.mentorIds());
        assertThrows(IllegalArgumentException.class, () -> matrix.mentorIndexOf("nobody@uwaterloo.ca"));
        assertThrows(IllegalArgumentException.class, () -> matrix.menteeIndexOf("ada@uwaterloo.ca"));
    }

    @Test
    @DisplayName("Duplicate or blank ids are rejected")
    void testInvalidIds() {
        assertThrows(IllegalArgumentException.class,
                () -> ScoreMatrix.of(List.of("a", "a"), List.of("b"), new double[][]{{1.0}, {2.0}}));
        assertThrows(IllegalArgumentException.class,
                () -> ScoreMatrix.of(List.of(" "), List.of("b"), new double[][]{{1.0}}));
    }
}

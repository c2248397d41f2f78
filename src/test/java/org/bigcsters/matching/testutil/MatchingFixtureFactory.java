package org.bigcsters.matching.testutil;

import org.bigcsters.matching.core.Assignment;
import org.bigcsters.matching.core.MatchingProblem;
import org.bigcsters.matching.profile.MeetingPreference;
import org.bigcsters.matching.profile.MenteeProfile;
import org.bigcsters.matching.profile.MentorProfile;
import org.bigcsters.matching.score.CompatibilityScorer;
import org.bigcsters.matching.score.ScoreMatrix;

import java.util.Random;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

/**
 * Shared test fixture factory for matching tests.
 */
public final class MatchingFixtureFactory {
    /** Shorthand for an ineligible cell in score literals. */
    public static final double X = CompatibilityScorer.INELIGIBLE;

    private MatchingFixtureFactory() {
    }

    /**
     * @param scores {@code scores[mentor][mentee]}.
     * @param capacities capacity per mentor.
     */
    public static MatchingProblem problem(double[][] scores, int... capacities) {
        return MatchingProblem.of(ScoreMatrix.of(scores), capacities);
    }

    public static MatchingProblem problem(double[][] scores, int[] capacities, double[] priorities) {
        return MatchingProblem.of(ScoreMatrix.of(scores), capacities, priorities);
    }

    /**
     * Three mentors with capacities [1, 1, 2], four mentees, all pairs eligible, distinct scores.
     */
    public static MatchingProblem threeMentorsFourMentees() {
        return problem(new double[][]{
                {10.0, 9.0, 3.0, 1.0},
                {8.0, 2.0, 7.0, 4.0},
                {6.0, 5.0, 11.0, 12.0}
        }, 1, 1, 2);
    }

    /**
     * Random instance with integer scores in [0, 30] and roughly {@code ineligibleRate} ineligible cells.
     */
    public static MatchingProblem randomProblem(
            Random random,
            int mentorCount,
            int menteeCount,
            int maxCapacity,
            double ineligibleRate
    ) {
        double[][] scores = new double[mentorCount][menteeCount];
        for (int r = 0; r < mentorCount; r++) {
            for (int e = 0; e < menteeCount; e++) {
                scores[r][e] = random.nextDouble() < ineligibleRate ? X : random.nextInt(31);
            }
        }
        int[] capacities = new int[mentorCount];
        for (int r = 0; r < mentorCount; r++) {
            capacities[r] = random.nextInt(maxCapacity + 1);
        }
        double[] priorities = new double[menteeCount];
        for (int e = 0; e < menteeCount; e++) {
            priorities[e] = random.nextInt(3);
        }
        return problem(scores, capacities, priorities);
    }

    /**
     * Asserts the structural invariants every strategy must keep.
     */
    public static void assertValidAssignment(Assignment assignment, MatchingProblem problem) {
        assertEquals(problem.menteeCount(), assignment.menteeCount());
        assertEquals(problem.mentorCount(), assignment.mentorCount());
        int[] load = new int[problem.mentorCount()];
        double total = 0.0d;
        for (int e = 0; e < problem.menteeCount(); e++) {
            int r = assignment.mentorOf(e);
            if (r == Assignment.UNASSIGNED) {
                continue;
            }
            assertTrue(problem.isEligible(r, e), "ineligible pair assigned: mentor " + r + ", mentee " + e);
            assertTrue(assignment.menteesOf(r).contains(e));
            load[r]++;
            total += problem.score(r, e);
        }
        for (int r = 0; r < problem.mentorCount(); r++) {
            assertTrue(load[r] <= problem.capacity(r), "mentor " + r + " over capacity");
            assertEquals(load[r], assignment.load(r));
        }
        assertEquals(total, assignment.totalScore(), 1e-9);
    }

    public static MentorProfile mentor(String email, int capacity, MeetingPreference preference, String location) {
        return MentorProfile.builder()
                .email(email)
                .name(email.substring(0, email.indexOf('@')))
                .pronouns("they/them")
                .program("Computer Science")
                .term("4A")
                .location(location)
                .meetingPreference(preference)
                .topic("Co-op")
                .careerTopic("Software")
                .capacity(capacity)
                .build();
    }

    public static MenteeProfile mentee(String email, MeetingPreference preference, String location) {
        return MenteeProfile.builder()
                .email(email)
                .name(email.substring(0, email.indexOf('@')))
                .pronouns("she/her")
                .program("Computer Science")
                .term("1A")
                .location(location)
                .meetingPreference(preference)
                .topic("Co-op")
                .careerTopic("Software")
                .build();
    }
}

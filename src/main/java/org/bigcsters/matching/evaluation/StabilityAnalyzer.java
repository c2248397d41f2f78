package org.bigcsters.matching.evaluation;

import lombok.experimental.UtilityClass;
import org.bigcsters.matching.core.Assignment;
import org.bigcsters.matching.core.MatchingProblem;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Objects;

/**
 * Blocking-pair detection over a mentee-indexed mentor array.
 *
 * <p>An eligible pair {@code (r, e)} with {@code e} not assigned to {@code r} blocks when
 * {@code e} is unassigned or strictly prefers {@code r} to its current mentor, and
 * {@code r} has a free slot or strictly prefers {@code e} to its lowest-scoring assigned
 * mentee. Mentors with capacity {@code 0} never block.</p>
 */
@UtilityClass
public class StabilityAnalyzer {

    /**
     * Lists blocking pairs ordered by mentee index, then by the mentee's preference
     * (score descending, mentor index ascending).
     *
     * @param problem problem the assignment was computed for.
     * @param mentorOfMentee mentor index per mentee, {@link Assignment#UNASSIGNED} when unassigned.
     * @return blocking pairs, empty for a stable assignment.
     */
    public List<BlockingPair> findBlockingPairs(MatchingProblem problem, int[] mentorOfMentee) {
        Objects.requireNonNull(problem, "problem");
        Objects.requireNonNull(mentorOfMentee, "mentorOfMentee");
        if (mentorOfMentee.length != problem.menteeCount()) {
            throw new IllegalArgumentException(
                    "mentorOfMentee has " + mentorOfMentee.length + " entries, expected " + problem.menteeCount());
        }
        int mentorCount = problem.mentorCount();
        int[] load = new int[mentorCount];
        double[] worstScore = new double[mentorCount];
        Arrays.fill(worstScore, Double.POSITIVE_INFINITY);
        for (int e = 0; e < mentorOfMentee.length; e++) {
            int r = mentorOfMentee[e];
            if (r == Assignment.UNASSIGNED) {
                continue;
            }
            load[r]++;
            worstScore[r] = Math.min(worstScore[r], problem.score(r, e));
        }

        List<BlockingPair> pairs = new ArrayList<>();
        List<BlockingPair> menteePairs = new ArrayList<>();
        for (int e = 0; e < mentorOfMentee.length; e++) {
            menteePairs.clear();
            int current = mentorOfMentee[e];
            for (int r = 0; r < mentorCount; r++) {
                if (r == current || problem.capacity(r) == 0 || !problem.isEligible(r, e)) {
                    continue;
                }
                double candidate = problem.score(r, e);
                boolean menteeWants = current == Assignment.UNASSIGNED || candidate > problem.score(current, e);
                boolean mentorWants = load[r] < problem.capacity(r) || worstScore[r] < candidate;
                if (menteeWants && mentorWants) {
                    menteePairs.add(new BlockingPair(r, e));
                }
            }
            int menteeIndex = e;
            menteePairs.sort((a, b) -> {
                int byScore = Double.compare(
                        problem.score(b.mentorIndex(), menteeIndex),
                        problem.score(a.mentorIndex(), menteeIndex));
                return byScore != 0 ? byScore : Integer.compare(a.mentorIndex(), b.mentorIndex());
            });
            pairs.addAll(menteePairs);
        }
        return pairs;
    }

    /**
     * @return number of blocking pairs of the assignment.
     */
    public int countBlockingPairs(Assignment assignment, MatchingProblem problem) {
        Objects.requireNonNull(assignment, "assignment");
        return findBlockingPairs(problem, assignment.toMentorArray()).size();
    }

    /**
     * @return true when the assignment has no blocking pair.
     */
    public boolean isStable(Assignment assignment, MatchingProblem problem) {
        return countBlockingPairs(assignment, problem) == 0;
    }
}

package org.bigcsters.matching.strategy;

import it.unimi.dsi.fastutil.ints.IntArrayFIFOQueue;
import it.unimi.dsi.fastutil.ints.IntArrays;
import it.unimi.dsi.fastutil.ints.IntComparator;
import it.unimi.dsi.fastutil.ints.IntHeapPriorityQueue;
import org.bigcsters.matching.core.Assignment;
import org.bigcsters.matching.core.MatchingAlgorithm;
import org.bigcsters.matching.core.MatchingProblem;

import java.util.Arrays;
import java.util.Objects;

/**
 * Mentee-proposing deferred acceptance with mentor capacities.
 *
 * <p>Mentees rank eligible mentors by score descending, then mentor index. Mentors rank
 * proposers by score descending, then mentee index, and hold their {@code capacity} best
 * proposals. The result has no blocking pair and is the mentee-optimal stable assignment
 * for these preferences.</p>
 */
public final class StableMatchingStrategy implements MatchingStrategy {

    @Override
    public MatchingAlgorithm algorithm() {
        return MatchingAlgorithm.STABLE;
    }

    @Override
    public Assignment solve(MatchingProblem problem) {
        Objects.requireNonNull(problem, "problem");
        int mentorCount = problem.mentorCount();
        int menteeCount = problem.menteeCount();

        int[][] preferences = new int[menteeCount][];
        for (int e = 0; e < menteeCount; e++) {
            preferences[e] = menteePreferences(problem, e);
        }

        // heap top is the mentor's least preferred held mentee
        IntHeapPriorityQueue[] held = new IntHeapPriorityQueue[mentorCount];
        for (int r = 0; r < mentorCount; r++) {
            held[r] = new IntHeapPriorityQueue(worstFirst(problem, r));
        }

        int[] nextChoice = new int[menteeCount];
        IntArrayFIFOQueue free = new IntArrayFIFOQueue(Math.max(1, menteeCount));
        for (int e = 0; e < menteeCount; e++) {
            if (preferences[e].length > 0) {
                free.enqueue(e);
            }
        }

        long proposalLimit = (long) menteeCount * mentorCount;
        long proposals = 0L;
        while (!free.isEmpty()) {
            int e = free.dequeueInt();
            if (nextChoice[e] >= preferences[e].length) {
                continue;
            }
            int r = preferences[e][nextChoice[e]++];
            if (++proposals > proposalLimit) {
                throw new IllegalStateException("deferred acceptance exceeded " + proposalLimit + " proposals");
            }
            IntHeapPriorityQueue queue = held[r];
            if (queue.size() < problem.capacity(r)) {
                queue.enqueue(e);
                continue;
            }
            int worst = queue.firstInt();
            if (mentorPrefers(problem, r, e, worst)) {
                queue.dequeueInt();
                queue.enqueue(e);
                free.enqueue(worst);
            } else {
                free.enqueue(e);
            }
        }

        Assignment.Builder builder = Assignment.builder(problem);
        for (int r = 0; r < mentorCount; r++) {
            IntHeapPriorityQueue queue = held[r];
            while (!queue.isEmpty()) {
                builder.assign(queue.dequeueInt(), r);
            }
        }
        return builder.build();
    }

    /**
     * @return eligible mentors with capacity, best first (score desc, mentor index asc).
     */
    static int[] menteePreferences(MatchingProblem problem, int menteeIndex) {
        int count = 0;
        int[] mentors = new int[problem.mentorCount()];
        for (int r = 0; r < problem.mentorCount(); r++) {
            if (problem.capacity(r) > 0 && problem.isEligible(r, menteeIndex)) {
                mentors[count++] = r;
            }
        }
        int[] ranked = Arrays.copyOf(mentors, count);
        IntArrays.mergeSort(ranked, (a, b) -> {
            int byScore = Double.compare(problem.score(b, menteeIndex), problem.score(a, menteeIndex));
            return byScore != 0 ? byScore : Integer.compare(a, b);
        });
        return ranked;
    }

    /**
     * @return true when mentor {@code r} ranks {@code candidate} above {@code incumbent}.
     */
    static boolean mentorPrefers(MatchingProblem problem, int r, int candidate, int incumbent) {
        int byScore = Double.compare(problem.score(r, candidate), problem.score(r, incumbent));
        return byScore != 0 ? byScore > 0 : candidate < incumbent;
    }

    private static IntComparator worstFirst(MatchingProblem problem, int r) {
        return (a, b) -> {
            int byScore = Double.compare(problem.score(r, a), problem.score(r, b));
            return byScore != 0 ? byScore : Integer.compare(b, a);
        };
    }
}

package org.bigcsters.matching.strategy;

import it.unimi.dsi.fastutil.ints.IntArrayList;
import it.unimi.dsi.fastutil.ints.IntArrays;
import org.bigcsters.matching.core.Assignment;
import org.bigcsters.matching.core.MatchingAlgorithm;
import org.bigcsters.matching.core.MatchingProblem;

import java.util.Objects;

/**
 * Fast baseline: highest-scoring eligible pair first.
 *
 * <p>Pairs are ordered by score descending, then mentee index, then mentor index. A pair is
 * taken when its mentee is still unresolved and its mentor has spare capacity. No optimality
 * guarantee.</p>
 */
public final class GreedyMatchingStrategy implements MatchingStrategy {

    @Override
    public MatchingAlgorithm algorithm() {
        return MatchingAlgorithm.GREEDY;
    }

    @Override
    public Assignment solve(MatchingProblem problem) {
        Objects.requireNonNull(problem, "problem");
        int mentorCount = problem.mentorCount();
        int menteeCount = problem.menteeCount();
        if ((long) mentorCount * menteeCount > Integer.MAX_VALUE) {
            throw new IllegalArgumentException("problem too large for pair indexing: "
                    + mentorCount + " x " + menteeCount);
        }

        // pair id = mentor * menteeCount + mentee
        IntArrayList pairs = new IntArrayList();
        for (int r = 0; r < mentorCount; r++) {
            if (problem.capacity(r) == 0) {
                continue;
            }
            for (int e = 0; e < menteeCount; e++) {
                if (problem.isEligible(r, e)) {
                    pairs.add(r * menteeCount + e);
                }
            }
        }
        int[] ordered = pairs.toIntArray();
        IntArrays.quickSort(ordered, (a, b) -> {
            int ra = a / menteeCount;
            int ea = a % menteeCount;
            int rb = b / menteeCount;
            int eb = b % menteeCount;
            int byScore = Double.compare(problem.score(rb, eb), problem.score(ra, ea));
            if (byScore != 0) {
                return byScore;
            }
            if (ea != eb) {
                return Integer.compare(ea, eb);
            }
            return Integer.compare(ra, rb);
        });

        Assignment.Builder builder = Assignment.builder(problem);
        int remaining = menteeCount;
        for (int pair : ordered) {
            if (remaining == 0) {
                break;
            }
            int r = pair / menteeCount;
            int e = pair % menteeCount;
            if (builder.isAssigned(e) || !builder.hasCapacity(r)) {
                continue;
            }
            builder.assign(e, r);
            remaining--;
        }
        return builder.build();
    }
}

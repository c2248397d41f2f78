package org.bigcsters.matching.strategy;

import it.unimi.dsi.fastutil.ints.IntArrayList;
import org.bigcsters.matching.core.Assignment;
import org.bigcsters.matching.core.MatchingAlgorithm;
import org.bigcsters.matching.core.MatchingProblem;

import java.util.Objects;

/**
 * Exact maximum-total-score assignment.
 *
 * <p>Each mentor is expanded into {@code min(capacity, menteeCount)} slots and every mentee
 * gets a private "unassigned" column, turning the capacitated problem into a rectangular
 * assignment solved by {@link HungarianAssignment}. Costs are {@code maxScore - score} for
 * eligible slots, {@code maxScore} for unassigned columns and {@code maxScore + 1} for
 * ineligible slots, so an ineligible slot is never part of an optimum.</p>
 *
 * <p>A fill pass then seats remaining mentees into free eligible slots; scores are
 * non-negative, so the total cannot drop. No stability guarantee.</p>
 */
public final class WeightedOptimalMatchingStrategy implements MatchingStrategy {

    @Override
    public MatchingAlgorithm algorithm() {
        return MatchingAlgorithm.WEIGHTED_OPTIMAL;
    }

    @Override
    public Assignment solve(MatchingProblem problem) {
        Objects.requireNonNull(problem, "problem");
        int mentorCount = problem.mentorCount();
        int menteeCount = problem.menteeCount();

        IntArrayList slotMentor = new IntArrayList();
        for (int r = 0; r < mentorCount; r++) {
            int slots = Math.min(problem.capacity(r), menteeCount);
            for (int s = 0; s < slots; s++) {
                slotMentor.add(r);
            }
        }
        int slotCount = slotMentor.size();
        double maxScore = problem.scoreMatrix().maxScore();
        double unassignedCost = maxScore;
        double ineligibleCost = maxScore + 1.0d;

        int[] columnOfMentee = HungarianAssignment.solve(
                menteeCount,
                slotCount + menteeCount,
                (mentee, column) -> {
                    if (column >= slotCount) {
                        return unassignedCost;
                    }
                    int mentor = slotMentor.getInt(column);
                    return problem.isEligible(mentor, mentee)
                            ? maxScore - problem.score(mentor, mentee)
                            : ineligibleCost;
                }
        );

        Assignment.Builder builder = Assignment.builder(problem);
        for (int e = 0; e < menteeCount; e++) {
            int column = columnOfMentee[e];
            if (column < slotCount && problem.isEligible(slotMentor.getInt(column), e)) {
                builder.assign(e, slotMentor.getInt(column));
            }
        }
        fillFreeSlots(problem, builder);
        return builder.build();
    }

    /**
     * Seats unassigned mentees into the best free eligible mentor (score desc, mentor index asc).
     */
    static void fillFreeSlots(MatchingProblem problem, Assignment.Builder builder) {
        for (int e = 0; e < problem.menteeCount(); e++) {
            if (builder.isAssigned(e)) {
                continue;
            }
            int best = Assignment.UNASSIGNED;
            for (int r = 0; r < problem.mentorCount(); r++) {
                if (!problem.isEligible(r, e) || !builder.hasCapacity(r)) {
                    continue;
                }
                if (best == Assignment.UNASSIGNED || problem.score(r, e) > problem.score(best, e)) {
                    best = r;
                }
            }
            if (best != Assignment.UNASSIGNED) {
                builder.assign(e, best);
            }
        }
    }
}

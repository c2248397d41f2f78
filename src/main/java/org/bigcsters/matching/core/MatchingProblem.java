package org.bigcsters.matching.core;

import org.bigcsters.matching.score.ScoreMatrix;

import java.util.Objects;

/**
 * Immutable input shared by every matching strategy: the score matrix, mentor capacities
 * and per-mentee priority values.
 *
 * <p>Priorities only influence tie-breaks in priority-aware strategies; all other
 * strategies ignore them.</p>
 */
public final class MatchingProblem {
    private final ScoreMatrix scoreMatrix;
    private final int[] capacities;
    private final double[] menteePriorities;
    private final long totalCapacity;

    private MatchingProblem(ScoreMatrix scoreMatrix, int[] capacities, double[] menteePriorities) {
        this.scoreMatrix = scoreMatrix;
        this.capacities = capacities;
        this.menteePriorities = menteePriorities;
        long total = 0L;
        for (int capacity : capacities) {
            total += capacity;
        }
        this.totalCapacity = total;
    }

    /**
     * Creates a problem where every mentee has priority {@code 0}.
     */
    public static MatchingProblem of(ScoreMatrix scoreMatrix, int[] capacities) {
        Objects.requireNonNull(scoreMatrix, "scoreMatrix");
        return of(scoreMatrix, capacities, new double[scoreMatrix.menteeCount()]);
    }

    /**
     * Creates a problem.
     *
     * @param scoreMatrix shared score matrix.
     * @param capacities capacity per mentor (>= 0), mentor index order.
     * @param menteePriorities finite priority per mentee, mentee index order.
     * @return immutable problem.
     */
    public static MatchingProblem of(ScoreMatrix scoreMatrix, int[] capacities, double[] menteePriorities) {
        Objects.requireNonNull(scoreMatrix, "scoreMatrix");
        Objects.requireNonNull(capacities, "capacities");
        Objects.requireNonNull(menteePriorities, "menteePriorities");
        if (capacities.length != scoreMatrix.mentorCount()) {
            throw new IllegalArgumentException(
                    "capacities has " + capacities.length + " entries, expected " + scoreMatrix.mentorCount());
        }
        if (menteePriorities.length != scoreMatrix.menteeCount()) {
            throw new IllegalArgumentException(
                    "menteePriorities has " + menteePriorities.length + " entries, expected "
                            + scoreMatrix.menteeCount());
        }
        for (int r = 0; r < capacities.length; r++) {
            if (capacities[r] < 0) {
                throw new IllegalArgumentException("capacity of mentor " + r + " must be >= 0");
            }
        }
        for (int e = 0; e < menteePriorities.length; e++) {
            if (!Double.isFinite(menteePriorities[e])) {
                throw new IllegalArgumentException("priority of mentee " + e + " must be finite");
            }
        }
        return new MatchingProblem(scoreMatrix, capacities.clone(), menteePriorities.clone());
    }

    public ScoreMatrix scoreMatrix() {
        return scoreMatrix;
    }

    public int mentorCount() {
        return scoreMatrix.mentorCount();
    }

    public int menteeCount() {
        return scoreMatrix.menteeCount();
    }

    public int capacity(int mentorIndex) {
        return capacities[mentorIndex];
    }

    public int[] capacities() {
        return capacities.clone();
    }

    public long totalCapacity() {
        return totalCapacity;
    }

    public double priority(int menteeIndex) {
        return menteePriorities[menteeIndex];
    }

    public double score(int mentorIndex, int menteeIndex) {
        return scoreMatrix.score(mentorIndex, menteeIndex);
    }

    public boolean isEligible(int mentorIndex, int menteeIndex) {
        return scoreMatrix.isEligible(mentorIndex, menteeIndex);
    }
}

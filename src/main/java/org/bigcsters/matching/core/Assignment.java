package org.bigcsters.matching.core;

import it.unimi.dsi.fastutil.ints.IntArrayList;
import it.unimi.dsi.fastutil.ints.IntList;
import it.unimi.dsi.fastutil.ints.IntLists;
import org.bigcsters.matching.score.ScoreMatrix;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Immutable mentee-to-mentor assignment produced by one strategy invocation.
 * <p>
 * Invariants (enforced by {@link Builder}):
 * </p>
 * <ul>
 * <li>each mentee is assigned to at most one mentor;</li>
 * <li>no mentor holds more mentees than its capacity;</li>
 * <li>only eligible pairs are assigned;</li>
 * <li>per-mentor mentee lists are in ascending mentee index (input) order.</li>
 * </ul>
 */
public final class Assignment {
    /** Marker for a mentee without a mentor. */
    public static final int UNASSIGNED = -1;

    private final ScoreMatrix scoreMatrix;
    private final int[] mentorOfMentee;
    private final IntList[] menteesOfMentor;
    private final double totalScore;
    private final int unassignedCount;

    private Assignment(ScoreMatrix scoreMatrix, int[] mentorOfMentee, IntList[] menteesOfMentor) {
        this.scoreMatrix = scoreMatrix;
        this.mentorOfMentee = mentorOfMentee;
        this.menteesOfMentor = menteesOfMentor;
        double total = 0.0d;
        int unassigned = 0;
        for (int e = 0; e < mentorOfMentee.length; e++) {
            int r = mentorOfMentee[e];
            if (r == UNASSIGNED) {
                unassigned++;
            } else {
                total += scoreMatrix.score(r, e);
            }
        }
        this.totalScore = total;
        this.unassignedCount = unassigned;
    }

    /**
     * Starts an empty assignment for the given problem.
     */
    public static Builder builder(MatchingProblem problem) {
        return new Builder(problem);
    }

    /**
     * @return mentor index of the mentee, or {@link #UNASSIGNED}.
     */
    public int mentorOf(int menteeIndex) {
        return mentorOfMentee[menteeIndex];
    }

    public boolean isAssigned(int menteeIndex) {
        return mentorOfMentee[menteeIndex] != UNASSIGNED;
    }

    /**
     * @return ascending mentee indices assigned to the mentor.
     */
    public IntList menteesOf(int mentorIndex) {
        return menteesOfMentor[mentorIndex];
    }

    /**
     * @return number of mentees assigned to the mentor.
     */
    public int load(int mentorIndex) {
        return menteesOfMentor[mentorIndex].size();
    }

    public int mentorCount() {
        return menteesOfMentor.length;
    }

    public int menteeCount() {
        return mentorOfMentee.length;
    }

    public int assignedCount() {
        return mentorOfMentee.length - unassignedCount;
    }

    public int unassignedCount() {
        return unassignedCount;
    }

    /**
     * @return sum of scores over assigned pairs.
     */
    public double totalScore() {
        return totalScore;
    }

    /**
     * @return copy of the mentee-indexed mentor array.
     */
    public int[] toMentorArray() {
        return mentorOfMentee.clone();
    }

    /**
     * @return assigned mentee id to mentor id, in mentee input order.
     */
    public Map<String, String> menteeToMentor() {
        Map<String, String> mapping = new LinkedHashMap<>();
        for (int e = 0; e < mentorOfMentee.length; e++) {
            if (mentorOfMentee[e] != UNASSIGNED) {
                mapping.put(scoreMatrix.menteeId(e), scoreMatrix.mentorId(mentorOfMentee[e]));
            }
        }
        return Collections.unmodifiableMap(mapping);
    }

    /**
     * @param menteeId mentee email.
     * @return mentor email, or empty when the mentee is unassigned.
     */
    public Optional<String> mentorIdOf(String menteeId) {
        int e = scoreMatrix.menteeIndexOf(menteeId);
        int r = mentorOfMentee[e];
        return r == UNASSIGNED ? Optional.empty() : Optional.of(scoreMatrix.mentorId(r));
    }

    /**
     * @param mentorId mentor email.
     * @return assigned mentee emails in input order.
     */
    public List<String> menteesOf(String mentorId) {
        int r = scoreMatrix.mentorIndexOf(mentorId);
        List<String> ids = new ArrayList<>(menteesOfMentor[r].size());
        for (int i = 0; i < menteesOfMentor[r].size(); i++) {
            ids.add(scoreMatrix.menteeId(menteesOfMentor[r].getInt(i)));
        }
        return List.copyOf(ids);
    }

    /**
     * @return ids of mentees without a mentor, in input order.
     */
    public List<String> unassignedMenteeIds() {
        List<String> ids = new ArrayList<>(unassignedCount);
        for (int e = 0; e < mentorOfMentee.length; e++) {
            if (mentorOfMentee[e] == UNASSIGNED) {
                ids.add(scoreMatrix.menteeId(e));
            }
        }
        return List.copyOf(ids);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof Assignment other)) {
            return false;
        }
        return Arrays.equals(mentorOfMentee, other.mentorOfMentee)
                && scoreMatrix.menteeIds().equals(other.scoreMatrix.menteeIds())
                && scoreMatrix.mentorIds().equals(other.scoreMatrix.mentorIds());
    }

    @Override
    public int hashCode() {
        return Arrays.hashCode(mentorOfMentee);
    }

    @Override
    public String toString() {
        return "Assignment{assigned=" + assignedCount()
                + ", unassigned=" + unassignedCount
                + ", totalScore=" + totalScore + "}";
    }

    /**
     * Mutable, capacity-checked assignment under construction.
     *
     * <p>Not thread-safe; each strategy invocation owns its own builder.</p>
     */
    public static final class Builder {
        private final MatchingProblem problem;
        private final int[] mentorOfMentee;
        private final IntArrayList[] menteesOfMentor;

        private Builder(MatchingProblem problem) {
            this.problem = Objects.requireNonNull(problem, "problem");
            this.mentorOfMentee = new int[problem.menteeCount()];
            Arrays.fill(mentorOfMentee, UNASSIGNED);
            this.menteesOfMentor = new IntArrayList[problem.mentorCount()];
            for (int r = 0; r < menteesOfMentor.length; r++) {
                menteesOfMentor[r] = new IntArrayList(Math.min(problem.capacity(r), problem.menteeCount()));
            }
        }

        /**
         * Copies every pair of an existing assignment into this builder.
         */
        public Builder copyOf(Assignment assignment) {
            for (int e = 0; e < assignment.menteeCount(); e++) {
                if (assignment.isAssigned(e)) {
                    assign(e, assignment.mentorOf(e));
                }
            }
            return this;
        }

        /**
         * Assigns an unassigned mentee to a mentor with spare capacity.
         *
         * @throws IllegalStateException when the mentee is already assigned, the mentor is full,
         * or the pair is ineligible.
         */
        public Builder assign(int menteeIndex, int mentorIndex) {
            if (mentorOfMentee[menteeIndex] != UNASSIGNED) {
                throw new IllegalStateException(
                        "mentee " + menteeIndex + " already assigned to mentor " + mentorOfMentee[menteeIndex]);
            }
            if (!hasCapacity(mentorIndex)) {
                throw new IllegalStateException("mentor " + mentorIndex + " is at capacity " + problem.capacity(mentorIndex));
            }
            if (!problem.isEligible(mentorIndex, menteeIndex)) {
                throw new IllegalStateException(
                        "pair (mentor " + mentorIndex + ", mentee " + menteeIndex + ") is ineligible");
            }
            mentorOfMentee[menteeIndex] = mentorIndex;
            menteesOfMentor[mentorIndex].add(menteeIndex);
            return this;
        }

        /**
         * Removes the mentee from its mentor; no-op when already unassigned.
         */
        public Builder unassign(int menteeIndex) {
            int r = mentorOfMentee[menteeIndex];
            if (r != UNASSIGNED) {
                menteesOfMentor[r].rem(menteeIndex);
                mentorOfMentee[menteeIndex] = UNASSIGNED;
            }
            return this;
        }

        public int mentorOf(int menteeIndex) {
            return mentorOfMentee[menteeIndex];
        }

        public boolean isAssigned(int menteeIndex) {
            return mentorOfMentee[menteeIndex] != UNASSIGNED;
        }

        public int load(int mentorIndex) {
            return menteesOfMentor[mentorIndex].size();
        }

        public boolean hasCapacity(int mentorIndex) {
            return menteesOfMentor[mentorIndex].size() < problem.capacity(mentorIndex);
        }

        /**
         * @return live read-only view of the mentor's current mentees (insertion order).
         */
        public IntList menteesOf(int mentorIndex) {
            return IntLists.unmodifiable(menteesOfMentor[mentorIndex]);
        }

        /**
         * @return copy of the current mentee-indexed mentor array.
         */
        public int[] toMentorArray() {
            return mentorOfMentee.clone();
        }

        /**
         * Freezes the current state.
         */
        public Assignment build() {
            IntList[] frozen = new IntList[menteesOfMentor.length];
            for (int r = 0; r < menteesOfMentor.length; r++) {
                int[] sorted = menteesOfMentor[r].toIntArray();
                Arrays.sort(sorted);
                frozen[r] = IntLists.unmodifiable(IntArrayList.wrap(sorted));
            }
            return new Assignment(problem.scoreMatrix(), mentorOfMentee.clone(), frozen);
        }
    }
}

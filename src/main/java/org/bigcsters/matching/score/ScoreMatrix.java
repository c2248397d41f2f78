package org.bigcsters.matching.score;

import it.unimi.dsi.fastutil.ints.IntArrayList;
import it.unimi.dsi.fastutil.ints.IntList;
import it.unimi.dsi.fastutil.ints.IntLists;
import org.bigcsters.core.id.IDMapper;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Immutable dense compatibility matrix indexed {@code [mentor][mentee]}.
 * <p>
 * Contract summary:
 * </p>
 * <ul>
 * <li>Every entry is a finite score {@code >= 0} or {@link CompatibilityScorer#INELIGIBLE}.</li>
 * <li>Row/column order matches the mentor/mentee order of the source profiles.</li>
 * <li>Built once per run and shared read-only by every strategy.</li>
 * </ul>
 */
public final class ScoreMatrix {
    private final IDMapper mentorMapper;
    private final IDMapper menteeMapper;
    private final List<String> mentorIds;
    private final List<String> menteeIds;
    private final double[][] scores;
    private final int[] eligibleMentorCounts;
    private final IntList menteesWithoutEligibleMentor;

    private ScoreMatrix(IDMapper mentorMapper, IDMapper menteeMapper, double[][] scores) {
        this.mentorMapper = mentorMapper;
        this.menteeMapper = menteeMapper;
        this.mentorIds = externalIds(mentorMapper);
        this.menteeIds = externalIds(menteeMapper);
        this.scores = scores;
        this.eligibleMentorCounts = new int[menteeIds.size()];
        IntArrayList without = new IntArrayList();
        for (int e = 0; e < menteeIds.size(); e++) {
            int count = 0;
            for (double[] row : scores) {
                if (row[e] != CompatibilityScorer.INELIGIBLE) {
                    count++;
                }
            }
            eligibleMentorCounts[e] = count;
            if (count == 0) {
                without.add(e);
            }
        }
        this.menteesWithoutEligibleMentor = IntLists.unmodifiable(without);
    }

    /**
     * Creates a matrix from raw scores.
     *
     * @param mentorIds mentor ids in row order.
     * @param menteeIds mentee ids in column order.
     * @param scores {@code scores[mentor][mentee]}; copied.
     * @return immutable matrix.
     * @throws IllegalArgumentException on blank or duplicate ids, shape mismatch, NaN, positive
     * infinity or negative finite scores.
     */
    public static ScoreMatrix of(List<String> mentorIds, List<String> menteeIds, double[][] scores) {
        Objects.requireNonNull(mentorIds, "mentorIds");
        Objects.requireNonNull(menteeIds, "menteeIds");
        return of(createMapper(mentorIds), createMapper(menteeIds), scores);
    }

    /**
     * Creates a matrix whose rows and columns follow existing id mappers.
     *
     * @param mentorIds mentor mapper; internal index is the row.
     * @param menteeIds mentee mapper; internal index is the column.
     * @param scores {@code scores[mentor][mentee]}; copied.
     * @return immutable matrix.
     * @throws IllegalArgumentException on shape mismatch or invalid scores.
     */
    public static ScoreMatrix of(IDMapper mentorIds, IDMapper menteeIds, double[][] scores) {
        Objects.requireNonNull(mentorIds, "mentorIds");
        Objects.requireNonNull(menteeIds, "menteeIds");
        Objects.requireNonNull(scores, "scores");
        if (scores.length != mentorIds.size()) {
            throw new IllegalArgumentException(
                    "scores has " + scores.length + " rows, expected " + mentorIds.size());
        }
        double[][] copy = new double[scores.length][];
        for (int r = 0; r < scores.length; r++) {
            double[] row = Objects.requireNonNull(scores[r], "scores row");
            if (row.length != menteeIds.size()) {
                throw new IllegalArgumentException(
                        "scores row " + r + " has " + row.length + " columns, expected " + menteeIds.size());
            }
            for (int e = 0; e < row.length; e++) {
                double value = row[e];
                if (value != CompatibilityScorer.INELIGIBLE && (!Double.isFinite(value) || value < 0.0d)) {
                    throw new IllegalArgumentException(
                            "score[" + r + "][" + e + "] must be finite and >= 0 or INELIGIBLE, got " + value);
                }
            }
            copy[r] = row.clone();
        }
        return new ScoreMatrix(mentorIds, menteeIds, copy);
    }

    /**
     * Convenience factory that names mentors {@code M0..} and mentees {@code E0..}.
     */
    public static ScoreMatrix of(double[][] scores) {
        Objects.requireNonNull(scores, "scores");
        int menteeCount = scores.length == 0 ? 0 : scores[0].length;
        List<String> mentors = new ArrayList<>(scores.length);
        for (int r = 0; r < scores.length; r++) {
            mentors.add("M" + r);
        }
        List<String> mentees = new ArrayList<>(menteeCount);
        for (int e = 0; e < menteeCount; e++) {
            mentees.add("E" + e);
        }
        return of(mentors, mentees, scores);
    }

    public int mentorCount() {
        return mentorIds.size();
    }

    public int menteeCount() {
        return menteeIds.size();
    }

    public String mentorId(int mentorIndex) {
        return mentorMapper.toExternal(mentorIndex);
    }

    public String menteeId(int menteeIndex) {
        return menteeMapper.toExternal(menteeIndex);
    }

    /**
     * @param mentorId mentor email.
     * @return row index of the mentor.
     * @throws IllegalArgumentException if the id is unknown.
     */
    public int mentorIndexOf(String mentorId) {
        try {
            return mentorMapper.toInternal(mentorId);
        } catch (IDMapper.UnknownIDException ex) {
            throw new IllegalArgumentException("unknown mentor id " + mentorId, ex);
        }
    }

    /**
     * @param menteeId mentee email.
     * @return column index of the mentee.
     * @throws IllegalArgumentException if the id is unknown.
     */
    public int menteeIndexOf(String menteeId) {
        try {
            return menteeMapper.toInternal(menteeId);
        } catch (IDMapper.UnknownIDException ex) {
            throw new IllegalArgumentException("unknown mentee id " + menteeId, ex);
        }
    }

    public List<String> mentorIds() {
        return mentorIds;
    }

    public List<String> menteeIds() {
        return menteeIds;
    }

    /**
     * @return score for the pair, or {@link CompatibilityScorer#INELIGIBLE}.
     */
    public double score(int mentorIndex, int menteeIndex) {
        return scores[mentorIndex][menteeIndex];
    }

    public boolean isEligible(int mentorIndex, int menteeIndex) {
        return scores[mentorIndex][menteeIndex] != CompatibilityScorer.INELIGIBLE;
    }

    /**
     * @return number of mentors the mentee may be paired with.
     */
    public int eligibleMentorCount(int menteeIndex) {
        return eligibleMentorCounts[menteeIndex];
    }

    /**
     * @return ascending indices of mentees with no eligible mentor.
     */
    public IntList menteesWithoutEligibleMentor() {
        return menteesWithoutEligibleMentor;
    }

    /**
     * @return largest eligible score, or {@code 0} when no pair is eligible.
     */
    public double maxScore() {
        double max = 0.0d;
        for (double[] row : scores) {
            for (double value : row) {
                if (value != CompatibilityScorer.INELIGIBLE && value > max) {
                    max = value;
                }
            }
        }
        return max;
    }

    private static IDMapper createMapper(List<String> ids) {
        try {
            return IDMapper.createImmutable(ids);
        } catch (IDMapper.DuplicateIDException ex) {
            throw new IllegalArgumentException(ex.getMessage(), ex);
        }
    }

    private static List<String> externalIds(IDMapper mapper) {
        String[] ids = new String[mapper.size()];
        for (int i = 0; i < ids.length; i++) {
            ids[i] = mapper.toExternal(i);
        }
        return List.of(ids);
    }
}

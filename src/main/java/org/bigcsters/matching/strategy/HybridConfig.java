package org.bigcsters.matching.strategy;

import lombok.Builder;
import lombok.Value;
import org.bigcsters.matching.core.MatchingException;
import org.bigcsters.matching.profile.MenteeProfile;

import java.util.Locale;
import java.util.Map;

/**
 * Tuning of {@link HybridPriorityStableStrategy}.
 */
@Value
@Builder(toBuilder = true)
public class HybridConfig {
    public static final String RETURNING_TAG = "returning";

    /**
     * Fraction of the optimal total the repair pass may give up, in {@code [0, 1]}.
     */
    @Builder.Default
    double scoreTolerance = 0.05d;

    /**
     * Priority contributed by each mentee tag, matched case-insensitively.
     */
    @Builder.Default
    Map<String, Double> priorityTagWeights = Map.of(RETURNING_TAG, 1.0d);

    @Builder.Default
    PriorityTieBreak priorityTieBreak = PriorityTieBreak.PRIORITY_WEIGHT;

    /**
     * Upper bound on applied repair moves; {@code 0} means {@code mentees * mentors}.
     */
    @Builder.Default
    int maxRepairMoves = 0;

    /**
     * Rule deciding whether a score-neutral move may displace an assigned mentee.
     */
    public enum PriorityTieBreak {
        /** Newcomer priority must be at least the displaced mentee's. */
        PRIORITY_WEIGHT,
        /** Newcomer must precede the displaced mentee in input order. */
        MENTEE_ORDER
    }

    public static HybridConfig defaults() {
        return HybridConfig.builder().build();
    }

    /**
     * @return sum of the weights of the mentee's tags.
     */
    public double priorityOf(MenteeProfile mentee) {
        double priority = 0.0d;
        for (String tag : mentee.getPriorityTags()) {
            String normalized = tag.trim().toLowerCase(Locale.ROOT);
            for (Map.Entry<String, Double> weight : priorityTagWeights.entrySet()) {
                if (weight.getKey().trim().toLowerCase(Locale.ROOT).equals(normalized)) {
                    priority += weight.getValue();
                }
            }
        }
        return priority;
    }

    /**
     * @return effective move bound for a problem of the given size.
     */
    public int effectiveMaxRepairMoves(int menteeCount, int mentorCount) {
        if (maxRepairMoves > 0) {
            return maxRepairMoves;
        }
        return (int) Math.min(Integer.MAX_VALUE, Math.max(1L, (long) menteeCount * mentorCount));
    }

    /**
     * @return this instance.
     * @throws MatchingException with {@link MatchingException#REASON_INVALID_CONFIGURATION}.
     */
    public HybridConfig validate() {
        if (!Double.isFinite(scoreTolerance) || scoreTolerance < 0.0d || scoreTolerance > 1.0d) {
            throw invalid("scoreTolerance must be in [0, 1], got " + scoreTolerance);
        }
        if (maxRepairMoves < 0) {
            throw invalid("maxRepairMoves must be >= 0, got " + maxRepairMoves);
        }
        if (priorityTieBreak == null) {
            throw invalid("priorityTieBreak is required");
        }
        if (priorityTagWeights == null) {
            throw invalid("priorityTagWeights is required");
        }
        for (Map.Entry<String, Double> entry : priorityTagWeights.entrySet()) {
            if (entry.getKey() == null || entry.getKey().isBlank()) {
                throw invalid("priority tag names must be non-blank");
            }
            Double weight = entry.getValue();
            if (weight == null || !Double.isFinite(weight)) {
                throw invalid("priority weight of tag '" + entry.getKey() + "' must be finite");
            }
        }
        return this;
    }

    private static MatchingException invalid(String message) {
        return new MatchingException(MatchingException.REASON_INVALID_CONFIGURATION, message);
    }
}

package org.bigcsters.matching.score;

import lombok.Builder;
import lombok.Value;
import org.bigcsters.matching.core.MatchingException;

import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Immutable weight configuration for {@link CompatibilityScorer}.
 *
 * <p>Defaults reproduce the program's historical weighting. Callers override any subset
 * by name through {@link #withOverrides(Map)}; unknown names and values outside
 * {@code [0, MAX_WEIGHT]} are rejected before any scoring happens.</p>
 */
@Value
@Builder(toBuilder = true)
public class ScoringWeights {
    public static final double MAX_WEIGHT = 1_000.0d;

    public static final String IN_PERSON_COLOCATED = "inPersonColocated";
    public static final String BOTH_ONLINE = "bothOnline";
    public static final String ONE_FLEXIBLE = "oneFlexible";
    public static final String BOTH_FLEXIBLE = "bothFlexible";
    public static final String TOPIC_MATCH = "topicMatch";
    public static final String CAREER_TOPIC_MATCH = "careerTopicMatch";
    public static final String PROGRAM_MATCH = "programMatch";
    public static final String SENIOR_TERM = "seniorTerm";

    /** Override names accepted by {@link #withOverrides(Map)}, in documentation order. */
    public static final List<String> WEIGHT_NAMES = List.of(
            IN_PERSON_COLOCATED,
            BOTH_ONLINE,
            ONE_FLEXIBLE,
            BOTH_FLEXIBLE,
            TOPIC_MATCH,
            CAREER_TOPIC_MATCH,
            PROGRAM_MATCH,
            SENIOR_TERM
    );

    /** Both prefer in-person and share a known location. */
    @Builder.Default
    double inPersonColocated = 10.0d;
    /** Both prefer online meetings. */
    @Builder.Default
    double bothOnline = 8.0d;
    /** Exactly one side has no meeting preference. */
    @Builder.Default
    double oneFlexible = 5.0d;
    /** Neither side has a meeting preference. */
    @Builder.Default
    double bothFlexible = 5.0d;
    /** Per shared mentorship topic (or scaled by Jaccard similarity). */
    @Builder.Default
    double topicMatch = 5.0d;
    /** Per shared career topic (or scaled by Jaccard similarity). */
    @Builder.Default
    double careerTopicMatch = 4.0d;
    /** Same program. */
    @Builder.Default
    double programMatch = 5.0d;
    /** Mentor is in a later term than the mentee, or is a graduate student. */
    @Builder.Default
    double seniorTerm = 20.0d;
    @Builder.Default
    TopicOverlapMode topicOverlapMode = TopicOverlapMode.INTERSECTION_COUNT;
    /**
     * When true, pairs whose meeting modes cannot be reconciled (in-person vs online, or
     * in-person without a shared known location) are ineligible.
     */
    @Builder.Default
    boolean strictMeetingModes = true;

    /**
     * @return default weights.
     */
    public static ScoringWeights defaults() {
        return ScoringWeights.builder().build();
    }

    /**
     * Returns a copy with named weights replaced.
     *
     * @param overrides weight name to value; null or empty means no change.
     * @return validated weights.
     * @throws MatchingException with {@link MatchingException#REASON_INVALID_CONFIGURATION}
     * for unknown names or out-of-range values.
     */
    public ScoringWeights withOverrides(Map<String, ? extends Number> overrides) {
        if (overrides == null || overrides.isEmpty()) {
            return validate();
        }
        ScoringWeightsBuilder builder = toBuilder();
        for (Map.Entry<String, ? extends Number> entry : overrides.entrySet()) {
            String name = Objects.requireNonNullElse(entry.getKey(), "<null>").trim();
            if (entry.getValue() == null) {
                throw invalid("weight " + name + " has no value");
            }
            double value = entry.getValue().doubleValue();
            switch (name) {
                case IN_PERSON_COLOCATED -> builder.inPersonColocated(value);
                case BOTH_ONLINE -> builder.bothOnline(value);
                case ONE_FLEXIBLE -> builder.oneFlexible(value);
                case BOTH_FLEXIBLE -> builder.bothFlexible(value);
                case TOPIC_MATCH -> builder.topicMatch(value);
                case CAREER_TOPIC_MATCH -> builder.careerTopicMatch(value);
                case PROGRAM_MATCH -> builder.programMatch(value);
                case SENIOR_TERM -> builder.seniorTerm(value);
                default -> throw invalid("unknown weight name '" + name + "', expected one of " + WEIGHT_NAMES);
            }
        }
        return builder.build().validate();
    }

    /**
     * Checks every weight is finite and within {@code [0, MAX_WEIGHT]}.
     *
     * @return this instance.
     */
    public ScoringWeights validate() {
        checkRange(IN_PERSON_COLOCATED, inPersonColocated);
        checkRange(BOTH_ONLINE, bothOnline);
        checkRange(ONE_FLEXIBLE, oneFlexible);
        checkRange(BOTH_FLEXIBLE, bothFlexible);
        checkRange(TOPIC_MATCH, topicMatch);
        checkRange(CAREER_TOPIC_MATCH, careerTopicMatch);
        checkRange(PROGRAM_MATCH, programMatch);
        checkRange(SENIOR_TERM, seniorTerm);
        if (topicOverlapMode == null) {
            throw invalid("topicOverlapMode is required");
        }
        return this;
    }

    private static void checkRange(String name, double value) {
        if (!Double.isFinite(value) || value < 0.0d || value > MAX_WEIGHT) {
            throw invalid("weight " + name + " must be within [0, " + MAX_WEIGHT + "], got " + value);
        }
    }

    private static MatchingException invalid(String message) {
        return new MatchingException(MatchingException.REASON_INVALID_CONFIGURATION, message);
    }
}

package org.bigcsters.matching.score;

import org.bigcsters.matching.profile.MeetingPreference;
import org.bigcsters.matching.profile.MenteeProfile;
import org.bigcsters.matching.profile.MentorProfile;
import org.bigcsters.matching.profile.ProfileStore;

import java.util.HashSet;
import java.util.Locale;
import java.util.Objects;
import java.util.Set;

/**
 * Computes mentor/mentee compatibility.
 *
 * <p>Scoring is a pure weighted sum of sub-scores:</p>
 * <ul>
 * <li>meeting mode and location agreement;</li>
 * <li>mentorship topic overlap and career topic overlap ({@link TopicOverlapMode});</li>
 * <li>same program;</li>
 * <li>term seniority (mentor's leading term digit greater than the mentee's, or a graduate mentor).</li>
 * </ul>
 * <p>Pairs with irreconcilable meeting modes are {@link #INELIGIBLE} when
 * {@link ScoringWeights#isStrictMeetingModes()} is set.</p>
 */
public final class CompatibilityScorer {
    /** Score marker for pairs excluded from every strategy. */
    public static final double INELIGIBLE = Double.NEGATIVE_INFINITY;

    private static final String GRADUATE_MARKER = "graduate";

    /**
     * Scores one pair.
     *
     * @param mentor mentor profile.
     * @param mentee mentee profile.
     * @param weights validated weights.
     * @return score {@code >= 0}, or {@link #INELIGIBLE}.
     */
    public double score(MentorProfile mentor, MenteeProfile mentee, ScoringWeights weights) {
        Objects.requireNonNull(mentor, "mentor");
        Objects.requireNonNull(mentee, "mentee");
        Objects.requireNonNull(weights, "weights");

        if (weights.isStrictMeetingModes() && !meetingModesCompatible(mentor, mentee)) {
            return INELIGIBLE;
        }

        double score = meetingScore(mentor, mentee, weights);
        score += weights.getTopicMatch()
                * overlap(mentor.getTopics(), mentee.getTopics(), weights.getTopicOverlapMode());
        score += weights.getCareerTopicMatch()
                * overlap(mentor.getCareerTopics(), mentee.getCareerTopics(), weights.getTopicOverlapMode());
        if (sameProgram(mentor.getProgram(), mentee.getProgram())) {
            score += weights.getProgramMatch();
        }
        if (isSenior(mentor.getTerm(), mentee.getTerm())) {
            score += weights.getSeniorTerm();
        }
        return score;
    }

    /**
     * Scores every pair of the store once.
     *
     * @param profiles validated profiles.
     * @param weights weights; validated before any pair is scored.
     * @return dense score matrix indexed [mentor][mentee].
     */
    public ScoreMatrix buildMatrix(ProfileStore profiles, ScoringWeights weights) {
        Objects.requireNonNull(profiles, "profiles");
        ScoringWeights validated = Objects.requireNonNull(weights, "weights").validate();

        int mentorCount = profiles.mentorCount();
        int menteeCount = profiles.menteeCount();
        double[][] scores = new double[mentorCount][menteeCount];
        for (int r = 0; r < mentorCount; r++) {
            MentorProfile mentor = profiles.mentor(r);
            for (int e = 0; e < menteeCount; e++) {
                scores[r][e] = score(mentor, profiles.mentee(e), validated);
            }
        }
        return ScoreMatrix.of(profiles.mentorIds(), profiles.menteeIds(), scores);
    }

    static boolean meetingModesCompatible(MentorProfile mentor, MenteeProfile mentee) {
        MeetingPreference a = mentor.getMeetingPreference();
        MeetingPreference b = mentee.getMeetingPreference();
        if (a == MeetingPreference.NO_PREFERENCE || b == MeetingPreference.NO_PREFERENCE) {
            return true;
        }
        if (a != b) {
            return false;
        }
        return a == MeetingPreference.ONLINE || colocated(mentor, mentee);
    }

    private static double meetingScore(MentorProfile mentor, MenteeProfile mentee, ScoringWeights weights) {
        MeetingPreference a = mentor.getMeetingPreference();
        MeetingPreference b = mentee.getMeetingPreference();
        if (a == MeetingPreference.IN_PERSON && b == MeetingPreference.IN_PERSON && colocated(mentor, mentee)) {
            return weights.getInPersonColocated();
        }
        if (a == MeetingPreference.ONLINE && b == MeetingPreference.ONLINE) {
            return weights.getBothOnline();
        }
        boolean aFlexible = a == MeetingPreference.NO_PREFERENCE;
        boolean bFlexible = b == MeetingPreference.NO_PREFERENCE;
        if (aFlexible && bFlexible) {
            return weights.getBothFlexible();
        }
        if (aFlexible || bFlexible) {
            return weights.getOneFlexible();
        }
        return 0.0d;
    }

    private static boolean colocated(MentorProfile mentor, MenteeProfile mentee) {
        return mentor.hasKnownLocation()
                && mentee.hasKnownLocation()
                && mentor.getLocation().trim().equalsIgnoreCase(mentee.getLocation().trim());
    }

    static double overlap(Set<String> mentorTopics, Set<String> menteeTopics, TopicOverlapMode mode) {
        if (mentorTopics.isEmpty() || menteeTopics.isEmpty()) {
            return 0.0d;
        }
        Set<String> left = normalize(mentorTopics);
        Set<String> right = normalize(menteeTopics);
        int shared = 0;
        for (String topic : right) {
            if (left.contains(topic)) {
                shared++;
            }
        }
        return switch (mode) {
            case INTERSECTION_COUNT -> shared;
            case JACCARD -> (double) shared / (left.size() + right.size() - shared);
        };
    }

    private static Set<String> normalize(Set<String> topics) {
        Set<String> normalized = new HashSet<>(topics.size() * 2);
        for (String topic : topics) {
            normalized.add(topic.trim().toLowerCase(Locale.ROOT));
        }
        return normalized;
    }

    private static boolean sameProgram(String mentorProgram, String menteeProgram) {
        return mentorProgram != null
                && !mentorProgram.isBlank()
                && mentorProgram.trim().equalsIgnoreCase(menteeProgram == null ? "" : menteeProgram.trim());
    }

    // Terms look like "3A", "4B" or "Graduate"; anything without a leading digit counts as term 0.
    static boolean isSenior(String mentorTerm, String menteeTerm) {
        if (leadingTermNumber(mentorTerm) > leadingTermNumber(menteeTerm)) {
            return true;
        }
        return mentorTerm != null && mentorTerm.toLowerCase(Locale.ROOT).contains(GRADUATE_MARKER);
    }

    private static int leadingTermNumber(String term) {
        if (term == null) {
            return 0;
        }
        String trimmed = term.trim();
        if (trimmed.isEmpty() || !Character.isDigit(trimmed.charAt(0))) {
            return 0;
        }
        return Character.digit(trimmed.charAt(0), 10);
    }
}

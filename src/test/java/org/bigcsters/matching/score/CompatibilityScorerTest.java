package org.bigcsters.matching.score;

import org.bigcsters.matching.profile.MeetingPreference;
import org.bigcsters.matching.profile.MenteeProfile;
import org.bigcsters.matching.profile.MentorProfile;
import org.bigcsters.matching.profile.ProfileRecord;
import org.bigcsters.matching.profile.ProfileStore;
import org.bigcsters.matching.profile.ProfileValidator;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Set;

import static org.bigcsters.matching.testutil.MatchingFixtureFactory.mentee;
import static org.bigcsters.matching.testutil.MatchingFixtureFactory.mentor;
import static org.junit.jupiter.api.Assertions.*;

class CompatibilityScorerTest {

    private final CompatibilityScorer scorer = new CompatibilityScorer();
    private final ScoringWeights weights = ScoringWeights.defaults();

    private static MentorProfile bareMentor(MeetingPreference preference, String location) {
        return MentorProfile.builder()
                .email("m@uwaterloo.ca")
                .name("M")
                .meetingPreference(preference)
                .location(location)
                .build();
    }

    private static MenteeProfile bareMentee(MeetingPreference preference, String location) {
        return MenteeProfile.builder()
                .email("e@uwaterloo.ca")
                .name("E")
                .meetingPreference(preference)
                .location(location)
                .build();
    }

    @Test
    @DisplayName("Meeting component covers co-located, online and flexible combinations")
    void testMeetingComponent() {
        assertEquals(10.0, scorer.score(
                bareMentor(MeetingPreference.IN_PERSON, "Waterloo"),
                bareMentee(MeetingPreference.IN_PERSON, " waterloo "), weights));
        assertEquals(8.0, scorer.score(
                bareMentor(MeetingPreference.ONLINE, "Toronto"),
                bareMentee(MeetingPreference.ONLINE, "Waterloo"), weights));
        assertEquals(5.0, scorer.score(
                bareMentor(MeetingPreference.NO_PREFERENCE, "Toronto"),
                bareMentee(MeetingPreference.ONLINE, "Waterloo"), weights));
        assertEquals(5.0, scorer.score(
                bareMentor(MeetingPreference.NO_PREFERENCE, "Toronto"),
                bareMentee(MeetingPreference.NO_PREFERENCE, "Waterloo"), weights));
    }

    @Test
    @DisplayName("Irreconcilable meeting modes are ineligible under strict modes")
    void testIneligiblePairs() {
        assertEquals(CompatibilityScorer.INELIGIBLE, scorer.score(
                bareMentor(MeetingPreference.IN_PERSON, "Waterloo"),
                bareMentee(MeetingPreference.ONLINE, "Waterloo"), weights));
        assertEquals(CompatibilityScorer.INELIGIBLE, scorer.score(
                bareMentor(MeetingPreference.IN_PERSON, "Waterloo"),
                bareMentee(MeetingPreference.IN_PERSON, "Toronto"), weights));
        assertEquals(CompatibilityScorer.INELIGIBLE, scorer.score(
                bareMentor(MeetingPreference.IN_PERSON, "Unknown"),
                bareMentee(MeetingPreference.IN_PERSON, "Unknown"), weights));

        ScoringWeights lenient = weights.toBuilder().strictMeetingModes(false).build();
        assertEquals(0.0, scorer.score(
                bareMentor(MeetingPreference.IN_PERSON, "Waterloo"),
                bareMentee(MeetingPreference.ONLINE, "Waterloo"), lenient));
    }

    private static ProfileRecord inPersonRow(String email, String location) {
        return ProfileRecord.builder()
                .email(email)
                .name("P")
                .location(location)
                .meetingPreference("Yes, in person")
                .maxMentees("1")
                .build();
    }

    @Test
    @DisplayName("Raw location answers co-locate only on a named place")
    void testLocationAnswersFromRecords() {
        MentorProfile waterlooMentor = ProfileValidator.toMentor(inPersonRow("m@uwaterloo.ca", "Waterloo"), 0);
        MenteeProfile yesMentee = ProfileValidator.toMentee(inPersonRow("e@uwaterloo.ca", "Yes"), 0);
        assertEquals(10.0, scorer.score(waterlooMentor, yesMentee, weights));

        MentorProfile undisclosedMentor = ProfileValidator.toMentor(
                inPersonRow("m@uwaterloo.ca", "No (and prefer not to say)"), 0);
        MenteeProfile undisclosedMentee = ProfileValidator.toMentee(
                inPersonRow("e@uwaterloo.ca", "No (and prefer not to say)"), 0);
        assertEquals(CompatibilityScorer.INELIGIBLE, scorer.score(undisclosedMentor, undisclosedMentee, weights));

        MentorProfile elsewhereMentor = ProfileValidator.toMentor(inPersonRow("m@uwaterloo.ca", "No, Toronto"), 0);
        MenteeProfile elsewhereMentee = ProfileValidator.toMentee(inPersonRow("e@uwaterloo.ca", "No, Vancouver"), 0);
        assertEquals(CompatibilityScorer.INELIGIBLE, scorer.score(elsewhereMentor, elsewhereMentee, weights));

        ScoringWeights lenient = weights.toBuilder().strictMeetingModes(false).build();
        assertEquals(0.0, scorer.score(undisclosedMentor, undisclosedMentee, lenient));
    }

    @Test
    @DisplayName("Topics, program and seniority add their weights")
    void testFullScore() {
        MentorProfile mentor = mentor("ada@uwaterloo.ca", 1, MeetingPreference.ONLINE, "Waterloo")
                .toBuilder()
                .topic("Research")
                .build();
        MenteeProfile mentee = MenteeProfile.builder()
                .email("e@uwaterloo.ca")
                .name("E")
                .program("computer science")
                .term("2B")
                .meetingPreference(MeetingPreference.ONLINE)
                .topic("co-op")
                .topic("research")
                .topic("Startups")
                .careerTopic("Hardware")
                .build();

        // online 8 + two shared topics 2*5 + program 5 + senior 20
        assertEquals(43.0, scorer.score(mentor, mentee, weights), 1e-9);
    }

    @Test
    @DisplayName("Jaccard overlap scales by set similarity")
    void testJaccardOverlap() {
        assertEquals(2.0 / 3.0,
                CompatibilityScorer.overlap(Set.of("a", "b"), Set.of("B", "c", "a"), TopicOverlapMode.JACCARD), 1e-9);
        assertEquals(2.0, CompatibilityScorer.overlap(Set.of("a", "b"), Set.of("B", "c", "a"),
                TopicOverlapMode.INTERSECTION_COUNT));
        assertEquals(0.0, CompatibilityScorer.overlap(Set.of(), Set.of("a"), TopicOverlapMode.JACCARD));
    }

    @Test
    @DisplayName("Seniority: later leading digit or graduate mentor")
    void testSeniority() {
        assertTrue(CompatibilityScorer.isSenior("3A", "2B"));
        assertFalse(CompatibilityScorer.isSenior("2A", "2B"));
        assertTrue(CompatibilityScorer.isSenior("Graduate (Masters)", "4B"));
        assertFalse(CompatibilityScorer.isSenior("", "1A"));
        assertTrue(CompatibilityScorer.isSenior("1B", null));
    }

    @Test
    @DisplayName("Matrix is built once per store and deterministic")
    void testBuildMatrix() {
        ProfileStore store = ProfileStore.of(
                List.of(
                        mentor("ada@uwaterloo.ca", 1, MeetingPreference.ONLINE, "Waterloo"),
                        mentor("linus@uwaterloo.ca", 1, MeetingPreference.IN_PERSON, "Waterloo")
                ),
                List.of(
                        mentee("e1@uwaterloo.ca", MeetingPreference.ONLINE, "Waterloo"),
                        mentee("e2@uwaterloo.ca", MeetingPreference.IN_PERSON, "Waterloo")
                )
        );
        ScoreMatrix matrix = scorer.buildMatrix(store, weights);

        assertEquals(List.of("ada@uwaterloo.ca", "linus@uwaterloo.ca"), matrix.mentorIds());
        assertEquals(store.mentorIds().toInternal("linus@uwaterloo.ca"), matrix.mentorIndexOf("linus@uwaterloo.ca"));
        assertEquals(1, matrix.menteeIndexOf("e2@uwaterloo.ca"));
        assertEquals(42.0, matrix.score(0, 0), 1e-9);
        assertFalse(matrix.isEligible(0, 1));
        assertFalse(matrix.isEligible(1, 0));
        assertEquals(44.0, matrix.score(1, 1), 1e-9);
        assertEquals(1, matrix.eligibleMentorCount(0));
        assertTrue(matrix.menteesWithoutEligibleMentor().isEmpty());
        assertEquals(matrix.score(1, 1), scorer.buildMatrix(store, weights).score(1, 1));
    }
}

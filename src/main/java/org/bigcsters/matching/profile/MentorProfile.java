package org.bigcsters.matching.profile;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.util.Set;

/**
 * Validated mentor profile.
 */
@Value
@Builder(toBuilder = true)
public class MentorProfile implements Profile {
    String email;
    String name;
    String pronouns;
    String program;
    String term;
    @Builder.Default
    String location = UNKNOWN_LOCATION;
    @Builder.Default
    MeetingPreference meetingPreference = MeetingPreference.NO_PREFERENCE;
    @Singular
    Set<String> topics;
    @Singular
    Set<String> careerTopics;
    @Singular
    Set<String> priorityTags;
    /** Maximum number of mentees this mentor accepts (>= 1). */
    @Builder.Default
    int capacity = 1;
}

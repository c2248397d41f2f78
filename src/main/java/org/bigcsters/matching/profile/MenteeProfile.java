package org.bigcsters.matching.profile;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.util.Set;

/**
 * Validated mentee profile.
 */
@Value
@Builder
public class MenteeProfile implements Profile {
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
}

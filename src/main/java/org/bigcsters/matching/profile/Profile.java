package org.bigcsters.matching.profile;

import java.util.Set;

/**
 * Validated participant profile: either a {@link MentorProfile} or a {@link MenteeProfile}.
 *
 * <p>The email is the participant id. Implementations are immutable.</p>
 */
public sealed interface Profile permits MentorProfile, MenteeProfile {
    /** Location value used when a participant did not disclose one. */
    String UNKNOWN_LOCATION = "Unknown";

    /** Answer "Yes" to being based in Waterloo. */
    String WATERLOO = "Waterloo";

    /** Based outside Waterloo without a usable city. */
    String NOT_WATERLOO = "Not Waterloo";

    String getEmail();

    String getName();

    String getPronouns();

    String getProgram();

    String getTerm();

    String getLocation();

    MeetingPreference getMeetingPreference();

    Set<String> getTopics();

    Set<String> getCareerTopics();

    /** Free-form labels such as {@code returning} consumed by priority-aware strategies. */
    Set<String> getPriorityTags();

    /**
     * @return true when the location names a specific place that can be co-located.
     */
    default boolean hasKnownLocation() {
        String location = getLocation();
        return location != null
                && !location.isBlank()
                && !UNKNOWN_LOCATION.equalsIgnoreCase(location)
                && !NOT_WATERLOO.equalsIgnoreCase(location);
    }
}

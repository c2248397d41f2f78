package org.bigcsters.matching.profile;

import lombok.Builder;
import lombok.Value;

/**
 * One typed response row handed over by CSV ingestion.
 *
 * <p>All fields are raw text. {@link ProfileValidator} turns a record into a
 * {@link MentorProfile} or {@link MenteeProfile}; {@code maxMentees} is ignored for mentees.</p>
 */
@Value
@Builder
public class ProfileRecord {
    String email;
    String name;
    String pronouns;
    String program;
    String term;
    String location;
    String meetingPreference;
    /** Comma- or semicolon-delimited mentorship topics. */
    String topics;
    /** Comma- or semicolon-delimited career topics. */
    String careerTopics;
    /** Positive integer text; mentors only. */
    String maxMentees;
    /** Optional comma- or semicolon-delimited priority tags. */
    String priorityTags;
}

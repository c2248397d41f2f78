package org.bigcsters.matching.profile;

import lombok.experimental.UtilityClass;
import org.bigcsters.matching.core.MatchingException;

import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * Converts {@link ProfileRecord} rows into validated profiles.
 *
 * <p>Every failure is a {@link MatchingException} with
 * {@link MatchingException#REASON_MALFORMED_PROFILE}; values are never silently coerced.</p>
 */
@UtilityClass
public class ProfileValidator {
    private static final Pattern LIST_DELIMITER = Pattern.compile("[,;]");
    private static final String UNDISCLOSED_LOCATION = "no (and prefer not to say)";

    /**
     * Validates one mentor row.
     *
     * @param record raw mentor row.
     * @param rowIndex zero-based row position used in error messages.
     * @return validated mentor.
     */
    public MentorProfile toMentor(ProfileRecord record, int rowIndex) {
        requireRecord(record, "mentor", rowIndex);
        return MentorProfile.builder()
                .email(requireText(record.getEmail(), "email", "mentor", rowIndex))
                .name(requireText(record.getName(), "name", "mentor", rowIndex))
                .pronouns(trimToEmpty(record.getPronouns()))
                .program(trimToEmpty(record.getProgram()))
                .term(trimToEmpty(record.getTerm()))
                .location(normalizeLocation(record.getLocation()))
                .meetingPreference(MeetingPreference.parse(record.getMeetingPreference()))
                .topics(parseList(record.getTopics()))
                .careerTopics(parseList(record.getCareerTopics()))
                .priorityTags(parseList(record.getPriorityTags()))
                .capacity(parseCapacity(record.getMaxMentees(), rowIndex))
                .build();
    }

    /**
     * Validates one mentee row.
     *
     * @param record raw mentee row.
     * @param rowIndex zero-based row position used in error messages.
     * @return validated mentee.
     */
    public MenteeProfile toMentee(ProfileRecord record, int rowIndex) {
        requireRecord(record, "mentee", rowIndex);
        return MenteeProfile.builder()
                .email(requireText(record.getEmail(), "email", "mentee", rowIndex))
                .name(requireText(record.getName(), "name", "mentee", rowIndex))
                .pronouns(trimToEmpty(record.getPronouns()))
                .program(trimToEmpty(record.getProgram()))
                .term(trimToEmpty(record.getTerm()))
                .location(normalizeLocation(record.getLocation()))
                .meetingPreference(MeetingPreference.parse(record.getMeetingPreference()))
                .topics(parseList(record.getTopics()))
                .careerTopics(parseList(record.getCareerTopics()))
                .priorityTags(parseList(record.getPriorityTags()))
                .build();
    }

    /**
     * Splits a comma- or semicolon-delimited answer into a set.
     *
     * <p>Entries are trimmed, blanks dropped, and first-seen order kept.</p>
     *
     * @param value raw list text, may be null.
     * @return ordered de-duplicated entries.
     */
    public Set<String> parseList(String value) {
        Set<String> items = new LinkedHashSet<>();
        if (value == null || value.isBlank()) {
            return items;
        }
        for (String item : LIST_DELIMITER.split(value)) {
            String trimmed = item.trim();
            if (!trimmed.isEmpty()) {
                items.add(trimmed);
            }
        }
        return items;
    }

    /**
     * Validates a full batch of mentor rows.
     */
    public List<MentorProfile> toMentors(List<ProfileRecord> records) {
        if (records == null) {
            throw new MatchingException(MatchingException.REASON_MALFORMED_PROFILE, "mentor records are required");
        }
        MentorProfile[] mentors = new MentorProfile[records.size()];
        for (int i = 0; i < mentors.length; i++) {
            mentors[i] = toMentor(records.get(i), i);
        }
        return List.of(mentors);
    }

    /**
     * Validates a full batch of mentee rows.
     */
    public List<MenteeProfile> toMentees(List<ProfileRecord> records) {
        if (records == null) {
            throw new MatchingException(MatchingException.REASON_MALFORMED_PROFILE, "mentee records are required");
        }
        MenteeProfile[] mentees = new MenteeProfile[records.size()];
        for (int i = 0; i < mentees.length; i++) {
            mentees[i] = toMentee(records.get(i), i);
        }
        return List.of(mentees);
    }

    private int parseCapacity(String value, int rowIndex) {
        String text = requireText(value, "max mentees", "mentor", rowIndex);
        int capacity;
        try {
            capacity = Integer.parseInt(text);
        } catch (NumberFormatException ex) {
            throw new MatchingException(
                    MatchingException.REASON_MALFORMED_PROFILE,
                    "mentor row " + rowIndex + ": max mentees is not an integer: '" + text + "'",
                    ex
            );
        }
        if (capacity < 1) {
            throw new MatchingException(
                    MatchingException.REASON_MALFORMED_PROFILE,
                    "mentor row " + rowIndex + ": max mentees must be >= 1, got " + capacity
            );
        }
        return capacity;
    }

    /**
     * Normalizes an answer to "Are you based in Waterloo this term? If not, which city?".
     *
     * <p>{@code Yes} becomes {@link Profile#WATERLOO}, the undisclosed answer and blanks become
     * {@link Profile#UNKNOWN_LOCATION}, any other answer starting with {@code no} becomes
     * {@link Profile#NOT_WATERLOO}, and anything else is taken as a city name in title case.</p>
     *
     * @param value raw answer, may be null.
     * @return normalized location.
     */
    public String normalizeLocation(String value) {
        if (value == null || value.isBlank()) {
            return Profile.UNKNOWN_LOCATION;
        }
        String answer = value.trim().toLowerCase(Locale.ROOT);
        if (answer.equals("yes")) {
            return Profile.WATERLOO;
        }
        if (answer.contains(UNDISCLOSED_LOCATION)) {
            return Profile.UNKNOWN_LOCATION;
        }
        if (answer.startsWith("no")) {
            return Profile.NOT_WATERLOO;
        }
        return titleCase(answer);
    }

    private String titleCase(String text) {
        StringBuilder out = new StringBuilder(text.length());
        boolean wordStart = true;
        for (int i = 0; i < text.length(); i++) {
            char c = text.charAt(i);
            out.append(wordStart ? Character.toUpperCase(c) : c);
            wordStart = !Character.isLetter(c);
        }
        return out.toString();
    }

    private void requireRecord(ProfileRecord record, String role, int rowIndex) {
        if (record == null) {
            throw new MatchingException(
                    MatchingException.REASON_MALFORMED_PROFILE,
                    role + " row " + rowIndex + " is missing"
            );
        }
    }

    private String requireText(String value, String field, String role, int rowIndex) {
        if (value == null || value.isBlank()) {
            throw new MatchingException(
                    MatchingException.REASON_MALFORMED_PROFILE,
                    role + " row " + rowIndex + ": " + field + " is required"
            );
        }
        return value.trim();
    }

    private String trimToEmpty(String value) {
        return value == null ? "" : value.trim();
    }
}

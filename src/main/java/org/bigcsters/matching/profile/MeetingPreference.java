package org.bigcsters.matching.profile;

import java.util.Locale;

/**
 * How a participant wants to meet their match.
 */
public enum MeetingPreference {
    IN_PERSON,
    ONLINE,
    NO_PREFERENCE;

    /**
     * Interprets a free-text meeting preference answer.
     *
     * <p>Blank or unrecognised answers map to {@link #NO_PREFERENCE}. Answers that mention
     * both modes (for example "in person or online") are treated as flexible.</p>
     *
     * @param value raw answer, may be null.
     * @return parsed preference.
     */
    public static MeetingPreference parse(String value) {
        if (value == null || value.isBlank()) {
            return NO_PREFERENCE;
        }
        String normalized = value.trim().toLowerCase(Locale.ROOT).replace('_', '-');
        boolean online = normalized.contains("online");
        boolean inPerson = normalized.contains("in person") || normalized.contains("in-person");
        if (online && !inPerson) {
            return ONLINE;
        }
        if (inPerson && !online) {
            return IN_PERSON;
        }
        return NO_PREFERENCE;
    }
}

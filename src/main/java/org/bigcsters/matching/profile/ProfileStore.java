package org.bigcsters.matching.profile;

import org.bigcsters.core.id.IDMapper;
import org.bigcsters.matching.core.MatchingException;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Immutable store of validated mentors and mentees for one matching run.
 * <p>
 * Contract summary:
 * </p>
 * <ul>
 * <li>Mentors and mentees keep input order; position is the dense internal index.</li>
 * <li>Participant emails are unique within each role.</li>
 * <li>Every mentor has capacity {@code >= 1}.</li>
 * <li>Immutable after construction; safe for concurrent readers.</li>
 * </ul>
 */
public final class ProfileStore {

    private final List<MentorProfile> mentors;
    private final List<MenteeProfile> mentees;
    private final IDMapper mentorIds;
    private final IDMapper menteeIds;
    private final int[] capacities;

    private ProfileStore(
            List<MentorProfile> mentors,
            List<MenteeProfile> mentees,
            IDMapper mentorIds,
            IDMapper menteeIds,
            int[] capacities
    ) {
        this.mentors = mentors;
        this.mentees = mentees;
        this.mentorIds = mentorIds;
        this.menteeIds = menteeIds;
        this.capacities = capacities;
    }

    /**
     * Builds a store from already validated profiles.
     *
     * @param mentors mentors in input order.
     * @param mentees mentees in input order.
     * @return immutable store.
     * @throws MatchingException with {@link MatchingException#REASON_MALFORMED_PROFILE} on
     * duplicate emails, missing entries, or mentor capacity below one.
     */
    public static ProfileStore of(List<MentorProfile> mentors, List<MenteeProfile> mentees) {
        Objects.requireNonNull(mentors, "mentors");
        Objects.requireNonNull(mentees, "mentees");

        List<String> mentorEmails = new ArrayList<>(mentors.size());
        int[] capacities = new int[mentors.size()];
        for (int i = 0; i < mentors.size(); i++) {
            MentorProfile mentor = mentors.get(i);
            if (mentor == null) {
                throw malformed("mentor at position " + i + " is missing");
            }
            if (mentor.getCapacity() < 1) {
                throw malformed("mentor " + mentor.getEmail() + " has capacity " + mentor.getCapacity() + " (< 1)");
            }
            mentorEmails.add(mentor.getEmail());
            capacities[i] = mentor.getCapacity();
        }
        List<String> menteeEmails = new ArrayList<>(mentees.size());
        for (int i = 0; i < mentees.size(); i++) {
            MenteeProfile mentee = mentees.get(i);
            if (mentee == null) {
                throw malformed("mentee at position " + i + " is missing");
            }
            menteeEmails.add(mentee.getEmail());
        }

        return new ProfileStore(
                List.copyOf(mentors),
                List.copyOf(mentees),
                createMapper(mentorEmails, "mentor"),
                createMapper(menteeEmails, "mentee"),
                capacities
        );
    }

    /**
     * Validates raw records and builds a store in one step.
     *
     * @param mentorRecords mentor rows.
     * @param menteeRecords mentee rows.
     * @return immutable store.
     */
    public static ProfileStore fromRecords(List<ProfileRecord> mentorRecords, List<ProfileRecord> menteeRecords) {
        return of(ProfileValidator.toMentors(mentorRecords), ProfileValidator.toMentees(menteeRecords));
    }

    public int mentorCount() {
        return mentors.size();
    }

    public int menteeCount() {
        return mentees.size();
    }

    public List<MentorProfile> mentors() {
        return mentors;
    }

    public List<MenteeProfile> mentees() {
        return mentees;
    }

    public MentorProfile mentor(int mentorIndex) {
        return mentors.get(mentorIndex);
    }

    public MenteeProfile mentee(int menteeIndex) {
        return mentees.get(menteeIndex);
    }

    /**
     * @return email-to-index mapper for mentors.
     */
    public IDMapper mentorIds() {
        return mentorIds;
    }

    /**
     * @return email-to-index mapper for mentees.
     */
    public IDMapper menteeIds() {
        return menteeIds;
    }

    /**
     * @return copy of mentor capacities in mentor index order.
     */
    public int[] capacities() {
        return capacities.clone();
    }

    /**
     * @return sum of all mentor capacities.
     */
    public long totalCapacity() {
        long total = 0L;
        for (int capacity : capacities) {
            total += capacity;
        }
        return total;
    }

    private static IDMapper createMapper(List<String> emails, String role) {
        try {
            return IDMapper.createImmutable(emails);
        } catch (IDMapper.DuplicateIDException | IllegalArgumentException ex) {
            throw new MatchingException(
                    MatchingException.REASON_MALFORMED_PROFILE,
                    role + " ids are invalid: " + ex.getMessage(),
                    ex
            );
        }
    }

    private static MatchingException malformed(String message) {
        return new MatchingException(MatchingException.REASON_MALFORMED_PROFILE, message);
    }
}

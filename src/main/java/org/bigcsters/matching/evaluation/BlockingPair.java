package org.bigcsters.matching.evaluation;

/**
 * Mentor and mentee that would both rather be paired with each other.
 *
 * @param mentorIndex mentor index.
 * @param menteeIndex mentee index.
 */
public record BlockingPair(int mentorIndex, int menteeIndex) {
}

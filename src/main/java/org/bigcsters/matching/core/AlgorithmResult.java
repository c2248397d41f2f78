package org.bigcsters.matching.core;

import lombok.Builder;
import lombok.Value;

/**
 * Outcome of one strategy invocation.
 *
 * <p>When {@code status == FAILED}, {@code assignment} is null, {@code totalScore} is
 * {@code 0} and the failure fields describe what went wrong. Failures are local to the
 * strategy that produced them.</p>
 */
@Value
@Builder
public class AlgorithmResult {
    /** Strategy that produced this result. */
    MatchingAlgorithm algorithm;
    Status status;
    /** Produced assignment, null on failure. */
    Assignment assignment;
    /** Sum of scores over assigned pairs. */
    double totalScore;
    /** Deterministic reason code, null on success. */
    String failureReasonCode;
    /** Human-readable failure detail, null on success. */
    String failureMessage;
    /** Wall-clock duration of the strategy call. */
    long elapsedMillis;

    /**
     * Result status.
     */
    public enum Status {
        SUCCEEDED,
        FAILED
    }

    public static AlgorithmResult succeeded(MatchingAlgorithm algorithm, Assignment assignment, long elapsedMillis) {
        return AlgorithmResult.builder()
                .algorithm(algorithm)
                .status(Status.SUCCEEDED)
                .assignment(assignment)
                .totalScore(assignment.totalScore())
                .elapsedMillis(elapsedMillis)
                .build();
    }

    public static AlgorithmResult failed(
            MatchingAlgorithm algorithm,
            String reasonCode,
            String message,
            long elapsedMillis
    ) {
        return AlgorithmResult.builder()
                .algorithm(algorithm)
                .status(Status.FAILED)
                .failureReasonCode(reasonCode)
                .failureMessage(message)
                .elapsedMillis(elapsedMillis)
                .build();
    }

    public boolean isSucceeded() {
        return status == Status.SUCCEEDED;
    }
}

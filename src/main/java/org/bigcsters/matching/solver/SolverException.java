package org.bigcsters.matching.solver;

import lombok.Getter;

import java.util.Objects;

/**
 * Thrown when a linear-programming backend cannot produce a solution.
 *
 * <p>Messages are prefixed with deterministic reason-code text. The engine turns this
 * exception into a failed result for the affected strategy only.</p>
 */
@Getter
public final class SolverException extends RuntimeException {
    public static final String REASON_SOLVER_INFEASIBLE = "SOLVER_INFEASIBLE";
    public static final String REASON_SOLVER_UNAVAILABLE = "SOLVER_UNAVAILABLE";
    public static final String REASON_SOLVER_TIMEOUT = "SOLVER_TIMEOUT";
    public static final String REASON_SOLVER_ABNORMAL = "SOLVER_ABNORMAL";

    private final String reasonCode;

    /**
     * Creates a reason-coded solver failure.
     *
     * @param reasonCode deterministic reason code.
     * @param message descriptive message.
     */
    public SolverException(String reasonCode, String message) {
        super(formatMessage(reasonCode, message));
        this.reasonCode = requireReasonCode(reasonCode);
    }

    /**
     * Creates a reason-coded solver failure with a cause.
     *
     * @param reasonCode deterministic reason code.
     * @param message descriptive message.
     * @param cause underlying exception.
     */
    public SolverException(String reasonCode, String message, Throwable cause) {
        super(formatMessage(reasonCode, message), cause);
        this.reasonCode = requireReasonCode(reasonCode);
    }

    private static String formatMessage(String reasonCode, String message) {
        return "[" + requireReasonCode(reasonCode) + "] " + Objects.requireNonNull(message, "message");
    }

    private static String requireReasonCode(String reasonCode) {
        String code = Objects.requireNonNull(reasonCode, "reasonCode");
        if (code.isBlank()) {
            throw new IllegalArgumentException("reasonCode must be non-blank");
        }
        return code;
    }
}

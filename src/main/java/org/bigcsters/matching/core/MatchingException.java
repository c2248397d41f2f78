package org.bigcsters.matching.core;

import lombok.Getter;

import java.util.Objects;

/**
 * Matching engine contract failure with a deterministic reason code.
 *
 * <p>Messages are prefixed with {@code [REASON_CODE]} so callers can map failures to
 * exit codes without parsing free text.</p>
 */
@Getter
public final class MatchingException extends RuntimeException {
    public static final String REASON_MALFORMED_PROFILE = "MALFORMED_PROFILE";
    public static final String REASON_INVALID_CONFIGURATION = "INVALID_CONFIGURATION";
    public static final String REASON_NO_ELIGIBLE_PAIRS = "NO_ELIGIBLE_PAIRS";
    public static final String REASON_STRATEGY_FAILED = "STRATEGY_FAILED";

    private final String reasonCode;

    /**
     * Creates a reason-coded matching failure.
     *
     * @param reasonCode deterministic reason code.
     * @param message descriptive error message.
     */
    public MatchingException(String reasonCode, String message) {
        super(formatMessage(reasonCode, message));
        this.reasonCode = requireReasonCode(reasonCode);
    }

    /**
     * Creates a reason-coded matching failure with a cause.
     *
     * @param reasonCode deterministic reason code.
     * @param message descriptive error message.
     * @param cause underlying cause.
     */
    public MatchingException(String reasonCode, String message, Throwable cause) {
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

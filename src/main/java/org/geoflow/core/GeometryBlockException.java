package org.geoflow.core;

import lombok.Getter;
import lombok.experimental.Accessors;

import java.util.Objects;

/**
 * Base type for reason-coded geometry pipeline failures.
 *
 * <p>Messages are prefixed with the deterministic reason code so callers can match on
 * {@link #reasonCode()} without parsing free text.</p>
 */
@Getter
@Accessors(fluent = true)
public abstract class GeometryBlockException extends RuntimeException {
    private final String reasonCode;

    /**
     * Creates a reason-coded failure.
     *
     * @param reasonCode deterministic reason code.
     * @param message descriptive message.
     */
    protected GeometryBlockException(String reasonCode, String message) {
        super(formatMessage(reasonCode, message));
        this.reasonCode = requireReasonCode(reasonCode);
    }

    /**
     * Creates a reason-coded failure with a cause.
     *
     * @param reasonCode deterministic reason code.
     * @param message descriptive message.
     * @param cause underlying exception.
     */
    protected GeometryBlockException(String reasonCode, String message, Throwable cause) {
        super(formatMessage(reasonCode, message), cause);
        this.reasonCode = requireReasonCode(reasonCode);
    }

    /**
     * Formats exception message with its reason-code prefix.
     */
    private static String formatMessage(String reasonCode, String message) {
        return "[" + requireReasonCode(reasonCode) + "] " + Objects.requireNonNull(message, "message");
    }

    /**
     * Validates reason-code contract.
     */
    private static String requireReasonCode(String reasonCode) {
        String code = Objects.requireNonNull(reasonCode, "reasonCode");
        if (code.isBlank()) {
            throw new IllegalArgumentException("reasonCode must be non-blank");
        }
        return code;
    }
}

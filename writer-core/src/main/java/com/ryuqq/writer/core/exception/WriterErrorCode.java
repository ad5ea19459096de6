package com.ryuqq.writer.core.exception;

/**
 * Writer error codes.
 *
 * <p>Every exception raised by the writer itself carries one of these codes. Failures of
 * the submitted work are not wrapped and carry no code.</p>
 *
 * @author Writer Team
 * @since 1.0.0
 */
public enum WriterErrorCode {

    // --- 1xxx: lifecycle ---
    NOT_INITIALISED(1001, "Writer is not initialised"),

    // --- 2xxx: submission ---
    HANDOFF_INTERRUPTED(2001, "Interrupted before the task was handed to the worker"),

    // --- 3xxx: transaction ---
    BEGIN_FAILED(3001, "Failed to begin transaction"),
    COMMIT_FAILED(3002, "Failed to commit transaction"),
    ROLLBACK_FAILED(3003, "Failed to roll back transaction"),

    ;

    private final int code;
    private final String defaultMessage;

    WriterErrorCode(int code, String defaultMessage) {
        this.code = code;
        this.defaultMessage = defaultMessage;
    }

    public int getCode() {
        return code;
    }

    public String getDefaultMessage() {
        return defaultMessage;
    }
}

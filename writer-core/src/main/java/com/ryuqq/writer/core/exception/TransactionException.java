package com.ryuqq.writer.core.exception;

/**
 * Failure to begin, commit or roll back a transaction.
 *
 * @author Writer Team
 * @since 1.0.0
 */
public class TransactionException extends WriterException {

    public TransactionException(WriterErrorCode errorCode, String message) {
        super(errorCode, message);
    }

    public TransactionException(WriterErrorCode errorCode, String message, Throwable cause) {
        super(errorCode, message, cause);
    }

    /**
     * begin 실패.
     *
     * @param cause 원인
     * @return TransactionException 인스턴스
     */
    public static TransactionException beginFailed(Throwable cause) {
        return new TransactionException(WriterErrorCode.BEGIN_FAILED,
            WriterErrorCode.BEGIN_FAILED.getDefaultMessage() + ": " + describe(cause), cause);
    }

    /**
     * commit 실패.
     *
     * @param cause 원인
     * @return TransactionException 인스턴스
     */
    public static TransactionException commitFailed(Throwable cause) {
        return new TransactionException(WriterErrorCode.COMMIT_FAILED,
            WriterErrorCode.COMMIT_FAILED.getDefaultMessage() + ": " + describe(cause), cause);
    }

    /**
     * rollback 실패.
     *
     * @param cause 원인
     * @return TransactionException 인스턴스
     */
    public static TransactionException rollbackFailed(Throwable cause) {
        return new TransactionException(WriterErrorCode.ROLLBACK_FAILED,
            WriterErrorCode.ROLLBACK_FAILED.getDefaultMessage() + ": " + describe(cause), cause);
    }

    private static String describe(Throwable cause) {
        if (cause == null) {
            return "unknown cause";
        }
        return cause.getMessage() != null ? cause.getMessage() : cause.getClass().getSimpleName();
    }
}

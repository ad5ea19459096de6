package com.ryuqq.writer.core.exception;

/**
 * Thrown when the submitting thread is interrupted before its task was accepted by a worker.
 *
 * <p>The task has not run and will not run. The thread's interrupt flag is restored
 * before this exception is thrown.</p>
 *
 * @author Writer Team
 * @since 1.0.0
 */
public class WriterInterruptedException extends WriterException {

    public WriterInterruptedException(String message, InterruptedException cause) {
        super(WriterErrorCode.HANDOFF_INTERRUPTED, message, cause);
    }
}

package com.ryuqq.writer.core.exception;

/**
 * Thrown synchronously by {@code submit} on a writer whose task queue was never set up.
 *
 * @author Writer Team
 * @since 1.0.0
 */
public class WriterNotInitialisedException extends WriterException {

    public WriterNotInitialisedException() {
        super(WriterErrorCode.NOT_INITIALISED);
    }

    public WriterNotInitialisedException(String message) {
        super(WriterErrorCode.NOT_INITIALISED, message);
    }
}

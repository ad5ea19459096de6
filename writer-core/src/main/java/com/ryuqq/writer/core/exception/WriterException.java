package com.ryuqq.writer.core.exception;

/**
 * Base class of the exceptions raised by the writer and its SPI adapters.
 *
 * <p>Unchecked so that it can cross the work function boundary without being declared.</p>
 *
 * @author Writer Team
 * @since 1.0.0
 */
public class WriterException extends RuntimeException {

    private final WriterErrorCode errorCode;

    public WriterException(WriterErrorCode errorCode) {
        super(errorCode.getDefaultMessage());
        this.errorCode = errorCode;
    }

    public WriterException(WriterErrorCode errorCode, String message) {
        super(message);
        this.errorCode = errorCode;
    }

    public WriterException(WriterErrorCode errorCode, String message, Throwable cause) {
        super(message, cause);
        this.errorCode = errorCode;
    }

    public WriterErrorCode getErrorCode() {
        return errorCode;
    }
}

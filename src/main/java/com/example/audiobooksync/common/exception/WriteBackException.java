package com.example.audiobooksync.common.exception;

public class WriteBackException extends BusinessException {

    public static final String CODE = "WRITE_BACK_FAILED";

    public WriteBackException(String message) {
        super(CODE, message);
    }

    public WriteBackException(String message, Throwable cause) {
        super(CODE, message, cause);
    }
}

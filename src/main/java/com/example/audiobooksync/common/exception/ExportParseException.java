package com.example.audiobooksync.common.exception;

public class ExportParseException extends BusinessException {

    public static final String CODE = "EXPORT_PARSE_FAILED";

    private static final String USER_ACTION = "Check that the file is a library export and is readable";

    public ExportParseException(String message) {
        super(CODE, message, USER_ACTION);
    }

    public ExportParseException(String message, Throwable cause) {
        super(CODE, message, USER_ACTION, cause);
    }
}

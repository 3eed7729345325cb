package com.example.audiobooksync.common.exception;

/**
 * Error reported to API callers as {@code code} + message, with an optional hint telling
 * the user what to do next.
 */
public class BusinessException extends RuntimeException {

    private final String code;
    private final String userAction;

    public BusinessException(String code, String message) {
        this(code, message, (String) null);
    }

    public BusinessException(String code, String message, String userAction) {
        this(code, message, userAction, null);
    }

    public BusinessException(String code, String message, Throwable cause) {
        this(code, message, null, cause);
    }

    public BusinessException(String code, String message, String userAction, Throwable cause) {
        super(message, cause);
        this.code = code;
        this.userAction = userAction;
    }

    public String getCode() {
        return code;
    }

    public String getUserAction() {
        return userAction;
    }
}

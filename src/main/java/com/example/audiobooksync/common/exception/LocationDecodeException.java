package com.example.audiobooksync.common.exception;

public class LocationDecodeException extends Exception {

    public LocationDecodeException(String message) {
        super(message);
    }

    public LocationDecodeException(String message, Throwable cause) {
        super(message, cause);
    }
}

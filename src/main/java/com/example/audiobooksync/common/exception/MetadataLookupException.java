package com.example.audiobooksync.common.exception;

public class MetadataLookupException extends Exception {

    public MetadataLookupException(String message) {
        super(message);
    }

    public MetadataLookupException(String message, Throwable cause) {
        super(message, cause);
    }
}

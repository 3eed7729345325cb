package com.example.audiobooksync.common.exception;

import com.example.audiobooksync.domain.model.LibraryFingerprint;

public class LibraryModifiedException extends BusinessException {

    public static final String CODE = "409";

    private final LibraryFingerprint stored;
    private final LibraryFingerprint current;

    public LibraryModifiedException(LibraryFingerprint stored, LibraryFingerprint current) {
        super(CODE,
                "Library export has been modified externally (stored: " + stored.describe()
                        + "; current: " + current.describe() + ")",
                "Re-sync the library, or retry with force overwrite");
        this.stored = stored;
        this.current = current;
    }

    public LibraryFingerprint getStored() {
        return stored;
    }

    public LibraryFingerprint getCurrent() {
        return current;
    }
}

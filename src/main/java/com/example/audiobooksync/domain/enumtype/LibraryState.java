package com.example.audiobooksync.domain.enumtype;

import java.util.Locale;

public enum LibraryState {
    IMPORTED,
    ORGANIZED,
    DELETED;

    public String dbValue() {
        return name().toLowerCase(Locale.ROOT);
    }
}

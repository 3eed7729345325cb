package com.example.audiobooksync.domain.enumtype;

public enum ImportMode {

    /** Files are already where they belong; books start out organized. */
    ORGANIZED,

    /** Books are recorded in place and left for a later organize pass. */
    IMPORT,

    /** Books are recorded and then moved by the reorganize phase. */
    ORGANIZE;

    public LibraryState initialState() {
        return this == ORGANIZED ? LibraryState.ORGANIZED : LibraryState.IMPORTED;
    }
}

package com.example.audiobooksync.infrastructure.export;

import com.example.audiobooksync.common.exception.ExportParseException;
import com.example.audiobooksync.domain.model.LibraryExport;
import java.nio.file.Path;

public interface LibraryExportParser {

    LibraryExport parse(Path exportPath) throws ExportParseException;

    /**
     * Parses export bytes already held in memory, e.g. a freshly rewritten export.
     */
    LibraryExport parse(byte[] content) throws ExportParseException;
}

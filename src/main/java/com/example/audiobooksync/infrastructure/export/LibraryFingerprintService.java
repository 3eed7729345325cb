package com.example.audiobooksync.infrastructure.export;

import com.example.audiobooksync.common.util.HashUtil;
import com.example.audiobooksync.domain.model.LibraryFingerprint;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import org.springframework.stereotype.Component;

@Component
public class LibraryFingerprintService {

    /**
     * Key fingerprints are stored under, so {@code ./Library.xml} and its absolute form
     * share one record.
     */
    public static String keyOf(Path path) {
        return path.toAbsolutePath().normalize().toString();
    }

    /**
     * Size, modification time and CRC32 of the file.
     */
    public LibraryFingerprint compute(Path path) throws IOException {
        long size = Files.size(path);
        long modTime = Files.getLastModifiedTime(path).toMillis();
        long checksum = HashUtil.crc32(path);
        return new LibraryFingerprint(keyOf(path), size, modTime, checksum);
    }

    /**
     * Size and modification time only, for frequent polling. The checksum is left at 0.
     */
    public LibraryFingerprint computeCheap(Path path) throws IOException {
        return new LibraryFingerprint(keyOf(path), Files.size(path), Files.getLastModifiedTime(path).toMillis(), 0L);
    }
}

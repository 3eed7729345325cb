package com.example.audiobooksync.domain.model;

import java.time.Instant;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class LibraryFingerprint {

    private String path;

    private long size;

    /** Epoch milliseconds. */
    private long modTime;

    private long checksum;

    /**
     * Cheap comparison on size and modification time. With {@code strong} the checksum
     * must match as well.
     */
    public boolean matches(LibraryFingerprint other, boolean strong) {
        if (other == null) {
            return false;
        }
        if (size != other.size || modTime != other.modTime) {
            return false;
        }
        return !strong || checksum == other.checksum;
    }

    public String describe() {
        return "size=" + size + ", mtime=" + Instant.ofEpochMilli(modTime) + ", crc32=" + Long.toHexString(checksum);
    }
}

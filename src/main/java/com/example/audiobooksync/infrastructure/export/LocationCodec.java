package com.example.audiobooksync.infrastructure.export;

import com.example.audiobooksync.common.exception.LocationDecodeException;
import com.example.audiobooksync.domain.model.PathMapping;
import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.regex.Pattern;
import org.springframework.stereotype.Component;
import org.springframework.util.StringUtils;
import org.springframework.web.util.UriUtils;

/**
 * Converts between the export's {@code file://} locations and local paths, and applies
 * user-supplied prefix remappings to raw locations.
 */
@Component
public class LocationCodec {

    private static final String LOCALHOST_PREFIX = "file://localhost";
    private static final String FILE_PREFIX = "file://";
    private static final Pattern DRIVE_PATH = Pattern.compile("^/[A-Za-z]:/.*");
    private static final Pattern BARE_DRIVE_PATH = Pattern.compile("^[A-Za-z]:/.*");

    /**
     * Decodes a raw location to a local path. Drive-letter paths lose their leading slash
     * ({@code /C:/x -> C:/x}) on every platform.
     */
    public String decode(String rawLocation) throws LocationDecodeException {
        if (!StringUtils.hasText(rawLocation)) {
            throw new LocationDecodeException("Location is empty");
        }
        String location = rawLocation.trim();
        if (location.startsWith(LOCALHOST_PREFIX)) {
            location = location.substring(LOCALHOST_PREFIX.length());
        } else if (location.startsWith(FILE_PREFIX)) {
            location = location.substring(FILE_PREFIX.length());
        } else if (location.contains("://")) {
            throw new LocationDecodeException("Unsupported location scheme: " + rawLocation);
        }

        String decoded;
        try {
            decoded = UriUtils.decode(location, StandardCharsets.UTF_8);
        } catch (IllegalArgumentException e) {
            throw new LocationDecodeException("Failed to decode location " + rawLocation + ": " + e.getMessage(), e);
        }
        if (DRIVE_PATH.matcher(decoded).matches()) {
            decoded = decoded.substring(1);
        }
        if (decoded.isEmpty()) {
            throw new LocationDecodeException("Location has no path: " + rawLocation);
        }
        return decoded;
    }

    /**
     * Encodes a local path as a {@code file://localhost/...} location.
     */
    public String encode(String path) {
        String normalized = path.replace('\\', '/');
        if (BARE_DRIVE_PATH.matcher(normalized).matches()) {
            normalized = "/" + normalized;
        }
        return LOCALHOST_PREFIX + UriUtils.encodePath(normalized, StandardCharsets.UTF_8);
    }

    /**
     * Rewrites the prefix of a raw location. The longest matching {@code from} wins. A
     * location that already sits under some mapping's {@code to}, at least as long as the
     * winning {@code from}, is returned as is, so remapping twice equals remapping once even
     * when one mapping's {@code to} is another one's {@code from}.
     */
    public String remap(String rawLocation, List<PathMapping> mappings) {
        if (rawLocation == null || mappings == null || mappings.isEmpty()) {
            return rawLocation;
        }
        String normalized = rawLocation.replace('\\', '/');
        PathMapping best = null;
        String bestFrom = null;
        int longestTo = -1;
        for (PathMapping mapping : mappings) {
            if (!isUsable(mapping)) {
                continue;
            }
            String from = mapping.getFrom().replace('\\', '/');
            if (normalized.startsWith(from) && (bestFrom == null || from.length() > bestFrom.length())) {
                best = mapping;
                bestFrom = from;
            }
            String to = mapping.getTo().replace('\\', '/');
            if (normalized.startsWith(to)) {
                longestTo = Math.max(longestTo, to.length());
            }
        }
        if (best == null || longestTo >= bestFrom.length()) {
            return rawLocation;
        }
        return best.getTo().replace('\\', '/') + normalized.substring(bestFrom.length());
    }

    /**
     * Maps a local path back into the export's location space: the longest decoded
     * {@code to} prefix is swapped for its {@code from}, then the result is encoded.
     */
    public String reverseRemap(String localPath, List<PathMapping> mappings) {
        String normalized = localPath.replace('\\', '/');
        if (mappings != null) {
            PathMapping best = null;
            String bestTo = null;
            for (PathMapping mapping : mappings) {
                if (!isUsable(mapping)) {
                    continue;
                }
                String to = decodeQuietly(mapping.getTo());
                if (to != null && normalized.startsWith(to) && (bestTo == null || to.length() > bestTo.length())) {
                    best = mapping;
                    bestTo = to;
                }
            }
            if (best != null) {
                String from = decodeQuietly(best.getFrom());
                if (from != null) {
                    normalized = from + normalized.substring(bestTo.length());
                }
            }
        }
        return encode(normalized);
    }

    private String decodeQuietly(String rawLocation) {
        try {
            return decode(rawLocation.replace('\\', '/'));
        } catch (LocationDecodeException e) {
            return null;
        }
    }

    private boolean isUsable(PathMapping mapping) {
        return mapping != null && StringUtils.hasText(mapping.getFrom()) && StringUtils.hasText(mapping.getTo());
    }
}

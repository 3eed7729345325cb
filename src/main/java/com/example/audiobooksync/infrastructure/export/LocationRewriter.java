package com.example.audiobooksync.infrastructure.export;

import java.nio.charset.StandardCharsets;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import org.springframework.stereotype.Component;
import org.springframework.web.util.HtmlUtils;

/**
 * Rewrites {@code Location} values of selected tracks directly in the export bytes. Only the
 * text between the location's {@code <string>} tags changes; every other byte is copied.
 *
 * <p>The content is handled as ISO-8859-1 so that each byte maps to exactly one char and
 * back, whatever the file's real encoding. New locations are percent-encoded ASCII.
 */
@Component
public class LocationRewriter {

    private static final String DICT_OPEN = "<dict>";
    private static final String DICT_CLOSE = "</dict>";
    private static final Pattern PERSISTENT_ID = Pattern.compile("<key>Persistent ID</key>\\s*<string>([^<]*)</string>");
    private static final Pattern LOCATION = Pattern.compile("(<key>Location</key>\\s*<string>)([^<]*)(</string>)");

    /**
     * @param content            original export bytes
     * @param locationsByPersistentId encoded location to store, per persistent id
     */
    public Result rewrite(byte[] content, Map<String, String> locationsByPersistentId) {
        String text = new String(content, StandardCharsets.ISO_8859_1);
        StringBuilder out = new StringBuilder(text.length() + 256);
        int copied = 0;
        int updated = 0;
        int lastOpen = -1;
        int pos = 0;
        while (true) {
            int open = text.indexOf(DICT_OPEN, pos);
            int close = text.indexOf(DICT_CLOSE, pos);
            if (close < 0) {
                break;
            }
            if (open >= 0 && open < close) {
                lastOpen = open;
                pos = open + DICT_OPEN.length();
                continue;
            }
            int end = close + DICT_CLOSE.length();
            if (lastOpen >= 0) {
                // a dictionary without nested dictionaries: a track entry or a playlist item
                String dict = text.substring(lastOpen, end);
                String replacement = rewriteEntry(dict, locationsByPersistentId);
                if (replacement != null) {
                    out.append(text, copied, lastOpen).append(replacement);
                    copied = end;
                    updated++;
                }
                lastOpen = -1;
            }
            pos = end;
        }
        out.append(text, copied, text.length());
        return new Result(out.toString().getBytes(StandardCharsets.ISO_8859_1), updated);
    }

    private String rewriteEntry(String dict, Map<String, String> locationsByPersistentId) {
        Matcher idMatcher = PERSISTENT_ID.matcher(dict);
        if (!idMatcher.find()) {
            return null;
        }
        String newLocation = locationsByPersistentId.get(idMatcher.group(1).trim());
        if (newLocation == null) {
            return null;
        }
        Matcher locationMatcher = LOCATION.matcher(dict);
        if (!locationMatcher.find()) {
            return null;
        }
        return dict.substring(0, locationMatcher.start(2))
                + HtmlUtils.htmlEscape(newLocation)
                + dict.substring(locationMatcher.end(2));
    }

    public static final class Result {

        private final byte[] content;
        private final int updatedCount;

        Result(byte[] content, int updatedCount) {
            this.content = content;
            this.updatedCount = updatedCount;
        }

        public byte[] getContent() {
            return content;
        }

        public int getUpdatedCount() {
            return updatedCount;
        }
    }
}

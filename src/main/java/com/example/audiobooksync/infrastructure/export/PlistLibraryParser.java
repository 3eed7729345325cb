package com.example.audiobooksync.infrastructure.export;

import com.example.audiobooksync.common.exception.ExportParseException;
import com.example.audiobooksync.domain.model.LibraryExport;
import com.example.audiobooksync.domain.model.Playlist;
import com.example.audiobooksync.domain.model.Track;
import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.math.BigInteger;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.Base64;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import javax.xml.parsers.DocumentBuilder;
import javax.xml.parsers.ParserConfigurationException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;
import org.w3c.dom.Document;
import org.w3c.dom.Element;
import org.w3c.dom.Node;
import org.w3c.dom.NodeList;
import org.xml.sax.SAXException;

/**
 * Reads the XML property-list export written by the media player. Structure problems fail
 * the whole parse; a single field with an unexpected type is read as its zero value.
 */
@Component
public class PlistLibraryParser implements LibraryExportParser {

    private static final Logger log = LoggerFactory.getLogger(PlistLibraryParser.class);

    /** Seconds between 1904-01-01 (legacy play-date epoch) and 1970-01-01. */
    private static final long LEGACY_EPOCH_OFFSET_SECONDS = 2_082_844_800L;

    @Override
    public LibraryExport parse(Path exportPath) {
        if (exportPath == null) {
            throw new ExportParseException("Export path is required");
        }
        try (InputStream in = Files.newInputStream(exportPath)) {
            LibraryExport export = parse(in);
            log.info("EXPORT_PARSED path={} tracks={} playlists={}",
                    exportPath, export.getTracks().size(), export.getPlaylists().size());
            return export;
        } catch (IOException e) {
            throw new ExportParseException("Failed to read library export " + exportPath + ": " + e.getMessage(), e);
        }
    }

    @Override
    public LibraryExport parse(byte[] content) {
        if (content == null || content.length == 0) {
            throw new ExportParseException("Library export is empty");
        }
        try {
            return parse(new ByteArrayInputStream(content));
        } catch (IOException e) {
            throw new ExportParseException("Failed to read library export: " + e.getMessage(), e);
        }
    }

    private LibraryExport parse(InputStream in) throws IOException {
        Document document;
        try {
            DocumentBuilder builder = SecureXmlFactory.newDocumentBuilder();
            document = builder.parse(in);
        } catch (ParserConfigurationException | SAXException e) {
            throw new ExportParseException("Malformed library export: " + e.getMessage(), e);
        }

        Element root = document.getDocumentElement();
        if (root == null || !"plist".equals(root.getTagName())) {
            throw new ExportParseException("Library export root element is not <plist>");
        }
        Element rootDict = firstChildElement(root);
        if (rootDict == null || !"dict".equals(rootDict.getTagName())) {
            throw new ExportParseException("Library export has no top-level dictionary");
        }
        Map<String, Object> plist = readDict(rootDict);

        LibraryExport.LibraryExportBuilder builder = LibraryExport.builder()
                .majorVersion(intValue(plist, "Major Version"))
                .minorVersion(intValue(plist, "Minor Version"))
                .applicationVersion(stringValue(plist, "Application Version"))
                .musicFolder(stringValue(plist, "Music Folder"));

        Object tracksValue = plist.get("Tracks");
        if (tracksValue != null && !(tracksValue instanceof Map)) {
            throw new ExportParseException("Library export 'Tracks' entry is not a dictionary");
        }
        if (tracksValue != null) {
            for (Object rawTrack : ((Map<?, ?>) tracksValue).values()) {
                if (rawTrack instanceof Map) {
                    builder.track(toTrack((Map<?, ?>) rawTrack));
                }
            }
        }

        Object playlistsValue = plist.get("Playlists");
        if (playlistsValue != null && !(playlistsValue instanceof List)) {
            throw new ExportParseException("Library export 'Playlists' entry is not an array");
        }
        if (playlistsValue != null) {
            for (Object rawPlaylist : (List<?>) playlistsValue) {
                if (rawPlaylist instanceof Map) {
                    Playlist playlist = toPlaylist((Map<?, ?>) rawPlaylist);
                    if (playlist != null) {
                        builder.playlist(playlist);
                    }
                }
            }
        }
        return builder.build();
    }

    private Track toTrack(Map<?, ?> raw) {
        long size = longValue(raw, "Size");
        if (size < 0) {
            // unsigned sizes above Long.MAX_VALUE; the import falls back to the on-disk size
            size = 0;
        }
        Instant lastPlayed = instantValue(raw, "Play Date UTC");
        if (lastPlayed == null) {
            long legacyPlayDate = longValue(raw, "Play Date");
            if (legacyPlayDate > 0) {
                lastPlayed = Instant.ofEpochSecond(legacyPlayDate - LEGACY_EPOCH_OFFSET_SECONDS);
            }
        }
        return Track.builder()
                .trackId(intValue(raw, "Track ID"))
                .persistentId(stringValue(raw, "Persistent ID"))
                .name(stringValue(raw, "Name"))
                .artist(stringValue(raw, "Artist"))
                .albumArtist(stringValue(raw, "Album Artist"))
                .album(stringValue(raw, "Album"))
                .genre(stringValue(raw, "Genre"))
                .kind(stringValue(raw, "Kind"))
                .discNumber(intValue(raw, "Disc Number"))
                .trackNumber(intValue(raw, "Track Number"))
                .totalTime(longValue(raw, "Total Time"))
                .size(size)
                .location(stringValue(raw, "Location"))
                .year(intValue(raw, "Year"))
                .playCount(intValue(raw, "Play Count"))
                .rating(intValue(raw, "Rating"))
                .bookmark(longValue(raw, "Bookmark"))
                .bookmarkable(booleanValue(raw, "Bookmarkable"))
                .lastPlayed(lastPlayed)
                .dateAdded(instantValue(raw, "Date Added"))
                .comments(stringValue(raw, "Comments"))
                .build();
    }

    private Playlist toPlaylist(Map<?, ?> raw) {
        Object items = raw.get("Playlist Items");
        if (!(items instanceof List)) {
            return null;
        }
        Playlist.PlaylistBuilder builder = Playlist.builder()
                .playlistId(intValue(raw, "Playlist ID"))
                .name(stringValue(raw, "Name"));
        for (Object item : (List<?>) items) {
            if (item instanceof Map) {
                int trackId = intValue((Map<?, ?>) item, "Track ID");
                if (trackId > 0) {
                    builder.trackId(trackId);
                }
            }
        }
        return builder.build();
    }

    // --- Plist value reading ---

    private Object readValue(Element element) {
        String tag = element.getTagName();
        String text = element.getTextContent() == null ? "" : element.getTextContent().trim();
        switch (tag) {
            case "dict":
                return readDict(element);
            case "array":
                return readArray(element);
            case "string":
                return element.getTextContent() == null ? "" : element.getTextContent();
            case "integer":
                return parseInteger(text);
            case "real":
                try {
                    return Double.parseDouble(text);
                } catch (NumberFormatException e) {
                    return null;
                }
            case "true":
                return Boolean.TRUE;
            case "false":
                return Boolean.FALSE;
            case "date":
                try {
                    return Instant.parse(text);
                } catch (DateTimeParseException e) {
                    return null;
                }
            case "data":
                try {
                    return Base64.getMimeDecoder().decode(text);
                } catch (IllegalArgumentException e) {
                    return null;
                }
            default:
                throw new ExportParseException("Unexpected element <" + tag + "> in library export");
        }
    }

    private Map<String, Object> readDict(Element dict) {
        Map<String, Object> result = new LinkedHashMap<>();
        List<Element> children = childElements(dict);
        for (int i = 0; i < children.size(); i += 2) {
            Element keyElement = children.get(i);
            if (!"key".equals(keyElement.getTagName())) {
                throw new ExportParseException("Expected <key> in dictionary, found <" + keyElement.getTagName() + ">");
            }
            if (i + 1 >= children.size()) {
                throw new ExportParseException("Dictionary key '" + keyElement.getTextContent() + "' has no value");
            }
            result.put(keyElement.getTextContent(), readValue(children.get(i + 1)));
        }
        return result;
    }

    private List<Object> readArray(Element array) {
        List<Object> result = new ArrayList<>();
        for (Element child : childElements(array)) {
            result.add(readValue(child));
        }
        return result;
    }

    private Long parseInteger(String text) {
        try {
            return new BigInteger(text).longValue();
        } catch (NumberFormatException e) {
            return null;
        }
    }

    private static List<Element> childElements(Element parent) {
        NodeList nodes = parent.getChildNodes();
        if (nodes.getLength() == 0) {
            return Collections.emptyList();
        }
        List<Element> elements = new ArrayList<>();
        for (int i = 0; i < nodes.getLength(); i++) {
            Node node = nodes.item(i);
            if (node.getNodeType() == Node.ELEMENT_NODE) {
                elements.add((Element) node);
            }
        }
        return elements;
    }

    private static Element firstChildElement(Element parent) {
        List<Element> children = childElements(parent);
        return children.isEmpty() ? null : children.get(0);
    }

    private static String stringValue(Map<?, ?> raw, String key) {
        Object value = raw.get(key);
        return value instanceof String ? (String) value : "";
    }

    private static long longValue(Map<?, ?> raw, String key) {
        Object value = raw.get(key);
        if (value instanceof Long) {
            return (Long) value;
        }
        if (value instanceof Double) {
            return ((Double) value).longValue();
        }
        return 0L;
    }

    private static int intValue(Map<?, ?> raw, String key) {
        long value = longValue(raw, key);
        if (value > Integer.MAX_VALUE || value < Integer.MIN_VALUE) {
            return 0;
        }
        return (int) value;
    }

    private static boolean booleanValue(Map<?, ?> raw, String key) {
        return Boolean.TRUE.equals(raw.get(key));
    }

    private static Instant instantValue(Map<?, ?> raw, String key) {
        Object value = raw.get(key);
        return value instanceof Instant ? (Instant) value : null;
    }
}

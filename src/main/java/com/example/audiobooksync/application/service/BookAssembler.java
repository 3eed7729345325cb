package com.example.audiobooksync.application.service;

import com.example.audiobooksync.common.exception.LocationDecodeException;
import com.example.audiobooksync.domain.model.AlbumGroup;
import com.example.audiobooksync.domain.model.ImportJobParams;
import com.example.audiobooksync.domain.model.PathMapping;
import com.example.audiobooksync.domain.model.Track;
import com.example.audiobooksync.infrastructure.export.LocationCodec;
import com.example.audiobooksync.infrastructure.persistence.entity.BookEntity;
import com.example.audiobooksync.infrastructure.persistence.entity.BookSegmentEntity;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.time.Instant;
import java.time.LocalDateTime;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Locale;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import org.springframework.stereotype.Component;

/**
 * Builds the catalog record for an album group. The first track decides title, year,
 * persistent id and the play statistics; duration and size are summed over all tracks.
 */
@Component
public class BookAssembler {

    private static final Pattern SERIES_POSITION = Pattern.compile(
            "(?i)(?:book|vol\\.?|volume|part|#)\\s*(\\d+)");

    private final LocationCodec locationCodec;

    public BookAssembler(LocationCodec locationCodec) {
        this.locationCodec = locationCodec;
    }

    /**
     * @throws LocationDecodeException a member track's location cannot be decoded
     * @throws NoSuchFileException     the first track's file is missing
     */
    public BookCandidate assemble(AlbumGroup group, ImportJobParams params, Long jobId)
            throws LocationDecodeException, IOException {
        Track first = group.getAuthoritativeTrack();
        if (first == null) {
            throw new IllegalArgumentException("Album group " + group.getKey() + " has no tracks");
        }
        List<PathMapping> mappings = params.getPathMappings();
        List<Path> files = new ArrayList<>(group.getTracks().size());
        for (Track track : group.getTracks()) {
            files.add(resolve(track, mappings));
        }
        Path firstFile = files.get(0);
        if (!Files.exists(firstFile)) {
            throw new NoSuchFileException(firstFile.toString(), null, "file does not exist");
        }

        long durationMs = 0;
        long totalSize = 0;
        for (int i = 0; i < group.getTracks().size(); i++) {
            Track track = group.getTracks().get(i);
            durationMs += Math.max(0L, track.getTotalTime());
            totalSize += sizeOf(track, files.get(i));
        }

        String fileName = firstFile.getFileName().toString();
        BookEntity book = new BookEntity();
        book.setTitle(resolveTitle(group, first, fileName));
        book.setFilePath(group.isMultiTrack() ? commonParent(files).toString() : firstFile.toString());
        book.setFormat(extension(fileName));
        book.setDurationSec(durationMs > 0 ? (int) (durationMs / 1000) : null);
        book.setFileSize(totalSize > 0 ? totalSize : null);
        book.setOriginalFilename(fileName);
        book.setReleaseYear(first.getYear() > 0 ? first.getYear() : null);
        book.setPersistentId(first.getPersistentId().trim().isEmpty() ? null : first.getPersistentId().trim());
        book.setPlayCount(first.getPlayCount());
        book.setRating(first.getRating());
        book.setBookmarkMs(first.getBookmark());
        book.setLastPlayedAt(toLocalDateTime(first.getLastPlayed()));
        book.setDateAddedAt(toLocalDateTime(first.getDateAdded()));
        if (!first.getAlbumArtist().isEmpty() && !first.getAlbumArtist().equals(first.getArtist())) {
            book.setNarrator(first.getAlbumArtist());
        }
        if (!first.getComments().isEmpty()) {
            book.setEdition(first.getComments());
        }
        book.setLibraryState(params.getImportMode().initialState().dbValue());
        book.setImportSource(params.getExportPath());
        book.setImportJobId(jobId);

        List<BookSegmentEntity> segments = group.isMultiTrack()
                ? buildSegments(group.getTracks(), files)
                : Collections.emptyList();

        String author = first.getArtist().trim();
        String seriesName = extractSeriesName(first.getAlbum());
        Integer seriesPosition = seriesName == null ? null : extractSeriesPosition(first.getAlbum());
        return new BookCandidate(book, segments, firstFile, author.isEmpty() ? null : author,
                seriesName, seriesPosition);
    }

    /**
     * Applies the path mappings to the raw location and decodes it.
     */
    public Path resolve(Track track, List<PathMapping> mappings) throws LocationDecodeException {
        String remapped = locationCodec.remap(track.getLocation(), mappings);
        return Paths.get(locationCodec.decode(remapped));
    }

    private List<BookSegmentEntity> buildSegments(List<Track> tracks, List<Path> files) throws IOException {
        List<BookSegmentEntity> segments = new ArrayList<>(tracks.size());
        for (int i = 0; i < tracks.size(); i++) {
            Track track = tracks.get(i);
            Path file = files.get(i);
            BookSegmentEntity segment = new BookSegmentEntity();
            segment.setFilePath(file.toString());
            segment.setFormat(extension(file.getFileName().toString()));
            long size = sizeOf(track, file);
            segment.setFileSize(size > 0 ? size : null);
            segment.setDurationSec(track.getTotalTime() > 0 ? (int) (track.getTotalTime() / 1000) : null);
            segment.setTrackNumber(track.getTrackNumber() > 0 ? track.getTrackNumber() : i + 1);
            segment.setTotalTracks(tracks.size());
            segments.add(segment);
        }
        return segments;
    }

    private long sizeOf(Track track, Path file) throws IOException {
        if (track.getSize() > 0) {
            return track.getSize();
        }
        return Files.isRegularFile(file) ? Files.size(file) : 0L;
    }

    private String resolveTitle(AlbumGroup group, Track first, String fileName) {
        if (group.isMultiTrack() && !first.getAlbum().trim().isEmpty()) {
            return first.getAlbum().trim();
        }
        String name = first.getName().trim();
        if (!name.isEmpty()) {
            return name;
        }
        int dot = fileName.lastIndexOf('.');
        return dot > 0 ? fileName.substring(0, dot) : fileName;
    }

    static Path commonParent(List<Path> files) {
        Path common = files.get(0).getParent();
        for (Path file : files) {
            while (common != null && !file.startsWith(common)) {
                common = common.getParent();
            }
        }
        return common == null ? files.get(0).getRoot() : common;
    }

    /**
     * Series name from albums such as {@code "Series, Book 2"}, {@code "Series - Book 2"} or
     * {@code "Series: Book 2"}. The album must split into exactly two parts.
     */
    static String extractSeriesName(String album) {
        if (album == null || album.trim().isEmpty()) {
            return null;
        }
        for (String separator : new String[] {",", " - ", ":"}) {
            String[] parts = album.split(Pattern.quote(separator), -1);
            if (parts.length == 2 && !parts[0].trim().isEmpty() && !parts[1].trim().isEmpty()) {
                return parts[0].trim();
            }
        }
        return null;
    }

    static Integer extractSeriesPosition(String album) {
        Matcher matcher = SERIES_POSITION.matcher(album);
        if (!matcher.find()) {
            return null;
        }
        try {
            return Integer.parseInt(matcher.group(1));
        } catch (NumberFormatException e) {
            return null;
        }
    }

    private static String extension(String fileName) {
        int dot = fileName.lastIndexOf('.');
        return dot < 0 ? "" : fileName.substring(dot + 1).toLowerCase(Locale.ROOT);
    }

    private static LocalDateTime toLocalDateTime(Instant instant) {
        return instant == null ? null : LocalDateTime.ofInstant(instant, ZoneOffset.UTC);
    }
}

package com.example.audiobooksync.infrastructure.collaborator;

import com.example.audiobooksync.common.config.AppImportProperties;
import com.example.audiobooksync.common.exception.MetadataLookupException;
import com.example.audiobooksync.infrastructure.catalog.CatalogStore;
import com.example.audiobooksync.infrastructure.persistence.entity.BookEntity;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.Locale;
import java.util.Optional;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import java.util.stream.Stream;
import org.jaudiotagger.audio.AudioFile;
import org.jaudiotagger.audio.AudioFileIO;
import org.jaudiotagger.audio.AudioHeader;
import org.jaudiotagger.tag.FieldKey;
import org.jaudiotagger.tag.Tag;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Fills missing release year, narrator and duration from the tags embedded in the book's
 * audio file. For a multi-file book the first audio file of the directory is read, and its
 * duration is not used.
 */
@Component
public class EmbeddedTagMetadataEnricher implements MetadataEnricher {

    private static final Logger log = LoggerFactory.getLogger(EmbeddedTagMetadataEnricher.class);

    private static final Pattern FIRST_INTEGER_PATTERN = Pattern.compile("(\\d+)");

    private final CatalogStore catalogStore;
    private final AppImportProperties appImportProperties;

    public EmbeddedTagMetadataEnricher(CatalogStore catalogStore, AppImportProperties appImportProperties) {
        this.catalogStore = catalogStore;
        this.appImportProperties = appImportProperties;
    }

    @Override
    public BookEntity fetchMetadataForRecord(Long bookId) throws MetadataLookupException {
        BookEntity book = catalogStore.getBookById(bookId);
        if (book == null) {
            throw new MetadataLookupException("Book not found: " + bookId);
        }
        Path bookPath = Paths.get(book.getFilePath());
        boolean directory = Files.isDirectory(bookPath);
        Path audioFile = directory ? firstAudioFile(bookPath) : bookPath;
        if (!isSupported(audioFile)) {
            throw new MetadataLookupException("Unsupported audio format: " + audioFile);
        }

        AudioFile parsed;
        try {
            parsed = AudioFileIO.read(audioFile.toFile());
        } catch (Exception e) {
            throw new MetadataLookupException("Failed to read tags from " + audioFile + ": " + e.getMessage(), e);
        }
        Tag tag = parsed.getTag();
        AudioHeader header = parsed.getAudioHeader();

        boolean changed = false;
        Integer year = parseInteger(safeTagValue(tag, FieldKey.YEAR));
        if (isMissing(book.getReleaseYear()) && year != null && year > 0) {
            book.setReleaseYear(year);
            changed = true;
        }
        String composer = safeTagValue(tag, FieldKey.COMPOSER);
        if (book.getNarrator() == null && composer != null) {
            book.setNarrator(composer);
            changed = true;
        }
        if (!directory && isMissing(book.getDurationSec()) && header != null && header.getTrackLength() > 0) {
            book.setDurationSec(header.getTrackLength());
            changed = true;
        }
        if (changed) {
            catalogStore.updateBook(book);
            log.debug("BOOK_ENRICHED bookId={} file={}", bookId, audioFile);
        }
        return book;
    }

    private Path firstAudioFile(Path directory) throws MetadataLookupException {
        try (Stream<Path> files = Files.list(directory)) {
            Optional<Path> first = files
                    .filter(Files::isRegularFile)
                    .filter(this::isSupported)
                    .sorted()
                    .findFirst();
            return first.orElseThrow(() -> new MetadataLookupException("No audio file in " + directory));
        } catch (IOException e) {
            throw new MetadataLookupException("Failed to list " + directory + ": " + e.getMessage(), e);
        }
    }

    private boolean isSupported(Path file) {
        String name = file.getFileName() == null ? "" : file.getFileName().toString();
        int dot = name.lastIndexOf('.');
        if (dot < 0) {
            return false;
        }
        Set<String> extensions = appImportProperties.normalizedAudioExtensions();
        return extensions.contains(name.substring(dot + 1).toLowerCase(Locale.ROOT));
    }

    private boolean isMissing(Integer value) {
        return value == null || value <= 0;
    }

    private String safeTagValue(Tag tag, FieldKey fieldKey) {
        if (tag == null) {
            return null;
        }
        String value = tag.getFirst(fieldKey);
        if (value == null) {
            return null;
        }
        String trimmed = value.trim();
        return trimmed.isEmpty() ? null : trimmed;
    }

    private Integer parseInteger(String raw) {
        if (raw == null) {
            return null;
        }
        Matcher matcher = FIRST_INTEGER_PATTERN.matcher(raw);
        if (!matcher.find()) {
            return null;
        }
        try {
            return Integer.parseInt(matcher.group(1));
        } catch (NumberFormatException e) {
            return null;
        }
    }
}

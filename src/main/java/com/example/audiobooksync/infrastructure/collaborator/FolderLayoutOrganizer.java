package com.example.audiobooksync.infrastructure.collaborator;

import com.example.audiobooksync.common.config.AppImportProperties;
import com.example.audiobooksync.infrastructure.catalog.CatalogStore;
import com.example.audiobooksync.infrastructure.persistence.entity.AuthorEntity;
import com.example.audiobooksync.infrastructure.persistence.entity.BookEntity;
import java.io.IOException;
import java.nio.file.FileAlreadyExistsException;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;
import org.springframework.util.StringUtils;

/**
 * Moves books to {@code <organize-root>/<author>/<title>/}. A single-file book keeps its
 * file name; a multi-file book's directory becomes the title directory.
 */
@Component
public class FolderLayoutOrganizer implements Organizer {

    private static final Logger log = LoggerFactory.getLogger(FolderLayoutOrganizer.class);

    private static final String UNKNOWN_AUTHOR = "Unknown Author";
    private static final String UNKNOWN_TITLE = "Unknown Title";

    private final CatalogStore catalogStore;
    private final AppImportProperties appImportProperties;

    public FolderLayoutOrganizer(CatalogStore catalogStore, AppImportProperties appImportProperties) {
        this.catalogStore = catalogStore;
        this.appImportProperties = appImportProperties;
    }

    @Override
    public String organizeBook(BookEntity book) throws IOException {
        if (!StringUtils.hasText(appImportProperties.getOrganizeRoot())) {
            throw new IOException("Organize root is not configured (app.import.organize-root)");
        }
        Path source = Paths.get(book.getFilePath());
        if (!Files.exists(source)) {
            throw new NoSuchFileException(source.toString());
        }
        List<AuthorEntity> authors = catalogStore.getBookAuthors(book.getId());
        String author = authors == null || authors.isEmpty() ? UNKNOWN_AUTHOR : authors.get(0).getName();
        Path titleDir = Paths.get(appImportProperties.getOrganizeRoot())
                .resolve(sanitize(author, UNKNOWN_AUTHOR))
                .resolve(sanitize(book.getTitle(), UNKNOWN_TITLE));

        Path target = Files.isDirectory(source) ? titleDir : titleDir.resolve(source.getFileName());
        if (target.toAbsolutePath().normalize().equals(source.toAbsolutePath().normalize())) {
            return target.toString();
        }
        if (Files.exists(target)) {
            throw new FileAlreadyExistsException(target.toString());
        }
        Files.createDirectories(target.getParent());
        Files.move(source, target);
        log.info("BOOK_ORGANIZED bookId={} from={} to={}", book.getId(), source, target);
        return target.toString();
    }

    static String sanitize(String name, String fallback) {
        if (name == null) {
            return fallback;
        }
        String cleaned = name.replaceAll("[\\\\/:*?\"<>|\\p{Cntrl}]", "_").trim();
        while (cleaned.endsWith(".")) {
            cleaned = cleaned.substring(0, cleaned.length() - 1).trim();
        }
        return cleaned.isEmpty() ? fallback : cleaned;
    }
}

package com.example.audiobooksync.infrastructure.collaborator;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import com.example.audiobooksync.common.config.AppImportProperties;
import com.example.audiobooksync.infrastructure.catalog.InMemoryCatalogStore;
import com.example.audiobooksync.infrastructure.persistence.entity.AuthorEntity;
import com.example.audiobooksync.infrastructure.persistence.entity.BookEntity;
import java.io.IOException;
import java.nio.file.FileAlreadyExistsException;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.util.Collections;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class FolderLayoutOrganizerTest {

    @TempDir
    Path dir;

    private Path root;
    private InMemoryCatalogStore catalogStore;
    private AppImportProperties properties;
    private FolderLayoutOrganizer organizer;

    @BeforeEach
    void setUp() {
        root = dir.resolve("library");
        catalogStore = new InMemoryCatalogStore();
        properties = new AppImportProperties();
        properties.setOrganizeRoot(root.toString());
        organizer = new FolderLayoutOrganizer(catalogStore, properties);
    }

    @Test
    void singleFileBookShouldMoveUnderAuthorAndTitle() throws Exception {
        Path source = Files.write(dir.resolve("dune.m4b"), new byte[] {1, 2});
        BookEntity book = book("Dune: Part 1", source);
        AuthorEntity author = catalogStore.getOrCreateAuthorByName("Frank Herbert");
        catalogStore.setBookAuthors(book.getId(), Collections.singletonList(author.getId()));

        String newPath = organizer.organizeBook(book);

        Path expected = root.resolve("Frank Herbert").resolve("Dune_ Part 1").resolve("dune.m4b");
        assertEquals(expected.toString(), newPath);
        assertTrue(Files.exists(expected));
        assertFalse(Files.exists(source));
    }

    @Test
    void directoryBookShouldBecomeTitleDirectory() throws Exception {
        Path source = Files.createDirectories(dir.resolve("parts"));
        Files.write(source.resolve("01.mp3"), new byte[] {1});
        Files.write(source.resolve("02.mp3"), new byte[] {2});
        BookEntity book = book("Long Book", source);

        String newPath = organizer.organizeBook(book);

        Path expected = root.resolve("Unknown Author").resolve("Long Book");
        assertEquals(expected.toString(), newPath);
        assertTrue(Files.exists(expected.resolve("02.mp3")));
    }

    @Test
    void alreadyOrganizedBookShouldStay() throws Exception {
        Path titleDir = Files.createDirectories(root.resolve("Unknown Author").resolve("Stay"));
        Path source = Files.write(titleDir.resolve("stay.m4b"), new byte[] {1});

        assertEquals(source.toString(), organizer.organizeBook(book("Stay", source)));
        assertTrue(Files.exists(source));
    }

    @Test
    void existingTargetShouldFail() throws Exception {
        Path source = Files.write(dir.resolve("x.m4b"), new byte[] {1});
        Path titleDir = Files.createDirectories(root.resolve("Unknown Author").resolve("X"));
        Files.write(titleDir.resolve("x.m4b"), new byte[] {9});

        assertThrows(FileAlreadyExistsException.class, () -> organizer.organizeBook(book("X", source)));
        assertTrue(Files.exists(source));
    }

    @Test
    void missingSourceShouldFail() {
        assertThrows(NoSuchFileException.class, () -> organizer.organizeBook(book("Gone", dir.resolve("gone.m4b"))));
    }

    @Test
    void missingRootShouldFail() throws Exception {
        properties.setOrganizeRoot("");
        Path source = Files.write(dir.resolve("y.m4b"), new byte[] {1});

        assertThrows(IOException.class, () -> organizer.organizeBook(book("Y", source)));
    }

    @Test
    void sanitizeShouldReplaceReservedCharacters() {
        assertEquals("AC_DC", FolderLayoutOrganizer.sanitize("AC/DC", "x"));
        assertEquals("Vol. 2", FolderLayoutOrganizer.sanitize("Vol. 2...", "x"));
        assertEquals("fallback", FolderLayoutOrganizer.sanitize(" .. ", "fallback"));
        assertEquals("fallback", FolderLayoutOrganizer.sanitize(null, "fallback"));
    }

    private BookEntity book(String title, Path file) {
        BookEntity book = new BookEntity();
        book.setTitle(title);
        book.setFilePath(file.toString());
        return catalogStore.createBook(book);
    }
}

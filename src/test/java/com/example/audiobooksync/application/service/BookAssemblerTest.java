package com.example.audiobooksync.application.service;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;

import com.example.audiobooksync.common.exception.LocationDecodeException;
import com.example.audiobooksync.domain.enumtype.ImportMode;
import com.example.audiobooksync.domain.model.AlbumGroup;
import com.example.audiobooksync.domain.model.ImportJobParams;
import com.example.audiobooksync.domain.model.Track;
import com.example.audiobooksync.infrastructure.export.ExportFixtures;
import com.example.audiobooksync.infrastructure.export.LocationCodec;
import com.example.audiobooksync.infrastructure.persistence.entity.BookEntity;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.time.Instant;
import java.time.LocalDateTime;
import java.util.Arrays;
import java.util.Collections;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class BookAssemblerTest {

    private final BookAssembler assembler = new BookAssembler(new LocationCodec());

    @TempDir
    Path dir;

    @Test
    void multiTrackGroupShouldBecomeOneBookWithSegments() throws Exception {
        Path bookDir = Files.createDirectories(dir.resolve("Jane Author").resolve("Long Story, Book 2"));
        Path part1 = Files.write(bookDir.resolve("01.mp3"), new byte[10]);
        Path part2 = Files.write(bookDir.resolve("02.mp3"), new byte[20]);
        Track first = Track.builder().trackId(1).persistentId("PID1").name("Part 1").artist("Jane Author")
                .albumArtist("John Reader").album("Long Story, Book 2").trackNumber(1).totalTime(90_000)
                .size(0).year(2015).playCount(3).rating(60).bookmark(5_000)
                .lastPlayed(Instant.parse("2022-01-02T03:04:05Z"))
                .comments("Unabridged").location(ExportFixtures.fileLocation(part1)).build();
        Track second = Track.builder().trackId(2).persistentId("PID2").name("Part 2").artist("Jane Author")
                .album("Long Story, Book 2").trackNumber(2).totalTime(30_000).size(500)
                .location(ExportFixtures.fileLocation(part2)).build();
        ImportJobParams params = params(ImportMode.IMPORT);

        BookCandidate candidate = assembler.assemble(new AlbumGroup("k", Arrays.asList(first, second)), params, 42L);

        BookEntity book = candidate.getBook();
        assertEquals("Long Story, Book 2", book.getTitle());
        assertEquals(bookDir.toAbsolutePath().toString(), book.getFilePath());
        assertEquals(120, book.getDurationSec());
        assertEquals(510L, book.getFileSize());
        assertEquals("mp3", book.getFormat());
        assertEquals("John Reader", book.getNarrator());
        assertEquals("Unabridged", book.getEdition());
        assertEquals(2015, book.getReleaseYear());
        assertEquals("PID1", book.getPersistentId());
        assertEquals(3, book.getPlayCount());
        assertEquals(LocalDateTime.of(2022, 1, 2, 3, 4, 5), book.getLastPlayedAt());
        assertEquals("imported", book.getLibraryState());
        assertEquals(42L, book.getImportJobId());
        assertEquals("Jane Author", candidate.getAuthorName());
        assertEquals("Long Story", candidate.getSeriesName());
        assertEquals(2, candidate.getSeriesPosition());
        assertEquals(2, candidate.getSegments().size());
        assertEquals(2, candidate.getSegments().get(1).getTrackNumber());
        assertEquals(2, candidate.getSegments().get(0).getTotalTracks());
    }

    @Test
    void singleTrackShouldUseNameAndOrganizedState() throws Exception {
        Path file = Files.write(dir.resolve("dune.m4b"), new byte[8]);
        Track track = Track.builder().trackId(1).name("Dune").artist("Frank Herbert").albumArtist("Frank Herbert")
                .album("Dune").location(ExportFixtures.fileLocation(file)).build();

        BookCandidate candidate = assembler.assemble(new AlbumGroup("k", Collections.singletonList(track)),
                params(ImportMode.ORGANIZED), 1L);

        assertEquals("Dune", candidate.getBook().getTitle());
        assertEquals(file.toAbsolutePath().toString(), candidate.getBook().getFilePath());
        assertEquals("organized", candidate.getBook().getLibraryState());
        assertNull(candidate.getBook().getNarrator());
        assertNull(candidate.getBook().getPersistentId());
        assertEquals(8L, candidate.getBook().getFileSize());
        assertNull(candidate.getSeriesName());
        assertEquals(0, candidate.getSegments().size());
    }

    @Test
    void missingFileShouldFailTheGroup() {
        Track track = Track.builder().trackId(1).name("Gone")
                .location(ExportFixtures.fileLocation(dir.resolve("gone.mp3"))).build();

        assertThrows(NoSuchFileException.class, () -> assembler.assemble(
                new AlbumGroup("k", Collections.singletonList(track)), params(ImportMode.IMPORT), 1L));
    }

    @Test
    void undecodableLocationShouldFailTheGroup() {
        Track track = Track.builder().trackId(1).name("Remote").location("http://example.com/a.mp3").build();

        assertThrows(LocationDecodeException.class, () -> assembler.assemble(
                new AlbumGroup("k", Collections.singletonList(track)), params(ImportMode.IMPORT), 1L));
    }

    @Test
    void seriesShouldBeExtractedFromCommonAlbumPatterns() {
        assertEquals("Discworld", BookAssembler.extractSeriesName("Discworld, Book 5"));
        assertEquals("Expanse", BookAssembler.extractSeriesName("Expanse - Book 3"));
        assertEquals("Foundation", BookAssembler.extractSeriesName("Foundation: Part 1"));
        assertNull(BookAssembler.extractSeriesName("Dune"));
        assertNull(BookAssembler.extractSeriesName("A, B, C"));
        assertEquals(5, BookAssembler.extractSeriesPosition("Discworld, Book 5"));
        assertEquals(12, BookAssembler.extractSeriesPosition("Saga - Vol. 12"));
        assertNull(BookAssembler.extractSeriesPosition("Foundation: Prelude"));
    }

    private ImportJobParams params(ImportMode mode) {
        ImportJobParams params = new ImportJobParams();
        params.setExportPath(dir.resolve("Library.xml").toString());
        params.setImportMode(mode);
        return params;
    }
}

package com.example.audiobooksync.application.service;

import static org.junit.jupiter.api.Assertions.assertEquals;

import com.example.audiobooksync.domain.model.ImportValidationResult;
import com.example.audiobooksync.domain.model.PathMapping;
import com.example.audiobooksync.infrastructure.export.ExportFixtures;
import com.example.audiobooksync.infrastructure.export.LocationCodec;
import com.example.audiobooksync.infrastructure.export.PlistLibraryParser;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Arrays;
import java.util.Collections;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class ImportValidationServiceTest {

    private final AudiobookTrackFilter filter = new AudiobookTrackFilter();
    private final ImportValidationService service = new ImportValidationService(new PlistLibraryParser(), filter,
            new AlbumGrouper(filter), new LocationCodec());

    @Test
    void validateShouldCountFoundAndMissingFiles(@TempDir Path dir) throws Exception {
        Path present = Files.write(dir.resolve("present.m4b"), new byte[] {1});
        Path export = ExportFixtures.export()
                .audiobook(1, "P1", "A", "Book One", 1, present)
                .audiobook(2, "P2", "B", "Book Two", 1, dir.resolve("absent.m4b"))
                .track(3).string("Name", "Song").string("Genre", "Pop").end()
                .track(4).string("Name", "Remote").string("Kind", "Audiobook")
                .string("Location", "http://example.com/episode.mp3").end()
                .writeTo(dir.resolve("Library.xml"));

        ImportValidationResult result = service.validate(export.toString(), Collections.emptyList());

        assertEquals(4, result.getTotalTracks());
        assertEquals(3, result.getAudiobookTracks());
        assertEquals(3, result.getAlbumGroups());
        assertEquals(1, result.getFilesFound());
        assertEquals(2, result.getFilesMissing());
        assertEquals(dir.resolve("absent.m4b").toAbsolutePath().toString(), result.getMissingPaths().get(0));
        assertEquals("1 seconds", result.getEstimatedTime());
    }

    @Test
    void mappingsShouldBeAppliedBeforeCheckingFiles(@TempDir Path dir) throws Exception {
        Files.write(dir.resolve("Dune.m4b"), new byte[] {1});
        Path export = ExportFixtures.export()
                .track(1).string("Name", "Dune").string("Kind", "Audiobook")
                .string("Location", "file://localhost/W:/itunes/Dune.m4b").end()
                .writeTo(dir.resolve("Library.xml"));
        PathMapping mapping = new PathMapping("file://localhost/W:/itunes",
                ExportFixtures.fileLocation(dir));

        ImportValidationResult result = service.validate(export.toString(), Collections.singletonList(mapping));

        assertEquals(1, result.getFilesFound());
        assertEquals(Collections.singletonList("file://localhost/W:/itunes/Dune.m4b"), result.getPathPrefixes());
    }

    @Test
    void prefixesShouldKeepDriveAndTwoDirectories() {
        assertEquals(Arrays.asList("file://localhost/W:/itunes/iTunes%20Media", "file://localhost/Users/me/Music"),
                ImportValidationService.extractPathPrefixes(Arrays.asList(
                        "file://localhost/W:/itunes/iTunes%20Media/Audiobooks/a.m4b",
                        "file://localhost/W:/itunes/iTunes%20Media/Books/b.m4b",
                        "file:///Users/me/Music/c.mp3",
                        "https://example.com/feed.mp3")));
    }

    @Test
    void estimateShouldUseSecondsMinutesAndHours() {
        assertEquals("45 seconds", ImportValidationService.estimateTime(45));
        assertEquals("2 minutes", ImportValidationService.estimateTime(150));
        assertEquals("1 hours 1 minutes", ImportValidationService.estimateTime(3_700));
    }
}

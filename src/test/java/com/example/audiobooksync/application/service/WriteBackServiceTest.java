package com.example.audiobooksync.application.service;

import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

import com.example.audiobooksync.common.config.AppLibraryProperties;
import com.example.audiobooksync.common.exception.BusinessException;
import com.example.audiobooksync.common.exception.ExportParseException;
import com.example.audiobooksync.common.exception.LibraryModifiedException;
import com.example.audiobooksync.common.exception.WriteBackException;
import com.example.audiobooksync.domain.model.LibraryFingerprint;
import com.example.audiobooksync.domain.model.PathMapping;
import com.example.audiobooksync.domain.model.WriteBackResult;
import com.example.audiobooksync.domain.model.WriteBackUpdate;
import com.example.audiobooksync.domain.model.WriteBackValidationResult;
import com.example.audiobooksync.infrastructure.catalog.InMemoryCatalogStore;
import com.example.audiobooksync.infrastructure.export.ExportFixtures;
import com.example.audiobooksync.infrastructure.export.LibraryExportParser;
import com.example.audiobooksync.infrastructure.export.LibraryFingerprintService;
import com.example.audiobooksync.infrastructure.export.LocationCodec;
import com.example.audiobooksync.infrastructure.export.LocationRewriter;
import com.example.audiobooksync.infrastructure.export.PlistLibraryParser;
import com.example.audiobooksync.infrastructure.persistence.entity.BookEntity;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.stream.Collectors;
import java.util.stream.Stream;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.beans.factory.support.StaticListableBeanFactory;

class WriteBackServiceTest {

    @TempDir
    Path dir;

    private InMemoryCatalogStore catalogStore;
    private AppLibraryProperties properties;
    private SimpleMeterRegistry meterRegistry;
    private Path export;
    private byte[] original;
    private Long bookId;

    @BeforeEach
    void setUp() throws Exception {
        catalogStore = new InMemoryCatalogStore();
        properties = new AppLibraryProperties();
        meterRegistry = new SimpleMeterRegistry();
        export = ExportFixtures.export()
                .track(1)
                .string("Persistent ID", "AAAA")
                .string("Name", "Dune")
                .string("Kind", "Audiobook")
                .string("Location", "file://localhost/W:/itunes/Audiobooks/Dune.m4b")
                .end()
                .track(2)
                .string("Persistent ID", "BBBB")
                .string("Name", "Emma")
                .string("Kind", "Audiobook")
                .string("Location", "file://localhost/W:/itunes/Audiobooks/Emma.m4b")
                .end()
                .writeTo(dir.resolve("Library.xml"));
        original = Files.readAllBytes(export);

        BookEntity book = new BookEntity();
        book.setTitle("Dune");
        book.setPersistentId("AAAA");
        book.setFilePath("/mnt/books/Frank Herbert/Dune/Dune.m4b");
        book.setLibraryState("organized");
        bookId = catalogStore.createBook(book).getId();
    }

    @Test
    void writeBackShouldReplaceOnlyTheBooksLocation() throws Exception {
        List<PathMapping> mappings = Collections.singletonList(
                new PathMapping("file://localhost/W:/itunes", "file://localhost/mnt/books"));

        WriteBackResult result = service(new PlistLibraryParser()).writeBack(export.toString(),
                Collections.singletonList(new WriteBackUpdate("AAAA", "/mnt/books/Frank Herbert/Dune/Dune.m4b")),
                mappings, true, false);

        String expected = new String(original, StandardCharsets.UTF_8).replace(
                "file://localhost/W:/itunes/Audiobooks/Dune.m4b",
                "file://localhost/W:/itunes/Frank%20Herbert/Dune/Dune.m4b");
        assertEquals(1, result.getUpdatedCount());
        assertEquals("Updated 1 of 1 locations", result.getMessage());
        assertArrayEquals(expected.getBytes(StandardCharsets.UTF_8), Files.readAllBytes(export));
        assertNotNull(result.getBackupPath());
        assertArrayEquals(original, Files.readAllBytes(Paths.get(result.getBackupPath())));
        assertNotNull(catalogStore.getLibraryFingerprint(export.toString()));
        assertEquals(1.0, meterRegistry.counter("audiobook.writeback", "result", "success").count());
        try (Stream<Path> files = Files.list(dir)) {
            assertFalse(files.anyMatch(file -> file.getFileName().toString().endsWith(".writeback.tmp")));
        }
    }

    @Test
    void modifiedExportShouldConflictWithoutTouchingTheFile() throws Exception {
        catalogStore.saveLibraryFingerprint(new LibraryFingerprint(export.toString(), 1L, 1L, 1L));

        LibraryModifiedException error = assertThrows(LibraryModifiedException.class,
                () -> service(new PlistLibraryParser()).writeBack(export.toString(),
                        Collections.singletonList(new WriteBackUpdate("AAAA", "/new/Dune.m4b")),
                        Collections.emptyList(), true, false));

        assertEquals("409", error.getCode());
        assertEquals(1L, error.getStored().getSize());
        assertEquals(original.length, error.getCurrent().getSize());
        assertArrayEquals(original, Files.readAllBytes(export));
        assertEquals(1, countFiles());
        assertEquals(1.0, meterRegistry.counter("audiobook.writeback", "result", "conflict").count());
    }

    @Test
    void conflictShouldBeFoundWhenExportPathIsNotNormalized() throws Exception {
        catalogStore.saveLibraryFingerprint(new LibraryFingerprint(export.toString(), 1L, 1L, 1L));
        String dotted = dir.resolve(".").resolve("Library.xml").toString();

        assertThrows(LibraryModifiedException.class,
                () -> service(new PlistLibraryParser()).writeBack(dotted,
                        Collections.singletonList(new WriteBackUpdate("AAAA", "/new/Dune.m4b")),
                        Collections.emptyList(), true, false));

        assertArrayEquals(original, Files.readAllBytes(export));
    }

    @Test
    void forceShouldOverrideTheConflict() throws Exception {
        catalogStore.saveLibraryFingerprint(new LibraryFingerprint(export.toString(), 1L, 1L, 1L));

        WriteBackResult result = service(new PlistLibraryParser()).writeBack(export.toString(),
                Collections.singletonList(new WriteBackUpdate("AAAA", "/new/Dune.m4b")),
                Collections.emptyList(), false, true);

        assertEquals(1, result.getUpdatedCount());
        assertNull(result.getBackupPath());
        assertTrue(new String(Files.readAllBytes(export), StandardCharsets.UTF_8)
                .contains("<string>file://localhost/new/Dune.m4b</string>"));
    }

    @Test
    void failedValidationShouldRestoreOriginalBytes() throws Exception {
        LibraryExportParser parser = mock(LibraryExportParser.class);
        when(parser.parse(any(Path.class))).thenThrow(new ExportParseException("truncated"));

        assertThrows(WriteBackException.class, () -> service(parser).writeBack(export.toString(),
                Collections.singletonList(new WriteBackUpdate("AAAA", "/new/Dune.m4b")),
                Collections.emptyList(), false, false));

        assertArrayEquals(original, Files.readAllBytes(export));
        assertNull(catalogStore.getLibraryFingerprint(export.toString()));
        assertEquals(1, countFiles());
    }

    @Test
    void updatesForUnknownBooksShouldBeRejected() {
        BusinessException error = assertThrows(BusinessException.class,
                () -> service(new PlistLibraryParser()).writeBack(export.toString(),
                        Collections.singletonList(new WriteBackUpdate("BBBB", "/new/Emma.m4b")),
                        Collections.emptyList(), false, false));

        assertEquals("400", error.getCode());
    }

    @Test
    void writeBackBooksShouldUseConfiguredExportAndBookPaths() throws Exception {
        properties.setExportPath(export.toString());

        WriteBackResult result = service(new PlistLibraryParser())
                .writeBackBooks(Arrays.asList(bookId, 999L), false, false);

        assertEquals(1, result.getUpdatedCount());
        assertTrue(new String(Files.readAllBytes(export), StandardCharsets.UTF_8)
                .contains("<string>file://localhost/mnt/books/Frank%20Herbert/Dune/Dune.m4b</string>"));
    }

    @Test
    void validateShouldReportUnknownIdsAndMissingPaths() throws Exception {
        Path existing = Files.write(dir.resolve("Emma.m4b"), new byte[] {1});

        WriteBackValidationResult result = service(new PlistLibraryParser()).validate(export.toString(), Arrays.asList(
                new WriteBackUpdate("BBBB", existing.toString()),
                new WriteBackUpdate("CCCC", existing.toString()),
                new WriteBackUpdate("AAAA", dir.resolve("absent.m4b").toString())));

        assertEquals(3, result.getRequested());
        assertEquals(2, result.getMatched());
        assertEquals(Collections.singletonList("CCCC"), result.getUnknownPersistentIds());
        assertEquals(Collections.singletonList(dir.resolve("absent.m4b").toString()), result.getMissingNewPaths());
        assertFalse(result.isValid());
        assertArrayEquals(original, Files.readAllBytes(export));
    }

    private WriteBackService service(LibraryExportParser parser) {
        return new WriteBackService(catalogStore, new LocationCodec(), new LocationRewriter(), parser,
                new LibraryFingerprintService(), properties, beanProvider(meterRegistry));
    }

    private long countFiles() throws Exception {
        try (Stream<Path> files = Files.list(dir)) {
            return files.collect(Collectors.toList()).size();
        }
    }

    private ObjectProvider<MeterRegistry> beanProvider(MeterRegistry meterRegistry) {
        StaticListableBeanFactory beanFactory = new StaticListableBeanFactory();
        beanFactory.addBean("meterRegistry", meterRegistry);
        return beanFactory.getBeanProvider(MeterRegistry.class);
    }
}

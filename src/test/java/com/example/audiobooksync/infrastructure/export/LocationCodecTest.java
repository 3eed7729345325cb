package com.example.audiobooksync.infrastructure.export;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

import com.example.audiobooksync.common.exception.LocationDecodeException;
import com.example.audiobooksync.domain.model.PathMapping;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import org.junit.jupiter.api.Test;

class LocationCodecTest {

    private final LocationCodec codec = new LocationCodec();

    @Test
    void decodeShouldStripLocalhostAndPercentDecode() throws Exception {
        assertEquals("/Users/me/Audio Books/Dune.m4b",
                codec.decode("file://localhost/Users/me/Audio%20Books/Dune.m4b"));
        assertEquals("/srv/books/Caf\u00e9.mp3", codec.decode("file:///srv/books/Caf%C3%A9.mp3"));
    }

    @Test
    void decodeShouldDropSlashBeforeDriveLetter() throws Exception {
        assertEquals("W:/itunes/Book.m4b", codec.decode("file://localhost/W:/itunes/Book.m4b"));
    }

    @Test
    void decodeShouldRejectEmptyAndRemoteLocations() {
        assertThrows(LocationDecodeException.class, () -> codec.decode(""));
        assertThrows(LocationDecodeException.class, () -> codec.decode("http://example.com/feed.mp3"));
        assertThrows(LocationDecodeException.class, () -> codec.decode("file://localhost/bad%zzescape"));
    }

    @Test
    void encodeShouldRoundTripThroughDecode() throws Exception {
        String location = codec.encode("C:\\Audio Books\\Dune #1.m4b");

        assertEquals("file://localhost/C:/Audio%20Books/Dune%20%231.m4b", location);
        assertEquals("C:/Audio Books/Dune #1.m4b", codec.decode(location));
    }

    @Test
    void remapShouldUseLongestMatchingPrefix() {
        List<PathMapping> mappings = Arrays.asList(
                new PathMapping("file://localhost/W:/itunes", "file://localhost/mnt/media"),
                new PathMapping("file://localhost/W:/itunes/iTunes%20Media/Audiobooks", "file://localhost/mnt/books"));

        assertEquals("file://localhost/mnt/books/Dune/01.m4b",
                codec.remap("file://localhost/W:/itunes/iTunes%20Media/Audiobooks/Dune/01.m4b", mappings));
        assertEquals("file://localhost/mnt/media/Music/song.mp3",
                codec.remap("file://localhost/W:/itunes/Music/song.mp3", mappings));
    }

    @Test
    void remapShouldBeIdempotent() {
        List<PathMapping> mappings = Collections.singletonList(
                new PathMapping("file://localhost/data", "file://localhost/data/books"));
        String once = codec.remap("file://localhost/data/Dune.m4b", mappings);

        assertEquals("file://localhost/data/books/Dune.m4b", once);
        assertEquals(once, codec.remap(once, mappings));
    }

    @Test
    void remapShouldBeIdempotentForChainedMappings() {
        List<PathMapping> mappings = Arrays.asList(
                new PathMapping("file://localhost/W:/itunes", "file://localhost/mnt/stage"),
                new PathMapping("file://localhost/mnt/stage", "file://localhost/mnt/books"));
        String once = codec.remap("file://localhost/W:/itunes/Dune/01.m4b", mappings);

        assertEquals("file://localhost/mnt/stage/Dune/01.m4b", once);
        assertEquals(once, codec.remap(once, mappings));
    }

    @Test
    void remapShouldStillApplyWhenTargetIsParentOfSource() {
        List<PathMapping> mappings = Collections.singletonList(
                new PathMapping("file://localhost/data/old", "file://localhost/data"));
        String once = codec.remap("file://localhost/data/old/Dune.m4b", mappings);

        assertEquals("file://localhost/data/Dune.m4b", once);
        assertEquals(once, codec.remap(once, mappings));
    }

    @Test
    void remapWithoutMatchShouldReturnInput() {
        List<PathMapping> mappings = Collections.singletonList(new PathMapping("file://localhost/X:", "file://localhost/x"));

        assertEquals("file://localhost/Y:/a.mp3", codec.remap("file://localhost/Y:/a.mp3", mappings));
        assertEquals("file://localhost/Y:/a.mp3", codec.remap("file://localhost/Y:/a.mp3", null));
    }

    @Test
    void reverseRemapShouldMapLocalPathBackIntoExportSpace() {
        List<PathMapping> mappings = Collections.singletonList(
                new PathMapping("file://localhost/W:/itunes/iTunes%20Media", "file://localhost/mnt/books"));

        assertEquals("file://localhost/W:/itunes/iTunes%20Media/Author/Title/Title.m4b",
                codec.reverseRemap("/mnt/books/Author/Title/Title.m4b", mappings));
        assertEquals("file://localhost/srv/other.m4b", codec.reverseRemap("/srv/other.m4b", mappings));
    }
}

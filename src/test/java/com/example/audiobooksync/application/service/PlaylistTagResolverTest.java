package com.example.audiobooksync.application.service;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

import com.example.audiobooksync.domain.model.AlbumGroup;
import com.example.audiobooksync.domain.model.Playlist;
import com.example.audiobooksync.domain.model.Track;
import java.util.Arrays;
import java.util.Collections;
import java.util.Map;
import java.util.Set;
import java.util.TreeSet;
import org.junit.jupiter.api.Test;

class PlaylistTagResolverTest {

    private final PlaylistTagResolver resolver = new PlaylistTagResolver();

    @Test
    void userPlaylistsShouldBecomeLowerCaseTags() {
        Map<Integer, Set<String>> index = resolver.indexByTrackId(Arrays.asList(
                Playlist.builder().playlistId(1).name("Audiobooks").trackId(10).trackId(11).build(),
                Playlist.builder().playlistId(2).name("Sci-Fi Favourites").trackId(11).build(),
                Playlist.builder().playlistId(3).name("Road Trip").trackId(10).build(),
                Playlist.builder().playlistId(4).name("Library").trackId(10).build()));
        AlbumGroup group = new AlbumGroup("k", Arrays.asList(
                Track.builder().trackId(10).build(), Track.builder().trackId(11).build()));

        assertEquals(new TreeSet<>(Arrays.asList("road trip", "sci-fi favourites")), resolver.tagsFor(group, index));
    }

    @Test
    void emptyIndexShouldGiveNoTags() {
        AlbumGroup group = new AlbumGroup("k", Collections.singletonList(Track.builder().trackId(1).build()));

        assertTrue(resolver.tagsFor(group, Collections.emptyMap()).isEmpty());
    }
}

package com.example.audiobooksync.application.service;

import com.example.audiobooksync.domain.model.AlbumGroup;
import com.example.audiobooksync.domain.model.Playlist;
import com.example.audiobooksync.domain.model.Track;
import java.util.Arrays;
import java.util.Collections;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.TreeSet;
import org.springframework.stereotype.Component;

/**
 * Turns user playlists into book tags. Playlists the media player creates by itself are ignored.
 */
@Component
public class PlaylistTagResolver {

    private static final Set<String> BUILT_IN_PLAYLISTS = new HashSet<>(Arrays.asList(
            "library", "music", "movies", "tv shows", "podcasts", "audiobooks", "itunes u", "books",
            "genius", "recently added", "recently played", "top 25 most played"));

    /**
     * Lower-case playlist names per track id.
     */
    public Map<Integer, Set<String>> indexByTrackId(List<Playlist> playlists) {
        Map<Integer, Set<String>> index = new HashMap<>();
        for (Playlist playlist : playlists) {
            String tag = playlist.getName() == null ? "" : playlist.getName().trim().toLowerCase(Locale.ROOT);
            if (tag.isEmpty() || BUILT_IN_PLAYLISTS.contains(tag)) {
                continue;
            }
            for (Integer trackId : playlist.getTrackIds()) {
                index.computeIfAbsent(trackId, id -> new TreeSet<>()).add(tag);
            }
        }
        return index;
    }

    public Set<String> tagsFor(AlbumGroup group, Map<Integer, Set<String>> index) {
        if (index.isEmpty()) {
            return Collections.emptySet();
        }
        Set<String> tags = new TreeSet<>();
        for (Track track : group.getTracks()) {
            tags.addAll(index.getOrDefault(track.getTrackId(), Collections.emptySet()));
        }
        return tags;
    }
}

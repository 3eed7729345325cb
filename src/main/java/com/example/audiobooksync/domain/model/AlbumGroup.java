package com.example.audiobooksync.domain.model;

import java.util.Collections;
import java.util.List;
import lombok.Value;

@Value
public class AlbumGroup {

    String key;

    List<Track> tracks;

    public AlbumGroup(String key, List<Track> tracks) {
        this.key = key;
        this.tracks = Collections.unmodifiableList(tracks);
    }

    /**
     * First track after sorting; source of title, year and persistent id for the book.
     */
    public Track getAuthoritativeTrack() {
        return tracks.isEmpty() ? null : tracks.get(0);
    }

    public boolean isMultiTrack() {
        return tracks.size() > 1;
    }
}

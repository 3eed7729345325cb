package com.example.audiobooksync.application.service;

import com.example.audiobooksync.domain.model.AlbumGroup;
import com.example.audiobooksync.domain.model.Track;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.springframework.stereotype.Component;

@Component
public class AlbumGrouper {

    private static final Comparator<Track> DISC_TRACK_ORDER = Comparator
            .comparingInt(Track::getDiscNumber)
            .thenComparingInt(Track::getTrackNumber);

    private final AudiobookTrackFilter audiobookTrackFilter;

    public AlbumGrouper(AudiobookTrackFilter audiobookTrackFilter) {
        this.audiobookTrackFilter = audiobookTrackFilter;
    }

    public List<AlbumGroup> group(List<Track> tracks) {
        Map<String, List<Track>> byKey = new LinkedHashMap<>();
        for (Track track : tracks) {
            if (!audiobookTrackFilter.isLongFormAudio(track)) {
                continue;
            }
            byKey.computeIfAbsent(groupKey(track), key -> new ArrayList<>()).add(track);
        }
        List<AlbumGroup> groups = new ArrayList<>(byKey.size());
        for (Map.Entry<String, List<Track>> entry : byKey.entrySet()) {
            List<Track> members = entry.getValue();
            // List.sort is a stable merge sort
            members.sort(DISC_TRACK_ORDER);
            groups.add(new AlbumGroup(entry.getKey(), members));
        }
        return groups;
    }

    static String groupKey(Track track) {
        String artist = trim(track.getArtist());
        String album = trim(track.getAlbum());
        if (album.isEmpty()) {
            album = trim(track.getName());
        }
        return artist + "|" + album;
    }

    private static String trim(String value) {
        return value == null ? "" : value.trim();
    }
}

package com.example.audiobooksync.application.service;

import com.example.audiobooksync.domain.model.Track;
import java.util.Locale;
import org.springframework.stereotype.Component;

@Component
public class AudiobookTrackFilter {

    public boolean isLongFormAudio(Track track) {
        if (track == null) {
            return false;
        }
        String kind = lower(track.getKind());
        if (kind.contains("audiobook") || kind.contains("spoken word")) {
            return true;
        }
        String genre = lower(track.getGenre());
        if (genre.contains("audiobook") || genre.contains("spoken")) {
            return true;
        }
        String location = track.getLocation() == null ? "" : track.getLocation();
        return location.contains("Audiobooks") || location.contains("audiobooks");
    }

    private String lower(String value) {
        return value == null ? "" : value.toLowerCase(Locale.ROOT);
    }
}

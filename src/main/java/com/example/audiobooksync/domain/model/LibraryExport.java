package com.example.audiobooksync.domain.model;

import java.util.List;
import lombok.Builder;
import lombok.Singular;
import lombok.Value;

@Value
@Builder
public class LibraryExport {

    int majorVersion;

    int minorVersion;

    String applicationVersion;

    String musicFolder;

    @Singular
    List<Track> tracks;

    @Singular
    List<Playlist> playlists;
}

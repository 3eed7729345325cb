package com.example.audiobooksync.domain.model;

import java.time.Instant;
import lombok.Builder;
import lombok.Value;

/**
 * One entry of the media-player export. Missing fields are zero values, never null strings.
 */
@Value
@Builder
public class Track {

    int trackId;

    @Builder.Default
    String persistentId = "";

    @Builder.Default
    String name = "";

    @Builder.Default
    String artist = "";

    @Builder.Default
    String albumArtist = "";

    @Builder.Default
    String album = "";

    @Builder.Default
    String genre = "";

    @Builder.Default
    String kind = "";

    int discNumber;

    int trackNumber;

    /** Milliseconds. */
    long totalTime;

    long size;

    @Builder.Default
    String location = "";

    int year;

    int playCount;

    /** 0-100. */
    int rating;

    /** Milliseconds. */
    long bookmark;

    boolean bookmarkable;

    Instant lastPlayed;

    Instant dateAdded;

    @Builder.Default
    String comments = "";
}

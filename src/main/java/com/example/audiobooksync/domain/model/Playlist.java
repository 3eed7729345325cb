package com.example.audiobooksync.domain.model;

import java.util.List;
import lombok.Builder;
import lombok.Singular;
import lombok.Value;

@Value
@Builder
public class Playlist {

    int playlistId;

    String name;

    @Singular
    List<Integer> trackIds;
}

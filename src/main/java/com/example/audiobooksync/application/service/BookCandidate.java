package com.example.audiobooksync.application.service;

import com.example.audiobooksync.infrastructure.persistence.entity.BookEntity;
import com.example.audiobooksync.infrastructure.persistence.entity.BookSegmentEntity;
import java.nio.file.Path;
import java.util.List;
import lombok.AllArgsConstructor;
import lombok.Getter;

@Getter
@AllArgsConstructor
public class BookCandidate {

    private final BookEntity book;

    private final List<BookSegmentEntity> segments;

    /** Resolved file of the group's first track; the content hash is taken from it. */
    private final Path firstFile;

    private final String authorName;

    private final String seriesName;

    private final Integer seriesPosition;
}

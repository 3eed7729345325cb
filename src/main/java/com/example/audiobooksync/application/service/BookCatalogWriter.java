package com.example.audiobooksync.application.service;

import com.example.audiobooksync.infrastructure.catalog.CatalogStore;
import com.example.audiobooksync.infrastructure.persistence.entity.AuthorEntity;
import com.example.audiobooksync.infrastructure.persistence.entity.BookEntity;
import com.example.audiobooksync.infrastructure.persistence.entity.BookSegmentEntity;
import com.example.audiobooksync.infrastructure.persistence.entity.SeriesEntity;
import java.util.Collection;
import java.util.Collections;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Transactional;

@Component
public class BookCatalogWriter {

    private final CatalogStore catalogStore;

    public BookCatalogWriter(CatalogStore catalogStore) {
        this.catalogStore = catalogStore;
    }

    /**
     * Stores the book with its segments, author, series and tags. A failed insert rolls all
     * of them back, so a retried import does not find a half-written book.
     */
    @Transactional(rollbackFor = Exception.class)
    public BookEntity create(BookCandidate candidate, Collection<String> tags) {
        BookEntity book = candidate.getBook();
        if (candidate.getSeriesName() != null) {
            SeriesEntity series = catalogStore.getOrCreateSeriesByName(candidate.getSeriesName());
            book.setSeriesId(series.getId());
            book.setSeriesPosition(candidate.getSeriesPosition());
        }
        catalogStore.createBook(book);

        for (BookSegmentEntity segment : candidate.getSegments()) {
            segment.setBookId(book.getId());
            catalogStore.createSegment(segment);
        }
        if (candidate.getAuthorName() != null) {
            AuthorEntity author = catalogStore.getOrCreateAuthorByName(candidate.getAuthorName());
            catalogStore.setBookAuthors(book.getId(), Collections.singletonList(author.getId()));
        }
        if (tags != null && !tags.isEmpty()) {
            catalogStore.setBookTags(book.getId(), tags);
        }
        return book;
    }
}

package com.example.audiobooksync.infrastructure.catalog;

import com.example.audiobooksync.domain.model.LibraryFingerprint;
import com.example.audiobooksync.infrastructure.persistence.entity.AuthorEntity;
import com.example.audiobooksync.infrastructure.persistence.entity.BookEntity;
import com.example.audiobooksync.infrastructure.persistence.entity.BookSegmentEntity;
import com.example.audiobooksync.infrastructure.persistence.entity.SeriesEntity;
import java.util.Collection;
import java.util.List;

/**
 * Book catalog used by import, sync and write-back. Lookups return {@code null} when
 * nothing matches.
 */
public interface CatalogStore {

    /**
     * Inserts the book and assigns its generated id.
     */
    BookEntity createBook(BookEntity book);

    void updateBook(BookEntity book);

    BookEntity getBookById(Long id);

    BookEntity getBookByFilePath(String filePath);

    BookEntity getBookByFileHash(String fileHash);

    BookEntity getBookByPersistentId(String persistentId);

    /**
     * Books created by the given job, in creation order.
     */
    List<BookEntity> listBooksByImportJob(Long jobId);

    boolean isHashBlocked(String fileHash);

    void createSegment(BookSegmentEntity segment);

    /**
     * Exact, case-sensitive name match; creates the author when absent.
     */
    AuthorEntity getOrCreateAuthorByName(String name);

    SeriesEntity getOrCreateSeriesByName(String name);

    /**
     * Replaces the book's authors, keeping the given order.
     */
    void setBookAuthors(Long bookId, List<Long> authorIds);

    List<AuthorEntity> getBookAuthors(Long bookId);

    void setBookTags(Long bookId, Collection<String> tags);

    void saveLibraryFingerprint(LibraryFingerprint fingerprint);

    LibraryFingerprint getLibraryFingerprint(String path);
}

package com.example.audiobooksync.infrastructure.catalog;

import com.example.audiobooksync.common.util.HashUtil;
import com.example.audiobooksync.domain.model.LibraryFingerprint;
import com.example.audiobooksync.infrastructure.persistence.entity.AuthorEntity;
import com.example.audiobooksync.infrastructure.persistence.entity.BookEntity;
import com.example.audiobooksync.infrastructure.persistence.entity.BookSegmentEntity;
import com.example.audiobooksync.infrastructure.persistence.entity.LibraryFingerprintEntity;
import com.example.audiobooksync.infrastructure.persistence.entity.SeriesEntity;
import com.example.audiobooksync.infrastructure.persistence.mapper.AuthorMapper;
import com.example.audiobooksync.infrastructure.persistence.mapper.BookAuthorMapper;
import com.example.audiobooksync.infrastructure.persistence.mapper.BookMapper;
import com.example.audiobooksync.infrastructure.persistence.mapper.BookSegmentMapper;
import com.example.audiobooksync.infrastructure.persistence.mapper.BookTagMapper;
import com.example.audiobooksync.infrastructure.persistence.mapper.HashBlocklistMapper;
import com.example.audiobooksync.infrastructure.persistence.mapper.LibraryFingerprintMapper;
import com.example.audiobooksync.infrastructure.persistence.mapper.SeriesMapper;
import java.util.Collection;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DuplicateKeyException;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Transactional;
import org.springframework.util.StringUtils;

@Component
public class MyBatisCatalogStore implements CatalogStore {

    private static final Logger log = LoggerFactory.getLogger(MyBatisCatalogStore.class);

    private final BookMapper bookMapper;
    private final BookSegmentMapper bookSegmentMapper;
    private final AuthorMapper authorMapper;
    private final SeriesMapper seriesMapper;
    private final BookAuthorMapper bookAuthorMapper;
    private final BookTagMapper bookTagMapper;
    private final HashBlocklistMapper hashBlocklistMapper;
    private final LibraryFingerprintMapper libraryFingerprintMapper;

    public MyBatisCatalogStore(BookMapper bookMapper,
                               BookSegmentMapper bookSegmentMapper,
                               AuthorMapper authorMapper,
                               SeriesMapper seriesMapper,
                               BookAuthorMapper bookAuthorMapper,
                               BookTagMapper bookTagMapper,
                               HashBlocklistMapper hashBlocklistMapper,
                               LibraryFingerprintMapper libraryFingerprintMapper) {
        this.bookMapper = bookMapper;
        this.bookSegmentMapper = bookSegmentMapper;
        this.authorMapper = authorMapper;
        this.seriesMapper = seriesMapper;
        this.bookAuthorMapper = bookAuthorMapper;
        this.bookTagMapper = bookTagMapper;
        this.hashBlocklistMapper = hashBlocklistMapper;
        this.libraryFingerprintMapper = libraryFingerprintMapper;
    }

    @Override
    public BookEntity createBook(BookEntity book) {
        book.setFilePathMd5(HashUtil.md5Hex(book.getFilePath()));
        bookMapper.insert(book);
        return book;
    }

    @Override
    public void updateBook(BookEntity book) {
        book.setFilePathMd5(HashUtil.md5Hex(book.getFilePath()));
        bookMapper.update(book);
    }

    @Override
    public BookEntity getBookById(Long id) {
        return id == null ? null : bookMapper.selectById(id);
    }

    @Override
    public BookEntity getBookByFilePath(String filePath) {
        if (!StringUtils.hasText(filePath)) {
            return null;
        }
        return bookMapper.selectByFilePathMd5(HashUtil.md5Hex(filePath));
    }

    @Override
    public BookEntity getBookByFileHash(String fileHash) {
        return StringUtils.hasText(fileHash) ? bookMapper.selectByFileHash(fileHash) : null;
    }

    @Override
    public BookEntity getBookByPersistentId(String persistentId) {
        return StringUtils.hasText(persistentId) ? bookMapper.selectByPersistentId(persistentId) : null;
    }

    @Override
    public List<BookEntity> listBooksByImportJob(Long jobId) {
        return bookMapper.selectByImportJobId(jobId);
    }

    @Override
    public boolean isHashBlocked(String fileHash) {
        return StringUtils.hasText(fileHash) && hashBlocklistMapper.countByHash(fileHash) > 0;
    }

    @Override
    public void createSegment(BookSegmentEntity segment) {
        bookSegmentMapper.insert(segment);
    }

    @Override
    public AuthorEntity getOrCreateAuthorByName(String name) {
        AuthorEntity existing = authorMapper.selectByName(name);
        if (existing != null) {
            return existing;
        }
        AuthorEntity created = new AuthorEntity();
        created.setName(name);
        try {
            authorMapper.insert(created);
            return created;
        } catch (DuplicateKeyException e) {
            // created concurrently by another job
            log.debug("AUTHOR_CREATE_RACE name={}", name);
            return authorMapper.selectByName(name);
        }
    }

    @Override
    public SeriesEntity getOrCreateSeriesByName(String name) {
        SeriesEntity existing = seriesMapper.selectByName(name);
        if (existing != null) {
            return existing;
        }
        SeriesEntity created = new SeriesEntity();
        created.setName(name);
        try {
            seriesMapper.insert(created);
            return created;
        } catch (DuplicateKeyException e) {
            log.debug("SERIES_CREATE_RACE name={}", name);
            return seriesMapper.selectByName(name);
        }
    }

    @Override
    @Transactional(rollbackFor = Exception.class)
    public void setBookAuthors(Long bookId, List<Long> authorIds) {
        bookAuthorMapper.deleteByBookId(bookId);
        int position = 0;
        for (Long authorId : authorIds) {
            bookAuthorMapper.insert(bookId, authorId, position++);
        }
    }

    @Override
    public List<AuthorEntity> getBookAuthors(Long bookId) {
        return authorMapper.selectByBookId(bookId);
    }

    @Override
    @Transactional(rollbackFor = Exception.class)
    public void setBookTags(Long bookId, Collection<String> tags) {
        bookTagMapper.deleteByBookId(bookId);
        for (String tag : tags) {
            bookTagMapper.insert(bookId, tag);
        }
    }

    @Override
    public void saveLibraryFingerprint(LibraryFingerprint fingerprint) {
        LibraryFingerprintEntity entity = new LibraryFingerprintEntity();
        entity.setPath(fingerprint.getPath());
        entity.setPathMd5(HashUtil.md5Hex(fingerprint.getPath()));
        entity.setFileSize(fingerprint.getSize());
        entity.setModTime(fingerprint.getModTime());
        entity.setChecksum(fingerprint.getChecksum());
        libraryFingerprintMapper.upsert(entity);
    }

    @Override
    public LibraryFingerprint getLibraryFingerprint(String path) {
        if (!StringUtils.hasText(path)) {
            return null;
        }
        LibraryFingerprintEntity entity = libraryFingerprintMapper.selectByPathMd5(HashUtil.md5Hex(path));
        if (entity == null) {
            return null;
        }
        return new LibraryFingerprint(entity.getPath(),
                entity.getFileSize() == null ? 0L : entity.getFileSize(),
                entity.getModTime() == null ? 0L : entity.getModTime(),
                entity.getChecksum() == null ? 0L : entity.getChecksum());
    }
}

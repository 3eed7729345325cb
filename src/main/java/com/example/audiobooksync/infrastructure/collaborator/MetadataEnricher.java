package com.example.audiobooksync.infrastructure.collaborator;

import com.example.audiobooksync.common.exception.MetadataLookupException;
import com.example.audiobooksync.infrastructure.persistence.entity.BookEntity;

public interface MetadataEnricher {

    /**
     * Looks up metadata for the catalog record, stores whatever was found and returns the
     * updated record.
     */
    BookEntity fetchMetadataForRecord(Long bookId) throws MetadataLookupException;
}

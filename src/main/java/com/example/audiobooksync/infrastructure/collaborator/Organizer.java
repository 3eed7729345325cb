package com.example.audiobooksync.infrastructure.collaborator;

import com.example.audiobooksync.infrastructure.persistence.entity.BookEntity;
import java.io.IOException;

public interface Organizer {

    /**
     * Moves the book's file or directory to its place in the library and returns the new path.
     * The record itself is not updated.
     */
    String organizeBook(BookEntity book) throws IOException;
}

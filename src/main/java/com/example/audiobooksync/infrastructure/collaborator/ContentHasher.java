package com.example.audiobooksync.infrastructure.collaborator;

import java.io.IOException;
import java.nio.file.Path;

public interface ContentHasher {

    String computeFileHash(Path file) throws IOException;
}

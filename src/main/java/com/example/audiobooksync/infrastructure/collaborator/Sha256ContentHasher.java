package com.example.audiobooksync.infrastructure.collaborator;

import com.example.audiobooksync.common.util.HashUtil;
import java.io.IOException;
import java.nio.file.Path;
import org.springframework.stereotype.Component;

@Component
public class Sha256ContentHasher implements ContentHasher {

    @Override
    public String computeFileHash(Path file) throws IOException {
        return HashUtil.sha256Hex(file);
    }
}

package com.example.audiobooksync.application.service;

import com.example.audiobooksync.common.exception.BusinessException;
import com.example.audiobooksync.common.exception.LocationDecodeException;
import com.example.audiobooksync.domain.model.ImportValidationResult;
import com.example.audiobooksync.domain.model.LibraryExport;
import com.example.audiobooksync.domain.model.PathMapping;
import com.example.audiobooksync.domain.model.Track;
import com.example.audiobooksync.infrastructure.export.LibraryExportParser;
import com.example.audiobooksync.infrastructure.export.LocationCodec;
import java.nio.file.Files;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.util.StringUtils;

/**
 * Dry run of an import: counts audiobook tracks, checks that their files exist and lists
 * the location prefixes a user may want to remap. Nothing is stored.
 */
@Service
public class ImportValidationService {

    private static final Logger log = LoggerFactory.getLogger(ImportValidationService.class);

    private static final String FILE_SCHEME = "file://";
    private static final String LOCALHOST_PREFIX = "file://localhost/";

    private final LibraryExportParser libraryExportParser;
    private final AudiobookTrackFilter audiobookTrackFilter;
    private final AlbumGrouper albumGrouper;
    private final LocationCodec locationCodec;

    public ImportValidationService(LibraryExportParser libraryExportParser,
                                   AudiobookTrackFilter audiobookTrackFilter,
                                   AlbumGrouper albumGrouper,
                                   LocationCodec locationCodec) {
        this.libraryExportParser = libraryExportParser;
        this.audiobookTrackFilter = audiobookTrackFilter;
        this.albumGrouper = albumGrouper;
        this.locationCodec = locationCodec;
    }

    public ImportValidationResult validate(String exportPath, List<PathMapping> mappings) {
        if (!StringUtils.hasText(exportPath)) {
            throw new BusinessException("400", "Export path is required");
        }
        LibraryExport export = libraryExportParser.parse(Paths.get(exportPath));

        ImportValidationResult result = new ImportValidationResult();
        result.setTotalTracks(export.getTracks().size());
        List<String> rawLocations = new ArrayList<>();
        for (Track track : export.getTracks()) {
            if (!audiobookTrackFilter.isLongFormAudio(track)) {
                continue;
            }
            result.setAudiobookTracks(result.getAudiobookTracks() + 1);
            rawLocations.add(track.getLocation());
            try {
                String path = locationCodec.decode(locationCodec.remap(track.getLocation(), mappings));
                if (Files.exists(Paths.get(path))) {
                    result.setFilesFound(result.getFilesFound() + 1);
                } else {
                    result.setFilesMissing(result.getFilesMissing() + 1);
                    result.getMissingPaths().add(path);
                }
            } catch (LocationDecodeException e) {
                result.setFilesMissing(result.getFilesMissing() + 1);
                result.getMissingPaths().add(track.getLocation());
            }
        }
        result.setAlbumGroups(albumGrouper.group(export.getTracks()).size());
        result.setPathPrefixes(extractPathPrefixes(rawLocations));
        result.setEstimatedTime(estimateTime(result.getFilesFound()));
        log.info("IMPORT_VALIDATED path={} tracks={} audiobooks={} found={} missing={} groups={}", exportPath,
                result.getTotalTracks(), result.getAudiobookTracks(), result.getFilesFound(),
                result.getFilesMissing(), result.getAlbumGroups());
        return result;
    }

    /**
     * Distinct {@code file://} prefixes made of the drive or root plus two directories.
     * Remote locations such as podcast feeds are skipped.
     */
    static List<String> extractPathPrefixes(List<String> locations) {
        Set<String> prefixes = new LinkedHashSet<>();
        for (String location : locations) {
            if (location == null || !location.startsWith(FILE_SCHEME)) {
                continue;
            }
            String rest = location.startsWith(LOCALHOST_PREFIX)
                    ? location.substring(LOCALHOST_PREFIX.length())
                    : location.substring(FILE_SCHEME.length()).replaceFirst("^/+", "");
            String[] parts = rest.split("/", 4);
            StringBuilder prefix = new StringBuilder(LOCALHOST_PREFIX);
            int segments = Math.min(3, parts.length);
            for (int i = 0; i < segments; i++) {
                if (i > 0) {
                    prefix.append('/');
                }
                prefix.append(parts[i]);
            }
            prefixes.add(prefix.toString());
        }
        return new ArrayList<>(prefixes);
    }

    /**
     * Roughly one second per file found.
     */
    static String estimateTime(int filesFound) {
        int seconds = filesFound;
        if (seconds < 60) {
            return seconds + " seconds";
        }
        if (seconds < 3600) {
            return (seconds / 60) + " minutes";
        }
        return (seconds / 3600) + " hours " + ((seconds % 3600) / 60) + " minutes";
    }
}

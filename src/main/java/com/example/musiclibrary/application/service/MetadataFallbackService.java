package com.example.musiclibrary.application.service;

import com.example.musiclibrary.domain.model.AudioMetadata;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.Collections;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import org.springframework.stereotype.Service;
import org.springframework.util.StringUtils;

/**
 * Fills in what the tags did not provide. The title comes from the file name, split as
 * {@code Artist - Title} when it has that shape; a missing album becomes "Unknown Album". Songs left
 * without artists show as "Unknown Artist" through {@link DenormalizedArtists}.
 */
@Service
public class MetadataFallbackService {

    static final String UNKNOWN_ALBUM = "Unknown Album";
    static final String UNKNOWN_TRACK = "unknown-track";

    private static final Pattern DASH_PATTERN = Pattern.compile("^\\s*(.+?)\\s+-\\s+(.+?)\\s*$");

    public AudioMetadata applyFallback(AudioMetadata input, String filePath) {
        AudioMetadata metadata = input == null ? new AudioMetadata() : input;
        if (metadata.getArtists() == null) {
            metadata.setArtists(new ArrayList<>());
        }
        if (metadata.getAlbumArtists() == null) {
            metadata.setAlbumArtists(new ArrayList<>());
        }

        String fileBaseName = extractFileBaseName(filePath);
        String guessedArtist = null;
        String guessedTitle = null;
        String[] parsed = parseFilenameSegments(fileBaseName);
        if (parsed != null) {
            String[] resolved = disambiguate(parsed[0], parsed[1], extractParentDirName(filePath));
            guessedArtist = resolved[0];
            guessedTitle = resolved[1];
        }

        if (!StringUtils.hasText(metadata.getTitle())) {
            metadata.setTitle(StringUtils.hasText(guessedTitle) ? guessedTitle : fileBaseName);
            if (metadata.getArtists().isEmpty() && StringUtils.hasText(guessedArtist)) {
                metadata.setArtists(new ArrayList<>(Collections.singletonList(guessedArtist)));
            }
        } else {
            metadata.setTitle(metadata.getTitle().trim());
        }

        if (!StringUtils.hasText(metadata.getAlbum())) {
            metadata.setAlbum(UNKNOWN_ALBUM);
        } else {
            metadata.setAlbum(metadata.getAlbum().trim());
        }
        return metadata;
    }

    private String[] parseFilenameSegments(String fileBaseName) {
        Matcher matcher = DASH_PATTERN.matcher(fileBaseName);
        if (matcher.matches()) {
            String a = safe(matcher.group(1));
            String b = safe(matcher.group(2));
            if (StringUtils.hasText(a) && StringUtils.hasText(b)) {
                return new String[]{a, b};
            }
        }
        return null;
    }

    /**
     * "Artist - Title" unless the second segment is the name of the containing folder, which then is
     * taken as the artist.
     */
    private String[] disambiguate(String segA, String segB, String parentDir) {
        if (StringUtils.hasText(parentDir) && parentDir.equalsIgnoreCase(segB)) {
            return new String[]{segB, segA};
        }
        return new String[]{segA, segB};
    }

    String extractFileBaseName(String filePath) {
        if (!StringUtils.hasText(filePath)) {
            return UNKNOWN_TRACK;
        }
        Path fileName = Paths.get(filePath).getFileName();
        String name = fileName == null ? "" : fileName.toString();
        int dotIndex = name.lastIndexOf('.');
        if (dotIndex > 0) {
            name = name.substring(0, dotIndex);
        }
        String safe = safe(name);
        return StringUtils.hasText(safe) ? safe : UNKNOWN_TRACK;
    }

    String extractParentDirName(String filePath) {
        if (!StringUtils.hasText(filePath)) {
            return null;
        }
        Path parent = Paths.get(filePath).getParent();
        if (parent == null || parent.getFileName() == null) {
            return null;
        }
        return safe(parent.getFileName().toString());
    }

    private String safe(String value) {
        if (value == null) {
            return null;
        }
        String trimmed = value.trim();
        return trimmed.isEmpty() ? null : trimmed;
    }
}

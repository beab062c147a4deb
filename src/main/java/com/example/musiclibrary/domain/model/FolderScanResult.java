package com.example.musiclibrary.domain.model;

import java.util.Collections;
import java.util.List;
import lombok.Data;

@Data
public class FolderScanResult {

    private final boolean folderGone;

    private final List<ScannedFile> files;

    /**
     * Directories and files that could not be read. Persisted songs under these paths must not be
     * treated as deleted.
     */
    private final List<String> unreadablePaths;

    public static FolderScanResult gone() {
        return new FolderScanResult(true, Collections.emptyList(), Collections.emptyList());
    }

    public static FolderScanResult of(List<ScannedFile> files, List<String> unreadablePaths) {
        return new FolderScanResult(false, files, unreadablePaths);
    }
}

package com.example.musiclibrary.application.service;

import com.example.musiclibrary.domain.model.ScannedFile;
import com.example.musiclibrary.infrastructure.persistence.model.SongFileStateRow;
import java.io.File;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Classification of a folder's files against its persisted songs, keyed by file path:
 * added (disk only), modified (both, last write time differs) and deleted (database only).
 */
public final class FolderDiff {

    private final List<ScannedFile> added;
    private final List<Modified> modified;
    private final List<SongFileStateRow> deleted;
    private final int unchanged;

    private FolderDiff(List<ScannedFile> added, List<Modified> modified, List<SongFileStateRow> deleted, int unchanged) {
        this.added = Collections.unmodifiableList(added);
        this.modified = Collections.unmodifiableList(modified);
        this.deleted = Collections.unmodifiableList(deleted);
        this.unchanged = unchanged;
    }

    /**
     * @param unreadablePaths paths the scanner could not read; songs below them are never reported deleted
     */
    public static FolderDiff compute(List<ScannedFile> onDisk,
                                     List<SongFileStateRow> persisted,
                                     List<String> unreadablePaths) {
        Map<String, SongFileStateRow> persistedByPath = new LinkedHashMap<>();
        for (SongFileStateRow row : persisted) {
            persistedByPath.put(row.getFilePath(), row);
        }

        List<ScannedFile> added = new ArrayList<>();
        List<Modified> modified = new ArrayList<>();
        int unchanged = 0;
        for (ScannedFile file : onDisk) {
            SongFileStateRow existing = persistedByPath.remove(file.getPath());
            if (existing == null) {
                added.add(file);
            } else if (!Objects.equals(existing.getFileModifiedDate(), file.getLastModified())) {
                modified.add(new Modified(file, existing));
            } else {
                unchanged++;
            }
        }

        List<SongFileStateRow> deleted = new ArrayList<>();
        for (SongFileStateRow row : persistedByPath.values()) {
            if (!isUnder(row.getFilePath(), unreadablePaths)) {
                deleted.add(row);
            }
        }
        return new FolderDiff(added, modified, deleted, unchanged);
    }

    private static boolean isUnder(String path, List<String> roots) {
        if (roots == null) {
            return false;
        }
        for (String root : roots) {
            if (path.equals(root) || path.startsWith(root.endsWith(File.separator) ? root : root + File.separator)) {
                return true;
            }
        }
        return false;
    }

    public List<ScannedFile> getAdded() {
        return added;
    }

    public List<Modified> getModified() {
        return modified;
    }

    public List<SongFileStateRow> getDeleted() {
        return deleted;
    }

    public int getUnchanged() {
        return unchanged;
    }

    public boolean isEmpty() {
        return added.isEmpty() && modified.isEmpty() && deleted.isEmpty();
    }

    public static final class Modified {

        private final ScannedFile file;
        private final SongFileStateRow existing;

        Modified(ScannedFile file, SongFileStateRow existing) {
            this.file = file;
            this.existing = existing;
        }

        public ScannedFile getFile() {
            return file;
        }

        public SongFileStateRow getExisting() {
            return existing;
        }
    }
}

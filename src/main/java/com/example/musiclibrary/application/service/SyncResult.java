package com.example.musiclibrary.application.service;

import java.util.Collections;
import java.util.Map;

/**
 * Counters of one rescan, or of a whole library refresh when {@code folderId} is null.
 */
public class SyncResult {

    private Long folderId;
    private int addedFiles;
    private int modifiedFiles;
    private int deletedFiles;
    private int failedFiles;
    private int unchangedFiles;
    private int foldersScanned;
    private int foldersRemoved;
    private int artistImagesResolved;
    private boolean canceled;
    private boolean skipped;
    private long durationMs;
    private Map<Long, String> touchedArtists = Collections.emptyMap();

    public static SyncResult forFolder(Long folderId) {
        SyncResult result = new SyncResult();
        result.setFolderId(folderId);
        return result;
    }

    /**
     * Result of a call that found the same work already running.
     */
    public static SyncResult skipped(Long folderId) {
        SyncResult result = forFolder(folderId);
        result.setSkipped(true);
        return result;
    }

    public boolean hasChanges() {
        return addedFiles + modifiedFiles + deletedFiles + foldersRemoved > 0;
    }

    /**
     * False when the run was canceled or did not start.
     */
    public boolean isCompleted() {
        return !canceled && !skipped;
    }

    void merge(SyncResult other) {
        addedFiles += other.addedFiles;
        modifiedFiles += other.modifiedFiles;
        deletedFiles += other.deletedFiles;
        failedFiles += other.failedFiles;
        unchangedFiles += other.unchangedFiles;
        foldersRemoved += other.foldersRemoved;
        artistImagesResolved += other.artistImagesResolved;
        if (!other.skipped) {
            foldersScanned++;
        }
    }

    public Long getFolderId() {
        return folderId;
    }

    public void setFolderId(Long folderId) {
        this.folderId = folderId;
    }

    public int getAddedFiles() {
        return addedFiles;
    }

    public void setAddedFiles(int addedFiles) {
        this.addedFiles = addedFiles;
    }

    public int getModifiedFiles() {
        return modifiedFiles;
    }

    public void setModifiedFiles(int modifiedFiles) {
        this.modifiedFiles = modifiedFiles;
    }

    public int getDeletedFiles() {
        return deletedFiles;
    }

    public void setDeletedFiles(int deletedFiles) {
        this.deletedFiles = deletedFiles;
    }

    public int getFailedFiles() {
        return failedFiles;
    }

    public void setFailedFiles(int failedFiles) {
        this.failedFiles = failedFiles;
    }

    public int getUnchangedFiles() {
        return unchangedFiles;
    }

    public void setUnchangedFiles(int unchangedFiles) {
        this.unchangedFiles = unchangedFiles;
    }

    public int getFoldersScanned() {
        return foldersScanned;
    }

    public int getFoldersRemoved() {
        return foldersRemoved;
    }

    public void setFoldersRemoved(int foldersRemoved) {
        this.foldersRemoved = foldersRemoved;
    }

    public boolean isFolderRemoved() {
        return folderId != null && foldersRemoved > 0;
    }

    public int getArtistImagesResolved() {
        return artistImagesResolved;
    }

    public void setArtistImagesResolved(int artistImagesResolved) {
        this.artistImagesResolved = artistImagesResolved;
    }

    public boolean isCanceled() {
        return canceled;
    }

    public void setCanceled(boolean canceled) {
        this.canceled = canceled;
    }

    public boolean isSkipped() {
        return skipped;
    }

    public void setSkipped(boolean skipped) {
        this.skipped = skipped;
    }

    public long getDurationMs() {
        return durationMs;
    }

    public void setDurationMs(long durationMs) {
        this.durationMs = durationMs;
    }

    /**
     * Artists credited by the committed songs, with a sample song path each.
     */
    Map<Long, String> getTouchedArtists() {
        return touchedArtists;
    }

    void setTouchedArtists(Map<Long, String> touchedArtists) {
        this.touchedArtists = touchedArtists;
    }

    @Override
    public String toString() {
        return "SyncResult{folderId=" + folderId + ", added=" + addedFiles + ", modified=" + modifiedFiles
                + ", deleted=" + deletedFiles + ", failed=" + failedFiles + ", unchanged=" + unchangedFiles
                + ", foldersRemoved=" + foldersRemoved + ", canceled=" + canceled + ", skipped=" + skipped + "}";
    }
}

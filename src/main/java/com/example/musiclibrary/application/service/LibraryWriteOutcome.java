package com.example.musiclibrary.application.service;

import com.example.musiclibrary.infrastructure.persistence.entity.ArtistEntity;
import com.example.musiclibrary.infrastructure.persistence.model.SongFileStateRow;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * What one committed write changed, for post-commit work (artifact cleanup, artist images).
 */
public class LibraryWriteOutcome {

    private int addedCount;
    private int updatedCount;
    private int deletedCount;
    private int deletedAlbumCount;
    private final Map<Long, String> touchedArtists = new LinkedHashMap<>();
    private final List<ArtistEntity> deletedArtists = new ArrayList<>();
    private final List<SongFileStateRow> removedSongs = new ArrayList<>();

    public int getAddedCount() {
        return addedCount;
    }

    public void setAddedCount(int addedCount) {
        this.addedCount = addedCount;
    }

    public int getUpdatedCount() {
        return updatedCount;
    }

    public void setUpdatedCount(int updatedCount) {
        this.updatedCount = updatedCount;
    }

    public int getDeletedCount() {
        return deletedCount;
    }

    public void setDeletedCount(int deletedCount) {
        this.deletedCount = deletedCount;
    }

    public int getDeletedAlbumCount() {
        return deletedAlbumCount;
    }

    public void setDeletedAlbumCount(int deletedAlbumCount) {
        this.deletedAlbumCount = deletedAlbumCount;
    }

    /**
     * Artist id to the path of one written song that credits the artist, in first-seen order.
     */
    public Map<Long, String> getTouchedArtists() {
        return touchedArtists;
    }

    public List<ArtistEntity> getDeletedArtists() {
        return deletedArtists;
    }

    /**
     * File state of songs removed together with their folder.
     */
    public List<SongFileStateRow> getRemovedSongs() {
        return removedSongs;
    }
}

package com.example.musiclibrary.application.service;

import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.Set;

/**
 * Songs and albums whose artist-link rows were added, removed or reordered in the current unit of work.
 * Collected by the write path as it touches link rows, whether or not the parent row itself changed.
 */
public class RelationChangeSet {

    private final Set<Long> songIds = new LinkedHashSet<>();
    private final Set<Long> albumIds = new LinkedHashSet<>();

    public void songLinksChanged(Long songId) {
        songIds.add(songId);
    }

    public void albumLinksChanged(Long albumId) {
        albumIds.add(albumId);
    }

    /**
     * Drops songs deleted later in the same unit of work.
     */
    public void songsDeleted(Collection<Long> deletedSongIds) {
        songIds.removeAll(deletedSongIds);
    }

    public void albumsDeleted(Collection<Long> deletedAlbumIds) {
        albumIds.removeAll(deletedAlbumIds);
    }

    public Set<Long> getSongIds() {
        return Collections.unmodifiableSet(songIds);
    }

    public Set<Long> getAlbumIds() {
        return Collections.unmodifiableSet(albumIds);
    }

    public boolean isEmpty() {
        return songIds.isEmpty() && albumIds.isEmpty();
    }
}

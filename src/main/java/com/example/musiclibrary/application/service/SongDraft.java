package com.example.musiclibrary.application.service;

import com.example.musiclibrary.infrastructure.persistence.entity.SongEntity;
import java.util.ArrayList;
import java.util.List;

/**
 * A song extracted from disk and waiting to be written, with the artist and album credits that become
 * link rows. {@code existingSongId} is set for modified files.
 */
public class SongDraft {

    private final Long existingSongId;
    private final SongEntity song;
    private final List<String> artistNames;
    private final List<String> albumArtistNames;
    private final String albumTitle;

    public SongDraft(Long existingSongId,
                     SongEntity song,
                     List<String> artistNames,
                     List<String> albumArtistNames,
                     String albumTitle) {
        this.existingSongId = existingSongId;
        this.song = song;
        this.artistNames = artistNames == null ? new ArrayList<>() : artistNames;
        this.albumArtistNames = albumArtistNames == null ? new ArrayList<>() : albumArtistNames;
        this.albumTitle = albumTitle;
    }

    public Long getExistingSongId() {
        return existingSongId;
    }

    public boolean isUpdate() {
        return existingSongId != null;
    }

    public SongEntity getSong() {
        return song;
    }

    public List<String> getArtistNames() {
        return artistNames;
    }

    /**
     * Album artists, falling back to the song artists when the tags name none.
     */
    public List<String> getEffectiveAlbumArtistNames() {
        return albumArtistNames.isEmpty() ? artistNames : albumArtistNames;
    }

    public String getAlbumTitle() {
        return albumTitle;
    }
}

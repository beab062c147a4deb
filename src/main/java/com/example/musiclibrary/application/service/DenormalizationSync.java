package com.example.musiclibrary.application.service;

import com.example.musiclibrary.infrastructure.persistence.mapper.AlbumArtistMapper;
import com.example.musiclibrary.infrastructure.persistence.mapper.AlbumMapper;
import com.example.musiclibrary.infrastructure.persistence.mapper.SongArtistMapper;
import com.example.musiclibrary.infrastructure.persistence.mapper.SongMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Rewrites {@code artist_name}/{@code primary_artist_name} of every song and album listed in a
 * {@link RelationChangeSet} from its current ordered link rows. Must run inside the transaction that
 * changed the links.
 */
@Component
public class DenormalizationSync {

    private static final Logger log = LoggerFactory.getLogger(DenormalizationSync.class);

    private final SongMapper songMapper;
    private final SongArtistMapper songArtistMapper;
    private final AlbumMapper albumMapper;
    private final AlbumArtistMapper albumArtistMapper;

    public DenormalizationSync(SongMapper songMapper,
                               SongArtistMapper songArtistMapper,
                               AlbumMapper albumMapper,
                               AlbumArtistMapper albumArtistMapper) {
        this.songMapper = songMapper;
        this.songArtistMapper = songArtistMapper;
        this.albumMapper = albumMapper;
        this.albumArtistMapper = albumArtistMapper;
    }

    public void apply(RelationChangeSet changes) {
        if (changes.isEmpty()) {
            return;
        }
        for (Long songId : changes.getSongIds()) {
            DenormalizedArtists names = DenormalizedArtists.of(songArtistMapper.selectOrderedArtistNames(songId));
            songMapper.updateArtistNames(songId, names.getArtistName(), names.getPrimaryArtistName());
        }
        for (Long albumId : changes.getAlbumIds()) {
            DenormalizedArtists names = DenormalizedArtists.of(albumArtistMapper.selectOrderedArtistNames(albumId));
            albumMapper.updateArtistNames(albumId, names.getArtistName(), names.getPrimaryArtistName());
        }
        log.debug("DENORMALIZED songs={} albums={}", changes.getSongIds().size(), changes.getAlbumIds().size());
    }
}

package com.example.musiclibrary.application.service;

import com.example.musiclibrary.api.response.ArtistImageResponse;
import com.example.musiclibrary.api.response.LyricsResponse;
import com.example.musiclibrary.common.exception.BusinessException;
import com.example.musiclibrary.domain.model.ParsedLrc;
import com.example.musiclibrary.domain.model.ResolvedLyrics;
import com.example.musiclibrary.infrastructure.persistence.entity.ArtistEntity;
import com.example.musiclibrary.infrastructure.persistence.entity.SongEntity;
import com.example.musiclibrary.infrastructure.persistence.mapper.ArtistMapper;
import com.example.musiclibrary.infrastructure.persistence.mapper.SongMapper;
import java.util.Collections;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * On-demand artifact lookups behind the API: song lyrics and artist images.
 */
@Service
public class LibraryArtifactService {

    private static final Logger log = LoggerFactory.getLogger(LibraryArtifactService.class);

    private final SongMapper songMapper;
    private final ArtistMapper artistMapper;
    private final LyricsResolver lyricsResolver;
    private final ArtistImageResolver artistImageResolver;

    public LibraryArtifactService(SongMapper songMapper,
                                  ArtistMapper artistMapper,
                                  LyricsResolver lyricsResolver,
                                  ArtistImageResolver artistImageResolver) {
        this.songMapper = songMapper;
        this.artistMapper = artistMapper;
        this.lyricsResolver = lyricsResolver;
        this.artistImageResolver = artistImageResolver;
    }

    /**
     * @param positionMs playback position; when given, the response carries the active line index
     */
    public LyricsResponse getLyrics(Long songId, Long positionMs) {
        SongEntity song = songMapper.selectById(songId);
        if (song == null) {
            throw BusinessException.notFound("歌曲不存在");
        }
        ResolvedLyrics lyrics = lyricsResolver.resolve(song);
        if (lyrics == null) {
            log.debug("LYRICS_NOT_FOUND songId={}", songId);
            return new LyricsResponse(songId, false, null, false, 0L, Collections.emptyList(), null, null);
        }
        if (!lyrics.isSynced()) {
            return new LyricsResponse(songId, true, lyrics.getSource().name(), false, 0L,
                    Collections.emptyList(), lyrics.getContent(), null);
        }
        ParsedLrc parsed = lyrics.getParsed();
        Integer activeIndex = positionMs == null ? null : parsed.findLineIndex(positionMs);
        return new LyricsResponse(songId, true, lyrics.getSource().name(), true, parsed.getOffsetMs(),
                parsed.getLines(), null, activeIndex);
    }

    /**
     * Runs the artist image chain now, online lookup included when enabled.
     */
    public ArtistImageResponse resolveArtistImage(Long artistId) {
        ArtistEntity artist = artistMapper.selectById(artistId);
        if (artist == null) {
            throw BusinessException.notFound("歌手不存在");
        }
        String samplePath = songMapper.selectSampleFilePathByArtistId(artistId);
        String resolved = artistImageResolver.resolve(artist, samplePath, true);
        return new ArtistImageResponse(artistId, artist.getLocalImageCachePath(), resolved != null);
    }
}

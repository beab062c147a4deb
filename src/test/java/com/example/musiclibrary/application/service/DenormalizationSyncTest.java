package com.example.musiclibrary.application.service;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyLong;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

import com.example.musiclibrary.infrastructure.persistence.mapper.AlbumArtistMapper;
import com.example.musiclibrary.infrastructure.persistence.mapper.AlbumMapper;
import com.example.musiclibrary.infrastructure.persistence.mapper.SongArtistMapper;
import com.example.musiclibrary.infrastructure.persistence.mapper.SongMapper;
import java.util.Arrays;
import java.util.Collections;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class DenormalizationSyncTest {

    private SongMapper songMapper;
    private SongArtistMapper songArtistMapper;
    private AlbumMapper albumMapper;
    private AlbumArtistMapper albumArtistMapper;
    private DenormalizationSync sync;

    @BeforeEach
    void setUp() {
        songMapper = mock(SongMapper.class);
        songArtistMapper = mock(SongArtistMapper.class);
        albumMapper = mock(AlbumMapper.class);
        albumArtistMapper = mock(AlbumArtistMapper.class);
        sync = new DenormalizationSync(songMapper, songArtistMapper, albumMapper, albumArtistMapper);
    }

    @Test
    void namesShouldBeJoinedInLinkOrder() {
        DenormalizedArtists names = DenormalizedArtists.of(Arrays.asList("Daft Punk", " Pharrell Williams ", ""));

        assertEquals("Daft Punk & Pharrell Williams", names.getArtistName());
        assertEquals("Daft Punk", names.getPrimaryArtistName());
    }

    @Test
    void emptyLinksShouldFallBackToUnknownArtist() {
        DenormalizedArtists names = DenormalizedArtists.of(Collections.emptyList());

        assertEquals(DenormalizedArtists.UNKNOWN_ARTIST, names.getArtistName());
        assertEquals(DenormalizedArtists.UNKNOWN_ARTIST, names.getPrimaryArtistName());
        assertEquals(DenormalizedArtists.UNKNOWN_ARTIST, DenormalizedArtists.of(null).getArtistName());
    }

    @Test
    void applyShouldRewriteEveryChangedSongAndAlbum() {
        when(songArtistMapper.selectOrderedArtistNames(10L)).thenReturn(Arrays.asList("B", "A"));
        when(songArtistMapper.selectOrderedArtistNames(11L)).thenReturn(Collections.emptyList());
        when(albumArtistMapper.selectOrderedArtistNames(20L)).thenReturn(Collections.singletonList("A"));
        RelationChangeSet changes = new RelationChangeSet();
        changes.songLinksChanged(10L);
        changes.songLinksChanged(11L);
        changes.albumLinksChanged(20L);

        sync.apply(changes);

        verify(songMapper).updateArtistNames(10L, "B & A", "B");
        verify(songMapper).updateArtistNames(11L, "Unknown Artist", "Unknown Artist");
        verify(albumMapper).updateArtistNames(20L, "A", "A");
    }

    @Test
    void deletedSongsShouldNotBeRewritten() {
        RelationChangeSet changes = new RelationChangeSet();
        changes.songLinksChanged(10L);
        changes.albumLinksChanged(20L);
        changes.songsDeleted(Collections.singletonList(10L));
        changes.albumsDeleted(Collections.singletonList(20L));

        sync.apply(changes);

        verifyNoInteractions(songArtistMapper, albumArtistMapper);
        verify(songMapper, never()).updateArtistNames(anyLong(), any(), any());
    }
}

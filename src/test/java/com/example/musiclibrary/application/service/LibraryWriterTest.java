package com.example.musiclibrary.application.service;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.ArgumentMatchers.anyLong;
import static org.mockito.Mockito.doAnswer;
import static org.mockito.Mockito.inOrder;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import com.example.musiclibrary.common.exception.BusinessException;
import com.example.musiclibrary.infrastructure.persistence.entity.AlbumEntity;
import com.example.musiclibrary.infrastructure.persistence.entity.ArtistEntity;
import com.example.musiclibrary.infrastructure.persistence.entity.ArtistLinkEntity;
import com.example.musiclibrary.infrastructure.persistence.entity.SongEntity;
import com.example.musiclibrary.infrastructure.persistence.mapper.AlbumArtistMapper;
import com.example.musiclibrary.infrastructure.persistence.mapper.AlbumMapper;
import com.example.musiclibrary.infrastructure.persistence.mapper.ArtistMapper;
import com.example.musiclibrary.infrastructure.persistence.mapper.FolderMapper;
import com.example.musiclibrary.infrastructure.persistence.mapper.SongArtistMapper;
import com.example.musiclibrary.infrastructure.persistence.mapper.SongMapper;
import com.example.musiclibrary.infrastructure.persistence.model.SongFileStateRow;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.atomic.AtomicLong;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.mockito.InOrder;

class LibraryWriterTest {

    private FolderMapper folderMapper;
    private SongMapper songMapper;
    private AlbumMapper albumMapper;
    private ArtistMapper artistMapper;
    private SongArtistMapper songArtistMapper;
    private AlbumArtistMapper albumArtistMapper;
    private DenormalizationSync denormalizationSync;
    private LibraryWriter writer;
    private final Map<String, Long> artistIds = new HashMap<>();

    @BeforeEach
    void setUp() {
        folderMapper = mock(FolderMapper.class);
        songMapper = mock(SongMapper.class);
        albumMapper = mock(AlbumMapper.class);
        artistMapper = mock(ArtistMapper.class);
        songArtistMapper = mock(SongArtistMapper.class);
        albumArtistMapper = mock(AlbumArtistMapper.class);
        denormalizationSync = mock(DenormalizationSync.class);
        writer = new LibraryWriter(folderMapper, songMapper, albumMapper, artistMapper, songArtistMapper,
                albumArtistMapper, denormalizationSync);

        doAnswer(invocation -> {
            ArtistEntity artist = invocation.getArgument(0);
            Long id = artistIds.get(artist.getName());
            if (id == null) {
                id = 100L + artistIds.size();
                artistIds.put(artist.getName(), id);
            }
            artist.setId(id);
            return 1;
        }).when(artistMapper).insertOrGetId(any(ArtistEntity.class));
        AtomicLong songIds = new AtomicLong(1000L);
        doAnswer(invocation -> {
            SongEntity song = invocation.getArgument(0);
            song.setId(songIds.getAndIncrement());
            return 1;
        }).when(songMapper).insert(any(SongEntity.class));
        doAnswer(invocation -> {
            AlbumEntity album = invocation.getArgument(0);
            album.setId(500L);
            return 1;
        }).when(albumMapper).insert(any(AlbumEntity.class));
    }

    @Test
    void newSongShouldBeInsertedWithOrderedLinksAndNewAlbum() {
        SongDraft draft = new SongDraft(null, song("/music/a.flac"), Arrays.asList("Daft Punk", "Pharrell Williams"),
                null, "Random Access Memories");

        LibraryWriteOutcome outcome = writer.applyFolderChanges(3L, Collections.singletonList(draft),
                Collections.emptyList());

        SongEntity inserted = draft.getSong();
        assertEquals(1000L, inserted.getId());
        assertEquals(3L, inserted.getFolderId());
        assertEquals(500L, inserted.getAlbumId());
        assertEquals("Daft Punk & Pharrell Williams", inserted.getArtistName());
        assertEquals("Daft Punk", inserted.getPrimaryArtistName());
        verify(songArtistMapper).batchInsert(Arrays.asList(
                new ArtistLinkEntity(null, 1000L, 100L, 0),
                new ArtistLinkEntity(null, 1000L, 101L, 1)));
        verify(albumArtistMapper).batchInsert(Arrays.asList(
                new ArtistLinkEntity(null, 500L, 100L, 0),
                new ArtistLinkEntity(null, 500L, 101L, 1)));

        assertEquals(1, outcome.getAddedCount());
        assertEquals(Arrays.asList(100L, 101L), new ArrayList<>(outcome.getTouchedArtists().keySet()));
        assertEquals("/music/a.flac", outcome.getTouchedArtists().get(100L));

        RelationChangeSet changes = capturedChanges();
        assertEquals(Collections.singleton(1000L), changes.getSongIds());
        assertEquals(Collections.singleton(500L), changes.getAlbumIds());
    }

    @Test
    void albumOnlyArtistShouldBeTouchedWhenItsAlbumIsCreated() {
        SongDraft draft = new SongDraft(null, song("/music/c.flac"), Collections.singletonList("Guest Singer"),
                Collections.singletonList("Various Artists"), "Compilation");

        LibraryWriteOutcome outcome = writer.applyFolderChanges(3L, Collections.singletonList(draft),
                Collections.emptyList());

        Long albumArtistId = artistIds.get("Various Artists");
        Long songArtistId = artistIds.get("Guest Singer");
        assertEquals(Arrays.asList(albumArtistId, songArtistId), new ArrayList<>(outcome.getTouchedArtists().keySet()));
        assertEquals("/music/c.flac", outcome.getTouchedArtists().get(albumArtistId));
    }

    @Test
    void modifiedSongShouldReplaceScannedFieldsAndLinks() {
        AlbumEntity existingAlbum = new AlbumEntity();
        existingAlbum.setId(42L);
        when(albumMapper.selectByTitleAndArtistName("Album", "Adele")).thenReturn(existingAlbum);
        SongDraft draft = new SongDraft(7L, song("/music/b.flac"), Collections.singletonList("Adele"),
                Collections.singletonList("Adele"), "Album");

        LibraryWriteOutcome outcome = writer.applyFolderChanges(3L, Collections.singletonList(draft),
                Collections.emptyList());

        InOrder order = inOrder(songMapper, songArtistMapper);
        order.verify(songMapper).updateScannedFields(draft.getSong());
        order.verify(songArtistMapper).deleteBySongId(7L);
        order.verify(songArtistMapper).batchInsert(Collections.singletonList(new ArtistLinkEntity(null, 7L, 100L, 0)));
        verify(songMapper, never()).insert(any(SongEntity.class));
        verify(albumMapper, never()).insert(any(AlbumEntity.class));
        assertEquals(42L, draft.getSong().getAlbumId());
        assertEquals(1, outcome.getUpdatedCount());

        RelationChangeSet changes = capturedChanges();
        assertEquals(Collections.singleton(7L), changes.getSongIds());
        assertTrue(changes.getAlbumIds().isEmpty());
    }

    @Test
    void songsOfOneAlbumShouldShareAlbumAndArtistLookups() {
        List<SongDraft> drafts = Arrays.asList(
                new SongDraft(null, song("/music/1.flac"), Collections.singletonList("Adele"), null, "25"),
                new SongDraft(null, song("/music/2.flac"), Collections.singletonList("Adele"), null, "25"),
                new SongDraft(null, song("/music/3.flac"), Collections.singletonList("Adele"),
                        Collections.singletonList(" adele"), "25"));

        writer.applyFolderChanges(3L, drafts, null);

        verify(albumMapper, times(1)).selectByTitleAndArtistName("25", "Adele");
        verify(albumMapper, times(2)).insert(any(AlbumEntity.class));
        verify(artistMapper, times(1)).insertOrGetId(any(ArtistEntity.class));
        assertEquals(drafts.get(0).getSong().getAlbumId(), drafts.get(1).getSong().getAlbumId());
    }

    @Test
    void deletionsShouldCascadeToOrphanAlbumsAndArtists() {
        List<Long> deleted = Arrays.asList(7L, 8L);
        when(songMapper.deleteByIds(deleted)).thenReturn(2);
        when(albumMapper.selectOrphanIds()).thenReturn(Collections.singletonList(42L));
        when(artistMapper.selectOrphans()).thenReturn(Collections.singletonList(artist(100L)));

        LibraryWriteOutcome outcome = writer.applyFolderChanges(3L, Collections.emptyList(), deleted);

        InOrder order = inOrder(songArtistMapper, songMapper, albumArtistMapper, albumMapper, artistMapper);
        order.verify(songArtistMapper).deleteBySongIds(deleted);
        order.verify(songMapper).deleteByIds(deleted);
        order.verify(albumArtistMapper).deleteByAlbumIds(Collections.singletonList(42L));
        order.verify(albumMapper).deleteByIds(Collections.singletonList(42L));
        order.verify(artistMapper).deleteByIds(Collections.singletonList(100L));
        assertEquals(2, outcome.getDeletedCount());
        assertEquals(1, outcome.getDeletedAlbumCount());
        assertEquals(100L, outcome.getDeletedArtists().get(0).getId());
    }

    @Test
    void orphanArtistsShouldNotBeReportedAsTouched() {
        when(artistMapper.selectOrphans()).thenReturn(Collections.singletonList(artist(100L)));
        SongDraft draft = new SongDraft(null, song("/music/a.flac"), Collections.singletonList("Gone"), null, "X");

        LibraryWriteOutcome outcome = writer.applyFolderChanges(3L, Collections.singletonList(draft), null);

        assertTrue(outcome.getTouchedArtists().isEmpty());
    }

    @Test
    void removeFolderShouldDeleteSongsFolderAndOrphans() {
        when(songMapper.selectFileStatesByFolderId(3L)).thenReturn(Arrays.asList(row(7L), row(8L)));
        when(songMapper.deleteByFolderId(3L)).thenReturn(2);

        LibraryWriteOutcome outcome = writer.removeFolder(3L);

        verify(songArtistMapper).deleteBySongIds(Arrays.asList(7L, 8L));
        verify(folderMapper).deleteById(3L);
        verify(albumMapper).selectOrphanIds();
        verify(artistMapper).selectOrphans();
        assertEquals(2, outcome.getDeletedCount());
        assertEquals(2, outcome.getRemovedSongs().size());
    }

    @Test
    void addSongArtistShouldAppendLinkAndRefreshNames() {
        when(songMapper.selectById(5L)).thenReturn(new SongEntity());
        when(songArtistMapper.selectBySongId(5L))
                .thenReturn(Collections.singletonList(new ArtistLinkEntity(1L, 5L, 200L, 0)));

        writer.addSongArtist(5L, " Nina Simone ");

        assertEquals(100L, artistIds.get("Nina Simone"));
        verify(songArtistMapper).batchInsert(Collections.singletonList(new ArtistLinkEntity(null, 5L, 100L, 1)));
        assertEquals(Collections.singleton(5L), capturedChanges().getSongIds());
    }

    @Test
    void addingLinkedArtistAgainShouldChangeNothing() {
        artistIds.put("Nina Simone", 200L);
        when(songMapper.selectById(5L)).thenReturn(new SongEntity());
        when(songArtistMapper.selectBySongId(5L))
                .thenReturn(Collections.singletonList(new ArtistLinkEntity(1L, 5L, 200L, 0)));

        writer.addSongArtist(5L, "Nina Simone");

        verify(songArtistMapper, never()).batchInsert(any());
        verify(denormalizationSync, never()).apply(any());
    }

    @Test
    void relationEditsShouldValidateInput() {
        BusinessException missingSong = assertThrows(BusinessException.class, () -> writer.addSongArtist(5L, "A"));
        assertEquals(BusinessException.CODE_NOT_FOUND, missingSong.getCode());

        BusinessException missingAlbum = assertThrows(BusinessException.class,
                () -> writer.reorderAlbumArtists(9L, Collections.singletonList(1L)));
        assertEquals(BusinessException.CODE_NOT_FOUND, missingAlbum.getCode());

        when(songMapper.selectById(5L)).thenReturn(new SongEntity());
        BusinessException blankName = assertThrows(BusinessException.class, () -> writer.addSongArtist(5L, "  "));
        assertEquals(BusinessException.CODE_BAD_REQUEST, blankName.getCode());
    }

    @Test
    void reorderShouldMoveListedArtistsToFront() {
        when(songMapper.selectById(5L)).thenReturn(new SongEntity());
        when(songArtistMapper.selectBySongId(5L)).thenReturn(Arrays.asList(
                new ArtistLinkEntity(1L, 5L, 200L, 0),
                new ArtistLinkEntity(2L, 5L, 201L, 1),
                new ArtistLinkEntity(3L, 5L, 202L, 2)));

        writer.reorderSongArtists(5L, Arrays.asList(202L, 200L));

        verify(songArtistMapper).updateSortOrder(3L, 0);
        verify(songArtistMapper).updateSortOrder(1L, 1);
        verify(songArtistMapper).updateSortOrder(2L, 2);
        assertEquals(Collections.singleton(5L), capturedChanges().getSongIds());
    }

    @Test
    void reorderWithCurrentOrderShouldBeNoOp() {
        when(albumMapper.selectById(9L)).thenReturn(new AlbumEntity());
        when(albumArtistMapper.selectByAlbumId(9L)).thenReturn(Arrays.asList(
                new ArtistLinkEntity(1L, 9L, 200L, 0),
                new ArtistLinkEntity(2L, 9L, 201L, 1)));

        writer.reorderAlbumArtists(9L, Arrays.asList(200L, 201L));

        verify(albumArtistMapper, never()).updateSortOrder(anyLong(), anyInt());
        verify(denormalizationSync, never()).apply(any());
    }

    @Test
    void removeAlbumArtistShouldDropOrphanArtist() {
        when(albumMapper.selectById(9L)).thenReturn(new AlbumEntity());
        when(albumArtistMapper.deleteByAlbumAndArtist(9L, 200L)).thenReturn(1);
        when(artistMapper.selectOrphans()).thenReturn(Collections.singletonList(artist(200L)));

        writer.removeAlbumArtist(9L, 200L);

        verify(artistMapper).deleteByIds(Collections.singletonList(200L));
        assertEquals(Collections.singleton(9L), capturedChanges().getAlbumIds());
    }

    private RelationChangeSet capturedChanges() {
        ArgumentCaptor<RelationChangeSet> captor = ArgumentCaptor.forClass(RelationChangeSet.class);
        verify(denormalizationSync).apply(captor.capture());
        return captor.getValue();
    }

    private static SongEntity song(String path) {
        SongEntity song = new SongEntity();
        song.setFilePath(path);
        song.setTitle("Title");
        return song;
    }

    private static ArtistEntity artist(Long id) {
        ArtistEntity artist = new ArtistEntity();
        artist.setId(id);
        artist.setName("Artist " + id);
        return artist;
    }

    private static SongFileStateRow row(Long id) {
        SongFileStateRow row = new SongFileStateRow();
        row.setId(id);
        row.setFilePath("/music/" + id + ".flac");
        return row;
    }
}

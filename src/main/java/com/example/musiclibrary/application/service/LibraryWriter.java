package com.example.musiclibrary.application.service;

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
import java.util.HashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;
import org.springframework.util.StringUtils;

/**
 * Transactional write side of the library. Every method is one unit of work: rows, link rows, orphan
 * cleanup and the denormalized artist names commit together or not at all.
 */
@Service
public class LibraryWriter {

    private static final Logger log = LoggerFactory.getLogger(LibraryWriter.class);

    private final FolderMapper folderMapper;
    private final SongMapper songMapper;
    private final AlbumMapper albumMapper;
    private final ArtistMapper artistMapper;
    private final SongArtistMapper songArtistMapper;
    private final AlbumArtistMapper albumArtistMapper;
    private final DenormalizationSync denormalizationSync;

    public LibraryWriter(FolderMapper folderMapper,
                         SongMapper songMapper,
                         AlbumMapper albumMapper,
                         ArtistMapper artistMapper,
                         SongArtistMapper songArtistMapper,
                         AlbumArtistMapper albumArtistMapper,
                         DenormalizationSync denormalizationSync) {
        this.folderMapper = folderMapper;
        this.songMapper = songMapper;
        this.albumMapper = albumMapper;
        this.artistMapper = artistMapper;
        this.songArtistMapper = songArtistMapper;
        this.albumArtistMapper = albumArtistMapper;
        this.denormalizationSync = denormalizationSync;
    }

    /**
     * Writes the outcome of one folder rescan: new and modified songs with their artist and album links,
     * removal of deleted songs, then orphan albums and artists.
     */
    @Transactional(rollbackFor = Exception.class)
    public LibraryWriteOutcome applyFolderChanges(Long folderId, List<SongDraft> drafts, List<Long> deletedSongIds) {
        LibraryWriteOutcome outcome = new LibraryWriteOutcome();
        RelationChangeSet changes = new RelationChangeSet();
        Map<String, Long> artistIdCache = new HashMap<>();
        Map<String, Long> albumIdCache = new HashMap<>();

        for (SongDraft draft : drafts) {
            SongEntity song = draft.getSong();
            song.setFolderId(folderId);
            song.setAlbumId(resolveAlbumId(draft, artistIdCache, albumIdCache, changes, outcome));

            List<Long> artistIds = resolveArtistIds(draft.getArtistNames(), artistIdCache);
            if (draft.isUpdate()) {
                song.setId(draft.getExistingSongId());
                songMapper.updateScannedFields(song);
                songArtistMapper.deleteBySongId(song.getId());
                outcome.setUpdatedCount(outcome.getUpdatedCount() + 1);
            } else {
                DenormalizedArtists names = DenormalizedArtists.of(draft.getArtistNames());
                song.setArtistName(names.getArtistName());
                song.setPrimaryArtistName(names.getPrimaryArtistName());
                songMapper.insert(song);
                outcome.setAddedCount(outcome.getAddedCount() + 1);
            }
            if (!artistIds.isEmpty()) {
                songArtistMapper.batchInsert(buildLinks(song.getId(), artistIds));
            }
            changes.songLinksChanged(song.getId());
            for (Long artistId : artistIds) {
                outcome.getTouchedArtists().putIfAbsent(artistId, song.getFilePath());
            }
        }

        if (deletedSongIds != null && !deletedSongIds.isEmpty()) {
            songArtistMapper.deleteBySongIds(deletedSongIds);
            int deleted = songMapper.deleteByIds(deletedSongIds);
            changes.songsDeleted(deletedSongIds);
            outcome.setDeletedCount(deleted);
        }

        removeOrphans(changes, outcome);
        denormalizationSync.apply(changes);
        log.info("LIBRARY_WRITE folderId={} added={} updated={} deleted={} orphanAlbums={} orphanArtists={}",
                folderId, outcome.getAddedCount(), outcome.getUpdatedCount(), outcome.getDeletedCount(),
                outcome.getDeletedAlbumCount(), outcome.getDeletedArtists().size());
        return outcome;
    }

    /**
     * Deletes a folder with all of its songs and whatever albums and artists that leaves unreferenced.
     */
    @Transactional(rollbackFor = Exception.class)
    public LibraryWriteOutcome removeFolder(Long folderId) {
        LibraryWriteOutcome outcome = new LibraryWriteOutcome();
        List<SongFileStateRow> songs = songMapper.selectFileStatesByFolderId(folderId);
        if (!songs.isEmpty()) {
            List<Long> songIds = new ArrayList<>(songs.size());
            for (SongFileStateRow row : songs) {
                songIds.add(row.getId());
            }
            songArtistMapper.deleteBySongIds(songIds);
        }
        outcome.setDeletedCount(songMapper.deleteByFolderId(folderId));
        outcome.getRemovedSongs().addAll(songs);
        folderMapper.deleteById(folderId);

        RelationChangeSet changes = new RelationChangeSet();
        removeOrphans(changes, outcome);
        denormalizationSync.apply(changes);
        log.info("LIBRARY_FOLDER_DELETED folderId={} songs={} orphanAlbums={} orphanArtists={}",
                folderId, outcome.getDeletedCount(), outcome.getDeletedAlbumCount(), outcome.getDeletedArtists().size());
        return outcome;
    }

    @Transactional(rollbackFor = Exception.class)
    public void addSongArtist(Long songId, String artistName) {
        requireSong(songId);
        Long artistId = resolveArtistId(requireName(artistName));
        List<ArtistLinkEntity> links = songArtistMapper.selectBySongId(songId);
        if (containsArtist(links, artistId)) {
            return;
        }
        List<Long> single = new ArrayList<>();
        single.add(artistId);
        List<ArtistLinkEntity> newLinks = buildLinks(songId, single);
        newLinks.get(0).setSortOrder(nextSortOrder(links));
        songArtistMapper.batchInsert(newLinks);

        RelationChangeSet changes = new RelationChangeSet();
        changes.songLinksChanged(songId);
        denormalizationSync.apply(changes);
    }

    @Transactional(rollbackFor = Exception.class)
    public void removeSongArtist(Long songId, Long artistId) {
        requireSong(songId);
        if (songArtistMapper.deleteBySongAndArtist(songId, artistId) == 0) {
            return;
        }
        RelationChangeSet changes = new RelationChangeSet();
        changes.songLinksChanged(songId);
        removeOrphanArtists(new LibraryWriteOutcome());
        denormalizationSync.apply(changes);
    }

    /**
     * Moves the listed artists to the front in the given order; artists not listed keep their relative order
     * behind them.
     */
    @Transactional(rollbackFor = Exception.class)
    public void reorderSongArtists(Long songId, List<Long> orderedArtistIds) {
        requireSong(songId);
        if (reorder(songArtistMapper.selectBySongId(songId), orderedArtistIds, true)) {
            RelationChangeSet changes = new RelationChangeSet();
            changes.songLinksChanged(songId);
            denormalizationSync.apply(changes);
        }
    }

    @Transactional(rollbackFor = Exception.class)
    public void addAlbumArtist(Long albumId, String artistName) {
        requireAlbum(albumId);
        Long artistId = resolveArtistId(requireName(artistName));
        List<ArtistLinkEntity> links = albumArtistMapper.selectByAlbumId(albumId);
        if (containsArtist(links, artistId)) {
            return;
        }
        List<Long> single = new ArrayList<>();
        single.add(artistId);
        List<ArtistLinkEntity> newLinks = buildLinks(albumId, single);
        newLinks.get(0).setSortOrder(nextSortOrder(links));
        albumArtistMapper.batchInsert(newLinks);

        RelationChangeSet changes = new RelationChangeSet();
        changes.albumLinksChanged(albumId);
        denormalizationSync.apply(changes);
    }

    @Transactional(rollbackFor = Exception.class)
    public void removeAlbumArtist(Long albumId, Long artistId) {
        requireAlbum(albumId);
        if (albumArtistMapper.deleteByAlbumAndArtist(albumId, artistId) == 0) {
            return;
        }
        RelationChangeSet changes = new RelationChangeSet();
        changes.albumLinksChanged(albumId);
        removeOrphanArtists(new LibraryWriteOutcome());
        denormalizationSync.apply(changes);
    }

    @Transactional(rollbackFor = Exception.class)
    public void reorderAlbumArtists(Long albumId, List<Long> orderedArtistIds) {
        requireAlbum(albumId);
        if (reorder(albumArtistMapper.selectByAlbumId(albumId), orderedArtistIds, false)) {
            RelationChangeSet changes = new RelationChangeSet();
            changes.albumLinksChanged(albumId);
            denormalizationSync.apply(changes);
        }
    }

    private Long resolveAlbumId(SongDraft draft,
                                Map<String, Long> artistIdCache,
                                Map<String, Long> albumIdCache,
                                RelationChangeSet changes,
                                LibraryWriteOutcome outcome) {
        List<String> albumArtists = draft.getEffectiveAlbumArtistNames();
        DenormalizedArtists names = DenormalizedArtists.of(albumArtists);
        String title = draft.getAlbumTitle();
        String cacheKey = title + '\u0000' + names.getArtistName();
        Long cached = albumIdCache.get(cacheKey);
        if (cached != null) {
            return cached;
        }

        AlbumEntity album = albumMapper.selectByTitleAndArtistName(title, names.getArtistName());
        if (album == null) {
            album = new AlbumEntity();
            album.setTitle(title);
            album.setArtistName(names.getArtistName());
            album.setPrimaryArtistName(names.getPrimaryArtistName());
            album.setYear(draft.getSong().getYear());
            albumMapper.insert(album);
            List<Long> artistIds = resolveArtistIds(albumArtists, artistIdCache);
            if (!artistIds.isEmpty()) {
                albumArtistMapper.batchInsert(buildLinks(album.getId(), artistIds));
            }
            for (Long artistId : artistIds) {
                outcome.getTouchedArtists().putIfAbsent(artistId, draft.getSong().getFilePath());
            }
            changes.albumLinksChanged(album.getId());
        }
        albumIdCache.put(cacheKey, album.getId());
        return album.getId();
    }

    private List<Long> resolveArtistIds(List<String> names, Map<String, Long> artistIdCache) {
        Set<Long> ids = new LinkedHashSet<>();
        for (String name : names) {
            if (!StringUtils.hasText(name)) {
                continue;
            }
            String trimmed = name.trim();
            String key = trimmed.toLowerCase(Locale.ROOT);
            Long id = artistIdCache.get(key);
            if (id == null) {
                id = resolveArtistId(trimmed);
                artistIdCache.put(key, id);
            }
            ids.add(id);
        }
        return new ArrayList<>(ids);
    }

    private Long resolveArtistId(String name) {
        ArtistEntity artist = new ArtistEntity();
        artist.setName(name);
        artistMapper.insertOrGetId(artist);
        return artist.getId();
    }

    private void removeOrphans(RelationChangeSet changes, LibraryWriteOutcome outcome) {
        List<Long> orphanAlbumIds = albumMapper.selectOrphanIds();
        if (!orphanAlbumIds.isEmpty()) {
            albumArtistMapper.deleteByAlbumIds(orphanAlbumIds);
            albumMapper.deleteByIds(orphanAlbumIds);
            changes.albumsDeleted(orphanAlbumIds);
            outcome.setDeletedAlbumCount(orphanAlbumIds.size());
        }
        removeOrphanArtists(outcome);
    }

    private void removeOrphanArtists(LibraryWriteOutcome outcome) {
        List<ArtistEntity> orphanArtists = artistMapper.selectOrphans();
        if (orphanArtists.isEmpty()) {
            return;
        }
        List<Long> ids = new ArrayList<>(orphanArtists.size());
        for (ArtistEntity artist : orphanArtists) {
            ids.add(artist.getId());
            outcome.getTouchedArtists().remove(artist.getId());
        }
        artistMapper.deleteByIds(ids);
        outcome.getDeletedArtists().addAll(orphanArtists);
    }

    private boolean reorder(List<ArtistLinkEntity> links, List<Long> orderedArtistIds, boolean songLinks) {
        List<ArtistLinkEntity> ordered = new ArrayList<>();
        if (orderedArtistIds != null) {
            for (Long artistId : orderedArtistIds) {
                for (ArtistLinkEntity link : links) {
                    if (link.getArtistId().equals(artistId) && !ordered.contains(link)) {
                        ordered.add(link);
                    }
                }
            }
        }
        for (ArtistLinkEntity link : links) {
            if (!ordered.contains(link)) {
                ordered.add(link);
            }
        }
        boolean changed = false;
        for (int i = 0; i < ordered.size(); i++) {
            ArtistLinkEntity link = ordered.get(i);
            if (link.getSortOrder() != null && link.getSortOrder() == i) {
                continue;
            }
            if (songLinks) {
                songArtistMapper.updateSortOrder(link.getId(), i);
            } else {
                albumArtistMapper.updateSortOrder(link.getId(), i);
            }
            changed = true;
        }
        return changed;
    }

    private List<ArtistLinkEntity> buildLinks(Long parentId, List<Long> artistIds) {
        List<ArtistLinkEntity> links = new ArrayList<>(artistIds.size());
        for (int i = 0; i < artistIds.size(); i++) {
            links.add(new ArtistLinkEntity(null, parentId, artistIds.get(i), i));
        }
        return links;
    }

    private boolean containsArtist(List<ArtistLinkEntity> links, Long artistId) {
        for (ArtistLinkEntity link : links) {
            if (link.getArtistId().equals(artistId)) {
                return true;
            }
        }
        return false;
    }

    private int nextSortOrder(List<ArtistLinkEntity> links) {
        int max = -1;
        for (ArtistLinkEntity link : links) {
            if (link.getSortOrder() != null && link.getSortOrder() > max) {
                max = link.getSortOrder();
            }
        }
        return max + 1;
    }

    private void requireSong(Long songId) {
        if (songId == null || songMapper.selectById(songId) == null) {
            throw BusinessException.notFound("歌曲不存在");
        }
    }

    private void requireAlbum(Long albumId) {
        if (albumId == null || albumMapper.selectById(albumId) == null) {
            throw BusinessException.notFound("专辑不存在");
        }
    }

    private String requireName(String artistName) {
        if (!StringUtils.hasText(artistName)) {
            throw new BusinessException(BusinessException.CODE_BAD_REQUEST, "歌手名称不能为空");
        }
        return artistName.trim();
    }
}

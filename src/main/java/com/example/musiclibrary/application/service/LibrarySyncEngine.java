package com.example.musiclibrary.application.service;

import com.example.musiclibrary.common.config.AppLibraryProperties;
import com.example.musiclibrary.common.exception.BusinessException;
import com.example.musiclibrary.common.util.HashUtil;
import com.example.musiclibrary.domain.enumtype.LibraryChangeType;
import com.example.musiclibrary.domain.event.LibraryContentChangedEvent;
import com.example.musiclibrary.domain.model.AudioMetadata;
import com.example.musiclibrary.domain.model.FolderScanResult;
import com.example.musiclibrary.domain.model.ResolvedArtwork;
import com.example.musiclibrary.domain.model.ScannedFile;
import com.example.musiclibrary.infrastructure.filesystem.FileSystemService;
import com.example.musiclibrary.infrastructure.parser.AudioMetadataParseException;
import com.example.musiclibrary.infrastructure.parser.AudioMetadataParser;
import com.example.musiclibrary.infrastructure.persistence.entity.ArtistEntity;
import com.example.musiclibrary.infrastructure.persistence.entity.FolderEntity;
import com.example.musiclibrary.infrastructure.persistence.entity.SongEntity;
import com.example.musiclibrary.infrastructure.persistence.mapper.ArtistMapper;
import com.example.musiclibrary.infrastructure.persistence.mapper.FolderMapper;
import com.example.musiclibrary.infrastructure.persistence.mapper.SongMapper;
import com.example.musiclibrary.infrastructure.persistence.model.SongFileStateRow;
import io.micrometer.core.instrument.MeterRegistry;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.time.LocalDateTime;
import java.time.ZoneOffset;
import java.time.temporal.ChronoUnit;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.locks.ReentrantReadWriteLock;
import java.util.function.BooleanSupplier;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.stereotype.Service;
import org.springframework.util.StringUtils;

/**
 * Keeps the database in step with the folders on disk. A rescan diffs the folder against its persisted
 * songs, extracts metadata and artwork for added and modified files, commits everything in one
 * {@link LibraryWriter} call and only then touches cache files, events and artist images.
 */
@Service
public class LibrarySyncEngine {

    private static final Logger log = LoggerFactory.getLogger(LibrarySyncEngine.class);

    private static final String GENRE_SEPARATOR = "; ";

    private final FolderMapper folderMapper;
    private final SongMapper songMapper;
    private final ArtistMapper artistMapper;
    private final FolderScanner folderScanner;
    private final AudioMetadataParser audioMetadataParser;
    private final MetadataFallbackService metadataFallbackService;
    private final ArtworkResolver artworkResolver;
    private final LyricsResolver lyricsResolver;
    private final ArtistImageResolver artistImageResolver;
    private final LibraryWriter libraryWriter;
    private final ContentCache contentCache;
    private final SingleFlightGuard singleFlightGuard;
    private final FileSystemService fileSystemService;
    private final ApplicationEventPublisher eventPublisher;
    private final AppLibraryProperties appLibraryProperties;
    private final MeterRegistry meterRegistry;

    /**
     * Held for read from extraction through commit, and for write while deleting unreferenced covers.
     */
    private final ReentrantReadWriteLock coverCacheLock = new ReentrantReadWriteLock(true);

    public LibrarySyncEngine(FolderMapper folderMapper,
                             SongMapper songMapper,
                             ArtistMapper artistMapper,
                             FolderScanner folderScanner,
                             AudioMetadataParser audioMetadataParser,
                             MetadataFallbackService metadataFallbackService,
                             ArtworkResolver artworkResolver,
                             LyricsResolver lyricsResolver,
                             ArtistImageResolver artistImageResolver,
                             LibraryWriter libraryWriter,
                             ContentCache contentCache,
                             SingleFlightGuard singleFlightGuard,
                             FileSystemService fileSystemService,
                             ApplicationEventPublisher eventPublisher,
                             AppLibraryProperties appLibraryProperties,
                             ObjectProvider<MeterRegistry> meterRegistryProvider) {
        this.folderMapper = folderMapper;
        this.songMapper = songMapper;
        this.artistMapper = artistMapper;
        this.folderScanner = folderScanner;
        this.audioMetadataParser = audioMetadataParser;
        this.metadataFallbackService = metadataFallbackService;
        this.artworkResolver = artworkResolver;
        this.lyricsResolver = lyricsResolver;
        this.artistImageResolver = artistImageResolver;
        this.libraryWriter = libraryWriter;
        this.contentCache = contentCache;
        this.singleFlightGuard = singleFlightGuard;
        this.fileSystemService = fileSystemService;
        this.eventPublisher = eventPublisher;
        this.appLibraryProperties = appLibraryProperties;
        this.meterRegistry = meterRegistryProvider.getIfAvailable();
    }

    public List<FolderEntity> listFolders() {
        return folderMapper.selectAll();
    }

    public FolderEntity addFolder(String path, String name) {
        if (!StringUtils.hasText(path)) {
            throw new BusinessException(BusinessException.CODE_BAD_REQUEST, "目录路径不能为空");
        }
        Path root = Paths.get(path.trim()).toAbsolutePath().normalize();
        if (!fileSystemService.directoryExists(root)) {
            throw new BusinessException(BusinessException.CODE_BAD_REQUEST, "目录不存在", "请确认目录路径后重试");
        }
        String normalizedPath = root.toString();
        String pathHash = HashUtil.sha256Hex(normalizedPath);
        if (folderMapper.selectByPathHash(pathHash) != null) {
            throw BusinessException.conflict("该目录已添加", "无需重复添加");
        }

        FolderEntity folder = new FolderEntity();
        folder.setPath(normalizedPath);
        folder.setPathHash(pathHash);
        folder.setName(StringUtils.hasText(name) ? name.trim() : defaultName(root));
        folderMapper.insert(folder);
        log.info("FOLDER_ADDED folderId={} path={}", folder.getId(), normalizedPath);
        eventPublisher.publishEvent(new LibraryContentChangedEvent(LibraryChangeType.FOLDER_ADDED, folder.getId()));
        return folder;
    }

    public void removeFolder(Long folderId) {
        FolderEntity folder = requireFolder(folderId);
        String key = SingleFlightGuard.folderKey(folderId);
        if (!singleFlightGuard.tryAcquire(key)) {
            throw BusinessException.conflict("目录正在扫描中", "请先取消扫描或稍后重试");
        }
        try {
            deleteFolder(folder);
        } finally {
            singleFlightGuard.release(key);
        }
        eventPublisher.publishEvent(new LibraryContentChangedEvent(LibraryChangeType.FOLDER_REMOVED, folderId));
    }

    public SyncResult rescanFolder(Long folderId) {
        return rescanFolder(folderId, null);
    }

    /**
     * Brings one folder up to date. Returns a skipped result when the folder is already being synced and
     * a canceled result, with nothing committed, when {@code cancelSignal} fires first.
     */
    public SyncResult rescanFolder(Long folderId, BooleanSupplier cancelSignal) {
        FolderEntity folder = requireFolder(folderId);
        String key = SingleFlightGuard.folderKey(folderId);
        if (!singleFlightGuard.tryAcquire(key)) {
            log.info("FOLDER_RESCAN_SKIPPED folderId={} reason=in-flight", folderId);
            return SyncResult.skipped(folderId);
        }
        try {
            SyncResult result = doRescan(folder, cancelSignal);
            if (result.isCompleted() && result.hasChanges()) {
                LibraryChangeType changeType = result.isFolderRemoved()
                        ? LibraryChangeType.FOLDER_REMOVED : LibraryChangeType.FOLDER_RESCANNED;
                eventPublisher.publishEvent(new LibraryContentChangedEvent(changeType, folderId));
            }
            if (result.isCompleted()) {
                resolveArtistImages(result, cancelSignal);
            }
            return result;
        } finally {
            singleFlightGuard.release(key);
        }
    }

    public SyncResult refreshAllFolders() {
        return refreshAllFolders(null);
    }

    /**
     * Rescans every folder. Folders finished before a cancel stay committed; a single library-wide event is
     * raised only for a run that completed with changes.
     */
    public SyncResult refreshAllFolders(BooleanSupplier cancelSignal) {
        if (!singleFlightGuard.tryAcquire(SingleFlightGuard.LIBRARY_KEY)) {
            log.info("LIBRARY_REFRESH_SKIPPED reason=in-flight");
            return SyncResult.skipped(null);
        }
        long start = System.currentTimeMillis();
        SyncResult total = SyncResult.forFolder(null);
        List<SyncResult> committed = new ArrayList<>();
        try {
            List<FolderEntity> folders = folderMapper.selectAll();
            log.info("LIBRARY_REFRESH_START folders={}", folders.size());
            for (FolderEntity listed : folders) {
                if (isCanceled(cancelSignal)) {
                    total.setCanceled(true);
                    break;
                }
                String key = SingleFlightGuard.folderKey(listed.getId());
                if (!singleFlightGuard.tryAcquire(key)) {
                    log.info("LIBRARY_REFRESH_FOLDER_BUSY folderId={}", listed.getId());
                    continue;
                }
                try {
                    FolderEntity folder = folderMapper.selectById(listed.getId());
                    if (folder == null) {
                        continue;
                    }
                    SyncResult result = doRescan(folder, cancelSignal);
                    if (result.isCanceled()) {
                        total.setCanceled(true);
                        break;
                    }
                    total.merge(result);
                    committed.add(result);
                } catch (Exception e) {
                    total.setFailedFiles(total.getFailedFiles() + 1);
                    log.warn("LIBRARY_REFRESH_FOLDER_FAILED folderId={} path={}", listed.getId(), listed.getPath(), e);
                } finally {
                    singleFlightGuard.release(key);
                }
            }
            if (!total.isCanceled() && total.hasChanges()) {
                eventPublisher.publishEvent(LibraryContentChangedEvent.libraryRescanned());
            }
            for (SyncResult result : committed) {
                if (result.isFolderRemoved()) {
                    continue;
                }
                resolveArtistImages(result, cancelSignal);
                total.setArtistImagesResolved(total.getArtistImagesResolved() + result.getArtistImagesResolved());
            }
        } finally {
            singleFlightGuard.release(SingleFlightGuard.LIBRARY_KEY);
        }
        total.setDurationMs(System.currentTimeMillis() - start);
        log.info("LIBRARY_REFRESH_DONE folders={} added={} modified={} deleted={} failed={} removedFolders={} "
                        + "canceled={} costMs={}",
                total.getFoldersScanned(), total.getAddedFiles(), total.getModifiedFiles(), total.getDeletedFiles(),
                total.getFailedFiles(), total.getFoldersRemoved(), total.isCanceled(), total.getDurationMs());
        return total;
    }

    /**
     * Caller holds the folder's guard key. Never publishes events.
     */
    SyncResult doRescan(FolderEntity folder, BooleanSupplier cancelSignal) {
        long start = System.currentTimeMillis();
        SyncResult result = SyncResult.forFolder(folder.getId());
        Path root = Paths.get(folder.getPath());
        log.info("FOLDER_RESCAN_START folderId={} path={}", folder.getId(), folder.getPath());

        FolderScanResult scan = folderScanner.scan(root, cancelSignal);
        if (scan.isFolderGone()) {
            log.info("FOLDER_GONE folderId={} path={}", folder.getId(), folder.getPath());
            deleteFolder(folder);
            result.setFoldersRemoved(1);
            return finish(result, start);
        }
        if (isCanceled(cancelSignal)) {
            return cancel(result, start);
        }

        List<SongFileStateRow> persisted = songMapper.selectFileStatesByFolderId(folder.getId());
        FolderDiff diff = FolderDiff.compute(scan.getFiles(), persisted, scan.getUnreadablePaths());
        result.setUnchangedFiles(diff.getUnchanged());
        if (diff.isEmpty()) {
            log.info("FOLDER_RESCAN_UNCHANGED folderId={} files={}", folder.getId(), diff.getUnchanged());
            return finish(result, start);
        }

        LibraryWriteOutcome outcome;
        coverCacheLock.readLock().lock();
        try {
            List<SongDraft> drafts = new ArrayList<>();
            for (ScannedFile file : diff.getAdded()) {
                if (isCanceled(cancelSignal)) {
                    return cancel(result, start);
                }
                SongDraft draft = extract(file, null, result);
                if (draft != null) {
                    drafts.add(draft);
                }
            }
            for (FolderDiff.Modified modified : diff.getModified()) {
                if (isCanceled(cancelSignal)) {
                    return cancel(result, start);
                }
                SongDraft draft = extract(modified.getFile(), modified.getExisting(), result);
                if (draft != null) {
                    drafts.add(draft);
                }
            }
            List<Long> deletedIds = new ArrayList<>();
            for (SongFileStateRow row : diff.getDeleted()) {
                deletedIds.add(row.getId());
            }
            if (isCanceled(cancelSignal)) {
                return cancel(result, start);
            }
            if (drafts.isEmpty() && deletedIds.isEmpty()) {
                log.info("FOLDER_RESCAN_NOTHING_TO_COMMIT folderId={} failed={}",
                        folder.getId(), result.getFailedFiles());
                return finish(result, start);
            }

            outcome = libraryWriter.applyFolderChanges(folder.getId(), drafts, deletedIds);
        } finally {
            coverCacheLock.readLock().unlock();
        }
        folderMapper.updateLastModifiedDate(folder.getId(), nowUtc());
        result.setAddedFiles(outcome.getAddedCount());
        result.setModifiedFiles(outcome.getUpdatedCount());
        result.setDeletedFiles(outcome.getDeletedCount());

        Set<String> replacedCovers = new LinkedHashSet<>();
        for (FolderDiff.Modified modified : diff.getModified()) {
            replacedCovers.add(modified.getExisting().getCoverArtUri());
        }
        cleanupArtifacts(diff.getDeleted(), replacedCovers, outcome.getDeletedArtists());
        result.setTouchedArtists(outcome.getTouchedArtists());

        incrementCounter("music.library.rescan.files", "result", "added", result.getAddedFiles());
        incrementCounter("music.library.rescan.files", "result", "modified", result.getModifiedFiles());
        incrementCounter("music.library.rescan.files", "result", "deleted", result.getDeletedFiles());
        return finish(result, start);
    }

    private SongDraft extract(ScannedFile file, SongFileStateRow existing, SyncResult result) {
        Path audioFile = Paths.get(file.getPath());
        try {
            AudioMetadata metadata;
            try {
                metadata = audioMetadataParser.parse(audioFile.toFile());
            } catch (AudioMetadataParseException e) {
                log.warn("SYNC_METADATA_FALLBACK path={} reason={} message={}",
                        file.getPath(), e.getReason().getCode(), e.getMessage());
                metadata = new AudioMetadata();
                metadata.setFailureReason(e.getReason());
            }
            AudioMetadata safeMetadata = metadataFallbackService.applyFallback(metadata, file.getPath());
            ResolvedArtwork artwork = artworkResolver.resolve(audioFile, safeMetadata::firstPicture);
            String sidecarLrc = lyricsResolver.findSidecarLrcPath(audioFile);

            SongEntity song = buildSong(file, audioFile, safeMetadata, artwork);
            if (sidecarLrc != null) {
                song.setLrcFilePath(sidecarLrc);
            } else if (existing != null) {
                song.setLrcFilePath(existing.getLrcFilePath());
            }
            return new SongDraft(existing == null ? null : existing.getId(), song,
                    safeMetadata.getArtists(), safeMetadata.getAlbumArtists(), safeMetadata.getAlbum());
        } catch (Exception e) {
            result.setFailedFiles(result.getFailedFiles() + 1);
            incrementCounter("music.library.rescan.files", "result", "failed", 1);
            log.warn("SYNC_FILE_FAILED path={}", file.getPath(), e);
            return null;
        }
    }

    private SongEntity buildSong(ScannedFile file, Path audioFile, AudioMetadata metadata, ResolvedArtwork artwork) {
        SongEntity song = new SongEntity();
        song.setFilePath(file.getPath());
        song.setFilePathHash(HashUtil.sha256Hex(file.getPath()));
        Path directory = audioFile.getParent();
        song.setDirectoryPath(directory == null ? null : directory.toString());
        song.setFileModifiedDate(file.getLastModified());
        song.setTitle(metadata.getTitle());
        song.setTrackNo(metadata.getTrackNo());
        song.setDiscNo(metadata.getDiscNo());
        song.setYear(metadata.getYear());
        song.setGenre(metadata.getGenres() == null || metadata.getGenres().isEmpty()
                ? null : String.join(GENRE_SEPARATOR, metadata.getGenres()));
        song.setDurationSec(metadata.getDurationSec());
        song.setBitrate(metadata.getBitrate());
        song.setSampleRate(metadata.getSampleRate());
        song.setChannels(metadata.getChannels());
        if (artwork != null) {
            song.setCoverArtUri(artwork.getCoverArtUri());
            song.setLightSwatch(artwork.getLightSwatch());
            song.setDarkSwatch(artwork.getDarkSwatch());
        }
        song.setLyrics(StringUtils.hasText(metadata.getLyrics()) ? metadata.getLyrics() : null);
        song.setReplayGainTrackGain(metadata.getReplayGainTrackGain());
        song.setReplayGainTrackPeak(metadata.getReplayGainTrackPeak());
        song.setExtractionError(metadata.getFailureReason() == null ? null : metadata.getFailureReason().getCode());
        return song;
    }

    private void deleteFolder(FolderEntity folder) {
        LibraryWriteOutcome outcome = libraryWriter.removeFolder(folder.getId());
        cleanupArtifacts(outcome.getRemovedSongs(), new LinkedHashSet<>(), outcome.getDeletedArtists());
        log.info("FOLDER_REMOVED folderId={} path={} songs={}", folder.getId(), folder.getPath(),
                outcome.getDeletedCount());
    }

    /**
     * Post-commit file cleanup. Only files inside the cache directories are deleted; sidecar lyrics and
     * images next to the music are never touched.
     */
    private void cleanupArtifacts(List<SongFileStateRow> removedSongs,
                                  Set<String> replacedCovers,
                                  List<ArtistEntity> deletedArtists) {
        Set<String> coverCandidates = new LinkedHashSet<>(replacedCovers);
        for (SongFileStateRow row : removedSongs) {
            coverCandidates.add(row.getCoverArtUri());
            contentCache.deleteIfInside(Paths.get(appLibraryProperties.getLyricsCacheDir()), row.getLrcFilePath());
        }
        Path coverDir = Paths.get(appLibraryProperties.getCoverArtCacheDir());
        coverCacheLock.writeLock().lock();
        try {
            for (String coverArtUri : coverCandidates) {
                if (!StringUtils.hasText(coverArtUri) || songMapper.countByCoverArtUri(coverArtUri) > 0) {
                    continue;
                }
                if (contentCache.deleteIfInside(coverDir, coverArtUri)) {
                    log.debug("COVER_ART_DELETED path={}", coverArtUri);
                }
            }
        } finally {
            coverCacheLock.writeLock().unlock();
        }
        Path artistDir = Paths.get(appLibraryProperties.getArtistImageCacheDir());
        for (ArtistEntity artist : deletedArtists) {
            contentCache.deleteIfInside(artistDir, artist.getLocalImageCachePath());
        }
    }

    /**
     * One artist's failure never stops the others.
     */
    private void resolveArtistImages(SyncResult result, BooleanSupplier cancelSignal) {
        Map<Long, String> touched = result.getTouchedArtists();
        if (touched == null || touched.isEmpty()) {
            return;
        }
        boolean allowOnline = appLibraryProperties.isOnlineArtistMetadataEnabled();
        for (Map.Entry<Long, String> entry : touched.entrySet()) {
            if (isCanceled(cancelSignal)) {
                log.info("ARTIST_IMAGES_CANCELED folderId={}", result.getFolderId());
                return;
            }
            try {
                ArtistEntity artist = artistMapper.selectById(entry.getKey());
                if (artist == null) {
                    continue;
                }
                if (artistImageResolver.resolve(artist, entry.getValue(), allowOnline) != null) {
                    result.setArtistImagesResolved(result.getArtistImagesResolved() + 1);
                }
            } catch (Exception e) {
                log.warn("ARTIST_IMAGE_FAILED artistId={} samplePath={}", entry.getKey(), entry.getValue(), e);
            }
        }
    }

    private FolderEntity requireFolder(Long folderId) {
        FolderEntity folder = folderId == null ? null : folderMapper.selectById(folderId);
        if (folder == null) {
            throw BusinessException.notFound("目录不存在或已移除");
        }
        return folder;
    }

    private SyncResult cancel(SyncResult result, long start) {
        result.setCanceled(true);
        log.info("FOLDER_RESCAN_CANCELED folderId={}", result.getFolderId());
        return finish(result, start);
    }

    private SyncResult finish(SyncResult result, long start) {
        result.setDurationMs(System.currentTimeMillis() - start);
        if (meterRegistry != null) {
            try {
                meterRegistry.timer("music.library.rescan.duration").record(result.getDurationMs(), TimeUnit.MILLISECONDS);
            } catch (Exception e) {
                log.debug("Metric timer update failed", e);
            }
        }
        log.info("FOLDER_RESCAN_DONE folderId={} added={} modified={} deleted={} failed={} unchanged={} removed={} "
                        + "canceled={} costMs={}",
                result.getFolderId(), result.getAddedFiles(), result.getModifiedFiles(), result.getDeletedFiles(),
                result.getFailedFiles(), result.getUnchangedFiles(), result.isFolderRemoved(), result.isCanceled(),
                result.getDurationMs());
        return result;
    }

    private boolean isCanceled(BooleanSupplier cancelSignal) {
        return cancelSignal != null && cancelSignal.getAsBoolean();
    }

    private String defaultName(Path root) {
        Path fileName = root.getFileName();
        return fileName == null ? root.toString() : fileName.toString();
    }

    private LocalDateTime nowUtc() {
        return LocalDateTime.now(ZoneOffset.UTC).truncatedTo(ChronoUnit.MILLIS);
    }

    private void incrementCounter(String name, String tagKey, String tagValue, int amount) {
        if (meterRegistry == null || amount <= 0) {
            return;
        }
        try {
            meterRegistry.counter(name, tagKey, tagValue).increment(amount);
        } catch (Exception e) {
            log.debug("Metric counter update failed, name={}", name, e);
        }
    }
}

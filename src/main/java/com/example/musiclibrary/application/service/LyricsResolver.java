package com.example.musiclibrary.application.service;

import com.example.musiclibrary.common.config.AppLibraryProperties;
import com.example.musiclibrary.domain.enumtype.ImageProvenance;
import com.example.musiclibrary.domain.enumtype.LyricsSource;
import com.example.musiclibrary.domain.model.LyricsQuery;
import com.example.musiclibrary.domain.model.ResolvedLyrics;
import com.example.musiclibrary.infrastructure.filesystem.FileSystemService;
import com.example.musiclibrary.infrastructure.persistence.entity.SongEntity;
import com.example.musiclibrary.infrastructure.persistence.mapper.SongMapper;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.time.LocalDateTime;
import java.time.ZoneOffset;
import java.time.temporal.ChronoUnit;
import java.util.Objects;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.util.StringUtils;

/**
 * Finds lyrics for a song. Order: a cached LRC that is not older than the audio file, a sibling
 * {@code .lrc}, a sibling {@code .txt}, the online providers, and finally lyrics embedded in the tags.
 */
@Service
public class LyricsResolver {

    private static final Logger log = LoggerFactory.getLogger(LyricsResolver.class);

    private final FileSystemService fileSystemService;
    private final LrcParser lrcParser;
    private final OnlineLyricsLookup onlineLyricsLookup;
    private final ContentCache contentCache;
    private final SongMapper songMapper;
    private final AppLibraryProperties appLibraryProperties;

    public LyricsResolver(FileSystemService fileSystemService,
                          LrcParser lrcParser,
                          OnlineLyricsLookup onlineLyricsLookup,
                          ContentCache contentCache,
                          SongMapper songMapper,
                          AppLibraryProperties appLibraryProperties) {
        this.fileSystemService = fileSystemService;
        this.lrcParser = lrcParser;
        this.onlineLyricsLookup = onlineLyricsLookup;
        this.contentCache = contentCache;
        this.songMapper = songMapper;
        this.appLibraryProperties = appLibraryProperties;
    }

    /**
     * @return the lyrics, or null when no source has any
     */
    public ResolvedLyrics resolve(SongEntity song) {
        Path audioFile = Paths.get(song.getFilePath());
        FallbackChain<SongEntity, ResolvedLyrics> chain = FallbackChain.<SongEntity, ResolvedLyrics>named("lyrics")
                .then("cached-lrc", s -> readFreshCache(s, audioFile))
                .then("sidecar-lrc", s -> readSidecar(s, audioFile, "lrc", LyricsSource.SIDECAR_LRC))
                .then("sidecar-txt", s -> readSidecar(s, audioFile, "txt", LyricsSource.SIDECAR_TXT))
                .then("online", this::fetchOnline)
                .then("embedded", this::readEmbedded);
        return chain.resolve(song).orElse(null);
    }

    /**
     * Sibling {@code .lrc} of an audio file, used while syncing; null when there is none.
     */
    public String findSidecarLrcPath(Path audioFile) {
        Path sidecar = sidecarPath(audioFile, "lrc");
        return fileSystemService.fileExists(sidecar) ? sidecar.toString() : null;
    }

    Optional<ResolvedLyrics> readFreshCache(SongEntity song, Path audioFile) throws IOException {
        if (!StringUtils.hasText(song.getLrcFilePath())) {
            return Optional.empty();
        }
        Path cached = Paths.get(song.getLrcFilePath());
        if (!fileSystemService.fileExists(cached)) {
            return Optional.empty();
        }
        LocalDateTime cacheTime = fileSystemService.lastWriteTimeUtc(cached);
        LocalDateTime audioTime = fileSystemService.lastWriteTimeUtc(audioFile);
        if (cacheTime.isBefore(audioTime)) {
            log.debug("LYRICS_CACHE_STALE songId={} cache={}", song.getId(), cached);
            return Optional.empty();
        }
        String text = fileSystemService.readText(cached);
        return Optional.of(new ResolvedLyrics(LyricsSource.CACHED_LRC, cached.toString(), text, lrcParser.parse(text)));
    }

    private Optional<ResolvedLyrics> readSidecar(SongEntity song, Path audioFile, String extension, LyricsSource source)
            throws IOException {
        Path sidecar = sidecarPath(audioFile, extension);
        if (!fileSystemService.fileExists(sidecar)) {
            return Optional.empty();
        }
        String text = fileSystemService.readText(sidecar);
        if (!StringUtils.hasText(text)) {
            return Optional.empty();
        }
        if (source == LyricsSource.SIDECAR_LRC && !Objects.equals(song.getLrcFilePath(), sidecar.toString())) {
            songMapper.updateLyricsState(song.getId(), sidecar.toString(), song.getLyricsLastCheckedUtc());
            song.setLrcFilePath(sidecar.toString());
        }
        return Optional.of(new ResolvedLyrics(source, sidecar.toString(), text, lrcParser.parse(text)));
    }

    private Optional<ResolvedLyrics> fetchOnline(SongEntity song) throws IOException {
        OnlineLyricsLookup.Outcome outcome = onlineLyricsLookup.lookup(toQuery(song));
        if (!outcome.isAttempted()) {
            return Optional.empty();
        }
        LocalDateTime checkedAt = LocalDateTime.now(ZoneOffset.UTC).truncatedTo(ChronoUnit.MILLIS);
        if (!outcome.isFound()) {
            songMapper.updateLyricsState(song.getId(), song.getLrcFilePath(), checkedAt);
            song.setLyricsLastCheckedUtc(checkedAt);
            return Optional.empty();
        }
        String path;
        try {
            path = contentCache.storeEntityArtifact(Paths.get(appLibraryProperties.getLyricsCacheDir()),
                    String.valueOf(song.getId()), ImageProvenance.FETCHED,
                    outcome.getContent().getBytes(StandardCharsets.UTF_8), "lrc").toString();
        } catch (IOException e) {
            // the lyrics are still usable for this request
            log.warn("LYRICS_CACHE_WRITE_FAILED songId={} reason={}", song.getId(), e.getMessage());
            path = song.getLrcFilePath();
        }
        songMapper.updateLyricsState(song.getId(), path, checkedAt);
        song.setLrcFilePath(path);
        song.setLyricsLastCheckedUtc(checkedAt);
        log.info("LYRICS_ONLINE_FOUND songId={} provider={} path={}", song.getId(), outcome.getProviderName(), path);
        return Optional.of(new ResolvedLyrics(LyricsSource.ONLINE, path, outcome.getContent(),
                lrcParser.parse(outcome.getContent())));
    }

    private Optional<ResolvedLyrics> readEmbedded(SongEntity song) {
        if (!StringUtils.hasText(song.getLyrics())) {
            return Optional.empty();
        }
        return Optional.of(new ResolvedLyrics(LyricsSource.EMBEDDED, null, song.getLyrics(),
                lrcParser.parse(song.getLyrics())));
    }

    private LyricsQuery toQuery(SongEntity song) {
        return new LyricsQuery(song.getTitle(), song.getPrimaryArtistName(), null, song.getDurationSec());
    }

    static Path sidecarPath(Path audioFile, String extension) {
        String name = audioFile.getFileName().toString();
        int dot = name.lastIndexOf('.');
        String base = dot > 0 ? name.substring(0, dot) : name;
        return audioFile.resolveSibling(base + "." + extension);
    }
}

package com.example.musiclibrary.application.service;

import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyLong;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.doAnswer;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

import com.example.musiclibrary.common.config.AppLibraryProperties;
import com.example.musiclibrary.domain.enumtype.ServiceResultStatus;
import com.example.musiclibrary.domain.event.ArtistMetadataUpdatedEvent;
import com.example.musiclibrary.domain.model.ArtistProfile;
import com.example.musiclibrary.domain.model.ServiceResult;
import com.example.musiclibrary.infrastructure.filesystem.LocalFileSystemService;
import com.example.musiclibrary.infrastructure.image.ImageIoImageProcessor;
import com.example.musiclibrary.infrastructure.persistence.entity.ArtistEntity;
import com.example.musiclibrary.infrastructure.persistence.mapper.ArtistMapper;
import com.example.musiclibrary.infrastructure.provider.ArtistInfoProvider;
import com.example.musiclibrary.infrastructure.provider.ProviderSessionRegistry;
import io.micrometer.core.instrument.MeterRegistry;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.time.LocalDateTime;
import java.util.Arrays;
import java.util.Collections;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.mockito.ArgumentCaptor;
import org.springframework.beans.factory.support.StaticListableBeanFactory;
import org.springframework.context.ApplicationEventPublisher;

class ArtistImageResolverTest {

    @TempDir
    Path tempDir;

    private Path artistDir;
    private Path albumDir;
    private Path imageCacheDir;
    private ArtistMapper artistMapper;
    private ProviderSessionRegistry providerSessionRegistry;
    private ApplicationEventPublisher eventPublisher;
    private AppLibraryProperties properties;
    private SingleFlightGuard singleFlightGuard;
    private ArtistImageResolver resolver;

    @BeforeEach
    void setUp() throws IOException {
        artistDir = Files.createDirectories(tempDir.resolve("music/Nina"));
        albumDir = Files.createDirectories(artistDir.resolve("Live 1968"));
        imageCacheDir = tempDir.resolve("cache/artists");
        artistMapper = mock(ArtistMapper.class);
        providerSessionRegistry = mock(ProviderSessionRegistry.class);
        eventPublisher = mock(ApplicationEventPublisher.class);
        properties = new AppLibraryProperties();
        properties.setArtistImageCacheDir(imageCacheDir.toString());
        singleFlightGuard = new SingleFlightGuard();

        LocalFileSystemService fileSystemService = new LocalFileSystemService();
        ContentCache contentCache = new ContentCache(fileSystemService,
                new StaticListableBeanFactory().getBeanProvider(MeterRegistry.class));
        resolver = new ArtistImageResolver(fileSystemService, new ImageIoImageProcessor(), contentCache,
                artistMapper, providerSessionRegistry, singleFlightGuard, eventPublisher, properties);
    }

    @Test
    void artistFolderImageShouldWinOverAlbumFolderImage() throws IOException {
        byte[] artistFolderImage = ImageFixtures.png(0xAA0000);
        Files.write(artistDir.resolve("Artist.PNG"), artistFolderImage);
        Files.write(albumDir.resolve("artist.png"), ImageFixtures.png(0x0000AA));

        String path = resolver.resolve(artist(7L, null), sampleSong(), false);

        assertEquals(imageCacheDir.resolve("7.local.png").toString(), path);
        assertArrayEquals(artistFolderImage, Files.readAllBytes(Paths.get(path)));
        verify(artistMapper).updateLocalImageCachePath(7L, path);
        ArgumentCaptor<Object> event = ArgumentCaptor.forClass(Object.class);
        verify(eventPublisher).publishEvent(event.capture());
        ArtistMetadataUpdatedEvent published = (ArtistMetadataUpdatedEvent) event.getValue();
        assertEquals(7L, published.getArtistId());
        assertEquals(path, published.getNewLocalImageCachePath());
    }

    @Test
    void albumFolderImageShouldBeUsedWhenArtistFolderHasNone() throws IOException {
        byte[] albumFolderImage = ImageFixtures.png(0x00AA00);
        Files.write(albumDir.resolve("artist.png"), albumFolderImage);

        String path = resolver.resolve(artist(7L, null), sampleSong(), false);

        assertArrayEquals(albumFolderImage, Files.readAllBytes(Paths.get(path)));
    }

    @Test
    void customImageShouldNeverBeReplaced() throws IOException {
        Files.write(artistDir.resolve("artist.png"), ImageFixtures.png(0xAA0000));

        String path = resolver.resolve(artist(7L, imageCacheDir.resolve("7.custom.jpg").toString()), sampleSong(), true);

        assertNull(path);
        verify(artistMapper, never()).updateLocalImageCachePath(anyLong(), anyString());
        verifyNoInteractions(eventPublisher, providerSessionRegistry);
    }

    @Test
    void busyArtistShouldBeLeftToTheCallerHoldingIt() throws IOException {
        Files.write(artistDir.resolve("artist.png"), ImageFixtures.png(0xAA0000));
        singleFlightGuard.tryAcquire(SingleFlightGuard.artistKey(7L));

        assertNull(resolver.resolve(artist(7L, null), sampleSong(), false));
        assertNull(resolver.storeFetchedImage(artist(7L, null),
                new ArtistProfile("bio", ImageFixtures.png(0x00AA00), "png")));

        verifyNoInteractions(artistMapper, eventPublisher);
        assertFalse(Files.exists(imageCacheDir.resolve("7.local.png")));
    }

    @Test
    void secondConcurrentResolveOfSameArtistShouldDoNothing() throws Exception {
        Files.write(artistDir.resolve("artist.png"), ImageFixtures.png(0xAA0000));
        CountDownLatch storing = new CountDownLatch(1);
        CountDownLatch proceed = new CountDownLatch(1);
        doAnswer(invocation -> {
            storing.countDown();
            assertTrue(proceed.await(5, TimeUnit.SECONDS));
            return 1;
        }).when(artistMapper).updateLocalImageCachePath(eq(7L), anyString());
        ExecutorService executor = Executors.newSingleThreadExecutor();
        try {
            Future<String> first = executor.submit(() -> resolver.resolve(artist(7L, null), sampleSong(), false));
            assertTrue(storing.await(5, TimeUnit.SECONDS));

            assertNull(resolver.resolve(artist(7L, null), sampleSong(), false));

            proceed.countDown();
            assertEquals(imageCacheDir.resolve("7.local.png").toString(), first.get(5, TimeUnit.SECONDS));
        } finally {
            proceed.countDown();
            executor.shutdownNow();
        }
        verify(artistMapper, times(1)).updateLocalImageCachePath(eq(7L), anyString());
        assertFalse(singleFlightGuard.isInFlight(SingleFlightGuard.artistKey(7L)));
    }

    @Test
    void staleArtistRowShouldBeReloadedBeforeStoring() throws IOException {
        Files.createDirectories(imageCacheDir);
        Path local = Files.write(imageCacheDir.resolve("7.local.png"), ImageFixtures.png(0x111111));
        when(artistMapper.selectById(7L)).thenReturn(artist(7L, local.toString()));

        String path = resolver.storeFetchedImage(artist(7L, null),
                new ArtistProfile("bio", ImageFixtures.png(0x00AA00), "png"));

        assertNull(path);
        assertTrue(Files.exists(local));
        verify(artistMapper, never()).updateLocalImageCachePath(anyLong(), anyString());
    }

    @Test
    void resolvedLocalImageShouldBeSkippedWhileItsFileExists() throws IOException {
        Files.createDirectories(imageCacheDir);
        Path existing = Files.write(imageCacheDir.resolve("7.local.png"), ImageFixtures.png(0x111111));
        Files.write(artistDir.resolve("artist.png"), ImageFixtures.png(0xAA0000));

        assertNull(resolver.resolve(artist(7L, existing.toString()), sampleSong(), false));

        Files.delete(existing);
        String path = resolver.resolve(artist(7L, existing.toString()), sampleSong(), false);
        assertEquals(existing.toString(), path);
    }

    @Test
    void onlineProviderShouldBeAskedWhenNoLocalImageExists() throws IOException {
        properties.setOnlineArtistMetadataEnabled(true);
        byte[] fetched = ImageFixtures.png(0x445566);
        StubArtistProvider provider = new StubArtistProvider(
                ServiceResult.success(new ArtistProfile("bio", fetched, "png")));
        when(providerSessionRegistry.enabledArtistProviders()).thenReturn(Collections.singletonList(provider));

        String path = resolver.resolve(artist(7L, null), sampleSong(), true);

        assertEquals(imageCacheDir.resolve("7.fetched.png").toString(), path);
        assertArrayEquals(fetched, Files.readAllBytes(Paths.get(path)));
        verify(artistMapper).updateMetadataChecked(eq(7L), eq("bio"), any(LocalDateTime.class));
        verify(providerSessionRegistry).record(eq("stub"), any());
    }

    @Test
    void onlineLookupShouldBeSkippedForArtistsAlreadyChecked() {
        properties.setOnlineArtistMetadataEnabled(true);
        StubArtistProvider provider = new StubArtistProvider(ServiceResult.notFound());
        when(providerSessionRegistry.enabledArtistProviders()).thenReturn(Collections.singletonList(provider));
        ArtistEntity artist = artist(7L, null);
        artist.setMetadataLastCheckedUtc(LocalDateTime.of(2024, 1, 1, 0, 0));

        assertNull(resolver.resolve(artist, sampleSong(), true));
        assertEquals(0, provider.calls.get());
    }

    @Test
    void temporaryProviderErrorShouldLeaveArtistUnchecked() {
        properties.setOnlineArtistMetadataEnabled(true);
        StubArtistProvider provider = new StubArtistProvider(ServiceResult.temporaryError("timeout"));
        when(providerSessionRegistry.enabledArtistProviders()).thenReturn(Collections.singletonList(provider));

        assertNull(resolver.resolve(artist(7L, null), sampleSong(), true));

        assertEquals(1, provider.calls.get());
        verify(artistMapper, never()).updateMetadataChecked(anyLong(), any(), any());
        verify(artistMapper, never()).updateLocalImageCachePath(anyLong(), anyString());
    }

    @Test
    void notFoundShouldOnlyBeReportedWhenSomeProviderAnswered() {
        StubArtistProvider broken = new StubArtistProvider(ServiceResult.permanentError("bad key"));
        StubArtistProvider empty = new StubArtistProvider(ServiceResult.notFound());
        when(providerSessionRegistry.enabledArtistProviders())
                .thenReturn(Arrays.asList(broken, empty))
                .thenReturn(Collections.singletonList(broken));

        assertEquals(ServiceResultStatus.SUCCESS_NOT_FOUND, resolver.fetchOnlineProfile("Nina").getStatus());
        assertEquals(ServiceResultStatus.TEMPORARY_ERROR, resolver.fetchOnlineProfile("Nina").getStatus());
    }

    @Test
    void undecodableLocalImageShouldNotBeStored() throws IOException {
        Files.write(artistDir.resolve("artist.jpg"), new byte[]{1, 2, 3, 4});

        assertNull(resolver.resolve(artist(7L, null), sampleSong(), false));
        verify(artistMapper, never()).updateLocalImageCachePath(anyLong(), anyString());
    }

    private String sampleSong() {
        return albumDir.resolve("01 Ain't Got No.flac").toString();
    }

    private ArtistEntity artist(Long id, String imagePath) {
        ArtistEntity artist = new ArtistEntity();
        artist.setId(id);
        artist.setName("Nina Simone");
        artist.setLocalImageCachePath(imagePath);
        return artist;
    }

    private static final class StubArtistProvider implements ArtistInfoProvider {

        private final ServiceResult<ArtistProfile> result;
        private final AtomicInteger calls = new AtomicInteger();

        private StubArtistProvider(ServiceResult<ArtistProfile> result) {
            this.result = result;
        }

        @Override
        public String getName() {
            return "stub";
        }

        @Override
        public ServiceResult<ArtistProfile> fetchArtist(String artistName) {
            calls.incrementAndGet();
            return result;
        }
    }
}

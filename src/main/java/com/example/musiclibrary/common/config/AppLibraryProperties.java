package com.example.musiclibrary.common.config;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collection;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.stream.Collectors;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

@Data
@ConfigurationProperties(prefix = "app.library")
public class AppLibraryProperties {

    private List<String> audioExtensions = new ArrayList<>(Arrays.asList(
            "aac", "aiff", "aif", "alac", "ape", "dsf", "flac", "m4a", "mp3",
            "mpc", "ogg", "oga", "opus", "wav", "wma", "wv"));

    private List<String> imageExtensions = new ArrayList<>(Arrays.asList(
            "jpg", "jpeg", "png", "bmp", "gif", "tiff", "tif", "ico"));

    private String coverArtCacheDir = System.getProperty("user.home") + "/.music-library/albumart";

    private String artistImageCacheDir = System.getProperty("user.home") + "/.music-library/artistimages";

    private String lyricsCacheDir = System.getProperty("user.home") + "/.music-library/lyrics";

    /**
     * Whether artist biographies and images may be fetched from online providers.
     */
    private boolean onlineArtistMetadataEnabled = false;

    /**
     * Whether lyrics may be fetched from online providers when no local file exists.
     */
    private boolean onlineLyricsEnabled = false;

    /**
     * Enabled lyrics providers, highest priority first.
     */
    private List<String> lyricsProviders = new ArrayList<>();

    /**
     * Enabled artist metadata providers, highest priority first.
     */
    private List<String> artistProviders = new ArrayList<>();

    /**
     * Extra separators that split one artist tag value into several artists.
     */
    private List<String> artistSeparators = new ArrayList<>(Arrays.asList(";"));

    private boolean refreshEnabled = false;

    private String refreshCron = "0 30 3 * * ?";

    private int onlineLookupTimeoutSec = 15;

    private int artistBackfillBatchSize = 50;

    private int taskThreadCount = 2;

    private int providerThreadCount = 4;

    public Set<String> normalizedAudioExtensions() {
        return normalize(audioExtensions);
    }

    public Set<String> normalizedImageExtensions() {
        return normalize(imageExtensions);
    }

    private static Set<String> normalize(Collection<String> extensions) {
        return extensions.stream()
                .filter(item -> item != null && !item.trim().isEmpty())
                .map(item -> item.trim().toLowerCase(Locale.ROOT).replaceFirst("^\\.", ""))
                .collect(Collectors.toCollection(LinkedHashSet::new));
    }
}

package com.example.musiclibrary.infrastructure.provider;

import com.example.musiclibrary.common.config.AppLibraryProperties;
import com.example.musiclibrary.domain.enumtype.ServiceResultStatus;
import com.example.musiclibrary.domain.model.ServiceResult;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.Function;
import java.util.stream.Collectors;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.stereotype.Component;

/**
 * Knows which online providers are registered and enabled, in priority order, and which ones have been
 * disabled for the rest of this process after a permanent error.
 */
@Component
public class ProviderSessionRegistry {

    private static final Logger log = LoggerFactory.getLogger(ProviderSessionRegistry.class);

    private final AppLibraryProperties appLibraryProperties;
    private final Map<String, LyricsProvider> lyricsProviders;
    private final Map<String, ArtistInfoProvider> artistProviders;
    private final Set<String> disabledProviders = ConcurrentHashMap.newKeySet();

    public ProviderSessionRegistry(AppLibraryProperties appLibraryProperties,
                                   ObjectProvider<LyricsProvider> lyricsProviders,
                                   ObjectProvider<ArtistInfoProvider> artistProviders) {
        this.appLibraryProperties = appLibraryProperties;
        this.lyricsProviders = lyricsProviders.orderedStream()
                .collect(Collectors.toMap(LyricsProvider::getName, Function.identity(), (a, b) -> a,
                        LinkedHashMap::new));
        this.artistProviders = artistProviders.orderedStream()
                .collect(Collectors.toMap(ArtistInfoProvider::getName, Function.identity(), (a, b) -> a,
                        LinkedHashMap::new));
    }

    public List<LyricsProvider> enabledLyricsProviders() {
        return enabled(appLibraryProperties.getLyricsProviders(), lyricsProviders);
    }

    public List<ArtistInfoProvider> enabledArtistProviders() {
        return enabled(appLibraryProperties.getArtistProviders(), artistProviders);
    }

    private <P> List<P> enabled(List<String> configuredOrder, Map<String, P> registered) {
        List<P> result = new ArrayList<>();
        if (configuredOrder == null) {
            return result;
        }
        for (String name : configuredOrder) {
            P provider = registered.get(name);
            if (provider != null && !disabledProviders.contains(name)) {
                result.add(provider);
            }
        }
        return result;
    }

    /**
     * Records the outcome of a lookup; a permanent error disables the provider until restart.
     */
    public void record(String providerName, ServiceResult<?> result) {
        if (result != null && result.getStatus() == ServiceResultStatus.PERMANENT_ERROR
                && disabledProviders.add(providerName)) {
            log.warn("PROVIDER_DISABLED provider={} reason={}", providerName, result.getMessage());
        }
    }

    public boolean isDisabled(String providerName) {
        return disabledProviders.contains(providerName);
    }
}

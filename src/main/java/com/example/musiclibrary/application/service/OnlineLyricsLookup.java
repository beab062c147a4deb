package com.example.musiclibrary.application.service;

import com.example.musiclibrary.common.config.AppLibraryProperties;
import com.example.musiclibrary.domain.model.LyricsQuery;
import com.example.musiclibrary.domain.model.ServiceResult;
import com.example.musiclibrary.infrastructure.provider.LyricsProvider;
import com.example.musiclibrary.infrastructure.provider.ProviderSessionRegistry;
import io.micrometer.core.instrument.MeterRegistry;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Component;
import org.springframework.util.StringUtils;

/**
 * Queries every enabled lyrics provider at once, waits for all of them, then picks the answer of the
 * highest-priority provider that returned text. Completion order plays no part in the choice. Every answer,
 * including one that arrives after the timeout, is recorded in the provider session.
 */
@Component
public class OnlineLyricsLookup {

    private static final Logger log = LoggerFactory.getLogger(OnlineLyricsLookup.class);

    private final ProviderSessionRegistry providerSessionRegistry;
    private final ExecutorService providerLookupExecutor;
    private final AppLibraryProperties appLibraryProperties;
    private final MeterRegistry meterRegistry;

    public OnlineLyricsLookup(ProviderSessionRegistry providerSessionRegistry,
                              @Qualifier("providerLookupExecutor") ExecutorService providerLookupExecutor,
                              AppLibraryProperties appLibraryProperties,
                              ObjectProvider<MeterRegistry> meterRegistryProvider) {
        this.providerSessionRegistry = providerSessionRegistry;
        this.providerLookupExecutor = providerLookupExecutor;
        this.appLibraryProperties = appLibraryProperties;
        this.meterRegistry = meterRegistryProvider.getIfAvailable();
    }

    public boolean isAvailable() {
        return appLibraryProperties.isOnlineLyricsEnabled()
                && !providerSessionRegistry.enabledLyricsProviders().isEmpty();
    }

    public Outcome lookup(LyricsQuery query) {
        if (!appLibraryProperties.isOnlineLyricsEnabled()) {
            return Outcome.notAttempted();
        }
        List<LyricsProvider> providers = providerSessionRegistry.enabledLyricsProviders();
        if (providers.isEmpty()) {
            return Outcome.notAttempted();
        }

        List<CompletableFuture<ServiceResult<String>>> futures = new ArrayList<>(providers.size());
        for (LyricsProvider provider : providers) {
            futures.add(CompletableFuture.supplyAsync(() -> searchAndRecord(provider, query), providerLookupExecutor));
        }
        awaitAll(futures);

        Outcome outcome = Outcome.attemptedWithoutResult();
        for (int i = 0; i < providers.size(); i++) {
            LyricsProvider provider = providers.get(i);
            ServiceResult<String> result = futures.get(i).getNow(null);
            if (result == null) {
                log.debug("LYRICS_PROVIDER_LATE provider={} title={}", provider.getName(), query.getTitle());
                continue;
            }
            if (!outcome.isFound() && result.isSuccess() && StringUtils.hasText(result.getData())) {
                outcome = Outcome.found(provider.getName(), result.getData());
            }
        }
        log.debug("LYRICS_ONLINE_DONE title={} providers={} chosen={}",
                query.getTitle(), providers.size(), outcome.getProviderName());
        return outcome;
    }

    private ServiceResult<String> searchAndRecord(LyricsProvider provider, LyricsQuery query) {
        ServiceResult<String> result = search(provider, query);
        incrementCounter("music.library.lyrics.online", "provider", provider.getName(),
                "status", result.getStatus().name());
        providerSessionRegistry.record(provider.getName(), result);
        return result;
    }

    private ServiceResult<String> search(LyricsProvider provider, LyricsQuery query) {
        try {
            ServiceResult<String> result = provider.searchLyrics(query);
            return result == null ? ServiceResult.temporaryError("no result") : result;
        } catch (RuntimeException e) {
            log.warn("LYRICS_PROVIDER_FAILED provider={} title={}", provider.getName(), query.getTitle(), e);
            return ServiceResult.temporaryError(e.getMessage());
        }
    }

    private void awaitAll(List<CompletableFuture<ServiceResult<String>>> futures) {
        CompletableFuture<Void> all = CompletableFuture.allOf(futures.toArray(new CompletableFuture[0]));
        try {
            all.get(Math.max(1, appLibraryProperties.getOnlineLookupTimeoutSec()), TimeUnit.SECONDS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.warn("LYRICS_ONLINE_INTERRUPTED");
        } catch (TimeoutException e) {
            log.warn("LYRICS_ONLINE_TIMEOUT timeoutSec={}", appLibraryProperties.getOnlineLookupTimeoutSec());
        } catch (ExecutionException e) {
            // search() never completes exceptionally; keep whatever finished
            log.debug("LYRICS_ONLINE_EXECUTION_FAILED", e);
        }
    }

    private void incrementCounter(String name, String... tags) {
        if (meterRegistry == null) {
            return;
        }
        try {
            meterRegistry.counter(name, tags).increment();
        } catch (Exception e) {
            log.debug("Metric counter update failed, name={}", name, e);
        }
    }

    public static final class Outcome {

        private final boolean attempted;
        private final String providerName;
        private final String content;

        private Outcome(boolean attempted, String providerName, String content) {
            this.attempted = attempted;
            this.providerName = providerName;
            this.content = content;
        }

        static Outcome notAttempted() {
            return new Outcome(false, null, null);
        }

        static Outcome attemptedWithoutResult() {
            return new Outcome(true, null, null);
        }

        static Outcome found(String providerName, String content) {
            return new Outcome(true, providerName, content);
        }

        public boolean isAttempted() {
            return attempted;
        }

        public boolean isFound() {
            return content != null;
        }

        public String getProviderName() {
            return providerName;
        }

        public String getContent() {
            return content;
        }
    }
}

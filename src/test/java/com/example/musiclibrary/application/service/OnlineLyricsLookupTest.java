package com.example.musiclibrary.application.service;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

import com.example.musiclibrary.common.config.AppLibraryProperties;
import com.example.musiclibrary.domain.model.LyricsQuery;
import com.example.musiclibrary.domain.model.ServiceResult;
import com.example.musiclibrary.infrastructure.provider.ArtistInfoProvider;
import com.example.musiclibrary.infrastructure.provider.LyricsProvider;
import com.example.musiclibrary.infrastructure.provider.ProviderSessionRegistry;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import java.util.Arrays;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Supplier;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.beans.factory.support.StaticListableBeanFactory;

class OnlineLyricsLookupTest {

    private static final LyricsQuery QUERY = new LyricsQuery("Song", "Someone", "Album", 200);

    private ExecutorService executor;
    private AppLibraryProperties properties;
    private SimpleMeterRegistry meterRegistry;

    @BeforeEach
    void setUp() {
        executor = Executors.newFixedThreadPool(4);
        properties = new AppLibraryProperties();
        properties.setOnlineLyricsEnabled(true);
        properties.setOnlineLookupTimeoutSec(5);
        properties.setLyricsProviders(Arrays.asList("primary", "secondary"));
        meterRegistry = new SimpleMeterRegistry();
    }

    @AfterEach
    void tearDown() {
        executor.shutdownNow();
    }

    @Test
    void higherPriorityProviderShouldWinEvenWhenItAnswersLast() {
        StubLyricsProvider primary = new StubLyricsProvider("primary", () -> {
            sleep(300);
            return ServiceResult.success("[00:01.00]primary");
        });
        StubLyricsProvider secondary = new StubLyricsProvider("secondary",
                () -> ServiceResult.success("[00:01.00]secondary"));

        OnlineLyricsLookup.Outcome outcome = lookup(primary, secondary).lookup(QUERY);

        assertTrue(outcome.isFound());
        assertEquals("primary", outcome.getProviderName());
        assertEquals("[00:01.00]primary", outcome.getContent());
        assertEquals(1, secondary.calls.get());
    }

    @Test
    void lowerPriorityProviderShouldAnswerWhenHigherOneHasNothing() {
        StubLyricsProvider primary = new StubLyricsProvider("primary", ServiceResult::notFound);
        StubLyricsProvider secondary = new StubLyricsProvider("secondary", () -> ServiceResult.success("text"));

        OnlineLyricsLookup.Outcome outcome = lookup(primary, secondary).lookup(QUERY);

        assertEquals("secondary", outcome.getProviderName());
        assertEquals(1.0, meterRegistry.counter("music.library.lyrics.online",
                "provider", "secondary", "status", "SUCCESS").count());
        assertEquals(1.0, meterRegistry.counter("music.library.lyrics.online",
                "provider", "primary", "status", "SUCCESS_NOT_FOUND").count());
    }

    @Test
    void throwingProviderShouldCountAsTemporaryFailure() {
        StubLyricsProvider primary = new StubLyricsProvider("primary", () -> {
            throw new IllegalStateException("connection reset");
        });
        StubLyricsProvider secondary = new StubLyricsProvider("secondary", () -> ServiceResult.success("text"));

        OnlineLyricsLookup.Outcome outcome = lookup(primary, secondary).lookup(QUERY);

        assertEquals("secondary", outcome.getProviderName());
        assertEquals(1.0, meterRegistry.counter("music.library.lyrics.online",
                "provider", "primary", "status", "TEMPORARY_ERROR").count());
    }

    @Test
    void permanentErrorShouldDisableProviderForLaterLookups() {
        StubLyricsProvider primary = new StubLyricsProvider("primary",
                () -> ServiceResult.permanentError("invalid api key"));
        StubLyricsProvider secondary = new StubLyricsProvider("secondary", ServiceResult::notFound);
        ProviderSessionRegistry registry = registry(primary, secondary);
        OnlineLyricsLookup lookup = new OnlineLyricsLookup(registry, executor, properties, meterProvider());

        OnlineLyricsLookup.Outcome first = lookup.lookup(QUERY);
        OnlineLyricsLookup.Outcome second = lookup.lookup(QUERY);

        assertTrue(first.isAttempted());
        assertFalse(first.isFound());
        assertTrue(registry.isDisabled("primary"));
        assertTrue(second.isAttempted());
        assertEquals(1, primary.calls.get());
        assertEquals(2, secondary.calls.get());
    }

    @Test
    void permanentErrorArrivingAfterTimeoutShouldStillDisableProvider() {
        properties.setOnlineLookupTimeoutSec(1);
        StubLyricsProvider primary = new StubLyricsProvider("primary", () -> {
            sleep(1500);
            return ServiceResult.permanentError("invalid api key");
        });
        StubLyricsProvider secondary = new StubLyricsProvider("secondary", () -> ServiceResult.success("text"));
        ProviderSessionRegistry registry = registry(primary, secondary);
        OnlineLyricsLookup lookup = new OnlineLyricsLookup(registry, executor, properties, meterProvider());

        OnlineLyricsLookup.Outcome outcome = lookup.lookup(QUERY);

        assertEquals("secondary", outcome.getProviderName());
        assertFalse(registry.isDisabled("primary"));
        long deadline = System.currentTimeMillis() + 5000;
        while (!registry.isDisabled("primary") && System.currentTimeMillis() < deadline) {
            sleep(50);
        }
        assertTrue(registry.isDisabled("primary"));
        assertEquals(1.0, meterRegistry.counter("music.library.lyrics.online",
                "provider", "primary", "status", "PERMANENT_ERROR").count());
    }

    @Test
    void lookupShouldNotBeAttemptedWhenDisabledOrWithoutProviders() {
        StubLyricsProvider primary = new StubLyricsProvider("primary", () -> ServiceResult.success("text"));
        properties.setOnlineLyricsEnabled(false);

        assertFalse(lookup(primary).lookup(QUERY).isAttempted());

        properties.setOnlineLyricsEnabled(true);
        properties.setLyricsProviders(Arrays.asList("unregistered"));
        OnlineLyricsLookup withoutProviders = lookup(primary);

        assertFalse(withoutProviders.isAvailable());
        assertFalse(withoutProviders.lookup(QUERY).isAttempted());
        assertEquals(0, primary.calls.get());
    }

    private OnlineLyricsLookup lookup(LyricsProvider... providers) {
        return new OnlineLyricsLookup(registry(providers), executor, properties, meterProvider());
    }

    private ProviderSessionRegistry registry(LyricsProvider... providers) {
        StaticListableBeanFactory beanFactory = new StaticListableBeanFactory();
        for (LyricsProvider provider : providers) {
            beanFactory.addBean(provider.getName(), provider);
        }
        return new ProviderSessionRegistry(properties, beanFactory.getBeanProvider(LyricsProvider.class),
                beanFactory.getBeanProvider(ArtistInfoProvider.class));
    }

    private ObjectProvider<MeterRegistry> meterProvider() {
        StaticListableBeanFactory beanFactory = new StaticListableBeanFactory();
        beanFactory.addBean("meterRegistry", meterRegistry);
        return beanFactory.getBeanProvider(MeterRegistry.class);
    }

    private static void sleep(long millis) {
        try {
            Thread.sleep(millis);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }

    private static final class StubLyricsProvider implements LyricsProvider {

        private final String name;
        private final Supplier<ServiceResult<String>> answer;
        private final AtomicInteger calls = new AtomicInteger();

        private StubLyricsProvider(String name, Supplier<ServiceResult<String>> answer) {
            this.name = name;
            this.answer = answer;
        }

        @Override
        public String getName() {
            return name;
        }

        @Override
        public ServiceResult<String> searchLyrics(LyricsQuery query) {
            calls.incrementAndGet();
            return answer.get();
        }
    }
}

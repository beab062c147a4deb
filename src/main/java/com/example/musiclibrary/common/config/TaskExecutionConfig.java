package com.example.musiclibrary.common.config;

import java.util.concurrent.ExecutorService;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.ThreadPoolExecutor;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import javax.annotation.PreDestroy;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class TaskExecutionConfig {

    private ExecutorService libraryTaskExecutor;
    private ExecutorService providerLookupExecutor;

    /**
     * Runs folder rescans, library refreshes and the artist metadata backfill.
     */
    @Bean
    public ExecutorService libraryTaskExecutor(AppLibraryProperties appLibraryProperties) {
        int core = Math.max(1, Math.min(4, appLibraryProperties.getTaskThreadCount()));
        this.libraryTaskExecutor = new ThreadPoolExecutor(
                core,
                core,
                60L,
                TimeUnit.SECONDS,
                new LinkedBlockingQueue<>(64),
                new NamedThreadFactory("library-task-"),
                new ThreadPoolExecutor.AbortPolicy());
        return this.libraryTaskExecutor;
    }

    /**
     * Runs concurrent online provider lookups.
     */
    @Bean
    public ExecutorService providerLookupExecutor(AppLibraryProperties appLibraryProperties) {
        int core = Math.max(1, appLibraryProperties.getProviderThreadCount());
        this.providerLookupExecutor = new ThreadPoolExecutor(
                core,
                core * 2,
                60L,
                TimeUnit.SECONDS,
                new LinkedBlockingQueue<>(128),
                new NamedThreadFactory("provider-lookup-"),
                new ThreadPoolExecutor.CallerRunsPolicy());
        return this.providerLookupExecutor;
    }

    @PreDestroy
    public void shutdown() {
        if (libraryTaskExecutor != null) {
            libraryTaskExecutor.shutdown();
        }
        if (providerLookupExecutor != null) {
            providerLookupExecutor.shutdown();
        }
    }

    private static class NamedThreadFactory implements ThreadFactory {

        private final AtomicInteger idx = new AtomicInteger(1);
        private final String prefix;

        private NamedThreadFactory(String prefix) {
            this.prefix = prefix;
        }

        @Override
        public Thread newThread(Runnable r) {
            Thread thread = new Thread(r, prefix + idx.getAndIncrement());
            thread.setDaemon(true);
            return thread;
        }
    }
}

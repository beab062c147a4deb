package com.example.musiclibrary.application.job;

import com.example.musiclibrary.application.service.LibraryScanService;
import com.example.musiclibrary.common.config.AppLibraryProperties;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Service;

@Service
public class LibraryRefreshJob {

    private static final Logger log = LoggerFactory.getLogger(LibraryRefreshJob.class);

    private final AppLibraryProperties appLibraryProperties;
    private final LibraryScanService libraryScanService;

    public LibraryRefreshJob(AppLibraryProperties appLibraryProperties, LibraryScanService libraryScanService) {
        this.appLibraryProperties = appLibraryProperties;
        this.libraryScanService = libraryScanService;
    }

    @Scheduled(cron = "${app.library.refresh-cron:0 30 3 * * ?}")
    public void run() {
        if (!appLibraryProperties.isRefreshEnabled()) {
            log.debug("Library refresh skipped: disabled");
            return;
        }
        try {
            boolean submitted = libraryScanService.submitRefreshAll();
            log.info("Library refresh schedule triggered, submitted={}, cron={}",
                    submitted, appLibraryProperties.getRefreshCron());
        } catch (Exception e) {
            log.warn("Library refresh submit failed unexpectedly", e);
        }
    }
}

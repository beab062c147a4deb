package com.example.musiclibrary.application.service;

import com.example.musiclibrary.common.exception.BusinessException;
import com.example.musiclibrary.infrastructure.persistence.entity.FolderEntity;
import com.example.musiclibrary.infrastructure.persistence.mapper.FolderMapper;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.atomic.AtomicBoolean;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

/**
 * Runs rescans and library refreshes on the background executor. Each run owns a cancel flag that the
 * engine polls between files.
 */
@Service
public class LibraryScanService {

    private static final Logger log = LoggerFactory.getLogger(LibraryScanService.class);

    private final LibrarySyncEngine librarySyncEngine;
    private final FolderMapper folderMapper;
    private final SingleFlightGuard singleFlightGuard;
    private final ExecutorService libraryTaskExecutor;

    private final Map<String, AtomicBoolean> cancelFlags = new ConcurrentHashMap<>();

    public LibraryScanService(LibrarySyncEngine librarySyncEngine,
                              FolderMapper folderMapper,
                              SingleFlightGuard singleFlightGuard,
                              @Qualifier("libraryTaskExecutor") ExecutorService libraryTaskExecutor) {
        this.librarySyncEngine = librarySyncEngine;
        this.folderMapper = folderMapper;
        this.singleFlightGuard = singleFlightGuard;
        this.libraryTaskExecutor = libraryTaskExecutor;
    }

    /**
     * Adds a folder and, when asked, queues its first scan.
     */
    public FolderEntity addFolder(String path, String name, boolean scanNow) {
        FolderEntity folder = librarySyncEngine.addFolder(path, name);
        if (scanNow) {
            submitRescan(folder.getId());
        }
        return folder;
    }

    /**
     * @return false when a rescan of the folder is already queued or running
     */
    public boolean submitRescan(Long folderId) {
        if (folderId == null || folderMapper.selectById(folderId) == null) {
            throw BusinessException.notFound("目录不存在或已移除");
        }
        String key = SingleFlightGuard.folderKey(folderId);
        return submit(key, cancelFlag -> {
            SyncResult result = librarySyncEngine.rescanFolder(folderId, cancelFlag::get);
            log.info("RESCAN_TASK_RESULT folderId={} result={}", folderId, result);
        });
    }

    /**
     * @return false when a refresh is already queued or running
     */
    public boolean submitRefreshAll() {
        return submit(SingleFlightGuard.LIBRARY_KEY, cancelFlag -> {
            SyncResult result = librarySyncEngine.refreshAllFolders(cancelFlag::get);
            log.info("REFRESH_TASK_RESULT result={}", result);
        });
    }

    /**
     * @return false when no rescan of the folder is queued or running
     */
    public boolean cancelRescan(Long folderId) {
        return cancel(SingleFlightGuard.folderKey(folderId));
    }

    public boolean cancelRefreshAll() {
        return cancel(SingleFlightGuard.LIBRARY_KEY);
    }

    public boolean isRunning(Long folderId) {
        String key = SingleFlightGuard.folderKey(folderId);
        return cancelFlags.containsKey(key) || singleFlightGuard.isInFlight(key);
    }

    private boolean submit(String key, ScanTask task) {
        if (singleFlightGuard.isInFlight(key)) {
            log.info("SCAN_TASK_SKIPPED key={} reason=in-flight", key);
            return false;
        }
        AtomicBoolean cancelFlag = new AtomicBoolean(false);
        if (cancelFlags.putIfAbsent(key, cancelFlag) != null) {
            log.info("SCAN_TASK_SKIPPED key={} reason=queued", key);
            return false;
        }
        try {
            libraryTaskExecutor.submit(() -> {
                try {
                    task.run(cancelFlag);
                } catch (Exception e) {
                    log.error("SCAN_TASK_FAILED key={}", key, e);
                } finally {
                    cancelFlags.remove(key, cancelFlag);
                }
            });
        } catch (RejectedExecutionException e) {
            cancelFlags.remove(key, cancelFlag);
            throw e;
        }
        log.info("SCAN_TASK_SUBMITTED key={}", key);
        return true;
    }

    private boolean cancel(String key) {
        AtomicBoolean cancelFlag = cancelFlags.get(key);
        if (cancelFlag == null) {
            log.info("SCAN_TASK_CANCEL_IGNORED key={}", key);
            return false;
        }
        cancelFlag.set(true);
        log.info("SCAN_TASK_CANCELED key={}", key);
        return true;
    }

    @FunctionalInterface
    private interface ScanTask {

        void run(AtomicBoolean cancelFlag);
    }
}

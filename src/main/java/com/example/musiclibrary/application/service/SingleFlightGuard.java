package com.example.musiclibrary.application.service;

import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import org.springframework.stereotype.Component;

/**
 * Per-key in-flight flags. A caller that finds its key taken gets nothing back instead of waiting.
 */
@Component
public class SingleFlightGuard {

    public static final String LIBRARY_KEY = "library";

    private final Set<String> inFlight = ConcurrentHashMap.newKeySet();

    public static String folderKey(Long folderId) {
        return "folder:" + folderId;
    }

    public static String artistKey(Long artistId) {
        return "artist:" + artistId;
    }

    public boolean tryAcquire(String key) {
        return inFlight.add(key);
    }

    public void release(String key) {
        inFlight.remove(key);
    }

    public boolean isInFlight(String key) {
        return inFlight.contains(key);
    }

    /**
     * Runs {@code work} unless another caller holds {@code key}.
     *
     * @return false when the key was already held and nothing ran
     */
    public boolean runIfIdle(String key, Runnable work) {
        if (!tryAcquire(key)) {
            return false;
        }
        try {
            work.run();
            return true;
        } finally {
            release(key);
        }
    }
}

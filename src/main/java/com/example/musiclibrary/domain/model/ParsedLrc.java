package com.example.musiclibrary.domain.model;

import java.util.Collections;
import java.util.List;

/**
 * Timed lyric lines sorted by start time, plus the global {@code [offset:]} of the file.
 */
public class ParsedLrc {

    private static final ParsedLrc EMPTY = new ParsedLrc(Collections.emptyList(), 0L);

    private final List<LyricLine> lines;
    private final long offsetMs;

    public ParsedLrc(List<LyricLine> sortedLines, long offsetMs) {
        this.lines = Collections.unmodifiableList(sortedLines);
        this.offsetMs = offsetMs;
    }

    public static ParsedLrc empty() {
        return EMPTY;
    }

    public List<LyricLine> getLines() {
        return lines;
    }

    public long getOffsetMs() {
        return offsetMs;
    }

    public boolean isEmpty() {
        return lines.isEmpty();
    }

    /**
     * Index of the line active at {@code positionMs}: the last line starting at or before it, the first line
     * when the position precedes all lines. Returns -1 only when there are no lines.
     */
    public int findLineIndex(long positionMs) {
        if (lines.isEmpty()) {
            return -1;
        }
        long t = positionMs + offsetMs;
        int lo = 0;
        int hi = lines.size() - 1;
        int ans = 0;
        while (lo <= hi) {
            int mid = (lo + hi) >>> 1;
            if (lines.get(mid).getStartMs() <= t) {
                ans = mid;
                lo = mid + 1;
            } else {
                hi = mid - 1;
            }
        }
        return ans;
    }

    /**
     * Same result as {@link #findLineIndex(long)}, but first checks the hinted line and its neighbours, which
     * covers normal playback where the position only moves forward a little between calls.
     */
    public int findLineIndex(long positionMs, int hintIndex) {
        if (lines.isEmpty()) {
            return -1;
        }
        if (hintIndex < 0 || hintIndex >= lines.size()) {
            return findLineIndex(positionMs);
        }
        long t = positionMs + offsetMs;
        if (isActiveAt(hintIndex, t)) {
            return hintIndex;
        }
        int next = hintIndex + 1;
        if (next < lines.size() && isActiveAt(next, t)) {
            return next;
        }
        int previous = hintIndex - 1;
        if (previous >= 0 && isActiveAt(previous, t)) {
            return previous;
        }
        return findLineIndex(positionMs);
    }

    public LyricLine lineAt(long positionMs) {
        int index = findLineIndex(positionMs);
        return index < 0 ? null : lines.get(index);
    }

    private boolean isActiveAt(int index, long t) {
        boolean started = index == 0 || lines.get(index).getStartMs() <= t;
        boolean notEnded = index == lines.size() - 1 || lines.get(index + 1).getStartMs() > t;
        return started && notEnded;
    }
}

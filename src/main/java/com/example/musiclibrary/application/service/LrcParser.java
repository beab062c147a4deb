package com.example.musiclibrary.application.service;

import com.example.musiclibrary.domain.model.LyricLine;
import com.example.musiclibrary.domain.model.ParsedLrc;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import org.springframework.stereotype.Component;

/**
 * Parses LRC text. A line may carry several timestamps ({@code [00:12.30][01:02.00]text}); lines without a
 * timestamp and metadata tags other than {@code [offset:]} are ignored.
 */
@Component
public class LrcParser {

    private static final Pattern OFFSET_TAG = Pattern.compile("^\\[offset:\\s*([+-]?\\d+)\\s*]$", Pattern.CASE_INSENSITIVE);

    public ParsedLrc parse(String lrcText) {
        if (lrcText == null || lrcText.trim().isEmpty()) {
            return ParsedLrc.empty();
        }
        List<LyricLine> lines = new ArrayList<>();
        long offsetMs = 0L;
        for (String raw : lrcText.split("\\r?\\n|\\r")) {
            String line = raw.trim();
            if (line.isEmpty()) {
                continue;
            }
            Matcher offset = OFFSET_TAG.matcher(line);
            if (offset.matches()) {
                offsetMs = Long.parseLong(offset.group(1));
                continue;
            }
            List<Long> stamps = new ArrayList<>();
            int idx = 0;
            while (idx < line.length() && line.charAt(idx) == '[') {
                int end = line.indexOf(']', idx + 1);
                if (end < 0) {
                    break;
                }
                Long stamp = parseTimestamp(line.substring(idx + 1, end));
                if (stamp == null) {
                    break;
                }
                stamps.add(stamp);
                idx = end + 1;
            }
            if (stamps.isEmpty()) {
                continue;
            }
            String text = line.substring(idx).trim();
            for (Long stamp : stamps) {
                lines.add(new LyricLine(stamp, text));
            }
        }
        // stable sort keeps file order for lines sharing a timestamp
        lines.sort(Comparator.comparingLong(LyricLine::getStartMs));
        return new ParsedLrc(lines, offsetMs);
    }

    /**
     * Accepts {@code mm:ss}, {@code mm:ss.f}, {@code mm:ss.ff}, {@code mm:ss.fff} and {@code hh:mm:ss.ff}; a
     * comma works as decimal separator.
     */
    static Long parseTimestamp(String tag) {
        String[] parts = tag.trim().split(":");
        if (parts.length < 2 || parts.length > 3) {
            return null;
        }
        try {
            int start = 0;
            long hours = 0;
            if (parts.length == 3) {
                hours = Long.parseLong(parts[0]);
                start = 1;
            }
            long minutes = Long.parseLong(parts[start]);
            String secPart = parts[start + 1];
            int dot = secPart.indexOf('.') >= 0 ? secPart.indexOf('.') : secPart.indexOf(',');
            long seconds;
            long millis = 0;
            if (dot >= 0) {
                seconds = Long.parseLong(secPart.substring(0, dot));
                String frac = secPart.substring(dot + 1);
                if (frac.length() >= 3) {
                    millis = Long.parseLong(frac.substring(0, 3));
                } else if (frac.length() == 2) {
                    millis = Long.parseLong(frac) * 10;
                } else if (frac.length() == 1) {
                    millis = Long.parseLong(frac) * 100;
                }
            } else {
                seconds = Long.parseLong(secPart);
            }
            if (minutes < 0 || seconds < 0 || hours < 0) {
                return null;
            }
            return (hours * 3600L + minutes * 60L + seconds) * 1000L + millis;
        } catch (NumberFormatException e) {
            return null;
        }
    }
}

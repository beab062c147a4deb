package com.example.musiclibrary.infrastructure.parser;

import com.example.musiclibrary.common.config.AppLibraryProperties;
import com.example.musiclibrary.domain.enumtype.ExtractionFailureReason;
import com.example.musiclibrary.domain.model.AudioMetadata;
import com.example.musiclibrary.domain.model.EmbeddedPicture;
import java.io.File;
import java.io.IOException;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.logging.Level;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import org.jaudiotagger.audio.AudioFile;
import org.jaudiotagger.audio.AudioFileIO;
import org.jaudiotagger.audio.AudioHeader;
import org.jaudiotagger.audio.exceptions.CannotReadException;
import org.jaudiotagger.audio.exceptions.InvalidAudioFrameException;
import org.jaudiotagger.audio.exceptions.ReadOnlyFileException;
import org.jaudiotagger.tag.FieldKey;
import org.jaudiotagger.tag.Tag;
import org.jaudiotagger.tag.TagException;
import org.jaudiotagger.tag.images.Artwork;
import org.springframework.stereotype.Component;

@Component
public class JaudiotaggerAudioMetadataParser implements AudioMetadataParser {

    private static final Pattern FIRST_INTEGER_PATTERN = Pattern.compile("(\\d+)");
    private static final Pattern FIRST_DECIMAL_PATTERN = Pattern.compile("([-+]?\\d+(?:[.,]\\d+)?)");

    // jaudiotagger reports every odd frame through java.util.logging at INFO
    private static final java.util.logging.Logger JAUDIOTAGGER_LOGGER =
            java.util.logging.Logger.getLogger("org.jaudiotagger");

    static {
        JAUDIOTAGGER_LOGGER.setLevel(Level.WARNING);
    }

    private final AppLibraryProperties appLibraryProperties;

    public JaudiotaggerAudioMetadataParser(AppLibraryProperties appLibraryProperties) {
        this.appLibraryProperties = appLibraryProperties;
    }

    @Override
    public AudioMetadata parse(File audioFile) throws AudioMetadataParseException {
        AudioFile parsed;
        try {
            parsed = AudioFileIO.read(audioFile);
        } catch (CannotReadException e) {
            throw new AudioMetadataParseException(classifyCannotRead(e), e.getMessage(), e);
        } catch (IOException | TagException | ReadOnlyFileException | InvalidAudioFrameException
                 | RuntimeException e) {
            throw new AudioMetadataParseException(ExtractionFailureReason.CORRUPT_FILE, e.getMessage(), e);
        }
        Tag tag = parsed.getTag();
        AudioHeader header = parsed.getAudioHeader();

        AudioMetadata metadata = new AudioMetadata();
        metadata.setTitle(safeTagValue(tag, FieldKey.TITLE));
        metadata.setArtists(splitArtists(safeTagValues(tag, FieldKey.ARTIST)));
        metadata.setAlbumArtists(splitArtists(safeTagValues(tag, FieldKey.ALBUM_ARTIST)));
        metadata.setAlbum(safeTagValue(tag, FieldKey.ALBUM));
        metadata.setTrackNo(parseInteger(safeTagValue(tag, FieldKey.TRACK)));
        metadata.setDiscNo(parseInteger(safeTagValue(tag, FieldKey.DISC_NO)));
        metadata.setYear(parseInteger(safeTagValue(tag, FieldKey.YEAR)));
        metadata.setGenres(distinct(safeTagValues(tag, FieldKey.GENRE)));
        metadata.setLyrics(safeTagValue(tag, FieldKey.LYRICS));
        metadata.setReplayGainTrackGain(parseDecimal(safeRawValue(tag, "REPLAYGAIN_TRACK_GAIN")));
        metadata.setReplayGainTrackPeak(parseDecimal(safeRawValue(tag, "REPLAYGAIN_TRACK_PEAK")));

        if (header != null) {
            metadata.setDurationSec(header.getTrackLength());
            metadata.setBitrate(parseInteger(header.getBitRate()));
            metadata.setSampleRate(parseInteger(header.getSampleRate()));
            metadata.setChannels(parseInteger(header.getChannels()));
        }

        metadata.setEmbeddedPictures(readPictures(tag));
        return metadata;
    }

    private ExtractionFailureReason classifyCannotRead(CannotReadException e) {
        String message = e.getMessage();
        if (message != null && message.contains("No Reader associated with this extension")) {
            return ExtractionFailureReason.UNSUPPORTED_FORMAT;
        }
        return ExtractionFailureReason.CORRUPT_FILE;
    }

    private List<EmbeddedPicture> readPictures(Tag tag) {
        if (tag == null) {
            return new ArrayList<>();
        }
        List<EmbeddedPicture> pictures = new ArrayList<>();
        List<Artwork> artworks;
        try {
            artworks = tag.getArtworkList();
        } catch (RuntimeException e) {
            return pictures;
        }
        if (artworks == null) {
            return pictures;
        }
        for (Artwork artwork : artworks) {
            byte[] data = artwork.getBinaryData();
            if (data != null && data.length > 0) {
                pictures.add(new EmbeddedPicture(data, artwork.getMimeType()));
            }
        }
        return pictures;
    }

    List<String> splitArtists(List<String> rawValues) {
        Set<String> names = new LinkedHashSet<>();
        for (String raw : rawValues) {
            List<String> parts = Collections.singletonList(raw);
            for (String separator : appLibraryProperties.getArtistSeparators()) {
                if (separator == null || separator.isEmpty()) {
                    continue;
                }
                List<String> next = new ArrayList<>();
                for (String part : parts) {
                    for (String piece : part.split(Pattern.quote(separator))) {
                        next.add(piece);
                    }
                }
                parts = next;
            }
            for (String part : parts) {
                String trimmed = part.trim();
                if (!trimmed.isEmpty()) {
                    names.add(trimmed);
                }
            }
        }
        return new ArrayList<>(names);
    }

    private List<String> distinct(List<String> values) {
        return new ArrayList<>(new LinkedHashSet<>(values));
    }

    private List<String> safeTagValues(Tag tag, FieldKey fieldKey) {
        List<String> values = new ArrayList<>();
        if (tag == null) {
            return values;
        }
        List<String> raw;
        try {
            raw = tag.getAll(fieldKey);
        } catch (RuntimeException e) {
            return values;
        }
        if (raw == null) {
            return values;
        }
        for (String value : raw) {
            if (value != null && !value.trim().isEmpty()) {
                values.add(value.trim());
            }
        }
        return values;
    }

    private String safeTagValue(Tag tag, FieldKey fieldKey) {
        if (tag == null) {
            return null;
        }
        String value;
        try {
            value = tag.getFirst(fieldKey);
        } catch (RuntimeException e) {
            return null;
        }
        if (value == null) {
            return null;
        }
        String trimmed = value.trim();
        return trimmed.isEmpty() ? null : trimmed;
    }

    private String safeRawValue(Tag tag, String id) {
        if (tag == null) {
            return null;
        }
        try {
            String value = tag.getFirst(id);
            return value == null || value.trim().isEmpty() ? null : value.trim();
        } catch (RuntimeException e) {
            return null;
        }
    }

    private Integer parseInteger(String raw) {
        if (raw == null || raw.trim().isEmpty()) {
            return null;
        }
        Matcher matcher = FIRST_INTEGER_PATTERN.matcher(raw);
        if (!matcher.find()) {
            return null;
        }
        try {
            return Integer.parseInt(matcher.group(1));
        } catch (NumberFormatException e) {
            return null;
        }
    }

    private Double parseDecimal(String raw) {
        if (raw == null) {
            return null;
        }
        Matcher matcher = FIRST_DECIMAL_PATTERN.matcher(raw);
        if (!matcher.find()) {
            return null;
        }
        try {
            return Double.parseDouble(matcher.group(1).replace(',', '.'));
        } catch (NumberFormatException e) {
            return null;
        }
    }
}

package com.example.musiclibrary.infrastructure.parser;

import com.example.musiclibrary.domain.model.AudioMetadata;
import java.io.File;

public interface AudioMetadataParser {

    /**
     * Reads tags and stream properties of an audio file.
     *
     * @throws AudioMetadataParseException when the file is corrupt or its format is not supported
     */
    AudioMetadata parse(File audioFile) throws AudioMetadataParseException;
}

package com.example.musiclibrary.infrastructure.parser;

import com.example.musiclibrary.domain.enumtype.ExtractionFailureReason;

public class AudioMetadataParseException extends Exception {

    private final ExtractionFailureReason reason;

    public AudioMetadataParseException(ExtractionFailureReason reason, String message, Throwable cause) {
        super(message, cause);
        this.reason = reason;
    }

    public ExtractionFailureReason getReason() {
        return reason;
    }
}

package com.example.musiclibrary.domain.model;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class LyricsQuery {

    private String title;

    private String artist;

    private String album;

    private Integer durationSec;
}

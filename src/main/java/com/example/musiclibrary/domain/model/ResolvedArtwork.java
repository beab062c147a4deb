package com.example.musiclibrary.domain.model;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class ResolvedArtwork {

    private String coverArtUri;

    private String lightSwatch;

    private String darkSwatch;

    private boolean fromDirectory;
}

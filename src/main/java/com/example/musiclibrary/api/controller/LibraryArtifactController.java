package com.example.musiclibrary.api.controller;

import com.example.musiclibrary.api.response.ApiResponse;
import com.example.musiclibrary.api.response.ArtistImageResponse;
import com.example.musiclibrary.api.response.LyricsResponse;
import com.example.musiclibrary.application.service.ArtistMetadataBackfillService;
import com.example.musiclibrary.application.service.LibraryArtifactService;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/api/v1/library")
public class LibraryArtifactController {

    private final LibraryArtifactService libraryArtifactService;
    private final ArtistMetadataBackfillService artistMetadataBackfillService;

    public LibraryArtifactController(LibraryArtifactService libraryArtifactService,
                                     ArtistMetadataBackfillService artistMetadataBackfillService) {
        this.libraryArtifactService = libraryArtifactService;
        this.artistMetadataBackfillService = artistMetadataBackfillService;
    }

    @GetMapping("/songs/{id}/lyrics")
    public ApiResponse<LyricsResponse> getLyrics(@PathVariable("id") Long id,
                                                 @RequestParam(value = "positionMs", required = false) Long positionMs) {
        return ApiResponse.success(libraryArtifactService.getLyrics(id, positionMs));
    }

    @PostMapping("/artists/{id}/image/resolve")
    public ApiResponse<ArtistImageResponse> resolveArtistImage(@PathVariable("id") Long id) {
        return ApiResponse.success(libraryArtifactService.resolveArtistImage(id));
    }

    @PostMapping("/artists/backfill")
    public ApiResponse<String> startArtistBackfill() {
        boolean started = artistMetadataBackfillService.startBackfill();
        return ApiResponse.success(started ? "SUBMITTED" : "SKIPPED");
    }
}

package com.example.musiclibrary.api.controller;

import com.example.musiclibrary.api.request.ArtistNameRequest;
import com.example.musiclibrary.api.request.ArtistOrderRequest;
import com.example.musiclibrary.api.response.ApiResponse;
import com.example.musiclibrary.application.service.LibraryWriter;
import javax.validation.Valid;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/api/v1/library")
public class ArtistRelationController {

    private final LibraryWriter libraryWriter;

    public ArtistRelationController(LibraryWriter libraryWriter) {
        this.libraryWriter = libraryWriter;
    }

    @PostMapping("/songs/{id}/artists")
    public ApiResponse<String> addSongArtist(@PathVariable("id") Long id,
                                             @Valid @RequestBody ArtistNameRequest request) {
        libraryWriter.addSongArtist(id, request.getName());
        return ApiResponse.success("ADDED");
    }

    @DeleteMapping("/songs/{id}/artists/{artistId}")
    public ApiResponse<String> removeSongArtist(@PathVariable("id") Long id,
                                                @PathVariable("artistId") Long artistId) {
        libraryWriter.removeSongArtist(id, artistId);
        return ApiResponse.success("REMOVED");
    }

    @PutMapping("/songs/{id}/artists/order")
    public ApiResponse<String> reorderSongArtists(@PathVariable("id") Long id,
                                                  @Valid @RequestBody ArtistOrderRequest request) {
        libraryWriter.reorderSongArtists(id, request.getArtistIds());
        return ApiResponse.success("REORDERED");
    }

    @PostMapping("/albums/{id}/artists")
    public ApiResponse<String> addAlbumArtist(@PathVariable("id") Long id,
                                              @Valid @RequestBody ArtistNameRequest request) {
        libraryWriter.addAlbumArtist(id, request.getName());
        return ApiResponse.success("ADDED");
    }

    @DeleteMapping("/albums/{id}/artists/{artistId}")
    public ApiResponse<String> removeAlbumArtist(@PathVariable("id") Long id,
                                                 @PathVariable("artistId") Long artistId) {
        libraryWriter.removeAlbumArtist(id, artistId);
        return ApiResponse.success("REMOVED");
    }

    @PutMapping("/albums/{id}/artists/order")
    public ApiResponse<String> reorderAlbumArtists(@PathVariable("id") Long id,
                                                   @Valid @RequestBody ArtistOrderRequest request) {
        libraryWriter.reorderAlbumArtists(id, request.getArtistIds());
        return ApiResponse.success("REORDERED");
    }
}

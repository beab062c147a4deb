package com.example.musiclibrary.api.controller;

import com.example.musiclibrary.api.request.AddFolderRequest;
import com.example.musiclibrary.api.response.ApiResponse;
import com.example.musiclibrary.api.response.FolderResponse;
import com.example.musiclibrary.application.service.LibraryScanService;
import com.example.musiclibrary.application.service.LibrarySyncEngine;
import com.example.musiclibrary.infrastructure.persistence.entity.FolderEntity;
import java.util.ArrayList;
import java.util.List;
import javax.validation.Valid;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/api/v1/library/folders")
public class LibraryFolderController {

    private final LibrarySyncEngine librarySyncEngine;
    private final LibraryScanService libraryScanService;

    public LibraryFolderController(LibrarySyncEngine librarySyncEngine, LibraryScanService libraryScanService) {
        this.librarySyncEngine = librarySyncEngine;
        this.libraryScanService = libraryScanService;
    }

    @GetMapping
    public ApiResponse<List<FolderResponse>> listFolders() {
        List<FolderResponse> folders = new ArrayList<>();
        for (FolderEntity folder : librarySyncEngine.listFolders()) {
            folders.add(toResponse(folder));
        }
        return ApiResponse.success(folders);
    }

    @PostMapping
    public ApiResponse<FolderResponse> addFolder(@Valid @RequestBody AddFolderRequest request) {
        FolderEntity folder = libraryScanService.addFolder(request.getPath(), request.getName(),
                !Boolean.FALSE.equals(request.getScanNow()));
        return ApiResponse.success(toResponse(folder));
    }

    @DeleteMapping("/{id}")
    public ApiResponse<String> removeFolder(@PathVariable("id") Long id) {
        librarySyncEngine.removeFolder(id);
        return ApiResponse.success("DELETED");
    }

    @PostMapping("/{id}/rescan")
    public ApiResponse<String> rescanFolder(@PathVariable("id") Long id) {
        boolean submitted = libraryScanService.submitRescan(id);
        return ApiResponse.success(submitted ? "SUBMITTED" : "ALREADY_RUNNING");
    }

    @PostMapping("/{id}/rescan/cancel")
    public ApiResponse<String> cancelRescan(@PathVariable("id") Long id) {
        if (!libraryScanService.cancelRescan(id)) {
            return ApiResponse.fail("404", "没有正在进行的扫描");
        }
        return ApiResponse.success("CANCELED");
    }

    @PostMapping("/refresh")
    public ApiResponse<String> refreshAll() {
        boolean submitted = libraryScanService.submitRefreshAll();
        return ApiResponse.success(submitted ? "SUBMITTED" : "ALREADY_RUNNING");
    }

    @PostMapping("/refresh/cancel")
    public ApiResponse<String> cancelRefresh() {
        if (!libraryScanService.cancelRefreshAll()) {
            return ApiResponse.fail("404", "没有正在进行的刷新");
        }
        return ApiResponse.success("CANCELED");
    }

    private FolderResponse toResponse(FolderEntity folder) {
        return new FolderResponse(folder.getId(), folder.getPath(), folder.getName(), folder.getLastModifiedDate(),
                libraryScanService.isRunning(folder.getId()));
    }
}

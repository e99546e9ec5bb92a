package com.example.musiccollection.api.controller;

import com.example.musiccollection.api.response.ApiResponse;
import com.example.musiccollection.api.response.IndexedTrackResponse;
import com.example.musiccollection.api.response.LibraryTrackResponse;
import com.example.musiccollection.api.response.PageResponse;
import com.example.musiccollection.application.service.TrackQueryService;
import java.util.List;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/api/v1/tracks")
public class TrackController {

    private final TrackQueryService trackQueryService;

    public TrackController(TrackQueryService trackQueryService) {
        this.trackQueryService = trackQueryService;
    }

    @GetMapping
    public ApiResponse<PageResponse<IndexedTrackResponse>> listTracks(
            @RequestParam(value = "pageNo", defaultValue = "1") int pageNo,
            @RequestParam(value = "pageSize", defaultValue = "50") int pageSize,
            @RequestParam(value = "keyword", required = false) String keyword,
            @RequestParam(value = "source", required = false) String source) {
        return ApiResponse.success(trackQueryService.listTracks(pageNo, pageSize, keyword, source));
    }

    @GetMapping("/library")
    public ApiResponse<List<LibraryTrackResponse>> listAlbumTracks(
            @RequestParam("album") String album,
            @RequestParam(value = "albumArtist", required = false) String albumArtist) {
        return ApiResponse.success(trackQueryService.listAlbumTracks(album, albumArtist));
    }
}

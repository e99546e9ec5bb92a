package com.example.musiccollection.api.controller;

import com.example.musiccollection.api.response.AlbumPlayCountResponse;
import com.example.musiccollection.api.response.ApiResponse;
import com.example.musiccollection.api.response.StatsOverviewResponse;
import com.example.musiccollection.application.service.StatsService;
import java.util.List;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/api/v1/stats")
public class StatsController {

    private final StatsService statsService;

    public StatsController(StatsService statsService) {
        this.statsService = statsService;
    }

    @GetMapping("/overview")
    public ApiResponse<StatsOverviewResponse> overview() {
        return ApiResponse.success(statsService.overview());
    }

    @GetMapping("/play-counts")
    public ApiResponse<List<AlbumPlayCountResponse>> playCounts(
            @RequestParam(value = "limit", required = false) Integer limit) {
        return ApiResponse.success(statsService.topPlayedAlbums(limit));
    }
}

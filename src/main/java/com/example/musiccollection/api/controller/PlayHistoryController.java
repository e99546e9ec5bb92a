package com.example.musiccollection.api.controller;

import com.example.musiccollection.api.request.PlayedAtRequest;
import com.example.musiccollection.api.response.ApiResponse;
import com.example.musiccollection.api.response.PageResponse;
import com.example.musiccollection.api.response.PlayHistoryResponse;
import com.example.musiccollection.application.service.CollectionUpdateService;
import com.example.musiccollection.application.service.TrackQueryService;
import javax.validation.Valid;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/api/v1/play-history")
public class PlayHistoryController {

    private final CollectionUpdateService collectionUpdateService;
    private final TrackQueryService trackQueryService;

    public PlayHistoryController(CollectionUpdateService collectionUpdateService,
                                 TrackQueryService trackQueryService) {
        this.collectionUpdateService = collectionUpdateService;
        this.trackQueryService = trackQueryService;
    }

    @GetMapping
    public ApiResponse<PageResponse<PlayHistoryResponse>> listPlays(
            @RequestParam(value = "pageNo", defaultValue = "1") int pageNo,
            @RequestParam(value = "pageSize", defaultValue = "50") int pageSize,
            @RequestParam(value = "keyword", required = false) String keyword) {
        return ApiResponse.success(trackQueryService.listPlayHistory(pageNo, pageSize, keyword));
    }

    @PutMapping("/{id}/played-at")
    public ApiResponse<String> updatePlayedAt(@PathVariable("id") Long id,
                                              @Valid @RequestBody PlayedAtRequest request) {
        collectionUpdateService.updatePlayedAt(id, request.getPlayedAt());
        return ApiResponse.success("UPDATED");
    }
}

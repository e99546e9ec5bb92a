package com.example.musiccollection.api.controller;

import com.example.musiccollection.api.response.AlbumSearchResponse;
import com.example.musiccollection.api.response.ApiResponse;
import com.example.musiccollection.api.response.PageResponse;
import com.example.musiccollection.application.service.SearchService;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/api/v1/search")
public class SearchController {

    private final SearchService searchService;

    public SearchController(SearchService searchService) {
        this.searchService = searchService;
    }

    @GetMapping
    public ApiResponse<PageResponse<AlbumSearchResponse>> search(
            @RequestParam("q") String keyword,
            @RequestParam(value = "source", defaultValue = "all") String source,
            @RequestParam(value = "pageNo", defaultValue = "1") int pageNo,
            @RequestParam(value = "pageSize", defaultValue = "50") int pageSize) {
        return ApiResponse.success(searchService.search(keyword, source, pageNo, pageSize));
    }
}

package com.example.musiccollection.api.controller;

import com.example.musiccollection.api.request.ListeningHistoryRequest;
import com.example.musiccollection.api.response.ApiResponse;
import com.example.musiccollection.api.response.ListeningHistoryResponse;
import com.example.musiccollection.api.response.PageResponse;
import com.example.musiccollection.application.service.ListeningHistoryService;
import javax.validation.Valid;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/api/v1/listening-history")
public class ListeningHistoryController {

    private final ListeningHistoryService listeningHistoryService;

    public ListeningHistoryController(ListeningHistoryService listeningHistoryService) {
        this.listeningHistoryService = listeningHistoryService;
    }

    @GetMapping
    public ApiResponse<PageResponse<ListeningHistoryResponse>> list(
            @RequestParam(value = "pageNo", defaultValue = "1") int pageNo,
            @RequestParam(value = "pageSize", defaultValue = "50") int pageSize) {
        return ApiResponse.success(listeningHistoryService.list(pageNo, pageSize));
    }

    @PostMapping
    public ApiResponse<ListeningHistoryResponse> record(@Valid @RequestBody ListeningHistoryRequest request) {
        return ApiResponse.success(listeningHistoryService.record(request));
    }
}

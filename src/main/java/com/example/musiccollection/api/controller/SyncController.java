package com.example.musiccollection.api.controller;

import com.example.musiccollection.api.request.SyncRunRequest;
import com.example.musiccollection.api.response.ApiResponse;
import com.example.musiccollection.api.response.SyncSourceStatusResponse;
import com.example.musiccollection.application.service.CollectionQueryService;
import com.example.musiccollection.application.service.SyncOrchestrator;
import com.example.musiccollection.common.exception.BusinessException;
import com.example.musiccollection.domain.enumtype.SyncSourceId;
import com.example.musiccollection.domain.model.RunReport;
import java.util.EnumSet;
import java.util.List;
import java.util.Set;
import javax.validation.Valid;
import org.springframework.http.HttpStatus;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/api/v1/sync")
public class SyncController {

    private final SyncOrchestrator syncOrchestrator;
    private final CollectionQueryService collectionQueryService;

    public SyncController(SyncOrchestrator syncOrchestrator, CollectionQueryService collectionQueryService) {
        this.syncOrchestrator = syncOrchestrator;
        this.collectionQueryService = collectionQueryService;
    }

    /**
     * Runs synchronously. The request thread is held until every selected source has finished.
     */
    @PostMapping
    public ApiResponse<RunReport> run(@Valid @RequestBody SyncRunRequest request) {
        if (syncOrchestrator.isRunning()) {
            throw new BusinessException(HttpStatus.CONFLICT, "A sync run is already in progress", "Retry after it finishes");
        }
        Set<SyncSourceId> sources = EnumSet.noneOf(SyncSourceId.class);
        for (String name : request.getSources()) {
            try {
                sources.add(SyncSourceId.fromName(name));
            } catch (IllegalArgumentException e) {
                throw new BusinessException(HttpStatus.BAD_REQUEST, e.getMessage());
            }
        }
        return ApiResponse.success(syncOrchestrator.run(sources, request.isForce()));
    }

    @GetMapping("/sources")
    public ApiResponse<List<SyncSourceStatusResponse>> listSources() {
        return ApiResponse.success(collectionQueryService.listSyncSources());
    }
}

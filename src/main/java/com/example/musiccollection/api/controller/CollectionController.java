package com.example.musiccollection.api.controller;

import com.example.musiccollection.api.request.LastListenedRequest;
import com.example.musiccollection.api.request.NotesRequest;
import com.example.musiccollection.api.request.NunFlagRequest;
import com.example.musiccollection.api.response.AlbumSearchResponse;
import com.example.musiccollection.api.response.ApiResponse;
import com.example.musiccollection.api.response.BootlegAlbumResponse;
import com.example.musiccollection.api.response.BootlegArtistResponse;
import com.example.musiccollection.api.response.CatalogItemResponse;
import com.example.musiccollection.api.response.CatalogTrackResponse;
import com.example.musiccollection.api.response.LibraryAlbumResponse;
import com.example.musiccollection.api.response.OverlapAlbumResponse;
import com.example.musiccollection.api.response.PageResponse;
import com.example.musiccollection.api.response.WantlistItemResponse;
import com.example.musiccollection.application.service.CollectionQueryService;
import com.example.musiccollection.application.service.CollectionUpdateService;
import com.example.musiccollection.application.service.SearchService;
import com.example.musiccollection.application.service.TrackQueryService;
import java.util.List;
import javax.validation.Valid;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/api/v1/collection")
public class CollectionController {

    private final CollectionQueryService collectionQueryService;
    private final CollectionUpdateService collectionUpdateService;
    private final TrackQueryService trackQueryService;
    private final SearchService searchService;

    public CollectionController(CollectionQueryService collectionQueryService,
                                CollectionUpdateService collectionUpdateService,
                                TrackQueryService trackQueryService,
                                SearchService searchService) {
        this.collectionQueryService = collectionQueryService;
        this.collectionUpdateService = collectionUpdateService;
        this.trackQueryService = trackQueryService;
        this.searchService = searchService;
    }

    @GetMapping("/catalog")
    public ApiResponse<PageResponse<CatalogItemResponse>> listCatalog(
            @RequestParam(value = "pageNo", defaultValue = "1") int pageNo,
            @RequestParam(value = "pageSize", defaultValue = "50") int pageSize,
            @RequestParam(value = "keyword", required = false) String keyword) {
        return ApiResponse.success(collectionQueryService.listCatalog(pageNo, pageSize, keyword));
    }

    @GetMapping("/catalog/{id}/tracks")
    public ApiResponse<List<CatalogTrackResponse>> listCatalogTracks(@PathVariable("id") Long id) {
        return ApiResponse.success(trackQueryService.listCatalogTracks(id));
    }

    @GetMapping("/library")
    public ApiResponse<PageResponse<LibraryAlbumResponse>> listLibrary(
            @RequestParam(value = "pageNo", defaultValue = "1") int pageNo,
            @RequestParam(value = "pageSize", defaultValue = "50") int pageSize,
            @RequestParam(value = "keyword", required = false) String keyword,
            @RequestParam(value = "includePhysicalDupes", defaultValue = "true") boolean includePhysicalDupes) {
        return ApiResponse.success(collectionQueryService.listLibrary(pageNo, pageSize, keyword, includePhysicalDupes));
    }

    @GetMapping("/library/bootlegs")
    public ApiResponse<PageResponse<BootlegAlbumResponse>> listBootlegs(
            @RequestParam(value = "artist", required = false) String artist,
            @RequestParam(value = "pageNo", defaultValue = "1") int pageNo,
            @RequestParam(value = "pageSize", defaultValue = "50") int pageSize) {
        return ApiResponse.success(collectionQueryService.listBootlegs(artist, pageNo, pageSize));
    }

    @GetMapping("/library/bootlegs/artists")
    public ApiResponse<List<BootlegArtistResponse>> listBootlegArtists() {
        return ApiResponse.success(collectionQueryService.listBootlegArtists());
    }

    @GetMapping("/unified")
    public ApiResponse<PageResponse<AlbumSearchResponse>> listUnified(
            @RequestParam(value = "source", defaultValue = "all") String source,
            @RequestParam(value = "hidePhysicalDupes", defaultValue = "false") boolean hidePhysicalDupes,
            @RequestParam(value = "pageNo", defaultValue = "1") int pageNo,
            @RequestParam(value = "pageSize", defaultValue = "50") int pageSize) {
        return ApiResponse.success(searchService.unified(source, hidePhysicalDupes, pageNo, pageSize));
    }

    @GetMapping("/wantlist")
    public ApiResponse<PageResponse<WantlistItemResponse>> listWantlist(
            @RequestParam(value = "pageNo", defaultValue = "1") int pageNo,
            @RequestParam(value = "pageSize", defaultValue = "50") int pageSize,
            @RequestParam(value = "availableOnly", defaultValue = "false") boolean availableOnly) {
        return ApiResponse.success(collectionQueryService.listWantlist(pageNo, pageSize, availableOnly));
    }

    @GetMapping("/overlap")
    public ApiResponse<PageResponse<OverlapAlbumResponse>> listOverlap(
            @RequestParam(value = "pageNo", defaultValue = "1") int pageNo,
            @RequestParam(value = "pageSize", defaultValue = "50") int pageSize) {
        return ApiResponse.success(collectionQueryService.listOverlap(pageNo, pageSize));
    }

    @PutMapping("/catalog/{id}/last-listened")
    public ApiResponse<CatalogItemResponse> updateLastListened(@PathVariable("id") Long id,
                                                               @Valid @RequestBody LastListenedRequest request) {
        return ApiResponse.success(collectionUpdateService.updateLastListened(id, request.getListenedAt()));
    }

    @PutMapping("/catalog/{id}/nun-flag")
    public ApiResponse<CatalogItemResponse> updateNunFlag(@PathVariable("id") Long id,
                                                          @Valid @RequestBody NunFlagRequest request) {
        return ApiResponse.success(collectionUpdateService.updateNunFlag(id, request.getNun()));
    }

    @PutMapping("/catalog/{id}/notes")
    public ApiResponse<CatalogItemResponse> updateNotes(@PathVariable("id") Long id,
                                                        @Valid @RequestBody NotesRequest request) {
        return ApiResponse.success(collectionUpdateService.updateNotes(id, request.getNotes()));
    }
}

package com.example.musiccollection.application.service;

import com.example.musiccollection.api.response.BootlegAlbumResponse;
import com.example.musiccollection.api.response.BootlegArtistResponse;
import com.example.musiccollection.api.response.CatalogItemResponse;
import com.example.musiccollection.api.response.LibraryAlbumResponse;
import com.example.musiccollection.api.response.OverlapAlbumResponse;
import com.example.musiccollection.api.response.PageResponse;
import com.example.musiccollection.api.response.SyncSourceStatusResponse;
import com.example.musiccollection.api.response.WantlistItemResponse;
import com.example.musiccollection.infrastructure.persistence.entity.CatalogCollectionEntity;
import com.example.musiccollection.infrastructure.persistence.entity.LibraryAlbumEntity;
import com.example.musiccollection.infrastructure.persistence.entity.SyncLedgerEntity;
import com.example.musiccollection.infrastructure.persistence.entity.WantlistEntity;
import com.example.musiccollection.infrastructure.persistence.mapper.CatalogCollectionMapper;
import com.example.musiccollection.infrastructure.persistence.mapper.LibraryAlbumMapper;
import com.example.musiccollection.infrastructure.persistence.mapper.WantlistMapper;
import com.example.musiccollection.infrastructure.persistence.model.OverlapAlbumRow;
import java.util.List;
import java.util.stream.Collectors;
import org.springframework.stereotype.Service;

@Service
public class CollectionQueryService {

    private static final int MAX_PAGE_SIZE = 200;
    private static final int SHOW_DATE_LENGTH = 10;

    private final CatalogCollectionMapper catalogCollectionMapper;
    private final LibraryAlbumMapper libraryAlbumMapper;
    private final WantlistMapper wantlistMapper;
    private final SyncLedgerService syncLedgerService;

    public CollectionQueryService(CatalogCollectionMapper catalogCollectionMapper,
                                  LibraryAlbumMapper libraryAlbumMapper,
                                  WantlistMapper wantlistMapper,
                                  SyncLedgerService syncLedgerService) {
        this.catalogCollectionMapper = catalogCollectionMapper;
        this.libraryAlbumMapper = libraryAlbumMapper;
        this.wantlistMapper = wantlistMapper;
        this.syncLedgerService = syncLedgerService;
    }

    public PageResponse<CatalogItemResponse> listCatalog(int pageNo, int pageSize, String keyword) {
        int safePageNo = safePageNo(pageNo);
        int safePageSize = safePageSize(pageSize);
        String safeKeyword = trimToNull(keyword);
        List<CatalogCollectionEntity> rows = catalogCollectionMapper.selectPage(
                offset(safePageNo, safePageSize), safePageSize, safeKeyword);
        long total = catalogCollectionMapper.count(safeKeyword);
        return new PageResponse<>(rows.stream().map(CollectionQueryService::toCatalogItem).collect(Collectors.toList()),
                total, safePageNo, safePageSize);
    }

    public PageResponse<LibraryAlbumResponse> listLibrary(int pageNo, int pageSize, String keyword,
                                                          boolean includePhysicalDupes) {
        int safePageNo = safePageNo(pageNo);
        int safePageSize = safePageSize(pageSize);
        String safeKeyword = trimToNull(keyword);
        List<LibraryAlbumEntity> rows = libraryAlbumMapper.selectPage(
                offset(safePageNo, safePageSize), safePageSize, safeKeyword, includePhysicalDupes);
        long total = libraryAlbumMapper.count(safeKeyword, includePhysicalDupes);
        return new PageResponse<>(rows.stream().map(this::toLibraryAlbum).collect(Collectors.toList()),
                total, safePageNo, safePageSize);
    }

    public PageResponse<WantlistItemResponse> listWantlist(int pageNo, int pageSize, boolean availableOnly) {
        int safePageNo = safePageNo(pageNo);
        int safePageSize = safePageSize(pageSize);
        List<WantlistEntity> rows = wantlistMapper.selectPage(offset(safePageNo, safePageSize), safePageSize, availableOnly);
        long total = wantlistMapper.count(availableOnly);
        return new PageResponse<>(rows.stream().map(this::toWantlistItem).collect(Collectors.toList()),
                total, safePageNo, safePageSize);
    }

    public PageResponse<OverlapAlbumResponse> listOverlap(int pageNo, int pageSize) {
        int safePageNo = safePageNo(pageNo);
        int safePageSize = safePageSize(pageSize);
        List<OverlapAlbumRow> rows = catalogCollectionMapper.selectOverlapPage(offset(safePageNo, safePageSize), safePageSize);
        long total = catalogCollectionMapper.countOverlap();
        return new PageResponse<>(rows.stream().map(row -> new OverlapAlbumResponse(
                row.getMatchKey(),
                row.getCatalogId(),
                row.getLibraryAlbumId(),
                row.getArtist(),
                row.getAlbumTitle(),
                row.getFormat(),
                row.getYear())).collect(Collectors.toList()), total, safePageNo, safePageSize);
    }

    /**
     * Library albums whose title starts with a {@code YYYY MM/DD} show date.
     */
    public PageResponse<BootlegAlbumResponse> listBootlegs(String artist, int pageNo, int pageSize) {
        int safePageNo = safePageNo(pageNo);
        int safePageSize = safePageSize(pageSize);
        String safeArtist = trimToNull(artist);
        List<LibraryAlbumEntity> rows = libraryAlbumMapper.selectBootlegPage(
                safeArtist, offset(safePageNo, safePageSize), safePageSize);
        long total = libraryAlbumMapper.countBootlegs(safeArtist);
        return new PageResponse<>(rows.stream().map(row -> new BootlegAlbumResponse(
                row.getId(),
                row.getArtist(),
                row.getAlbumTitle(),
                row.getImageKey(),
                row.getAlbumTitle().substring(0, SHOW_DATE_LENGTH))).collect(Collectors.toList()),
                total, safePageNo, safePageSize);
    }

    public List<BootlegArtistResponse> listBootlegArtists() {
        return libraryAlbumMapper.countBootlegsByArtist().stream()
                .map(row -> new BootlegArtistResponse(row.getArtist(), row.getShowCount()))
                .collect(Collectors.toList());
    }

    public List<SyncSourceStatusResponse> listSyncSources() {
        return syncLedgerService.listAll().stream().map(this::toSourceStatus).collect(Collectors.toList());
    }

    static CatalogItemResponse toCatalogItem(CatalogCollectionEntity entity) {
        CatalogItemResponse response = new CatalogItemResponse();
        response.setId(entity.getId());
        response.setReleaseId(entity.getReleaseId());
        response.setArtist(entity.getArtist());
        response.setAlbumTitle(entity.getAlbumTitle());
        response.setLabel(entity.getLabel());
        response.setFormat(entity.getFormat());
        response.setYear(entity.getYear());
        response.setDateAdded(entity.getDateAdded());
        response.setRating(entity.getRating());
        response.setNumForSale(entity.getNumForSale());
        response.setLowestPrice(entity.getLowestPrice());
        response.setThumbUrl(entity.getThumbUrl());
        response.setCoverImageUrl(entity.getCoverImageUrl());
        response.setMediaCondition(entity.getMediaCondition());
        response.setSleeveCondition(entity.getSleeveCondition());
        response.setLastListened(entity.getLastListened());
        response.setNun(Boolean.TRUE.equals(entity.getIsNun()));
        response.setNotes(entity.getNotes());
        return response;
    }

    private LibraryAlbumResponse toLibraryAlbum(LibraryAlbumEntity entity) {
        return new LibraryAlbumResponse(
                entity.getId(),
                entity.getArtist(),
                entity.getAlbumTitle(),
                entity.getImageKey(),
                Boolean.TRUE.equals(entity.getIsPhysicalDupe()),
                entity.getPhysicalTag());
    }

    private WantlistItemResponse toWantlistItem(WantlistEntity entity) {
        WantlistItemResponse response = new WantlistItemResponse();
        response.setId(entity.getId());
        response.setReleaseId(entity.getReleaseId());
        response.setArtist(entity.getArtist());
        response.setAlbumTitle(entity.getAlbumTitle());
        response.setFormat(entity.getFormat());
        response.setYear(entity.getYear());
        response.setDateAdded(entity.getDateAdded());
        response.setNumForSale(entity.getNumForSale());
        response.setLowestPrice(entity.getLowestPrice());
        response.setAvailable(Boolean.TRUE.equals(entity.getAvailable()));
        response.setMarketplaceUrl(entity.getMarketplaceUrl());
        response.setThumbUrl(entity.getThumbUrl());
        return response;
    }

    private SyncSourceStatusResponse toSourceStatus(SyncLedgerEntity entity) {
        return new SyncSourceStatusResponse(
                entity.getSourceName(),
                entity.getSourceType(),
                entity.getFilePath(),
                entity.getLastSync(),
                entity.getRecordsCount(),
                entity.getSyncStatus());
    }

    private int safePageNo(int pageNo) {
        return Math.max(1, pageNo);
    }

    private int safePageSize(int pageSize) {
        return Math.max(1, Math.min(MAX_PAGE_SIZE, pageSize));
    }

    private int offset(int pageNo, int pageSize) {
        return (pageNo - 1) * pageSize;
    }

    private String trimToNull(String value) {
        if (value == null) {
            return null;
        }
        String trimmed = value.trim();
        return trimmed.isEmpty() ? null : trimmed;
    }
}

package com.example.musiccollection.application.service;

import com.example.musiccollection.api.response.AlbumSearchResponse;
import com.example.musiccollection.api.response.PageResponse;
import com.example.musiccollection.common.exception.BusinessException;
import com.example.musiccollection.infrastructure.persistence.mapper.SearchMapper;
import com.example.musiccollection.infrastructure.persistence.model.AlbumSearchRow;
import java.util.Collections;
import java.util.List;
import java.util.stream.Collectors;
import org.springframework.stereotype.Service;
import org.springframework.util.StringUtils;

/**
 * Album search and listing over the library and the catalog collection together.
 */
@Service
public class SearchService {

    private static final int MAX_PAGE_SIZE = 200;

    private final SearchMapper searchMapper;

    public SearchService(SearchMapper searchMapper) {
        this.searchMapper = searchMapper;
    }

    /**
     * Matches artist or album title. A blank keyword gives an empty page.
     *
     * @param source {@code all}, {@code library} ({@code roon}) or {@code catalog} ({@code discogs})
     */
    public PageResponse<AlbumSearchResponse> search(String keyword, String source, int pageNo, int pageSize) {
        SourceScope scope = SourceScope.parse(source);
        String safeKeyword = normalizeKeyword(keyword);
        int safePageNo = normalizePageNo(pageNo);
        int safePageSize = normalizePageSize(pageSize);
        if (!StringUtils.hasText(safeKeyword)) {
            return new PageResponse<>(Collections.emptyList(), 0L, safePageNo, safePageSize);
        }
        return page(safeKeyword, scope, false, safePageNo, safePageSize);
    }

    /**
     * Every album from the selected collections, sorted by artist then title.
     */
    public PageResponse<AlbumSearchResponse> unified(String source, boolean hidePhysicalDupes, int pageNo, int pageSize) {
        return page(null, SourceScope.parse(source), hidePhysicalDupes, normalizePageNo(pageNo), normalizePageSize(pageSize));
    }

    private PageResponse<AlbumSearchResponse> page(String keyword, SourceScope scope, boolean hidePhysicalDupes,
                                                   int pageNo, int pageSize) {
        int offset = (pageNo - 1) * pageSize;
        List<AlbumSearchRow> rows = searchMapper.selectAlbumPage(keyword, scope.library, scope.catalog,
                hidePhysicalDupes, offset, pageSize);
        long total = searchMapper.countAlbums(keyword, scope.library, scope.catalog, hidePhysicalDupes);
        return new PageResponse<>(rows.stream().map(this::toResponse).collect(Collectors.toList()),
                total, pageNo, pageSize);
    }

    private AlbumSearchResponse toResponse(AlbumSearchRow row) {
        AlbumSearchResponse response = new AlbumSearchResponse();
        response.setSource(row.getSource());
        response.setId(row.getId());
        response.setArtist(row.getArtist());
        response.setAlbumTitle(row.getAlbumTitle());
        response.setLabel(row.getLabel());
        response.setFormat(row.getFormat());
        response.setYear(row.getYear());
        response.setThumbUrl(row.getThumbUrl());
        response.setImageKey(row.getImageKey());
        response.setLastListened(row.getLastListened());
        response.setNun(Boolean.TRUE.equals(row.getIsNun()));
        response.setPhysicalDupe(Boolean.TRUE.equals(row.getIsPhysicalDupe()));
        response.setPhysicalTag(row.getPhysicalTag());
        return response;
    }

    private String normalizeKeyword(String keyword) {
        return keyword == null ? null : keyword.trim();
    }

    private int normalizePageNo(int pageNo) {
        return Math.max(1, pageNo);
    }

    private int normalizePageSize(int pageSize) {
        return Math.max(1, Math.min(MAX_PAGE_SIZE, pageSize));
    }

    private enum SourceScope {
        ALL(true, true),
        LIBRARY(true, false),
        CATALOG(false, true);

        private final boolean library;
        private final boolean catalog;

        SourceScope(boolean library, boolean catalog) {
            this.library = library;
            this.catalog = catalog;
        }

        static SourceScope parse(String source) {
            if (!StringUtils.hasText(source) || "all".equalsIgnoreCase(source.trim())) {
                return ALL;
            }
            String value = source.trim();
            if ("library".equalsIgnoreCase(value) || "roon".equalsIgnoreCase(value)) {
                return LIBRARY;
            }
            if ("catalog".equalsIgnoreCase(value) || "discogs".equalsIgnoreCase(value)) {
                return CATALOG;
            }
            throw BusinessException.unknownSource(source);
        }
    }
}

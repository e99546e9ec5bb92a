package com.example.musiccollection.application.service;

import com.example.musiccollection.api.response.CatalogTrackResponse;
import com.example.musiccollection.api.response.IndexedTrackResponse;
import com.example.musiccollection.api.response.LibraryTrackResponse;
import com.example.musiccollection.api.response.PageResponse;
import com.example.musiccollection.api.response.PlayHistoryResponse;
import com.example.musiccollection.common.exception.BusinessException;
import com.example.musiccollection.infrastructure.persistence.entity.LibraryTrackEntity;
import com.example.musiccollection.infrastructure.persistence.entity.PlayHistoryEntity;
import com.example.musiccollection.infrastructure.persistence.mapper.CatalogCollectionMapper;
import com.example.musiccollection.infrastructure.persistence.mapper.CatalogTrackMapper;
import com.example.musiccollection.infrastructure.persistence.mapper.LibraryTrackMapper;
import com.example.musiccollection.infrastructure.persistence.mapper.PlayHistoryMapper;
import com.example.musiccollection.infrastructure.persistence.mapper.TrackIndexMapper;
import com.example.musiccollection.infrastructure.persistence.model.TrackIndexRow;
import java.util.List;
import java.util.stream.Collectors;
import org.springframework.http.HttpStatus;
import org.springframework.stereotype.Service;
import org.springframework.util.StringUtils;

/**
 * Track level reads: the combined track index, per-album track lists and the play history.
 */
@Service
public class TrackQueryService {

    private static final int MAX_PAGE_SIZE = 200;

    private final TrackIndexMapper trackIndexMapper;
    private final LibraryTrackMapper libraryTrackMapper;
    private final CatalogTrackMapper catalogTrackMapper;
    private final CatalogCollectionMapper catalogCollectionMapper;
    private final PlayHistoryMapper playHistoryMapper;

    public TrackQueryService(TrackIndexMapper trackIndexMapper,
                             LibraryTrackMapper libraryTrackMapper,
                             CatalogTrackMapper catalogTrackMapper,
                             CatalogCollectionMapper catalogCollectionMapper,
                             PlayHistoryMapper playHistoryMapper) {
        this.trackIndexMapper = trackIndexMapper;
        this.libraryTrackMapper = libraryTrackMapper;
        this.catalogTrackMapper = catalogTrackMapper;
        this.catalogCollectionMapper = catalogCollectionMapper;
        this.playHistoryMapper = playHistoryMapper;
    }

    /**
     * Pages the track index, which holds library and catalog tracks side by side.
     *
     * @param source optional {@code library} ({@code roon}) or {@code catalog} ({@code discogs}); blank for both
     */
    public PageResponse<IndexedTrackResponse> listTracks(int pageNo, int pageSize, String keyword, String source) {
        String indexSource = toIndexSource(source);
        int safePageNo = normalizePageNo(pageNo);
        int safePageSize = normalizePageSize(pageSize);
        String safeKeyword = trimToNull(keyword);
        List<TrackIndexRow> rows = trackIndexMapper.selectPage(
                (safePageNo - 1) * safePageSize, safePageSize, safeKeyword, indexSource);
        long total = trackIndexMapper.count(safeKeyword, indexSource);
        return new PageResponse<>(rows.stream().map(row -> new IndexedTrackResponse(
                row.getId(),
                row.getTrackTitle(),
                row.getAlbum(),
                row.getArtist(),
                row.getSource())).collect(Collectors.toList()), total, safePageNo, safePageSize);
    }

    public List<LibraryTrackResponse> listAlbumTracks(String album, String albumArtist) {
        if (!StringUtils.hasText(album)) {
            throw new BusinessException(HttpStatus.BAD_REQUEST, "Album is required");
        }
        return libraryTrackMapper.selectByAlbum(album.trim(), trimToNull(albumArtist)).stream()
                .map(this::toLibraryTrack)
                .collect(Collectors.toList());
    }

    public List<CatalogTrackResponse> listCatalogTracks(Long collectionId) {
        if (catalogCollectionMapper.selectById(collectionId) == null) {
            throw BusinessException.notFound("Catalog item", "Refresh the collection and retry");
        }
        return catalogTrackMapper.selectByCollectionId(collectionId).stream()
                .map(track -> new CatalogTrackResponse(
                        track.getId(),
                        track.getPosition(),
                        track.getTrackTitle(),
                        track.getDuration(),
                        track.getTrackArtists(),
                        track.getExtraArtists()))
                .collect(Collectors.toList());
    }

    /**
     * Newest plays first; plays without a timestamp sort last.
     */
    public PageResponse<PlayHistoryResponse> listPlayHistory(int pageNo, int pageSize, String keyword) {
        int safePageNo = normalizePageNo(pageNo);
        int safePageSize = normalizePageSize(pageSize);
        String safeKeyword = trimToNull(keyword);
        List<PlayHistoryEntity> rows = playHistoryMapper.selectPage(
                (safePageNo - 1) * safePageSize, safePageSize, safeKeyword);
        long total = playHistoryMapper.count(safeKeyword);
        return new PageResponse<>(rows.stream().map(this::toPlay).collect(Collectors.toList()),
                total, safePageNo, safePageSize);
    }

    private LibraryTrackResponse toLibraryTrack(LibraryTrackEntity entity) {
        LibraryTrackResponse response = new LibraryTrackResponse();
        response.setId(entity.getId());
        response.setDiscNumber(entity.getDiscNumber());
        response.setTrackNumber(entity.getTrackNumber());
        response.setTrackTitle(entity.getTrackTitle());
        response.setTrackArtists(entity.getTrackArtists());
        response.setAlbum(entity.getAlbum());
        response.setAlbumArtist(entity.getAlbumArtist());
        response.setComposers(entity.getComposers());
        response.setSource(entity.getSource());
        return response;
    }

    private PlayHistoryResponse toPlay(PlayHistoryEntity entity) {
        PlayHistoryResponse response = new PlayHistoryResponse();
        response.setId(entity.getId());
        response.setPlayedAt(entity.getPlayedAt());
        response.setAlbumArtist(entity.getAlbumArtist());
        response.setAlbum(entity.getAlbum());
        response.setDiscNumber(entity.getDiscNumber());
        response.setTrackNumber(entity.getTrackNumber());
        response.setTrackTitle(entity.getTrackTitle());
        response.setTrackArtists(entity.getTrackArtists());
        response.setSource(entity.getSource());
        return response;
    }

    private String toIndexSource(String source) {
        if (!StringUtils.hasText(source) || "all".equalsIgnoreCase(source.trim())) {
            return null;
        }
        String value = source.trim();
        if ("library".equalsIgnoreCase(value) || "roon".equalsIgnoreCase(value)) {
            return "roon";
        }
        if ("catalog".equalsIgnoreCase(value) || "discogs".equalsIgnoreCase(value)) {
            return "discogs";
        }
        throw BusinessException.unknownSource(source);
    }

    private int normalizePageNo(int pageNo) {
        return Math.max(1, pageNo);
    }

    private int normalizePageSize(int pageSize) {
        return Math.max(1, Math.min(MAX_PAGE_SIZE, pageSize));
    }

    private String trimToNull(String value) {
        if (value == null) {
            return null;
        }
        String trimmed = value.trim();
        return trimmed.isEmpty() ? null : trimmed;
    }
}

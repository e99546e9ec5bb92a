package com.example.musiccollection.application.service;

import com.example.musiccollection.api.request.ListeningHistoryRequest;
import com.example.musiccollection.api.response.ListeningHistoryResponse;
import com.example.musiccollection.api.response.PageResponse;
import com.example.musiccollection.common.exception.BusinessException;
import com.example.musiccollection.infrastructure.persistence.entity.ListeningHistoryEntity;
import com.example.musiccollection.infrastructure.persistence.mapper.CatalogCollectionMapper;
import com.example.musiccollection.infrastructure.persistence.mapper.ListeningHistoryMapper;
import java.time.LocalDateTime;
import java.util.List;
import java.util.stream.Collectors;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

@Service
public class ListeningHistoryService {

    private static final Logger log = LoggerFactory.getLogger(ListeningHistoryService.class);

    private final ListeningHistoryMapper listeningHistoryMapper;
    private final CatalogCollectionMapper catalogCollectionMapper;
    private final SyncLedgerService syncLedgerService;

    public ListeningHistoryService(ListeningHistoryMapper listeningHistoryMapper,
                                   CatalogCollectionMapper catalogCollectionMapper,
                                   SyncLedgerService syncLedgerService) {
        this.listeningHistoryMapper = listeningHistoryMapper;
        this.catalogCollectionMapper = catalogCollectionMapper;
        this.syncLedgerService = syncLedgerService;
    }

    /**
     * Records a listen. When it is linked to a catalog item, that item's last-listened time moves
     * to the same instant.
     */
    @Transactional(rollbackFor = Exception.class)
    public ListeningHistoryResponse record(ListeningHistoryRequest request) {
        Long catalogId = request.getDiscogsCollectionId();
        if (catalogId != null && catalogCollectionMapper.selectById(catalogId) == null) {
            throw BusinessException.notFound("Catalog item", null);
        }
        LocalDateTime listenedAt = request.getListenedAt() == null ? syncLedgerService.now() : request.getListenedAt();

        ListeningHistoryEntity entity = new ListeningHistoryEntity();
        entity.setArtist(request.getArtist().trim());
        entity.setAlbum(request.getAlbum().trim());
        entity.setSource(request.getSource());
        entity.setListenedAt(listenedAt);
        entity.setFormat(request.getFormat());
        entity.setNotes(request.getNotes());
        entity.setDiscogsCollectionId(catalogId);
        entity.setRoonAlbumId(request.getRoonAlbumId());
        listeningHistoryMapper.insert(entity);

        if (catalogId != null) {
            catalogCollectionMapper.updateLastListened(catalogId, listenedAt);
        }
        log.info("LISTENING_RECORDED id={} source={} catalogId={}", entity.getId(), entity.getSource(), catalogId);
        return toResponse(entity);
    }

    public PageResponse<ListeningHistoryResponse> list(int pageNo, int pageSize) {
        int safePageNo = Math.max(1, pageNo);
        int safePageSize = Math.max(1, Math.min(200, pageSize));
        List<ListeningHistoryEntity> rows = listeningHistoryMapper.selectPage((safePageNo - 1) * safePageSize, safePageSize);
        long total = listeningHistoryMapper.count();
        return new PageResponse<>(rows.stream().map(this::toResponse).collect(Collectors.toList()),
                total, safePageNo, safePageSize);
    }

    private ListeningHistoryResponse toResponse(ListeningHistoryEntity entity) {
        return new ListeningHistoryResponse(
                entity.getId(),
                entity.getArtist(),
                entity.getAlbum(),
                entity.getSource(),
                entity.getListenedAt(),
                entity.getFormat(),
                entity.getNotes(),
                entity.getDiscogsCollectionId(),
                entity.getRoonAlbumId());
    }
}

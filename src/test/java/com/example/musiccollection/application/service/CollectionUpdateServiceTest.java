package com.example.musiccollection.application.service;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyBoolean;
import static org.mockito.ArgumentMatchers.anyLong;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import com.example.musiccollection.api.request.ListeningHistoryRequest;
import com.example.musiccollection.api.response.CatalogItemResponse;
import com.example.musiccollection.api.response.ListeningHistoryResponse;
import com.example.musiccollection.common.exception.BusinessException;
import com.example.musiccollection.infrastructure.persistence.entity.CatalogCollectionEntity;
import com.example.musiccollection.infrastructure.persistence.entity.ListeningHistoryEntity;
import com.example.musiccollection.infrastructure.persistence.entity.PlayHistoryEntity;
import com.example.musiccollection.infrastructure.persistence.mapper.CatalogCollectionMapper;
import com.example.musiccollection.infrastructure.persistence.mapper.ListeningHistoryMapper;
import com.example.musiccollection.infrastructure.persistence.mapper.PlayHistoryMapper;
import java.time.LocalDateTime;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class CollectionUpdateServiceTest {

    private static final LocalDateTime NOW = LocalDateTime.of(2024, 3, 10, 12, 0);

    private CatalogCollectionMapper catalogMapper;
    private PlayHistoryMapper playHistoryMapper;
    private ListeningHistoryMapper listeningHistoryMapper;
    private CollectionUpdateService updateService;
    private ListeningHistoryService listeningHistoryService;

    @BeforeEach
    void setUp() {
        catalogMapper = mock(CatalogCollectionMapper.class);
        playHistoryMapper = mock(PlayHistoryMapper.class);
        listeningHistoryMapper = mock(ListeningHistoryMapper.class);
        SyncLedgerService ledgerService = mock(SyncLedgerService.class);
        when(ledgerService.now()).thenReturn(NOW);
        when(catalogMapper.selectById(5L)).thenReturn(catalogItem(5L));

        updateService = new CollectionUpdateService(catalogMapper, playHistoryMapper, ledgerService);
        listeningHistoryService = new ListeningHistoryService(listeningHistoryMapper, catalogMapper, ledgerService);
    }

    @Test
    void shouldDefaultLastListenedToNow() {
        CatalogItemResponse response = updateService.updateLastListened(5L, null);

        verify(catalogMapper).updateLastListened(5L, NOW);
        assertEquals(5L, response.getId().longValue());
    }

    @Test
    void shouldRejectUnknownCatalogItem() {
        BusinessException error = assertThrows(BusinessException.class, () -> updateService.updateNunFlag(99L, true));

        assertEquals("404", error.getCode());
        verify(catalogMapper, never()).updateNunFlag(anyLong(), anyBoolean());
    }

    @Test
    void shouldUpdatePlayedAtOfExistingPlay() {
        when(playHistoryMapper.selectById(3L)).thenReturn(new PlayHistoryEntity());
        LocalDateTime playedAt = LocalDateTime.of(2024, 1, 1, 20, 0);

        updateService.updatePlayedAt(3L, playedAt);

        verify(playHistoryMapper).updatePlayedAt(3L, playedAt);
        assertThrows(BusinessException.class, () -> updateService.updatePlayedAt(4L, playedAt));
    }

    @Test
    void shouldMoveLastListenedWhenRecordingLinkedListen() {
        when(listeningHistoryMapper.insert(any())).thenAnswer(invocation -> {
            ListeningHistoryEntity entity = invocation.getArgument(0);
            entity.setId(77L);
            return 1;
        });
        ListeningHistoryRequest request = new ListeningHistoryRequest();
        request.setArtist(" Pink Floyd ");
        request.setAlbum("The Wall");
        request.setSource("discogs");
        request.setFormat("Vinyl");
        request.setDiscogsCollectionId(5L);

        ListeningHistoryResponse response = listeningHistoryService.record(request);

        assertEquals(77L, response.getId().longValue());
        assertEquals("Pink Floyd", response.getArtist());
        assertEquals(NOW, response.getListenedAt());
        verify(catalogMapper).updateLastListened(5L, NOW);
    }

    @Test
    void shouldRecordUnlinkedListenWithoutTouchingCatalog() {
        ListeningHistoryRequest request = new ListeningHistoryRequest();
        request.setArtist("Miles Davis");
        request.setAlbum("Kind of Blue");
        request.setSource("roon");
        request.setListenedAt(LocalDateTime.of(2024, 3, 9, 22, 0));

        listeningHistoryService.record(request);

        verify(listeningHistoryMapper).insert(any());
        verify(catalogMapper, never()).updateLastListened(anyLong(), any());
    }

    private CatalogCollectionEntity catalogItem(Long id) {
        CatalogCollectionEntity entity = new CatalogCollectionEntity();
        entity.setId(id);
        entity.setReleaseId(1000L + id);
        entity.setArtist("Pink Floyd");
        entity.setAlbumTitle("The Wall");
        entity.setIsNun(false);
        return entity;
    }
}

package com.example.musiccollection.application.service;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.mockito.ArgumentMatchers.anyLong;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.inOrder;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import com.example.musiccollection.domain.enumtype.SyncResultStatus;
import com.example.musiccollection.domain.enumtype.SyncSourceId;
import com.example.musiccollection.domain.model.SyncOutcome;
import com.example.musiccollection.infrastructure.persistence.mapper.TrackIndexMapper;
import com.example.musiccollection.infrastructure.persistence.model.StoreTable;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.InOrder;

class TrackIndexServiceTest {

    private TrackIndexMapper mapper;
    private CollectionStoreService store;
    private SyncLedgerService ledgerService;
    private TrackIndexService service;

    @BeforeEach
    void setUp() {
        mapper = mock(TrackIndexMapper.class);
        store = mock(CollectionStoreService.class);
        ledgerService = mock(SyncLedgerService.class);
        service = new TrackIndexService(mapper, store, ledgerService);

        when(mapper.insertFromLibraryTracks()).thenReturn(1200);
        when(mapper.insertFromCatalogTracks()).thenReturn(300);
        when(mapper.countAll()).thenReturn(1500L);
        when(mapper.countDistinctTitles()).thenReturn(1320L);
    }

    @Test
    void shouldRebuildFromBothTrackTables() {
        SyncOutcome outcome = service.sync(false, true);

        assertEquals(SyncResultStatus.SUCCESS, outcome.getStatus());
        assertEquals(1500L, outcome.getRecordCount());
        assertEquals(1320L, outcome.getDetails().get("distinctTitles").longValue());
        assertEquals(300L, outcome.getDetails().get("catalogRows").longValue());
        InOrder order = inOrder(mapper);
        order.verify(mapper).truncate();
        order.verify(mapper).insertFromLibraryTracks();
        order.verify(mapper).insertFromCatalogTracks();
        verify(ledgerService).update(SyncSourceId.TRACK_INDEX, 1500L, SyncLedgerService.STATUS_SUCCESS);
    }

    @Test
    void shouldSkipWhenNothingChangedAndFresh() {
        when(ledgerService.shouldSkip(SyncSourceId.TRACK_INDEX, false)).thenReturn(true);
        when(store.count(StoreTable.TRACK_INDEX)).thenReturn(1500L);

        SyncOutcome outcome = service.sync(false, false);

        assertEquals(SyncResultStatus.SKIPPED, outcome.getStatus());
        assertEquals(1500L, outcome.getRecordCount());
        verify(mapper, never()).truncate();
        verify(ledgerService, never()).update(eq(SyncSourceId.TRACK_INDEX), anyLong(), anyString());
    }

    @Test
    void shouldRebuildStaleIndexEvenWithoutUpstreamChange() {
        when(ledgerService.shouldSkip(SyncSourceId.TRACK_INDEX, false)).thenReturn(false);

        assertEquals(SyncResultStatus.SUCCESS, service.sync(false, false).getStatus());
        verify(mapper).truncate();
    }
}

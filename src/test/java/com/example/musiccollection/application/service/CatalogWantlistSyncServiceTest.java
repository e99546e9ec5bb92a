package com.example.musiccollection.application.service;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyLong;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import com.example.musiccollection.common.config.AppSyncProperties;
import com.example.musiccollection.domain.enumtype.SyncResultStatus;
import com.example.musiccollection.domain.enumtype.SyncSourceId;
import com.example.musiccollection.domain.model.CatalogPageResult;
import com.example.musiccollection.domain.model.CatalogRelease;
import com.example.musiccollection.domain.model.FetchError;
import com.example.musiccollection.domain.model.FetchResult;
import com.example.musiccollection.domain.model.MarketplaceStats;
import com.example.musiccollection.domain.model.SyncOutcome;
import com.example.musiccollection.infrastructure.persistence.entity.WantlistEntity;
import com.example.musiccollection.infrastructure.persistence.mapper.CatalogCollectionMapper;
import com.example.musiccollection.infrastructure.persistence.mapper.CatalogTrackMapper;
import com.example.musiccollection.infrastructure.persistence.mapper.LibraryAlbumMapper;
import com.example.musiccollection.infrastructure.persistence.mapper.LibraryTrackMapper;
import com.example.musiccollection.infrastructure.persistence.mapper.PlayHistoryMapper;
import com.example.musiccollection.infrastructure.persistence.mapper.TableCountMapper;
import com.example.musiccollection.infrastructure.persistence.mapper.WantlistMapper;
import com.example.musiccollection.infrastructure.persistence.model.StoreTable;
import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.List;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class CatalogWantlistSyncServiceTest {

    private final List<WantlistEntity> stored = new ArrayList<>();

    private CatalogFetchService fetchService;
    private WantlistMapper wantlistMapper;
    private SyncLedgerService ledgerService;
    private CatalogWantlistSyncService service;

    @BeforeEach
    void setUp() {
        fetchService = mock(CatalogFetchService.class);
        wantlistMapper = mock(WantlistMapper.class);
        when(wantlistMapper.batchInsert(any())).thenAnswer(invocation -> {
            List<WantlistEntity> batch = invocation.getArgument(0);
            stored.addAll(batch);
            return batch.size();
        });
        TableCountMapper countMapper = mock(TableCountMapper.class);
        when(countMapper.count(StoreTable.DISCOGS_WANTLIST)).thenAnswer(invocation -> (long) stored.size());
        ledgerService = mock(SyncLedgerService.class);
        AppSyncProperties properties = new AppSyncProperties();
        CollectionStoreService store = new CollectionStoreService(mock(LibraryAlbumMapper.class),
                mock(LibraryTrackMapper.class), mock(PlayHistoryMapper.class), mock(CatalogCollectionMapper.class),
                mock(CatalogTrackMapper.class), wantlistMapper, countMapper, properties);
        service = new CatalogWantlistSyncService(fetchService, store, ledgerService, properties);
    }

    @Test
    void shouldStoreAvailabilityFromMarketplaceStats() {
        when(fetchService.fetchWantlist()).thenReturn(listing(null, release(11L), release(12L)));
        when(fetchService.fetchMarketplaceStats(11L))
                .thenReturn(FetchResult.success(new MarketplaceStats(4, new BigDecimal("25.00"), "EUR", false)));
        when(fetchService.fetchMarketplaceStats(12L))
                .thenReturn(FetchResult.success(new MarketplaceStats(0, null, null, false)));

        SyncOutcome outcome = service.sync(true);

        assertEquals(SyncResultStatus.SUCCESS, outcome.getStatus());
        assertEquals(2L, outcome.getRecordCount());
        verify(wantlistMapper).truncate();
        assertTrue(stored.get(0).getAvailable());
        assertEquals("https://www.discogs.com/sell/release/11", stored.get(0).getMarketplaceUrl());
        assertFalse(stored.get(1).getAvailable());
        assertNull(stored.get(1).getLowestPrice());
    }

    @Test
    void shouldStoreItemWithoutStatsWhenDetailFails() {
        when(fetchService.fetchWantlist()).thenReturn(listing(null, release(21L)));
        when(fetchService.fetchMarketplaceStats(anyLong())).thenReturn(FetchResult.failure(FetchError.status(500)));

        SyncOutcome outcome = service.sync(true);

        assertEquals(SyncResultStatus.PARTIAL_SUCCESS, outcome.getStatus());
        assertEquals(0, stored.get(0).getNumForSale().intValue());
        verify(ledgerService).update(SyncSourceId.DISCOGS_WANTLIST, 1L, "partial: 1 detail requests failed");
    }

    @Test
    void shouldKeepTableWhenListingFailsOnFirstPage() {
        when(fetchService.fetchWantlist()).thenReturn(listing(FetchError.status(503)));

        SyncOutcome outcome = service.sync(true);

        assertEquals(SyncResultStatus.FAILED, outcome.getStatus());
        verify(wantlistMapper, never()).truncate();
        verify(ledgerService).recordFailure(SyncSourceId.DISCOGS_WANTLIST, "HTTP 503");
    }

    @Test
    void shouldCountDuplicateWants() {
        when(fetchService.fetchWantlist()).thenReturn(listing(null, release(31L), release(31L)));
        when(fetchService.fetchMarketplaceStats(anyLong()))
                .thenReturn(FetchResult.success(new MarketplaceStats(1, BigDecimal.TEN, "USD", false)));

        SyncOutcome outcome = service.sync(true);

        assertEquals(1L, outcome.getDetails().get("duplicates").longValue());
    }

    private CatalogPageResult listing(FetchError abortError, CatalogRelease... releases) {
        CatalogPageResult result = new CatalogPageResult();
        for (CatalogRelease release : releases) {
            result.getItems().add(release);
        }
        result.setPagesFetched(1);
        result.setTotalPages(1);
        result.setAbortError(abortError);
        return result;
    }

    private CatalogRelease release(long releaseId) {
        CatalogRelease release = new CatalogRelease();
        release.setReleaseId(releaseId);
        release.setArtist("Artist " + releaseId);
        release.setTitle("Title " + releaseId);
        return release;
    }
}
